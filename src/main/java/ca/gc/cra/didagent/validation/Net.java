package ca.gc.cra.didagent.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Network setting validation: bind hosts, ports and HTTP URLs.
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a bind host: hostname, IPv4 literal, or IPv6 literal with or without brackets.
   *
   * @param name setting name for diagnostics
   * @param host candidate host
   * @return trimmed host, IPv6 brackets removed
   * @throws IllegalArgumentException if the host is malformed
   */
  public static String requireHost(String name, String host) {
    String sanitized = Strings.requireNonBlank(name, host);
    if (sanitized.startsWith("[") && sanitized.endsWith("]")) {
      sanitized = sanitized.substring(1, sanitized.length() - 1);
    }
    if (sanitized.indexOf(':') >= 0) {
      validateIpv6(name, sanitized);
    } else if (IPV4_PATTERN.matcher(sanitized).matches()) {
      for (String octet : sanitized.split("\\.")) {
        Numbers.requireRange(name + " octet", Integer.parseInt(octet), 0, 255);
      }
    } else {
      validateHostname(name, sanitized);
    }
    return sanitized;
  }

  /**
   * Validates a TCP port; {@code 0} selects an ephemeral port.
   */
  public static int requirePort(String name, int port) {
    return (int) Numbers.requireRange(name, port, 0, 65535);
  }

  /**
   * Validates an absolute {@code http}/{@code https} URL with a host.
   *
   * @return the URL, trimmed
   * @throws IllegalArgumentException if the URL is malformed or uses another scheme
   */
  public static String requireHttpUrl(String name, String url) {
    String sanitized = Strings.requireNonBlank(name, url);
    URI uri;
    try {
      uri = new URI(sanitized);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " is not a valid URL: " + sanitized, ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException(name + " must use http or https (was " + sanitized + ")");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException(name + " must include a host (was " + sanitized + ")");
    }
    return sanitized;
  }

  private static void validateHostname(String name, String host) {
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(name + " hostname longer than " + MAX_HOSTNAME_LENGTH);
    }
    for (String label : host.split("\\.", -1)) {
      if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
        throw new IllegalArgumentException(name + " has an invalid hostname label in " + host);
      }
      if (!isAsciiAlnum(label.charAt(0)) || !isAsciiAlnum(label.charAt(label.length() - 1))) {
        throw new IllegalArgumentException(name + " labels must start and end with alphanumerics: " + host);
      }
      for (int i = 1; i < label.length() - 1; i++) {
        char c = label.charAt(i);
        if (!(isAsciiAlnum(c) || c == '-')) {
          throw new IllegalArgumentException(name + " has illegal character '" + c + "' in " + host);
        }
      }
    }
  }

  private static void validateIpv6(String name, String host) {
    try {
      if (!(InetAddress.getByName(host) instanceof Inet6Address)) {
        throw new IllegalArgumentException(name + " is not an IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException(name + " is not an IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
