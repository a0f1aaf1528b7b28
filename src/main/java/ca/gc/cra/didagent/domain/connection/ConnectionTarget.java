package ca.gc.cra.didagent.domain.connection;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Delivery parameters for one outbound recipient.
 *
 * @param did recipient DID; may be {@code null} for invitation-key targets
 * @param endpoint transport endpoint URL (e.g., {@code https://agent.example/didcomm})
 * @param label human readable recipient label; may be {@code null}
 * @param recipientKeys keys the payload is packed for
 * @param routingKeys mediator keys to wrap the payload for, outermost last
 * @param senderKey local key used to authenticate the payload; may be {@code null}
 */
public record ConnectionTarget(
    String did,
    String endpoint,
    String label,
    List<String> recipientKeys,
    List<String> routingKeys,
    String senderKey) {

  public ConnectionTarget {
    Objects.requireNonNull(endpoint, "endpoint");
    recipientKeys = recipientKeys == null ? List.of() : List.copyOf(recipientKeys);
    routingKeys = routingKeys == null ? List.of() : List.copyOf(routingKeys);
  }

  /**
   * Returns the lower-cased URI scheme of the endpoint, used to select an outbound transport.
   *
   * @return scheme, or an empty string if the endpoint has none
   */
  public String scheme() {
    try {
      String scheme = URI.create(endpoint).getScheme();
      return scheme == null ? "" : scheme.toLowerCase(Locale.ROOT);
    } catch (IllegalArgumentException ex) {
      return "";
    }
  }
}
