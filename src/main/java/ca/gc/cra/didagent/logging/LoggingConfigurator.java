package ca.gc.cra.didagent.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runtime logging and console output for the agent CLI.
 * <p><strong>Role:</strong> Bridges CLI flags to the Logback backend and renders the startup
 * banner the conductor prints once the agent is running.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single startup thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final int BANNER_WIDTH = 60;

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }

  /**
   * Prints a framed startup banner.
   *
   * <pre>
   * ::::::::::::::::::::::::::::::::::::::::
   * :: my-agent                           ::
   * ::                                    ::
   * :: Inbound Transports:                ::
   * ::   - loopback                       ::
   * ::::::::::::::::::::::::::::::::::::::::
   * </pre>
   *
   * @param out console writer; flushed before returning
   * @param title first banner line, typically the agent label
   * @param sections ordered section headings to their entries; empty sections print {@code none}
   */
  public static void printBanner(PrintWriter out, String title, Map<String, List<String>> sections) {
    String border = ":".repeat(BANNER_WIDTH);
    out.println();
    out.println(border);
    out.println(bannerLine(title == null ? "" : title));
    out.println(bannerLine(""));
    sections.forEach((heading, entries) -> {
      out.println(bannerLine(heading + ":"));
      if (entries.isEmpty()) {
        out.println(bannerLine("  - none"));
      }
      for (String entry : entries) {
        out.println(bannerLine("  - " + entry));
      }
    });
    out.println(border);
    out.println();
    out.flush();
  }

  static String bannerLine(String text) {
    int inner = BANNER_WIDTH - 6;
    String content = text.length() > inner ? text.substring(0, inner) : text;
    return ":: " + content + " ".repeat(inner - content.length()) + " ::";
  }
}
