package ca.gc.cra.didagent.domain.msg;

import java.util.Locale;

/**
 * Direct-response request carried by an inbound message: whether replies should travel back over
 * the same transport session instead of a separate outbound delivery.
 */
public enum ReplyMode {
  /** No direct response requested. */
  NONE,
  /** Replies belonging to the same thread as the inbound message. */
  THREAD,
  /** Every pending reply for the sender. */
  ALL;

  /**
   * Parses the wire form ({@code none}, {@code thread}, {@code all}); {@code null} or blank maps to
   * {@link #NONE}.
   *
   * @param raw wire value
   * @return parsed mode
   * @throws IllegalArgumentException if {@code raw} names no mode
   */
  public static ReplyMode fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      return NONE;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "none" -> NONE;
      case "thread" -> THREAD;
      case "all" -> ALL;
      default -> throw new IllegalArgumentException("Unknown reply mode: " + raw);
    };
  }
}
