package ca.gc.cra.didagent.domain.msg;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Transport-level facts recorded when a message arrives.
 *
 * @param directResponseMode reply mode requested by the sender; never {@code null}
 * @param senderVerkey sender verification key when the envelope was authenticated; may be {@code null}
 * @param recipientVerkey local key the envelope was addressed to; may be {@code null}
 * @param receivedAt arrival time
 */
public record MessageReceipt(
    ReplyMode directResponseMode, String senderVerkey, String recipientVerkey, Instant receivedAt) {

  public MessageReceipt {
    Objects.requireNonNull(directResponseMode, "directResponseMode");
    Objects.requireNonNull(receivedAt, "receivedAt");
  }

  /** Receipt for an anonymous message with no direct response requested. */
  public static MessageReceipt anonymous() {
    return new MessageReceipt(ReplyMode.NONE, null, null, Instant.now());
  }

  /**
   * @return {@code true} if the sender asked for replies over the inbound session
   */
  public boolean directResponseRequested() {
    return directResponseMode != ReplyMode.NONE;
  }

  public Optional<String> sender() {
    return Optional.ofNullable(senderVerkey);
  }

  public Optional<String> recipient() {
    return Optional.ofNullable(recipientVerkey);
  }
}
