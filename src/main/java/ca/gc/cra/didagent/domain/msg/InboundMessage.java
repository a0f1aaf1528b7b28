package ca.gc.cra.didagent.domain.msg;

import java.util.Objects;
import java.util.UUID;

/**
 * Message received from a transport, before protocol dispatch.
 *
 * @param messageId locally assigned identifier used for logging and completion tracking
 * @param payload unpacked message body (JSON text)
 * @param receipt transport facts about the arrival
 * @param transportType name of the inbound transport that accepted the message
 */
public record InboundMessage(String messageId, String payload, MessageReceipt receipt, String transportType) {

  public InboundMessage {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(receipt, "receipt");
    Objects.requireNonNull(transportType, "transportType");
  }

  /**
   * Creates a message with a fresh random identifier.
   *
   * @param payload unpacked message body
   * @param receipt transport facts
   * @param transportType accepting transport name
   * @return new message
   */
  public static InboundMessage of(String payload, MessageReceipt receipt, String transportType) {
    return new InboundMessage(UUID.randomUUID().toString(), payload, receipt, transportType);
  }
}
