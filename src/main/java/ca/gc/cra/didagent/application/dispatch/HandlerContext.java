package ca.gc.cra.didagent.application.dispatch;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.port.Responder;
import ca.gc.cra.didagent.domain.connection.ConnectionRecord;
import ca.gc.cra.didagent.domain.msg.InboundMessage;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a protocol handler sees for one message.
 *
 * @param context agent context
 * @param message the raw inbound message
 * @param messageType value of the {@code @type} field
 * @param body parsed message body
 * @param connection connection the message arrived on, or {@code null} if unknown
 * @param responder channel for replies and webhook events
 */
public record HandlerContext(
    InjectionContext context,
    InboundMessage message,
    String messageType,
    Map<String, Object> body,
    ConnectionRecord connection,
    Responder responder) {

  public Optional<ConnectionRecord> connectionRecord() {
    return Optional.ofNullable(connection);
  }

  /**
   * @return the message {@code @id}, if present
   */
  public Optional<String> messageId() {
    Object id = body.get("@id");
    return id == null ? Optional.empty() : Optional.of(id.toString());
  }
}
