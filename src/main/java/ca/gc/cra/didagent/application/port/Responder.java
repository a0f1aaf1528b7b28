package ca.gc.cra.didagent.application.port;

import ca.gc.cra.didagent.domain.msg.OutboundMessage;
import java.util.Map;

/**
 * Lets protocol code send messages and notify the controller without knowing about routing.
 */
public interface Responder {
  void send(OutboundMessage message);

  /**
   * Posts an event to the configured webhook targets.
   *
   * @param topic event topic, e.g. {@code connections}
   * @param payload JSON-compatible event body
   */
  void sendWebhook(String topic, Map<String, Object> payload);
}
