package ca.gc.cra.didagent.application.port;

import ca.gc.cra.didagent.domain.msg.InboundMessage;

/**
 * Processes one inbound message, sending any replies through {@code responder}.
 */
@FunctionalInterface
public interface MessageHandler {
  void handleMessage(InboundMessage message, OutboundRouter responder) throws Exception;
}
