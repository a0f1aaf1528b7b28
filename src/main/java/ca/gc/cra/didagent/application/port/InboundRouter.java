package ca.gc.cra.didagent.application.port;

import ca.gc.cra.didagent.domain.msg.InboundMessage;

/**
 * Entry point that inbound transports hand received messages to.
 */
@FunctionalInterface
public interface InboundRouter {
  /**
   * Routes a received message toward the dispatcher. Must not block on message processing.
   *
   * @param message received message
   */
  void route(InboundMessage message);
}
