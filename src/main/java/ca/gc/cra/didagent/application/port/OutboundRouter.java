package ca.gc.cra.didagent.application.port;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.domain.msg.InboundMessage;
import ca.gc.cra.didagent.domain.msg.OutboundMessage;

/**
 * Resolves recipients for an outbound message and hands it to delivery.
 *
 * <p>Undeliverable messages are logged and dropped rather than reported to the caller.</p>
 */
@FunctionalInterface
public interface OutboundRouter {
  /**
   * @param context context the message was produced in
   * @param outbound message to deliver
   * @param inbound message being replied to, or {@code null} when not a reply
   */
  void route(InjectionContext context, OutboundMessage outbound, InboundMessage inbound);
}
