package ca.gc.cra.didagent.application.dispatch;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.port.OutboundRouter;
import ca.gc.cra.didagent.application.port.Responder;
import ca.gc.cra.didagent.domain.msg.InboundMessage;
import ca.gc.cra.didagent.domain.msg.OutboundMessage;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responder scoped to one inbound message: replies go through the outbound router with the
 * inbound message attached, webhook events go to the responder bound in the context.
 */
final class MessageResponder implements Responder {
  private static final Logger log = LoggerFactory.getLogger(MessageResponder.class);

  private final InjectionContext context;
  private final InboundMessage inbound;
  private final OutboundRouter router;

  MessageResponder(InjectionContext context, InboundMessage inbound, OutboundRouter router) {
    this.context = Objects.requireNonNull(context, "context");
    this.inbound = Objects.requireNonNull(inbound, "inbound");
    this.router = Objects.requireNonNull(router, "router");
  }

  @Override
  public void send(OutboundMessage message) {
    router.route(context, message, inbound);
  }

  @Override
  public void sendWebhook(String topic, Map<String, Object> payload) {
    context.injectIfPresent(Responder.class).ifPresentOrElse(
        responder -> responder.sendWebhook(topic, payload),
        () -> log.debug("No webhook responder bound; dropping {} event", topic));
  }
}
