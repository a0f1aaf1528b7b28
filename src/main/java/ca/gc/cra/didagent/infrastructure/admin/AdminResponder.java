package ca.gc.cra.didagent.infrastructure.admin;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.port.OutboundRouter;
import ca.gc.cra.didagent.application.port.Responder;
import ca.gc.cra.didagent.domain.msg.OutboundMessage;
import java.util.Map;
import java.util.Objects;

/**
 * Default responder once the admin API is up: messages go through the outbound router with no
 * inbound message attached, events go to the webhook targets.
 */
public final class AdminResponder implements Responder {
  private final InjectionContext context;
  private final OutboundRouter router;
  private final WebhookEmitter webhooks;

  AdminResponder(InjectionContext context, OutboundRouter router, WebhookEmitter webhooks) {
    this.context = Objects.requireNonNull(context, "context");
    this.router = Objects.requireNonNull(router, "router");
    this.webhooks = Objects.requireNonNull(webhooks, "webhooks");
  }

  @Override
  public void send(OutboundMessage message) {
    router.route(context, message, null);
  }

  @Override
  public void sendWebhook(String topic, Map<String, Object> payload) {
    webhooks.emit(topic, payload);
  }
}
