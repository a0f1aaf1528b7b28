package ca.gc.cra.didagent.application.dispatch;

import ca.gc.cra.didagent.application.json.JsonSupport;
import ca.gc.cra.didagent.domain.connection.ConnectionRecord;
import ca.gc.cra.didagent.domain.msg.OutboundMessage;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers trust pings on established connections and reports them to the controller.
 */
public final class TrustPingHandler implements ProtocolHandler {
  private static final Logger log = LoggerFactory.getLogger(TrustPingHandler.class);
  public static final String PING = "did:sov:BzCbsNYhMrjHiqZDTUASHg;spec/trust_ping/1.0/ping";
  public static final String PING_RESPONSE =
      "did:sov:BzCbsNYhMrjHiqZDTUASHg;spec/trust_ping/1.0/ping_response";

  private final JsonSupport json;

  public TrustPingHandler(JsonSupport json) {
    this.json = json;
  }

  /**
   * Registers the handler for ping messages.
   */
  public static void register(ProtocolRegistry registry, JsonSupport json) {
    registry.register(PING, new TrustPingHandler(json));
  }

  @Override
  public void handle(HandlerContext context) {
    ConnectionRecord connection = context.connection();
    if (connection == null) {
      log.info("Ignoring trust ping {} received outside a connection", context.message().messageId());
      return;
    }
    String threadId = context.messageId().orElse(context.message().messageId());
    context.responder().sendWebhook("ping", Map.of(
        "connection_id", connection.connectionId(),
        "thread_id", threadId,
        "state", "received"));
    if (Boolean.FALSE.equals(context.body().get("response_requested"))) {
      return;
    }
    Map<String, Object> response = new LinkedHashMap<>();
    response.put("@type", PING_RESPONSE);
    response.put("@id", UUID.randomUUID().toString());
    response.put("~thread", Map.of("thid", threadId));
    context.responder().send(OutboundMessage.builder(json.write(response))
        .connectionId(connection.connectionId())
        .replyThreadId(threadId)
        .build());
  }
}
