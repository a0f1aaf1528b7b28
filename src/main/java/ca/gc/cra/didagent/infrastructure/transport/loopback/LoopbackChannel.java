package ca.gc.cra.didagent.infrastructure.transport.loopback;

import ca.gc.cra.didagent.application.port.InboundRouter;
import ca.gc.cra.didagent.domain.connection.ConnectionTarget;
import ca.gc.cra.didagent.domain.msg.InboundMessage;
import ca.gc.cra.didagent.domain.msg.MessageReceipt;
import ca.gc.cra.didagent.domain.msg.ReplyMode;
import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process link between the loopback outbound and inbound transports of one agent.
 */
public final class LoopbackChannel {
  public static final String TRANSPORT_NAME = "loopback";
  public static final String SCHEME = "loop";

  private final AtomicReference<InboundRouter> receiver = new AtomicReference<>();

  void attach(InboundRouter router) {
    if (!receiver.compareAndSet(null, router)) {
      throw new IllegalStateException("Loopback channel already has a receiver");
    }
  }

  void detach() {
    receiver.set(null);
  }

  /**
   * Hands {@code payload} to the attached inbound transport, addressed with the target keys.
   *
   * @throws IOException if no inbound loopback transport is running
   */
  void deliver(String payload, ConnectionTarget target) throws IOException {
    InboundRouter router = receiver.get();
    if (router == null) {
      throw new IOException("No loopback receiver for " + target.endpoint());
    }
    String recipient = target.recipientKeys().isEmpty() ? null : target.recipientKeys().get(0);
    MessageReceipt receipt = new MessageReceipt(ReplyMode.NONE, target.senderKey(), recipient, Instant.now());
    router.route(InboundMessage.of(payload, receipt, TRANSPORT_NAME));
  }
}
