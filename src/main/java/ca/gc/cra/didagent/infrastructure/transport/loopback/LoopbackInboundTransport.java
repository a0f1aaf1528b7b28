package ca.gc.cra.didagent.infrastructure.transport.loopback;

import ca.gc.cra.didagent.application.port.InboundRouter;
import ca.gc.cra.didagent.application.port.InboundTransport;
import java.util.Objects;

/**
 * Receives messages sent to {@code loop://} endpoints by the same agent. No direct response.
 */
public final class LoopbackInboundTransport implements InboundTransport {
  private final LoopbackChannel channel;

  public LoopbackInboundTransport(LoopbackChannel channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  @Override
  public String name() {
    return LoopbackChannel.TRANSPORT_NAME;
  }

  @Override
  public void start(InboundRouter router) {
    channel.attach(Objects.requireNonNull(router, "router"));
  }

  @Override
  public void stop() {
    channel.detach();
  }

  @Override
  public boolean supportsDirectResponse() {
    return false;
  }
}
