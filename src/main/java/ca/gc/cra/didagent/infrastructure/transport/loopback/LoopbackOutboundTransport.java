package ca.gc.cra.didagent.infrastructure.transport.loopback;

import ca.gc.cra.didagent.application.port.OutboundTransport;
import ca.gc.cra.didagent.domain.connection.ConnectionTarget;
import java.io.IOException;
import java.util.Objects;
import java.util.Set;

/**
 * Sends to {@code loop://} endpoints through a {@link LoopbackChannel}.
 */
public final class LoopbackOutboundTransport implements OutboundTransport {
  private final LoopbackChannel channel;
  private volatile boolean running;

  public LoopbackOutboundTransport(LoopbackChannel channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  @Override
  public String name() {
    return LoopbackChannel.TRANSPORT_NAME;
  }

  @Override
  public Set<String> schemes() {
    return Set.of(LoopbackChannel.SCHEME);
  }

  @Override
  public void start() {
    running = true;
  }

  @Override
  public void stop() {
    running = false;
  }

  @Override
  public void send(String payload, ConnectionTarget target) throws IOException {
    if (!running) {
      throw new IOException("Loopback outbound transport is not running");
    }
    channel.deliver(payload, target);
  }
}
