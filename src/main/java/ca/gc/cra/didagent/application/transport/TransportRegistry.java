package ca.gc.cra.didagent.application.transport;

import ca.gc.cra.didagent.application.port.InboundTransport;
import ca.gc.cra.didagent.application.port.OutboundTransport;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Named transport factories. Settings refer to transports by these names.
 */
public final class TransportRegistry {
  private final ConcurrentMap<String, Supplier<? extends InboundTransport>> inbound = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Supplier<? extends OutboundTransport>> outbound = new ConcurrentHashMap<>();

  public TransportRegistry registerInbound(String name, Supplier<? extends InboundTransport> factory) {
    inbound.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(factory, "factory"));
    return this;
  }

  public TransportRegistry registerOutbound(String name, Supplier<? extends OutboundTransport> factory) {
    outbound.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(factory, "factory"));
    return this;
  }

  /**
   * @return a new transport instance, or empty if {@code name} is not registered
   */
  public Optional<InboundTransport> createInbound(String name) {
    return Optional.ofNullable(inbound.get(name)).map(Supplier::get);
  }

  public Optional<OutboundTransport> createOutbound(String name) {
    return Optional.ofNullable(outbound.get(name)).map(Supplier::get);
  }

  public Set<String> inboundNames() {
    return new TreeSet<>(inbound.keySet());
  }

  public Set<String> outboundNames() {
    return new TreeSet<>(outbound.keySet());
  }
}
