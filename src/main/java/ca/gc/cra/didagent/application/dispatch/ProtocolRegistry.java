package ca.gc.cra.didagent.application.dispatch;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps message type URIs to handlers.
 */
public final class ProtocolRegistry {
  private final ConcurrentMap<String, ProtocolHandler> handlers = new ConcurrentHashMap<>();

  /**
   * @throws IllegalStateException if {@code messageType} already has a handler
   */
  public void register(String messageType, ProtocolHandler handler) {
    Objects.requireNonNull(messageType, "messageType");
    Objects.requireNonNull(handler, "handler");
    if (handlers.putIfAbsent(messageType, handler) != null) {
      throw new IllegalStateException("Handler already registered for " + messageType);
    }
  }

  public Optional<ProtocolHandler> resolve(String messageType) {
    return messageType == null ? Optional.empty() : Optional.ofNullable(handlers.get(messageType));
  }

  public Set<String> messageTypes() {
    return new TreeSet<>(handlers.keySet());
  }
}
