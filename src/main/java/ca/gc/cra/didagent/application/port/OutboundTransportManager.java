package ca.gc.cra.didagent.application.port;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.transport.OutboundDeliveryException;
import ca.gc.cra.didagent.domain.msg.OutboundMessage;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Owns the configured outbound transports and schedules deliveries on them.
 * <p><strong>Role:</strong> Created by the conductor with the dispatcher's task runner; the
 * conductor's outbound router calls {@link #deliver} once recipients are known.</p>
 *
 * @since 0.1.0
 */
public interface OutboundTransportManager {
  void setup() throws Exception;

  void start() throws Exception;

  void stop() throws Exception;

  /**
   * Schedules delivery of {@code message} to its first target with a supported scheme.
   *
   * @param context context the message was produced in
   * @param message message with resolved targets
   * @throws OutboundDeliveryException if no target can be served by a registered transport
   */
  void deliver(InjectionContext context, OutboundMessage message) throws OutboundDeliveryException;

  /**
   * @return transport name to served schemes, read-only
   */
  Map<String, Set<String>> registeredTransports();
}
