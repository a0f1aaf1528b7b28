package ca.gc.cra.didagent.application.port;

import ca.gc.cra.didagent.domain.msg.InboundMessage;
import java.util.List;
import java.util.concurrent.Future;

/**
 * <strong>What:</strong> Owns the configured inbound transports.
 * <p><strong>Role:</strong> Created by the conductor with its inbound router; transports deliver
 * into that router once started.</p>
 * <p><strong>Thread-safety:</strong> lifecycle methods are called from the conductor thread;
 * {@link #dispatchComplete} is called from dispatcher threads.</p>
 *
 * @since 0.1.0
 */
public interface InboundTransportManager {
  /** Instantiates configured transports. Nothing listens yet. */
  void setup() throws Exception;

  /** Starts every transport. */
  void start() throws Exception;

  void stop() throws Exception;

  /**
   * Notification that the dispatcher finished handling {@code message}.
   *
   * @param message handled message
   * @param task the dispatcher task
   * @param failure failure raised while handling, or {@code null}
   */
  void dispatchComplete(InboundMessage message, Future<?> task, Throwable failure);

  /**
   * @return names of the transports set up, in configuration order
   */
  List<String> registeredTransports();

  /**
   * @param transportType transport name from {@link InboundMessage#transportType()}
   * @return {@code true} if that transport can return replies over the inbound session
   */
  boolean supportsDirectResponse(String transportType);
}
