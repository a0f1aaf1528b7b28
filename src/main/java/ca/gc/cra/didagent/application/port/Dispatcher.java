package ca.gc.cra.didagent.application.port;

import ca.gc.cra.didagent.domain.msg.InboundMessage;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.function.UnaryOperator;

/**
 * <strong>What:</strong> Port for the component that runs protocol handlers for inbound messages.
 * <p><strong>Why:</strong> Decouples transports from message processing so a slow handler never
 * stalls a transport read loop.</p>
 * <p><strong>Role:</strong> Owned by the conductor; implemented by {@code TaskQueueDispatcher}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Queue inbound messages and report each completion exactly once.</li>
 *   <li>Run background tasks for transports ({@link #runTask}) and the admin API ({@link #putTask}).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> all methods may be called from any thread.</p>
 *
 * @since 0.1.0
 */
public interface Dispatcher extends MessageHandler {
  /**
   * Queues {@code message} for handling without blocking the caller.
   *
   * @param message message to handle
   * @param responder router used for replies produced while handling
   * @param onComplete invoked exactly once when handling finishes
   */
  void queueMessage(InboundMessage message, OutboundRouter responder, CompletionCallback onComplete);

  /**
   * Handles {@code message} on the calling thread.
   *
   * @throws Exception any failure raised by protocol handling
   */
  @Override
  void handleMessage(InboundMessage message, OutboundRouter responder) throws Exception;

  /**
   * Starts {@code task} immediately, outside the concurrency limit applied to messages.
   */
  Future<?> runTask(Callable<?> task);

  /**
   * Enqueues {@code task} under the same concurrency limit as messages.
   */
  Future<?> putTask(Callable<?> task);

  /**
   * Replaces the handler used for queued and direct message handling with a decorated one, for
   * example a timing wrapper.
   *
   * @param decorator receives the current handler and returns its replacement
   */
  void decorateHandler(UnaryOperator<MessageHandler> decorator);
}
