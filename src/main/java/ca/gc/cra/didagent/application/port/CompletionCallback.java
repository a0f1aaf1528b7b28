package ca.gc.cra.didagent.application.port;

import java.util.concurrent.Future;

/**
 * Notified once when a queued unit of work finishes, successfully or not.
 */
@FunctionalInterface
public interface CompletionCallback {
  /**
   * @param task the finished task
   * @param failure failure raised by the task, or {@code null} on success
   */
  void onComplete(Future<?> task, Throwable failure);
}
