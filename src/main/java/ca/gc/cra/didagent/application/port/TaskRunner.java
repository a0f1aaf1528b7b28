package ca.gc.cra.didagent.application.port;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Schedules background work on the dispatcher.
 */
@FunctionalInterface
public interface TaskRunner {
  /**
   * @param task work to run; must not be {@code null}
   * @return handle for the scheduled work
   */
  Future<?> run(Callable<?> task);
}
