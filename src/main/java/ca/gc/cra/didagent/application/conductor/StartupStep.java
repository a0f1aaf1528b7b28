package ca.gc.cra.didagent.application.conductor;

import java.util.Objects;
import org.slf4j.Logger;

/**
 * One ordered step of conductor startup together with how its failure is treated.
 *
 * @param description verb phrase used in logs, e.g. {@code start inbound transports}
 * @param criticality failure policy
 * @param action work to perform
 */
public record StartupStep(String description, Criticality criticality, Action action) {

  public StartupStep {
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(criticality, "criticality");
    Objects.requireNonNull(action, "action");
  }

  /** Failure policy of a step. */
  public enum Criticality {
    /** Failure is logged with its stack trace and rethrown, aborting startup. */
    FATAL,
    /** Failure propagates to the caller without extra logging. */
    PROPAGATE,
    /** Failure is logged and startup continues with the next step. */
    RECOVERABLE
  }

  /** Step body. */
  @FunctionalInterface
  public interface Action {
    void run() throws Exception;
  }

  public static StartupStep fatal(String description, Action action) {
    return new StartupStep(description, Criticality.FATAL, action);
  }

  public static StartupStep propagating(String description, Action action) {
    return new StartupStep(description, Criticality.PROPAGATE, action);
  }

  public static StartupStep recoverable(String description, Action action) {
    return new StartupStep(description, Criticality.RECOVERABLE, action);
  }

  /**
   * Runs the step under its failure policy.
   *
   * @param log logger receiving {@code "Unable to <description>"} on failure
   * @throws Exception the step failure, unchanged, for fatal and propagating steps
   */
  public void execute(Logger log) throws Exception {
    switch (criticality) {
      case PROPAGATE -> action.run();
      case FATAL -> {
        try {
          action.run();
        } catch (Exception ex) {
          log.error("Unable to {}", description, ex);
          throw ex;
        }
      }
      case RECOVERABLE -> {
        try {
          action.run();
        } catch (Exception ex) {
          log.error("Unable to {}", description, ex);
        }
      }
      default -> throw new IllegalStateException("Unhandled criticality " + criticality);
    }
  }
}
