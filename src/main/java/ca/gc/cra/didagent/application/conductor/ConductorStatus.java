package ca.gc.cra.didagent.application.conductor;

/**
 * Read-only view of the conductor lifecycle, bound into the context for status reporting.
 */
@FunctionalInterface
public interface ConductorStatus {
  ConductorState state();
}
