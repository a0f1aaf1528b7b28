package ca.gc.cra.didagent.application.conductor;

/**
 * Conductor lifecycle states. The normal path runs {@code CREATED} through {@code STOPPED}. A
 * failed {@code setup()} ends in {@link #FAILED}; a failed {@code start()} leaves the conductor in
 * {@link #STARTING}. {@code stop()} is permitted from both.
 */
public enum ConductorState {
  CREATED,
  CONFIGURED,
  STARTING,
  RUNNING,
  STOPPING,
  STOPPED,
  FAILED
}
