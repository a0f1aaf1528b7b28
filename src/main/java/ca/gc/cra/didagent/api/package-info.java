/**
 * Command-line entry points that load configuration and run the agent conductor.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging
 * and telemetry, and hands control to {@link ca.gc.cra.didagent.application.conductor.Conductor}.</p>
 */
package ca.gc.cra.didagent.api;
