/**
 * OpenTelemetry-backed metrics adapters.
 */
package ca.gc.cra.didagent.infrastructure.metrics;
