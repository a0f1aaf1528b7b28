/**
 * Configuration loading (YAML, CLI, defaults) and the composition root that wires adapters.
 */
package ca.gc.cra.didagent.config;
