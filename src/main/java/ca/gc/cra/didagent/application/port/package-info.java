/**
 * Ports between the conductor and its collaborators. Implementations live under
 * {@code ca.gc.cra.didagent.infrastructure} or in the application sub-packages.
 */
package ca.gc.cra.didagent.application.port;
