/**
 * Agent lifecycle orchestration.
 * <p><strong>Role:</strong> Application layer; owns setup, start and stop of transports, dispatcher
 * and administration API, and routes messages between them.</p>
 * <p><strong>Concurrency:</strong> Lifecycle transitions are serialized; message routing runs on
 * transport and dispatcher threads.</p>
 */
package ca.gc.cra.didagent.application.conductor;
