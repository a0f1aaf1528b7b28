/**
 * Inbound and outbound agent messages and their delivery metadata.
 */
package ca.gc.cra.didagent.domain.msg;
