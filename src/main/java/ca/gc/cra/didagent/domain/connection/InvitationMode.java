package ca.gc.cra.didagent.domain.connection;

/** How a connection came into being. */
public enum InvitationMode {
  /** Single-use invitation. */
  ONCE,
  /** Invitation that may be accepted by many parties. */
  MULTI,
  /** Statically provisioned from known seeds, no exchange. */
  STATIC
}
