package ca.gc.cra.didagent.domain.connection;

/** Pairwise connection states. */
public enum ConnectionState {
  INVITATION,
  REQUEST,
  RESPONSE,
  ACTIVE,
  INACTIVE;

  /**
   * @return {@code true} if messages may be delivered over a connection in this state
   */
  public boolean deliverable() {
    return this == RESPONSE || this == ACTIVE;
  }
}
