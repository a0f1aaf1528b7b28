package ca.gc.cra.didagent.application.connection;

/**
 * Raised when a connection operation cannot complete: unknown connection, unusable key material,
 * or an invitation that cannot be issued.
 */
public final class ConnectionManagerException extends Exception {
  public ConnectionManagerException(String message) {
    super(message);
  }

  public ConnectionManagerException(String message, Throwable cause) {
    super(message, cause);
  }
}
