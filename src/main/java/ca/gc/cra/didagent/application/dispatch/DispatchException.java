package ca.gc.cra.didagent.application.dispatch;

/**
 * Raised when an inbound message cannot be matched to a protocol handler.
 */
public final class DispatchException extends Exception {
  public DispatchException(String message) {
    super(message);
  }

  public DispatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
