package ca.gc.cra.didagent.application.transport;

/**
 * Raised when an outbound message cannot be handed to any registered transport.
 */
public final class OutboundDeliveryException extends Exception {
  public OutboundDeliveryException(String message) {
    super(message);
  }
}
