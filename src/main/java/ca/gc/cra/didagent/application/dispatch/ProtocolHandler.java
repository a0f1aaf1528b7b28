package ca.gc.cra.didagent.application.dispatch;

/**
 * Handles messages of one or more {@code @type} values.
 */
@FunctionalInterface
public interface ProtocolHandler {
  void handle(HandlerContext context) throws Exception;
}
