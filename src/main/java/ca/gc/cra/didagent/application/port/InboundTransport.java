package ca.gc.cra.didagent.application.port;

/**
 * A listener that accepts messages from peers and feeds them to an {@link InboundRouter}.
 */
public interface InboundTransport {
  String name();

  void start(InboundRouter router) throws Exception;

  void stop() throws Exception;

  /**
   * @return {@code true} if replies can be returned over the session that carried the message
   */
  boolean supportsDirectResponse();
}
