package ca.gc.cra.didagent.application.port;

import java.util.List;

/**
 * HTTP administration API for the controller application.
 */
public interface AdminServer {
  /**
   * @param url base URL that receives {@code POST <url>/topic/<topic>/} events
   */
  void addWebhookTarget(String url);

  List<String> webhookTargets();

  void start() throws Exception;

  void stop() throws Exception;

  /**
   * @return responder that routes messages outbound and events to webhooks
   */
  Responder responder();
}
