package ca.gc.cra.didagent.application.port;

import ca.gc.cra.didagent.domain.connection.ConnectionTarget;
import java.io.IOException;
import java.util.Set;

/**
 * Sends payloads to endpoints whose URI scheme it handles.
 */
public interface OutboundTransport {
  String name();

  /**
   * @return lower-case endpoint schemes served, e.g. {@code http} and {@code https}
   */
  Set<String> schemes();

  void start() throws Exception;

  void stop() throws Exception;

  void send(String payload, ConnectionTarget target) throws IOException;
}
