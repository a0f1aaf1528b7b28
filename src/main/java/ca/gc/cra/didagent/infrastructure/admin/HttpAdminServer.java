package ca.gc.cra.didagent.infrastructure.admin;

import ca.gc.cra.didagent.application.conductor.ConductorStatus;
import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.json.JsonSupport;
import ca.gc.cra.didagent.application.port.AdminServer;
import ca.gc.cra.didagent.application.port.MetricsPort;
import ca.gc.cra.didagent.application.port.OutboundRouter;
import ca.gc.cra.didagent.application.port.Responder;
import ca.gc.cra.didagent.application.port.TaskRunner;
import ca.gc.cra.didagent.validation.Net;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Administration API on the JDK HTTP server.
 *
 * <p>Serves {@code GET /status} with the agent label, conductor state and webhook target count.
 * Webhook events are posted through the dispatcher's task queue.</p>
 */
public final class HttpAdminServer implements AdminServer {
  private static final Logger log = LoggerFactory.getLogger(HttpAdminServer.class);

  private final String host;
  private final int port;
  private final InjectionContext context;
  private final JsonSupport json;
  private final List<String> webhookTargets = new CopyOnWriteArrayList<>();
  private final AdminResponder responder;
  private HttpServer server;

  public HttpAdminServer(
      String host,
      int port,
      InjectionContext context,
      OutboundRouter outboundRouter,
      TaskRunner taskEnqueuer,
      MetricsPort metrics) {
    this.host = Net.requireHost("admin.host", host);
    this.port = Net.requirePort("admin.port", port);
    this.context = Objects.requireNonNull(context, "context");
    this.json = new JsonSupport();
    HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    WebhookEmitter webhooks = new WebhookEmitter(this::webhookTargets, taskEnqueuer, client, json, metrics);
    this.responder = new AdminResponder(context, outboundRouter, webhooks);
  }

  @Override
  public void addWebhookTarget(String url) {
    webhookTargets.add(Net.requireHttpUrl("admin.webhook_urls", url));
  }

  @Override
  public List<String> webhookTargets() {
    return List.copyOf(webhookTargets);
  }

  @Override
  public synchronized void start() throws IOException {
    if (server != null) {
      throw new IllegalStateException("Administration API already started");
    }
    HttpServer created = HttpServer.create(new InetSocketAddress(host, port), 0);
    created.createContext("/status", this::handleStatus);
    created.start();
    server = created;
    log.info("Administration API listening on {}:{}", host, boundPort());
  }

  @Override
  public synchronized void stop() {
    if (server != null) {
      server.stop(0);
      server = null;
      log.info("Administration API stopped");
    }
  }

  @Override
  public Responder responder() {
    return responder;
  }

  /**
   * @return the bound port, useful when configured with port {@code 0}
   * @throws IllegalStateException if the server is not running
   */
  public synchronized int boundPort() {
    if (server == null) {
      throw new IllegalStateException("Administration API is not running");
    }
    return server.getAddress().getPort();
  }

  private void handleStatus(HttpExchange exchange) throws IOException {
    try {
      if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
        exchange.sendResponseHeaders(405, -1);
        return;
      }
      Map<String, Object> status = new LinkedHashMap<>();
      status.put("label", context.settings().getString("default_label", "didagent"));
      status.put("state", context.injectIfPresent(ConductorStatus.class)
          .map(s -> s.state().name().toLowerCase(Locale.ROOT))
          .orElse("unknown"));
      status.put("webhook_targets", webhookTargets.size());
      byte[] body = json.write(status).getBytes(StandardCharsets.UTF_8);
      exchange.getResponseHeaders().set("Content-Type", "application/json");
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    } finally {
      exchange.close();
    }
  }
}
