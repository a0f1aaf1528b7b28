package ca.gc.cra.didagent.infrastructure.admin;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.didagent.application.conductor.ConductorState;
import ca.gc.cra.didagent.application.conductor.ConductorStatus;
import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.context.Settings;
import ca.gc.cra.didagent.application.json.JsonSupport;
import ca.gc.cra.didagent.application.port.MetricsPort;
import ca.gc.cra.didagent.application.port.TaskRunner;
import ca.gc.cra.didagent.domain.msg.InboundMessage;
import ca.gc.cra.didagent.domain.msg.MessageReceipt;
import ca.gc.cra.didagent.domain.msg.OutboundMessage;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class HttpAdminServerTest {
  private final CountingMetrics metrics = new CountingMetrics();
  private final TaskRunner inline = task -> {
    try {
      return CompletableFuture.completedFuture(task.call());
    } catch (Exception ex) {
      return CompletableFuture.failedFuture(ex);
    }
  };
  private final AtomicReference<OutboundMessage> routed = new AtomicReference<>();
  private final AtomicReference<InboundMessage> routedInbound =
      new AtomicReference<>(InboundMessage.of("{}", MessageReceipt.anonymous(), "loopback"));
  private HttpAdminServer admin;
  private HttpServer hooks;

  @AfterEach
  void tearDown() {
    if (admin != null) {
      admin.stop();
    }
    if (hooks != null) {
      hooks.stop(0);
    }
  }

  @Test
  void statusReportsLabelStateAndWebhookCount() throws Exception {
    InjectionContext context = new InjectionContext(Settings.of(Map.of("default_label", "alice")));
    context.injector().bindInstance(ConductorStatus.class, () -> ConductorState.RUNNING);
    admin = server(context);
    admin.addWebhookTarget("http://127.0.0.1:9/hooks");
    admin.start();

    HttpResponse<String> response = HttpClient.newHttpClient().send(
        HttpRequest.newBuilder(statusUri()).GET().build(), HttpResponse.BodyHandlers.ofString());

    assertEquals(200, response.statusCode());
    assertEquals("application/json", response.headers().firstValue("Content-Type").orElse(""));
    Map<String, Object> body = new JsonSupport().parseObject(response.body());
    assertEquals("alice", body.get("label"));
    assertEquals("running", body.get("state"));
    assertEquals(1, ((Number) body.get("webhook_targets")).intValue());
  }

  @Test
  void statusRejectsOtherMethods() throws Exception {
    admin = server(new InjectionContext(Settings.empty()));
    admin.start();

    HttpResponse<String> response = HttpClient.newHttpClient().send(
        HttpRequest.newBuilder(statusUri()).POST(HttpRequest.BodyPublishers.noBody()).build(),
        HttpResponse.BodyHandlers.ofString());

    assertEquals(405, response.statusCode());
  }

  @Test
  void startTwiceFailsAndStopIsIdempotent() throws Exception {
    admin = server(new InjectionContext(Settings.empty()));
    admin.start();

    assertThrows(IllegalStateException.class, admin::start);
    admin.stop();
    admin.stop();
    assertThrows(IllegalStateException.class, admin::boundPort);
  }

  @Test
  void invalidWebhookTargetIsRejected() {
    admin = server(new InjectionContext(Settings.empty()));

    assertThrows(IllegalArgumentException.class, () -> admin.addWebhookTarget("ftp://hooks.example"));
    assertEquals(List.of(), admin.webhookTargets());
  }

  @Test
  void webhookEventsArePostedToTopicPath() throws Exception {
    List<String> received = new CopyOnWriteArrayList<>();
    hooks = hookServer(204, received);
    admin = server(new InjectionContext(Settings.empty()));
    admin.addWebhookTarget("http://127.0.0.1:" + hooks.getAddress().getPort() + "/hooks/");

    admin.responder().sendWebhook("ping", Map.of("state", "received"));

    assertEquals(List.of("/hooks/topic/ping/ {\"state\":\"received\"}"), received);
    assertEquals(1, metrics.count("admin.webhook.sent"));
  }

  @Test
  void rejectedAndUnreachableWebhooksAreCounted() throws Exception {
    hooks = hookServer(500, new CopyOnWriteArrayList<>());
    admin = server(new InjectionContext(Settings.empty()));
    admin.addWebhookTarget("http://127.0.0.1:" + hooks.getAddress().getPort());
    admin.addWebhookTarget("http://127.0.0.1:" + unusedPort());

    admin.responder().sendWebhook("connections", Map.of("state", "active"));

    assertEquals(1, metrics.count("admin.webhook.rejected"));
    assertEquals(1, metrics.count("admin.webhook.failed"));
  }

  @Test
  void responderSendsWithoutInboundMessage() {
    admin = server(new InjectionContext(Settings.empty()));
    OutboundMessage message = OutboundMessage.builder("{}").connectionId("conn-1").build();

    admin.responder().send(message);

    assertSame(message, routed.get());
    assertNull(routedInbound.get());
  }

  private HttpAdminServer server(InjectionContext context) {
    return new HttpAdminServer("127.0.0.1", 0, context, (ctx, outbound, inbound) -> {
      routed.set(outbound);
      routedInbound.set(inbound);
    }, inline, metrics);
  }

  private URI statusUri() {
    return URI.create("http://127.0.0.1:" + admin.boundPort() + "/status");
  }

  private static HttpServer hookServer(int status, List<String> received) throws IOException {
    HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/", exchange -> {
      try {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        received.add(exchange.getRequestURI().getPath() + " " + body);
        exchange.sendResponseHeaders(status, -1);
      } finally {
        exchange.close();
      }
    });
    server.start();
    return server;
  }

  private static int unusedPort() throws IOException {
    HttpServer portFinder = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    int port = portFinder.getAddress().getPort();
    portFinder.stop(0);
    return port;
  }

  private static final class CountingMetrics implements MetricsPort {
    private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();

    @Override
    public void increment(String key) {
      counters.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
    }

    @Override
    public void observe(String key, long value) {}

    int count(String key) {
      AtomicInteger counter = counters.get(key);
      return counter == null ? 0 : counter.get();
    }
  }
}
