package ca.gc.cra.didagent.application.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.context.Settings;
import ca.gc.cra.didagent.application.port.InboundRouter;
import ca.gc.cra.didagent.application.port.InboundTransport;
import ca.gc.cra.didagent.application.port.MetricsPort;
import ca.gc.cra.didagent.application.port.OutboundTransport;
import ca.gc.cra.didagent.application.port.TaskRunner;
import ca.gc.cra.didagent.domain.connection.ConnectionTarget;
import ca.gc.cra.didagent.domain.msg.InboundMessage;
import ca.gc.cra.didagent.domain.msg.MessageReceipt;
import ca.gc.cra.didagent.domain.msg.OutboundMessage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TransportManagersTest {
  private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();
  private final MetricsPort metrics = new MetricsPort() {
    @Override
    public void increment(String key) {
      counters.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
    }

    @Override
    public void observe(String key, long value) {}
  };
  private final TaskRunner inline = task -> {
    try {
      return CompletableFuture.completedFuture(task.call());
    } catch (Exception ex) {
      return CompletableFuture.failedFuture(ex);
    }
  };

  @Test
  void inboundManagerStartsConfiguredTransportsWithRouter() throws Exception {
    RecordingInbound http = new RecordingInbound("http", true);
    RecordingInbound ws = new RecordingInbound("ws", false);
    TransportRegistry registry = new TransportRegistry()
        .registerInbound("http", () -> http)
        .registerInbound("ws", () -> ws);
    InboundRouter router = message -> {};
    DefaultInboundTransportManager manager =
        new DefaultInboundTransportManager(context(Map.of("transport.inbound", "http,ws")), router, registry, metrics);

    manager.setup();
    manager.start();

    assertEquals(List.of("http", "ws"), manager.registeredTransports());
    assertSame(router, http.router);
    assertSame(router, ws.router);
    assertTrue(manager.supportsDirectResponse("http"));
    assertFalse(manager.supportsDirectResponse("ws"));
    assertFalse(manager.supportsDirectResponse("smtp"));
  }

  @Test
  void inboundManagerRejectsUnknownTransport() {
    DefaultInboundTransportManager manager = new DefaultInboundTransportManager(
        context(Map.of("transport.inbound", "carrier-pigeon")), message -> {}, new TransportRegistry(), metrics);

    IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, manager::setup);
    assertTrue(thrown.getMessage().contains("carrier-pigeon"));
  }

  @Test
  void inboundStopAttemptsEveryTransportAndRethrowsFirstFailure() throws Exception {
    RecordingInbound first = new RecordingInbound("a", false);
    RecordingInbound second = new RecordingInbound("b", false);
    first.stopFailure = new IOException("a stuck");
    second.stopFailure = new IOException("b stuck");
    TransportRegistry registry = new TransportRegistry()
        .registerInbound("a", () -> first)
        .registerInbound("b", () -> second);
    DefaultInboundTransportManager manager =
        new DefaultInboundTransportManager(context(Map.of("transport.inbound", "a,b")), message -> {}, registry, metrics);
    manager.setup();

    IOException thrown = assertThrows(IOException.class, manager::stop);

    assertEquals("a stuck", thrown.getMessage());
    assertEquals(1, thrown.getSuppressed().length);
    assertTrue(second.stopped);
  }

  @Test
  void dispatchCompletionIsCountedByOutcome() {
    DefaultInboundTransportManager manager = new DefaultInboundTransportManager(
        context(Map.of()), message -> {}, new TransportRegistry(), metrics);
    InboundMessage message = InboundMessage.of("{}", MessageReceipt.anonymous(), "loopback");
    CompletableFuture<Object> task = new CompletableFuture<>();

    manager.dispatchComplete(message, task, null);
    manager.dispatchComplete(message, task, new CancellationException());
    manager.dispatchComplete(message, task, new IllegalStateException("handler failed"));

    assertEquals(1, count("inbound.dispatch.completed"));
    assertEquals(1, count("inbound.dispatch.cancelled"));
    assertEquals(1, count("inbound.dispatch.failed"));
  }

  @Test
  void outboundManagerDeliversViaTransportForScheme() throws Exception {
    RecordingOutbound http = new RecordingOutbound("http", Set.of("http", "https"));
    TransportRegistry registry = new TransportRegistry().registerOutbound("http", () -> http);
    DefaultOutboundTransportManager manager = outboundManager(registry, "http");
    manager.setup();
    manager.start();

    manager.deliver(context(Map.of()), OutboundMessage.builder("{\"hi\":1}")
        .target(target("https://peer.example/agent")).build());

    assertEquals(List.of("https://peer.example/agent"), http.sentTo);
    assertEquals(1, count("outbound.sent"));
    assertEquals(Map.of("http", Set.of("http", "https")), manager.registeredTransports());
  }

  @Test
  void outboundManagerUsesFirstTargetWithSupportedScheme() throws Exception {
    RecordingOutbound http = new RecordingOutbound("http", Set.of("http"));
    DefaultOutboundTransportManager manager =
        outboundManager(new TransportRegistry().registerOutbound("http", () -> http), "http");
    manager.setup();

    manager.deliver(context(Map.of()), OutboundMessage.builder("{}")
        .targetList(List.of(target("ws://peer.example"), target("http://peer.example"), target("http://backup")))
        .build());

    assertEquals(List.of("http://peer.example"), http.sentTo);
  }

  @Test
  void outboundManagerRejectsMessageWithoutTargets() {
    DefaultOutboundTransportManager manager = outboundManager(new TransportRegistry(), "");

    assertThrows(OutboundDeliveryException.class,
        () -> manager.deliver(context(Map.of()), OutboundMessage.builder("{}").build()));
  }

  @Test
  void outboundManagerRejectsUnsupportedScheme() throws Exception {
    RecordingOutbound http = new RecordingOutbound("http", Set.of("http"));
    DefaultOutboundTransportManager manager =
        outboundManager(new TransportRegistry().registerOutbound("http", () -> http), "http");
    manager.setup();

    OutboundDeliveryException thrown = assertThrows(OutboundDeliveryException.class,
        () -> manager.deliver(context(Map.of()), OutboundMessage.builder("{}").target(target("ws://peer")).build()));

    assertTrue(thrown.getMessage().contains("ws://peer"));
    assertTrue(http.sentTo.isEmpty());
  }

  @Test
  void outboundSendFailureIsCounted() throws Exception {
    RecordingOutbound http = new RecordingOutbound("http", Set.of("http"));
    http.sendFailure = new IOException("connection refused");
    DefaultOutboundTransportManager manager =
        outboundManager(new TransportRegistry().registerOutbound("http", () -> http), "http");
    manager.setup();

    manager.deliver(context(Map.of()), OutboundMessage.builder("{}").target(target("http://peer")).build());

    assertEquals(1, count("outbound.failed"));
    assertEquals(0, count("outbound.sent"));
  }

  @Test
  void outboundManagerRejectsDuplicateScheme() {
    TransportRegistry registry = new TransportRegistry()
        .registerOutbound("a", () -> new RecordingOutbound("a", Set.of("http")))
        .registerOutbound("b", () -> new RecordingOutbound("b", Set.of("http")));
    DefaultOutboundTransportManager manager = outboundManager(registry, "a,b");

    assertThrows(IllegalArgumentException.class, manager::setup);
  }

  private DefaultOutboundTransportManager outboundManager(TransportRegistry registry, String names) {
    return new DefaultOutboundTransportManager(context(Map.of("transport.outbound", names)), inline, registry, metrics);
  }

  private static InjectionContext context(Map<String, Object> settings) {
    return new InjectionContext(Settings.of(settings));
  }

  private static ConnectionTarget target(String endpoint) {
    return new ConnectionTarget(null, endpoint, null, List.of("key"), List.of(), "sender");
  }

  private int count(String key) {
    AtomicInteger counter = counters.get(key);
    return counter == null ? 0 : counter.get();
  }

  private static final class RecordingInbound implements InboundTransport {
    private final String name;
    private final boolean directResponse;
    InboundRouter router;
    boolean stopped;
    Exception stopFailure;

    RecordingInbound(String name, boolean directResponse) {
      this.name = name;
      this.directResponse = directResponse;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public void start(InboundRouter router) {
      this.router = router;
    }

    @Override
    public void stop() throws Exception {
      stopped = true;
      if (stopFailure != null) {
        throw stopFailure;
      }
    }

    @Override
    public boolean supportsDirectResponse() {
      return directResponse;
    }
  }

  private static final class RecordingOutbound implements OutboundTransport {
    private final String name;
    private final Set<String> schemes;
    final List<String> sentTo = new ArrayList<>();
    IOException sendFailure;

    RecordingOutbound(String name, Set<String> schemes) {
      this.name = name;
      this.schemes = schemes;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Set<String> schemes() {
      return schemes;
    }

    @Override
    public void start() {}

    @Override
    public void stop() {}

    @Override
    public void send(String payload, ConnectionTarget target) throws IOException {
      if (sendFailure != null) {
        throw sendFailure;
      }
      sentTo.add(target.endpoint());
    }
  }
}
