package ca.gc.cra.didagent.application.transport;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.port.InboundRouter;
import ca.gc.cra.didagent.application.port.InboundTransport;
import ca.gc.cra.didagent.application.port.InboundTransportManager;
import ca.gc.cra.didagent.application.port.MetricsPort;
import ca.gc.cra.didagent.domain.msg.InboundMessage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Inbound transport manager driven by the {@code transport.inbound} setting.
 *
 * <p>Transports start in configuration order and the first failure aborts startup. Stop attempts
 * every transport and rethrows the first failure afterwards.</p>
 */
public final class DefaultInboundTransportManager implements InboundTransportManager {
  private static final Logger log = LoggerFactory.getLogger(DefaultInboundTransportManager.class);
  public static final String INBOUND_SETTING = "transport.inbound";

  private final InjectionContext context;
  private final InboundRouter router;
  private final TransportRegistry registry;
  private final MetricsPort metrics;
  private final Map<String, InboundTransport> transports = new LinkedHashMap<>();

  public DefaultInboundTransportManager(
      InjectionContext context, InboundRouter router, TransportRegistry registry, MetricsPort metrics) {
    this.context = Objects.requireNonNull(context, "context");
    this.router = Objects.requireNonNull(router, "router");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public synchronized void setup() {
    for (String name : context.settings().getList(INBOUND_SETTING, List.of("loopback"))) {
      InboundTransport transport = registry.createInbound(name)
          .orElseThrow(() -> new IllegalArgumentException("Unknown inbound transport: " + name));
      transports.put(name, transport);
      log.debug("Registered inbound transport {}", name);
    }
  }

  @Override
  public synchronized void start() throws Exception {
    for (InboundTransport transport : transports.values()) {
      transport.start(router);
      log.info("Started inbound transport {}", transport.name());
    }
  }

  @Override
  public synchronized void stop() throws Exception {
    Exception first = null;
    for (InboundTransport transport : transports.values()) {
      try {
        transport.stop();
      } catch (Exception ex) {
        log.warn("Failed to stop inbound transport {}", transport.name(), ex);
        if (first == null) {
          first = ex;
        } else {
          first.addSuppressed(ex);
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }

  @Override
  public void dispatchComplete(InboundMessage message, Future<?> task, Throwable failure) {
    if (failure == null) {
      metrics.increment("inbound.dispatch.completed");
    } else if (failure instanceof CancellationException) {
      metrics.increment("inbound.dispatch.cancelled");
      log.debug("Handling of message {} was cancelled", message.messageId());
    } else {
      metrics.increment("inbound.dispatch.failed");
      log.error("Exception in message handler for {} via {}", message.messageId(), message.transportType(), failure);
    }
  }

  @Override
  public synchronized List<String> registeredTransports() {
    return List.copyOf(new ArrayList<>(transports.keySet()));
  }

  @Override
  public synchronized boolean supportsDirectResponse(String transportType) {
    InboundTransport transport = transports.get(transportType);
    return transport != null && transport.supportsDirectResponse();
  }
}
