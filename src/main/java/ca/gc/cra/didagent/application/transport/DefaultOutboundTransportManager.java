package ca.gc.cra.didagent.application.transport;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.port.MetricsPort;
import ca.gc.cra.didagent.application.port.OutboundTransport;
import ca.gc.cra.didagent.application.port.OutboundTransportManager;
import ca.gc.cra.didagent.application.port.TaskRunner;
import ca.gc.cra.didagent.domain.connection.ConnectionTarget;
import ca.gc.cra.didagent.domain.msg.OutboundMessage;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outbound transport manager driven by the {@code transport.outbound} setting.
 *
 * <p>Each transport claims one or more endpoint schemes; two transports claiming the same scheme
 * is a configuration error. Sends run on the task runner so {@link #deliver} never blocks on
 * the network.</p>
 */
public final class DefaultOutboundTransportManager implements OutboundTransportManager {
  private static final Logger log = LoggerFactory.getLogger(DefaultOutboundTransportManager.class);
  public static final String OUTBOUND_SETTING = "transport.outbound";

  private final InjectionContext context;
  private final TaskRunner taskRunner;
  private final TransportRegistry registry;
  private final MetricsPort metrics;
  private final Map<String, OutboundTransport> transports = new LinkedHashMap<>();
  private final Map<String, OutboundTransport> byScheme = new LinkedHashMap<>();

  public DefaultOutboundTransportManager(
      InjectionContext context, TaskRunner taskRunner, TransportRegistry registry, MetricsPort metrics) {
    this.context = Objects.requireNonNull(context, "context");
    this.taskRunner = Objects.requireNonNull(taskRunner, "taskRunner");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public synchronized void setup() {
    for (String name : context.settings().getList(OUTBOUND_SETTING, List.of("loopback"))) {
      OutboundTransport transport = registry.createOutbound(name)
          .orElseThrow(() -> new IllegalArgumentException("Unknown outbound transport: " + name));
      for (String scheme : transport.schemes()) {
        OutboundTransport existing = byScheme.putIfAbsent(scheme, transport);
        if (existing != null) {
          throw new IllegalArgumentException(
              "Scheme " + scheme + " claimed by both " + existing.name() + " and " + name);
        }
      }
      transports.put(name, transport);
      log.debug("Registered outbound transport {} for {}", name, transport.schemes());
    }
  }

  @Override
  public synchronized void start() throws Exception {
    for (OutboundTransport transport : transports.values()) {
      transport.start();
      log.info("Started outbound transport {}", transport.name());
    }
  }

  @Override
  public synchronized void stop() throws Exception {
    Exception first = null;
    for (OutboundTransport transport : transports.values()) {
      try {
        transport.stop();
      } catch (Exception ex) {
        log.warn("Failed to stop outbound transport {}", transport.name(), ex);
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
  public void deliver(InjectionContext context, OutboundMessage message) throws OutboundDeliveryException {
    List<ConnectionTarget> targets = message.target().map(List::of).orElseGet(message::targetList);
    if (targets.isEmpty()) {
      throw new OutboundDeliveryException("No delivery targets for " + message);
    }
    for (ConnectionTarget target : targets) {
      OutboundTransport transport = transportFor(target.scheme());
      if (transport == null) {
        continue;
      }
      taskRunner.run(() -> {
        try {
          transport.send(message.payload(), target);
        } catch (IOException ex) {
          metrics.increment("outbound.failed");
          log.warn("Delivery to {} via {} failed", target.endpoint(), transport.name(), ex);
          throw ex;
        }
        metrics.increment("outbound.sent");
        return null;
      });
      log.debug("Scheduled delivery to {} via {}", target.endpoint(), transport.name());
      return;
    }
    throw new OutboundDeliveryException("No supported transport for endpoints "
        + targets.stream().map(ConnectionTarget::endpoint).collect(Collectors.joining(", ")));
  }

  private synchronized OutboundTransport transportFor(String scheme) {
    return byScheme.get(scheme);
  }

  @Override
  public synchronized Map<String, Set<String>> registeredTransports() {
    Map<String, Set<String>> view = new LinkedHashMap<>();
    transports.forEach((name, transport) -> view.put(name, Set.copyOf(transport.schemes())));
    return Collections.unmodifiableMap(view);
  }
}
