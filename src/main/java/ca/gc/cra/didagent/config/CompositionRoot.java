package ca.gc.cra.didagent.config;

import ca.gc.cra.didagent.application.conductor.ComponentFactory;
import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.context.Settings;
import ca.gc.cra.didagent.application.dispatch.ProtocolRegistry;
import ca.gc.cra.didagent.application.dispatch.TaskQueueDispatcher;
import ca.gc.cra.didagent.application.dispatch.TrustPingHandler;
import ca.gc.cra.didagent.application.json.JsonSupport;
import ca.gc.cra.didagent.application.port.AdminServer;
import ca.gc.cra.didagent.application.port.ConnectionManager;
import ca.gc.cra.didagent.application.port.ContextBuilder;
import ca.gc.cra.didagent.application.port.Dispatcher;
import ca.gc.cra.didagent.application.port.InboundRouter;
import ca.gc.cra.didagent.application.port.InboundTransportManager;
import ca.gc.cra.didagent.application.port.LedgerConfigurator;
import ca.gc.cra.didagent.application.port.MetricsPort;
import ca.gc.cra.didagent.application.port.OutboundRouter;
import ca.gc.cra.didagent.application.port.OutboundTransportManager;
import ca.gc.cra.didagent.application.port.TaskRunner;
import ca.gc.cra.didagent.application.port.WalletConfigurator;
import ca.gc.cra.didagent.application.stats.Collector;
import ca.gc.cra.didagent.application.task.TaskQueue;
import ca.gc.cra.didagent.application.transport.DefaultInboundTransportManager;
import ca.gc.cra.didagent.application.transport.DefaultOutboundTransportManager;
import ca.gc.cra.didagent.application.transport.TransportRegistry;
import ca.gc.cra.didagent.infrastructure.admin.HttpAdminServer;
import ca.gc.cra.didagent.infrastructure.connection.ConnectionStore;
import ca.gc.cra.didagent.infrastructure.connection.InMemoryConnectionManager;
import ca.gc.cra.didagent.infrastructure.ledger.GenesisLedgerConfigurator;
import ca.gc.cra.didagent.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.didagent.infrastructure.transport.loopback.LoopbackChannel;
import ca.gc.cra.didagent.infrastructure.transport.loopback.LoopbackInboundTransport;
import ca.gc.cra.didagent.infrastructure.transport.loopback.LoopbackOutboundTransport;
import ca.gc.cra.didagent.infrastructure.wallet.SeedWalletConfigurator;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Composition root that turns effective settings into the agent's component graph.
 * <p><strong>Role:</strong> Production {@link ContextBuilder} and {@link ComponentFactory} for the
 * {@link ca.gc.cra.didagent.application.conductor.Conductor}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate settings and bind shared services (metrics, JSON codec, protocol and transport
 *   registries, connection store) into a fresh {@link InjectionContext}.</li>
 *   <li>Bind a {@link Collector} when {@code timing.enabled} is set.</li>
 *   <li>Create dispatcher, transport managers, admin server and connection managers on request.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #build()} creates a new context per call; factory methods
 * allocate new instances and are not synchronized.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements ContextBuilder, ComponentFactory {
  static final String DISPATCH_QUEUE_NAME = "didagent-dispatch";

  private final Settings settings;
  private final MetricsPort metrics;

  public CompositionRoot(Settings settings) {
    this(settings, new NoOpMetricsAdapter());
  }

  /**
   * @param settings effective settings, usually from {@link ConfigMerger}
   * @param metrics metrics sink bound into every built context
   */
  public CompositionRoot(Settings settings, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public InjectionContext build() {
    ConfigMerger.validate(settings);
    InjectionContext context = new InjectionContext(settings);
    JsonSupport json = new JsonSupport();
    context.injector().bindInstance(MetricsPort.class, metrics);
    context.injector().bindInstance(JsonSupport.class, json);

    ProtocolRegistry protocols = new ProtocolRegistry();
    TrustPingHandler.register(protocols, json);
    context.injector().bindInstance(ProtocolRegistry.class, protocols);

    LoopbackChannel channel = new LoopbackChannel();
    TransportRegistry transports = new TransportRegistry()
        .registerInbound(LoopbackChannel.TRANSPORT_NAME, () -> new LoopbackInboundTransport(channel))
        .registerOutbound(LoopbackChannel.TRANSPORT_NAME, () -> new LoopbackOutboundTransport(channel));
    context.injector().bindInstance(TransportRegistry.class, transports);
    context.injector().bindInstance(ConnectionStore.class, new ConnectionStore());

    if (settings.getBoolean("timing.enabled", false)) {
      context.injector().bindInstance(Collector.class, new Collector(metrics));
    }
    return context;
  }

  @Override
  public Dispatcher dispatcher(
      InjectionContext context, Function<InjectionContext, ConnectionManager> connections) {
    int maxActive = context.settings().getInt(
        "dispatch.max_active", 2 * Runtime.getRuntime().availableProcessors());
    return new TaskQueueDispatcher(
        context,
        context.inject(ProtocolRegistry.class),
        connections,
        new TaskQueue(DISPATCH_QUEUE_NAME, maxActive),
        context.inject(JsonSupport.class),
        metricsOf(context));
  }

  @Override
  public InboundTransportManager inboundTransportManager(InjectionContext context, InboundRouter router) {
    return new DefaultInboundTransportManager(
        context, router, context.inject(TransportRegistry.class), metricsOf(context));
  }

  @Override
  public OutboundTransportManager outboundTransportManager(InjectionContext context, TaskRunner taskRunner) {
    return new DefaultOutboundTransportManager(
        context, taskRunner, context.inject(TransportRegistry.class), metricsOf(context));
  }

  @Override
  public AdminServer adminServer(
      String host, int port, InjectionContext context, OutboundRouter router, TaskRunner taskEnqueuer) {
    return new HttpAdminServer(host, port, context, router, taskEnqueuer, metricsOf(context));
  }

  @Override
  public ConnectionManager connectionManager(InjectionContext context) {
    return new InMemoryConnectionManager(context, context.inject(ConnectionStore.class));
  }

  @Override
  public WalletConfigurator walletConfigurator() {
    return new SeedWalletConfigurator();
  }

  @Override
  public LedgerConfigurator ledgerConfigurator() {
    return new GenesisLedgerConfigurator();
  }

  private static MetricsPort metricsOf(InjectionContext context) {
    return context.injectIfPresent(MetricsPort.class).orElse(MetricsPort.NO_OP);
  }
}
