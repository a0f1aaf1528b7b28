package ca.gc.cra.didagent.application.conductor;

import ca.gc.cra.didagent.application.connection.ConnectionManagerException;
import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.context.Settings;
import ca.gc.cra.didagent.application.json.InvitationUrls;
import ca.gc.cra.didagent.application.port.AdminServer;
import ca.gc.cra.didagent.application.port.ConnectionManager;
import ca.gc.cra.didagent.application.port.ConnectionManager.InvitationResult;
import ca.gc.cra.didagent.application.port.ContextBuilder;
import ca.gc.cra.didagent.application.port.Dispatcher;
import ca.gc.cra.didagent.application.port.InboundTransportManager;
import ca.gc.cra.didagent.application.port.MetricsPort;
import ca.gc.cra.didagent.application.port.OutboundRouter;
import ca.gc.cra.didagent.application.port.OutboundTransportManager;
import ca.gc.cra.didagent.application.port.Responder;
import ca.gc.cra.didagent.application.stats.Collector;
import ca.gc.cra.didagent.application.task.TaskQueue;
import ca.gc.cra.didagent.application.transport.OutboundDeliveryException;
import ca.gc.cra.didagent.domain.connection.AgentIdentity;
import ca.gc.cra.didagent.domain.connection.ConnectionRecord;
import ca.gc.cra.didagent.domain.msg.InboundMessage;
import ca.gc.cra.didagent.domain.msg.OutboundMessage;
import ca.gc.cra.didagent.logging.LoggingConfigurator;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns the agent lifecycle and routes every message entering or leaving it.
 * <p><strong>Why:</strong> Transports, dispatcher, admin API and connection management have their
 * own lifecycles and failure modes; one component composes them in a fixed order and applies a
 * single delivery policy.</p>
 * <p><strong>Role:</strong> Application core; collaborators come from a {@link ComponentFactory}
 * and share one {@link InjectionContext}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@link #setup()} builds the context and collaborators; {@link #start()} brings them up in
 *   order; {@link #stop(Duration)} tears them down in parallel under a deadline.</li>
 *   <li>{@link #routeInbound} queues received messages on the dispatcher without blocking the
 *   transport.</li>
 *   <li>{@link #routeOutbound} resolves connection targets once and hands the message to delivery,
 *   dropping it (never retrying) when it cannot be resolved or no transport serves it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@code setup} and {@code start} are serialized; {@code stop}
 * may be called from any thread (typically a shutdown hook). A stop that arrives during
 * {@code start} wins: no further startup step runs and the conductor stays stopped. Routing
 * methods are called concurrently from transport and dispatcher threads once setup completed.</p>
 * <p><strong>Observability:</strong> Counters under {@code conductor.*}; see {@link MetricsPort}.</p>
 *
 * @since 0.1.0
 */
public final class Conductor {
  private static final Logger log = LoggerFactory.getLogger(Conductor.class);

  /** Default deadline for {@link #stop()}. */
  public static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(1);
  static final String TEST_SUBJECT_SEED_INPUT = "aries-protocol-test-subject";
  static final String TEST_SUITE_SEED_INPUT = "aries-protocol-test-suite";
  static final String DEFAULT_ADMIN_HOST = "0.0.0.0";
  static final int DEFAULT_ADMIN_PORT = 80;

  private final ContextBuilder contextBuilder;
  private final ComponentFactory components;
  private final PrintWriter console;
  private final InvitationUrls invitationUrls = new InvitationUrls();
  private final Object lifecycleLock = new Object();
  private final AtomicReference<ConductorState> state = new AtomicReference<>(ConductorState.CREATED);

  private volatile InjectionContext context;
  private volatile Dispatcher dispatcher;
  private volatile InboundTransportManager inboundTransportManager;
  private volatile OutboundTransportManager outboundTransportManager;
  private volatile AdminServer adminServer;
  private volatile Collector collector;
  private volatile MetricsPort metrics = MetricsPort.NO_OP;
  private volatile OutboundRouter outboundRouter = this::deliverOutbound;

  /**
   * Creates a conductor printing to standard output.
   *
   * @param contextBuilder produces the context during {@link #setup()}
   * @param components creates collaborators
   */
  public Conductor(ContextBuilder contextBuilder, ComponentFactory components) {
    this(contextBuilder, components,
        new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
  }

  /**
   * @param contextBuilder produces the context during {@link #setup()}
   * @param components creates collaborators
   * @param console receives the banner and debug output
   */
  public Conductor(ContextBuilder contextBuilder, ComponentFactory components, PrintWriter console) {
    this.contextBuilder = Objects.requireNonNull(contextBuilder, "contextBuilder");
    this.components = Objects.requireNonNull(components, "components");
    this.console = Objects.requireNonNull(console, "console");
  }

  /**
   * Builds the context and constructs every collaborator. Nothing listens or sends yet.
   *
   * <p>A failure leaves the conductor {@link ConductorState#FAILED}; {@link #stop(Duration)} then
   * stops whichever transport managers were already set up.</p>
   *
   * @throws IllegalStateException if setup already ran on this instance
   * @throws Exception any failure from context building, transport setup or admin construction
   */
  public void setup() throws Exception {
    synchronized (lifecycleLock) {
      requireState(ConductorState.CREATED, "setup()");
      try {
        configure();
      } catch (Exception ex) {
        state.compareAndSet(ConductorState.CREATED, ConductorState.FAILED);
        throw ex;
      }
    }
  }

  private void configure() throws Exception {
    InjectionContext ctx = contextBuilder.build();
    metrics = ctx.injectIfPresent(MetricsPort.class).orElse(MetricsPort.NO_OP);
    ctx.injector().bindInstance(ConductorStatus.class, this::state);

    Dispatcher newDispatcher = components.dispatcher(ctx, this::connectionManager);
    dispatcher = newDispatcher;

    InboundTransportManager inbound = components.inboundTransportManager(ctx, this::routeInbound);
    inboundTransportManager = inbound;
    inbound.setup();

    OutboundTransportManager outbound = components.outboundTransportManager(ctx, newDispatcher::runTask);
    outboundTransportManager = outbound;
    outbound.setup();

    Settings settings = ctx.settings();
    if (settings.getBoolean("admin.enabled", false)) {
      adminServer = createAdminServer(ctx, newDispatcher);
    }

    ctx.injectIfPresent(Collector.class).ifPresent(this::instrument);
    context = ctx;
    state.set(ConductorState.CONFIGURED);
    log.debug("Conductor configured with inbound {} and outbound {}",
        inbound.registeredTransports(), outbound.registeredTransports().keySet());
  }

  /**
   * Brings the agent up: wallet, ledger, inbound then outbound transports, admin API, banner,
   * then the optional debug connection and invitation.
   *
   * <p>Wallet and ledger failures propagate unchanged. Transport start failures are logged and
   * rethrown. Admin API start and invitation failures are logged and startup continues. When
   * {@link #stop(Duration)} runs concurrently, the remaining steps are skipped.</p>
   *
   * @throws IllegalStateException if {@link #setup()} has not completed or start already ran
   * @throws Exception the first fatal step failure
   */
  public void start() throws Exception {
    synchronized (lifecycleLock) {
      if (!state.compareAndSet(ConductorState.CONFIGURED, ConductorState.STARTING)) {
        throw new IllegalStateException("start() requires state CONFIGURED but was " + state.get());
      }
      InjectionContext ctx = context;
      Settings settings = ctx.settings();
      AtomicReference<AgentIdentity> publicIdentity = new AtomicReference<>();

      List<StartupStep> steps = new ArrayList<>();
      steps.add(StartupStep.propagating("configure wallet",
          () -> publicIdentity.set(components.walletConfigurator().configure(ctx).orElse(null))));
      steps.add(StartupStep.propagating("configure ledger",
          () -> components.ledgerConfigurator().configure(ctx, publicIdentity.get())));
      steps.add(StartupStep.fatal("start inbound transports", inboundTransportManager::start));
      steps.add(StartupStep.fatal("start outbound transports", outboundTransportManager::start));
      if (adminServer != null) {
        steps.add(StartupStep.recoverable("start administration API", this::startAdminServer));
      }
      steps.add(StartupStep.propagating("print banner", () -> printBanner(settings, publicIdentity.get())));
      String testSuiteEndpoint = settings.getString("debug.test_suite_endpoint");
      if (testSuiteEndpoint != null && !testSuiteEndpoint.isBlank()) {
        steps.add(StartupStep.propagating("create test suite connection",
            () -> createTestSuiteConnection(ctx, testSuiteEndpoint)));
      }
      if (settings.getBoolean("debug.print_invitation", false)) {
        steps.add(StartupStep.recoverable("create invitation", () -> printInvitation(ctx)));
      }

      for (StartupStep step : steps) {
        if (state.get() != ConductorState.STARTING) {
          log.info("Conductor {} during startup; skipping {}", state.get(), step.description());
          return;
        }
        step.execute(log);
      }
      if (state.compareAndSet(ConductorState.STARTING, ConductorState.RUNNING)) {
        log.info("Conductor started");
      } else {
        log.info("Conductor {} during startup", state.get());
      }
    }
  }

  /**
   * Stops with {@link #DEFAULT_STOP_TIMEOUT}.
   */
  public void stop() {
    stop(DEFAULT_STOP_TIMEOUT);
  }

  /**
   * Stops the admin API and both transport managers in parallel, waiting at most {@code timeout}.
   *
   * <p>Component failures are logged and counted; components still stopping at the deadline are
   * cancelled. Never throws; the conductor ends {@link ConductorState#STOPPED}. A conductor that
   * was never set up, or is already stopping, is left unchanged.</p>
   *
   * @param timeout deadline for all component stops
   */
  public void stop(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative");
    }
    ConductorState current = state.get();
    while (true) {
      if (current == ConductorState.CREATED
          || current == ConductorState.STOPPING
          || current == ConductorState.STOPPED) {
        log.debug("Ignoring stop() in state {}", current);
        return;
      }
      if (state.compareAndSet(current, ConductorState.STOPPING)) {
        break;
      }
      current = state.get();
    }

    Map<String, CompletableFuture<Object>> stops = new LinkedHashMap<>();
    try (TaskQueue shutdown = new TaskQueue("conductor-stop", 0)) {
      AdminServer admin = adminServer;
      if (admin != null) {
        stops.put("administration API", shutdown.run(() -> {
          admin.stop();
          return null;
        }));
      }
      InboundTransportManager inbound = inboundTransportManager;
      if (inbound != null) {
        stops.put("inbound transports", shutdown.run(() -> {
          inbound.stop();
          return null;
        }));
      }
      OutboundTransportManager outbound = outboundTransportManager;
      if (outbound != null) {
        stops.put("outbound transports", shutdown.run(() -> {
          outbound.stop();
          return null;
        }));
      }
      try {
        shutdown.complete(timeout);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for components to stop");
        shutdown.cancelAll();
      }
      stops.forEach((component, future) -> reportStop(component, future, timeout));
    } finally {
      state.set(ConductorState.STOPPED);
    }
    log.info("Conductor stopped");
  }

  /**
   * Inbound router handed to the inbound transport manager. Returns once the message is queued.
   *
   * @param message received message
   * @throws IllegalStateException if called before {@link #setup()}
   */
  public void routeInbound(InboundMessage message) {
    Objects.requireNonNull(message, "message");
    Dispatcher currentDispatcher = dispatcher;
    InboundTransportManager inbound = inboundTransportManager;
    if (currentDispatcher == null || inbound == null) {
      throw new IllegalStateException("Conductor is not set up");
    }
    if (message.receipt().directResponseRequested()
        && !inbound.supportsDirectResponse(message.transportType())) {
      log.warn("Direct response requested, but not supported by transport: {}", message.transportType());
      metrics.increment("conductor.inbound.directResponseUnsupported");
    }
    currentDispatcher.queueMessage(message, this::routeOutbound,
        (task, failure) -> inbound.dispatchComplete(message, task, failure));
    metrics.increment("conductor.inbound.queued");
  }

  /**
   * Outbound router: resolves connection targets when needed and schedules delivery.
   *
   * @param ctx context the message was produced in
   * @param outbound message to deliver
   * @param inbound message being replied to, or {@code null}
   */
  public void routeOutbound(InjectionContext ctx, OutboundMessage outbound, InboundMessage inbound) {
    outboundRouter.route(ctx, outbound, inbound);
  }

  public ConductorState state() {
    return state.get();
  }

  /**
   * @throws IllegalStateException before {@link #setup()} completed
   */
  public InjectionContext context() {
    InjectionContext ctx = context;
    if (ctx == null) {
      throw new IllegalStateException("Conductor is not set up");
    }
    return ctx;
  }

  public Optional<AdminServer> adminServer() {
    return Optional.ofNullable(adminServer);
  }

  public Optional<InboundTransportManager> inboundTransportManager() {
    return Optional.ofNullable(inboundTransportManager);
  }

  public Optional<OutboundTransportManager> outboundTransportManager() {
    return Optional.ofNullable(outboundTransportManager);
  }

  public Optional<Dispatcher> dispatcher() {
    return Optional.ofNullable(dispatcher);
  }

  private void deliverOutbound(InjectionContext ctx, OutboundMessage outbound, InboundMessage inbound) {
    Objects.requireNonNull(outbound, "outbound");
    OutboundTransportManager manager = outboundTransportManager;
    if (manager == null) {
      throw new IllegalStateException("Conductor is not set up");
    }
    Optional<String> connectionId = outbound.connectionId();
    if (!outbound.hasTargets() && connectionId.isPresent()) {
      try {
        outbound.resolveTargets(connectionManager(ctx).getConnectionTargets(connectionId.get()));
      } catch (ConnectionManagerException ex) {
        log.error("Error preparing outbound message for transmission to connection {}", connectionId.get(), ex);
        metrics.increment("conductor.outbound.dropped.unresolved");
        return;
      }
    }
    try {
      manager.deliver(ctx, outbound);
      metrics.increment("conductor.outbound.delivered");
    } catch (OutboundDeliveryException ex) {
      log.warn("Cannot queue message for delivery, no supported transport: {} ({})", outbound, ex.getMessage());
      metrics.increment("conductor.outbound.dropped.noTransport");
    }
  }

  private ConnectionManager connectionManager(InjectionContext ctx) {
    ConnectionManager manager = components.connectionManager(ctx);
    Collector timing = collector;
    return timing == null ? manager : timing.timeConnections(manager);
  }

  private AdminServer createAdminServer(InjectionContext ctx, Dispatcher owner) throws Exception {
    Settings settings = ctx.settings();
    try {
      String host = settings.getString("admin.host", DEFAULT_ADMIN_HOST);
      int port = settings.getInt("admin.port", DEFAULT_ADMIN_PORT);
      AdminServer server = components.adminServer(host, port, ctx, this::routeOutbound, owner::putTask);
      for (String url : settings.getList("admin.webhook_urls")) {
        server.addWebhookTarget(url);
      }
      ctx.injector().bindInstance(AdminServer.class, server);
      return server;
    } catch (Exception ex) {
      log.error("Unable to register admin server", ex);
      throw ex;
    }
  }

  private void instrument(Collector timing) {
    collector = timing;
    outboundRouter = timing.timeRouting(outboundRouter);
    dispatcher.decorateHandler(timing::timeHandling);
  }

  private void startAdminServer() throws Exception {
    AdminServer server = adminServer;
    server.start();
    context.injector().bindInstance(Responder.class, server.responder());
  }

  private void printBanner(Settings settings, AgentIdentity publicIdentity) {
    Map<String, List<String>> sections = new LinkedHashMap<>();
    sections.put("Inbound Transports", inboundTransportManager.registeredTransports());
    List<String> outbound = new ArrayList<>();
    outboundTransportManager.registeredTransports()
        .forEach((name, schemes) -> outbound.add(name + " " + new TreeSet<>(schemes)));
    sections.put("Outbound Transports", outbound);
    sections.put("Public DID Information",
        publicIdentity == null ? List.of() : List.of("DID: " + publicIdentity.did()));
    AdminServer admin = adminServer;
    sections.put("Administration API", admin == null
        ? List.of("disabled")
        : List.of(settings.getString("admin.host", DEFAULT_ADMIN_HOST) + ":"
            + settings.getInt("admin.port", DEFAULT_ADMIN_PORT)));
    LoggingConfigurator.printBanner(console, settings.getString("default_label", "didagent"), sections);
  }

  private void createTestSuiteConnection(InjectionContext ctx, String endpoint) throws Exception {
    ConnectionRecord connection = connectionManager(ctx).createStaticConnection(
        sha256(TEST_SUBJECT_SEED_INPUT), sha256(TEST_SUITE_SEED_INPUT), endpoint, "tester", "test-suite");
    console.println("Created static connection for test suite");
    console.println(" - My DID: " + connection.myDid());
    console.println(" - Their DID: " + connection.theirDid());
    console.println(" - Their endpoint: " + endpoint);
    console.println();
    console.flush();
  }

  private void printInvitation(InjectionContext ctx) throws Exception {
    Settings settings = ctx.settings();
    InvitationResult result = connectionManager(ctx).createInvitation(
        settings.getString("debug.invite_role"),
        settings.getString("debug.invite_label"),
        settings.getBoolean("debug.invite_multi_use", false),
        settings.getBoolean("debug.invite_public", false));
    String baseUrl = settings.getString("invite_base_url");
    if (baseUrl == null || baseUrl.isBlank()) {
      baseUrl = result.invitation().serviceEndpoint() != null
          ? result.invitation().serviceEndpoint()
          : settings.getString("default_endpoint");
    }
    if (baseUrl == null) {
      throw new ConnectionManagerException("No invite_base_url or default_endpoint to build the invitation URL");
    }
    console.println("Invitation URL:");
    console.println(invitationUrls.toUrl(result.invitation(), baseUrl));
    console.println();
    console.flush();
  }

  private void reportStop(String component, CompletableFuture<Object> future, Duration timeout) {
    if (future.isCancelled() || !future.isDone()) {
      log.warn("{} did not stop within {} ms", component, timeout.toMillis());
      metrics.increment("conductor.stop.timeout");
      return;
    }
    if (future.isCompletedExceptionally()) {
      Throwable failure = future.handle((value, error) -> error).join();
      if (failure instanceof CompletionException && failure.getCause() != null) {
        failure = failure.getCause();
      }
      log.warn("Failed to stop {}", component, failure);
      metrics.increment("conductor.stop.failed");
    }
  }

  private void requireState(ConductorState expected, String operation) {
    ConductorState current = state.get();
    if (current != expected) {
      throw new IllegalStateException(operation + " requires state " + expected + " but was " + current);
    }
  }

  static byte[] sha256(String input) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.US_ASCII));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }
}
