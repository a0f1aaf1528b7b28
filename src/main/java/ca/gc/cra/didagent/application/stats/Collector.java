package ca.gc.cra.didagent.application.stats;

import ca.gc.cra.didagent.application.connection.ConnectionManagerException;
import ca.gc.cra.didagent.application.port.ConnectionManager;
import ca.gc.cra.didagent.application.port.MessageHandler;
import ca.gc.cra.didagent.application.port.MetricsPort;
import ca.gc.cra.didagent.application.port.OutboundRouter;
import ca.gc.cra.didagent.domain.connection.ConnectionRecord;
import ca.gc.cra.didagent.domain.connection.ConnectionTarget;
import ca.gc.cra.didagent.domain.connection.DidDocument;
import ca.gc.cra.didagent.domain.msg.InboundMessage;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> Timing collector counting calls and measuring wall-clock time of the
 * conductor's hot paths.
 * <p><strong>Role:</strong> Bound into the injection context when timing is enabled; the conductor
 * decorates the outbound router, the dispatcher's handler and every connection manager it hands
 * out.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@link #timeRouting}, {@link #timeHandling} and {@link #timeConnections} return typed
 *   decorators; {@link #time} measures an arbitrary call.</li>
 *   <li>Forward each measurement to the {@link MetricsPort} as {@code <key>.calls} and
 *   {@code <key>.nanos}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> safe for concurrent use; per-key aggregation is synchronized.</p>
 *
 * @since 0.1.0
 */
public final class Collector {
  public static final String ROUTE_KEY = "OutboundRouter.route";
  public static final String HANDLE_KEY = "MessageHandler.handleMessage";
  public static final String TARGETS_KEY = "ConnectionManager.getConnectionTargets";
  public static final String DID_DOCUMENT_KEY = "ConnectionManager.fetchDidDocument";
  public static final String FIND_CONNECTION_KEY = "ConnectionManager.findMessageConnection";

  private final MetricsPort metrics;
  private final ConcurrentMap<String, Accumulator> results = new ConcurrentHashMap<>();

  public Collector() {
    this(MetricsPort.NO_OP);
  }

  public Collector(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /** Call measured by {@link #time}. */
  @FunctionalInterface
  public interface TimedCall<T, X extends Exception> {
    T call() throws X;
  }

  /**
   * Runs {@code call} and records its duration under {@code key}, whether it returns or throws.
   *
   * @throws X the failure of {@code call}, unchanged
   */
  public <T, X extends Exception> T time(String key, TimedCall<T, X> call) throws X {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(call, "call");
    long start = System.nanoTime();
    try {
      return call.call();
    } finally {
      record(key, System.nanoTime() - start);
    }
  }

  public OutboundRouter timeRouting(OutboundRouter router) {
    Objects.requireNonNull(router, "router");
    return (context, outbound, inbound) -> time(ROUTE_KEY, () -> {
      router.route(context, outbound, inbound);
      return null;
    });
  }

  public MessageHandler timeHandling(MessageHandler handler) {
    Objects.requireNonNull(handler, "handler");
    return (message, responder) -> time(HANDLE_KEY, () -> {
      handler.handleMessage(message, responder);
      return null;
    });
  }

  /**
   * Times target resolution, DID document lookup and message connection lookup; invitation and
   * static connection creation pass through.
   */
  public ConnectionManager timeConnections(ConnectionManager manager) {
    return new TimedConnectionManager(Objects.requireNonNull(manager, "manager"));
  }

  /**
   * @return snapshot of timings keyed by {@code SimpleTypeName.method}, sorted by key
   */
  public Map<String, CallStats> results() {
    Map<String, CallStats> snapshot = new TreeMap<>();
    results.forEach((key, accumulator) -> snapshot.put(key, accumulator.snapshot()));
    return Collections.unmodifiableMap(snapshot);
  }

  public void reset() {
    results.clear();
  }

  private void record(String key, long nanos) {
    results.computeIfAbsent(key, k -> new Accumulator()).add(nanos);
    metrics.increment(key + ".calls");
    metrics.observe(key + ".nanos", nanos);
  }

  private final class TimedConnectionManager implements ConnectionManager {
    private final ConnectionManager delegate;

    private TimedConnectionManager(ConnectionManager delegate) {
      this.delegate = delegate;
    }

    @Override
    public List<ConnectionTarget> getConnectionTargets(String connectionId) throws ConnectionManagerException {
      return time(TARGETS_KEY, () -> delegate.getConnectionTargets(connectionId));
    }

    @Override
    public ConnectionRecord createStaticConnection(
        byte[] mySeed, byte[] theirSeed, String theirEndpoint, String theirRole, String alias)
        throws ConnectionManagerException {
      return delegate.createStaticConnection(mySeed, theirSeed, theirEndpoint, theirRole, alias);
    }

    @Override
    public InvitationResult createInvitation(
        String theirRole, String myLabel, boolean multiUse, boolean publicInvitation)
        throws ConnectionManagerException {
      return delegate.createInvitation(theirRole, myLabel, multiUse, publicInvitation);
    }

    @Override
    public Optional<ConnectionRecord> findMessageConnection(InboundMessage message) {
      return time(FIND_CONNECTION_KEY, () -> delegate.findMessageConnection(message));
    }

    @Override
    public Optional<DidDocument> fetchDidDocument(String did) {
      return time(DID_DOCUMENT_KEY, () -> delegate.fetchDidDocument(did));
    }

    @Override
    public String toString() {
      return "Timed[" + delegate + "]";
    }
  }

  private static final class Accumulator {
    private long count;
    private long total;
    private long min = Long.MAX_VALUE;
    private long max;

    synchronized void add(long nanos) {
      count++;
      total += nanos;
      min = Math.min(min, nanos);
      max = Math.max(max, nanos);
    }

    synchronized CallStats snapshot() {
      return new CallStats(count, total, count == 0 ? 0 : min, max);
    }
  }
}
