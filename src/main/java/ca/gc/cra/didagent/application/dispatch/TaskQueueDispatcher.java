package ca.gc.cra.didagent.application.dispatch;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.json.JsonSupport;
import ca.gc.cra.didagent.application.port.CompletionCallback;
import ca.gc.cra.didagent.application.port.ConnectionManager;
import ca.gc.cra.didagent.application.port.Dispatcher;
import ca.gc.cra.didagent.application.port.MessageHandler;
import ca.gc.cra.didagent.application.port.MetricsPort;
import ca.gc.cra.didagent.application.port.OutboundRouter;
import ca.gc.cra.didagent.application.task.TaskQueue;
import ca.gc.cra.didagent.domain.connection.ConnectionRecord;
import ca.gc.cra.didagent.domain.msg.InboundMessage;
import ca.gc.cra.didagent.logging.Logs;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatcher that runs protocol handlers on a {@link TaskQueue}.
 *
 * <p>Handling a message parses its JSON body, resolves the handler for its {@code @type}, looks
 * up the connection it arrived on and invokes the handler with a responder bound to that message.
 * Queued messages share the queue's concurrency cap with {@link #putTask} work.</p>
 *
 * @since 0.1.0
 */
public final class TaskQueueDispatcher implements Dispatcher {
  private static final Logger log = LoggerFactory.getLogger(TaskQueueDispatcher.class);

  private final InjectionContext context;
  private final ProtocolRegistry protocols;
  private final Function<InjectionContext, ConnectionManager> connections;
  private final TaskQueue queue;
  private final JsonSupport json;
  private final MetricsPort metrics;
  private volatile MessageHandler handler = this::process;

  /**
   * @param context agent context handed to handlers
   * @param protocols handler registry
   * @param connections produces a connection manager for the context
   * @param queue queue running messages and tasks
   * @param json JSON codec
   * @param metrics metrics sink
   */
  public TaskQueueDispatcher(
      InjectionContext context,
      ProtocolRegistry protocols,
      Function<InjectionContext, ConnectionManager> connections,
      TaskQueue queue,
      JsonSupport json,
      MetricsPort metrics) {
    this.context = Objects.requireNonNull(context, "context");
    this.protocols = Objects.requireNonNull(protocols, "protocols");
    this.connections = Objects.requireNonNull(connections, "connections");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.json = Objects.requireNonNull(json, "json");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void queueMessage(InboundMessage message, OutboundRouter responder, CompletionCallback onComplete) {
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(responder, "responder");
    Objects.requireNonNull(onComplete, "onComplete");
    queue.put(() -> {
      handler.handleMessage(message, responder);
      return null;
    }, onComplete);
    metrics.increment("dispatch.queued");
  }

  @Override
  public void handleMessage(InboundMessage message, OutboundRouter responder) throws Exception {
    handler.handleMessage(message, responder);
  }

  @Override
  public Future<?> runTask(Callable<?> task) {
    return queue.run(task);
  }

  @Override
  public Future<?> putTask(Callable<?> task) {
    return queue.put(task);
  }

  @Override
  public synchronized void decorateHandler(UnaryOperator<MessageHandler> decorator) {
    handler = Objects.requireNonNull(decorator.apply(handler), "decorated handler");
  }

  private void process(InboundMessage message, OutboundRouter responder) throws Exception {
    Map<String, Object> body;
    try {
      body = json.parseObject(message.payload());
    } catch (IllegalArgumentException ex) {
      metrics.increment("dispatch.rejected.malformed");
      throw new DispatchException("Message " + message.messageId() + " is not a JSON object", ex);
    }
    Object type = body.get("@type");
    if (!(type instanceof String messageType)) {
      metrics.increment("dispatch.rejected.untyped");
      throw new DispatchException("Message " + message.messageId() + " has no @type");
    }
    ProtocolHandler protocolHandler = protocols.resolve(messageType).orElseThrow(() -> {
      metrics.increment("dispatch.rejected.unsupported");
      return new DispatchException("No handler registered for message type " + messageType);
    });
    ConnectionRecord connection = connections.apply(context).findMessageConnection(message).orElse(null);
    if (log.isDebugEnabled()) {
      log.debug("Dispatching {} ({}) via {}: {}",
          message.messageId(), messageType, message.transportType(), Logs.payload(message.payload()));
    }
    long start = System.nanoTime();
    try {
      protocolHandler.handle(new HandlerContext(
          context, message, messageType, body, connection, new MessageResponder(context, message, responder)));
      metrics.increment("dispatch.handled");
    } finally {
      metrics.observe("dispatch.handle.nanos", System.nanoTime() - start);
    }
  }
}
