package ca.gc.cra.didagent.infrastructure.admin;

import ca.gc.cra.didagent.application.json.JsonSupport;
import ca.gc.cra.didagent.application.port.MetricsPort;
import ca.gc.cra.didagent.application.port.TaskRunner;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts controller events to webhook targets as {@code POST <target>/topic/<topic>/} with a JSON
 * body. Each post runs as a dispatcher task; a failed post is logged and not retried.
 */
final class WebhookEmitter {
  private static final Logger log = LoggerFactory.getLogger(WebhookEmitter.class);
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

  private final Supplier<List<String>> targets;
  private final TaskRunner taskEnqueuer;
  private final HttpClient client;
  private final JsonSupport json;
  private final MetricsPort metrics;

  WebhookEmitter(
      Supplier<List<String>> targets,
      TaskRunner taskEnqueuer,
      HttpClient client,
      JsonSupport json,
      MetricsPort metrics) {
    this.targets = Objects.requireNonNull(targets, "targets");
    this.taskEnqueuer = Objects.requireNonNull(taskEnqueuer, "taskEnqueuer");
    this.client = Objects.requireNonNull(client, "client");
    this.json = Objects.requireNonNull(json, "json");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  void emit(String topic, Map<String, Object> payload) {
    Objects.requireNonNull(topic, "topic");
    String body = json.write(payload);
    for (String target : targets.get()) {
      taskEnqueuer.run(() -> {
        post(target, topic, body);
        return null;
      });
    }
  }

  static URI topicUri(String target, String topic) {
    String base = target.endsWith("/") ? target.substring(0, target.length() - 1) : target;
    return URI.create(base + "/topic/" + topic + "/");
  }

  private void post(String target, String topic, String body) throws InterruptedException {
    HttpRequest request = HttpRequest.newBuilder(topicUri(target, topic))
        .timeout(REQUEST_TIMEOUT)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .build();
    try {
      HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
      if (response.statusCode() >= 400) {
        metrics.increment("admin.webhook.rejected");
        log.warn("Webhook {} rejected {} event with status {}", target, topic, response.statusCode());
      } else {
        metrics.increment("admin.webhook.sent");
      }
    } catch (IOException ex) {
      metrics.increment("admin.webhook.failed");
      log.warn("Failed to post {} event to webhook {}", topic, target, ex);
    }
  }
}
