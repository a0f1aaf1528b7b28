package ca.gc.cra.didagent.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterCounterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("didagent.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAndServiceResource() {
    adapter.increment("conductor.inbound.queued");
    adapter.increment("conductor.inbound.queued");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "conductor.inbound.queued");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("conductor.inbound.queued", point.getAttributes().get(METRIC_KEY));

    assertEquals("didagent", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void keysAreSanitizedIntoInstrumentNames() {
    adapter.increment("conductor.outbound.dropped.noTransport");
    adapter.increment("1st key/with spaces");
    adapter.forceFlush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    LongPointData camel = find(metrics, "conductor.outbound.dropped.notransport")
        .getLongSumData().getPoints().iterator().next();
    assertEquals("conductor.outbound.dropped.noTransport", camel.getAttributes().get(METRIC_KEY));
    LongPointData odd = find(metrics, "m1st_key_with_spaces").getLongSumData().getPoints().iterator().next();
    assertEquals("1st key/with spaces", odd.getAttributes().get(METRIC_KEY));
  }

  @Test
  void sanitizeFallsBackForBlankKeys() {
    assertEquals("didagent.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("dispatch.handled", OpenTelemetryMetricsAdapter.sanitizeName(" Dispatch.Handled "));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match.orElseThrow();
  }
}
