package ca.gc.cra.didagent.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Exporter options for the agent meter provider.
 *
 * <p>Values resolve from JVM system properties first, then the standard {@code OTEL_*} environment
 * variables, then built-in defaults.</p>
 *
 * @param exporter exporter selection
 * @param endpoint OTLP collector endpoint
 * @param resourceAttributes raw {@code key=value,key=value} resource attributes; may be blank
 * @param exportInterval period between metric exports
 * @since 0.1.0
 */
public record TelemetryOptions(
    ExporterMode exporter, String endpoint, String resourceAttributes, Duration exportInterval) {
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

  public TelemetryOptions {
    Objects.requireNonNull(exporter, "exporter");
    Objects.requireNonNull(endpoint, "endpoint");
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes;
    Objects.requireNonNull(exportInterval, "exportInterval");
    if (exportInterval.isNegative() || exportInterval.isZero()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
  }

  /**
   * Resolves options from system properties and environment.
   *
   * @return effective options
   */
  public static TelemetryOptions fromEnvironment() {
    Properties props = System.getProperties();
    String exporter = firstNonBlank(
        props.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), "otlp");
    String endpoint = firstNonBlank(
        props.getProperty("otel.exporter.otlp.endpoint"),
        System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
        DEFAULT_ENDPOINT);
    String attributes = firstNonBlank(
        props.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"), "");
    return new TelemetryOptions(ExporterMode.from(exporter), endpoint, attributes, DEFAULT_INTERVAL);
  }

  /** Options that disable export entirely. */
  public static TelemetryOptions disabled() {
    return new TelemetryOptions(ExporterMode.NONE, DEFAULT_ENDPOINT, "", DEFAULT_INTERVAL);
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }

  /** Supported metric exporters. */
  public enum ExporterMode {
    OTLP,
    NONE;

    /**
     * Parses an exporter name; unknown names fall back to {@link #OTLP}.
     *
     * @param raw exporter name such as {@code otlp} or {@code none}
     * @return parsed mode
     */
    public static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        default -> OTLP;
      };
    }
  }
}
