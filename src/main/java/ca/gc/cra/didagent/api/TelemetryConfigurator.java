package ca.gc.cra.didagent.api;

import ca.gc.cra.didagent.infrastructure.metrics.TelemetryOptions;
import ca.gc.cra.didagent.validation.Net;
import ca.gc.cra.didagent.validation.Strings;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves metrics exporter options from CLI arguments layered over the environment.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Removes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from
   * {@code args} and applies them over {@link TelemetryOptions#fromEnvironment()}.
   *
   * @param args mutable CLI map
   * @return effective exporter options
   * @throws IllegalArgumentException if a telemetry argument is invalid
   */
  static TelemetryOptions resolve(Map<String, String> args) {
    TelemetryOptions base = TelemetryOptions.fromEnvironment();
    TelemetryOptions.ExporterMode exporter = base.exporter();
    String endpoint = base.endpoint();
    String attributes = base.resourceAttributes();

    String rawExporter = blankToNull(args.remove("metricsExporter"));
    if (rawExporter != null) {
      String normalized = rawExporter.toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      exporter = TelemetryOptions.ExporterMode.from(normalized);
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
    }

    String rawEndpoint = blankToNull(args.remove("otelEndpoint"));
    if (rawEndpoint != null) {
      endpoint = Net.requireHttpUrl("otelEndpoint", rawEndpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
    }

    String rawAttributes = blankToNull(args.remove("otelResourceAttributes"));
    if (rawAttributes != null) {
      attributes = Strings.requirePrintableAscii(
          "otelResourceAttributes", rawAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    return new TelemetryOptions(exporter, endpoint, attributes, base.exportInterval());
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
