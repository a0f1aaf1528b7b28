package ca.gc.cra.didagent.api;

import ca.gc.cra.didagent.application.conductor.Conductor;
import ca.gc.cra.didagent.application.context.Settings;
import ca.gc.cra.didagent.config.AgentDefaults;
import ca.gc.cra.didagent.config.CompositionRoot;
import ca.gc.cra.didagent.config.ConfigMerger;
import ca.gc.cra.didagent.config.YamlConfigLoader;
import ca.gc.cra.didagent.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.didagent.infrastructure.metrics.TelemetryOptions;
import ca.gc.cra.didagent.logging.LoggingConfigurator;
import ca.gc.cra.didagent.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the agent conductor and keeps it running until the JVM shuts down.
 *
 * @since 0.1.0
 */
public final class StartCli {
  private static final Logger log = LoggerFactory.getLogger(StartCli.class);
  private static final String SUMMARY_USAGE =
      "usage: start [config=PATH] [key=value ...] [--dry-run] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      Agent conductor

      Usage:
        start [config=PATH] [key=value ...]

      Settings (YAML keys under 'agent', or key=value on the command line):
        default_label=NAME            Agent label used in invitations (default didagent)
        default_endpoint=URL          Endpoint advertised in invitations
        transport.inbound=a,b         Inbound transports to listen on (default loopback)
        transport.outbound=a,b        Outbound transports to send with (default loopback)
        admin.enabled=true|false      Start the administration API (default false)
        admin.host=HOST               Administration bind host (default 0.0.0.0)
        admin.port=0-65535            Administration port (default 80)
        admin.webhook_urls=URL,...    Webhook targets for agent events
        wallet.seed=SEED              32-character seed for the public DID
        ledger.genesis_file=PATH      Genesis transactions file
        ledger.genesis_url=URL        Genesis transactions URL
        ledger.read_only=true|false   Do not publish the public DID
        timing.enabled=true|false     Record call timings for core operations
        dispatch.max_active=N         Concurrent message handlers (0 = unbounded)
        shutdown.timeout_ms=N         Time allowed for transports to stop (default 1000)
        debug.print_invitation=true   Print an invitation URL after startup
        debug.invite_role, debug.invite_label, debug.invite_multi_use, debug.invite_public
        debug.test_suite_endpoint=URL Create a static connection for a protocol test suite
        invite_base_url=URL           Base URL for printed invitations

      Flags:
        --dry-run                     Print the effective settings and exit
        --verbose                     Enable DEBUG logging
        --help                        Show this message

      Telemetry:
        metricsExporter=otlp|none     Metrics exporter (default otlp)
        otelEndpoint=URL              OTLP metrics endpoint
        otelResourceAttributes=K=V    Comma-separated OTel resource attributes
      """;

  private StartCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the agent until shutdown and returns the exit code.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for start command");
    }

    Map<String, String> kv;
    TelemetryOptions telemetry;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      telemetry = TelemetryConfigurator.resolve(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = CliArgsParser.extractConfigPath(kv);
    Settings settings;
    try {
      settings = loadSettings(configPath, kv);
    } catch (IOException ex) {
      log.error("Unable to read configuration {}", configPath, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    if (input.hasFlag("--dry-run")) {
      printEffectiveSettings(settings);
      return ExitCode.SUCCESS;
    }
    return runConductor(settings, telemetry);
  }

  static Settings loadSettings(String configPath, Map<String, String> cli) throws IOException {
    Optional<Map<String, Object>> yaml = Optional.empty();
    if (configPath != null) {
      Path path = Path.of(configPath);
      if (!Files.isRegularFile(path)) {
        throw new IOException("Configuration file not found: " + path);
      }
      yaml = YamlConfigLoader.load(path, AgentDefaults.SECTION);
    }
    return ConfigMerger.buildEffectiveSettings(yaml, cli, AgentDefaults.defaults(), log::warn);
  }

  private static ExitCode runConductor(Settings settings, TelemetryOptions telemetry) {
    OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(telemetry);
    CompositionRoot root = new CompositionRoot(settings, metrics);
    Conductor conductor = new Conductor(root, root, CliPrinter.writer());
    Duration stopTimeout = Duration.ofMillis(
        settings.getLong("shutdown.timeout_ms", AgentDefaults.DEFAULT_SHUTDOWN_TIMEOUT_MS));
    CountDownLatch stopped = new CountDownLatch(1);

    try {
      conductor.setup();
      conductor.start();
    } catch (IOException ex) {
      log.error("Agent startup I/O failure", ex);
      shutdown(conductor, metrics, stopTimeout);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Agent configuration error: {}", ex.getMessage(), ex);
      shutdown(conductor, metrics, stopTimeout);
      return ExitCode.CONFIG_ERROR;
    } catch (Exception ex) {
      log.error("Agent startup failed", ex);
      shutdown(conductor, metrics, stopTimeout);
      return ExitCode.RUNTIME_FAILURE;
    }

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      log.info("Shutdown requested; stopping agent");
      shutdown(conductor, metrics, stopTimeout);
      stopped.countDown();
    }, "didagent-shutdown"));

    try {
      stopped.await();
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Agent interrupted; shutting down", ex);
      shutdown(conductor, metrics, stopTimeout);
      return ExitCode.INTERRUPTED;
    }
  }

  private static void shutdown(Conductor conductor, OpenTelemetryMetricsAdapter metrics, Duration timeout) {
    try {
      conductor.stop(timeout);
    } finally {
      metrics.close();
    }
  }

  private static void printEffectiveSettings(Settings settings) {
    List<String> lines = new ArrayList<>();
    lines.add("Dry run: effective settings (agent not started)");
    new TreeMap<>(settings.asMap()).forEach((key, value) ->
        lines.add(" " + key + " = " + (key.startsWith("wallet.") ? "<redacted>" : Logs.truncate(String.valueOf(value), 96))));
    CliPrinter.printLines(lines.toArray(String[]::new));
  }
}
