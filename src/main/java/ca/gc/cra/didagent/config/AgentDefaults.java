package ca.gc.cra.didagent.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in settings applied beneath YAML and CLI values.
 */
public final class AgentDefaults {
  public static final String SECTION = "agent";
  public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 1_000L;

  private AgentDefaults() {}

  /**
   * @return a fresh mutable copy of the defaults
   */
  public static Map<String, Object> defaults() {
    Map<String, Object> defaults = new LinkedHashMap<>();
    defaults.put("default_label", "didagent");
    defaults.put("admin.enabled", false);
    defaults.put("admin.host", "0.0.0.0");
    defaults.put("admin.port", 80);
    defaults.put("timing.enabled", false);
    defaults.put("transport.inbound", List.of("loopback"));
    defaults.put("transport.outbound", List.of("loopback"));
    defaults.put("dispatch.max_active", 2 * Runtime.getRuntime().availableProcessors());
    defaults.put("shutdown.timeout_ms", DEFAULT_SHUTDOWN_TIMEOUT_MS);
    return defaults;
  }
}
