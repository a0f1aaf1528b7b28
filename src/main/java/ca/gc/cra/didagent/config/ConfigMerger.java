package ca.gc.cra.didagent.config;

import ca.gc.cra.didagent.application.context.Settings;
import ca.gc.cra.didagent.validation.Net;
import ca.gc.cra.didagent.validation.Numbers;
import ca.gc.cra.didagent.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults and validates
 * the result.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults built-in defaults
   * @param warn receives a note for each CLI key that overrides a YAML key; may be {@code null}
   * @return validated settings
   * @throws IllegalArgumentException when validation fails
   */
  public static Settings buildEffectiveSettings(
      Optional<Map<String, Object>> yaml,
      Map<String, String> cli,
      Map<String, Object> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, Object> yamlValues = yaml.orElse(Map.of());
    Map<String, Object> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        if (yamlValues.containsKey(entry.getKey()) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    Settings settings = Settings.of(merged);
    validate(settings);
    return settings;
  }

  /**
   * Validates cross-key constraints and value formats.
   *
   * @throws IllegalArgumentException on the first invalid setting
   */
  public static void validate(Settings settings) {
    if (settings.getBoolean("admin.enabled", false)) {
      Net.requireHost("admin.host", settings.getString("admin.host", "0.0.0.0"));
      Net.requirePort("admin.port", settings.getInt("admin.port", 80));
      for (String url : settings.getList("admin.webhook_urls")) {
        Net.requireHttpUrl("admin.webhook_urls", url);
      }
    }
    Strings.requirePrintableAscii("default_label", settings.getString("default_label", "didagent"), 128);
    Numbers.requireRange("dispatch.max_active", settings.getInt("dispatch.max_active", 0), 0, 10_000);
    Numbers.requireRange("shutdown.timeout_ms", settings.getLong("shutdown.timeout_ms", 0), 0, 3_600_000);
    if (settings.getBoolean("debug.invite_public", false) && settings.getBoolean("debug.invite_multi_use", false)) {
      throw new IllegalArgumentException("debug.invite_public and debug.invite_multi_use cannot both be set");
    }
    settings.getBoolean("timing.enabled", false);
    settings.getBoolean("ledger.read_only", false);
    settings.getBoolean("debug.print_invitation", false);
  }
}
