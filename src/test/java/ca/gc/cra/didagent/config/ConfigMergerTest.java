package ca.gc.cra.didagent.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.didagent.application.context.Settings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, Object> yaml = Map.of("default_label", "yaml-label", "admin.port", 8021);
    Map<String, String> cli = Map.of("default_label", "cli-label");
    List<String> warnings = new ArrayList<>();

    Settings merged = ConfigMerger.buildEffectiveSettings(
        Optional.of(yaml), cli, AgentDefaults.defaults(), warnings::add);

    assertEquals("cli-label", merged.getString("default_label"));
    assertEquals(8021, merged.getInt("admin.port", 0));
    assertEquals(List.of("CLI overrides YAML for key: default_label"), warnings);
  }

  @Test
  void defaultsApplyWhenNothingElseIsSet() {
    Settings merged = ConfigMerger.buildEffectiveSettings(
        Optional.empty(), Map.of(), AgentDefaults.defaults(), msg -> {});

    assertEquals("didagent", merged.getString("default_label"));
    assertEquals(List.of("loopback"), merged.getList("transport.inbound"));
    assertEquals(AgentDefaults.DEFAULT_SHUTDOWN_TIMEOUT_MS, merged.getLong("shutdown.timeout_ms", 0));
    assertTrue(merged.getInt("dispatch.max_active", 0) > 0);
  }

  @Test
  void cliKeyWithoutYamlCounterpartDoesNotWarn() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveSettings(
        Optional.of(Map.of()), Map.of("admin.port", "9000"), AgentDefaults.defaults(), warnings::add);

    assertTrue(warnings.isEmpty());
  }

  @Test
  void adminPortOutOfRangeIsRejectedWhenAdminEnabled() {
    Map<String, String> cli = Map.of("admin.enabled", "true", "admin.port", "70000");

    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveSettings(
        Optional.empty(), cli, AgentDefaults.defaults(), msg -> {}));
  }

  @Test
  void adminSettingsIgnoredWhenAdminDisabled() {
    Settings merged = ConfigMerger.buildEffectiveSettings(
        Optional.empty(), Map.of("admin.port", "70000"), AgentDefaults.defaults(), msg -> {});

    assertEquals(70000, merged.getInt("admin.port", 0));
  }

  @Test
  void webhookUrlsMustBeHttp() {
    Map<String, String> cli = Map.of("admin.enabled", "true", "admin.webhook_urls", "http://ok.example,ftp://bad");

    IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveSettings(Optional.empty(), cli, AgentDefaults.defaults(), msg -> {}));

    assertTrue(thrown.getMessage().startsWith("admin.webhook_urls"));
  }

  @Test
  void publicAndMultiUseInvitationsAreMutuallyExclusive() {
    Map<String, String> cli = Map.of("debug.invite_public", "true", "debug.invite_multi_use", "true");

    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveSettings(
        Optional.empty(), cli, AgentDefaults.defaults(), msg -> {}));
  }

  @Test
  void labelMustBePrintableAscii() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveSettings(
        Optional.empty(), Map.of("default_label", "café"), AgentDefaults.defaults(), msg -> {}));
  }

  @Test
  void booleanFlagsMustParse() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveSettings(
        Optional.empty(), Map.of("timing.enabled", "sometimes"), AgentDefaults.defaults(), msg -> {}));
  }

  @Test
  void shutdownTimeoutBounded() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveSettings(
        Optional.empty(), Map.of("shutdown.timeout_ms", "-1"), AgentDefaults.defaults(), msg -> {}));
  }
}
