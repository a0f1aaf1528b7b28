package ca.gc.cra.didagent.infrastructure.wallet;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.context.Settings;
import ca.gc.cra.didagent.domain.connection.AgentIdentity;
import ca.gc.cra.didagent.infrastructure.connection.DidKeys;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SeedWalletConfiguratorTest {
  private static final String SEED = "00000000000000000000000000000My1";

  @Test
  void asciiSeedBindsPublicIdentity() {
    InjectionContext context = new InjectionContext(Settings.of(Map.of(SeedWalletConfigurator.SEED_SETTING, SEED)));

    AgentIdentity identity = new SeedWalletConfigurator().configure(context).orElseThrow();

    assertEquals(DidKeys.fromSeed(SEED.getBytes(StandardCharsets.US_ASCII)), identity);
    assertEquals(identity, context.inject(AgentIdentity.class));
  }

  @Test
  void base64SeedIsDecoded() {
    byte[] raw = new byte[32];
    raw[31] = 7;

    assertArrayEquals(raw, SeedWalletConfigurator.seedBytes(Base64.getEncoder().encodeToString(raw)));
  }

  @Test
  void missingSeedLeavesAgentWithoutPublicDid() {
    InjectionContext context = new InjectionContext(Settings.empty());

    assertFalse(new SeedWalletConfigurator().configure(context).isPresent());
    assertFalse(context.injectIfPresent(AgentIdentity.class).isPresent());
  }

  @Test
  void malformedSeedIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> SeedWalletConfigurator.seedBytes("too-short"));
    assertThrows(IllegalArgumentException.class, () -> SeedWalletConfigurator.seedBytes("c2hvcnQ="));
  }
}
