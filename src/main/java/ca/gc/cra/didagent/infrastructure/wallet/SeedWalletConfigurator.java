package ca.gc.cra.didagent.infrastructure.wallet;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.port.WalletConfigurator;
import ca.gc.cra.didagent.domain.connection.AgentIdentity;
import ca.gc.cra.didagent.infrastructure.connection.DidKeys;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the public DID from the {@code wallet.seed} setting and binds it into the context.
 *
 * <p>The seed is either 32 ASCII characters or the Base64 encoding of 32 bytes.</p>
 */
public final class SeedWalletConfigurator implements WalletConfigurator {
  private static final Logger log = LoggerFactory.getLogger(SeedWalletConfigurator.class);
  public static final String SEED_SETTING = "wallet.seed";

  @Override
  public Optional<AgentIdentity> configure(InjectionContext context) {
    String seed = context.settings().getString(SEED_SETTING);
    if (seed == null || seed.isBlank()) {
      log.info("No wallet seed configured; agent has no public DID");
      return Optional.empty();
    }
    AgentIdentity identity = DidKeys.fromSeed(seedBytes(seed));
    context.injector().bindInstance(AgentIdentity.class, identity);
    log.info("Wallet configured with public DID {}", identity.did());
    return Optional.of(identity);
  }

  static byte[] seedBytes(String seed) {
    byte[] raw = seed.getBytes(StandardCharsets.US_ASCII);
    if (raw.length == DidKeys.SEED_LENGTH) {
      return raw;
    }
    try {
      byte[] decoded = Base64.getDecoder().decode(seed);
      if (decoded.length == DidKeys.SEED_LENGTH) {
        return decoded;
      }
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(SEED_SETTING + " must be 32 characters or base64 of 32 bytes", ex);
    }
    throw new IllegalArgumentException(SEED_SETTING + " must be 32 characters or base64 of 32 bytes");
  }
}
