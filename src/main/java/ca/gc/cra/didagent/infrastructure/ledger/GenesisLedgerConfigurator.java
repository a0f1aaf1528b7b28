package ca.gc.cra.didagent.infrastructure.ledger;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.context.Settings;
import ca.gc.cra.didagent.application.port.LedgerConfigurator;
import ca.gc.cra.didagent.domain.connection.AgentIdentity;
import ca.gc.cra.didagent.validation.Net;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the ledger settings and records the genesis source the agent connects with.
 *
 * <p>With no genesis configured the agent runs ledger-less, which is allowed only when it has no
 * public DID or the ledger is marked read-only.</p>
 */
public final class GenesisLedgerConfigurator implements LedgerConfigurator {
  private static final Logger log = LoggerFactory.getLogger(GenesisLedgerConfigurator.class);

  @Override
  public void configure(InjectionContext context, AgentIdentity publicIdentity) throws IOException {
    Settings settings = context.settings();
    String genesisFile = settings.getString("ledger.genesis_file");
    String genesisUrl = settings.getString("ledger.genesis_url");
    boolean readOnly = settings.getBoolean("ledger.read_only", false);

    LedgerGenesis genesis;
    if (genesisFile != null && !genesisFile.isBlank()) {
      Path path = Path.of(genesisFile);
      String transactions = Files.readString(path, StandardCharsets.UTF_8);
      if (transactions.isBlank()) {
        throw new IllegalArgumentException("Genesis file " + path + " is empty");
      }
      genesis = new LedgerGenesis(path.toString(), transactions.lines().filter(l -> !l.isBlank()).count(), readOnly);
    } else if (genesisUrl != null && !genesisUrl.isBlank()) {
      Net.requireHttpUrl("ledger.genesis_url", genesisUrl);
      genesis = new LedgerGenesis(genesisUrl, 0, readOnly);
    } else {
      if (publicIdentity != null && !readOnly) {
        throw new IllegalStateException(
            "Public DID " + publicIdentity.did() + " requires ledger.genesis_file or ledger.genesis_url");
      }
      log.info("No ledger configured");
      return;
    }
    context.injector().bindInstance(LedgerGenesis.class, genesis);
    log.info("Ledger configured from {} (read-only: {})", genesis.source(), readOnly);
    if (publicIdentity != null && !readOnly) {
      log.info("Public DID {} will be published to the ledger", publicIdentity.did());
    }
  }

  /**
   * Genesis source selected for the ledger.
   *
   * @param source file path or URL
   * @param transactions genesis transaction count when read from a file, otherwise {@code 0}
   * @param readOnly whether writes are disabled
   */
  public record LedgerGenesis(String source, long transactions, boolean readOnly) {}
}
