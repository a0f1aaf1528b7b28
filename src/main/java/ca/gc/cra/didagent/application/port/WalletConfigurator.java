package ca.gc.cra.didagent.application.port;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.domain.connection.AgentIdentity;
import java.util.Optional;

/**
 * Opens or provisions the agent wallet.
 */
@FunctionalInterface
public interface WalletConfigurator {
  /**
   * @return the agent's public identity, when the wallet holds one
   */
  Optional<AgentIdentity> configure(InjectionContext context) throws Exception;
}
