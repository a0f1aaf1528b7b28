package ca.gc.cra.didagent.application.port;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.domain.connection.AgentIdentity;

/**
 * Connects the agent to its ledger, if one is configured.
 */
@FunctionalInterface
public interface LedgerConfigurator {
  /**
   * @param publicIdentity identity returned by wallet configuration, or {@code null}
   */
  void configure(InjectionContext context, AgentIdentity publicIdentity) throws Exception;
}
