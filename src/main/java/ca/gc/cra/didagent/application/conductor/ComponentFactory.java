package ca.gc.cra.didagent.application.conductor;

import ca.gc.cra.didagent.application.context.InjectionContext;
import ca.gc.cra.didagent.application.port.AdminServer;
import ca.gc.cra.didagent.application.port.ConnectionManager;
import ca.gc.cra.didagent.application.port.Dispatcher;
import ca.gc.cra.didagent.application.port.InboundRouter;
import ca.gc.cra.didagent.application.port.InboundTransportManager;
import ca.gc.cra.didagent.application.port.LedgerConfigurator;
import ca.gc.cra.didagent.application.port.OutboundRouter;
import ca.gc.cra.didagent.application.port.OutboundTransportManager;
import ca.gc.cra.didagent.application.port.TaskRunner;
import ca.gc.cra.didagent.application.port.WalletConfigurator;
import java.util.function.Function;

/**
 * Creates the collaborators a {@link Conductor} orchestrates.
 *
 * <p>Implemented by the composition root for production and by test doubles in tests.</p>
 */
public interface ComponentFactory {
  /**
   * @param connections supplies connection managers; the conductor passes its own so that
   *     instrumentation applies to lookups made while dispatching
   */
  Dispatcher dispatcher(InjectionContext context, Function<InjectionContext, ConnectionManager> connections);

  InboundTransportManager inboundTransportManager(InjectionContext context, InboundRouter router);

  OutboundTransportManager outboundTransportManager(InjectionContext context, TaskRunner taskRunner);

  /**
   * @throws Exception if the server cannot be constructed for the given address
   */
  AdminServer adminServer(
      String host, int port, InjectionContext context, OutboundRouter router, TaskRunner taskEnqueuer)
      throws Exception;

  ConnectionManager connectionManager(InjectionContext context);

  WalletConfigurator walletConfigurator();

  LedgerConfigurator ledgerConfigurator();
}
