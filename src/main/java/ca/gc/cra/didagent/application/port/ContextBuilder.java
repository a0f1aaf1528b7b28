package ca.gc.cra.didagent.application.port;

import ca.gc.cra.didagent.application.context.InjectionContext;

/**
 * Produces the injection context a conductor runs in.
 */
@FunctionalInterface
public interface ContextBuilder {
  InjectionContext build() throws Exception;
}
