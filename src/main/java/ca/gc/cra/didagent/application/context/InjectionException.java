package ca.gc.cra.didagent.application.context;

/**
 * Raised when a required capability has no binding in the {@link Injector}.
 */
public final class InjectionException extends RuntimeException {
  private final Class<?> capability;

  public InjectionException(Class<?> capability) {
    super("No instance bound for " + capability.getName());
    this.capability = capability;
  }

  public Class<?> capability() {
    return capability;
  }
}
