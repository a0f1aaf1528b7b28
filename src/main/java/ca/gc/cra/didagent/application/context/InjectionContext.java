package ca.gc.cra.didagent.application.context;

import java.util.Objects;
import java.util.Optional;

/**
 * Settings plus capability registry handed to every agent component.
 *
 * <p>One context is built per conductor. Components share it, so bindings added after setup (the
 * admin server, the responder) become visible to every holder.</p>
 */
public final class InjectionContext {
  private final Settings settings;
  private final Injector injector;

  public InjectionContext(Settings settings) {
    this(settings, new Injector());
  }

  public InjectionContext(Settings settings, Injector injector) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.injector = Objects.requireNonNull(injector, "injector");
  }

  public Settings settings() {
    return settings;
  }

  public Injector injector() {
    return injector;
  }

  public <T> T inject(Class<T> type) {
    return injector.inject(type);
  }

  public <T> Optional<T> injectIfPresent(Class<T> type) {
    return injector.injectIfPresent(type);
  }
}
