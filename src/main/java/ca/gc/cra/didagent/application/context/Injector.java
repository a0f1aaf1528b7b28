package ca.gc.cra.didagent.application.context;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Capability registry mapping an interface type to its bound instance.
 *
 * <p>Rebinding a type replaces the previous instance. Lookups are by exact type.</p>
 *
 * <p><strong>Thread-safety:</strong> backed by a concurrent map; bindings made during startup are
 * visible to transport and dispatcher threads.</p>
 */
public final class Injector {
  private final ConcurrentMap<Class<?>, Object> bindings = new ConcurrentHashMap<>();

  /**
   * Binds {@code instance} as the provider of {@code type}.
   *
   * @param type capability type
   * @param instance implementation
   * @param <T> capability type
   */
  public <T> void bindInstance(Class<T> type, T instance) {
    Objects.requireNonNull(type, "type");
    bindings.put(type, type.cast(Objects.requireNonNull(instance, "instance")));
  }

  /**
   * Returns the bound instance.
   *
   * @throws InjectionException if nothing is bound for {@code type}
   */
  public <T> T inject(Class<T> type) {
    return injectIfPresent(type).orElseThrow(() -> new InjectionException(type));
  }

  public <T> Optional<T> injectIfPresent(Class<T> type) {
    Objects.requireNonNull(type, "type");
    return Optional.ofNullable(bindings.get(type)).map(type::cast);
  }

  public boolean isBound(Class<?> type) {
    return bindings.containsKey(type);
  }
}
