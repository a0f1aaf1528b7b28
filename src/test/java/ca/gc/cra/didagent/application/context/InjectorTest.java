package ca.gc.cra.didagent.application.context;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class InjectorTest {

  interface Greeter {
    String greet();
  }

  @Test
  void boundInstanceIsInjected() {
    Injector injector = new Injector();
    Greeter greeter = () -> "hello";

    injector.bindInstance(Greeter.class, greeter);

    assertTrue(injector.isBound(Greeter.class));
    assertSame(greeter, injector.inject(Greeter.class));
    assertSame(greeter, injector.injectIfPresent(Greeter.class).orElseThrow());
  }

  @Test
  void rebindingReplacesInstance() {
    Injector injector = new Injector();
    injector.bindInstance(Greeter.class, () -> "first");

    injector.bindInstance(Greeter.class, () -> "second");

    assertEquals("second", injector.inject(Greeter.class).greet());
  }

  @Test
  void missingBindingThrowsWithCapabilityName() {
    Injector injector = new Injector();

    InjectionException thrown = assertThrows(InjectionException.class, () -> injector.inject(Greeter.class));

    assertSame(Greeter.class, thrown.capability());
    assertFalse(injector.injectIfPresent(Greeter.class).isPresent());
  }

  @Test
  void contextDelegatesToInjectorAndExposesSettings() {
    InjectionContext context = new InjectionContext(Settings.of(Map.of("default_label", "agent")));
    context.injector().bindInstance(Greeter.class, () -> "hi");

    assertEquals("hi", context.inject(Greeter.class).greet());
    assertEquals("agent", context.settings().getString("default_label"));
  }
}
