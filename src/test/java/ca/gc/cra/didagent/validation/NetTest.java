package ca.gc.cra.didagent.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void requireHostAcceptsHostname() {
    assertEquals("agent.example.com", Net.requireHost("admin.host", " agent.example.com "));
  }

  @Test
  void requireHostAcceptsIpv4() {
    assertEquals("0.0.0.0", Net.requireHost("admin.host", "0.0.0.0"));
  }

  @Test
  void requireHostStripsIpv6Brackets() {
    assertEquals("::1", Net.requireHost("admin.host", "[::1]"));
  }

  @Test
  void requireHostRejectsBadOctet() {
    assertThrows(IllegalArgumentException.class, () -> Net.requireHost("admin.host", "10.0.0.300"));
  }

  @Test
  void requireHostRejectsIllegalLabel() {
    assertThrows(IllegalArgumentException.class, () -> Net.requireHost("admin.host", "bad_host.example"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireHost("admin.host", "-lead.example"));
  }

  @Test
  void requirePortAllowsEphemeralAndRejectsOutOfRange() {
    assertEquals(0, Net.requirePort("admin.port", 0));
    assertThrows(IllegalArgumentException.class, () -> Net.requirePort("admin.port", 65536));
  }

  @Test
  void requireHttpUrlAcceptsHttpAndHttps() {
    assertEquals("https://hooks.example/topic", Net.requireHttpUrl("url", " https://hooks.example/topic "));
  }

  @Test
  void requireHttpUrlRejectsOtherSchemesAndMissingHost() {
    assertThrows(IllegalArgumentException.class, () -> Net.requireHttpUrl("url", "ws://hooks.example"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireHttpUrl("url", "http:///path"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireHttpUrl("url", "http://bad host"));
  }
}
