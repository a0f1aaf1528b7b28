package ca.gc.cra.didagent.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LoggingConfiguratorTest {

  @Test
  void bannerFramesSectionsAndMarksEmptyOnes() {
    StringWriter buffer = new StringWriter();
    Map<String, List<String>> sections = new LinkedHashMap<>();
    sections.put("Inbound Transports", List.of("loopback"));
    sections.put("Public DID Information", List.of());

    LoggingConfigurator.printBanner(new PrintWriter(buffer), "alice", sections);

    List<String> lines = buffer.toString().lines().filter(line -> !line.isEmpty()).toList();
    assertEquals(":".repeat(60), lines.get(0));
    assertEquals(LoggingConfigurator.bannerLine("alice"), lines.get(1));
    assertTrue(lines.contains(LoggingConfigurator.bannerLine("  - loopback")));
    assertTrue(lines.contains(LoggingConfigurator.bannerLine("  - none")));
    assertEquals(":".repeat(60), lines.get(lines.size() - 1));
  }

  @Test
  void bannerLinesArePaddedAndClipped() {
    assertEquals(60, LoggingConfigurator.bannerLine("short").length());
    assertEquals(60, LoggingConfigurator.bannerLine("x".repeat(200)).length());
  }
}
