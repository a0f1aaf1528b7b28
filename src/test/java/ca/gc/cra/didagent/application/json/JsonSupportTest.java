package ca.gc.cra.didagent.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedObjectGraph() {
    Map<String, Object> parsed = json.parseObject(
        "{\"@type\":\"ping\",\"~thread\":{\"thid\":\"t-1\"},\"keys\":[\"a\",\"b\"],\"n\":3,\"ok\":true,\"x\":null}");

    assertEquals("ping", parsed.get("@type"));
    assertEquals(Map.of("thid", "t-1"), parsed.get("~thread"));
    assertEquals(List.of("a", "b"), parsed.get("keys"));
    assertEquals(3, ((Number) parsed.get("n")).intValue());
    assertEquals(Boolean.TRUE, parsed.get("ok"));
    assertNull(parsed.get("x"));
  }

  @Test
  void writesCompactJsonPreservingInsertionOrder() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("@type", "ping_response");
    body.put("count", 2);
    body.put("tags", List.of("x"));
    body.put("none", null);

    assertEquals("{\"@type\":\"ping_response\",\"count\":2,\"tags\":[\"x\"],\"none\":null}", json.write(body));
  }

  @Test
  void rejectsMalformedOrTrailingContent() {
    assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\":"));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
    assertThrows(IllegalArgumentException.class, () -> json.parse(""));
  }

  @Test
  void parseObjectRejectsNonObjectRoot() {
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("[1,2]"));
  }

  @Test
  void writeRejectsUnsupportedTypes() {
    assertThrows(IllegalArgumentException.class, () -> json.write(Map.of("bytes", new Object())));
    assertEquals("[1,2]", json.write(Arrays.asList(1, 2)));
  }
}
