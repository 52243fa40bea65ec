package ca.gc.cra.faultline.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesNestedStructures() {
    Map<String, Object> parsed = json.parseObject("{\"id\":\"abc\",\"list\":[1,true,null],\"obj\":{\"k\":\"v\"}}");

    assertEquals("abc", parsed.get("id"));
    List<?> list = (List<?>) parsed.get("list");
    assertEquals(3, list.size());
    assertEquals(Boolean.TRUE, list.get(1));
    assertEquals(Map.of("k", "v"), parsed.get("obj"));
  }

  @Test
  void rejectsTrailingContentAndNonObjects() {
    assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
    assertThrows(IllegalArgumentException.class, () -> json.parseObject("[1,2]"));
  }

  @Test
  void readStringFieldToleratesGarbage() {
    assertEquals(Optional.of("abc"), json.readStringField("{\"id\":\"abc\"}", "id"));
    assertTrue(json.readStringField("<html>oops</html>", "id").isEmpty());
    assertTrue(json.readStringField("{\"id\":42}", "id").isEmpty());
    assertTrue(json.readStringField("", "id").isEmpty());
  }
}
