package ca.gc.cra.faultline.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("environment", "   "));
  }

  @Test
  void sanitizeTopicAllowsSafeCharacters() {
    assertEquals("faultline.events-1", Strings.sanitizeTopic("topic", "faultline.events-1"));
  }

  @Test
  void sanitizeTopicRejectsInvalidCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTopic("topic", "faultline events"));
  }

  @Test
  void splitListTrimsAndDropsBlanks() {
    assertEquals(List.of("production", "staging"), Strings.splitList(" production, ,staging ,"));
  }

  @Test
  void splitListOfNullIsEmpty() {
    assertTrue(Strings.splitList(null).isEmpty());
  }
}
