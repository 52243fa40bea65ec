package ca.gc.cra.faultline.domain.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventTest {

  @Test
  void eventWithoutMessageOrExceptionIsNotTransmittable() {
    Event empty = Event.builder().eventId(EventIds.next()).build();
    assertFalse(empty.isTransmittable());
    assertNull(empty.primaryException());

    assertTrue(Event.builder().message("hello").build().isTransmittable());
    assertTrue(Event.builder().addException(ExceptionValue.of("Boom", null)).build().isTransmittable());
  }

  @Test
  void defaultsLevelAndPlatform() {
    Event event = Event.builder().message("m").level(null).build();
    assertEquals(Level.ERROR, event.level());
    assertEquals("java", event.platform());
  }

  @Test
  void extraAcceptsNullValuesAndIsImmutable() {
    Map<String, Object> extra = new HashMap<>();
    extra.put("missing", null);
    Event event = Event.builder().message("m").extra(extra).build();

    assertTrue(event.extra().containsKey("missing"));
    assertThrows(UnsupportedOperationException.class, () -> event.extra().put("x", 1));
  }

  @Test
  void prependFrameKeepsOuterToInnerOrder() {
    Frame inner = Frame.of("A.java", "inner", "a.A", 10, true);
    Frame outer = Frame.of("B.java", "outer", "b.B", 20, true);
    Event event = Event.builder().message("m").prependFrame(inner).prependFrame(outer).build();

    assertEquals(List.of(outer, inner), event.frames());
  }

  @Test
  void toBuilderCopiesAllFields() {
    Event original = Event.builder()
        .eventId("abc")
        .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
        .message("m")
        .tag("k", "v")
        .extra("e", 1)
        .environment("staging")
        .build();

    Event copy = original.toBuilder().build();
    assertEquals(original, copy);
  }

  @Test
  void eventIdsAreThirtyTwoHexCharacters() {
    String id = EventIds.next();
    assertEquals(32, id.length());
    assertTrue(id.matches("[0-9a-f]{32}"), id);
  }

  @Test
  void frameRejectsNonPositiveLine() {
    assertThrows(IllegalArgumentException.class, () -> Frame.of("A.java", "run", null, 0, true));
  }

  @Test
  void frameQualifiedFunctionIncludesModule() {
    assertEquals("a.A.run", Frame.of("A.java", "run", "a.A", 3, true).qualifiedFunction());
    assertEquals("MyModule.my_fun/1", Frame.of("file.ex", "MyModule.my_fun/1", null, 3, true).qualifiedFunction());
  }

  @Test
  void levelParsesWireNames() {
    assertEquals(Level.WARNING, Level.fromWireName("warn"));
    assertEquals(Level.FATAL, Level.fromWireName("fatal"));
    assertEquals(Level.ERROR, Level.fromWireName(null));
    assertEquals("warning", Level.WARNING.wireName());
  }
}
