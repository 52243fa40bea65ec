package ca.gc.cra.faultline.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.faultline.domain.event.Breadcrumb;
import ca.gc.cra.faultline.domain.event.Event;
import ca.gc.cra.faultline.domain.event.ExceptionValue;
import ca.gc.cra.faultline.domain.event.Frame;
import ca.gc.cra.faultline.domain.event.Level;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventJsonWriterTest {
  private final EventJsonWriter writer = new EventJsonWriter();
  private final JsonSupport json = new JsonSupport();

  @Test
  void writesCollectorSchema() {
    Map<String, Object> extra = new HashMap<>();
    extra.put("attempts", 3);
    extra.put("missing", null);
    extra.put("ids", new String[] {"a", null});
    Event event = Event.builder()
        .eventId("0123456789abcdef0123456789abcdef")
        .timestamp(Instant.parse("2024-03-05T06:07:08.999Z"))
        .message("(RuntimeError) boom")
        .level(Level.WARNING)
        .culprit("com.example.Worker.run")
        .serverName("host-a")
        .release("1.0.0")
        .environment("production")
        .tag("region", "ca-central")
        .extra(extra)
        .user(Map.of("id", "u-1"))
        .breadcrumbs(List.of(Breadcrumb.of(Instant.parse("2024-03-05T06:07:00Z"), "http", "GET /")))
        .addException(new ExceptionValue("IllegalStateException", "boom", "java.lang"))
        .addException(ExceptionValue.of("exit", null))
        .addFrame(Frame.of("Worker.java", "run", "com.example.Worker", 12, true)
            .withSourceContext("  run();", List.of("  // before"), List.of()))
        .build();

    Map<String, Object> root = json.parseObject(writer.writeString(event));

    assertEquals("0123456789abcdef0123456789abcdef", root.get("event_id"));
    assertEquals("2024-03-05T06:07:08", root.get("timestamp"));
    assertEquals("warning", root.get("level"));
    assertEquals("java", root.get("platform"));
    assertEquals("com.example.Worker.run", root.get("culprit"));
    assertEquals("host-a", root.get("server_name"));
    assertEquals(Map.of("region", "ca-central"), root.get("tags"));

    Map<?, ?> extraJson = (Map<?, ?>) root.get("extra");
    assertEquals(3, ((Number) extraJson.get("attempts")).intValue());
    assertTrue(extraJson.containsKey("missing"));
    assertNull(extraJson.get("missing"));
    assertEquals(Arrays.asList("a", null), extraJson.get("ids"));

    List<?> exceptions = (List<?>) root.get("exception");
    Map<?, ?> first = (Map<?, ?>) exceptions.get(0);
    assertEquals("IllegalStateException", first.get("type"));
    assertEquals("java.lang", first.get("module"));
    assertFalse(((Map<?, ?>) exceptions.get(1)).containsKey("module"));

    Map<?, ?> frame = (Map<?, ?>) ((List<?>) ((Map<?, ?>) root.get("stacktrace")).get("frames")).get(0);
    assertEquals("Worker.java", frame.get("filename"));
    assertEquals(12, ((Number) frame.get("lineno")).intValue());
    assertEquals(Boolean.TRUE, frame.get("in_app"));
    assertEquals("  run();", frame.get("context_line"));
    assertEquals(List.of("  // before"), frame.get("pre_context"));
    assertEquals(Map.of(), frame.get("vars"));

    Map<?, ?> crumb = (Map<?, ?>) ((List<?>) root.get("breadcrumbs")).get(0);
    assertEquals("2024-03-05T06:07:00", crumb.get("timestamp"));
    assertEquals("info", crumb.get("level"));
  }

  @Test
  void reparsedBodyKeepsScalarsAndFrameOrder() {
    Event event = Event.builder()
        .eventId("fedcba9876543210fedcba9876543210")
        .timestamp(Instant.parse("2024-11-02T23:59:01Z"))
        .message("(RuntimeError) Unique Error")
        .level(Level.ERROR)
        .culprit("MyApp.Worker.handle_call/3")
        .serverName("host-b")
        .release("2.4.1")
        .environment("staging")
        .addException(ExceptionValue.of("RuntimeError", "Unique Error"))
        .addFrame(Frame.of("gen_server.erl", "try_handle_call/4", ":gen_server", 636, false))
        .addFrame(Frame.of("lib/my_app/router.ex", "dispatch/2", "MyApp.Router", 18, true))
        .addFrame(Frame.of("lib/my_app/worker.ex", "handle_call/3", "MyApp.Worker", 42, true))
        .build();

    Map<String, Object> root = json.parseObject(writer.writeString(event));

    assertEquals("fedcba9876543210fedcba9876543210", root.get("event_id"));
    assertEquals("(RuntimeError) Unique Error", root.get("message"));
    assertEquals("2024-11-02T23:59:01", root.get("timestamp"));
    assertEquals("error", root.get("level"));
    assertEquals("java", root.get("platform"));
    assertEquals("MyApp.Worker.handle_call/3", root.get("culprit"));
    assertEquals("host-b", root.get("server_name"));
    assertEquals("2.4.1", root.get("release"));
    assertEquals("staging", root.get("environment"));

    List<?> frames = (List<?>) ((Map<?, ?>) root.get("stacktrace")).get("frames");
    assertEquals(3, frames.size());
    assertFrame(frames.get(0), "gen_server.erl", 636);
    assertFrame(frames.get(1), "lib/my_app/router.ex", 18);
    assertFrame(frames.get(2), "lib/my_app/worker.ex", 42);
  }

  @Test
  void emptyEventStillHasAllSections() {
    Map<String, Object> root = json.parseObject(writer.writeString(Event.builder().message("m").build()));

    assertEquals(List.of(), root.get("exception"));
    assertEquals(Map.of("frames", List.of()), root.get("stacktrace"));
    assertEquals(Map.of(), root.get("extra"));
    assertNull(root.get("timestamp"));
  }

  private static void assertFrame(Object frame, String filename, int lineno) {
    Map<?, ?> fields = (Map<?, ?>) frame;
    assertEquals(filename, fields.get("filename"));
    assertEquals(lineno, ((Number) fields.get("lineno")).intValue());
  }
}
