package ca.gc.cra.faultline.application.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.faultline.application.event.TextTraceParser.LineClass;
import ca.gc.cra.faultline.domain.event.Event;
import ca.gc.cra.faultline.domain.event.ExceptionValue;
import ca.gc.cra.faultline.domain.event.Frame;
import java.util.List;
import org.junit.jupiter.api.Test;

class TextTraceParserTest {
  private final TextTraceParser parser =
      new TextTraceParser(new InAppClassifier(List.of(), List.of("java.", "jdk.")));

  @Test
  void classifiesLines() {
    assertEquals(LineClass.SUMMARY, parser.classify("** (RuntimeError) boom"));
    assertEquals(LineClass.SUMMARY, parser.classify("java.lang.IllegalStateException: broken"));
    assertEquals(LineClass.SUMMARY, parser.classify("Caused by: java.io.IOException: disk"));
    assertEquals(LineClass.FRAME, parser.classify("    file.ex:42: MyModule.my_fun/1"));
    assertEquals(LineClass.FRAME, parser.classify("\tat com.example.Service.run(Service.java:10)"));
    assertEquals(LineClass.METADATA, parser.classify("Last message: :crash"));
    assertEquals(LineClass.OTHER, parser.classify("\t... 3 more"));
    assertEquals(LineClass.OTHER, parser.classify(null));
  }

  @Test
  void parsesTerminationReport() {
    String report = String.join("\n",
        "Error in process <0.12.0> with exit value:",
        "** (RuntimeError) Unique Error",
        "    (my_app) lib/my_app/worker.ex:42: MyApp.Worker.handle_call/3",
        "    (stdlib) gen_server.erl:636: :gen_server.try_handle_call/4",
        "Last message: :crash",
        "State: %{count: 1}");

    Event event = parse(report);

    assertEquals("(RuntimeError) Unique Error", event.message());
    assertEquals(List.of(ExceptionValue.of("RuntimeError", "Unique Error")), event.exceptions());
    assertEquals(2, event.frames().size());
    Frame outer = event.frames().get(0);
    Frame inner = event.frames().get(1);
    assertEquals("gen_server.erl", outer.filename());
    assertFalse(outer.inApp());
    assertEquals("lib/my_app/worker.ex", inner.filename());
    assertEquals(42, inner.lineno());
    assertTrue(inner.inApp());
    assertEquals("MyApp.Worker.handle_call/3", event.culprit());
    assertEquals(":crash", event.extra().get("last_message"));
    assertEquals("%{count: 1}", event.extra().get("state"));
  }

  @Test
  void parsesSingleTextFrame() {
    Event event = parse("** (RuntimeError) boom\n    file.ex:42: MyModule.my_fun/1");

    Frame frame = event.frames().get(0);
    assertEquals(42, frame.lineno());
    assertEquals("file.ex", frame.filename());
    assertEquals("MyModule.my_fun/1", frame.function());
    assertTrue(frame.inApp());
  }

  @Test
  void elixirAndStdlibFramesAreNotInApp() {
    String report = String.join("\n",
        "** (RuntimeError) boom",
        "    (elixir) lib/enum.ex:1: Enum.map/2",
        "    (stdlib) gen.erl:3: :gen.do_call/4",
        "    (my_app) lib/my_app.ex:9: MyApp.run/0");

    Event event = parse(report);

    assertEquals(3, event.frames().size());
    assertFalse(frameFor(event, "lib/enum.ex").inApp());
    assertFalse(frameFor(event, "gen.erl").inApp());
    assertTrue(frameFor(event, "lib/my_app.ex").inApp());
  }

  @Test
  void parsesJavaTraceAndSkipsCauseFrames() {
    String trace = String.join("\n",
        "Exception in thread \"main\" java.lang.IllegalStateException: broken",
        "\tat com.example.Service.run(Service.java:10)",
        "\tat java.base/java.lang.Thread.run(Thread.java:833)",
        "Caused by: java.io.IOException: disk",
        "\tat com.example.Disk.read(Disk.java:5)",
        "\t... 1 more");

    Event event = parse(trace);

    assertEquals(List.of(
        new ExceptionValue("IllegalStateException", "broken", "java.lang"),
        new ExceptionValue("IOException", "disk", "java.io")), event.exceptions());
    assertEquals(2, event.frames().size());
    assertEquals("java.lang.Thread.run", event.frames().get(0).qualifiedFunction());
    assertFalse(event.frames().get(0).inApp());
    assertEquals("com.example.Service.run", event.frames().get(1).qualifiedFunction());
    assertEquals("com.example.Service.run", event.culprit());
  }

  @Test
  void dropsMalformedFramesAndKeepsParsing() {
    String trace = String.join("\n",
        "** (ArgumentError) bad",
        "    lib/zero.ex:0: Zero.fun/0",
        "\tat com.example.Native.call(Native Method)",
        "    lib/ok.ex:7: Ok.fun/0");

    Event event = parse(trace);

    assertEquals(1, event.frames().size());
    assertEquals("lib/ok.ex", event.frames().get(0).filename());
  }

  @Test
  void firstMetadataValueWins() {
    Event event = parse("** (E) x\nState: first\nState: second");
    assertEquals("first", event.extra().get("state"));
  }

  @Test
  void unrecognizedTextYieldsNothing() {
    Event event = parse("just some words\nmore words");

    assertNull(event.message());
    assertTrue(event.exceptions().isEmpty());
    assertFalse(event.isTransmittable());
  }

  private static Frame frameFor(Event event, String filename) {
    return event.frames().stream()
        .filter(frame -> filename.equals(frame.filename()))
        .findFirst()
        .orElseThrow();
  }

  private Event parse(String text) {
    Event.Builder builder = Event.builder();
    parser.parse(text, builder);
    return builder.build();
  }
}
