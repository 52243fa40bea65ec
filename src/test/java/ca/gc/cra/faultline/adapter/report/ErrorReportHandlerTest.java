package ca.gc.cra.faultline.adapter.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.faultline.application.capture.CaptureResult;
import ca.gc.cra.faultline.application.context.ErrorContext;
import ca.gc.cra.faultline.application.event.TerminationReport;
import ca.gc.cra.faultline.domain.event.Event;
import ca.gc.cra.faultline.domain.event.Level;
import ca.gc.cra.faultline.testutil.CapturingPipeline;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ErrorReportHandlerTest {
  private CapturingPipeline pipeline;
  private ErrorReportHandler handler;
  private Logger logger;
  private ListAppender<ILoggingEvent> appender;

  @BeforeEach
  void setUp() {
    pipeline = new CapturingPipeline();
    handler = new ErrorReportHandler(pipeline.captureService());
    logger = (Logger) LoggerFactory.getLogger(ErrorReportHandler.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    pipeline.close();
  }

  @Test
  void flatThrowableReportIsCapturedWithUnitAndCategory() throws Exception {
    ErrorContext context = new ErrorContext().putTag("request", "r-9");
    ErrorReport report = new ErrorReport("uncaught", "worker-1",
        new ErrorInfo.Flat(TerminationReport.Kind.ERROR, new RuntimeException("Unique Error"), List.of()), context);

    Event event = sent(handler.handle(report));

    assertEquals("RuntimeException", event.primaryException().type());
    assertEquals("Unique Error", event.primaryException().value());
    assertEquals("worker-1", event.extra().get("unit"));
    assertEquals("uncaught", event.extra().get("category"));
    assertEquals("r-9", event.tags().get("request"));
  }

  @Test
  void nestedReportIgnoresSupervisorStack() throws Exception {
    StackTraceElement own = new StackTraceElement("com.example.Worker", "run", "Worker.java", 12);
    StackTraceElement supervisor = new StackTraceElement("com.example.Supervisor", "watch", "Supervisor.java", 40);
    ErrorReport report = new ErrorReport("supervisor", "worker-2",
        new ErrorInfo.Nested(TerminationReport.Kind.EXIT, "killed", List.of(own), List.of(supervisor)), null);

    Event event = sent(handler.handle(report));

    assertEquals("exit", event.primaryException().type());
    assertEquals("** (exit) killed", event.primaryException().value());
    assertEquals(1, event.frames().size());
    assertEquals("com.example.Worker.run", event.culprit());
  }

  @Test
  void renderedReportGoesThroughTextParser() throws Exception {
    ErrorReport report = new ErrorReport("crash", "<0.99.0>",
        new ErrorInfo.Rendered("** (RuntimeError) Unique Error\n    file.ex:42: MyModule.my_fun/1"), null);

    Event event = sent(handler.handle(report));

    assertEquals("(RuntimeError) Unique Error", event.message());
    assertEquals(42, event.frames().get(0).lineno());
  }

  @Test
  void loggedMessageKeepsLevel() throws Exception {
    ErrorReport report = new ErrorReport("app", "main", new ErrorInfo.Logged("disk nearly full", Level.WARNING), null);

    Event event = sent(handler.handle(report));

    assertEquals("disk nearly full", event.message());
    assertEquals(Level.WARNING, event.level());
  }

  @Test
  void unrecognizedShapeIsLoggedAndDropped() {
    Optional<CaptureResult> result = handler.handle(new ErrorReport("app", "main", "not a report", null));

    assertTrue(result.isEmpty());
    assertTrue(pipeline.transported().isEmpty());
    assertEquals(1, appender.list.size());
    ILoggingEvent warning = appender.list.get(0);
    assertEquals(ch.qos.logback.classic.Level.WARN, warning.getLevel());
    assertTrue(warning.getFormattedMessage().startsWith("Unable to capture error report"),
        warning.getFormattedMessage());
  }

  @Test
  void nullReportIsLoggedAndDropped() {
    assertTrue(handler.handle(null).isEmpty());
    assertEquals(1, appender.list.size());
  }

  private static Event sent(Optional<CaptureResult> result) throws Exception {
    CaptureResult.Sent sent = assertInstanceOf(CaptureResult.Sent.class, result.orElseThrow());
    assertTrue(sent.handle().get(5, TimeUnit.SECONDS).succeeded());
    return sent.event();
  }
}
