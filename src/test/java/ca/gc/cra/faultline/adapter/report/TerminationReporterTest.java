package ca.gc.cra.faultline.adapter.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.faultline.application.capture.CaptureResult;
import ca.gc.cra.faultline.application.context.ErrorContext;
import ca.gc.cra.faultline.application.port.ClockPort;
import ca.gc.cra.faultline.config.CompositionRoot;
import ca.gc.cra.faultline.testutil.RecordingMetrics;
import ca.gc.cra.faultline.testutil.TestConfigs;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TerminationReporterTest {
  private MockWebServer server;
  private CompositionRoot root;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    String dsn = "http://public:secret@" + server.getHostName() + ":" + server.getPort() + "/1";
    root = new CompositionRoot(TestConfigs.config("dsn", dsn), null, null, ClockPort.SYSTEM, new RecordingMetrics());
  }

  @AfterEach
  void tearDown() throws IOException {
    root.close();
    server.shutdown();
  }

  @Test
  void uncaughtExceptionInMonitoredThreadReachesCollector() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"id\":\"abc\"}"));
    ErrorContext context = new ErrorContext().putTag("job", "nightly");

    Thread thread = root.terminationReporter().newThread("worker-7", context, () -> {
      throw new RuntimeException("Unique Error");
    });
    thread.start();
    thread.join(5_000);

    RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
    assertNotNull(request, "collector received no request");
    assertEquals("/api/1/store/", request.getPath());
    String body = request.getBody().readUtf8();
    assertTrue(body.contains("RuntimeException"), body);
    assertTrue(body.contains("Unique Error"), body);
    assertTrue(body.contains("\"job\":\"nightly\""), body);
    assertTrue(body.contains("worker-7"), body);
    root.close();
    assertEquals(1, server.getRequestCount());
  }

  @Test
  void exitReasonIsSentAsExitException() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"id\":\"def\"}"));

    CaptureResult result = root.terminationReporter()
        .exited("unit-1", ":bad_exit", List.of(), null)
        .orElseThrow();

    CaptureResult.Sent sent = assertInstanceOf(CaptureResult.Sent.class, result);
    assertTrue(sent.handle().get(5, TimeUnit.SECONDS).succeeded());
    assertEquals("exit", sent.event().primaryException().type());
    assertEquals("** (exit) :bad_exit", sent.event().primaryException().value());
    String body = server.takeRequest(5, TimeUnit.SECONDS).getBody().readUtf8();
    assertTrue(body.contains(":bad_exit"), body);
    assertEquals(1, server.getRequestCount());
  }

  @Test
  void factoryThreadsCarryTheirOwnContext() {
    TerminationReporter reporter = root.terminationReporter();
    Thread first = reporter.newThread(() -> {});
    Thread second = reporter.newThread(() -> {});

    ErrorContext firstContext = TerminationReporter.contextOf(first).orElseThrow();
    assertTrue(first.getName().startsWith("faultline-unit-"), first.getName());
    assertTrue(firstContext != TerminationReporter.contextOf(second).orElseThrow());
    assertSame(reporter, first.getUncaughtExceptionHandler());
    assertTrue(TerminationReporter.contextOf(Thread.currentThread()).isEmpty());
  }
}
