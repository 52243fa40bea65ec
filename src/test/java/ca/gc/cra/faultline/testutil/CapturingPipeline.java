package ca.gc.cra.faultline.testutil;

import ca.gc.cra.faultline.application.capture.CaptureService;
import ca.gc.cra.faultline.application.dispatch.Dispatcher;
import ca.gc.cra.faultline.application.event.EventBuilder;
import ca.gc.cra.faultline.application.filter.EventFilter;
import ca.gc.cra.faultline.application.filter.EventGate;
import ca.gc.cra.faultline.application.filter.Sampler;
import ca.gc.cra.faultline.application.port.ClockPort;
import ca.gc.cra.faultline.application.port.SendResult;
import ca.gc.cra.faultline.domain.event.Event;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/** Enabled capture pipeline whose transport records events instead of sending them. */
public final class CapturingPipeline implements AutoCloseable {
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final List<Event> transported = new CopyOnWriteArrayList<>();
  private final Dispatcher dispatcher;
  private final CaptureService captureService;

  public CapturingPipeline() {
    this.dispatcher = new Dispatcher(
        event -> {
          transported.add(event);
          return new SendResult.Success(event.eventId());
        },
        null, metrics, ClockPort.SYSTEM, 1, 64);
    EventGate gate = new EventGate(true, "production", Set.of("production"), EventFilter.NONE, new Sampler(1.0d));
    this.captureService = new CaptureService(
        new EventBuilder(TestConfigs.config(), null, ClockPort.SYSTEM), null, gate, dispatcher, metrics);
  }

  public CaptureService captureService() {
    return captureService;
  }

  public RecordingMetrics metrics() {
    return metrics;
  }

  public List<Event> transported() {
    return transported;
  }

  @Override
  public void close() {
    dispatcher.close();
  }
}
