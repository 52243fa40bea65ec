package ca.gc.cra.faultline.application.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.faultline.application.port.AfterSendHook;
import ca.gc.cra.faultline.application.port.ClockPort;
import ca.gc.cra.faultline.application.port.SendResult;
import ca.gc.cra.faultline.application.port.Transport;
import ca.gc.cra.faultline.domain.event.Event;
import ca.gc.cra.faultline.domain.event.EventIds;
import ca.gc.cra.faultline.testutil.RecordingMetrics;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class DispatcherTest {
  private static final Event EVENT = Event.builder().eventId(EventIds.next()).message("boom").build();

  @Test
  void successfulSendCompletesHandleAndRunsHook() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    List<SendResult> seen = new CopyOnWriteArrayList<>();
    AfterSendHook hook = (event, result) -> seen.add(result);
    try (Dispatcher dispatcher = new Dispatcher(
        event -> new SendResult.Success(event.eventId()), hook, metrics, ClockPort.SYSTEM, 2, 8)) {

      SendResult result = dispatcher.dispatch(EVENT).get(5, TimeUnit.SECONDS);

      assertEquals(new SendResult.Success(EVENT.eventId()), result);
      assertEquals(List.of(result), seen);
      assertEquals(1L, metrics.counter("dispatch.sent"));
      assertEquals(1, metrics.observations("dispatch.latencyMillis").size());
    }
  }

  @Test
  void transportCrashBecomesFailure() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    Transport crashing = event -> {
      throw new IllegalStateException("socket exploded");
    };
    try (Dispatcher dispatcher = new Dispatcher(crashing, null, metrics, ClockPort.SYSTEM, 1, 4)) {

      SendResult result = dispatcher.dispatch(EVENT).get(5, TimeUnit.SECONDS);

      SendResult.Failure failure = assertInstanceOf(SendResult.Failure.class, result);
      assertTrue(failure.reason().contains("socket exploded"), failure.reason());
      assertEquals(1L, metrics.counter("dispatch.failed"));
    }
  }

  @Test
  void nullTransportResultBecomesFailure() throws Exception {
    try (Dispatcher dispatcher = new Dispatcher(event -> null, null, new RecordingMetrics(), ClockPort.SYSTEM, 1, 4)) {
      assertFalse(dispatcher.dispatch(EVENT).get(5, TimeUnit.SECONDS).succeeded());
    }
  }

  @Test
  void failingAfterSendHookDoesNotAffectResult() throws Exception {
    AfterSendHook hook = (event, result) -> {
      throw new IllegalStateException("hook bug");
    };
    try (Dispatcher dispatcher = new Dispatcher(
        event -> new SendResult.Success("id-1"), hook, new RecordingMetrics(), ClockPort.SYSTEM, 1, 4)) {
      assertTrue(dispatcher.dispatch(EVENT).get(5, TimeUnit.SECONDS).succeeded());
    }
  }

  @Test
  void fullQueueRejectsImmediately() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    CountDownLatch release = new CountDownLatch(1);
    Transport blocking = event -> {
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      return new SendResult.Success(event.eventId());
    };
    try (Dispatcher dispatcher = new Dispatcher(blocking, null, metrics, ClockPort.SYSTEM, 1, 1)) {
      CompletableFuture<SendResult> first = dispatcher.dispatch(EVENT);
      CompletableFuture<SendResult> second = dispatcher.dispatch(EVENT);
      CompletableFuture<SendResult> third = dispatcher.dispatch(EVENT);

      assertTrue(third.isDone());
      assertEquals(SendResult.Failure.of("dispatch queue full"), third.get());
      assertEquals(1L, metrics.counter("dispatch.rejected"));

      release.countDown();
      assertTrue(first.get(5, TimeUnit.SECONDS).succeeded());
      assertTrue(second.get(5, TimeUnit.SECONDS).succeeded());
    }
  }

  @Test
  void closedDispatcherRejectsAndClosesTransport() throws Exception {
    AtomicBoolean closed = new AtomicBoolean();
    Transport transport = new Transport() {
      @Override
      public SendResult send(Event event) {
        return new SendResult.Success(event.eventId());
      }

      @Override
      public void close() {
        closed.set(true);
      }
    };
    Dispatcher dispatcher = new Dispatcher(transport, null, new RecordingMetrics(), ClockPort.SYSTEM, 1, 4);
    dispatcher.close();

    assertTrue(closed.get());
    assertEquals(SendResult.Failure.of("dispatcher closed"), dispatcher.dispatch(EVENT).get());
  }
}
