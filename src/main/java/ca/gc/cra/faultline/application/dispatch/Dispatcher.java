package ca.gc.cra.faultline.application.dispatch;

import ca.gc.cra.faultline.application.port.AfterSendHook;
import ca.gc.cra.faultline.application.port.ClockPort;
import ca.gc.cra.faultline.application.port.MetricsPort;
import ca.gc.cra.faultline.application.port.SendResult;
import ca.gc.cra.faultline.application.port.Transport;
import ca.gc.cra.faultline.domain.event.Event;
import ca.gc.cra.faultline.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs each transmission as its own task on a bounded daemon pool.
 * <p><strong>Why:</strong> Capture calls must return promptly; network I/O and transport crashes stay off the
 * capturing thread.</p>
 * <p><strong>Role:</strong> Application service between {@code CaptureService} and the {@link Transport}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return a {@link CompletableFuture} that callers may await or discard.</li>
 *   <li>Convert transport exceptions and pool rejections into {@link SendResult.Failure}s.</li>
 *   <li>Invoke the after-send hook and isolate its failures.</li>
 * </ul>
 * <p><strong>Concurrency:</strong> No ordering between dispatched events; tasks are not cancellable. The handle
 * never completes exceptionally.</p>
 * <p><strong>Observability:</strong> Emits {@code dispatch.sent}, {@code dispatch.failed}, {@code dispatch.rejected},
 * and {@code dispatch.latencyMillis}.</p>
 *
 * @since 0.1.0
 */
public final class Dispatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

  private final Transport transport;
  private final AfterSendHook afterSend;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ExecutorService executor;

  /**
   * Creates a dispatcher with its own worker pool.
   *
   * @param transport transport used by workers
   * @param afterSend hook run after every attempt; {@code null} disables it
   * @param metrics metrics sink
   * @param clock clock used for latency measurements
   * @param workers worker thread count
   * @param queueCapacity pending-send bound
   */
  public Dispatcher(
      Transport transport,
      AfterSendHook afterSend,
      MetricsPort metrics,
      ClockPort clock,
      int workers,
      int queueCapacity) {
    this(transport, afterSend, metrics, clock,
        ExecutorFactories.newDispatchPool(workers, queueCapacity, "faultline-dispatch",
            (thread, ex) -> log.error("Dispatch worker {} terminated unexpectedly", thread.getName(), ex)));
  }

  Dispatcher(
      Transport transport,
      AfterSendHook afterSend,
      MetricsPort metrics,
      ClockPort clock,
      ExecutorService executor) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.afterSend = afterSend == null ? AfterSendHook.NONE : afterSend;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /**
   * Schedules a transmission.
   *
   * @param event finalized event
   * @return handle completing with the send outcome; already completed with a failure when the pool rejects the task
   */
  public CompletableFuture<SendResult> dispatch(Event event) {
    Objects.requireNonNull(event, "event");
    SendTask task = new SendTask(event);
    try {
      executor.execute(task);
    } catch (RejectedExecutionException ex) {
      metrics.increment("dispatch.rejected");
      String reason = executor.isShutdown() ? "dispatcher closed" : "dispatch queue full";
      log.warn("Dispatch rejected for event {}: {}", event.eventId(), reason);
      task.handle.complete(SendResult.Failure.of(reason));
    }
    return task.handle;
  }

  private SendResult sendSupervised(Event event) {
    long start = clock.nowMillis();
    SendResult result;
    try {
      result = transport.send(event);
      if (result == null) {
        result = SendResult.Failure.of("transport returned no result");
      }
    } catch (RuntimeException | LinkageError ex) {
      log.warn("Transport crashed while sending event {}", event.eventId(), ex);
      result = SendResult.Failure.of(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
    metrics.observe("dispatch.latencyMillis", Math.max(0L, clock.nowMillis() - start));
    metrics.increment(result.succeeded() ? "dispatch.sent" : "dispatch.failed");
    if (result instanceof SendResult.Failure failure) {
      log.debug("Event {} not delivered: {} (status {})", event.eventId(), failure.reason(), failure.status());
    }
    try {
      afterSend.afterSend(event, result);
    } catch (RuntimeException ex) {
      log.warn("After-send hook failed for event {}", event.eventId(), ex);
    }
    return result;
  }

  /**
   * Stops accepting sends, waits briefly for in-flight ones, then abandons the rest and closes the transport.
   */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
        List<Runnable> abandoned = executor.shutdownNow();
        log.warn("Dispatcher closed with {} pending sends abandoned", abandoned.size());
        abandon(abandoned);
      }
    } catch (InterruptedException ex) {
      abandon(executor.shutdownNow());
      Thread.currentThread().interrupt();
    }
    try {
      transport.close();
    } catch (Exception ex) {
      log.warn("Failed to close transport {}", transport.getClass().getSimpleName(), ex);
    }
  }

  private static void abandon(List<Runnable> pending) {
    for (Runnable runnable : pending) {
      if (runnable instanceof SendTask task) {
        task.handle.complete(SendResult.Failure.of("dispatcher closed"));
      }
    }
  }

  private final class SendTask implements Runnable {
    private final Event event;
    private final CompletableFuture<SendResult> handle = new CompletableFuture<>();

    SendTask(Event event) {
      this.event = event;
    }

    @Override
    public void run() {
      try {
        handle.complete(sendSupervised(event));
      } finally {
        if (!handle.isDone()) {
          handle.complete(SendResult.Failure.of("dispatch worker failed"));
        }
      }
    }
  }
}
