package ca.gc.cra.faultline.adapter.report;

import ca.gc.cra.faultline.application.capture.CaptureResult;
import ca.gc.cra.faultline.application.context.ErrorContext;
import ca.gc.cra.faultline.application.event.TerminationReport;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reports abnormal terminations of monitored threads.
 * <p><strong>Why:</strong> A thread that dies with an uncaught exception never reaches application error handling;
 * this reporter turns the death into an {@link ErrorReport} for {@link ErrorReportHandler}.</p>
 * <p><strong>Role:</strong> Adapter acting as both {@link ThreadFactory} and
 * {@link Thread.UncaughtExceptionHandler}. Threads it creates carry their own {@link ErrorContext}, which is read back
 * when the thread terminates.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; contexts are owned by their threads.</p>
 *
 * @since 0.1.0
 */
public final class TerminationReporter implements ThreadFactory, Thread.UncaughtExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(TerminationReporter.class);
  /** Category attached to uncaught-exception reports. */
  public static final String CATEGORY_UNCAUGHT = "uncaught";
  /** Category attached to explicit exit reports. */
  public static final String CATEGORY_EXIT = "exit";

  private final ErrorReportHandler handler;
  private final Supplier<ErrorContext> contextFactory;
  private final String threadPrefix;
  private final AtomicInteger threadCounter = new AtomicInteger();

  /**
   * @param handler report handler
   * @param contextFactory creates one context per monitored thread; {@code null} uses {@link ErrorContext#ErrorContext()}
   * @param threadPrefix name prefix for created threads; defaults to {@code faultline-unit}
   */
  public TerminationReporter(ErrorReportHandler handler, Supplier<ErrorContext> contextFactory, String threadPrefix) {
    this.handler = Objects.requireNonNull(handler, "handler");
    this.contextFactory = contextFactory == null ? ErrorContext::new : contextFactory;
    this.threadPrefix = threadPrefix == null || threadPrefix.isBlank() ? "faultline-unit" : threadPrefix.trim();
  }

  /**
   * Creates a monitored thread with a fresh context.
   *
   * @param task work to run
   * @return unstarted monitored thread
   */
  @Override
  public Thread newThread(Runnable task) {
    return newThread(threadPrefix + "-" + threadCounter.incrementAndGet(), contextFactory.get(), task);
  }

  /**
   * Creates a monitored thread bound to the supplied context.
   *
   * @param name thread name, used as the unit identifier
   * @param context context owned by the new thread
   * @param task work to run
   * @return unstarted monitored thread
   */
  public Thread newThread(String name, ErrorContext context, Runnable task) {
    MonitoredThread thread = new MonitoredThread(Objects.requireNonNull(task, "task"), name,
        Objects.requireNonNull(context, "context"));
    thread.setUncaughtExceptionHandler(this);
    return thread;
  }

  /**
   * Returns the context owned by a monitored thread.
   *
   * @param thread thread to inspect
   * @return the thread's context, or empty if the thread was not created by a reporter
   */
  public static Optional<ErrorContext> contextOf(Thread thread) {
    if (thread instanceof MonitoredThread monitored) {
      return Optional.of(monitored.context);
    }
    return Optional.empty();
  }

  /**
   * Reports a thread terminated by an uncaught exception.
   *
   * @param thread terminated thread
   * @param error uncaught throwable
   */
  @Override
  public void uncaughtException(Thread thread, Throwable error) {
    log.error("Unit {} terminated abnormally", thread.getName(), error);
    ErrorContext context = contextOf(thread).orElse(null);
    handler.handle(new ErrorReport(CATEGORY_UNCAUGHT, thread.getName(),
        new ErrorInfo.Flat(TerminationReport.Kind.ERROR, error, List.of()), context));
  }

  /**
   * Reports a unit that exited with a non-normal reason.
   *
   * @param unitId exiting unit
   * @param reason exit reason, rendered as text unless it is a Throwable
   * @param stacktrace frames reported with the exit; may be empty
   * @param context unit context; may be {@code null}
   * @return capture outcome, or empty if the report could not be handled
   */
  public Optional<CaptureResult> exited(String unitId, Object reason, List<StackTraceElement> stacktrace,
      ErrorContext context) {
    return handler.handle(new ErrorReport(CATEGORY_EXIT, unitId,
        new ErrorInfo.Flat(TerminationReport.Kind.EXIT, reason, stacktrace), context));
  }

  /**
   * Installs this reporter as the JVM-wide default uncaught exception handler.
   *
   * @return the handler previously installed, possibly {@code null}
   */
  public Thread.UncaughtExceptionHandler installAsDefault() {
    Thread.UncaughtExceptionHandler previous = Thread.getDefaultUncaughtExceptionHandler();
    Thread.setDefaultUncaughtExceptionHandler(this);
    return previous;
  }

  private static final class MonitoredThread extends Thread {
    private final ErrorContext context;

    MonitoredThread(Runnable task, String name, ErrorContext context) {
      super(task, name);
      this.context = context;
    }
  }
}
