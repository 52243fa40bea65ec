package ca.gc.cra.faultline.adapter.logback;

import ca.gc.cra.faultline.adapter.report.ErrorInfo;
import ca.gc.cra.faultline.adapter.report.ErrorReport;
import ca.gc.cra.faultline.adapter.report.ErrorReportHandler;
import ca.gc.cra.faultline.application.context.ErrorContext;
import ca.gc.cra.faultline.application.event.TerminationReport;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.AppenderBase;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Logback appender forwarding ERROR-level log events to faultline.
 * <p><strong>Why:</strong> Most failures in a running service are only ever logged; this appender makes them
 * collector events without touching call sites.</p>
 * <p><strong>Role:</strong> Adapter translating {@link ILoggingEvent}s into {@link ErrorReport}s for
 * {@link ErrorReportHandler}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report attached Throwables as error terminations with their own stack.</li>
 *   <li>Report serialized throwable proxies as rendered text.</li>
 *   <li>Report plain messages as rendered text, or as messages when {@code captureMessages} is set.</li>
 *   <li>Ignore faultline's own loggers to avoid feedback loops.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link AppenderBase} serializes {@link #append(ILoggingEvent)}.</p>
 *
 * @since 0.1.0
 */
public final class LogbackCaptureAppender extends AppenderBase<ILoggingEvent> {
  /** Logger name prefix never forwarded. */
  public static final String OWN_LOGGER_PREFIX = "ca.gc.cra.faultline";

  private ErrorReportHandler handler;
  private Supplier<ErrorContext> contextFactory = ErrorContext::new;
  private boolean captureMessages;

  /** Creates an appender; {@link #setHandler(ErrorReportHandler)} must be called before {@link #start()}. */
  public LogbackCaptureAppender() {
  }

  /**
   * @param handler report handler
   * @param contextFactory creates the per-event context; {@code null} uses {@link ErrorContext#ErrorContext()}
   */
  public LogbackCaptureAppender(ErrorReportHandler handler, Supplier<ErrorContext> contextFactory) {
    this.handler = handler;
    if (contextFactory != null) {
      this.contextFactory = contextFactory;
    }
  }

  public void setHandler(ErrorReportHandler handler) {
    this.handler = handler;
  }

  public void setCaptureMessages(boolean captureMessages) {
    this.captureMessages = captureMessages;
  }

  public boolean isCaptureMessages() {
    return captureMessages;
  }

  @Override
  public void start() {
    if (handler == null) {
      addError("No ErrorReportHandler set for appender named [" + name + "]");
      return;
    }
    super.start();
  }

  @Override
  protected void append(ILoggingEvent event) {
    if (!event.getLevel().isGreaterOrEqual(Level.ERROR)) {
      return;
    }
    String loggerName = event.getLoggerName();
    if (loggerName != null && loggerName.startsWith(OWN_LOGGER_PREFIX)) {
      return;
    }
    handler.handle(new ErrorReport(loggerName, event.getThreadName(), toInfo(event), contextFor(event)));
  }

  private ErrorInfo toInfo(ILoggingEvent event) {
    IThrowableProxy proxy = event.getThrowableProxy();
    if (proxy instanceof ThrowableProxy live && live.getThrowable() != null) {
      return new ErrorInfo.Flat(TerminationReport.Kind.ERROR, live.getThrowable(), List.of());
    }
    String message = event.getFormattedMessage() == null ? "" : event.getFormattedMessage();
    if (proxy != null) {
      return new ErrorInfo.Rendered(message + System.lineSeparator() + ThrowableProxyUtil.asString(proxy));
    }
    if (captureMessages) {
      return new ErrorInfo.Logged(message, ca.gc.cra.faultline.domain.event.Level.ERROR);
    }
    return new ErrorInfo.Rendered(message);
  }

  private ErrorContext contextFor(ILoggingEvent event) {
    ErrorContext context = contextFactory.get();
    context.putTag("logger", event.getLoggerName());
    Map<String, String> mdc = event.getMDCPropertyMap();
    if (mdc != null && !mdc.isEmpty()) {
      context.putExtra("mdc", Map.copyOf(mdc));
    }
    return context;
  }

  /**
   * Creates, starts, and attaches an appender to the root logger of the active Logback context.
   *
   * @param handler report handler
   * @param contextFactory per-event context factory; may be {@code null}
   * @param captureMessages whether plain error messages are captured as messages
   * @return the attached appender, or empty when SLF4J is not bound to Logback
   */
  public static Optional<LogbackCaptureAppender> attachToRoot(ErrorReportHandler handler,
      Supplier<ErrorContext> contextFactory, boolean captureMessages) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext loggerContext)) {
      LoggerFactory.getLogger(LogbackCaptureAppender.class)
          .warn("Logback capture requested but backend {} is not Logback", factory.getClass().getName());
      return Optional.empty();
    }
    LogbackCaptureAppender appender = new LogbackCaptureAppender(handler, contextFactory);
    appender.setName("faultline");
    appender.setContext(loggerContext);
    appender.setCaptureMessages(captureMessages);
    appender.start();
    Logger root = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
    root.addAppender(appender);
    return Optional.of(appender);
  }

  /**
   * Detaches an appender previously attached with {@link #attachToRoot}.
   *
   * @param appender appender to detach
   */
  public static void detachFromRoot(LogbackCaptureAppender appender) {
    if (appender.getContext() instanceof LoggerContext loggerContext) {
      loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).detachAppender(appender);
    }
    appender.stop();
  }
}
