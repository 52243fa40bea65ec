package ca.gc.cra.faultline.adapter.report;

import ca.gc.cra.faultline.application.capture.CaptureResult;
import ca.gc.cra.faultline.application.capture.CaptureService;
import ca.gc.cra.faultline.application.event.CaptureOptions;
import ca.gc.cra.faultline.application.event.TerminationReport;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Logged-error adapter translating {@link ErrorReport}s into captures.
 * <p><strong>Why:</strong> Failures surfaced through logging or termination hooks should reach the collector without
 * the application calling the capture API itself.</p>
 * <p><strong>Role:</strong> Adapter on top of {@link CaptureService}; captures carry source {@code logger} plus
 * {@code extra.unit} and {@code extra.category}.</p>
 * <p><strong>Error handling:</strong> Unrecognized or malformed reports are logged at WARN and dropped; nothing
 * propagates to the reporting thread.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ErrorReportHandler {
  private static final Logger log = LoggerFactory.getLogger(ErrorReportHandler.class);
  /** Capture source attached to every report. */
  public static final String SOURCE = "logger";

  private final CaptureService captureService;

  /**
   * @param captureService capture pipeline
   */
  public ErrorReportHandler(CaptureService captureService) {
    this.captureService = Objects.requireNonNull(captureService, "captureService");
  }

  /**
   * Captures a report.
   *
   * @param report incoming report; {@code null} is logged and ignored
   * @return capture outcome, or empty when the report could not be interpreted
   */
  public Optional<CaptureResult> handle(ErrorReport report) {
    try {
      if (report == null) {
        throw new AdapterParseException("report is null");
      }
      return Optional.of(capture(report));
    } catch (RuntimeException ex) {
      log.warn("Unable to capture error report: {}: {}", ex.getClass().getSimpleName(), ex.getMessage());
      return Optional.empty();
    }
  }

  private CaptureResult capture(ErrorReport report) {
    CaptureOptions options = CaptureOptions.builder()
        .context(report.context())
        .source(SOURCE)
        .extra("unit", report.unitId())
        .extra("category", report.category())
        .build();
    Object info = report.info();
    if (info instanceof ErrorInfo.Nested nested) {
      return captureService.captureTermination(
          new TerminationReport(nested.kind(), nested.reason(), nested.stacktrace()), options);
    }
    if (info instanceof ErrorInfo.Flat flat) {
      return captureService.captureTermination(
          new TerminationReport(flat.kind(), flat.reason(), flat.stacktrace()), options);
    }
    if (info instanceof ErrorInfo.Rendered rendered) {
      return captureService.captureText(rendered.text(), options);
    }
    if (info instanceof ErrorInfo.Logged logged) {
      return captureService.captureMessage(logged.message(), options.toBuilder().level(logged.level()).build());
    }
    throw new AdapterParseException("unrecognized error info "
        + (info == null ? "null" : info.getClass().getName()) + " from unit " + report.unitId());
  }
}
