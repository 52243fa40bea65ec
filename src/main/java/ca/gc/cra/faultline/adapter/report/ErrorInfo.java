package ca.gc.cra.faultline.adapter.report;

import ca.gc.cra.faultline.application.event.TerminationReport;
import ca.gc.cra.faultline.domain.event.Level;
import java.util.List;
import java.util.Objects;

/**
 * Failure payload shapes accepted by {@link ErrorReportHandler}.
 *
 * <p>{@link Nested} and {@link Flat} both describe a termination; they differ only in where the supervising stack
 * sits. Both become a {@link TerminationReport}. {@link Rendered} carries text only and goes through the text trace
 * parser. {@link Logged} is a plain error message.</p>
 *
 * @since 0.1.0
 */
public sealed interface ErrorInfo permits ErrorInfo.Nested, ErrorInfo.Flat, ErrorInfo.Rendered, ErrorInfo.Logged {

  /**
   * Termination reported with the reason and its frames grouped together, followed by the supervisor's own stack.
   *
   * @param kind termination kind
   * @param reason Throwable or other reason
   * @param stacktrace frames belonging to the reason
   * @param supervisorStack frames of the supervising unit; not part of the captured event
   */
  record Nested(TerminationReport.Kind kind, Object reason, List<StackTraceElement> stacktrace,
      List<StackTraceElement> supervisorStack) implements ErrorInfo {
    public Nested {
      Objects.requireNonNull(kind, "kind");
      stacktrace = stacktrace == null ? List.of() : List.copyOf(stacktrace);
      supervisorStack = supervisorStack == null ? List.of() : List.copyOf(supervisorStack);
    }
  }

  /**
   * Termination reported as kind, reason, and frames.
   *
   * @param kind termination kind
   * @param reason Throwable or other reason
   * @param stacktrace frames reported with the reason
   */
  record Flat(TerminationReport.Kind kind, Object reason, List<StackTraceElement> stacktrace) implements ErrorInfo {
    public Flat {
      Objects.requireNonNull(kind, "kind");
      stacktrace = stacktrace == null ? List.of() : List.copyOf(stacktrace);
    }
  }

  /**
   * Text-only failure report.
   *
   * @param text rendered report
   */
  record Rendered(String text) implements ErrorInfo {
    public Rendered {
      Objects.requireNonNull(text, "text");
    }
  }

  /**
   * Plain logged message.
   *
   * @param message formatted message
   * @param level severity
   */
  record Logged(String message, Level level) implements ErrorInfo {
    public Logged {
      Objects.requireNonNull(message, "message");
      level = level == null ? Level.ERROR : level;
    }
  }
}
