package ca.gc.cra.faultline.adapter.report;

import ca.gc.cra.faultline.application.context.ErrorContext;

/**
 * Structured error report delivered by a host error-reporting facility.
 *
 * <p>{@code info} is deliberately untyped: reports come from outside faultline and anything that is not an
 * {@link ErrorInfo} is rejected by the handler with a warning.</p>
 *
 * @param category report category (e.g., logger name or {@code uncaught})
 * @param unitId identifier of the failing execution unit (e.g., thread name)
 * @param info failure payload, normally an {@link ErrorInfo}
 * @param context context of the failing unit; may be {@code null}
 * @since 0.1.0
 */
public record ErrorReport(String category, String unitId, Object info, ErrorContext context) {}
