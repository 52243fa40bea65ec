/**
 * Adapters turning host error reports and thread terminations into captures.
 *
 * <p>{@link ca.gc.cra.faultline.adapter.report.ErrorReportHandler} never lets a failure escape back into the
 * reporting thread.</p>
 */
package ca.gc.cra.faultline.adapter.report;
