/**
 * Per-execution-unit diagnostic context attached to captured events.
 *
 * <p><strong>Concurrency:</strong> One {@link ca.gc.cra.faultline.application.context.ErrorContext} per unit; instances
 * are never shared between units.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.application.context;
