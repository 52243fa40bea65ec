/**
 * <strong>Purpose:</strong> Event assembly from Throwables, termination reports, messages, and rendered traces.
 * <p><strong>Pipeline role:</strong> First stage of capture; runs synchronously on the capturing thread.</p>
 * <p><strong>Concurrency:</strong> Builders and parsers are immutable and shared; per-call state lives in local
 * accumulators.</p>
 * <p><strong>Performance:</strong> Linear in frame and line count; source lookups hit a shared cache.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.application.event;
