/**
 * <strong>Purpose:</strong> Ports connecting the capture pipeline to clocks, metrics, transports, and user hooks.
 * <p><strong>Pipeline role:</strong> Application layer contracts; infrastructure and adapters implement them.</p>
 * <p><strong>Concurrency:</strong> Implementations must be thread-safe; they are shared by capturing threads and
 * dispatcher workers.</p>
 * <p><strong>Observability:</strong> {@link ca.gc.cra.faultline.application.port.MetricsPort} defines the metric names
 * used across the pipeline.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.application.port;
