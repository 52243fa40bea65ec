/**
 * <strong>Purpose:</strong> OpenTelemetry implementation of the metrics port.
 * <p><strong>Observability:</strong> Instruments are named {@code faultline.<key>} and carry the original key as the
 * {@code faultline.metric.key} attribute.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.infrastructure.metrics;
