/**
 * Kafka publishing transport.
 *
 * <p><strong>Delivery:</strong> Producer retries are disabled, keeping at most one delivery attempt per event.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.adapter.kafka;
