/**
 * <strong>Purpose:</strong> Infrastructure implementations of application ports: HTTP delivery, JSON codecs,
 * executors, and metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.infrastructure;
