/**
 * Executor construction for dispatch workers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.infrastructure.exec;
