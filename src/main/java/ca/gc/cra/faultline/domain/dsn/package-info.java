/**
 * Collector connection string parsing.
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.domain.dsn;
