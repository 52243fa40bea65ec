/**
 * Logging hygiene helpers shared by transports and configuration.
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.logging;
