/**
 * Send/no-send decisions: environment gate, pluggable exception filter, and sampler.
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.application.filter;
