/**
 * Logback integration: forwards ERROR-level log events into the capture pipeline.
 */
package ca.gc.cra.faultline.adapter.logback;
