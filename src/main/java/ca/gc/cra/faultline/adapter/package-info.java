/**
 * Adapters binding faultline to its surroundings: Kafka transport, host error reports, and Logback.
 */
package ca.gc.cra.faultline.adapter;
