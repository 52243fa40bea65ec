/**
 * <strong>Purpose:</strong> Asynchronous, supervised transmission of finished events.
 * <p><strong>Concurrency:</strong> One pooled task per event on daemon threads; handles never complete
 * exceptionally.</p>
 * <p><strong>Observability:</strong> Publishes {@code dispatch.*} metrics.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.application.dispatch;
