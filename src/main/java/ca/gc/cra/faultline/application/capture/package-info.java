/**
 * <strong>Purpose:</strong> Direct-call capture API and its outcome types.
 * <p><strong>Pipeline role:</strong> Orchestrates build, before-send, gate, and dispatch for every capture path.</p>
 * <p><strong>Concurrency:</strong> Capture runs synchronously on the caller's thread up to dispatch.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.application.capture;
