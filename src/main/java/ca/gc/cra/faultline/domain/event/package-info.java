/**
 * <strong>Purpose:</strong> Immutable event model shared by capture, filtering, and transport.
 * <p><strong>Pipeline role:</strong> Domain layer; no dependencies on application or infrastructure packages.</p>
 * <p><strong>Concurrency:</strong> All types are immutable except {@link ca.gc.cra.faultline.domain.event.Event.Builder}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.domain.event;
