/**
 * <strong>Purpose:</strong> Capture-transform-dispatch services and the ports they depend on.
 * <p><strong>Pipeline role:</strong> Sits between adapters (logging, termination hooks, direct calls) and
 * infrastructure transports.</p>
 * <p><strong>Concurrency:</strong> Everything up to dispatch runs on the capturing thread; transmission runs on the
 * dispatcher pool.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.application;
