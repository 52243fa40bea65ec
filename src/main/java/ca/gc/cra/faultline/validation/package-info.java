/**
 * <strong>Purpose:</strong> Input validation helpers applied while resolving client configuration.
 * <p><strong>Security:</strong> Rejects control characters, malformed endpoints, and out-of-range tuning values before
 * any network resource is allocated.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.validation;
