/**
 * <strong>Purpose:</strong> Domain model for captured failures and collector addressing.
 * <p><strong>Pipeline role:</strong> Innermost layer; application services and adapters depend on it, never the reverse.</p>
 * <p><strong>Security:</strong> Credential-bearing types redact secrets from their string form.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.domain;
