/**
 * <strong>Purpose:</strong> OkHttp-based delivery to the collector store endpoint.
 * <p><strong>Concurrency:</strong> One shared client per transport; calls run synchronously on dispatcher
 * threads.</p>
 * <p><strong>Security:</strong> Credentials travel only in the {@code X-Sentry-Auth} header and are never logged.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.infrastructure.transport.http;
