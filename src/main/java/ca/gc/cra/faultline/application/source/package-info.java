/**
 * <strong>Purpose:</strong> Source-line lookup used to enrich in-app frames.
 * <p><strong>Concurrency:</strong> The file cache is process-wide and read-mostly; lookups never block on each other
 * beyond the first load of a given file.</p>
 * <p><strong>Security:</strong> Lookups are confined to the configured root; paths escaping it resolve to nothing.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.faultline.application.source;
