package ca.gc.cra.faultline.application.context;

import ca.gc.cra.faultline.domain.event.Breadcrumb;
import ca.gc.cra.faultline.validation.Numbers;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Ambient diagnostic state for one logical execution unit (a request, a job, a worker).
 * <p><strong>Why:</strong> User, tag, extra, and breadcrumb data recorded while a unit runs is attached to the
 * next event that unit captures.</p>
 * <p><strong>Role:</strong> Owned by the execution unit and passed explicitly to capture calls through
 * {@code CaptureOptions}; never global and never thread-local.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Allocate storage lazily on first write.</li>
 *   <li>Bound breadcrumbs, evicting the oldest entry first.</li>
 *   <li>Produce immutable {@link Snapshot}s for event assembly.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Methods are synchronized so several threads working for the same unit may
 * write; distinct units must use distinct instances.</p>
 * <p><strong>Performance:</strong> Writes and breadcrumb eviction are O(1); snapshots copy current state.</p>
 *
 * @since 0.1.0
 */
public final class ErrorContext {
  /** Breadcrumb bound used when none is configured. */
  public static final int DEFAULT_MAX_BREADCRUMBS = 100;

  private final int maxBreadcrumbs;
  private Map<String, Object> user;
  private Map<String, String> tags;
  private Map<String, Object> extra;
  private ArrayDeque<Breadcrumb> breadcrumbs;

  /** Creates a context holding up to {@link #DEFAULT_MAX_BREADCRUMBS} breadcrumbs. */
  public ErrorContext() {
    this(DEFAULT_MAX_BREADCRUMBS);
  }

  /**
   * Creates a context with a custom breadcrumb bound.
   *
   * @param maxBreadcrumbs maximum retained breadcrumbs; between 0 and 10,000
   * @throws IllegalArgumentException if the bound is out of range
   */
  public ErrorContext(int maxBreadcrumbs) {
    this.maxBreadcrumbs = (int) Numbers.requireRange("maxBreadcrumbs", maxBreadcrumbs, 0, 10_000);
  }

  /**
   * Merges attributes into the user map.
   *
   * @param attributes user attributes (e.g., {@code id}, {@code email}); must not be {@code null}
   * @return this context
   */
  public synchronized ErrorContext setUser(Map<String, ?> attributes) {
    Objects.requireNonNull(attributes, "attributes");
    if (user == null) {
      user = new LinkedHashMap<>();
    }
    user.putAll(attributes);
    return this;
  }

  /**
   * Sets a tag, replacing any previous value.
   *
   * @param key tag key; must not be {@code null}
   * @param value tag value
   * @return this context
   */
  public synchronized ErrorContext putTag(String key, String value) {
    Objects.requireNonNull(key, "key");
    if (tags == null) {
      tags = new LinkedHashMap<>();
    }
    tags.put(key, value);
    return this;
  }

  /**
   * Sets an extra data entry, replacing any previous value.
   *
   * @param key extra key; must not be {@code null}
   * @param value arbitrary value; serialized as JSON by the transport
   * @return this context
   */
  public synchronized ErrorContext putExtra(String key, Object value) {
    Objects.requireNonNull(key, "key");
    if (extra == null) {
      extra = new LinkedHashMap<>();
    }
    extra.put(key, value);
    return this;
  }

  /**
   * Records a breadcrumb, evicting the oldest one when the bound is reached.
   *
   * @param breadcrumb breadcrumb to append; must not be {@code null}
   * @return this context
   */
  public synchronized ErrorContext addBreadcrumb(Breadcrumb breadcrumb) {
    Objects.requireNonNull(breadcrumb, "breadcrumb");
    if (maxBreadcrumbs == 0) {
      return this;
    }
    if (breadcrumbs == null) {
      breadcrumbs = new ArrayDeque<>();
    }
    while (breadcrumbs.size() >= maxBreadcrumbs) {
      breadcrumbs.removeFirst();
    }
    breadcrumbs.addLast(breadcrumb);
    return this;
  }

  /** Drops all recorded state. */
  public synchronized void clear() {
    user = null;
    tags = null;
    extra = null;
    breadcrumbs = null;
  }

  /**
   * Indicates whether anything has been written since creation or the last {@link #clear()}.
   *
   * @return {@code true} if storage has been allocated
   */
  public synchronized boolean isAllocated() {
    return user != null || tags != null || extra != null || breadcrumbs != null;
  }

  /**
   * Copies the current state.
   *
   * @return immutable snapshot
   */
  public synchronized Snapshot snapshot() {
    if (!isAllocated()) {
      return Snapshot.EMPTY;
    }
    return new Snapshot(
        copy(user),
        copy(tags),
        copy(extra),
        breadcrumbs == null ? List.of() : List.copyOf(new ArrayList<>(breadcrumbs)));
  }

  private static <V> Map<String, V> copy(Map<String, V> source) {
    return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  /**
   * Point-in-time copy of an {@link ErrorContext}.
   *
   * @param user user attributes
   * @param tags tags
   * @param extra extra data
   * @param breadcrumbs breadcrumbs, oldest first
   * @since 0.1.0
   */
  public record Snapshot(
      Map<String, Object> user,
      Map<String, String> tags,
      Map<String, Object> extra,
      List<Breadcrumb> breadcrumbs) {
    /** Snapshot of a context that was never written. */
    public static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of(), Map.of(), List.of());
  }
}
