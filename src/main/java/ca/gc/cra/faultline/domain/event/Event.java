package ca.gc.cra.faultline.domain.event;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> One captured failure, normalized into the collector's event schema.
 * <p><strong>Why:</strong> Exceptions, termination reports, and rendered text traces all converge on this
 * shape before filtering and transmission.</p>
 * <p><strong>Role:</strong> Domain aggregate produced by {@code EventBuilder} and consumed by transports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold the ordered exception list (thrown exception first, causes after).</li>
 *   <li>Hold frames ordered outermost first, innermost last.</li>
 *   <li>Report whether it carries enough data to be transmitted.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; collections are defensively copied and unmodifiable.</p>
 * <p><strong>Observability:</strong> {@link #eventId()} is the correlation key logged by dispatch and transports.</p>
 *
 * @param eventId 32-character lowercase hex identifier; {@code null} until finalized
 * @param timestamp UTC capture instant; {@code null} until finalized
 * @param message free text; may be {@code null}
 * @param exceptions exception entries; empty for message-only events
 * @param frames stack frames, outer to inner
 * @param level severity
 * @param platform runtime identifier, always {@link #PLATFORM}
 * @param culprit best-guess offending function; may be {@code null}
 * @param tags string tags
 * @param extra structured extra data
 * @param breadcrumbs breadcrumbs, oldest first
 * @param user user attributes; may be empty
 * @param serverName reporting host; may be {@code null}
 * @param release application release; may be {@code null}
 * @param environment environment name; may be {@code null}
 * @since 0.1.0
 */
public record Event(
    String eventId,
    Instant timestamp,
    String message,
    List<ExceptionValue> exceptions,
    List<Frame> frames,
    Level level,
    String platform,
    String culprit,
    Map<String, String> tags,
    Map<String, Object> extra,
    List<Breadcrumb> breadcrumbs,
    Map<String, Object> user,
    String serverName,
    String release,
    String environment) {

  /** Platform identifier written on every event. */
  public static final String PLATFORM = "java";

  public Event {
    exceptions = exceptions == null ? List.of() : List.copyOf(exceptions);
    frames = frames == null ? List.of() : List.copyOf(frames);
    level = level == null ? Level.ERROR : level;
    platform = platform == null ? PLATFORM : platform;
    tags = unmodifiableCopy(tags);
    extra = unmodifiableCopy(extra);
    breadcrumbs = breadcrumbs == null ? List.of() : List.copyOf(breadcrumbs);
    user = unmodifiableCopy(user);
  }

  /**
   * Indicates whether the event carries a message or at least one exception entry.
   *
   * @return {@code false} when neither could be extracted
   */
  public boolean isTransmittable() {
    return message != null || !exceptions.isEmpty();
  }

  /**
   * Returns the first exception entry when present.
   *
   * @return primary exception or {@code null}
   */
  public ExceptionValue primaryException() {
    return exceptions.isEmpty() ? null : exceptions.get(0);
  }

  /**
   * Creates a builder pre-populated with this event's values.
   *
   * @return mutable builder
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.eventId = eventId;
    builder.timestamp = timestamp;
    builder.message = message;
    builder.exceptions.addAll(exceptions);
    builder.frames.addAll(frames);
    builder.level = level;
    builder.culprit = culprit;
    builder.tags.putAll(tags);
    builder.extra.putAll(extra);
    builder.breadcrumbs.addAll(breadcrumbs);
    builder.user.putAll(user);
    builder.serverName = serverName;
    builder.release = release;
    builder.environment = environment;
    return builder;
  }

  /**
   * Creates an empty builder.
   *
   * @return mutable builder
   */
  public static Builder builder() {
    return new Builder();
  }

  // Map.copyOf rejects null values, which extra data legitimately carries.
  private static <V> Map<String, V> unmodifiableCopy(Map<String, V> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  /**
   * Mutable accumulator used while an event is being assembled. Not thread-safe.
   *
   * @since 0.1.0
   */
  public static final class Builder {
    private String eventId;
    private Instant timestamp;
    private String message;
    private final List<ExceptionValue> exceptions = new ArrayList<>();
    private final List<Frame> frames = new ArrayList<>();
    private Level level = Level.ERROR;
    private String culprit;
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final Map<String, Object> extra = new LinkedHashMap<>();
    private final List<Breadcrumb> breadcrumbs = new ArrayList<>();
    private final Map<String, Object> user = new LinkedHashMap<>();
    private String serverName;
    private String release;
    private String environment;

    private Builder() {}

    public Builder eventId(String value) {
      this.eventId = value;
      return this;
    }

    public Builder timestamp(Instant value) {
      this.timestamp = value;
      return this;
    }

    public Builder message(String value) {
      this.message = value;
      return this;
    }

    public String message() {
      return message;
    }

    public Builder exceptions(List<ExceptionValue> values) {
      exceptions.clear();
      exceptions.addAll(values);
      return this;
    }

    public Builder addException(ExceptionValue value) {
      exceptions.add(value);
      return this;
    }

    public List<ExceptionValue> exceptions() {
      return exceptions;
    }

    public Builder frames(List<Frame> values) {
      frames.clear();
      frames.addAll(values);
      return this;
    }

    /** Appends a frame at the innermost position. */
    public Builder addFrame(Frame frame) {
      frames.add(frame);
      return this;
    }

    /** Inserts a frame at the outermost position. */
    public Builder prependFrame(Frame frame) {
      frames.add(0, frame);
      return this;
    }

    public List<Frame> frames() {
      return frames;
    }

    public Builder level(Level value) {
      this.level = value;
      return this;
    }

    public Builder culprit(String value) {
      this.culprit = value;
      return this;
    }

    public String culprit() {
      return culprit;
    }

    public Builder tags(Map<String, String> values) {
      tags.putAll(values);
      return this;
    }

    public Builder tag(String key, String value) {
      tags.put(key, value);
      return this;
    }

    public Builder extra(Map<String, ?> values) {
      extra.putAll(values);
      return this;
    }

    public Builder extra(String key, Object value) {
      extra.put(key, value);
      return this;
    }

    /** Stores the value only when the key has not been set yet. */
    public Builder extraIfAbsent(String key, Object value) {
      extra.putIfAbsent(key, value);
      return this;
    }

    public Map<String, Object> extra() {
      return extra;
    }

    public Builder breadcrumbs(List<Breadcrumb> values) {
      breadcrumbs.addAll(values);
      return this;
    }

    public Builder user(Map<String, ?> values) {
      user.putAll(values);
      return this;
    }

    public Builder serverName(String value) {
      this.serverName = value;
      return this;
    }

    public Builder release(String value) {
      this.release = value;
      return this;
    }

    public Builder environment(String value) {
      this.environment = value;
      return this;
    }

    public Event build() {
      return new Event(eventId, timestamp, message, exceptions, frames, level, PLATFORM, culprit,
          tags, extra, breadcrumbs, user, serverName, release, environment);
    }
  }
}
