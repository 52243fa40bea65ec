package ca.gc.cra.faultline.application.event;

import ca.gc.cra.faultline.application.context.ErrorContext;
import ca.gc.cra.faultline.domain.event.Level;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-capture options supplied by adapters and direct callers.
 *
 * @param context execution-unit context to merge; {@code null} when the caller has none
 * @param source capture source label passed to the event filter (e.g., {@code logger}); may be {@code null}
 * @param stacktrace explicit frames overriding the Throwable's own; {@code null} or empty keeps the Throwable's
 * @param level severity override; {@code null} keeps the path default
 * @param tags tags applied after global and context tags
 * @param extra extra data applied after context extra
 * @param user user attributes applied after context user
 * @since 0.1.0
 */
public record CaptureOptions(
    ErrorContext context,
    String source,
    List<StackTraceElement> stacktrace,
    Level level,
    Map<String, String> tags,
    Map<String, Object> extra,
    Map<String, Object> user) {

  /** Options carrying nothing. */
  public static final CaptureOptions NONE = builder().build();

  public CaptureOptions {
    stacktrace = stacktrace == null ? List.of() : List.copyOf(stacktrace);
    tags = copy(tags);
    extra = copy(extra);
    user = copy(user);
  }

  /**
   * Returns options with only a context.
   *
   * @param context execution-unit context
   * @return options
   */
  public static CaptureOptions withContext(ErrorContext context) {
    return builder().context(context).build();
  }

  /** @return new builder */
  public static Builder builder() {
    return new Builder();
  }

  /** @return builder seeded from these options */
  public Builder toBuilder() {
    Builder builder = new Builder().context(context).source(source).stacktrace(stacktrace).level(level);
    builder.tags.putAll(tags);
    builder.extra.putAll(extra);
    builder.user.putAll(user);
    return builder;
  }

  private static <V> Map<String, V> copy(Map<String, V> source) {
    return source == null || source.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  /** Mutable builder for {@link CaptureOptions}. */
  public static final class Builder {
    private ErrorContext context;
    private String source;
    private List<StackTraceElement> stacktrace;
    private Level level;
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final Map<String, Object> extra = new LinkedHashMap<>();
    private final Map<String, Object> user = new LinkedHashMap<>();

    private Builder() {}

    public Builder context(ErrorContext value) {
      this.context = value;
      return this;
    }

    public Builder source(String value) {
      this.source = value;
      return this;
    }

    public Builder stacktrace(List<StackTraceElement> value) {
      this.stacktrace = value;
      return this;
    }

    public Builder level(Level value) {
      this.level = value;
      return this;
    }

    public Builder tag(String key, String value) {
      tags.put(key, value);
      return this;
    }

    public Builder extra(String key, Object value) {
      extra.put(key, value);
      return this;
    }

    public Builder user(String key, Object value) {
      user.put(key, value);
      return this;
    }

    public CaptureOptions build() {
      return new CaptureOptions(context, source, stacktrace, level, tags, extra, user);
    }
  }
}
