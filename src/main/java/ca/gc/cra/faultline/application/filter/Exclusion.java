package ca.gc.cra.faultline.application.filter;

import java.util.Locale;

/**
 * Reason an event was not sent. Exclusions are outcomes, not errors.
 *
 * @since 0.1.0
 */
public enum Exclusion {
  /** No DSN configured. */
  DISABLED,
  /** Active environment is not an included environment. */
  ENVIRONMENT,
  /** The configured {@link EventFilter} rejected the exception. */
  FILTERED,
  /** The sampler drew above the sample rate. */
  SAMPLED,
  /** The before-send hook returned {@code null}. */
  BEFORE_SEND;

  /** @return metric suffix, e.g. {@code sampled} for {@code capture.excluded.sampled} */
  public String metricSuffix() {
    return name().toLowerCase(Locale.ROOT);
  }
}
