package ca.gc.cra.faultline.infrastructure.transport.http;

import ca.gc.cra.faultline.domain.dsn.Dsn;
import java.util.Objects;

/**
 * Builds the {@code X-Sentry-Auth} header value sent with every store request.
 *
 * <p>Format: {@code Sentry sentry_version=5, sentry_client=faultline-java/0.1.0, sentry_timestamp=<epoch s>,
 * sentry_key=<public>, sentry_secret=<secret>}. The secret is omitted when the DSN carries none.</p>
 *
 * @since 0.1.0
 */
public final class AuthHeader {
  /** Header name. */
  public static final String NAME = "X-Sentry-Auth";
  /** Protocol version advertised to the collector. */
  public static final int PROTOCOL_VERSION = 5;
  /** Client identifier, also used as the {@code User-Agent}. */
  public static final String CLIENT = "faultline-java/0.1.0";

  private AuthHeader() {}

  /**
   * Renders the header value.
   *
   * @param dsn parsed DSN supplying keys
   * @param epochSeconds request timestamp in seconds
   * @return header value
   */
  public static String value(Dsn dsn, long epochSeconds) {
    Objects.requireNonNull(dsn, "dsn");
    StringBuilder header = new StringBuilder(160)
        .append("Sentry sentry_version=").append(PROTOCOL_VERSION)
        .append(", sentry_client=").append(CLIENT)
        .append(", sentry_timestamp=").append(epochSeconds)
        .append(", sentry_key=").append(dsn.publicKey());
    if (dsn.secretKey() != null) {
      header.append(", sentry_secret=").append(dsn.secretKey());
    }
    return header.toString();
  }
}
