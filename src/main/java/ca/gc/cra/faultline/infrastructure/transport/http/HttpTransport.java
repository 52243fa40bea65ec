package ca.gc.cra.faultline.infrastructure.transport.http;

import ca.gc.cra.faultline.application.port.ClockPort;
import ca.gc.cra.faultline.application.port.SendResult;
import ca.gc.cra.faultline.application.port.Transport;
import ca.gc.cra.faultline.config.ClientConfig.TransportSettings;
import ca.gc.cra.faultline.domain.dsn.Dsn;
import ca.gc.cra.faultline.domain.event.Event;
import ca.gc.cra.faultline.infrastructure.json.EventJsonWriter;
import ca.gc.cra.faultline.infrastructure.json.JsonSupport;
import ca.gc.cra.faultline.logging.Logs;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import okhttp3.ConnectionPool;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link Transport} that POSTs events to {@code {endpoint}/api/{project}/store/}.
 * <p><strong>Why:</strong> Default delivery path to the remote collector.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize the event with {@link EventJsonWriter}.</li>
 *   <li>Attach the {@link AuthHeader}, {@code User-Agent}, and {@code Content-Type} headers.</li>
 *   <li>Map 2xx responses to {@link SendResult.Success} using the response {@code id}, anything else to
 *       {@link SendResult.Failure}. No retries.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link OkHttpClient} is thread-safe; concurrent sends share its connection
 * pool.</p>
 * <p><strong>Performance:</strong> Pool size, keep-alive, and timeouts come from {@link TransportSettings}.</p>
 * <p><strong>Observability:</strong> Logs failures at WARN with truncated response bodies.</p>
 * <p><strong>Security:</strong> The auth header is never logged.</p>
 *
 * @since 0.1.0
 */
public final class HttpTransport implements Transport {
  private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final int MAX_LOGGED_BODY_BYTES = 512;

  private final Dsn dsn;
  private final OkHttpClient client;
  private final EventJsonWriter writer;
  private final JsonSupport json;
  private final ClockPort clock;

  /**
   * Creates a transport with an OkHttp client tuned from configuration.
   *
   * @param dsn collector DSN
   * @param settings pool and timeout settings
   * @param writer event serializer
   * @param clock clock for {@code sentry_timestamp}
   */
  public HttpTransport(Dsn dsn, TransportSettings settings, EventJsonWriter writer, ClockPort clock) {
    this(dsn, newClient(settings), writer, new JsonSupport(), clock);
  }

  HttpTransport(Dsn dsn, OkHttpClient client, EventJsonWriter writer, JsonSupport json, ClockPort clock) {
    this.dsn = Objects.requireNonNull(dsn, "dsn");
    this.client = Objects.requireNonNull(client, "client");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.json = Objects.requireNonNull(json, "json");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  static OkHttpClient newClient(TransportSettings settings) {
    Objects.requireNonNull(settings, "settings");
    return new OkHttpClient.Builder()
        .connectionPool(new ConnectionPool(settings.poolSize(), settings.keepAliveSeconds(), TimeUnit.SECONDS))
        .connectTimeout(settings.connectTimeoutMillis(), TimeUnit.MILLISECONDS)
        .readTimeout(settings.readTimeoutMillis(), TimeUnit.MILLISECONDS)
        .writeTimeout(settings.readTimeoutMillis(), TimeUnit.MILLISECONDS)
        .retryOnConnectionFailure(false)
        .build();
  }

  @Override
  public SendResult send(Event event) {
    byte[] body;
    try {
      body = writer.write(event);
    } catch (UncheckedIOException ex) {
      log.warn("Unable to serialize event {}", event.eventId(), ex);
      return SendResult.Failure.of("serialization failed: " + ex.getMessage());
    }
    Request request = new Request.Builder()
        .url(dsn.storeUrl())
        .header(AuthHeader.NAME, AuthHeader.value(dsn, TimeUnit.MILLISECONDS.toSeconds(clock.nowMillis())))
        .header("User-Agent", AuthHeader.CLIENT)
        .post(RequestBody.create(body, JSON))
        .build();

    try (Response response = client.newCall(request).execute()) {
      String responseBody = readBody(response);
      if (response.isSuccessful()) {
        String id = json.readStringField(responseBody, "id").orElse(event.eventId());
        log.debug("Event {} accepted by {} as {}", event.eventId(), dsn.endpointUrl(), id);
        return new SendResult.Success(id);
      }
      log.warn("Collector rejected event {} with HTTP {}: {}", event.eventId(), response.code(),
          Logs.truncate(responseBody, MAX_LOGGED_BODY_BYTES));
      return new SendResult.Failure("HTTP " + response.code() + " " + response.message(), response.code());
    } catch (IOException ex) {
      log.warn("Failed to deliver event {} to {}: {}", event.eventId(), dsn.endpointUrl(), ex.toString());
      return SendResult.Failure.of(ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }

  private static String readBody(Response response) throws IOException {
    ResponseBody body = response.body();
    return body == null ? "" : body.string();
  }

  @Override
  public void close() {
    client.dispatcher().executorService().shutdown();
    client.connectionPool().evictAll();
  }
}
