package ca.gc.cra.faultline.config;

import ca.gc.cra.faultline.application.context.ErrorContext;
import ca.gc.cra.faultline.application.source.SourceContextResolver;
import ca.gc.cra.faultline.domain.dsn.Dsn;
import ca.gc.cra.faultline.validation.Net;
import ca.gc.cra.faultline.validation.Numbers;
import ca.gc.cra.faultline.validation.Strings;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable client configuration resolved once at startup and passed to each component.
 *
 * @param dsn collector connection; {@code null} disables transmission
 * @param environment active environment name
 * @param includedEnvironments environments whose events are sent
 * @param release application release identifier; may be {@code null}
 * @param serverName reporting host name
 * @param tags global tags attached to every event
 * @param sampleRate probability in [0.0, 1.0] that an eligible event is sent
 * @param maxBreadcrumbs breadcrumb bound for contexts created through {@link #newContext()}
 * @param sourceContext source-context lookup settings
 * @param inApp in-app classification prefixes
 * @param filterClass fully qualified {@code EventFilter} implementation; {@code null} keeps the default
 * @param transport transport selection and tuning
 * @param dispatch dispatcher pool sizing
 * @since 0.1.0
 */
public record ClientConfig(
    Dsn dsn,
    String environment,
    Set<String> includedEnvironments,
    String release,
    String serverName,
    Map<String, String> tags,
    double sampleRate,
    int maxBreadcrumbs,
    SourceContextSettings sourceContext,
    InAppSettings inApp,
    String filterClass,
    TransportSettings transport,
    DispatchSettings dispatch) {

  private static final String DEFAULT_ENVIRONMENT = "production";
  private static final String TAG_PREFIX = "tags.";
  private static final int DEFAULT_CONTEXT_LINES = 3;
  private static final int MAX_CONTEXT_LINES = 50;
  private static final int DEFAULT_POOL_SIZE = 10;
  private static final int MAX_POOL_SIZE = 256;
  private static final int DEFAULT_KEEP_ALIVE_SECONDS = 300;
  private static final int MAX_KEEP_ALIVE_SECONDS = 3_600;
  private static final int DEFAULT_TIMEOUT_MILLIS = 5_000;
  private static final int MAX_TIMEOUT_MILLIS = 120_000;
  private static final String DEFAULT_KAFKA_TOPIC = "faultline.events";
  private static final int DEFAULT_WORKERS = 2;
  private static final int MAX_WORKERS = 64;
  private static final int DEFAULT_QUEUE_CAPACITY = 256;
  private static final int MAX_QUEUE_CAPACITY = 65_536;

  public ClientConfig {
    environment = Strings.requireNonBlank("environment", environment);
    includedEnvironments = Collections.unmodifiableSet(new LinkedHashSet<>(
        Objects.requireNonNull(includedEnvironments, "includedEnvironments")));
    tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    Numbers.requireFraction("sampleRate", sampleRate);
    Numbers.requireRange("maxBreadcrumbs", maxBreadcrumbs, 0, 10_000);
    Objects.requireNonNull(sourceContext, "sourceContext");
    Objects.requireNonNull(inApp, "inApp");
    Objects.requireNonNull(transport, "transport");
    Objects.requireNonNull(dispatch, "dispatch");
  }

  /**
   * Returns a disabled configuration (no DSN) with conservative defaults.
   *
   * @return default configuration
   */
  public static ClientConfig defaults() {
    return new ClientConfig(
        null,
        DEFAULT_ENVIRONMENT,
        Set.of(DEFAULT_ENVIRONMENT),
        null,
        defaultServerName(),
        Map.of(),
        1.0d,
        ErrorContext.DEFAULT_MAX_BREADCRUMBS,
        new SourceContextSettings(
            false, Path.of(".").toAbsolutePath().normalize(), SourceContextResolver.DEFAULT_GLOB,
            SourceContextResolver.DEFAULT_EXCLUDES, DEFAULT_CONTEXT_LINES),
        new InAppSettings(List.of(), InAppSettings.DEFAULT_EXCLUDES),
        null,
        new TransportSettings(
            TransportType.HTTP, DEFAULT_POOL_SIZE, DEFAULT_KEEP_ALIVE_SECONDS, DEFAULT_TIMEOUT_MILLIS,
            DEFAULT_TIMEOUT_MILLIS, null, DEFAULT_KAFKA_TOPIC),
        new DispatchSettings(DEFAULT_WORKERS, DEFAULT_QUEUE_CAPACITY));
  }

  /**
   * Resolves a configuration from flattened dotted keys (see {@link YamlConfigLoader}).
   *
   * @param values key/value pairs; may be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static ClientConfig fromMap(Map<String, String> values) {
    Map<String, String> kv = values == null ? Map.of() : new HashMap<>(values);
    ClientConfig defaults = defaults();

    String dsnRaw = kv.get("dsn");
    Dsn dsn = dsnRaw == null || dsnRaw.isBlank() ? null : Dsn.parse(Strings.requireNonBlank("dsn", dsnRaw));

    String environment = Strings.requireNonBlank("environment",
        kv.getOrDefault("environment", defaults.environment()));
    String includedRaw = kv.get("includedEnvironments");
    Set<String> included = includedRaw == null
        ? defaults.includedEnvironments()
        : new LinkedHashSet<>(Strings.splitList(includedRaw));

    String release = blankToNull(kv.get("release"));
    String serverName = Optional.ofNullable(blankToNull(kv.get("serverName"))).orElse(defaults.serverName());

    Map<String, String> tags = new LinkedHashMap<>();
    kv.keySet().stream()
        .filter(key -> key.startsWith(TAG_PREFIX) && key.length() > TAG_PREFIX.length())
        .sorted()
        .forEach(key -> tags.put(key.substring(TAG_PREFIX.length()), kv.get(key)));

    double sampleRate = Numbers.requireFraction("sampleRate",
        Numbers.parseDouble("sampleRate", kv.get("sampleRate"), defaults.sampleRate()));
    int maxBreadcrumbs = parseBoundedInt(kv, "maxBreadcrumbs", defaults.maxBreadcrumbs(), 0, 10_000);

    SourceContextSettings sourceDefaults = defaults.sourceContext();
    String excludesRaw = kv.get("sourceContext.excludes");
    SourceContextSettings sourceContext = new SourceContextSettings(
        parseBoolean(kv.get("sourceContext.enabled"), sourceDefaults.enabled()),
        kv.get("sourceContext.rootPath") == null
            ? sourceDefaults.rootPath()
            : parsePath("sourceContext.rootPath", kv.get("sourceContext.rootPath")),
        Optional.ofNullable(blankToNull(kv.get("sourceContext.glob"))).orElse(sourceDefaults.glob()),
        excludesRaw == null ? sourceDefaults.excludes() : Strings.splitList(excludesRaw),
        parseBoundedInt(kv, "sourceContext.lines", sourceDefaults.lines(), 0, MAX_CONTEXT_LINES));

    String inAppExcludes = kv.get("inApp.excludes");
    InAppSettings inApp = new InAppSettings(
        Strings.splitList(kv.get("inApp.includes")),
        inAppExcludes == null ? defaults.inApp().excludes() : Strings.splitList(inAppExcludes));

    String filterClass = blankToNull(kv.get("filter.class"));

    TransportSettings transportDefaults = defaults.transport();
    TransportType type = TransportType.fromString(kv.get("transport.type"), transportDefaults.type());
    String bootstrapRaw = blankToNull(kv.get("transport.kafka.bootstrap"));
    String bootstrap = bootstrapRaw == null ? null : Net.validateHostPortList(bootstrapRaw);
    if (type == TransportType.KAFKA && bootstrap == null) {
      throw new IllegalArgumentException("transport.kafka.bootstrap is required when transport.type=kafka");
    }
    String topicRaw = blankToNull(kv.get("transport.kafka.topic"));
    TransportSettings transport = new TransportSettings(
        type,
        parseBoundedInt(kv, "transport.poolSize", transportDefaults.poolSize(), 1, MAX_POOL_SIZE),
        parseBoundedInt(kv, "transport.keepAliveSeconds", transportDefaults.keepAliveSeconds(), 1,
            MAX_KEEP_ALIVE_SECONDS),
        parseBoundedInt(kv, "transport.connectTimeoutMillis", transportDefaults.connectTimeoutMillis(), 1,
            MAX_TIMEOUT_MILLIS),
        parseBoundedInt(kv, "transport.readTimeoutMillis", transportDefaults.readTimeoutMillis(), 1,
            MAX_TIMEOUT_MILLIS),
        bootstrap,
        topicRaw == null ? transportDefaults.kafkaTopic() : Strings.sanitizeTopic("transport.kafka.topic", topicRaw));

    int workers = parseBoundedInt(kv, "dispatch.workers", defaults.dispatch().workers(), 1, MAX_WORKERS);
    DispatchSettings dispatch = new DispatchSettings(
        workers,
        parseBoundedInt(kv, "dispatch.queueCapacity", defaults.dispatch().queueCapacity(), 1, MAX_QUEUE_CAPACITY));

    return new ClientConfig(dsn, environment, included, release, serverName, tags, sampleRate, maxBreadcrumbs,
        sourceContext, inApp, filterClass, transport, dispatch);
  }

  /**
   * Indicates whether a DSN is configured.
   *
   * @return {@code true} if events can be transmitted
   */
  public boolean enabled() {
    return dsn != null;
  }

  /**
   * Creates a fresh context honoring {@link #maxBreadcrumbs()}.
   *
   * @return empty context for one execution unit
   */
  public ErrorContext newContext() {
    return new ErrorContext(maxBreadcrumbs);
  }

  private static int parseBoundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    int parsed = Numbers.parseInt(key, kv.get(key), defaultValue);
    Numbers.requireRange(key, parsed, min, max);
    return parsed;
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static String defaultServerName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      String env = System.getenv("HOSTNAME");
      return env == null || env.isBlank() ? "localhost" : env;
    }
  }

  /** Transport implementation selected by {@code transport.type}. */
  public enum TransportType {
    HTTP,
    KAFKA;

    static TransportType fromString(String value, TransportType fallback) {
      if (value == null || value.isBlank()) {
        return fallback;
      }
      try {
        return TransportType.valueOf(value.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("transport.type must be http or kafka (was " + value + ")", ex);
      }
    }
  }

  /**
   * Source-context lookup settings.
   *
   * @param enabled whether in-app frames receive source windows
   * @param rootPath directory frame paths are resolved against
   * @param glob preload glob
   * @param excludes path regexes skipped during lookup and preload
   * @param lines window size on each side of the frame line
   */
  public record SourceContextSettings(boolean enabled, Path rootPath, String glob, List<String> excludes, int lines) {
    public SourceContextSettings {
      Objects.requireNonNull(rootPath, "rootPath");
      glob = Strings.requireNonBlank("sourceContext.glob", glob);
      excludes = List.copyOf(excludes);
    }
  }

  /**
   * In-app classification prefixes. Includes override excludes.
   *
   * @param includes class or module prefixes always treated as application code
   * @param excludes class or module prefixes treated as runtime or dependency code
   */
  public record InAppSettings(List<String> includes, List<String> excludes) {
    /** Runtime prefixes excluded when none are configured. */
    public static final List<String> DEFAULT_EXCLUDES = List.of("java.", "javax.", "jdk.", "sun.", "com.sun.");

    public InAppSettings {
      includes = List.copyOf(includes);
      excludes = List.copyOf(excludes);
    }
  }

  /**
   * Transport selection and tuning.
   *
   * @param type transport implementation
   * @param poolSize maximum idle HTTP connections
   * @param keepAliveSeconds idle connection keep-alive
   * @param connectTimeoutMillis HTTP connect timeout
   * @param readTimeoutMillis HTTP read and write timeout
   * @param kafkaBootstrap Kafka bootstrap servers; required for {@link TransportType#KAFKA}
   * @param kafkaTopic Kafka topic for events
   */
  public record TransportSettings(
      TransportType type,
      int poolSize,
      int keepAliveSeconds,
      int connectTimeoutMillis,
      int readTimeoutMillis,
      String kafkaBootstrap,
      String kafkaTopic) {
    public TransportSettings {
      Objects.requireNonNull(type, "type");
    }
  }

  /**
   * Dispatcher pool sizing.
   *
   * @param workers worker threads
   * @param queueCapacity pending sends before new sends are rejected
   */
  public record DispatchSettings(int workers, int queueCapacity) {}
}
