package ca.gc.cra.faultline.application.source;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads and caches source files so frames can carry a window of surrounding lines.
 * <p><strong>Why:</strong> Context lines let operators read the failing code without checking out the release.</p>
 * <p><strong>Role:</strong> Application service consulted by {@code EventBuilder} for in-app frames.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Cache file contents keyed by path relative to {@code rootPath}.</li>
 *   <li>Optionally preload every file matching the glob, skipping excluded paths.</li>
 *   <li>Resolve Java frames through their package directory, falling back to the bare file name.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Backed by {@link ConcurrentHashMap}; concurrent lookups are safe. Two
 * threads missing the cache at once may both read a file; the first result wins.</p>
 * <p><strong>Performance:</strong> Lookups after the first access are O(1) map reads plus a sublist copy.</p>
 * <p><strong>Observability:</strong> Logs preload totals at INFO and unreadable files at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class SourceContextResolver {
  private static final Logger log = LoggerFactory.getLogger(SourceContextResolver.class);

  /** Glob applied when none is configured. */
  public static final String DEFAULT_GLOB = "**/*.java";
  /** Exclusion patterns applied when none are configured. */
  public static final List<String> DEFAULT_EXCLUDES =
      List.of("(^|/)target/", "(^|/)build/", "(^|/)\\.git/", "(^|/)node_modules/");

  private final Path rootPath;
  private final PathMatcher matcher;
  private final List<Pattern> excludes;
  private final Map<String, List<String>> cache = new ConcurrentHashMap<>();
  private final Map<String, String> byFileName = new ConcurrentHashMap<>();

  /**
   * Creates a resolver rooted at a source directory.
   *
   * @param rootPath directory against which frame paths are resolved; must not be {@code null}
   * @param glob glob selecting files for {@link #preload()}; {@code null} selects {@link #DEFAULT_GLOB}
   * @param excludes regular expressions matched against relative paths; {@code null} selects {@link #DEFAULT_EXCLUDES}
   */
  public SourceContextResolver(Path rootPath, String glob, List<String> excludes) {
    this.rootPath = Objects.requireNonNull(rootPath, "rootPath").toAbsolutePath().normalize();
    this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + (glob == null ? DEFAULT_GLOB : glob));
    this.excludes = (excludes == null ? DEFAULT_EXCLUDES : excludes).stream().map(Pattern::compile).toList();
  }

  /**
   * Walks {@code rootPath} and caches every matching, non-excluded file.
   *
   * @return number of files cached
   * @throws IOException if the directory walk fails
   */
  public int preload() throws IOException {
    if (!Files.isDirectory(rootPath)) {
      log.warn("Source context root {} is not a directory; skipping preload", rootPath);
      return 0;
    }
    int loaded = 0;
    try (Stream<Path> paths = Files.walk(rootPath)) {
      for (Path path : (Iterable<Path>) paths.filter(Files::isRegularFile)::iterator) {
        String relative = relativize(path);
        if (isExcluded(relative) || !matcher.matches(rootPath.relativize(path))) {
          continue;
        }
        if (!lines(relative).isEmpty()) {
          loaded++;
        }
      }
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    }
    log.info("Preloaded {} source files from {}", loaded, rootPath);
    return loaded;
  }

  /**
   * Returns the context window around a line.
   *
   * @param path file path relative to {@code rootPath} (forward slashes)
   * @param lineno one-based line number
   * @param windowSize number of lines to include on each side; negative values are treated as zero
   * @return context window, or empty when the file is unknown or the line is out of range
   */
  public Optional<SourceContext> resolve(String path, int lineno, int windowSize) {
    if (path == null || path.isBlank() || lineno <= 0) {
      return Optional.empty();
    }
    List<String> lines = lines(normalize(path));
    if (lineno > lines.size()) {
      return Optional.empty();
    }
    int window = Math.max(0, windowSize);
    int index = lineno - 1;
    List<String> pre = lines.subList(Math.max(0, index - window), index);
    List<String> post = lines.subList(index + 1, Math.min(lines.size(), index + 1 + window));
    return Optional.of(new SourceContext(lines.get(index), pre, post));
  }

  /**
   * Resolves a Java frame by mapping its declaring class to a package directory.
   *
   * <p>{@code com.acme.Worker} with file {@code Worker.java} is looked up as {@code com/acme/Worker.java};
   * when that misses, the bare file name is tried, then any preloaded file with the same name.</p>
   *
   * @param declaringClass fully qualified class name; may be {@code null}
   * @param fileName source file name reported by the stack frame; may be {@code null}
   * @param lineno one-based line number
   * @param windowSize lines on each side
   * @return context window or empty
   */
  public Optional<SourceContext> resolveFrame(String declaringClass, String fileName, int lineno, int windowSize) {
    if (fileName == null || fileName.isBlank()) {
      return Optional.empty();
    }
    if (declaringClass != null) {
      int dot = declaringClass.lastIndexOf('.');
      if (dot > 0) {
        String packagePath = declaringClass.substring(0, dot).replace('.', '/');
        Optional<SourceContext> byPackage = resolve(packagePath + "/" + fileName, lineno, windowSize);
        if (byPackage.isPresent()) {
          return byPackage;
        }
      }
    }
    Optional<SourceContext> direct = resolve(fileName, lineno, windowSize);
    if (direct.isPresent()) {
      return direct;
    }
    String indexed = byFileName.get(fileName);
    return indexed == null ? Optional.empty() : resolve(indexed, lineno, windowSize);
  }

  /**
   * Returns the number of cached files. Paths that could not be read are not cached.
   *
   * @return cache size
   */
  public int cachedFiles() {
    return cache.size();
  }

  private List<String> lines(String relative) {
    List<String> cached = cache.get(relative);
    if (cached != null) {
      return cached;
    }
    Optional<List<String>> loaded = load(relative);
    if (loaded.isEmpty()) {
      return List.of();
    }
    List<String> previous = cache.putIfAbsent(relative, loaded.get());
    return previous == null ? loaded.get() : previous;
  }

  private Optional<List<String>> load(String relative) {
    if (isExcluded(relative)) {
      return Optional.empty();
    }
    Path file;
    try {
      file = rootPath.resolve(relative).normalize();
    } catch (InvalidPathException ex) {
      log.debug("Frame path {} is not a valid file path", relative);
      return Optional.empty();
    }
    if (!file.startsWith(rootPath) || !Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      List<String> lines = List.copyOf(Files.readAllLines(file, StandardCharsets.UTF_8));
      Path name = file.getFileName();
      if (name != null) {
        byFileName.putIfAbsent(name.toString(), relative);
      }
      return Optional.of(lines);
    } catch (MalformedInputException ex) {
      log.debug("Source file {} is not UTF-8; skipping", relative);
      return Optional.empty();
    } catch (IOException ex) {
      log.debug("Unable to read source file {}: {}", relative, ex.getMessage());
      return Optional.empty();
    }
  }

  private boolean isExcluded(String relative) {
    for (Pattern pattern : excludes) {
      if (pattern.matcher(relative).find()) {
        return true;
      }
    }
    return false;
  }

  private String relativize(Path path) {
    return normalize(rootPath.relativize(path).toString());
  }

  private static String normalize(String path) {
    String normalized = path.replace('\\', '/');
    while (normalized.startsWith("./")) {
      normalized = normalized.substring(2);
    }
    while (normalized.startsWith("/")) {
      normalized = normalized.substring(1);
    }
    return normalized;
  }
}
