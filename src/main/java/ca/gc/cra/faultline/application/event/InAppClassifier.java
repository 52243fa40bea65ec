package ca.gc.cra.faultline.application.event;

import java.util.List;
import java.util.Set;

/**
 * Decides whether a frame belongs to application code.
 *
 * <p>A class or module matching an include prefix is always in-app. Otherwise a match against an exclude prefix
 * marks it as runtime or dependency code. Anything else is in-app.</p>
 *
 * @since 0.1.0
 */
public final class InAppClassifier {
  /** Runtime application names recognized in rendered text frames. */
  public static final Set<String> RUNTIME_APPS = Set.of("stdlib", "elixir", "kernel", "java.base");

  private final List<String> includes;
  private final List<String> excludes;

  /**
   * @param includes prefixes always in-app
   * @param excludes prefixes never in-app unless included
   */
  public InAppClassifier(List<String> includes, List<String> excludes) {
    this.includes = List.copyOf(includes);
    this.excludes = List.copyOf(excludes);
  }

  /**
   * Classifies a fully qualified class or module name.
   *
   * @param name qualified name; {@code null} is treated as in-app
   * @return {@code true} for application code
   */
  public boolean isInApp(String name) {
    if (name == null) {
      return true;
    }
    if (matches(includes, name)) {
      return true;
    }
    return !matches(excludes, name);
  }

  /**
   * Classifies a text frame that may carry an owning application or runtime module.
   *
   * @param app application or module prefix from the frame (e.g., {@code stdlib}, {@code java.base}); may be
   *     {@code null}
   * @param name qualified class or function name
   * @return {@code true} for application code
   */
  public boolean isInApp(String app, String name) {
    if (app != null && RUNTIME_APPS.contains(app) && !matches(includes, name == null ? "" : name)) {
      return false;
    }
    return isInApp(name);
  }

  private static boolean matches(List<String> prefixes, String name) {
    for (String prefix : prefixes) {
      if (name.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}
