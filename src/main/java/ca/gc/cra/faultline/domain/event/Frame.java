package ca.gc.cra.faultline.domain.event;

import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> One stack location inside an {@link Event}.
 * <p><strong>Why:</strong> Normalizes Java stack trace elements and rendered text frames into a single shape.</p>
 * <p><strong>Role:</strong> Domain value object serialized under {@code stacktrace.frames}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; list fields are defensively copied.</p>
 *
 * @param filename source file name as reported by the runtime (e.g., {@code Worker.java})
 * @param function method or function name
 * @param module declaring class or module; may be {@code null}
 * @param lineno one-based line number; always positive
 * @param colno column number; may be {@code null}
 * @param absPath absolute source path; may be {@code null}
 * @param contextLine source line at {@code lineno}; {@code null} unless source context was resolved
 * @param preContext lines before {@code contextLine}; {@code null} unless source context was resolved
 * @param postContext lines after {@code contextLine}; {@code null} unless source context was resolved
 * @param inApp whether the frame belongs to application code
 * @param vars local variables; always empty
 * @since 0.1.0
 */
public record Frame(
    String filename,
    String function,
    String module,
    int lineno,
    Integer colno,
    String absPath,
    String contextLine,
    List<String> preContext,
    List<String> postContext,
    boolean inApp,
    Map<String, Object> vars) {

  public Frame {
    if (lineno <= 0) {
      throw new IllegalArgumentException("lineno must be positive (was " + lineno + ")");
    }
    if (function == null || function.isBlank()) {
      throw new IllegalArgumentException("function must not be blank");
    }
    preContext = preContext == null ? null : List.copyOf(preContext);
    postContext = postContext == null ? null : List.copyOf(postContext);
    vars = Map.of();
  }

  /**
   * Creates a frame without source context.
   *
   * @param filename source file name; may be {@code null}
   * @param function function name
   * @param module declaring module; may be {@code null}
   * @param lineno positive line number
   * @param inApp whether the frame belongs to application code
   * @return frame
   * @throws IllegalArgumentException if {@code lineno} is not positive
   */
  public static Frame of(String filename, String function, String module, int lineno, boolean inApp) {
    return new Frame(filename, function, module, lineno, null, null, null, null, null, inApp, Map.of());
  }

  /**
   * Returns a copy carrying the given source window.
   *
   * @param line source line at {@link #lineno()}
   * @param pre preceding lines, oldest first
   * @param post following lines
   * @return new frame with context populated
   */
  public Frame withSourceContext(String line, List<String> pre, List<String> post) {
    return new Frame(filename, function, module, lineno, colno, absPath, line, pre, post, inApp, vars);
  }

  /**
   * Returns the function name prefixed by its module when one is known.
   *
   * @return {@code module.function} or {@code function}
   */
  public String qualifiedFunction() {
    return module == null || module.isEmpty() ? function : module + "." + function;
  }
}
