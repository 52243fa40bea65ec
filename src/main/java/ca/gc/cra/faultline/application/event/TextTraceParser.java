package ca.gc.cra.faultline.application.event;

import ca.gc.cra.faultline.domain.event.Event;
import ca.gc.cra.faultline.domain.event.ExceptionValue;
import ca.gc.cra.faultline.domain.event.Frame;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Line-oriented state machine that turns a rendered failure report into event fields.
 * <p><strong>Why:</strong> Out-of-band reports (crash logs, logged stack traces) often arrive as text only, without
 * structured frame data.</p>
 * <p><strong>Role:</strong> Used by {@code EventBuilder#buildFromText}; each line is classified, then applied to an
 * accumulator.</p>
 * <p><strong>Line classes</strong> (tried in order):
 * <ol>
 *   <li>{@link LineClass#SUMMARY}: {@code ** (Type) Value}, {@code Error in process ...}, a Java summary
 *       ({@code [Exception in thread "t" ]pkg.SomeException[: msg]}), or {@code Caused by: ...}.</li>
 *   <li>{@link LineClass#FRAME}: an indented {@code [(app) ]file:line: function} line or a Java
 *       {@code at [module/]pkg.Class.method(File.java:42)} line.</li>
 *   <li>{@link LineClass#METADATA}: {@code Last message:}, {@code State:}, {@code Function:}, {@code Args:}.</li>
 *   <li>{@link LineClass#OTHER}: ignored.</li>
 * </ol>
 * <p><strong>Error handling:</strong> Never throws on malformed input. Frame-shaped lines that do not yield a valid
 * frame (missing or non-positive line number) are dropped and parsing continues.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls; each {@link #parse} call owns its accumulator.</p>
 *
 * @since 0.1.0
 */
public final class TextTraceParser {
  private static final Pattern FAILURE_SUMMARY = Pattern.compile("^\\s*\\*\\* \\((.+?)\\) (.+)$");
  private static final Pattern ERROR_IN_PROCESS = Pattern.compile("^Error in process .*$");
  private static final Pattern JAVA_SUMMARY = Pattern.compile(
      "^(?:Exception in thread \"[^\"]*\" )?((?:[A-Za-z_$][\\w$]*\\.)+[A-Za-z_$][\\w$]*(?:Exception|Error|Throwable))"
          + "(?:: ?(.*))?$");
  private static final Pattern CAUSED_BY = Pattern.compile(
      "^\\s*Caused by: ((?:[A-Za-z_$][\\w$]*\\.)*[A-Za-z_$][\\w$]*)(?:: ?(.*))?$");
  private static final Pattern SUPPRESSED = Pattern.compile("^\\s*Suppressed: .*$");
  private static final Pattern TEXT_FRAME = Pattern.compile("^\\s+(?:\\((.+?)\\) )?(.+?):(\\d+): (.+)$");
  private static final Pattern JAVA_FRAME = Pattern.compile(
      "^\\s+at (?:([^/\\s(]+)/)?((?:[\\w$]+\\.)*[\\w$]+)\\.([\\w$<>]+)\\((.*)\\)$");
  private static final Pattern JAVA_LOCATION = Pattern.compile("^(.+):(\\d+)$");
  private static final Pattern METADATA = Pattern.compile("^\\s*(Last message|State|Function|Args): (.*)$");

  private static final Map<String, String> METADATA_KEYS = Map.of(
      "Last message", "last_message",
      "State", "state",
      "Function", "function",
      "Args", "args");

  private final InAppClassifier classifier;

  /**
   * @param classifier in-app classifier applied to parsed frames
   */
  public TextTraceParser(InAppClassifier classifier) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
  }

  /** Line classes recognized by the parser. */
  public enum LineClass {
    SUMMARY,
    FRAME,
    METADATA,
    OTHER
  }

  /**
   * Classifies a single line without applying it.
   *
   * @param line raw line; {@code null} is {@link LineClass#OTHER}
   * @return line class
   */
  public LineClass classify(String line) {
    if (line == null) {
      return LineClass.OTHER;
    }
    if (FAILURE_SUMMARY.matcher(line).matches()
        || ERROR_IN_PROCESS.matcher(line).matches()
        || JAVA_SUMMARY.matcher(line).matches()
        || CAUSED_BY.matcher(line).matches()
        || SUPPRESSED.matcher(line).matches()) {
      return LineClass.SUMMARY;
    }
    if (TEXT_FRAME.matcher(line).matches() || JAVA_FRAME.matcher(line).matches()) {
      return LineClass.FRAME;
    }
    if (METADATA.matcher(line).matches()) {
      return LineClass.METADATA;
    }
    return LineClass.OTHER;
  }

  /**
   * Parses a rendered report into the builder.
   *
   * <p>Frames are printed innermost first, so each parsed frame is inserted at the outermost position, leaving the
   * builder's frame list ordered outer to inner. The first parsed frame sets the culprit when none is set.</p>
   *
   * @param text rendered report; {@code null} leaves the builder untouched
   * @param builder event builder receiving message, exceptions, frames, culprit, and extra
   */
  public void parse(String text, Event.Builder builder) {
    if (text == null || text.isEmpty()) {
      return;
    }
    Accumulator accumulator = new Accumulator(builder);
    for (String rawLine : text.split("\\R")) {
      switch (classify(rawLine)) {
        case SUMMARY -> accumulator.summary(rawLine);
        case FRAME -> accumulator.frame(rawLine);
        case METADATA -> accumulator.metadata(rawLine);
        default -> {
          // Not part of the report structure.
        }
      }
    }
  }

  private enum Section {
    PRIMARY,
    NESTED
  }

  private final class Accumulator {
    private final Event.Builder builder;
    private Section section = Section.PRIMARY;

    Accumulator(Event.Builder builder) {
      this.builder = builder;
    }

    void summary(String line) {
      Matcher failure = FAILURE_SUMMARY.matcher(line);
      if (failure.matches()) {
        String type = failure.group(1);
        String value = failure.group(2);
        builder.message("(" + type + ") " + value);
        builder.exceptions(List.of(ExceptionValue.of(type, value)));
        builder.culprit(null);
        section = Section.PRIMARY;
        return;
      }
      if (ERROR_IN_PROCESS.matcher(line).matches()) {
        builder.message(line);
        return;
      }
      Matcher caused = CAUSED_BY.matcher(line);
      if (caused.matches()) {
        builder.addException(exceptionFor(caused.group(1), caused.group(2)));
        section = Section.NESTED;
        return;
      }
      if (SUPPRESSED.matcher(line).matches()) {
        section = Section.NESTED;
        return;
      }
      Matcher java = JAVA_SUMMARY.matcher(line);
      if (java.matches()) {
        builder.exceptions(List.of(exceptionFor(java.group(1), java.group(2))));
        builder.culprit(null);
        section = Section.PRIMARY;
      }
    }

    void frame(String line) {
      if (section != Section.PRIMARY) {
        return;
      }
      Frame frame = parseFrame(line);
      if (frame == null) {
        return;
      }
      if (builder.culprit() == null) {
        builder.culprit(frame.qualifiedFunction());
      }
      builder.prependFrame(frame);
    }

    void metadata(String line) {
      Matcher matcher = METADATA.matcher(line);
      if (matcher.matches()) {
        builder.extraIfAbsent(METADATA_KEYS.get(matcher.group(1)), matcher.group(2));
      }
    }
  }

  private Frame parseFrame(String line) {
    Matcher java = JAVA_FRAME.matcher(line);
    if (java.matches()) {
      Matcher location = JAVA_LOCATION.matcher(java.group(4));
      if (!location.matches()) {
        return null;
      }
      int lineno = parseLine(location.group(2));
      if (lineno <= 0) {
        return null;
      }
      String app = moduleName(java.group(1));
      String declaringClass = java.group(2);
      return Frame.of(location.group(1), java.group(3), declaringClass, lineno,
          classifier.isInApp(app, declaringClass));
    }
    Matcher text = TEXT_FRAME.matcher(line);
    if (text.matches()) {
      int lineno = parseLine(text.group(3));
      if (lineno <= 0) {
        return null;
      }
      String function = text.group(4).trim();
      if (function.isEmpty()) {
        return null;
      }
      return Frame.of(text.group(2), function, null, lineno, classifier.isInApp(text.group(1), function));
    }
    return null;
  }

  // Strips a module version suffix such as "java.base@17.0.2".
  private static String moduleName(String raw) {
    if (raw == null) {
      return null;
    }
    int at = raw.indexOf('@');
    return at < 0 ? raw : raw.substring(0, at);
  }

  private static int parseLine(String digits) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException ex) {
      return -1;
    }
  }

  private static ExceptionValue exceptionFor(String qualifiedType, String message) {
    int dot = qualifiedType.lastIndexOf('.');
    String simple = dot < 0 ? qualifiedType : qualifiedType.substring(dot + 1);
    String module = dot < 0 ? null : qualifiedType.substring(0, dot);
    String value = message == null || message.isBlank() ? null : message;
    return new ExceptionValue(simple, value, module);
  }
}
