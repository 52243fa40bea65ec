package ca.gc.cra.faultline.application.event;

import ca.gc.cra.faultline.domain.event.Frame;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts JVM stack trace elements into event frames.
 *
 * @since 0.1.0
 */
final class StackFrames {
  private StackFrames() {}

  /**
   * Maps elements (innermost first, as the JVM reports them) to frames ordered outer to inner.
   * Elements without a positive line number are skipped.
   *
   * @param elements stack elements
   * @param classifier in-app classifier
   * @return frames, outermost first
   */
  static List<Frame> toFrames(List<StackTraceElement> elements, InAppClassifier classifier) {
    List<Frame> frames = new ArrayList<>(elements.size());
    for (int i = elements.size() - 1; i >= 0; i--) {
      StackTraceElement element = elements.get(i);
      if (element == null || element.getLineNumber() <= 0) {
        continue;
      }
      frames.add(Frame.of(
          element.getFileName(),
          element.getMethodName(),
          element.getClassName(),
          element.getLineNumber(),
          classifier.isInApp(element.getModuleName(), element.getClassName())));
    }
    return frames;
  }
}
