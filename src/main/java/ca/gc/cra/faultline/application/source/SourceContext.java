package ca.gc.cra.faultline.application.source;

import java.util.List;
import java.util.Objects;

/**
 * Source window around a frame's line.
 *
 * @param contextLine the line itself
 * @param preContext preceding lines in file order
 * @param postContext following lines in file order
 * @since 0.1.0
 */
public record SourceContext(String contextLine, List<String> preContext, List<String> postContext) {
  public SourceContext {
    Objects.requireNonNull(contextLine, "contextLine");
    preContext = List.copyOf(preContext);
    postContext = List.copyOf(postContext);
  }
}
