package ca.gc.cra.faultline.domain.event;

/**
 * One entry of an event's exception list.
 *
 * @param type exception type label (simple class name, or a termination kind such as {@code exit})
 * @param value rendered message; may be {@code null} when the exception carried none
 * @param module declaring package; may be {@code null}
 * @since 0.1.0
 */
public record ExceptionValue(String type, String value, String module) {
  public ExceptionValue {
    if (type == null || type.isBlank()) {
      throw new IllegalArgumentException("type must not be blank");
    }
  }

  /**
   * Creates an exception entry without a module.
   *
   * @param type exception type label
   * @param value rendered message
   * @return exception entry
   */
  public static ExceptionValue of(String type, String value) {
    return new ExceptionValue(type, value, null);
  }
}
