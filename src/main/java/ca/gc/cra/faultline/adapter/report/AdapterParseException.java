package ca.gc.cra.faultline.adapter.report;

/**
 * Raised when an adapter receives a report shape it does not understand. Never escapes the adapter.
 *
 * @since 0.1.0
 */
public final class AdapterParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public AdapterParseException(String message) {
    super(message);
  }
}
