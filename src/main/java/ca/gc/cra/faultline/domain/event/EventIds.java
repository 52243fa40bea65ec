package ca.gc.cra.faultline.domain.event;

import java.util.UUID;

/**
 * Generates event identifiers: 32 lowercase hexadecimal characters derived from a random UUID.
 *
 * @since 0.1.0
 */
public final class EventIds {
  private EventIds() {}

  /**
   * Returns a fresh identifier.
   *
   * @return 32-character lowercase hex string
   */
  public static String next() {
    UUID uuid = UUID.randomUUID();
    return hex(uuid.getMostSignificantBits()) + hex(uuid.getLeastSignificantBits());
  }

  private static String hex(long bits) {
    String digits = Long.toHexString(bits);
    if (digits.length() == 16) {
      return digits;
    }
    return "0".repeat(16 - digits.length()) + digits;
  }
}
