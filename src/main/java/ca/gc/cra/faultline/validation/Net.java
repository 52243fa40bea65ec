package ca.gc.cra.faultline.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates broker endpoint lists such as {@code transport.kafka.bootstrap}.
 *
 * @since 0.1.0
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final Pattern LABEL = Pattern.compile("[A-Za-z0-9](?:[A-Za-z0-9-]{0,61}[A-Za-z0-9])?");
  private static final Pattern IPV6_BODY = Pattern.compile("[0-9A-Fa-f:.%]+");

  private Net() {
    // Utility
  }

  /**
   * Validates a single {@code host:port} pair; IPv6 literals must be bracketed.
   *
   * @param value candidate endpoint
   * @return normalized {@code host:port}
   * @throws IllegalArgumentException if the host or port is invalid
   */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    String host;
    String portPart;
    if (sanitized.startsWith("[")) {
      int idx = sanitized.indexOf(']');
      if (idx < 0 || idx + 1 >= sanitized.length() || sanitized.charAt(idx + 1) != ':') {
        throw new IllegalArgumentException("host:port must use [IPv6]:PORT format");
      }
      String literal = sanitized.substring(1, idx);
      if (!IPV6_BODY.matcher(literal).matches()) {
        throw new IllegalArgumentException("invalid IPv6 literal: " + literal);
      }
      host = '[' + literal + ']';
      portPart = sanitized.substring(idx + 2);
    } else {
      int lastColon = sanitized.lastIndexOf(':');
      if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
        throw new IllegalArgumentException("host:port must use HOST:PORT format");
      }
      host = sanitized.substring(0, lastColon);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 host must be wrapped in [ ]");
      }
      validateHostname(host);
      portPart = sanitized.substring(lastColon + 1);
    }
    int port = Numbers.parseInt("port", portPart, -1);
    Numbers.requireRange("port", port, 1, 65_535);
    return host + ':' + port;
  }

  /**
   * Validates a comma-separated list of {@code host:port} pairs.
   *
   * @param value candidate list
   * @return normalized list joined with commas
   * @throws IllegalArgumentException if the list is empty or any entry is invalid
   */
  public static String validateHostPortList(String value) {
    List<String> entries = Strings.splitList(Strings.requireNonBlank("bootstrap", value));
    if (entries.isEmpty()) {
      throw new IllegalArgumentException("bootstrap must list at least one host:port");
    }
    List<String> normalized = new ArrayList<>(entries.size());
    for (String entry : entries) {
      normalized.add(validateHostPort(entry));
    }
    return String.join(",", normalized);
  }

  private static void validateHostname(String host) {
    if (host.length() > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("hostname exceeds " + MAX_HOSTNAME_LENGTH + " characters");
    }
    for (String label : host.split("\\.", -1)) {
      if (!LABEL.matcher(label).matches()) {
        throw new IllegalArgumentException("invalid hostname: " + host);
      }
    }
  }
}
