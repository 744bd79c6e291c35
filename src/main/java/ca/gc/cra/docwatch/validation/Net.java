package ca.gc.cra.docwatch.validation;

import java.util.regex.Pattern;

/**
 * Network endpoint validation utilities for relay configuration.
 */
public final class Net {

  // RFC-conservative bounds
  private static final int MAX_HOSTNAME_LENGTH = 253;   // total length
  private static final int MAX_LABEL_LENGTH    = 63;    // per label

  // IPv4 dotted-quad shape (fast pre-check); we still range-check octets.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a relay host name or IPv4 literal.
   *
   * @param name logical parameter name for diagnostics
   * @param host candidate host
   * @return trimmed host
   * @throws IllegalArgumentException when the host is blank or malformed
   */
  public static String validateHost(String name, String host) {
    String sanitized = Strings.requireNonBlank(name, host);
    try {
      if (IPV4_PATTERN.matcher(sanitized).matches()) {
        validateIpv4Octets(sanitized);
      } else {
        validateHostname(sanitized);
      }
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(name + ": " + ex.getMessage(), ex);
    }
    return sanitized;
  }

  /**
   * Validates a TCP port.
   *
   * @param name logical parameter name for diagnostics
   * @param port candidate port
   * @return the port
   * @throws IllegalArgumentException when outside 1..65535
   */
  public static int validatePort(String name, int port) {
    Numbers.requireRange(name, port, 1, 65535);
    return port;
  }

  /** Deterministic hostname validator (ASCII/Punycode). */
  private static void validateHostname(String host) {
    final int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }

    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break; // last label done
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  /**
   * Validates a single label [start,end):
   * - length 1..63
   * - first/last are alnum
   * - interior chars are alnum or '-'
   */
  private static void validateLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }

    final char first = s.charAt(start);
    final char last  = s.charAt(end - 1);
    if (!isAsciiAlnum(first) || !isAsciiAlnum(last)) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }

    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  /** Parses and range-checks IPv4 octets (0..255). */
  private static void validateIpv4Octets(String host) {
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      final int endIndex = (i < 3) ? host.indexOf('.', startIndex) : host.length();
      final int octet = Integer.parseInt(host.substring(startIndex, endIndex));
      Numbers.requireRange("IPv4 octet", octet, 0, 255);
      startIndex = endIndex + 1;
    }
  }

  /** Fast ASCII alphanumeric check (no locale). */
  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
