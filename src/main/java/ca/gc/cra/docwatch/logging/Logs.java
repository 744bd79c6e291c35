package ca.gc.cra.docwatch.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Shapes relay replies and account names before they reach operator logs.
 * <p><strong>Why:</strong> SMTP servers answer with multi-line replies of arbitrary size, and mailbox
 * names identify people.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Folds a relay reply onto one line and caps it at {@code maxBytes} of UTF-8.
   *
   * @param value reply or exception message; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return single-line text, suffixed with the original length when shortened
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String detail(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    String folded = value.strip().replaceAll("\\s*[\\r\\n]+\\s*", " | ");
    byte[] bytes = folded.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return folded;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer kept = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return kept + "... (" + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "...";
    }
  }

  /**
   * Masks the local part of a mailbox: {@code sender@qq.com} becomes {@code s***@qq.com}.
   *
   * @param address mailbox; values without {@code @} are masked whole
   * @return masked mailbox
   */
  public static String maskAddress(String address) {
    if (address == null || address.isBlank()) {
      return NULL_PLACEHOLDER;
    }
    String trimmed = address.strip();
    int at = trimmed.indexOf('@');
    if (at <= 0) {
      return "***";
    }
    return trimmed.charAt(0) + "***" + trimmed.substring(at);
  }
}
