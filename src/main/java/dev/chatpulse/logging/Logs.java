package dev.chatpulse.logging;

import java.nio.charset.StandardCharsets;

/**
 * Log hygiene for chat text and room credentials.
 *
 * <p>Chat lines are user-generated and can be arbitrarily long, and an entry token grants access to the
 * room, so neither is written to operator logs verbatim. Stateless.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Byte budget for chat text in log lines. */
  public static final int CHAT_TEXT_BUDGET = 64;

  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {}

  /**
   * Cuts {@code value} to at most {@code maxBytes} of UTF-8 without splitting a code point, and notes
   * the original size.
   *
   * @param value text to shorten; {@code null} yields {@code "<null>"}
   * @param maxBytes UTF-8 byte budget, positive
   * @return {@code value} when it fits, otherwise its longest whole-character prefix plus a
   *     {@code "... (truncated, n of m bytes)"} suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int total = value.getBytes(StandardCharsets.UTF_8).length;
    if (total <= maxBytes) {
      return value;
    }
    int used = 0;
    int end = 0;
    while (end < value.length()) {
      int cp = value.codePointAt(end);
      int width = utf8Width(cp);
      if (used + width > maxBytes) {
        break;
      }
      used += width;
      end += Character.charCount(cp);
    }
    return value.substring(0, end) + "... (truncated, " + maxBytes + " of " + total + " bytes)";
  }

  /**
   * Masks a credential.
   *
   * @param value secret; only its presence is reported
   * @return {@code "[REDACTED]"}, or {@code "<null>"} when nothing was supplied
   */
  public static String redact(String value) {
    return value == null ? NULL_PLACEHOLDER : REDACTED_PLACEHOLDER;
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
