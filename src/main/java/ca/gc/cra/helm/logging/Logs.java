package ca.gc.cra.helm.logging;

import java.nio.charset.StandardCharsets;

/**
 * Bounds player-supplied text before it reaches a log line.
 *
 * <p>Commands and messages are free-form, so routing and session logs pass them through {@link #truncate(String)}.
 * Cuts always fall on a code point boundary.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** UTF-8 bytes kept by {@link #truncate(String)}. */
  public static final int DEFAULT_MAX_BYTES = 256;

  private Logs() {
    // Utility
  }

  public static String truncate(String value) {
    return truncate(value, DEFAULT_MAX_BYTES);
  }

  /**
   * Keeps at most {@code maxBytes} UTF-8 bytes of {@code value}, appending {@code ... (truncated, kept of total)}
   * when anything was cut.
   *
   * @param value text to bound; {@code null} yields {@code "<null>"}
   * @param maxBytes byte limit; must be positive
   * @return {@code value} itself when it fits, otherwise the shortened form
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return "<null>";
    }
    int total = value.getBytes(StandardCharsets.UTF_8).length;
    if (total <= maxBytes) {
      return value;
    }
    int kept = 0;
    int end = 0;
    while (end < value.length()) {
      int codePoint = value.codePointAt(end);
      int width = utf8Width(codePoint);
      if (kept + width > maxBytes) {
        break;
      }
      kept += width;
      end += Character.charCount(codePoint);
    }
    return value.substring(0, end) + "... (truncated, " + maxBytes + " of " + total + ")";
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
