package ca.gc.cra.layeredconfig.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Logging hygiene helpers that keep configuration values out of logs when they look sensitive.
 * <p><strong>Why:</strong> Resolution debug logs echo values; credentials supplied through environment variables or
 * command lines must not leak into operator logs.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used by the resolver and the sources.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Truncate UTF-8 values to a safe byte budget while preserving readability.</li>
 *   <li>Redact values whose key names suggest secrets.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final int DEFAULT_MAX_BYTES = 128;
  private static final Pattern SENSITIVE_KEY =
      Pattern.compile(".*(password|passwd|secret|token|credential|apikey|api_key|private).*");

  private Logs() {
    // Utility
  }

  /**
   * Renders a configuration value for a log line: redacted when the key looks sensitive, truncated otherwise.
   *
   * @param key configuration key the value belongs to; may be {@code null}
   * @param value value to render; may be {@code null}
   * @return loggable representation
   */
  public static String describe(String key, Object value) {
    if (isSensitive(key)) {
      return redact(value == null ? null : value.toString());
    }
    return truncate(value == null ? null : value.toString(), DEFAULT_MAX_BYTES);
  }

  /**
   * Returns whether a key name suggests a secret.
   *
   * @param key key name; {@code null} is never sensitive
   * @return {@code true} for names containing password, secret, token and similar markers
   */
  public static boolean isSensitive(String key) {
    return key != null && SENSITIVE_KEY.matcher(key.toLowerCase(Locale.ROOT)).matches();
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String utf16Safe = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return utf16Safe + "... (truncated)";
    }
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent API usage
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }
}
