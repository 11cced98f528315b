package ca.gc.cra.warden.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers that minimize sensitive payload exposure.
 * <p><strong>Why:</strong> Identity provider responses can be large and credentials must never be logged.
 * <p><strong>Role:</strong> Cross-cutting utility used by credentials, transports, and the session orchestrator.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final int TOKEN_HINT_CHARS = 4;

  private Logs() {
    // Utility
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
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent call sites
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Produces a short, non-reversible hint identifying a token in logs (its first four characters and length).
   *
   * @param token bearer token; may be {@code null}
   * @return hint such as {@code "eyJh...(212 chars)"}, or {@code "<none>"} when absent
   */
  public static String tokenHint(String token) {
    if (token == null || token.isEmpty()) {
      return "<none>";
    }
    if (token.length() <= TOKEN_HINT_CHARS * 2) {
      return REDACTED_PLACEHOLDER;
    }
    return token.substring(0, TOKEN_HINT_CHARS) + "...(" + token.length() + " chars)";
  }

  /**
   * Formats an optional username for log lines, substituting {@code [Anonymous]} when absent.
   *
   * @param username candidate username; may be {@code null}
   * @return printable user label
   */
  public static String userLabel(String username) {
    return username == null || username.isBlank() ? "[Anonymous]" : username;
  }
}
