package ca.gc.cra.warden.infrastructure.auth;

import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.domain.auth.UserCredentials;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Serializes and restores credential state as a small JSON document.
 *
 * <p>An empty or whitespace-only stream restores to {@link UserCredentials#empty()}. A document written by a
 * different authentication method, with an unsupported version, or with malformed JSON is rejected with
 * {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class SessionStateCodec {
  static final int FORMAT_VERSION = 1;

  private final ObjectMapper mapper;
  private final ClockPort clock;

  /**
   * Creates a codec stamping documents with the system clock.
   */
  public SessionStateCodec() {
    this(ClockPort.SYSTEM);
  }

  /**
   * Creates a codec stamping documents with the supplied clock.
   *
   * @param clock time source for {@code savedAt}; never {@code null}
   */
  public SessionStateCodec(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * Writes the state of a signed-in (or configured) user.
   *
   * @param method authentication method writing the document; never {@code null}
   * @param username username; may be {@code null}
   * @param accessToken bearer token; may be {@code null}
   * @return stream over the UTF-8 JSON document
   */
  public InputStream encode(String method, String username, String accessToken) {
    Objects.requireNonNull(method, "method");
    SessionState state = new SessionState(FORMAT_VERSION, method, username, accessToken, clock.now());
    try {
      return new ByteArrayInputStream(mapper.writeValueAsBytes(state));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize session state", ex);
    }
  }

  /**
   * Restores credentials from a document written by {@link #encode(String, String, String)}.
   *
   * @param method authentication method expected in the document; never {@code null}
   * @param stream serialized state; never {@code null}
   * @return restored credentials without a password
   * @throws UncheckedIOException if the stream cannot be read
   * @throws IllegalArgumentException if the document is malformed or belongs to another method
   */
  public UserCredentials decode(String method, InputStream stream) {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(stream, "stream");
    byte[] raw;
    try {
      raw = stream.readAllBytes();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read session state", ex);
    }
    if (new String(raw, StandardCharsets.UTF_8).isBlank()) {
      return UserCredentials.empty();
    }
    SessionState state;
    try {
      state = mapper.readValue(raw, SessionState.class);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Malformed session state document", ex);
    }
    if (state == null) {
      throw new IllegalArgumentException("Session state document is empty (null)");
    }
    if (state.version() != FORMAT_VERSION) {
      throw new IllegalArgumentException("Unsupported session state version " + state.version());
    }
    if (!method.equals(state.method())) {
      throw new IllegalArgumentException(
          "Session state was written by method '" + state.method() + "', expected '" + method + "'");
    }
    return new UserCredentials(state.username(), null, state.accessToken());
  }
}
