package ca.gc.cra.warden.infrastructure.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.auth.UserCredentials;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SessionStateCodecTest {
  private static final long SAVED_AT = Instant.parse("2024-03-01T12:00:00Z").toEpochMilli();

  private final SessionStateCodec codec = new SessionStateCodec(() -> SAVED_AT);

  @Test
  void encodeWritesVersionedDocumentWithoutPassword() throws IOException {
    String json = read(codec.encode("password", "alice", "tok-1"));

    assertTrue(json.contains("\"version\":1"), json);
    assertTrue(json.contains("\"method\":\"password\""), json);
    assertTrue(json.contains("\"username\":\"alice\""), json);
    assertTrue(json.contains("\"accessToken\":\"tok-1\""), json);
    assertTrue(json.contains("\"savedAt\":\"2024-03-01T12:00:00Z\""), json);
    assertFalse(json.contains("password\":\"pw"), json);
  }

  @Test
  void decodeRestoresUsernameAndToken() {
    UserCredentials restored = codec.decode("token", codec.encode("token", "bob", "tok-2"));

    assertEquals("bob", restored.username());
    assertEquals("tok-2", restored.accessToken());
    assertNull(restored.password());
  }

  @Test
  void encodeOmitsAbsentFields() throws IOException {
    String json = read(codec.encode("token", null, null));
    assertFalse(json.contains("username"), json);
    assertTrue(codec.decode("token", codec.encode("token", null, null)).isEmpty());
  }

  @Test
  void blankStreamDecodesToEmptyCredentials() {
    assertTrue(codec.decode("password", stream("")).isEmpty());
    assertTrue(codec.decode("password", stream("  \n ")).isEmpty());
  }

  @Test
  void documentFromOtherMethodIsRejected() {
    InputStream saved = codec.encode("token", "bob", "tok");
    assertThrows(IllegalArgumentException.class, () -> codec.decode("password", saved));
  }

  @Test
  void unknownVersionIsRejected() {
    String json = "{\"version\":2,\"method\":\"token\",\"accessToken\":\"tok\"}";
    assertThrows(IllegalArgumentException.class, () -> codec.decode("token", stream(json)));
  }

  @Test
  void malformedJsonIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> codec.decode("token", stream("{not json")));
  }

  @Test
  void literalNullDocumentIsRejected() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> codec.decode("token", stream("null")));
    assertTrue(ex.getMessage().contains("null"), ex.getMessage());
  }

  @Test
  void unknownFieldsAreIgnored() {
    String json = "{\"version\":1,\"method\":\"token\",\"accessToken\":\"tok\",\"extra\":true}";
    assertEquals("tok", codec.decode("token", stream(json)).accessToken());
  }

  private static InputStream stream(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  private static String read(InputStream stream) throws IOException {
    return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
  }
}
