package ca.gc.cra.warden.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.auth.UserCredentials;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CredentialStoreTest {

  @Test
  void replaceReturnsPreviousValue() {
    CredentialStore store = new CredentialStore();
    UserCredentials first = UserCredentials.password("alice", "pw");
    UserCredentials second = UserCredentials.token("tok");

    assertTrue(store.replace(first).isEmpty());
    assertEquals(Optional.of(first), store.replace(second));
    assertEquals(Optional.of(second), store.current());
  }

  @Test
  void replaceRejectsNull() {
    CredentialStore store = new CredentialStore();
    assertThrows(NullPointerException.class, () -> store.replace(null));
    assertTrue(store.current().isEmpty());
  }
}
