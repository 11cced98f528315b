package ca.gc.cra.warden.infrastructure.persistence;

import ca.gc.cra.warden.application.session.AuthenticationClient;
import ca.gc.cra.warden.domain.auth.UserCredentials;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes a client's saved session state to disk and restores it on the next start.
 * <p><strong>Why:</strong> Lets a signed-in user survive a process restart without re-entering a password.</p>
 * <p><strong>Thread-safety:</strong> Stateless; concurrent saves to the same path race, and the last atomic move
 * wins.</p>
 * <p><strong>Security:</strong> Files contain access tokens; callers choose a path readable only by the
 * user.</p>
 *
 * @since 0.1.0
 */
public final class SessionStateFileStore {
  private static final Logger log = LoggerFactory.getLogger(SessionStateFileStore.class);

  /**
   * Saves the client's state to {@code path} through a temporary sibling file and an atomic move.
   *
   * @param client source client; never {@code null}
   * @param path destination file; never {@code null}
   * @return future completing once the file is in place
   */
  public CompletableFuture<Void> save(AuthenticationClient client, Path path) {
    Objects.requireNonNull(client, "client");
    Path target = Objects.requireNonNull(path, "path").toAbsolutePath();
    return client.save().thenAccept(stream -> write(stream, target));
  }

  /**
   * Restores state from {@code path} and applies it to the client with
   * {@link AuthenticationClient#setCredentials(UserCredentials)}.
   *
   * @param client target client; never {@code null}
   * @param path saved state file; never {@code null}
   * @return future completing with the applied credentials, or empty when no file exists
   */
  public CompletableFuture<Optional<UserCredentials>> restore(AuthenticationClient client, Path path) {
    Objects.requireNonNull(client, "client");
    Path source = Objects.requireNonNull(path, "path").toAbsolutePath();
    if (!Files.exists(source)) {
      log.debug("No saved session state at {}", source);
      return CompletableFuture.completedFuture(Optional.empty());
    }
    InputStream stream;
    try {
      stream = Files.newInputStream(source);
    } catch (IOException ex) {
      return CompletableFuture.failedFuture(
          new UncheckedIOException("Failed to open session state " + source, ex));
    }
    CompletableFuture<UserCredentials> loaded;
    try {
      loaded = client.load(stream);
    } catch (RuntimeException ex) {
      closeQuietly(stream, source);
      return CompletableFuture.failedFuture(ex);
    }
    return loaded
        .whenComplete((ignored, failure) -> closeQuietly(stream, source))
        .thenApply(credentials -> {
          client.setCredentials(credentials);
          log.info("Restored session state from {}", source);
          return Optional.of(credentials);
        });
  }

  private static void write(InputStream stream, Path target) {
    Path parent = target.getParent();
    try (InputStream in = stream) {
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
      try {
        Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
        moveIntoPlace(temp, target);
      } finally {
        Files.deleteIfExists(temp);
      }
      log.info("Saved session state to {}", target);
    } catch (IOException ex) {
      throw new CompletionException(new UncheckedIOException("Failed to write session state " + target, ex));
    }
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to replace", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void closeQuietly(InputStream stream, Path source) {
    try {
      stream.close();
    } catch (IOException ex) {
      log.warn("Failed to close session state {}", source, ex);
    }
  }
}
