package com.codeheadsystems.geni.client.store;

import com.codeheadsystems.geni.client.exceptions.SecretBackendException;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the secret in a file readable and writable only by its owner.
 * <p>
 * The parent directory is created on first write. Writes go to a temporary file in the same
 * directory that is then moved over the target, so readers never see a partial secret.
 */
public class FileSecretBackend implements SecretBackend {

  /**
   * rw-------.
   */
  public static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

  private static final Logger log = LoggerFactory.getLogger(FileSecretBackend.class);

  private final Path file;

  /**
   * Instantiates a new File secret backend.
   *
   * @param file the file holding the secret
   */
  public FileSecretBackend(final Path file) {
    log.info("FileSecretBackend({})", file);
    this.file = file.toAbsolutePath();
  }

  @Override
  public Optional<String> get() {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      String content = Files.readString(file, StandardCharsets.UTF_8);
      return content.isBlank() ? Optional.empty() : Optional.of(content);
    } catch (IOException e) {
      throw new SecretBackendException("Unable to read " + file, e);
    }
  }

  @Override
  public void set(final String value) {
    Path directory = file.getParent();
    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, "." + file.getFileName(), ".tmp");
      restrictToOwner(temp);
      Files.writeString(temp, value, StandardCharsets.UTF_8);
      move(temp, file);
    } catch (IOException e) {
      if (temp != null) {
        try {
          Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
          e.addSuppressed(cleanup);
        }
      }
      throw new SecretBackendException("Unable to write " + file, e);
    }
  }

  @Override
  public void delete() {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      throw new SecretBackendException("Unable to delete " + file, e);
    }
  }

  @Override
  public String name() {
    return "file " + file;
  }

  /**
   * File path.
   *
   * @return the file holding the secret
   */
  public Path file() {
    return file;
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void restrictToOwner(Path path) throws IOException {
    if (Files.getFileStore(path).supportsFileAttributeView(PosixFileAttributeView.class)) {
      Files.setPosixFilePermissions(path, OWNER_ONLY);
      return;
    }
    File f = path.toFile();
    boolean restricted = f.setReadable(false, false)
        && f.setReadable(true, true)
        && f.setWritable(false, false)
        && f.setWritable(true, true);
    if (!restricted) {
      log.warn("Unable to restrict permissions on {}", path);
    }
  }
}
