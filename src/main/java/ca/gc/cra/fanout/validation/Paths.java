package ca.gc.cra.fanout.validation;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for CLI and configuration flows.
 * <p><strong>Why:</strong> Identity files and YAML configuration are read by the ssh client or the loader; a wrong
 * path should fail before the run starts, with the offending path in the message.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; results reflect filesystem state at call time only.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Resolves and validates a readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param raw textual path from the CLI or YAML
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the path is malformed, missing, not a regular file, or unreadable
   */
  public static Path requireReadableFile(String name, String raw) {
    String sanitized = Strings.requireNonBlank(name, raw);
    Path path;
    try {
      path = Path.of(sanitized).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(Strings.message(name, "is not a valid path: " + sanitized), ex);
    }
    if (!Files.exists(path)) {
      throw new IllegalArgumentException(Strings.message(name, "does not exist: " + path));
    }
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException(Strings.message(name, "is not a regular file: " + path));
    }
    if (!Files.isReadable(path)) {
      throw new IllegalArgumentException(Strings.message(name, "is not readable: " + path));
    }
    return path;
  }
}
