package ca.gc.cra.fanout.domain.job;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable snapshot of the local script sent to every host.
 * <p><strong>Why:</strong> The file is read once before dispatch so every host executes the same bytes, even if the
 * file changes on disk mid-run.</p>
 * <p><strong>Role:</strong> Domain value shared read-only by all jobs of a run.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the backing array is never exposed.</p>
 *
 * @since 0.1.0
 */
public final class ScriptBody {
  private final String name;
  private final byte[] content;
  private final String sha256;

  private ScriptBody(String name, byte[] content) {
    this.name = name;
    this.content = content;
    this.sha256 = digest(content);
  }

  /**
   * Reads the script at {@code path} exactly once.
   *
   * @param path local script path
   * @return snapshot of the file content
   * @throws ScriptUnreadableException if the path is missing, not a regular file, or unreadable
   */
  public static ScriptBody read(Path path) throws ScriptUnreadableException {
    if (path == null) {
      throw new ScriptUnreadableException(null, ScriptUnreadableException.Reason.MISSING,
          "script path is required", null);
    }
    if (!Files.exists(path)) {
      throw new ScriptUnreadableException(path, ScriptUnreadableException.Reason.MISSING,
          "script file '" + path + "' not found", null);
    }
    if (!Files.isRegularFile(path)) {
      throw new ScriptUnreadableException(path, ScriptUnreadableException.Reason.NOT_A_FILE,
          "script '" + path + "' is not a regular file", null);
    }
    if (!Files.isReadable(path)) {
      throw new ScriptUnreadableException(path, ScriptUnreadableException.Reason.UNREADABLE,
          "script file '" + path + "' is not readable", null);
    }
    try {
      return new ScriptBody(path.toString(), Files.readAllBytes(path));
    } catch (NoSuchFileException ex) {
      throw new ScriptUnreadableException(path, ScriptUnreadableException.Reason.MISSING,
          "script file '" + path + "' disappeared while reading", ex);
    } catch (AccessDeniedException ex) {
      throw new ScriptUnreadableException(path, ScriptUnreadableException.Reason.UNREADABLE,
          "script file '" + path + "' is not readable", ex);
    } catch (IOException ex) {
      throw new ScriptUnreadableException(path, ScriptUnreadableException.Reason.UNREADABLE,
          "unable to read script file '" + path + "': " + ex.getMessage(), ex);
    }
  }

  /**
   * Wraps in-memory script content.
   *
   * @param name label used in logs and dry-run plans
   * @param content script bytes; copied
   * @return snapshot
   */
  public static ScriptBody of(String name, byte[] content) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(content, "content");
    return new ScriptBody(name, content.clone());
  }

  /**
   * Streams the script into {@code out} without copying the backing array.
   *
   * @param out destination, typically the remote command's standard input
   * @throws IOException if the destination fails
   */
  public void writeTo(OutputStream out) throws IOException {
    out.write(content);
  }

  /**
   * Opens a fresh stream over the script bytes.
   *
   * @return independent input stream
   */
  public InputStream openStream() {
    return new ByteArrayInputStream(content);
  }

  public String name() {
    return name;
  }

  public int size() {
    return content.length;
  }

  /**
   * Returns the lowercase hex SHA-256 of the content, shown in dry-run plans and logs.
   *
   * @return content digest
   */
  public String sha256() {
    return sha256;
  }

  @Override
  public String toString() {
    return name + " (" + content.length + " bytes, sha256=" + sha256 + ")";
  }

  private static String digest(byte[] bytes) {
    try {
      return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
