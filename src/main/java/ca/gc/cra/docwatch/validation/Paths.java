package ca.gc.cra.docwatch.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for files DOCWATCH writes (reports, sample data, state, templates).
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject paths with null bytes or control characters.</li>
 *   <li>Create the parent directory on request and confirm it is writable.</li>
 *   <li>Refuse to treat an existing directory as an output file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an output file location.
   *
   * @param path candidate file; must not be {@code null}
   * @param createParents whether to create missing parent directories
   * @return absolute normalized path
   * @throws IllegalArgumentException when the location cannot hold a writable file
   */
  public static Path validateOutputFile(Path path, boolean createParents) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is a directory: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("path has no parent to validate: " + normalized);
    }
    try {
      if (!Files.exists(parent)) {
        if (!createParents) {
          throw new IllegalArgumentException("parent directory does not exist: " + parent);
        }
        Files.createDirectories(parent);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + parent + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(parent)) {
      throw new IllegalArgumentException("parent is not a directory: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("parent directory is not writable: " + parent);
    }
    return normalized;
  }
}
