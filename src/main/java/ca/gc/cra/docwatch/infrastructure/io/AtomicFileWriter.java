package ca.gc.cra.docwatch.infrastructure.io;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes files by streaming into a sibling temp file and renaming it over the target.
 *
 * <p>Readers observe either the previous content or the complete new content. When the filesystem cannot
 * rename atomically the move falls back to a plain replace.</p>
 *
 * @since 0.1.0
 */
public final class AtomicFileWriter {
  private static final Logger log = LoggerFactory.getLogger(AtomicFileWriter.class);

  /** Body of an atomic write. */
  @FunctionalInterface
  public interface Body {
    void writeTo(OutputStream out) throws IOException;
  }

  private AtomicFileWriter() {}

  /**
   * Writes {@code target} atomically.
   *
   * @param target destination file; parent directories are created
   * @param body producer of the file content
   * @throws IOException when writing or renaming fails; the temp file is removed
   */
  public static void write(Path target, Body body) throws IOException {
    Path absolute = target.toAbsolutePath();
    Path parent = absolute.getParent();
    Files.createDirectories(parent);
    Path temp = Files.createTempFile(parent, "." + absolute.getFileName(), ".tmp");
    boolean moved = false;
    try {
      try (OutputStream out = Files.newOutputStream(temp)) {
        body.writeTo(out);
      }
      try {
        Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException ex) {
        log.debug("Atomic move unsupported for {}; replacing in place", absolute);
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
      }
      moved = true;
    } finally {
      if (!moved) {
        Files.deleteIfExists(temp);
      }
    }
  }

  /**
   * Writes a byte array atomically.
   *
   * @param target destination file
   * @param content bytes to write
   * @throws IOException when writing or renaming fails
   */
  public static void write(Path target, byte[] content) throws IOException {
    write(target, out -> out.write(content));
  }
}
