package ca.gc.cra.docwatch.infrastructure.state;

import ca.gc.cra.docwatch.application.port.LastSuccessStore;
import ca.gc.cra.docwatch.infrastructure.io.AtomicFileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LastSuccessStore} keeping one ISO-8601 local date-time in a text file.
 *
 * @since 0.1.0
 */
public final class FileLastSuccessStore implements LastSuccessStore {
  private static final Logger log = LoggerFactory.getLogger(FileLastSuccessStore.class);

  /** Default state file. */
  public static final Path DEFAULT_PATH = Path.of("logs", "last_success_iso.txt");

  private final Path file;

  public FileLastSuccessStore(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public Optional<LocalDateTime> read() {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    String text;
    try {
      text = Files.readString(file, StandardCharsets.UTF_8).strip();
    } catch (IOException ex) {
      log.warn("Unable to read last-success state {}; treating as absent", file, ex);
      return Optional.empty();
    }
    if (text.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME));
    } catch (DateTimeParseException ex) {
      log.warn("Ignoring unparsable last-success timestamp '{}' in {}", text, file);
      return Optional.empty();
    }
  }

  @Override
  public void write(LocalDateTime timestamp) throws IOException {
    String text = timestamp.truncatedTo(ChronoUnit.SECONDS).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    AtomicFileWriter.write(file, text.getBytes(StandardCharsets.UTF_8));
    log.debug("Recorded last success {} in {}", text, file);
  }

  public Path file() {
    return file;
  }
}
