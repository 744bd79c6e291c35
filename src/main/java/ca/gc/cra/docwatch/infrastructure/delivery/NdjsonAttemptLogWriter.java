package ca.gc.cra.docwatch.infrastructure.delivery;

import ca.gc.cra.docwatch.application.port.AttemptLogWriter;
import ca.gc.cra.docwatch.application.port.ClockPort;
import ca.gc.cra.docwatch.domain.delivery.DeliveryAttempt;
import ca.gc.cra.docwatch.domain.delivery.DeliveryResult;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends delivery attempts to a newline-delimited JSON file, one object per attempt.
 *
 * <p>Fields: {@code ts}, {@code runId}, {@code relay}, {@code ordinal}, {@code outcome},
 * {@code classification}, {@code hint}, {@code detail}, {@code elapsedMs}, {@code delivered}.
 * Failure-only fields are omitted on success.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonAttemptLogWriter implements AttemptLogWriter {
  private static final Logger log = LoggerFactory.getLogger(NdjsonAttemptLogWriter.class);

  private final JsonFactory jsonFactory = new JsonFactory();
  private final Path file;
  private final ClockPort clock;

  public NdjsonAttemptLogWriter(Path file, ClockPort clock) {
    this.file = Objects.requireNonNull(file, "file");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void write(String runId, DeliveryResult result) throws IOException {
    Objects.requireNonNull(result, "result");
    if (result.attempts().isEmpty()) {
      return;
    }
    String ts = clock.now().toOffsetDateTime().toString();
    StringBuilder lines = new StringBuilder();
    for (DeliveryAttempt attempt : result.attempts()) {
      lines.append(toJson(ts, runId, attempt, result.delivered())).append('\n');
    }
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(file, lines, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    log.debug("Appended {} delivery attempt(s) to {}", result.attempts().size(), file);
  }

  public Path file() {
    return file;
  }

  String toJson(String ts, String runId, DeliveryAttempt attempt, boolean delivered) throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("ts", ts);
      gen.writeStringField("runId", runId == null ? "" : runId);
      gen.writeStringField("relay", attempt.relayName());
      gen.writeNumberField("ordinal", attempt.ordinal());
      gen.writeStringField("outcome", attempt.outcome().name());
      if (!attempt.succeeded()) {
        gen.writeStringField("classification", attempt.classification().name());
        gen.writeStringField("hint", attempt.hint());
        gen.writeStringField("detail", attempt.detail());
      }
      gen.writeNumberField("elapsedMs", attempt.elapsedMillis());
      gen.writeBooleanField("delivered", delivered);
      gen.writeEndObject();
    }
    return out.toString();
  }
}
