package ca.gc.cra.docwatch.infrastructure.delivery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docwatch.domain.delivery.DeliveryAttempt;
import ca.gc.cra.docwatch.domain.delivery.DeliveryResult;
import ca.gc.cra.docwatch.domain.delivery.FailureClassification;
import ca.gc.cra.docwatch.testutil.FixedClock;
import ca.gc.cra.docwatch.testutil.Relays;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonAttemptLogWriterTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @TempDir Path tempDir;

  @Test
  void appendsOneLinePerAttempt() throws IOException {
    Path file = tempDir.resolve("logs").resolve("delivery.ndjson");
    NdjsonAttemptLogWriter writer =
        new NdjsonAttemptLogWriter(file, FixedClock.at(LocalDateTime.of(2024, 6, 1, 9, 0)));
    DeliveryResult first = new DeliveryResult(true, List.of(
        DeliveryAttempt.failure(Relays.relay("primary", "smtp.qq.com", "a@qq.com", 0),
            FailureClassification.AUTH_FAILURE, "use the \"code\"", "535 denied", 12),
        DeliveryAttempt.success(Relays.relay("backup", "smtp.163.com", "b@163.com", 1), 30)));

    writer.write("abcd1234", first);
    writer.write("efgh5678", new DeliveryResult(false, List.of(
        DeliveryAttempt.failure(Relays.relay("primary", "smtp.qq.com", "a@qq.com", 0),
            FailureClassification.CONNECT_FAILURE, "dns", "unknown host", 3))));

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());

    JsonNode failed = MAPPER.readTree(lines.get(0));
    assertEquals("2024-06-01T09:00+08:00", failed.get("ts").asText());
    assertEquals("abcd1234", failed.get("runId").asText());
    assertEquals("primary", failed.get("relay").asText());
    assertEquals("FAILURE", failed.get("outcome").asText());
    assertEquals("AUTH_FAILURE", failed.get("classification").asText());
    assertEquals("use the \"code\"", failed.get("hint").asText());
    assertTrue(failed.get("delivered").asBoolean());

    JsonNode succeeded = MAPPER.readTree(lines.get(1));
    assertEquals(1, succeeded.get("ordinal").asInt());
    assertEquals(30, succeeded.get("elapsedMs").asLong());
    assertFalse(succeeded.has("classification"));

    assertEquals("efgh5678", MAPPER.readTree(lines.get(2)).get("runId").asText());
  }

  @Test
  void noAttemptsWritesNothing() throws IOException {
    Path file = tempDir.resolve("delivery.ndjson");

    new NdjsonAttemptLogWriter(file, FixedClock.at(LocalDateTime.of(2024, 6, 1, 9, 0)))
        .write("run", new DeliveryResult(false, List.of()));

    assertFalse(Files.exists(file));
  }
}
