package ca.gc.cra.docwatch.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void validateOutputFileCreatesParentsWhenRequested() {
    Path file = tempDir.resolve("reports/2024/report.csv");
    Path validated = Paths.validateOutputFile(file, true);
    assertEquals(file.toAbsolutePath().normalize(), validated);
    assertTrue(Files.isDirectory(validated.getParent()));
  }

  @Test
  void validateOutputFileRejectsMissingParentWithoutCreation() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile(tempDir.resolve("missing/report.csv"), false));
  }

  @Test
  void validateOutputFileRejectsDirectory() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(dir, false));
  }

  @Test
  void validateOutputFileRejectsNull() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(null, false));
  }
}
