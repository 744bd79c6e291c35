package ca.gc.cra.docwatch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docwatch.config.CompositionRoot;
import ca.gc.cra.docwatch.domain.delivery.FailureClassification;
import ca.gc.cra.docwatch.testutil.FakeMailTransport;
import ca.gc.cra.docwatch.testutil.FixedClock;
import ca.gc.cra.docwatch.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestEmailCliTest {
  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();
  private final FakeMailTransport transport = new FakeMailTransport();
  private Path config;

  @BeforeEach
  void setUp() throws IOException {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
    CommandSupport.setRootFactoryForTesting(cfg -> new CompositionRoot(
        cfg, transport, FixedClock.on(CliFixtures.TODAY), new RecordingMetricsPort()));
    config = CliFixtures.writeConfig(tempDir, tempDir.resolve("unused.csv"));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
    CommandSupport.clearRootFactory();
  }

  @Test
  void sendsWithoutReadingTheRoster() {
    ExitCode code = TestEmailCli.run(new String[] {"config=" + config});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Delivered via relay primary"));
    assertEquals(1, transport.sent().size());
  }

  @Test
  void failurePrintsHintPerRelay() {
    transport.fail("primary", FakeMailTransport.Stage.CONNECT, FailureClassification.CONNECT_FAILURE);

    ExitCode code = TestEmailCli.run(new String[] {"config=" + config});

    assertEquals(ExitCode.DELIVERY_FAILED, code);
    String out = buffer.toString();
    assertTrue(out.contains("[0] primary: CONNECT_FAILURE"), out);
    assertTrue(out.contains("hint: "), out);
  }
}
