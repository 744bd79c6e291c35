package ca.gc.cra.docwatch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docwatch.domain.delivery.RelayConfig;
import ca.gc.cra.docwatch.domain.delivery.TlsMode;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class YamlConfigLoaderTest {
  private static final String TAIL = """
      reminder:
        days_before_expiry: [60, 30, 7, 1]
      report:
        output_filename: 证件状态报告_{date}.csv
      mail_template:
        subject: "提醒 {count} {today_date}"
      """;

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(YamlConfigLoader.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
  }

  @Test
  void legacyFlatShapeBecomesSinglePrimaryRelay() throws IOException {
    Path yaml = tempDir.resolve("config.yaml");
    Files.writeString(yaml, """
        email:
          smtp_server: smtp.qq.com
          smtp_port: 465
          smtp_user: sender@qq.com
          smtp_password: code
          sender_name: 证件管理系统
          use_ssl: true
          receiver_email: a@example.com, b@example.com
        """ + TAIL);

    AppConfig config = YamlConfigLoader.load(yaml);

    assertEquals(1, config.email().relays().size());
    RelayConfig primary = config.email().primary();
    assertEquals("primary", primary.name());
    assertEquals(TlsMode.SSL, primary.tlsMode());
    assertEquals(0, primary.ordinal());
    assertEquals("证件管理系统", primary.senderName());
    assertEquals(List.of("a@example.com", "b@example.com"), config.email().recipients().addresses());
    assertEquals("INFO", config.logLevel());
    assertEquals(AppConfig.DEFAULT_DATA_FILE, config.dataFile());
    assertEquals("已办理", config.reminder().handledRemark());
  }

  @Test
  void legacyTlsFlagSelectsStarttls() {
    AppConfig config = YamlConfigLoader.parse("""
        email:
          smtp_server: smtp.office365.com
          smtp_port: 587
          smtp_user: sender@outlook.com
          smtp_password: pw
          use_ssl: false
          use_tls: true
          receiver_email: ops@example.com
        """ + TAIL, "inline");

    assertEquals(TlsMode.STARTTLS, config.email().primary().tlsMode());
  }

  @Test
  void primaryWithBackupsIsOrdered() {
    AppConfig config = YamlConfigLoader.parse("""
        email:
          primary:
            smtp_server: smtp.qq.com
            smtp_port: 465
            smtp_user: a@qq.com
            smtp_password: code
          backups:
            - name: netease
              smtp_server: smtp.163.com
              smtp_port: 465
              smtp_user: b@163.com
              smtp_password: pw
              tls_mode: ssl
            - smtp_server: smtp.gmail.com
              smtp_port: 587
              smtp_user: c@gmail.com
              smtp_password: app
          receiver_email: ops@example.com
        """ + TAIL, "inline");

    List<RelayConfig> relays = config.email().relays();
    assertEquals(List.of("primary", "netease", "backup-2"), relays.stream().map(RelayConfig::name).toList());
    assertEquals(List.of(0, 1, 2), relays.stream().map(RelayConfig::ordinal).toList());
    assertEquals(TlsMode.SSL, relays.get(0).tlsMode());
    assertEquals(TlsMode.STARTTLS, relays.get(2).tlsMode());
    assertEquals(2, config.email().backups().size());
  }

  @Test
  void primaryWinsOverLegacyKeysWithWarning() {
    AppConfig config = YamlConfigLoader.parse("""
        email:
          smtp_server: legacy.example.com
          smtp_port: 25
          primary:
            smtp_server: smtp.qq.com
            smtp_port: 465
            smtp_user: a@qq.com
            smtp_password: code
          receiver_email: ops@example.com
        """ + TAIL, "inline");

    assertEquals("smtp.qq.com", config.email().primary().host());
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().contains("ignoring legacy relay keys [smtp_server, smtp_port]")));
  }

  @Test
  void reportsEveryProblemAtOnce() {
    ConfigException ex = assertThrows(ConfigException.class, () -> YamlConfigLoader.parse("""
        email:
          smtp_server: smtp.qq.com
          smtp_port: 99999
          smtp_user: " "
          receiver_email: not-an-address
        reminder:
          days_before_expiry: [30, -1]
        report:
          days_until_expiring_threshold: -5
        log_level: LOUD
        """, "broken.yaml"));

    List<String> problems = ex.problems();
    assertTrue(problems.stream().anyMatch(p -> p.contains("smtp_port must be between 1 and 65535")), problems.toString());
    assertTrue(problems.stream().anyMatch(p -> p.contains("email.smtp_user must not be blank")), problems.toString());
    assertTrue(problems.contains("email.smtp_password is required"), problems.toString());
    assertTrue(problems.stream().anyMatch(p -> p.contains("not a valid e-mail address")), problems.toString());
    assertTrue(problems.stream().anyMatch(p -> p.contains("days_before_expiry entry")), problems.toString());
    assertTrue(problems.stream().anyMatch(p -> p.contains("days_until_expiring_threshold")), problems.toString());
    assertTrue(problems.contains("mail_template section is required"), problems.toString());
    assertTrue(problems.stream().anyMatch(p -> p.startsWith("log_level must be one of")), problems.toString());
    assertTrue(ex.getMessage().startsWith("Invalid configuration in broken.yaml ("));
  }

  @Test
  void backupsWithoutPrimaryRejected() {
    ConfigException ex = assertThrows(ConfigException.class, () -> YamlConfigLoader.parse("""
        email:
          smtp_server: smtp.qq.com
          smtp_port: 465
          smtp_user: a@qq.com
          smtp_password: code
          backups: []
          receiver_email: ops@example.com
        """ + TAIL, "inline"));

    assertTrue(ex.problems().contains("email.backups requires email.primary"));
  }

  @Test
  void duplicateRelayNamesRejected() {
    ConfigException ex = assertThrows(ConfigException.class, () -> YamlConfigLoader.parse("""
        email:
          primary:
            name: same
            smtp_server: smtp.qq.com
            smtp_port: 465
            smtp_user: a@qq.com
            smtp_password: code
          backups:
            - name: same
              smtp_server: smtp.163.com
              smtp_port: 465
              smtp_user: b@163.com
              smtp_password: pw
          receiver_email: ops@example.com
        """ + TAIL, "inline"));

    assertTrue(ex.problems().contains("relay names must be unique (duplicate 'same')"));
  }

  @Test
  void omittedBodyAndRowFallBackToBundledTemplates() {
    AppConfig config = YamlConfigLoader.parse(minimal(), "inline");

    assertTrue(config.mailTemplate().bodyHtml().contains("{table_rows}"));
    assertTrue(config.mailTemplate().tableRowHtml().contains("{person_name}"));
    assertEquals("提醒 {count} {today_date}", config.mailTemplate().subject());
  }

  @Test
  void emptyThresholdListAllowedWithWarning() {
    AppConfig config = YamlConfigLoader.parse(minimal().replace("[60, 30, 7, 1]", "[]"), "inline");

    assertTrue(config.reminder().thresholds().isEmpty());
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.WARN
        && event.getFormattedMessage().contains("days_before_expiry is empty")));
  }

  @Test
  void logFileExpandsDate() {
    AppConfig config = YamlConfigLoader.parse(minimal() + "log_file: logs/docwatch_{date}.log\n", "inline");

    assertEquals(Path.of("logs/docwatch_20240601.log"), config.logFileFor(LocalDate.of(2024, 6, 1)).orElseThrow());
    assertEquals("证件状态报告_20240601.csv", config.report().fileNameFor(LocalDate.of(2024, 6, 1)));
    assertEquals(30, config.report().expiringThreshold());
  }

  @Test
  void defaultFileNamesStayUnresolvedUntilUsed() {
    String yaml = minimal().replace("output_filename: 证件状态报告_{date}.csv", "days_until_expiring_threshold: 30");
    AppConfig config = YamlConfigLoader.parse(yaml, "inline");

    assertEquals("sample_data/人员证件信息.csv", config.dataFile());
    assertEquals(ReportConfig.DEFAULT_OUTPUT_FILENAME, config.report().outputFilename());
    assertEquals("证件状态报告_20240601.csv", config.report().fileNameFor(LocalDate.of(2024, 6, 1)));
  }

  @Test
  void unusableDataFileFailsAsConfigErrorWhenResolved() {
    AppConfig config = YamlConfigLoader.parse(minimal() + "data_file: \"roster\\0.csv\"\n", "inline");

    ConfigException ex = assertThrows(ConfigException.class, config::dataFilePath);
    assertTrue(ex.getMessage().contains("data_file"));
    assertTrue(ex.getMessage().contains("sun.jnu.encoding"));
  }

  @Test
  void unusableReportAndLogNamesFailAsConfigError() {
    AppConfig config = YamlConfigLoader.parse(minimal() + "log_file: \"logs/run\\0{date}.log\"\n", "inline");
    ReportConfig report = new ReportConfig("report\u0000{date}.csv", 30);
    LocalDate day = LocalDate.of(2024, 6, 1);

    assertTrue(assertThrows(ConfigException.class, () -> config.logFileFor(day)).getMessage().contains("log_file"));
    assertTrue(assertThrows(ConfigException.class, () -> report.fileFor(day))
        .getMessage().contains("report.output_filename"));
  }

  @Test
  void missingFileIsConfigError() {
    ConfigException ex = assertThrows(ConfigException.class,
        () -> YamlConfigLoader.load(tempDir.resolve("absent.yaml")));

    assertTrue(ex.getMessage().contains("init-config"));
  }

  @Test
  void malformedYamlIsConfigError() {
    ConfigException ex = assertThrows(ConfigException.class,
        () -> YamlConfigLoader.parse("email: [unclosed", "bad.yaml"));

    assertTrue(ex.getMessage().startsWith("Failed to parse YAML config at bad.yaml"));
    assertFalse(ex.problems().isEmpty());
  }

  private static String minimal() {
    return """
        email:
          smtp_server: smtp.qq.com
          smtp_port: 465
          smtp_user: a@qq.com
          smtp_password: code
          receiver_email: ops@example.com
        """ + TAIL;
  }
}
