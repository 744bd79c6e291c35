package ca.gc.cra.docwatch.config;

import ca.gc.cra.docwatch.domain.delivery.RecipientSet;
import ca.gc.cra.docwatch.domain.delivery.RelayConfig;
import ca.gc.cra.docwatch.domain.delivery.TlsMode;
import ca.gc.cra.docwatch.domain.document.ReminderThresholds;
import ca.gc.cra.docwatch.validation.Net;
import ca.gc.cra.docwatch.validation.Numbers;
import ca.gc.cra.docwatch.validation.Strings;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Loads {@link AppConfig} from a YAML document.
 * <p><strong>Relay shapes:</strong> {@code email} either carries the legacy flat keys ({@code smtp_server},
 * {@code smtp_port}, ...) for a single relay, or a {@code primary} mapping plus an optional {@code backups}
 * list. When {@code primary} is present the legacy keys are ignored with a warning. Both shapes are
 * converted here into one ordered {@code List<RelayConfig>}.</p>
 * <p><strong>Validation:</strong> Every problem is collected and reported together in one
 * {@link ConfigException}.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);

  private static final List<String> LEGACY_RELAY_KEYS = List.of(
      "smtp_server", "smtp_port", "smtp_user", "smtp_password", "sender_name", "use_ssl", "use_tls");
  private static final Set<String> LOG_LEVELS =
      Set.of("TRACE", "DEBUG", "INFO", "WARN", "WARNING", "ERROR", "CRITICAL", "OFF");

  private YamlConfigLoader() {}

  /**
   * Loads and validates configuration from {@code path}.
   *
   * @param path YAML file location
   * @return validated configuration
   * @throws IOException when the file exists but cannot be read
   * @throws ConfigException when the file is missing, unparsable, or invalid
   */
  public static AppConfig load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new ConfigException(path.toString(),
          List.of("configuration file not found (run 'docwatch init-config' to create a template)"));
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return parse(reader, path.toString());
    }
  }

  /**
   * Parses configuration from YAML text.
   *
   * @param yaml YAML document
   * @param source description used in error messages
   * @return validated configuration
   * @throws ConfigException when the document is unparsable or invalid
   */
  public static AppConfig parse(String yaml, String source) {
    return parse(new StringReader(yaml), source);
  }

  private static AppConfig parse(Reader reader, String source) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new ConfigException("Failed to parse YAML config at " + source + ": " + ex.getMessage(), ex);
    }
    List<String> problems = new ArrayList<>();
    if (document == null) {
      throw new ConfigException(source, List.of("configuration document is empty"));
    }
    Map<String, Object> root = asMap(document, "root", problems);
    if (root == null) {
      throw new ConfigException(source, problems);
    }

    EmailConfig email = parseEmail(section(root, "email", problems), problems);
    ReminderConfig reminder = parseReminder(section(root, "reminder", problems), problems);
    ReportConfig report = parseReport(section(root, "report", problems), problems);
    MailTemplateConfig templates = parseTemplates(section(root, "mail_template", problems), problems);

    String dataFile = optionalString(root, "data_file", "data_file", problems);
    String logLevel = optionalString(root, "log_level", "log_level", problems);
    if (logLevel != null && !LOG_LEVELS.contains(logLevel.trim().toUpperCase(Locale.ROOT))) {
      problems.add("log_level must be one of " + LOG_LEVELS + " (was '" + logLevel + "')");
    }
    String logFile = optionalString(root, "log_file", "log_file", problems);

    if (!problems.isEmpty()) {
      throw new ConfigException(source, problems);
    }
    AppConfig config = new AppConfig(
        email,
        reminder,
        report,
        templates,
        dataFile,
        logLevel == null ? null : logLevel.trim().toUpperCase(Locale.ROOT),
        logFile);
    log.debug("Loaded configuration from {}: relays={}, recipients={}, thresholds={}",
        source, config.email().relays(), config.email().recipients().size(),
        config.reminder().thresholds().days());
    return config;
  }

  private static EmailConfig parseEmail(Map<String, Object> email, List<String> problems) {
    if (email == null) {
      return null;
    }
    List<RelayConfig> relays = new ArrayList<>();
    Object primary = email.get("primary");
    if (primary != null) {
      List<String> ignored = LEGACY_RELAY_KEYS.stream().filter(email::containsKey).toList();
      if (!ignored.isEmpty()) {
        log.warn("email.primary is configured; ignoring legacy relay keys {}", ignored);
      }
      Map<String, Object> primaryMap = asMap(primary, "email.primary", problems);
      if (primaryMap != null) {
        addIfPresent(relays, parseRelay(primaryMap, "email.primary", "primary", 0, false, problems));
      }
      Object backups = email.get("backups");
      if (backups != null) {
        if (backups instanceof List<?> list) {
          for (int i = 0; i < list.size(); i++) {
            String context = "email.backups[" + i + "]";
            Map<String, Object> backup = asMap(list.get(i), context, problems);
            if (backup != null) {
              addIfPresent(relays, parseRelay(backup, context, "backup-" + (i + 1), i + 1, false, problems));
            }
          }
        } else {
          problems.add("email.backups must be a list");
        }
      }
    } else {
      if (email.containsKey("backups")) {
        problems.add("email.backups requires email.primary");
      }
      addIfPresent(relays, parseRelay(email, "email", "primary", 0, true, problems));
    }
    checkUniqueNames(relays, problems);

    RecipientSet recipients = parseRecipients(email, problems);
    if (relays.isEmpty() || recipients == null) {
      return null;
    }
    return new EmailConfig(relays, recipients);
  }

  private static RelayConfig parseRelay(
      Map<String, Object> node,
      String context,
      String defaultName,
      int ordinal,
      boolean legacy,
      List<String> problems) {
    int before = problems.size();
    String name = legacy ? defaultName : optionalString(node, "name", context + ".name", problems);
    if (name == null || name.isBlank()) {
      name = defaultName;
    }
    String host = requiredString(node, "smtp_server", context, problems);
    if (host != null) {
      try {
        host = Net.validateHost(context + ".smtp_server", host);
      } catch (IllegalArgumentException ex) {
        problems.add(ex.getMessage());
        host = null;
      }
    }
    int port = 0;
    Object rawPort = node.get("smtp_port");
    if (rawPort == null) {
      problems.add(context + ".smtp_port is required");
    } else {
      try {
        port = Net.validatePort(context + ".smtp_port", Numbers.requireInt(context + ".smtp_port", rawPort));
      } catch (IllegalArgumentException ex) {
        problems.add(ex.getMessage());
      }
    }
    String user = nonBlank(node, "smtp_user", context, problems);
    String password = nonBlank(node, "smtp_password", context, problems);
    String senderName = optionalString(node, "sender_name", context + ".sender_name", problems);

    TlsMode tlsMode = null;
    if (legacy) {
      Boolean useSsl = optionalBoolean(node, "use_ssl", context, true, problems);
      Boolean useTls = optionalBoolean(node, "use_tls", context, false, problems);
      if (useSsl != null && useTls != null) {
        tlsMode = TlsMode.fromLegacyFlags(useSsl, useTls);
      }
    } else {
      String rawMode = optionalString(node, "tls_mode", context + ".tls_mode", problems);
      try {
        tlsMode = rawMode == null ? defaultTlsMode(port) : TlsMode.fromString(rawMode);
      } catch (IllegalArgumentException ex) {
        problems.add(context + "." + ex.getMessage());
      }
    }
    if (problems.size() != before || host == null || user == null || password == null || tlsMode == null) {
      return null;
    }
    return new RelayConfig(name.trim(), host, port, user, password, senderName, tlsMode, ordinal);
  }

  private static TlsMode defaultTlsMode(int port) {
    return port == 465 ? TlsMode.SSL : TlsMode.STARTTLS;
  }

  private static RecipientSet parseRecipients(Map<String, Object> email, List<String> problems) {
    String raw = requiredString(email, "receiver_email", "email", problems);
    if (raw == null) {
      return null;
    }
    if (raw.isBlank()) {
      problems.add("email.receiver_email must not be blank");
      return null;
    }
    RecipientSet recipients = RecipientSet.parse(raw);
    boolean valid = true;
    for (String address : recipients.addresses()) {
      try {
        Strings.requireMailAddress("email.receiver_email", address);
      } catch (IllegalArgumentException ex) {
        problems.add(ex.getMessage());
        valid = false;
      }
    }
    return valid ? recipients : null;
  }

  private static void checkUniqueNames(List<RelayConfig> relays, List<String> problems) {
    Set<String> seen = new HashSet<>();
    for (RelayConfig relay : relays) {
      if (!seen.add(relay.name())) {
        problems.add("relay names must be unique (duplicate '" + relay.name() + "')");
      }
    }
  }

  private static ReminderConfig parseReminder(Map<String, Object> reminder, List<String> problems) {
    if (reminder == null) {
      return null;
    }
    ReminderThresholds thresholds = ReminderThresholds.DEFAULT;
    Object rawDays = reminder.get("days_before_expiry");
    if (rawDays != null) {
      if (!(rawDays instanceof List<?> list)) {
        problems.add("reminder.days_before_expiry must be a list of non-negative integers");
        return null;
      }
      List<Integer> days = new ArrayList<>();
      for (Object item : list) {
        try {
          int day = Numbers.requireInt("reminder.days_before_expiry", item);
          Numbers.requireRange("reminder.days_before_expiry entry", day, 0, Integer.MAX_VALUE);
          days.add(day);
        } catch (IllegalArgumentException ex) {
          problems.add(ex.getMessage());
        }
      }
      if (days.size() != list.size()) {
        return null;
      }
      thresholds = new ReminderThresholds(days);
      if (thresholds.isEmpty()) {
        log.warn("reminder.days_before_expiry is empty; only expired documents will be reminded");
      }
    }
    String handled = optionalString(reminder, "handled_remark", "reminder.handled_remark", problems);
    return new ReminderConfig(thresholds, handled);
  }

  private static ReportConfig parseReport(Map<String, Object> report, List<String> problems) {
    if (report == null) {
      return null;
    }
    String fileName = optionalString(report, "output_filename", "report.output_filename", problems);
    if (fileName != null && fileName.isBlank()) {
      problems.add("report.output_filename must not be blank");
      return null;
    }
    int threshold = ReportConfig.DEFAULT_EXPIRING_THRESHOLD;
    Object rawThreshold = report.get("days_until_expiring_threshold");
    if (rawThreshold != null) {
      try {
        threshold = Numbers.requireInt("report.days_until_expiring_threshold", rawThreshold);
        Numbers.requireRange("report.days_until_expiring_threshold", threshold, 0, Integer.MAX_VALUE);
      } catch (IllegalArgumentException ex) {
        problems.add(ex.getMessage());
        return null;
      }
    }
    return new ReportConfig(fileName == null ? ReportConfig.DEFAULT_OUTPUT_FILENAME : fileName.trim(), threshold);
  }

  private static MailTemplateConfig parseTemplates(Map<String, Object> templates, List<String> problems) {
    if (templates == null) {
      return null;
    }
    String subject = template(templates, "subject", problems);
    String body = template(templates, "body_html", problems);
    String row = template(templates, "table_row_html", problems);
    if (subject == null || body == null || row == null) {
      return null;
    }
    return new MailTemplateConfig(subject, body, row);
  }

  private static String template(Map<String, Object> templates, String key, List<String> problems) {
    String context = "mail_template." + key;
    if (!templates.containsKey(key)) {
      return switch (key) {
        case "subject" -> MailTemplateConfig.DEFAULT_SUBJECT;
        case "body_html" -> ClasspathTemplates.load(ClasspathTemplates.BODY);
        default -> ClasspathTemplates.load(ClasspathTemplates.ROW);
      };
    }
    String value = optionalString(templates, key, context, problems);
    if (value == null || value.isBlank()) {
      problems.add(context + " must not be blank");
      return null;
    }
    return value;
  }

  private static Map<String, Object> section(Map<String, Object> root, String key, List<String> problems) {
    Object node = root.get(key);
    if (node == null) {
      problems.add(key + " section is required");
      return null;
    }
    return asMap(node, key, problems);
  }

  private static Map<String, Object> asMap(Object node, String context, List<String> problems) {
    if (!(node instanceof Map<?, ?> raw)) {
      problems.add(context + " section must be a mapping");
      return null;
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        problems.add(context + " section contains non-string key " + entry.getKey());
        continue;
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static String requiredString(
      Map<String, Object> node, String key, String context, List<String> problems) {
    Object value = node.get(key);
    if (value == null) {
      problems.add(context + "." + key + " is required");
      return null;
    }
    if (value instanceof Map<?, ?> || value instanceof List<?>) {
      problems.add(context + "." + key + " must be a scalar");
      return null;
    }
    return value.toString();
  }

  private static String nonBlank(Map<String, Object> node, String key, String context, List<String> problems) {
    String value = requiredString(node, key, context, problems);
    if (value == null) {
      return null;
    }
    try {
      return Strings.requireNonBlank(context + "." + key, value);
    } catch (IllegalArgumentException ex) {
      problems.add(ex.getMessage());
      return null;
    }
  }

  private static String optionalString(
      Map<String, Object> node, String key, String label, List<String> problems) {
    Object value = node.get(key);
    if (value == null) {
      return null;
    }
    if (value instanceof Map<?, ?> || value instanceof List<?>) {
      problems.add(label + " must be a scalar");
      return null;
    }
    return value.toString();
  }

  private static Boolean optionalBoolean(
      Map<String, Object> node, String key, String context, boolean defaultValue, List<String> problems) {
    Object value = node.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    String text = value.toString().trim().toLowerCase(Locale.ROOT);
    return switch (text) {
      case "true", "yes", "on" -> Boolean.TRUE;
      case "false", "no", "off" -> Boolean.FALSE;
      default -> {
        problems.add(context + "." + key + " must be true or false (was '" + value + "')");
        yield null;
      }
    };
  }

  private static <T> void addIfPresent(List<T> target, T value) {
    if (value != null) {
      target.add(value);
    }
  }
}
