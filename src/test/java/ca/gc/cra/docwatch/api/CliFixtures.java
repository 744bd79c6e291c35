package ca.gc.cra.docwatch.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

/** Configuration and roster files for command tests. */
final class CliFixtures {
  static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

  private CliFixtures() {}

  /** Three documents: one expired, one seven days out, one far in the future. */
  static Path writeRoster(Path dir) throws IOException {
    Path csv = dir.resolve("roster.csv");
    Files.writeString(csv, """
        person_name,document_type,start_date,expiry_date,remarks
        张三,护照,2019-05-01,2024-05-01,
        李四,签证,2023-06-08,2024-06-08,研发部
        王五,驾驶证,2020-01-01,2030-01-01,
        """, StandardCharsets.UTF_8);
    return csv;
  }

  static Path writeConfig(Path dir, Path dataFile) throws IOException {
    Path yaml = dir.resolve("config.yaml");
    Files.writeString(yaml, """
        email:
          smtp_server: smtp.qq.com
          smtp_port: 465
          smtp_user: sender@qq.com
          smtp_password: code
          sender_name: 证件管理系统
          use_ssl: true
          receiver_email: hr@example.com
        reminder:
          days_before_expiry: [60, 30, 7, 1]
        report:
          output_filename: status_report_{date}.csv
        mail_template:
          subject: "证件到期提醒 {count} 份 {today_date}"
        data_file: "%s"
        """.formatted(dataFile.toString().replace('\\', '/')), StandardCharsets.UTF_8);
    return yaml;
  }
}
