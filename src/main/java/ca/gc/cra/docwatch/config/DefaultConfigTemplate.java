package ca.gc.cra.docwatch.config;

import ca.gc.cra.docwatch.infrastructure.io.AtomicFileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the commented configuration template used by {@code init-config}.
 *
 * <p>The template uses the multi-relay shape and parses with {@link YamlConfigLoader} as-is.</p>
 *
 * @since 0.1.0
 */
public final class DefaultConfigTemplate {
  private static final Logger log = LoggerFactory.getLogger(DefaultConfigTemplate.class);

  /** Default template location. */
  public static final Path DEFAULT_PATH = Path.of("config_templates", "config_template.yaml");

  private DefaultConfigTemplate() {}

  /**
   * Returns the bundled template text.
   *
   * @return YAML text
   */
  public static String text() {
    return ClasspathTemplates.load(ClasspathTemplates.CONFIG_TEMPLATE);
  }

  /**
   * Writes the template to {@code target}.
   *
   * @param target destination file
   * @param overwrite whether an existing file may be replaced
   * @return the written path
   * @throws IOException when writing fails
   * @throws IllegalArgumentException when {@code target} exists and {@code overwrite} is {@code false}
   */
  public static Path write(Path target, boolean overwrite) throws IOException {
    Objects.requireNonNull(target, "target");
    if (Files.exists(target) && !overwrite) {
      throw new IllegalArgumentException(target + " already exists (pass --force to replace it)");
    }
    AtomicFileWriter.write(target, text().getBytes(StandardCharsets.UTF_8));
    log.info("Configuration template written to {}", target);
    return target;
  }
}
