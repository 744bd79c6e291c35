package ca.gc.cra.docwatch.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads template resources bundled with the application.
 *
 * @since 0.1.0
 */
public final class ClasspathTemplates {
  public static final String BODY = "/templates/body.html";
  public static final String ROW = "/templates/row.html";
  public static final String TEST_EMAIL = "/templates/test-email.html";
  public static final String CONFIG_TEMPLATE = "/templates/config_template.yaml";

  private ClasspathTemplates() {}

  /**
   * Reads a UTF-8 resource.
   *
   * @param resource absolute classpath resource name
   * @return resource text
   * @throws IllegalStateException if the resource is not packaged
   * @throws UncheckedIOException if the resource cannot be read
   */
  public static String load(String resource) {
    try (InputStream in = ClasspathTemplates.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Missing bundled resource " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read bundled resource " + resource, ex);
    }
  }
}
