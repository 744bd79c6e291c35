package ca.gc.cra.docwatch.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Turns configured file names into paths, reporting names the platform cannot encode as configuration errors.
 *
 * <p>Names are resolved when a command needs them, not when configuration loads. Non-ASCII names such as the
 * default roster {@code sample_data/人员证件信息.csv} need a JVM whose {@code sun.jnu.encoding} can represent
 * them; under a C or POSIX locale {@link Path#of} rejects them.</p>
 *
 * @since 0.1.0
 */
public final class ConfigPaths {
  private ConfigPaths() {}

  /**
   * Resolves {@code value} for the setting {@code key}.
   *
   * @param key configuration key, used in the error message
   * @param value file name or path as configured
   * @return path
   * @throws ConfigException if the name cannot be represented on this platform
   */
  public static Path resolve(String key, String value) {
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new ConfigException(key + " '" + value + "' is not a usable file name on this platform ("
          + ex.getReason() + "; sun.jnu.encoding=" + System.getProperty("sun.jnu.encoding")
          + "); run under a UTF-8 locale or choose an ASCII name", ex);
    }
  }
}
