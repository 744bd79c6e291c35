package ca.gc.cra.docwatch.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsed command line: flags ({@code --verbose}), {@code key=value} options, and bare words.
 *
 * <p>Option names must match {@code [A-Za-z0-9._-]+}; names and values must not contain control
 * characters. Later occurrences of a key replace earlier ones.</p>
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private final List<String> words;
  private final Map<String, String> options;
  private final Set<String> flags;

  private CliInput(List<String> words, Map<String, String> options, Set<String> flags) {
    this.words = List.copyOf(words);
    this.options = options;
    this.flags = Set.copyOf(flags);
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed input
   * @throws IllegalArgumentException when an option is malformed
   */
  public static CliInput parse(String[] args) {
    List<String> words = new ArrayList<>();
    Map<String, String> options = new LinkedHashMap<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args == null) {
      return new CliInput(words, options, flags);
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      String lower = arg.toLowerCase(Locale.ROOT);
      if (isHelpFlag(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else if (arg.indexOf('=') >= 0) {
        putOption(options, raw, arg);
      } else {
        words.add(arg);
      }
    }
    return new CliInput(words, options, flags);
  }

  /**
   * Returns whether {@code arg} requests help.
   *
   * @param arg raw argument
   * @return {@code true} for {@code --help}, {@code -h}, or {@code help}
   */
  static boolean isHelpFlag(String arg) {
    return arg != null && HELP_FLAGS.contains(arg.trim().toLowerCase(Locale.ROOT));
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --force} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns a non-blank option value.
   *
   * @param key option name
   * @return trimmed value, or empty when absent or blank
   */
  public Optional<String> option(String key) {
    String value = options.get(key);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
  }

  /**
   * Returns the options as a mutable copy; consumers may remove the keys they handle.
   *
   * @return options in command-line order
   */
  public Map<String, String> options() {
    return new LinkedHashMap<>(options);
  }

  /** Bare words (no {@code =}, no leading dash) in order. */
  public List<String> words() {
    return words;
  }

  private static void putOption(Map<String, String> options, String raw, String arg) {
    int idx = arg.indexOf('=');
    if (idx <= 0) {
      throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
    }
    String key = arg.substring(0, idx).trim();
    String value = arg.substring(idx + 1).trim();
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
    if (containsControl(value)) {
      throw new IllegalArgumentException("argument " + key + " must not contain control characters");
    }
    options.put(key, value);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
