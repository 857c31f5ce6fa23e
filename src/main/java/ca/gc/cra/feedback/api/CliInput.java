package ca.gc.cra.feedback.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into {@code key=value} pairs and bare flags.
 *
 * <p>Flags are lower-cased; help aliases ({@code -h}, {@code help}) normalize to {@code --help} and
 * verbose aliases ({@code -v}, {@code --debug}) to {@code --verbose}.</p>
 *
 * @param keyValues non-flag arguments, trimmed, in their original order
 * @param flags normalized flags
 */
public record CliInput(List<String> keyValues, Set<String> flags) {
  private static final Set<String> HELP_ALIASES = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_ALIASES = Set.of("--verbose", "-v", "--debug");

  public CliInput {
    keyValues = List.copyOf(keyValues);
    flags = Set.copyOf(flags);
  }

  /**
   * Partitions raw arguments. Blank and {@code null} entries are skipped.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> keyValues = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_ALIASES.contains(lower)) {
          flags.add("--help");
        } else if (VERBOSE_ALIASES.contains(lower)) {
          flags.add("--verbose");
        } else if (arg.startsWith("-") && arg.indexOf('=') < 0) {
          flags.add(lower);
        } else {
          keyValues.add(arg);
        }
      }
    }
    return new CliInput(keyValues, flags);
  }

  /** Returns the non-flag arguments in the array form {@link CliArgsParser#toMap(String[])} takes. */
  public String[] keyValueArgs() {
    return keyValues.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was supplied.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
