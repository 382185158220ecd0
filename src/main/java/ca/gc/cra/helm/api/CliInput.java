package ca.gc.cra.helm.api;

import ca.gc.cra.helm.validation.Strings;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Command-line tokens split into the two global switches and everything else.
 *
 * @param arguments non-switch tokens in the order given
 * @param help whether {@code --help}, {@code -h} or {@code help} was present
 * @param verbose whether {@code --verbose}, {@code -v} or {@code --debug} was present
 * @since 0.1.0
 */
public record CliInput(List<String> arguments, boolean help, boolean verbose) {
  private static final Set<String> HELP = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE = Set.of("--verbose", "-v", "--debug");

  public CliInput {
    arguments = List.copyOf(arguments);
  }

  /**
   * Splits raw arguments; blank tokens are ignored and switches match case-insensitively.
   *
   * @param args raw arguments, may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> rest = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String token = raw.trim();
        String lower = token.toLowerCase(Locale.ROOT);
        help |= HELP.contains(lower);
        verbose |= VERBOSE.contains(lower);
        if (!HELP.contains(lower) && !VERBOSE.contains(lower)) {
          rest.add(token);
        }
      }
    }
    return new CliInput(rest, help, verbose);
  }

  /**
   * Reads the remaining arguments as {@code key=value} options, splitting on the first {@code '='} and renaming
   * short keys through {@code aliases} (for example {@code party} to {@code console.party}).
   *
   * @param aliases short key to configuration key
   * @return mutable map in argument order; a repeated key keeps its last value
   * @throws IllegalArgumentException if an argument is not {@code key=value}, the key is not a single token, or the
   *     value is blank
   */
  public Map<String, String> options(Map<String, String> aliases) {
    Map<String, String> options = new LinkedHashMap<>();
    for (String argument : arguments) {
      int split = argument.indexOf('=');
      if (split <= 0) {
        throw new IllegalArgumentException("expected key=value but got '" + argument + "'");
      }
      String key = Strings.requireToken("option name", argument.substring(0, split));
      String value = Strings.requireNonBlank(key, argument.substring(split + 1));
      options.put(aliases.getOrDefault(key, key), value);
    }
    return options;
  }
}
