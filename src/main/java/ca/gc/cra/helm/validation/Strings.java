package ca.gc.cra.helm.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Checks applied to names, ids and command tokens before they become map keys or appear in player-visible text.
 * Failures raise {@link IllegalArgumentException} naming the offending parameter.
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9._-]+");

  private Strings() {
    // Utility
  }

  /**
   * Returns {@code value} trimmed, provided it is neither blank nor carrying control characters.
   *
   * @param name parameter name used in the failure message
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if {@code value} is blank or contains an ISO control character
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, label(name));
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Like {@link #requireNonBlank(String, String)}, and additionally limits the value to one token of letters, digits,
   * dot, underscore or hyphen.
   *
   * @param name parameter name used in the failure message
   * @param token candidate token
   * @return trimmed token
   */
  public static String requireToken(String name, String token) {
    String trimmed = requireNonBlank(name, token);
    if (!TOKEN.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(label(name) + " must be a single token of [A-Za-z0-9._-]: " + trimmed);
    }
    return trimmed;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
