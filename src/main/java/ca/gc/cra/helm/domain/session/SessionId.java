package ca.gc.cra.helm.domain.session;

import ca.gc.cra.helm.validation.Strings;

/**
 * Stable external key identifying one connected actor.
 *
 * <p><strong>Thread-safety:</strong> Records are immutable and safely shareable.</p>
 *
 * @param value canonical identifier; trimmed, never blank
 *
 * @since 0.1.0
 */
public record SessionId(String value) {

  /**
   * Canonicalizes the identifier.
   *
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if {@code value} is blank or contains control characters
   */
  public SessionId {
    value = Strings.requireNonBlank("sessionId", value);
  }

  /**
   * Builds a session id from raw transport text.
   *
   * @param value raw identifier
   * @return canonical session id
   */
  public static SessionId of(String value) {
    return new SessionId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
