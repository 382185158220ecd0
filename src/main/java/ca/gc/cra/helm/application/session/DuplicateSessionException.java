package ca.gc.cra.helm.application.session;

import ca.gc.cra.helm.domain.session.SessionId;

/**
 * Thrown when a session id is already registered.
 *
 * @since 0.1.0
 */
public final class DuplicateSessionException extends RuntimeException {
  private final SessionId sessionId;

  /**
   * Creates an exception for the id that is already taken.
   *
   * @param sessionId id that collided
   */
  public DuplicateSessionException(SessionId sessionId) {
    super("ID already taken: " + sessionId);
    this.sessionId = sessionId;
  }

  public SessionId sessionId() {
    return sessionId;
  }
}
