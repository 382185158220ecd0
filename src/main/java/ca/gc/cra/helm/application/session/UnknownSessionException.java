package ca.gc.cra.helm.application.session;

import ca.gc.cra.helm.domain.session.SessionId;

/**
 * Thrown when a session id has no registered {@link Player}.
 *
 * @since 0.1.0
 */
public final class UnknownSessionException extends RuntimeException {
  private final SessionId sessionId;

  /**
   * Creates an exception for the missing session.
   *
   * @param sessionId id that failed to resolve
   */
  public UnknownSessionException(SessionId sessionId) {
    super("Unknown session: " + sessionId);
    this.sessionId = sessionId;
  }

  public SessionId sessionId() {
    return sessionId;
  }
}
