package ca.gc.cra.helm.domain.msg;

import ca.gc.cra.helm.domain.session.SessionId;
import java.util.Objects;

/**
 * One message collected from a session's outbound queue, addressed to that session.
 *
 * @param sessionId session the message belongs to; never {@code null}
 * @param message message text; never {@code null}
 *
 * @since 0.1.0
 */
public record OutboundMessage(SessionId sessionId, String message) {

  public OutboundMessage {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(message, "message");
  }
}
