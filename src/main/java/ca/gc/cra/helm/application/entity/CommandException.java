package ca.gc.cra.helm.application.entity;

/**
 * Non-fatal command failure. {@link Character#update()} reports the message to the issuing controller and carries on
 * with the next queued command.
 *
 * @since 0.1.0
 */
public class CommandException extends RuntimeException {

  /**
   * Creates an exception with a player-visible message.
   *
   * @param message text sent back to the issuer
   */
  public CommandException(String message) {
    super(message);
  }

  /**
   * Builds the standard report for a command name that no table knows.
   *
   * @param command unknown command name
   * @return exception carrying {@code Command '<name>' not recognized.}
   */
  public static CommandException notRecognized(String command) {
    return new CommandException("Command '" + command + "' not recognized.");
  }
}
