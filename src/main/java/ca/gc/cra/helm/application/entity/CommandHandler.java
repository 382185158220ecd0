package ca.gc.cra.helm.application.entity;

/**
 * Handler bound to one command name in a {@link CommandTable}.
 *
 * @param <C> character type the handler acts on
 * @since 0.1.0
 */
@FunctionalInterface
public interface CommandHandler<C extends Character> {

  /**
   * Executes the command.
   *
   * @param character character issuing the command
   * @param args text following the command name, trimmed; empty when absent
   * @throws CommandException when the command cannot be carried out; reported back to the issuer
   */
  void handle(C character, String args);
}
