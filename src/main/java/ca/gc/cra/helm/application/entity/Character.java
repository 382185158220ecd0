package ca.gc.cra.helm.application.entity;

import ca.gc.cra.helm.application.control.Monoreceiver;
import ca.gc.cra.helm.application.port.Controller;
import ca.gc.cra.helm.validation.Strings;

/**
 * <strong>What:</strong> Base class for playable entities driven by text commands.
 * <p><strong>Role:</strong> Single-owner receiver; each subclass publishes a static {@link CommandTable} that inherits
 * {@link #COMMANDS} and returns it from {@link #commands()}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drain the controller's commands in FIFO order on every {@link #update()}.</li>
 *   <li>Report unknown or rejected commands back to the controller without stopping.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public abstract class Character extends Monoreceiver {
  /** Commands every character understands. */
  public static final CommandTable<Character> COMMANDS = CommandTable.builder(Character.class)
      .register("help", """
          Show relevant help information for a particular command.
          usage: help [command]
          If no command is supplied, a list of all commands is shown.""", Character::help)
      .register("say", """
          Say a message aloud.
          usage: say [msg]""", Character::say)
      .build();

  private final String name;

  protected Character(String name) {
    this.name = Strings.requireNonBlank("name", name);
  }

  public String name() {
    return name;
  }

  /**
   * Returns the command table for this character's concrete type.
   *
   * @return table whose {@link CommandTable#type()} matches this instance
   */
  protected CommandTable<? extends Character> commands() {
    return COMMANDS;
  }

  /**
   * Sends a message to the controller of this character; dropped when detached.
   *
   * @param message message text
   */
  public void message(String message) {
    Controller controller = controller();
    if (controller != null) {
      controller.writeMessage(message);
    }
  }

  /**
   * Processes every queued command in order. Blank lines are skipped; failures are reported as messages.
   */
  @Override
  public void update() {
    Controller controller = controller();
    while (controller != null && controller.hasCommand()) {
      String line = controller.readCommand();
      if (!line.isBlank()) {
        try {
          commands().execute(this, line);
        } catch (CommandException ex) {
          message(ex.getMessage());
        }
      }
      controller = controller();
    }
  }

  private void help(String args) {
    CommandTable<? extends Character> table = commands();
    if (args.isEmpty()) {
      message(table.helpMenu());
      return;
    }
    String command = args.split(" ")[0];
    message(table.find(command)
        .orElseThrow(() -> CommandException.notRecognized(command))
        .usage());
  }

  private void say(String args) {
    message(this + " : " + args);
  }

  @Override
  public String toString() {
    return name + " the " + commands().label();
  }
}
