package ca.gc.cra.helm.application.entity;

/**
 * Plain character used by the console session; adds a {@code wave} emote to the base commands.
 *
 * @since 0.1.0
 */
public class Wanderer extends Character {
  public static final CommandTable<Wanderer> COMMANDS = CommandTable.builder(Wanderer.class)
      .inherit(Character.COMMANDS)
      .register("wave", """
          Wave at whoever is watching.
          usage: wave""", Wanderer::wave)
      .build();

  public Wanderer(String name) {
    super(name);
  }

  @Override
  protected CommandTable<Wanderer> commands() {
    return COMMANDS;
  }

  private void wave(String args) {
    message(name() + " waves.");
  }
}
