package ca.gc.cra.helm.application.entity;

import ca.gc.cra.helm.validation.Strings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable mapping from command name to handler for one {@link Character} type.
 * <p><strong>Why:</strong> Command sets are declared once, statically, per character type; a table may inherit the
 * commands of a parent table and add or override its own.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the first token of a command line to a handler.</li>
 *   <li>Track which commands are unique to this type (absent from every parent).</li>
 *   <li>Render the help menu: parent menus first, then a {@code [<Label> Commands]} section.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once built; safe to share.</p>
 *
 * @param <C> character type whose commands this table holds
 * @since 0.1.0
 */
public final class CommandTable<C extends Character> {
  private final Class<C> type;
  private final String label;
  private final Map<String, Command> commands;
  private final List<String> uniqueCommands;
  private final String helpMenu;

  private CommandTable(Builder<C> builder) {
    this.type = builder.type;
    this.label = builder.label;
    this.commands = Collections.unmodifiableMap(new LinkedHashMap<>(builder.commands));
    Set<String> inherited = new LinkedHashSet<>();
    StringBuilder menu = new StringBuilder();
    for (CommandTable<?> parent : builder.parents) {
      inherited.addAll(parent.commands.keySet());
      menu.append(parent.helpMenu);
    }
    List<String> unique = new ArrayList<>();
    for (String name : builder.commands.keySet()) {
      if (!inherited.contains(name)) {
        unique.add(name);
      }
    }
    this.uniqueCommands = List.copyOf(unique);
    menu.append('[').append(label).append(" Commands]\n")
        .append(String.join("\t", uniqueCommands)).append('\n');
    this.helpMenu = menu.toString();
  }

  /**
   * Starts a table for {@code type}, labelled from its simple name ({@code CamelCase} becomes {@code Camel Case}).
   *
   * @param type character type; must not be {@code null}
   * @param <C> character type
   * @return builder
   */
  public static <C extends Character> Builder<C> builder(Class<C> type) {
    return new Builder<>(type);
  }

  public Class<C> type() {
    return type;
  }

  /**
   * Returns the player-facing type label, e.g. {@code Dark Wizard}.
   *
   * @return label
   */
  public String label() {
    return label;
  }

  /**
   * Looks up a command by name, ignoring case.
   */
  public Optional<Command> find(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(commands.get(name.toLowerCase(Locale.ROOT)));
  }

  public Set<String> names() {
    return commands.keySet();
  }

  public List<String> uniqueCommands() {
    return uniqueCommands;
  }

  public String helpMenu() {
    return helpMenu;
  }

  /**
   * Parses and runs one command line against {@code target}.
   *
   * @param target character issuing the command; must be an instance of {@link #type()}
   * @param line raw command line; the first space-delimited token is the command name
   * @throws CommandException if the command is unknown or its handler rejects the arguments
   * @throws ClassCastException if {@code target} is not an instance of {@link #type()}
   */
  public void execute(Character target, String line) {
    Objects.requireNonNull(line, "line");
    C typed = type.cast(Objects.requireNonNull(target, "target"));
    String stripped = line.strip();
    int space = stripped.indexOf(' ');
    String name = space < 0 ? stripped : stripped.substring(0, space);
    String args = space < 0 ? "" : stripped.substring(space + 1).trim();
    Command command = find(name).orElseThrow(() -> CommandException.notRecognized(name));
    invoke(command.handler(), typed, args);
  }

  // Handlers come from this type or a supertype, checked in Builder#inherit.
  @SuppressWarnings("unchecked")
  private static <T extends Character> void invoke(CommandHandler<T> handler, Character target, String args) {
    handler.handle((T) target, args);
  }

  static String labelFor(Class<?> type) {
    String simple = type.getSimpleName();
    StringBuilder label = new StringBuilder(simple.length() + 4);
    for (int i = 0; i < simple.length(); i++) {
      char c = simple.charAt(i);
      if (i > 0 && java.lang.Character.isUpperCase(c)) {
        label.append(' ');
      }
      label.append(c);
    }
    return label.toString();
  }

  /**
   * One registered command.
   *
   * @param name command name as typed by the player
   * @param usage help text shown by {@code help <name>}
   * @param handler handler invoked with the remaining arguments
   */
  public record Command(String name, String usage, CommandHandler<?> handler) {
    public Command {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(usage, "usage");
      Objects.requireNonNull(handler, "handler");
    }
  }

  /**
   * Builder for {@link CommandTable}.
   *
   * @param <C> character type
   */
  public static final class Builder<C extends Character> {
    private final Class<C> type;
    private final Map<String, Command> commands = new LinkedHashMap<>();
    private final List<CommandTable<?>> parents = new ArrayList<>();
    private String label;

    private Builder(Class<C> type) {
      this.type = Objects.requireNonNull(type, "type");
      this.label = labelFor(type);
    }

    /**
     * Overrides the label derived from the class name.
     */
    public Builder<C> label(String label) {
      this.label = Strings.requireNonBlank("label", label);
      return this;
    }

    /**
     * Copies every command of {@code parent} into this table; later registrations may override them.
     *
     * @param parent table of a supertype of {@code C}
     * @throws IllegalArgumentException if the parent's type is not a supertype of {@code C}
     */
    public Builder<C> inherit(CommandTable<? super C> parent) {
      Objects.requireNonNull(parent, "parent");
      if (!parent.type().isAssignableFrom(type)) {
        throw new IllegalArgumentException(parent.type().getName() + " is not a supertype of " + type.getName());
      }
      parents.add(parent);
      commands.putAll(parent.commands);
      return this;
    }

    /**
     * Registers a command.
     *
     * @param name single-token command name; stored lowercase
     * @param usage help text
     * @param handler handler for the command
     */
    public Builder<C> register(String name, String usage, CommandHandler<? super C> handler) {
      String key = Strings.requireToken("command", name).toLowerCase(Locale.ROOT);
      commands.put(key, new Command(key, usage, handler));
      return this;
    }

    public CommandTable<C> build() {
      return new CommandTable<>(this);
    }
  }
}
