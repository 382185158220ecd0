package ca.gc.cra.helm.application.control;

import ca.gc.cra.helm.application.port.Controller;
import ca.gc.cra.helm.application.port.Receiver;
import ca.gc.cra.helm.application.util.CommandChannel;
import java.util.Objects;

/**
 * Private per-member controller used by a {@link Multireceiver} to drive one member without handing it the external
 * controller. Commands arrive through {@link #enqueue(String)}; messages go back through the owner's routing step.
 */
final class MemberController implements Controller {
  private final Multireceiver owner;
  private final Receiver member;
  private final CommandChannel<String> commands = new CommandChannel<>();
  private Receiver receiver;

  MemberController(Multireceiver owner, Receiver member) {
    this.owner = Objects.requireNonNull(owner, "owner");
    this.member = Objects.requireNonNull(member, "member");
  }

  Receiver member() {
    return member;
  }

  void enqueue(String command) {
    commands.send(command);
  }

  int pendingCommands() {
    return commands.size();
  }

  @Override
  public String readCommand() {
    try {
      return commands.receive();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for a command for " + member, ex);
    }
  }

  @Override
  public void writeMessage(String message) {
    owner.route(member, Objects.requireNonNull(message, "message"));
  }

  @Override
  public boolean hasCommand() {
    return !commands.isEmpty();
  }

  /**
   * Diagnostic only: reports whether the owner's external controller has unread messages.
   */
  @Override
  public boolean hasMessage() {
    Controller external = owner.controller();
    return external != null && external.hasMessage();
  }

  @Override
  public Receiver receiver() {
    return receiver;
  }

  @Override
  public void bind(Receiver receiver) {
    this.receiver = receiver;
  }

  @Override
  public String toString() {
    return "MemberController[" + member + "]";
  }
}
