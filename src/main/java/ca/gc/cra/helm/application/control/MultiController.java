package ca.gc.cra.helm.application.control;

import ca.gc.cra.helm.application.port.Controller;
import ca.gc.cra.helm.application.port.Receiver;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Composite controller fanning several controllers into one command stream.
 * <p><strong>Why:</strong> Lets multiple actors (two players, or a player and an AI) drive a single receiver.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Flatten nested composites so the effective member order is the leaf registration order.</li>
 *   <li>Read the first available command in member order.</li>
 *   <li>Broadcast every message to all members.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; member list is fixed at construction.</p>
 *
 * @implNote Members are only ever touched through their own {@link Controller} operations.
 * @since 0.1.0
 */
public final class MultiController implements Controller {
  private final List<Controller> members;
  private Receiver receiver;

  /**
   * Creates a composite over the supplied controllers.
   *
   * @param controllers constituents in registration order; composites are flattened in place
   * @throws NullPointerException if the array or any constituent is {@code null}
   */
  public MultiController(Controller... controllers) {
    this(List.of(Objects.requireNonNull(controllers, "controllers")));
  }

  /**
   * Creates a composite over the supplied controllers.
   *
   * @param controllers constituents in registration order; composites are flattened in place
   * @throws NullPointerException if the list or any constituent is {@code null}
   */
  public MultiController(List<? extends Controller> controllers) {
    Objects.requireNonNull(controllers, "controllers");
    List<Controller> flattened = new ArrayList<>();
    for (Controller controller : controllers) {
      Objects.requireNonNull(controller, "controller");
      if (controller instanceof MultiController composite) {
        flattened.addAll(composite.members);
      } else {
        flattened.add(controller);
      }
    }
    this.members = List.copyOf(flattened);
  }

  /**
   * Returns the flattened constituents.
   *
   * @return immutable member list in registration order
   */
  public List<Controller> members() {
    return members;
  }

  /**
   * Returns the command of the first member, in registration order, that has one queued.
   *
   * @throws IllegalStateException when no member has a queued command
   */
  @Override
  public String readCommand() {
    for (Controller member : members) {
      if (member.hasCommand()) {
        return member.readCommand();
      }
    }
    throw new IllegalStateException("No constituent controller has a queued command");
  }

  @Override
  public void writeMessage(String message) {
    Objects.requireNonNull(message, "message");
    for (Controller member : members) {
      member.writeMessage(message);
    }
  }

  @Override
  public boolean hasCommand() {
    for (Controller member : members) {
      if (member.hasCommand()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean hasMessage() {
    for (Controller member : members) {
      if (member.hasMessage()) {
        return true;
      }
    }
    return false;
  }

  @Override
  public Receiver receiver() {
    return receiver;
  }

  /**
   * Binds this composite and every member to {@code receiver}. On unbind, only members still pointing at the
   * previous receiver are cleared, so a member that has since taken over something else keeps it.
   */
  @Override
  public void bind(Receiver receiver) {
    Receiver previous = this.receiver;
    this.receiver = receiver;
    for (Controller member : members) {
      if (receiver != null) {
        member.bind(receiver);
      } else if (member.receiver() == previous) {
        member.bind(null);
      }
    }
  }

  @Override
  public String toString() {
    return "MultiController" + members;
  }
}
