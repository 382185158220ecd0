package ca.gc.cra.helm.application.control;

import ca.gc.cra.helm.application.port.Controller;
import ca.gc.cra.helm.application.port.Receiver;
import java.util.Objects;

/**
 * Receiver that listens to exactly one controller at a time and keeps the back-references symmetric:
 * {@code receiver.controller() == c} if and only if {@code c.receiver() == receiver}.
 *
 * <p>Subclasses supply {@link #update()}.</p>
 *
 * @since 0.1.0
 */
public abstract class Monoreceiver implements Receiver {
  private Controller controller;

  protected Monoreceiver() {}

  @Override
  public void attach(Controller controller) {
    Objects.requireNonNull(controller, "controller");
    if (controller == this.controller) {
      return;
    }
    detach();
    this.controller = controller;
    controller.bind(this);
  }

  @Override
  public void detach() {
    Controller current = this.controller;
    if (current == null) {
      return;
    }
    current.bind(null);
    this.controller = null;
  }

  @Override
  public Controller controller() {
    return controller;
  }
}
