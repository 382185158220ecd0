package ca.gc.cra.helm.application.port;

import ca.gc.cra.helm.application.control.MultiController;

/**
 * <strong>What:</strong> Two-queue endpoint mediating between an external actor and the entity it drives.
 * <p><strong>Why:</strong> Lets a human player, an AI, or another program drive a {@link Receiver} without either
 * side knowing how the other is implemented.</p>
 * <p><strong>Role:</strong> Inbound port; implemented by sessions, composites, and internal group adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold the inbound command stream consumed by the driven receiver.</li>
 *   <li>Hold the outbound message stream produced by the driven receiver.</li>
 *   <li>Track the receiver currently driven (non-owning back-reference).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; all controllers are driven from one cooperative thread of
 * control.</p>
 * <p><strong>Performance:</strong> Queue operations are expected to be O(1).</p>
 *
 * @implNote Callers must gate {@link #readCommand()} behind {@link #hasCommand()}; reading an empty queue may block
 * indefinitely.
 * @since 0.1.0
 */
public interface Controller {

  /**
   * Removes and returns the oldest queued command.
   *
   * @return oldest command; never {@code null}
   * @throws IllegalStateException if the implementation cannot wait for a command (interrupted, or no command is
   *     available on a non-blocking composite)
   *
   * <p><strong>Concurrency:</strong> May suspend the calling thread until a command arrives.</p>
   */
  String readCommand();

  /**
   * Appends a message to the outbound stream.
   *
   * @param message message text; must not be {@code null}
   *
   * <p><strong>Performance:</strong> Never blocks and never fails for a non-null message.</p>
   */
  void writeMessage(String message);

  /**
   * Indicates whether at least one command is queued.
   *
   * @return {@code true} when {@link #readCommand()} would return immediately
   */
  boolean hasCommand();

  /**
   * Indicates whether at least one outbound message has not been collected yet.
   *
   * @return {@code true} when messages are waiting
   */
  boolean hasMessage();

  /**
   * Returns the receiver this controller currently drives.
   *
   * @return driven receiver, or {@code null} when detached
   */
  Receiver receiver();

  /**
   * Updates the receiver back-reference.
   *
   * <p>Only {@link Receiver#attach(Controller)} and {@link Receiver#detach()} call this method; nothing else may
   * rebind a controller.</p>
   *
   * @param receiver new driven receiver, or {@code null} to clear the back-reference
   */
  void bind(Receiver receiver);

  /**
   * Detaches {@code receiver} from whatever drives it, then attaches it to this controller.
   *
   * @param receiver receiver to take over; must not be {@code null}
   */
  default void assumeControl(Receiver receiver) {
    receiver.detach();
    receiver.attach(this);
  }

  /**
   * Combines this controller with another into a composite that fans both into one stream.
   *
   * @param other controller to combine with; must not be {@code null}
   * @return composite whose constituents are this controller followed by {@code other}
   */
  default Controller combine(Controller other) {
    return new MultiController(this, other);
  }
}
