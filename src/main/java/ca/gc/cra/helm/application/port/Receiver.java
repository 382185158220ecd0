package ca.gc.cra.helm.application.port;

/**
 * <strong>What:</strong> Attachable, updatable entity driven by a {@link Controller}.
 * <p><strong>Role:</strong> Outbound port implemented by single-owner entities and by group aggregators.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; updates run on the single cooperative thread of control.</p>
 *
 * @since 0.1.0
 */
public interface Receiver {

  /**
   * Places this receiver under the control of {@code controller}.
   *
   * <p>Attaching the controller that is already in charge is a no-op; this guard breaks the cycle started by
   * {@link Controller#assumeControl(Receiver)}.</p>
   *
   * @param controller new controller; must not be {@code null}
   */
  void attach(Controller controller);

  /**
   * Severs the current control association. A no-op when already detached.
   */
  void detach();

  /**
   * Runs one tick: consumes queued commands and emits messages.
   */
  void update();

  /**
   * Returns the controller currently driving this receiver.
   *
   * @return current controller, or {@code null} when detached
   */
  Controller controller();
}
