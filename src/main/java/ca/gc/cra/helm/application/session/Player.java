package ca.gc.cra.helm.application.session;

import ca.gc.cra.helm.application.port.Controller;
import ca.gc.cra.helm.application.port.Receiver;
import ca.gc.cra.helm.application.util.CommandChannel;
import ca.gc.cra.helm.domain.session.SessionId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Controller backed by one connected session and two FIFO queues.
 * <p><strong>Why:</strong> Gives transports a stable handle (the {@link SessionId}) for pushing commands in and
 * collecting messages out.</p>
 * <p><strong>Role:</strong> Created and owned by {@link PlayerRegistry}; never constructed directly by callers.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; driven from the single cooperative thread of control.</p>
 *
 * @implNote Updates are push-triggered: {@link #submit(String)} runs one full update pass of the attached receiver
 * before returning, so the blocking {@link #readCommand()} path is never hit by the documented call pattern.
 * @since 0.1.0
 */
public final class Player implements Controller {
  private final SessionId id;
  private final CommandChannel<String> commands = new CommandChannel<>();
  private final CommandChannel<String> messages = new CommandChannel<>();
  private final List<String> deferred = new ArrayList<>();
  private Receiver receiver;
  private boolean updating;

  Player(SessionId id) {
    this.id = Objects.requireNonNull(id, "id");
  }

  public SessionId id() {
    return id;
  }

  /**
   * Queues a command and runs one update pass of the attached receiver.
   *
   * <p>Commands submitted while a pass for this player is already running are held back until that pass ends,
   * so they are handled by the next trigger rather than the current one.</p>
   *
   * @param command raw command text; must not be {@code null}
   */
  void submit(String command) {
    Objects.requireNonNull(command, "command");
    if (updating) {
      deferred.add(command);
      return;
    }
    commands.send(command);
    trigger();
  }

  /**
   * Runs one update pass of the attached receiver, if any.
   */
  void trigger() {
    Receiver current = receiver;
    if (current == null || updating) {
      return;
    }
    updating = true;
    try {
      current.update();
    } finally {
      updating = false;
      for (String command : deferred) {
        commands.send(command);
      }
      deferred.clear();
    }
  }

  /**
   * Removes the oldest outbound message without blocking.
   *
   * @return oldest message, or {@link Optional#empty()} when none are queued
   */
  Optional<String> pollMessage() {
    return messages.poll();
  }

  /**
   * Drops every queued command and message.
   */
  void discardQueues() {
    commands.clear();
    messages.clear();
    deferred.clear();
  }

  /**
   * Blocks until a command is queued, then removes and returns it.
   *
   * @throws IllegalStateException if the thread is interrupted while waiting
   */
  @Override
  public String readCommand() {
    try {
      return commands.receive();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for a command on session " + id, ex);
    }
  }

  @Override
  public void writeMessage(String message) {
    messages.send(Objects.requireNonNull(message, "message"));
  }

  @Override
  public boolean hasCommand() {
    return !commands.isEmpty();
  }

  @Override
  public boolean hasMessage() {
    return !messages.isEmpty();
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
    return "id: " + id + " receiver: " + receiver;
  }
}
