package ca.gc.cra.helm.application.session;

import ca.gc.cra.helm.application.port.MetricsPort;
import ca.gc.cra.helm.application.port.Receiver;
import ca.gc.cra.helm.domain.msg.OutboundMessage;
import ca.gc.cra.helm.domain.session.SessionId;
import ca.gc.cra.helm.logging.Logs;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Registry mapping session ids to their {@link Player}s.
 * <p><strong>Why:</strong> Transports only know a session id; this registry turns it into the controller that drives
 * an entity, and collects what every entity said back.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create a player on connect and remove it on disconnect.</li>
 *   <li>Deliver commands to a session and trigger its update pass.</li>
 *   <li>Drain every session's outbound messages in registration order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; callers must serialize access when more than one thread of
 * control is involved.</p>
 * <p><strong>Observability:</strong> Emits {@code session.*} counters; logs connects/disconnects at INFO.</p>
 *
 * @since 0.1.0
 */
public final class PlayerRegistry {
  private static final Logger log = LoggerFactory.getLogger(PlayerRegistry.class);

  private final Map<SessionId, Player> players = new LinkedHashMap<>();
  private final MetricsPort metrics;

  /**
   * Creates an empty registry without metrics.
   */
  public PlayerRegistry() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates an empty registry.
   *
   * @param metrics metrics sink; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public PlayerRegistry(MetricsPort metrics) {
    this.metrics = MetricsPort.orNoOp(metrics);
  }

  /**
   * Creates and registers a player for a newly connected session.
   *
   * @param id session id; must not be {@code null}
   * @return the new player
   * @throws DuplicateSessionException if {@code id} is already registered; the registry is left unchanged
   */
  public Player connect(SessionId id) {
    Objects.requireNonNull(id, "id");
    if (players.containsKey(id)) {
      throw new DuplicateSessionException(id);
    }
    Player player = new Player(id);
    players.put(id, player);
    metrics.increment("session.connected");
    log.info("Session {} connected", id);
    return player;
  }

  /**
   * Resolves a registered player.
   *
   * @param id session id
   * @return registered player
   * @throws UnknownSessionException if no player is registered under {@code id}
   */
  public Player lookup(SessionId id) {
    Player player = players.get(Objects.requireNonNull(id, "id"));
    if (player == null) {
      throw new UnknownSessionException(id);
    }
    return player;
  }

  public Optional<Player> find(SessionId id) {
    return Optional.ofNullable(players.get(id));
  }

  public boolean contains(SessionId id) {
    return players.containsKey(id);
  }

  public int size() {
    return players.size();
  }

  /**
   * Returns the registered session ids.
   *
   * @return snapshot in registration order
   */
  public List<SessionId> sessionIds() {
    return List.copyOf(players.keySet());
  }

  /**
   * Queues a command for a session and synchronously runs one update pass of its receiver.
   *
   * @param id session id
   * @param command raw command text; must not be {@code null}
   * @throws UnknownSessionException if {@code id} is not registered; no queue is touched
   */
  public void sendCommand(SessionId id, String command) {
    Objects.requireNonNull(command, "command");
    Player player = lookup(id);
    metrics.increment("session.command.submitted");
    log.debug("Session {} command: {}", id, Logs.truncate(command));
    player.submit(command);
  }

  /**
   * Lazily drains every session's outbound queue once, in registration order.
   *
   * <p>Each call returns a fresh, finite stream. Messages are removed from a player's queue only as the stream
   * reaches them; sessions removed before the stream reaches them are skipped.</p>
   *
   * @return stream of (session id, message) pairs
   */
  public Stream<OutboundMessage> receiveMessages() {
    Iterator<OutboundMessage> iterator = new DrainIterator(List.copyOf(players.values()));
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
  }

  /**
   * Removes a session after disconnect: detaches its receiver, drops its queues, then deletes the entry.
   *
   * @param id session id
   * @throws UnknownSessionException if {@code id} is not registered (including a second removal)
   */
  public void removePlayer(SessionId id) {
    Player player = lookup(id);
    Receiver receiver = player.receiver();
    if (receiver != null) {
      receiver.detach();
    }
    player.discardQueues();
    players.remove(id);
    metrics.increment("session.disconnected");
    log.info("Session {} disconnected", id);
  }

  private final class DrainIterator implements Iterator<OutboundMessage> {
    private final Iterator<Player> remaining;
    private Player current;
    private OutboundMessage next;

    private DrainIterator(List<Player> snapshot) {
      this.remaining = snapshot.iterator();
    }

    @Override
    public boolean hasNext() {
      while (next == null) {
        if (current != null) {
          Optional<String> message = current.pollMessage();
          if (message.isPresent()) {
            next = new OutboundMessage(current.id(), message.get());
            break;
          }
        }
        if (!advance()) {
          return false;
        }
      }
      return true;
    }

    @Override
    public OutboundMessage next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      OutboundMessage result = next;
      next = null;
      return result;
    }

    private boolean advance() {
      while (remaining.hasNext()) {
        Player candidate = remaining.next();
        if (players.get(candidate.id()) == candidate) {
          current = candidate;
          return true;
        }
      }
      current = null;
      return false;
    }
  }
}
