package ca.gc.cra.helm.application.control;

import ca.gc.cra.helm.application.port.Controller;
import ca.gc.cra.helm.application.port.MetricsPort;
import ca.gc.cra.helm.application.port.Receiver;
import ca.gc.cra.helm.logging.Logs;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Receiver composed of several member receivers, driven as a group by one external controller.
 * <p><strong>Why:</strong> Lets one actor steer a party of entities while reading a single, labelled transcript.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Give every member a private {@link MemberController} so members never see the external controller.</li>
 *   <li>Copy each external command to every active member, preserving order.</li>
 *   <li>Forward member messages with a {@code [<member>]} header on speaker change, suppressing a message another
 *       member already reported within the routing window.</li>
 *   <li>Evict members that were taken over by some other controller.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the member map and routing window belong to this instance.</p>
 * <p><strong>Observability:</strong> Emits {@code multireceiver.*} counters; logs evictions at WARN.</p>
 *
 * @implNote Window capacity is {@code floor(dedupFactor * activeMembers)} and is recomputed on every eviction.
 * @since 0.1.0
 */
public class Multireceiver extends Monoreceiver {
  /** Default multiplier applied to the active member count to size the routing window. */
  public static final double DEFAULT_DEDUP_FACTOR = 1.5;

  private static final Logger log = LoggerFactory.getLogger(Multireceiver.class);

  private final Map<Receiver, MemberController> members = new LinkedHashMap<>();
  private final RoutingWindow window;
  private final MetricsPort metrics;

  /**
   * Creates a group using the default dedup factor and no metrics.
   *
   * @param members member receivers in iteration order
   */
  public Multireceiver(Receiver... members) {
    this(List.of(Objects.requireNonNull(members, "members")), DEFAULT_DEDUP_FACTOR, MetricsPort.NO_OP);
  }

  /**
   * Creates a group.
   *
   * @param members member receivers in iteration order; no {@code null} or repeated entries
   * @param dedupFactor routing window multiplier; must be positive
   * @param metrics metrics sink; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @throws IllegalArgumentException if a member repeats, is this group itself, or the factor is not positive
   */
  public Multireceiver(List<? extends Receiver> members, double dedupFactor, MetricsPort metrics) {
    Objects.requireNonNull(members, "members");
    for (Receiver member : members) {
      Objects.requireNonNull(member, "member");
      if (member == this) {
        throw new IllegalArgumentException("A group cannot contain itself");
      }
      if (this.members.putIfAbsent(member, new MemberController(this, member)) != null) {
        throw new IllegalArgumentException("Duplicate member: " + member);
      }
    }
    this.window = new RoutingWindow(dedupFactor, this.members.size());
    this.metrics = MetricsPort.orNoOp(metrics);
  }

  /**
   * Returns the active members.
   *
   * @return snapshot of members in iteration order
   */
  public List<Receiver> members() {
    return List.copyOf(members.keySet());
  }

  /**
   * Returns the current routing window capacity.
   *
   * @return {@code floor(dedupFactor * activeMembers)}
   */
  public int capacity() {
    return window.capacity();
  }

  int windowSize() {
    return window.size();
  }

  MemberController adapterFor(Receiver member) {
    return members.get(member);
  }

  /**
   * Attaches the external controller, then has every member's private controller take the member over.
   */
  @Override
  public void attach(Controller controller) {
    Objects.requireNonNull(controller, "controller");
    if (controller == controller()) {
      return;
    }
    super.attach(controller);
    for (MemberController adapter : new ArrayList<>(members.values())) {
      adapter.assumeControl(adapter.member());
    }
  }

  /**
   * Releases the external controller and detaches every member.
   */
  @Override
  public void detach() {
    super.detach();
    for (Receiver member : new ArrayList<>(members.keySet())) {
      member.detach();
    }
  }

  /**
   * Runs one tick: evicts taken-over members, fans external commands out, then updates every member.
   */
  @Override
  public void update() {
    evictLostMembers();
    fanOutCommands();
    for (Receiver member : new ArrayList<>(members.keySet())) {
      member.update();
    }
  }

  private void evictLostMembers() {
    var iterator = members.entrySet().iterator();
    while (iterator.hasNext()) {
      Map.Entry<Receiver, MemberController> entry = iterator.next();
      Controller current = entry.getKey().controller();
      if (current == null || current == entry.getValue()) {
        continue;
      }
      iterator.remove();
      window.resize(members.size());
      metrics.increment("multireceiver.member.evicted");
      log.warn("Member {} was taken over by {}; evicting from group", entry.getKey(), current);
      Controller external = controller();
      if (external != null) {
        external.writeMessage("Lost connection with " + entry.getKey());
      }
    }
  }

  private void fanOutCommands() {
    Controller external = controller();
    if (external == null) {
      return;
    }
    while (external.hasCommand()) {
      String command = external.readCommand();
      for (MemberController adapter : members.values()) {
        adapter.enqueue(command);
      }
      metrics.increment("multireceiver.command.fanout");
      metrics.observe("multireceiver.command.fanout.width", members.size());
    }
  }

  /**
   * Routes one member message to the external controller.
   */
  void route(Receiver member, String message) {
    window.trim();
    if (window.reportedByOther(member, message)) {
      metrics.increment("multireceiver.message.suppressed");
      log.debug("Suppressed duplicate from {}: {}", member, Logs.truncate(message));
      return;
    }
    Controller external = controller();
    if (external == null) {
      log.debug("Dropped message from {} while detached: {}", member, Logs.truncate(message));
      return;
    }
    if (window.speakerChanged(member)) {
      external.writeMessage("[" + member + "]");
    }
    external.writeMessage(message);
    window.record(member, message);
    metrics.increment("multireceiver.message.forwarded");
  }

  @Override
  public String toString() {
    return "Multireceiver" + members.keySet();
  }
}
