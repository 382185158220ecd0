package ca.gc.cra.helm.application.control;

import ca.gc.cra.helm.application.port.Receiver;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded history of recently forwarded (member, message) pairs owned by one {@link Multireceiver}.
 *
 * <p>Size never exceeds {@link #capacity()} once a mutating call returns.</p>
 */
final class RoutingWindow {
  private final Deque<Entry> entries = new ArrayDeque<>();
  private final double factor;
  private int capacity;

  RoutingWindow(double factor, int memberCount) {
    if (!(factor > 0) || Double.isInfinite(factor)) {
      throw new IllegalArgumentException("dedup factor must be a positive finite number");
    }
    this.factor = factor;
    resize(memberCount);
  }

  /**
   * Recomputes capacity as {@code floor(factor * memberCount)}.
   */
  void resize(int memberCount) {
    if (memberCount < 0) {
      throw new IllegalArgumentException("memberCount must not be negative");
    }
    this.capacity = (int) Math.floor(factor * memberCount);
  }

  int capacity() {
    return capacity;
  }

  int size() {
    return entries.size();
  }

  /**
   * Discards the oldest entries until the window fits its capacity.
   */
  void trim() {
    while (entries.size() > capacity) {
      entries.removeFirst();
    }
  }

  /**
   * Returns {@code true} when another member already reported the same message within the window.
   */
  boolean reportedByOther(Receiver member, String message) {
    for (Entry entry : entries) {
      if (entry.member() != member && entry.message().equals(message)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns {@code true} when the last forwarded message came from a different member (or nothing was forwarded).
   */
  boolean speakerChanged(Receiver member) {
    return entries.isEmpty() || entries.peekLast().member() != member;
  }

  void record(Receiver member, String message) {
    entries.addLast(new Entry(member, message));
    trim();
  }

  List<Entry> snapshot() {
    return List.copyOf(entries);
  }

  record Entry(Receiver member, String message) {
    Entry {
      Objects.requireNonNull(member, "member");
      Objects.requireNonNull(message, "message");
    }
  }
}
