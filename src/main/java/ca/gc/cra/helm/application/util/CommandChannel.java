package ca.gc.cra.helm.application.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * <strong>What:</strong> FIFO channel offering both a blocking receive and a non-blocking poll.
 * <p><strong>Why:</strong> Controllers expose a suspending read for the documented contract while the push-triggered
 * call pattern only ever polls queues that are known to be non-empty.</p>
 * <p><strong>Role:</strong> Backing store for controller command and message streams.</p>
 * <p><strong>Thread-safety:</strong> Backed by a {@link LinkedBlockingQueue}; individual operations are thread-safe,
 * but compound check-then-act sequences are not.</p>
 * <p><strong>Performance:</strong> O(1) send/poll/receive.</p>
 *
 * @param <T> element type
 * @since 0.1.0
 */
public final class CommandChannel<T> {
  private final BlockingQueue<T> queue;

  /**
   * Creates an unbounded channel.
   */
  public CommandChannel() {
    this.queue = new LinkedBlockingQueue<>();
  }

  /**
   * Creates a channel holding at most {@code capacity} elements.
   *
   * @param capacity maximum number of queued elements; must be positive
   * @throws IllegalArgumentException if {@code capacity} is not positive
   */
  public CommandChannel(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.queue = new LinkedBlockingQueue<>(capacity);
  }

  /**
   * Appends an element to the tail of the channel without blocking.
   *
   * @param element element to append; must not be {@code null}
   * @return {@code true} if accepted; {@code false} when a bounded channel is full
   */
  public boolean send(T element) {
    return queue.offer(Objects.requireNonNull(element, "element"));
  }

  /**
   * Removes the head element, waiting until one is available.
   *
   * @return head element
   * @throws InterruptedException if interrupted while waiting
   */
  public T receive() throws InterruptedException {
    return queue.take();
  }

  /**
   * Removes the head element if present.
   *
   * @return head element, or {@link Optional#empty()} when the channel is empty
   */
  public Optional<T> poll() {
    return Optional.ofNullable(queue.poll());
  }

  /**
   * Removes every queued element.
   *
   * @return drained elements in FIFO order
   */
  public List<T> drain() {
    List<T> drained = new ArrayList<>(queue.size());
    queue.drainTo(drained);
    return drained;
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }

  public int size() {
    return queue.size();
  }

  /**
   * Discards every queued element.
   */
  public void clear() {
    queue.clear();
  }
}
