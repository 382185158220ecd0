package ca.gc.cra.helm.application.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CommandChannelTest {

  @Test
  void deliversInFifoOrder() throws InterruptedException {
    CommandChannel<String> channel = new CommandChannel<>();
    channel.send("a");
    channel.send("b");

    assertEquals("a", channel.receive());
    assertEquals(Optional.of("b"), channel.poll());
    assertEquals(Optional.empty(), channel.poll());
    assertTrue(channel.isEmpty());
  }

  @Test
  void boundedChannelRefusesWhenFull() {
    CommandChannel<String> channel = new CommandChannel<>(1);

    assertTrue(channel.send("a"));
    assertFalse(channel.send("b"));
    assertEquals(1, channel.size());
  }

  @Test
  void drainAndClearEmptyTheChannel() {
    CommandChannel<String> channel = new CommandChannel<>();
    channel.send("a");
    channel.send("b");

    assertEquals(List.of("a", "b"), channel.drain());
    channel.send("c");
    channel.clear();
    assertTrue(channel.isEmpty());
  }

  @Test
  void receiveWaitsForAProducer() {
    CommandChannel<String> channel = new CommandChannel<>();
    Thread producer = new Thread(() -> {
      try {
        Thread.sleep(50);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      channel.send("late");
    });
    producer.start();

    String received = assertTimeoutPreemptively(Duration.ofSeconds(5), channel::receive);
    assertEquals("late", received);
  }

  @Test
  void rejectsNullElementsAndNonPositiveCapacity() {
    CommandChannel<String> channel = new CommandChannel<>();

    assertThrows(NullPointerException.class, () -> channel.send(null));
    assertThrows(IllegalArgumentException.class, () -> new CommandChannel<String>(0));
  }
}
