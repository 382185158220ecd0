package ca.gc.cra.helm.application.control;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.helm.testutil.EchoReceiver;
import ca.gc.cra.helm.testutil.RecordingController;
import ca.gc.cra.helm.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class MultireceiverTest {
  private RecordingController external;
  private EchoReceiver alice;
  private EchoReceiver bob;
  private RecordingMetricsPort metrics;
  private Multireceiver group;

  @BeforeEach
  void setUp() {
    external = new RecordingController("external");
    alice = new EchoReceiver("alice");
    bob = new EchoReceiver("bob");
    metrics = new RecordingMetricsPort();
    group = new Multireceiver(List.of(alice, bob), Multireceiver.DEFAULT_DEDUP_FACTOR, metrics);
  }

  @Test
  void attachHandsEachMemberItsOwnPrivateController() {
    group.attach(external);

    assertSame(group, external.receiver());
    assertNotNull(alice.controller());
    assertNotSame(external, alice.controller());
    assertNotSame(alice.controller(), bob.controller());
    assertSame(alice, alice.controller().receiver());
    assertSame(group.adapterFor(bob), bob.controller());
  }

  @Test
  void reattachingSameControllerIsANoOp() {
    group.attach(external);
    MemberController aliceAdapter = group.adapterFor(alice);

    group.attach(external);

    assertEquals(1, external.bindings().size());
    assertSame(aliceAdapter, alice.controller());
  }

  @Test
  void commandsFanOutToEveryMemberInOrder() {
    group.attach(external);
    external.queue("look", "wave");

    group.update();

    assertEquals(List.of("look", "wave"), alice.seen());
    assertEquals(List.of("look", "wave"), bob.seen());
    assertEquals(2, metrics.count("multireceiver.command.fanout"));
    assertEquals(List.of(2L, 2L), metrics.observed("multireceiver.command.fanout.width"));
  }

  @Test
  void headerIsWrittenOnlyWhenTheSpeakerChanges() {
    group.attach(external);
    external.queue("1", "2");

    group.update();

    assertEquals(List.of(
        "[alice]", "alice heard 1", "alice heard 2",
        "[bob]", "bob heard 1", "bob heard 2"), external.takeMessages());
  }

  @Test
  void messageAlreadyReportedByAnotherMemberIsSuppressed() {
    Multireceiver chorus = new Multireceiver(
        List.of(new EchoReceiver("a", cmd -> "same"), new EchoReceiver("b", cmd -> "same")),
        Multireceiver.DEFAULT_DEDUP_FACTOR, metrics);
    chorus.attach(external);
    external.queue("sing");

    chorus.update();

    assertEquals(List.of("[a]", "same"), external.takeMessages());
    assertEquals(1, metrics.count("multireceiver.message.suppressed"));
    assertEquals(1, metrics.count("multireceiver.message.forwarded"));
  }

  @Test
  void sameMemberRepeatingItselfIsNotSuppressed() {
    group.attach(external);

    alice.say("hi");
    alice.say("hi");

    assertEquals(List.of("[alice]", "hi", "hi"), external.takeMessages());
  }

  @Test
  void duplicatesOutsideTheWindowAreForwardedAgain() {
    group.attach(external);
    assertEquals(3, group.capacity());

    alice.say("x");
    bob.say("1");
    bob.say("2");
    bob.say("3");
    bob.say("x");

    assertEquals(List.of("[alice]", "x", "[bob]", "1", "2", "3", "x"), external.takeMessages());
    assertTrue(group.windowSize() <= group.capacity());
  }

  @Test
  void duplicateInsideTheWindowIsDropped() {
    group.attach(external);

    alice.say("x");
    bob.say("x");

    assertEquals(List.of("[alice]", "x"), external.takeMessages());
  }

  @Test
  void capacityIsFloorOfFactorTimesMembers() {
    Multireceiver trio = new Multireceiver(new EchoReceiver("a"), new EchoReceiver("b"), new EchoReceiver("c"));
    Multireceiver wide = new Multireceiver(List.of(new EchoReceiver("a"), new EchoReceiver("b")), 2.0, null);

    assertEquals(4, trio.capacity());
    assertEquals(4, wide.capacity());
  }

  @Test
  void takenOverMemberIsEvictedAndReportedBeforeCommandsFanOut() {
    group.attach(external);
    RecordingController other = new RecordingController("other");
    other.assumeControl(bob);
    external.queue("x");

    group.update();

    assertEquals(List.of(alice), group.members());
    assertEquals(1, group.capacity());
    assertEquals(List.of("Lost connection with bob", "[alice]", "alice heard x"), external.takeMessages());
    assertTrue(bob.seen().isEmpty());
    assertSame(other, bob.controller());
    assertEquals(1, metrics.count("multireceiver.member.evicted"));
  }

  @Test
  void evictionIsLoggedAtWarn() {
    group.attach(external);
    new RecordingController("other").assumeControl(bob);

    Logger logger = (Logger) LoggerFactory.getLogger(Multireceiver.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    try {
      group.update();
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    List<ILoggingEvent> warnings = appender.list.stream()
        .filter(event -> event.getLevel() == Level.WARN)
        .toList();
    assertEquals(1, warnings.size());
    assertEquals("Member bob was taken over by other; evicting from group", warnings.get(0).getFormattedMessage());
  }

  @Test
  void windowShrinksAfterEviction() {
    group.attach(external);
    alice.say("1");
    alice.say("2");
    alice.say("3");
    assertEquals(3, group.windowSize());

    new RecordingController("other").assumeControl(bob);
    group.update();
    alice.say("4");

    assertEquals(1, group.windowSize());
  }

  @Test
  void detachedMemberIsNotEvictedAndItsCommandsWait() {
    group.attach(external);
    bob.detach();
    external.queue("look");

    group.update();

    assertEquals(List.of(alice, bob), group.members());
    assertEquals(List.of("[alice]", "alice heard look"), external.takeMessages());
    assertTrue(bob.seen().isEmpty());
    assertEquals(1, group.adapterFor(bob).pendingCommands());
    assertEquals(0, group.adapterFor(alice).pendingCommands());
  }

  @Test
  void detachReleasesExternalControllerAndMembers() {
    group.attach(external);

    group.detach();

    assertNull(group.controller());
    assertNull(external.receiver());
    assertNull(alice.controller());
    assertNull(bob.controller());
  }

  @Test
  void detachReleasesMembersTakenOverElsewhere() {
    group.attach(external);
    RecordingController other = new RecordingController("other");
    other.assumeControl(bob);

    group.detach();

    assertNull(bob.controller());
    assertNull(other.receiver());
    assertNull(alice.controller());
  }

  @Test
  void attachRejectsNullEvenWhenDetached() {
    assertThrows(NullPointerException.class, () -> group.attach(null));
    assertNull(group.controller());
  }

  @Test
  void updateWithoutExternalControllerStillUpdatesMembers() {
    group.update();

    assertEquals(1, alice.updates());
    assertEquals(1, bob.updates());
    assertEquals(0, group.windowSize());
  }

  @Test
  void switchingExternalControllerRebindsMembers() {
    group.attach(external);
    RecordingController next = new RecordingController("next");

    group.attach(next);

    assertNull(external.receiver());
    assertSame(group, next.receiver());
    assertSame(group.adapterFor(alice), alice.controller());
    next.queue("hello");
    group.update();
    assertEquals(List.of("[alice]", "alice heard hello", "[bob]", "bob heard hello"), next.takeMessages());
  }

  @Test
  void rejectsDuplicateAndNullMembers() {
    EchoReceiver member = new EchoReceiver("m");

    assertThrows(IllegalArgumentException.class,
        () -> new Multireceiver(List.of(member, member), Multireceiver.DEFAULT_DEDUP_FACTOR, null));
    assertThrows(NullPointerException.class, () -> new Multireceiver(member, null));
    assertThrows(IllegalArgumentException.class, () -> new Multireceiver(List.of(member), 0.0, null));
  }
}
