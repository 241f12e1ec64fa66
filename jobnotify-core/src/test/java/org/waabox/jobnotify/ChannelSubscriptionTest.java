package org.waabox.jobnotify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for {@link ChannelSubscription}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ChannelSubscriptionTest {

  /** The fake connection, pid 981. */
  private InMemoryNotificationConnection connection;

  /** The subscription under test. */
  private ChannelSubscription subscription;

  @BeforeEach
  void setUp() {
    connection = new InMemoryNotificationConnection(981);
    subscription = new ChannelSubscription(connection,
        ListenerConfig.create());
  }

  @Test
  void whenListening_shouldSubscribeToChannelNamedAfterBackendPid() {
    subscription.listen();

    assertEquals(SubscriptionState.LISTENING, subscription.state());
    assertEquals("job_listener_981", subscription.channel().orElseThrow());
    assertEquals(List.of("LISTEN job_listener_981"), connection.commands());
  }

  @Test
  void whenListening_givenAlreadyListening_shouldNotSubscribeAgain() {
    subscription.listen();
    subscription.listen();

    assertEquals(List.of("LISTEN job_listener_981"), connection.commands());
  }

  @Test
  void whenListening_givenTwoConnections_shouldUseDistinctChannels() {
    final InMemoryNotificationConnection other =
        new InMemoryNotificationConnection(982);
    final ChannelSubscription otherSubscription = new ChannelSubscription(
        other, ListenerConfig.create());

    subscription.listen();
    otherSubscription.listen();

    connection.send("job_listener_982", "{\"message_type\":\"x\"}");

    assertEquals(0, connection.pendingCount());
    assertEquals(0, other.pendingCount());

    other.send("job_listener_982", "{\"message_type\":\"x\"}");
    assertEquals(1, other.pendingCount());
  }

  @Test
  void whenUnlistening_givenFiveBufferedNotifications_shouldDrainThem() {
    subscription.listen();
    for (int i = 0; i < 5; i++) {
      connection.send("job_listener_981", "{\"message_type\":\"blah\"}");
    }

    subscription.unlisten();

    assertEquals(0, connection.pendingCount());
    assertEquals(SubscriptionState.UNSUBSCRIBED, subscription.state());
    assertTrue(subscription.channel().isEmpty());
  }

  @Test
  void whenUnlistening_givenNotificationDeliveredInChunks_shouldDrainAll() {
    connection.pollChunkSize(1);
    subscription.listen();
    for (int i = 0; i < 3; i++) {
      connection.send("job_listener_981", "ping");
    }

    subscription.unlisten();

    assertEquals(0, connection.pendingCount());
  }

  @Test
  void whenUnlistening_shouldIgnoreLaterNotifications() {
    subscription.listen();
    connection.send("job_listener_981", "{\"message_type\":\"blah\"}");
    connection.pollNotifications();

    subscription.unlisten();
    connection.send("job_listener_981", "{\"message_type\":\"blah\"}");

    assertTrue(connection.pollNotifications().isEmpty());
    assertEquals(List.of("LISTEN job_listener_981",
        "UNLISTEN job_listener_981"), connection.commands());
  }

  @Test
  void whenUnlistening_givenNeverListened_shouldDoNothing() {
    subscription.unlisten();

    assertEquals(SubscriptionState.UNSUBSCRIBED, subscription.state());
    assertTrue(connection.commands().isEmpty());
  }
}
