package org.waabox.jobnotify;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manages the subscription of a {@link NotificationConnection} to its
 * private notification channel.
 *
 * <p>The channel name is derived from the connection's backend pid, so
 * concurrent listeners on different connections never receive each other's
 * notifications.
 *
 * <p>{@link #unlisten()} drains every notification still buffered on the
 * connection after unsubscribing. A notification may already sit in the
 * client-side buffer when the unsubscribe is acknowledged; without the
 * drain the next user of the pooled connection would observe it.
 *
 * <p>Not thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChannelSubscription {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(ChannelSubscription.class);

  /** The borrowed connection, never null. */
  private final NotificationConnection connection;

  /** The listener configuration, never null. */
  private final ListenerConfig config;

  /** The current state, never null. */
  private SubscriptionState state = SubscriptionState.UNSUBSCRIBED;

  /** The channel being listened on, null while unsubscribed. */
  private String channel;

  /**
   * Creates a new subscription over the given connection.
   *
   * @param theConnection the borrowed connection, never null
   * @param theConfig     the listener configuration, never null
   */
  public ChannelSubscription(final NotificationConnection theConnection,
      final ListenerConfig theConfig) {
    connection = Objects.requireNonNull(theConnection,
        "connection must not be null");
    config = Objects.requireNonNull(theConfig, "config must not be null");
  }

  /**
   * Subscribes to the connection's private channel.
   *
   * <p>Does nothing if already listening.
   */
  public void listen() {
    if (state == SubscriptionState.LISTENING) {
      log.debug("Already listening on channel '{}'", channel);
      return;
    }
    final String target = config.channelFor(connection.backendPid());
    connection.subscribe(target);
    channel = target;
    state = SubscriptionState.LISTENING;
    log.info("Listening on channel '{}'", channel);
  }

  /**
   * Unsubscribes from the private channel and discards every notification
   * still buffered on the connection.
   *
   * <p>Does nothing if not listening.
   */
  public void unlisten() {
    if (state == SubscriptionState.UNSUBSCRIBED) {
      return;
    }
    connection.unsubscribe(channel);

    int discarded = 0;
    List<Notification> pending = connection.pollNotifications();
    while (!pending.isEmpty()) {
      discarded += pending.size();
      pending = connection.pollNotifications();
    }

    log.info("Stopped listening on channel '{}', discarded {} pending"
        + " notifications", channel, discarded);

    channel = null;
    state = SubscriptionState.UNSUBSCRIBED;
  }

  /**
   * Returns the current subscription state.
   *
   * @return the state, never null
   */
  public SubscriptionState state() {
    return state;
  }

  /**
   * Returns the channel currently listened on.
   *
   * @return the channel name, empty when not listening
   */
  public Optional<String> channel() {
    return Optional.ofNullable(channel);
  }
}
