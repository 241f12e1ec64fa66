package org.waabox.jobnotify.pg;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.jobnotify.ListenerConnectionException;
import org.waabox.jobnotify.Notification;
import org.waabox.jobnotify.NotificationConnection;

/**
 * A {@link NotificationConnection} backed by a pgjdbc connection.
 *
 * <p>Subscriptions are issued as {@code LISTEN} / {@code UNLISTEN}
 * statements. Waiting relies on {@link PGConnection#getNotifications(int)},
 * which blocks on the socket until a notification arrives or the timeout
 * elapses; the notifications it returns are kept in a local buffer and
 * handed out by the next {@link #pollNotifications()}.
 *
 * <p>The wrapped connection is borrowed: this class never closes it, and it
 * must not be used by anyone else while a listener owns it.
 *
 * <p>Every {@link SQLException} is rethrown as a
 * {@link ListenerConnectionException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PgNotificationConnection implements NotificationConnection {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PgNotificationConnection.class);

  /** The longest wait pgjdbc accepts. */
  private static final Duration MAX_WAIT =
      Duration.ofMillis(Integer.MAX_VALUE);

  /** The wrapped JDBC connection, never null. */
  private final Connection connection;

  /** The pgjdbc view of the connection, never null. */
  private final PGConnection pgConnection;

  /** Notifications received while waiting, not yet polled. */
  private final Deque<Notification> buffered = new ArrayDeque<>();

  /**
   * Creates a new notification connection.
   *
   * @param theConnection a connection to a PostgreSQL server, never null
   *
   * @throws ListenerConnectionException if the connection is not a pgjdbc
   *                                     connection
   */
  public PgNotificationConnection(final Connection theConnection) {
    connection = Objects.requireNonNull(theConnection,
        "connection must not be null");
    try {
      pgConnection = theConnection.unwrap(PGConnection.class);
    } catch (final SQLException e) {
      throw new ListenerConnectionException(
          "Connection is not a PostgreSQL connection", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public int backendPid() {
    return pgConnection.getBackendPID();
  }

  /** {@inheritDoc} */
  @Override
  public void subscribe(final String channel) {
    Objects.requireNonNull(channel, "channel must not be null");
    execute("LISTEN " + quoteIdentifier(channel));
  }

  /** {@inheritDoc} */
  @Override
  public void unsubscribe(final String channel) {
    Objects.requireNonNull(channel, "channel must not be null");
    execute("UNLISTEN " + quoteIdentifier(channel));
  }

  /** {@inheritDoc} */
  @Override
  public boolean awaitNotifications(final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout must not be null");

    if (!buffered.isEmpty()) {
      return true;
    }

    try {
      if (timeout.isZero() || timeout.isNegative()) {
        buffer(pgConnection.getNotifications());
      } else {
        buffer(pgConnection.getNotifications(toWaitMillis(timeout)));
      }
    } catch (final SQLException e) {
      throw new ListenerConnectionException(
          "Failed to wait for notifications", e);
    }
    return !buffered.isEmpty();
  }

  /** {@inheritDoc} */
  @Override
  public List<Notification> pollNotifications() {
    try {
      buffer(pgConnection.getNotifications());
    } catch (final SQLException e) {
      throw new ListenerConnectionException(
          "Failed to poll notifications", e);
    }

    if (buffered.isEmpty()) {
      return Collections.emptyList();
    }
    final List<Notification> result = new ArrayList<>(buffered);
    buffered.clear();
    return result;
  }

  /**
   * Executes a statement on the wrapped connection.
   *
   * @param sql the statement, never null
   */
  private void execute(final String sql) {
    try (final Statement statement = connection.createStatement()) {
      statement.execute(sql);
      log.debug("Executed '{}'", sql);
    } catch (final SQLException e) {
      throw new ListenerConnectionException("Failed to execute '" + sql
          + "'", e);
    }
  }

  /**
   * Appends notifications received from the driver to the local buffer.
   *
   * @param received the notifications, may be null
   */
  private void buffer(final PGNotification[] received) {
    if (received == null) {
      return;
    }
    for (final PGNotification notification : received) {
      buffered.add(new Notification(notification.getName(),
          notification.getParameter() == null
              ? "" : notification.getParameter(),
          notification.getPID()));
    }
  }

  /**
   * Converts a positive timeout to the milliseconds pgjdbc expects.
   *
   * <p>pgjdbc treats zero as "wait forever", so timeouts shorter than one
   * millisecond are rounded up to one.
   *
   * @param timeout the positive timeout, never null
   *
   * @return the wait in milliseconds, between 1 and Integer.MAX_VALUE
   */
  static int toWaitMillis(final Duration timeout) {
    if (timeout.compareTo(MAX_WAIT) >= 0) {
      return Integer.MAX_VALUE;
    }
    final long millis = timeout.toMillis();
    if (millis < 1) {
      return 1;
    }
    return (int) millis;
  }

  /**
   * Quotes a channel name as a SQL identifier.
   *
   * @param identifier the identifier, never null
   *
   * @return the quoted identifier, never null
   */
  static String quoteIdentifier(final String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }
}
