package org.waabox.jobnotify.pg;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import javax.sql.DataSource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.jobnotify.ListenerConfig;
import org.waabox.jobnotify.ListenerConnectionException;
import org.waabox.jobnotify.RawMessage;
import org.waabox.jobnotify.transform.MessageType;
import org.waabox.jobnotify.transform.NewJobTransform;

/**
 * Sends notifications to job listeners through {@code pg_notify}.
 *
 * <p>Listeners listen on {@code <prefix>_<backend-pid>}, so the sender
 * addresses a listener by the backend pid of its connection. Messages are
 * serialized to JSON with Jackson.
 *
 * <p>Each call borrows a connection from the data source and returns it
 * when done. Notifications are delivered when the borrowed connection's
 * transaction commits, which with auto-commit is immediately.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PgNotifier {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(PgNotifier.class);

  /** Timestamp format for {@code run_at}, with microsecond precision. */
  private static final DateTimeFormatter RUN_AT_FORMAT = DateTimeFormatter
      .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSX")
      .withZone(ZoneOffset.UTC);

  /** Shared ObjectMapper for payload serialization. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The JDBC data source, never null. */
  private final DataSource dataSource;

  /** The listener configuration, never null. */
  private final ListenerConfig config;

  /**
   * Creates a new notifier.
   *
   * @param theDataSource the data source, never null
   * @param theConfig     the configuration shared with the listeners,
   *                      never null
   */
  public PgNotifier(final DataSource theDataSource,
      final ListenerConfig theConfig) {
    dataSource = Objects.requireNonNull(theDataSource,
        "dataSource must not be null");
    config = Objects.requireNonNull(theConfig, "config must not be null");
  }

  /**
   * Sends a raw payload on a channel.
   *
   * @param channel the channel name, never null
   * @param payload the payload, never null
   *
   * @throws ListenerConnectionException if the statement fails
   */
  public void publish(final String channel, final String payload) {
    Objects.requireNonNull(channel, "channel must not be null");
    Objects.requireNonNull(payload, "payload must not be null");

    try (final Connection conn = dataSource.getConnection();
         final PreparedStatement ps =
             conn.prepareStatement("SELECT pg_notify(?, ?)")) {

      ps.setString(1, channel);
      ps.setString(2, payload);
      ps.execute();

      log.debug("Sent notification on channel '{}'", channel);

    } catch (final SQLException e) {
      throw new ListenerConnectionException(
          "Failed to send notification on channel '" + channel + "'", e);
    }
  }

  /**
   * Sends a typed message to the listener of a backend.
   *
   * @param backendPid  the backend pid of the listening connection
   * @param messageType the message type tag, never null
   * @param fields      the message fields, never null
   *
   * @throws IllegalArgumentException    if the fields cannot be serialized
   * @throws ListenerConnectionException if the statement fails
   */
  public void notifyListener(final int backendPid, final String messageType,
      final Map<String, Object> fields) {
    Objects.requireNonNull(messageType, "messageType must not be null");
    Objects.requireNonNull(fields, "fields must not be null");

    final Map<String, Object> message = new LinkedHashMap<>();
    message.put(RawMessage.MESSAGE_TYPE, messageType);
    message.putAll(fields);

    final String payload;
    try {
      payload = MAPPER.writeValueAsString(message);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Failed to serialize '" + messageType + "' message", e);
    }

    publish(config.channelFor(backendPid), payload);
  }

  /**
   * Tells the listener of a backend that a job was inserted.
   *
   * @param backendPid the backend pid of the listening connection
   * @param id         the job id
   * @param priority   the job priority
   * @param runAt      when the job becomes runnable, never null
   *
   * @throws ListenerConnectionException if the statement fails
   */
  public void notifyNewJob(final int backendPid, final long id,
      final int priority, final Instant runAt) {
    Objects.requireNonNull(runAt, "runAt must not be null");

    final Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(NewJobTransform.PRIORITY, priority);
    fields.put(NewJobTransform.RUN_AT, formatRunAt(runAt));
    fields.put(NewJobTransform.ID, id);

    notifyListener(backendPid, MessageType.NEW_JOB.tag(), fields);
  }

  /**
   * Formats a run time as an ISO-8601 UTC timestamp with microseconds.
   *
   * @param runAt the instant, never null
   *
   * @return the formatted timestamp, never null
   */
  static String formatRunAt(final Instant runAt) {
    return RUN_AT_FORMAT.format(runAt);
  }
}
