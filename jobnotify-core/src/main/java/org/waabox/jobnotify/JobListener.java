package org.waabox.jobnotify;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.jobnotify.metrics.DiscardReason;
import org.waabox.jobnotify.metrics.ListenerMetrics;
import org.waabox.jobnotify.metrics.NoopListenerMetrics;
import org.waabox.jobnotify.transform.MessageTransformRegistry;
import org.waabox.jobnotify.transform.TransformResult;

/**
 * Turns the notifications pushed to a borrowed database connection into
 * batches of validated messages grouped by message type.
 *
 * <p>Each listener owns one {@link NotificationConnection} for as long as
 * it listens, and listens on a channel private to that connection. The
 * caller, typically a job locker's poll loop, drives it from a single
 * thread:
 * <pre>{@code
 * JobListener listener = JobListener.builder()
 *     .connection(new PgNotificationConnection(jdbcConnection))
 *     .errorReporter(error -> alerts.send(error))
 *     .build();
 *
 * listener.listen();
 * try {
 *   while (running) {
 *     Map<String, List<Map<String, Object>>> messages =
 *         listener.waitForMessages(Duration.ofSeconds(1));
 *     List<Map<String, Object>> newJobs = messages.get("new_job");
 *     // ...
 *   }
 * } finally {
 *   listener.unlisten();
 * }
 * }</pre>
 *
 * <p>Per-message failures never escape {@link #waitForMessages(Duration)}:
 * undecodable payloads and schema mismatches are dropped silently, and
 * conversion faults are dropped after being handed to the
 * {@link ErrorReporter}. Connection failures propagate to the caller.
 *
 * <p>Not thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JobListener {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(JobListener.class);

  /** The borrowed connection, never null. */
  private final NotificationConnection connection;

  /** The channel subscription over the connection, never null. */
  private final ChannelSubscription subscription;

  /** The payload decoder, never null. */
  private final PayloadDecoder decoder;

  /** The transforms by message type, never null. */
  private final MessageTransformRegistry registry;

  /** The sink for conversion faults, never null. */
  private final ErrorReporter errorReporter;

  /** The metrics reporter, never null. */
  private final ListenerMetrics metrics;

  /**
   * Creates a new listener.
   *
   * @param theConnection    the borrowed connection, never null
   * @param theConfig        the configuration, never null
   * @param theDecoder       the payload decoder, never null
   * @param theRegistry      the transform registry, never null
   * @param theErrorReporter the error reporter, never null
   * @param theMetrics       the metrics reporter, never null
   */
  private JobListener(final NotificationConnection theConnection,
      final ListenerConfig theConfig,
      final PayloadDecoder theDecoder,
      final MessageTransformRegistry theRegistry,
      final ErrorReporter theErrorReporter,
      final ListenerMetrics theMetrics) {
    connection = theConnection;
    subscription = new ChannelSubscription(theConnection, theConfig);
    decoder = theDecoder;
    registry = theRegistry;
    errorReporter = theErrorReporter;
    metrics = theMetrics;
  }

  /**
   * Creates a new builder for constructing a listener.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts listening on the connection's private channel.
   *
   * <p>Does nothing if already listening.
   *
   * @throws ListenerConnectionException if the subscribe command fails
   */
  public void listen() {
    subscription.listen();
  }

  /**
   * Stops listening and discards every notification still buffered on the
   * connection, so the connection can go back to its pool clean.
   *
   * <p>Does nothing if not listening.
   *
   * @throws ListenerConnectionException if the connection fails
   */
  public void unlisten() {
    subscription.unlisten();
  }

  /**
   * Returns whether the listener is subscribed.
   *
   * @return true while listening
   */
  public boolean isListening() {
    return subscription.state() == SubscriptionState.LISTENING;
  }

  /**
   * Returns the channel listened on.
   *
   * @return the channel name, empty when not listening
   */
  public Optional<String> channel() {
    return subscription.channel();
  }

  /**
   * Waits for notifications and returns every valid message received,
   * grouped by message type.
   *
   * <p>Blocks up to {@code timeout} for the first notification. Once one
   * arrives, every notification buffered on the connection is drained
   * without further blocking, so a single call can return many messages.
   * Within a type, messages keep their arrival order.
   *
   * <p>An empty result means either that the timeout elapsed or that every
   * drained notification was dropped.
   *
   * @param timeout the maximum time to wait, never null or negative
   *
   * @return the validated fields of each message keyed by message type,
   *         never null, unmodifiable
   *
   * @throws IllegalStateException       if the listener is not listening
   * @throws IllegalArgumentException    if the timeout is negative
   * @throws ListenerConnectionException if the connection fails
   */
  public Map<String, List<Map<String, Object>>> waitForMessages(
      final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout must not be null");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException(
          "timeout must not be negative, got: " + timeout);
    }
    if (!isListening()) {
      throw new IllegalStateException(
          "Listener must be listening before waiting for messages");
    }

    final String channel = subscription.channel().orElseThrow();

    log.debug("Waiting up to {} for notifications on channel '{}'",
        timeout, channel);

    if (!connection.awaitNotifications(timeout)) {
      return Collections.emptyMap();
    }

    final List<Notification> batch = drain();
    metrics.batchReceived(channel, batch.size());
    log.debug("Received {} notifications on channel '{}'", batch.size(),
        channel);

    final Map<String, List<Map<String, Object>>> grouped =
        new LinkedHashMap<>();
    for (final Notification notification : batch) {
      collect(notification, grouped);
    }

    final Map<String, List<Map<String, Object>>> result =
        new LinkedHashMap<>();
    for (final Map.Entry<String, List<Map<String, Object>>> entry
        : grouped.entrySet()) {
      metrics.messagesAccepted(entry.getKey(), entry.getValue().size());
      result.put(entry.getKey(),
          Collections.unmodifiableList(entry.getValue()));
    }
    return Collections.unmodifiableMap(result);
  }

  /**
   * Pulls every notification buffered on the connection, without blocking.
   *
   * <p>Ends as soon as a poll returns nothing.
   *
   * @return the drained notifications in arrival order, never null
   */
  private List<Notification> drain() {
    final List<Notification> batch = new ArrayList<>();
    List<Notification> pending = connection.pollNotifications();
    while (!pending.isEmpty()) {
      batch.addAll(pending);
      pending = connection.pollNotifications();
    }
    return batch;
  }

  /**
   * Decodes and transforms one notification, adding the result to its
   * type's group when valid.
   *
   * @param notification the notification, never null
   * @param grouped      the accumulated groups, never null
   */
  private void collect(final Notification notification,
      final Map<String, List<Map<String, Object>>> grouped) {

    final Optional<RawMessage> decoded =
        decoder.decode(notification.payload());
    if (decoded.isEmpty()) {
      metrics.messageDiscarded(null, DiscardReason.UNDECODABLE);
      return;
    }

    final RawMessage message = decoded.get();
    final TransformResult result = transform(message);

    switch (result.outcome()) {
      case ACCEPTED:
        grouped.computeIfAbsent(message.type(), type -> new ArrayList<>())
            .add(result.fields());
        break;
      case ABSTAINED:
        log.debug("Discarding '{}' message: {}", message.type(),
            result.reason());
        metrics.messageDiscarded(message.type(),
            DiscardReason.SCHEMA_MISMATCH);
        break;
      default:
        log.debug("Discarding '{}' message after conversion fault: {}",
            message.type(), result.error().toString());
        metrics.messageDiscarded(message.type(),
            DiscardReason.CONVERSION_FAULT);
        report(result.error());
        break;
    }
  }

  /**
   * Runs the registered transform for a message.
   *
   * <p>An exception escaping the transform, or a null result, counts as a
   * conversion fault.
   *
   * @param message the decoded message, never null
   *
   * @return the transform result, never null
   */
  private TransformResult transform(final RawMessage message) {
    final TransformResult result;
    try {
      result = registry.transformFor(message.type()).apply(message.fields());
    } catch (final RuntimeException e) {
      return TransformResult.faulted(e);
    }
    if (result == null) {
      return TransformResult.faulted(new IllegalStateException(
          "transform for '" + message.type() + "' returned null"));
    }
    return result;
  }

  /**
   * Hands an error to the error reporter. A failing reporter is logged and
   * does not interrupt the batch.
   *
   * @param error the error to report, never null
   */
  private void report(final Throwable error) {
    try {
      errorReporter.report(error);
    } catch (final RuntimeException e) {
      log.error("Error reporter failed while reporting '{}': {}",
          error.getMessage(), e.getMessage(), e);
    }
  }

  /**
   * Builder for {@link JobListener}.
   *
   * <p>Defaults for unset optional fields:
   * <ul>
   *   <li>config: {@link ListenerConfig#create()}</li>
   *   <li>decoder: {@link PayloadDecoder#PayloadDecoder()}</li>
   *   <li>registry: {@link MessageTransformRegistry#defaults()}</li>
   *   <li>errorReporter: {@link LoggingErrorReporter}</li>
   *   <li>metrics: {@link NoopListenerMetrics}</li>
   * </ul>
   */
  public static final class Builder {

    /** The connection, required. */
    private NotificationConnection connection;

    /** The optional configuration. */
    private ListenerConfig config;

    /** The optional payload decoder. */
    private PayloadDecoder decoder;

    /** The optional transform registry. */
    private MessageTransformRegistry registry;

    /** The optional error reporter. */
    private ErrorReporter errorReporter;

    /** The optional metrics reporter. */
    private ListenerMetrics metrics;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the borrowed connection to listen on.
     *
     * @param theConnection the connection, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder connection(final NotificationConnection theConnection) {
      Objects.requireNonNull(theConnection, "connection must not be null");
      this.connection = theConnection;
      return this;
    }

    /**
     * Sets the listener configuration.
     *
     * @param theConfig the configuration, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder config(final ListenerConfig theConfig) {
      Objects.requireNonNull(theConfig, "config must not be null");
      this.config = theConfig;
      return this;
    }

    /**
     * Sets the payload decoder.
     *
     * @param theDecoder the decoder, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder decoder(final PayloadDecoder theDecoder) {
      Objects.requireNonNull(theDecoder, "decoder must not be null");
      this.decoder = theDecoder;
      return this;
    }

    /**
     * Sets the transform registry.
     *
     * @param theRegistry the registry, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder registry(final MessageTransformRegistry theRegistry) {
      Objects.requireNonNull(theRegistry, "registry must not be null");
      this.registry = theRegistry;
      return this;
    }

    /**
     * Sets the error reporter that receives conversion faults.
     *
     * @param theErrorReporter the reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder errorReporter(final ErrorReporter theErrorReporter) {
      Objects.requireNonNull(theErrorReporter,
          "errorReporter must not be null");
      this.errorReporter = theErrorReporter;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final ListenerMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Builds the listener. The listener starts unsubscribed.
     *
     * @return a new listener, never null
     *
     * @throws IllegalStateException if no connection was set
     */
    public JobListener build() {
      if (connection == null) {
        throw new IllegalStateException("connection must be set");
      }
      return new JobListener(
          connection,
          config != null ? config : ListenerConfig.create(),
          decoder != null ? decoder : new PayloadDecoder(),
          registry != null ? registry : MessageTransformRegistry.defaults(),
          errorReporter != null ? errorReporter : new LoggingErrorReporter(),
          metrics != null ? metrics : new NoopListenerMetrics());
    }
  }
}
