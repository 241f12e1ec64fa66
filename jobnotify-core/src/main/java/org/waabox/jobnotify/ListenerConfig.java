package org.waabox.jobnotify;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Configuration for a {@link JobListener}.
 *
 * <p>Holds the prefix used to build the listener's private channel name.
 * The channel for a connection is {@code <prefix>_<backend-pid>}, so every
 * physical connection listens on its own channel.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create()} and {@link #create(String)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ListenerConfig {

  /** Default channel prefix. */
  private static final String DEFAULT_CHANNEL_PREFIX = "job_listener";

  /** PostgreSQL maximum identifier length. */
  private static final int MAX_IDENTIFIER_LENGTH = 63;

  /** Room reserved for the "_" separator and a backend pid (10 digits). */
  private static final int PID_SUFFIX_LENGTH = 11;

  /** Letters, digits and underscores, not starting with a digit. */
  private static final Pattern IDENTIFIER =
      Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

  /** The channel prefix, never null. */
  private final String channelPrefix;

  /** Private constructor; use static factories.
   *
   * @param theChannelPrefix the channel prefix
   */
  private ListenerConfig(final String theChannelPrefix) {
    channelPrefix = theChannelPrefix;
  }

  /**
   * Creates a configuration with a custom channel prefix.
   *
   * @param channelPrefix the channel prefix, never null. Must be a valid
   *                      PostgreSQL identifier of at most 52 characters.
   *
   * @return a new configuration instance, never null
   *
   * @throws IllegalArgumentException if the prefix is blank, too long or
   *                                  contains invalid characters
   */
  public static ListenerConfig create(final String channelPrefix) {
    Objects.requireNonNull(channelPrefix, "channelPrefix must not be null");

    if (channelPrefix.isBlank()) {
      throw new IllegalArgumentException("channelPrefix must not be blank");
    }
    if (channelPrefix.length() > MAX_IDENTIFIER_LENGTH - PID_SUFFIX_LENGTH) {
      throw new IllegalArgumentException("channelPrefix '" + channelPrefix
          + "' exceeds " + (MAX_IDENTIFIER_LENGTH - PID_SUFFIX_LENGTH)
          + " characters");
    }
    if (!IDENTIFIER.matcher(channelPrefix).matches()) {
      throw new IllegalArgumentException("Invalid channelPrefix '"
          + channelPrefix + "'. Must start with a letter or underscore,"
          + " followed by letters, digits or underscores only");
    }

    return new ListenerConfig(channelPrefix);
  }

  /**
   * Creates a configuration with the default channel prefix,
   * {@code job_listener}.
   *
   * @return a new configuration instance, never null
   */
  public static ListenerConfig create() {
    return new ListenerConfig(DEFAULT_CHANNEL_PREFIX);
  }

  /**
   * Returns the channel prefix.
   *
   * @return the channel prefix, never null
   */
  public String channelPrefix() {
    return channelPrefix;
  }

  /**
   * Builds the private channel name for the given backend pid.
   *
   * @param backendPid the backend session identifier
   *
   * @return the channel name, never null
   */
  public String channelFor(final int backendPid) {
    return channelPrefix + "_" + backendPid;
  }
}
