package org.waabox.jobnotify;

/**
 * The subscription state of a {@link ChannelSubscription}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SubscriptionState {

  /** Not subscribed to any channel. */
  UNSUBSCRIBED,

  /** Subscribed to the connection's private channel. */
  LISTENING
}
