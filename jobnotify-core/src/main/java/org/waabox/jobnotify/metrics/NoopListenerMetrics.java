package org.waabox.jobnotify.metrics;

/**
 * A no-operation implementation of {@link ListenerMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopListenerMetrics implements ListenerMetrics {

  /** {@inheritDoc} */
  @Override
  public void batchReceived(final String channel,
      final int notificationCount) {
  }

  /** {@inheritDoc} */
  @Override
  public void messageDiscarded(final String messageType,
      final DiscardReason reason) {
  }

  /** {@inheritDoc} */
  @Override
  public void messagesAccepted(final String messageType, final int count) {
  }
}
