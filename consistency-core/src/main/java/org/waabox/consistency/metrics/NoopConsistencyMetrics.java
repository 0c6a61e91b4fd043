package org.waabox.consistency.metrics;

import org.waabox.consistency.SessionId;

/**
 * A no-operation implementation of {@link ConsistencyMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopConsistencyMetrics implements ConsistencyMetrics {

  /** {@inheritDoc} */
  @Override
  public void sessionOpened(final SessionId sessionId) {
  }

  /** {@inheritDoc} */
  @Override
  public void sessionClosed(final SessionId sessionId,
      final int subscriptions) {
  }

  /** {@inheritDoc} */
  @Override
  public void invalidationDispatched(final String uri, final int recipients) {
  }

  /** {@inheritDoc} */
  @Override
  public void messageDropped(final SessionId sessionId) {
  }

  /** {@inheritDoc} */
  @Override
  public void slowConsumerDisconnected(final SessionId sessionId) {
  }

  /** {@inheritDoc} */
  @Override
  public void protocolError(final SessionId sessionId) {
  }

  /** {@inheritDoc} */
  @Override
  public void changeRejected(final String uri) {
  }
}
