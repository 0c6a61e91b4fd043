package org.waabox.consistency.metrics;

import org.waabox.consistency.SessionId;

/**
 * An abstraction for recording operational metrics of the Consistency
 * broker.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopConsistencyMetrics}
 * when metrics collection is not required.
 *
 * <p>Implementations are called from session and dispatch threads and must
 * be thread-safe and non-blocking.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ConsistencyMetrics {

  /**
   * Records a newly accepted client session.
   *
   * @param sessionId the id of the new session, never null
   */
  void sessionOpened(SessionId sessionId);

  /**
   * Records a session teardown.
   *
   * @param sessionId     the id of the closed session, never null
   * @param subscriptions the number of subscriptions the session held when
   *                      it was torn down
   */
  void sessionClosed(SessionId sessionId, int subscriptions);

  /**
   * Records the fan-out of one invalidation event.
   *
   * @param uri        the invalidated resource URI, never null
   * @param recipients the number of sessions that accepted the notification
   */
  void invalidationDispatched(String uri, int recipients);

  /**
   * Records a message discarded from a full outbound queue.
   *
   * @param sessionId the id of the slow session, never null
   */
  void messageDropped(SessionId sessionId);

  /**
   * Records a session closed because its outbound queue overflowed.
   *
   * @param sessionId the id of the slow session, never null
   */
  void slowConsumerDisconnected(SessionId sessionId);

  /**
   * Records a malformed frame received from a client.
   *
   * @param sessionId the id of the session that sent the frame, never null
   */
  void protocolError(SessionId sessionId);

  /**
   * Records a backend change the broker refused to accept.
   *
   * @param uri the URI of the refused change, may be null when the change
   *            itself was invalid
   */
  void changeRejected(String uri);
}
