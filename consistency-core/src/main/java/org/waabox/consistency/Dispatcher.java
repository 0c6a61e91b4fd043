package org.waabox.consistency;

import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.consistency.ingest.InvalidationEvent;
import org.waabox.consistency.metrics.ConsistencyMetrics;
import org.waabox.consistency.protocol.OutboundMessage;

/**
 * Fans one {@link InvalidationEvent} out to every session subscribed to its
 * URI.
 *
 * <p>The dispatcher works on a snapshot of the subscribers and enqueues an
 * {@code invalidated} message on each session that is still live. It never
 * blocks and never waits for the client: a stale id, a closed session or a
 * failure on one session only affects that session.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Dispatcher {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

  /** The subscription registry, never null. */
  private final SubscriptionRegistry registry;

  /** The live sessions, never null. */
  private final SessionTable sessions;

  /** The metrics reporter, never null. */
  private final ConsistencyMetrics metrics;

  /**
   * Creates a new dispatcher.
   *
   * @param theRegistry the subscription registry, never null
   * @param theSessions the live sessions, never null
   * @param theMetrics  the metrics reporter, never null
   */
  public Dispatcher(final SubscriptionRegistry theRegistry,
      final SessionTable theSessions, final ConsistencyMetrics theMetrics) {
    registry = Objects.requireNonNull(theRegistry,
        "registry must not be null");
    sessions = Objects.requireNonNull(theSessions,
        "sessions must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Enqueues an invalidation on every live subscriber of the event's URI.
   *
   * @param event the event to fan out, never null
   * @return the number of sessions that accepted the notification
   */
  public int dispatch(final InvalidationEvent event) {
    Objects.requireNonNull(event, "event must not be null");

    final Set<SessionId> subscribers = registry.subscribersOf(event.uri());
    if (subscribers.isEmpty()) {
      log.debug("No subscribers for {}", event.uri());
      metrics.invalidationDispatched(event.uri(), 0);
      return 0;
    }

    final OutboundMessage message = OutboundMessage.invalidated(
        event.uri(), event.payload());

    int delivered = 0;
    for (final SessionId sessionId : subscribers) {
      final Session session = sessions.find(sessionId);
      if (session == null) {
        // Disconnected after the snapshot was taken.
        continue;
      }
      try {
        if (session.offer(message)) {
          delivered++;
        }
      } catch (final RuntimeException e) {
        log.warn("Failed to enqueue {} on {}: {}", event.uri(), sessionId,
            e.getMessage(), e);
      }
    }

    log.debug("Dispatched {} to {}/{} subscriber(s)", event.uri(), delivered,
        subscribers.size());
    metrics.invalidationDispatched(event.uri(), delivered);
    return delivered;
  }
}
