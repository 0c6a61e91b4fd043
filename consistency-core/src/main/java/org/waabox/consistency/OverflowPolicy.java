package org.waabox.consistency;

/**
 * What a {@link Session} does when its bounded outbound queue is full and a
 * new message arrives.
 *
 * <p>Invalidations are idempotent: a client that misses some of them still
 * re-fetches the resource on the next one, so dropping is safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum OverflowPolicy {

  /** Discard the oldest undelivered message and enqueue the new one. */
  DROP_OLDEST,

  /** Close the session; the client must reconnect and resubscribe. */
  DISCONNECT
}
