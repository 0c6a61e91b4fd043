package org.waabox.consistency;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single source of truth of which sessions watch which resources.
 *
 * <p>The registry keeps two indices: resource URI to subscribed sessions
 * (forward) and session to subscribed URIs (reverse). Every operation runs
 * under one lock, and every mutation updates both indices inside the same
 * critical section, so that for any session {@code s} and URI {@code u},
 * {@code s} is in the forward entry of {@code u} exactly when {@code u} is
 * in the reverse entry of {@code s}.
 *
 * <p>Entries are created on first subscribe and pruned when they become
 * empty, so the registry only grows with live subscriptions.
 *
 * <p>Readers get immutable snapshots; a snapshot may name sessions that
 * disconnect right after it was taken.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SubscriptionRegistry {

  /** Serializes every read and write. */
  private final ReentrantLock lock = new ReentrantLock();

  /** URI to subscribed sessions. Guarded by {@link #lock}. */
  private final Map<String, Set<SessionId>> subscribersByUri =
      new HashMap<>();

  /** Session to subscribed URIs. Guarded by {@link #lock}. */
  private final Map<SessionId, Set<String>> urisBySession = new HashMap<>();

  /**
   * Subscribes a session to a resource. Subscribing an existing pair is a
   * no-op.
   *
   * @param sessionId the session, never null
   * @param uri       the resource URI, never null
   * @return true if the pair was added, false if it was already present
   */
  public boolean subscribe(final SessionId sessionId, final String uri) {
    Objects.requireNonNull(sessionId, "sessionId must not be null");
    Objects.requireNonNull(uri, "uri must not be null");

    lock.lock();
    try {
      final boolean added = subscribersByUri
          .computeIfAbsent(uri, k -> new HashSet<>())
          .add(sessionId);
      urisBySession.computeIfAbsent(sessionId, k -> new HashSet<>())
          .add(uri);
      return added;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Unsubscribes a session from a resource. Removing an absent pair is a
   * no-op.
   *
   * @param sessionId the session, never null
   * @param uri       the resource URI, never null
   * @return true if the pair was removed, false if it was not present
   */
  public boolean unsubscribe(final SessionId sessionId, final String uri) {
    Objects.requireNonNull(sessionId, "sessionId must not be null");
    Objects.requireNonNull(uri, "uri must not be null");

    lock.lock();
    try {
      final Set<String> uris = urisBySession.get(sessionId);
      if (uris == null || !uris.remove(uri)) {
        return false;
      }
      if (uris.isEmpty()) {
        urisBySession.remove(sessionId);
      }
      removeSubscriber(uri, sessionId);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the sessions currently subscribed to a resource.
   *
   * @param uri the resource URI, never null
   * @return an immutable snapshot, never null
   */
  public Set<SessionId> subscribersOf(final String uri) {
    Objects.requireNonNull(uri, "uri must not be null");

    lock.lock();
    try {
      final Set<SessionId> subscribers = subscribersByUri.get(uri);
      return subscribers == null ? Set.of() : Set.copyOf(subscribers);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the resources a session is subscribed to.
   *
   * @param sessionId the session, never null
   * @return an immutable snapshot, never null
   */
  public Set<String> subscriptionsOf(final SessionId sessionId) {
    Objects.requireNonNull(sessionId, "sessionId must not be null");

    lock.lock();
    try {
      final Set<String> uris = urisBySession.get(sessionId);
      return uris == null ? Set.of() : Set.copyOf(uris);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes a session from every resource it is subscribed to, in one
   * critical section. Resources left without subscribers are dropped.
   *
   * @param sessionId the session, never null
   * @return the URIs the session was subscribed to, never null
   */
  public Set<String> removeSession(final SessionId sessionId) {
    Objects.requireNonNull(sessionId, "sessionId must not be null");

    lock.lock();
    try {
      final Set<String> uris = urisBySession.remove(sessionId);
      if (uris == null) {
        return Set.of();
      }
      for (final String uri : uris) {
        removeSubscriber(uri, sessionId);
      }
      return Set.copyOf(uris);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of resources with at least one subscriber.
   *
   * @return the resource count
   */
  public int resourceCount() {
    lock.lock();
    try {
      return subscribersByUri.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of sessions with at least one subscription.
   *
   * @return the session count
   */
  public int sessionCount() {
    lock.lock();
    try {
      return urisBySession.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Checks that the forward and reverse indices mirror each other and hold
   * no empty entries. Used by tests.
   *
   * @return true if the indices are consistent
   */
  boolean isConsistent() {
    lock.lock();
    try {
      for (final Map.Entry<String, Set<SessionId>> entry
          : subscribersByUri.entrySet()) {
        if (entry.getValue().isEmpty()) {
          return false;
        }
        for (final SessionId sessionId : entry.getValue()) {
          final Set<String> uris = urisBySession.get(sessionId);
          if (uris == null || !uris.contains(entry.getKey())) {
            return false;
          }
        }
      }
      for (final Map.Entry<SessionId, Set<String>> entry
          : urisBySession.entrySet()) {
        if (entry.getValue().isEmpty()) {
          return false;
        }
        for (final String uri : entry.getValue()) {
          final Set<SessionId> subscribers = subscribersByUri.get(uri);
          if (subscribers == null || !subscribers.contains(entry.getKey())) {
            return false;
          }
        }
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Removes one session from a forward entry, pruning it when empty.
   * Must be called with the lock held.
   *
   * @param uri the resource URI.
   * @param sessionId the session to remove.
   */
  private void removeSubscriber(final String uri, final SessionId sessionId) {
    final Set<SessionId> subscribers = subscribersByUri.get(uri);
    if (subscribers != null) {
      subscribers.remove(sessionId);
      if (subscribers.isEmpty()) {
        subscribersByUri.remove(uri);
      }
    }
  }
}
