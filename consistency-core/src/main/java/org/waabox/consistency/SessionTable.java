package org.waabox.consistency;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The live sessions of a broker, by id.
 *
 * <p>The {@link ConnectionManager} adds and removes sessions; the
 * {@link Dispatcher} resolves registry ids through it. A lookup that misses
 * means the session is gone.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SessionTable {

  /** The live sessions, never null. */
  private final Map<SessionId, Session> sessions = new ConcurrentHashMap<>();

  /**
   * Adds a session.
   *
   * @param session the session, never null
   *
   * @throws IllegalArgumentException if a session with the same id exists
   */
  void add(final Session session) {
    Objects.requireNonNull(session, "session must not be null");
    if (sessions.putIfAbsent(session.id(), session) != null) {
      throw new IllegalArgumentException(
          "Session already registered: " + session.id());
    }
  }

  /**
   * Removes a session.
   *
   * @param sessionId the session id, never null
   * @return the removed session, or null if none was present
   */
  Session remove(final SessionId sessionId) {
    return sessions.remove(sessionId);
  }

  /**
   * Resolves a session id.
   *
   * @param sessionId the session id, never null
   * @return the live session, or null if it is gone
   */
  public Session find(final SessionId sessionId) {
    Objects.requireNonNull(sessionId, "sessionId must not be null");
    return sessions.get(sessionId);
  }

  /**
   * Returns a snapshot of the live sessions.
   *
   * @return an immutable collection, never null
   */
  public Collection<Session> all() {
    return List.copyOf(sessions.values());
  }

  /**
   * Returns the number of live sessions.
   *
   * @return the session count
   */
  public int size() {
    return sessions.size();
  }
}
