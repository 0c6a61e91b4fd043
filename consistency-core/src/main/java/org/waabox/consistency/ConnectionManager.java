package org.waabox.consistency;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.consistency.metrics.ConsistencyMetrics;
import org.waabox.consistency.protocol.ClientFrame;
import org.waabox.consistency.protocol.FrameCodec;
import org.waabox.consistency.protocol.OutboundMessage;
import org.waabox.consistency.protocol.ProtocolException;
import org.waabox.consistency.transport.ClientConnection;
import org.waabox.consistency.transport.TransportException;

/**
 * Owns the client sessions: accepts connections, runs each session's
 * receive loop and writer, and guarantees cleanup.
 *
 * <p>Each accepted connection gets a fresh {@link SessionId} and two tasks:
 * a reader that decodes client frames and applies them to the
 * {@link SubscriptionRegistry}, and a writer that drains the session's
 * outbound queue to the connection in order.
 *
 * <p>Malformed frames are answered with an {@code error} frame and the
 * session continues. End of stream, a transport failure, a {@code close}
 * frame, an overflow under {@link OverflowPolicy#DISCONNECT} or
 * {@link #stop()} end the session. An overflowed session whose writer is
 * stuck in a write to the client is torn down after a short grace period,
 * which closes the connection under the writer. Teardown closes the
 * session's queue,
 * removes all of its registry entries, drops it from the
 * {@link SessionTable} and closes the connection, in that order.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConnectionManager {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ConnectionManager.class);

  /** How long {@link #stop()} waits for session tasks to finish. */
  private static final long STOP_TIMEOUT_MS = 5_000;

  /** How long an overflowed session's writer may take to say goodbye. */
  private static final long OVERFLOW_GRACE_MS = 1_000;

  /** The reason sent to a client disconnected for being too slow. */
  private static final String OVERFLOW_REASON =
      "outbound queue overflow, resubscribe after reconnecting";

  /** The subscription registry, never null. */
  private final SubscriptionRegistry registry;

  /** The live sessions, never null. */
  private final SessionTable sessions;

  /** The broker settings, never null. */
  private final BrokerSettings settings;

  /** The metrics reporter, never null. */
  private final ConsistencyMetrics metrics;

  /** Runs the reader and writer tasks of every session. */
  private final ExecutorService workers;

  /** The last id handed out. */
  private final AtomicLong lastSessionId = new AtomicLong();

  /** Whether {@link #stop()} was called. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /**
   * Creates a new connection manager.
   *
   * @param theRegistry the subscription registry, never null
   * @param theSessions the live sessions, never null
   * @param theSettings the broker settings, never null
   * @param theMetrics  the metrics reporter, never null
   */
  public ConnectionManager(final SubscriptionRegistry theRegistry,
      final SessionTable theSessions, final BrokerSettings theSettings,
      final ConsistencyMetrics theMetrics) {
    registry = Objects.requireNonNull(theRegistry,
        "registry must not be null");
    sessions = Objects.requireNonNull(theSessions,
        "sessions must not be null");
    settings = Objects.requireNonNull(theSettings,
        "settings must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    workers = Executors.newCachedThreadPool(new SessionThreadFactory());
  }

  /**
   * Creates a session for a new connection and starts its reader and
   * writer.
   *
   * @param connection the accepted connection, never null
   * @return the new session, never null
   *
   * @throws IllegalStateException if the manager is stopped; the
   *     connection is closed
   */
  public Session accept(final ClientConnection connection) {
    Objects.requireNonNull(connection, "connection must not be null");

    if (stopped.get()) {
      connection.close();
      throw new IllegalStateException(
          "ConnectionManager is stopped, refusing " + connection
              .remoteAddress());
    }

    final SessionId id = new SessionId(lastSessionId.incrementAndGet());
    final Session session = new Session(id, connection, settings, metrics,
        this::onOverflow);
    sessions.add(session);
    metrics.sessionOpened(id);
    log.debug("Accepted {}", session);

    try {
      workers.execute(named(id, "writer", () -> writeLoop(session)));
      workers.execute(named(id, "reader", () -> readLoop(session)));
    } catch (final RejectedExecutionException e) {
      teardown(session, "broker stopping");
      throw new IllegalStateException(
          "ConnectionManager is stopped, refusing " + connection
              .remoteAddress(), e);
    }
    return session;
  }

  /**
   * Tears down a session on demand. Unknown ids are ignored.
   *
   * @param sessionId the session to close, never null
   */
  public void close(final SessionId sessionId) {
    Objects.requireNonNull(sessionId, "sessionId must not be null");
    final Session session = sessions.find(sessionId);
    if (session != null) {
      teardown(session, "closed by broker");
    }
  }

  /**
   * Returns the resources a session is subscribed to.
   *
   * @param sessionId the session, never null
   * @return an immutable snapshot, never null
   */
  public Set<String> subscriptionsOf(final SessionId sessionId) {
    return registry.subscriptionsOf(sessionId);
  }

  /**
   * Returns the number of live sessions.
   *
   * @return the session count
   */
  public int sessionCount() {
    return sessions.size();
  }

  /**
   * Tears down every session and stops the session workers. Idempotent.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    final int count = sessions.size();
    for (final Session session : sessions.all()) {
      teardown(session, "broker stopping");
    }
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
        log.warn("Session workers did not terminate in {} ms",
            STOP_TIMEOUT_MS);
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for session workers to stop");
    }
    log.info("ConnectionManager stopped, closed {} session(s)", count);
  }

  /**
   * Applies one raw client frame to a session.
   *
   * <p>Package-private for testability.
   *
   * @param session the session that received the frame, never null
   * @param text    the raw frame, never null
   * @return false if the client asked to close the session
   */
  boolean handleFrame(final Session session, final String text) {
    final ClientFrame frame;
    try {
      frame = FrameCodec.decodeClientFrame(text);
    } catch (final ProtocolException e) {
      metrics.protocolError(session.id());
      log.warn("{} sent a malformed frame: {}", session.id(), e.getMessage());
      session.offer(OutboundMessage.error(e.getMessage()));
      return true;
    }

    switch (frame.type()) {
      case SUBSCRIBE:
        subscribe(session, frame.uri());
        return true;
      case UNSUBSCRIBE:
        registry.unsubscribe(session.id(), frame.uri());
        log.debug("{} unsubscribed from {}", session.id(), frame.uri());
        return true;
      case CLOSE:
        log.debug("{} requested close", session.id());
        return false;
      default:
        throw new IllegalStateException("Unknown frame type: "
            + frame.type());
    }
  }

  /** Acknowledges a subscription and registers it.
   *
   * <p>The registration runs under the session lock right after the ack is
   * queued, so an invalidation for {@code uri} always reaches the client
   * after its ack, and a concurrent teardown, which closes the session
   * first, always sees and removes the new entry.
   *
   * @param session the subscribing session.
   * @param uri the resource URI.
   */
  private void subscribe(final Session session, final String uri) {
    final boolean queued = session.offer(OutboundMessage.ack(uri),
        () -> registry.subscribe(session.id(), uri));
    if (queued) {
      log.debug("{} subscribed to {}", session.id(), uri);
    }
  }

  /** Reads and applies frames until the session ends, then tears it down.
   *
   * @param session the session to serve.
   */
  private void readLoop(final Session session) {
    String reason = "client disconnected";
    try {
      while (session.isOpen()) {
        final String frame = session.connection().receive();
        if (frame == null) {
          break;
        }
        if (!handleFrame(session, frame)) {
          reason = "client closed";
          break;
        }
      }
    } catch (final TransportException e) {
      reason = "transport failure: " + e.getMessage();
    } catch (final RuntimeException e) {
      reason = "unexpected failure: " + e.getMessage();
      log.error("Reader of {} failed", session.id(), e);
    } finally {
      teardown(session, reason);
    }
  }

  /** Writes queued messages in order until the session closes, then tears
   * it down.
   *
   * @param session the session to serve.
   */
  private void writeLoop(final Session session) {
    String reason = "session closed";
    try {
      OutboundMessage message;
      while ((message = session.take()) != null) {
        session.connection().send(FrameCodec.encode(message));
      }
      if (session.isOverflowed()) {
        reason = "slow consumer";
        sendQuietly(session, OutboundMessage.error(OVERFLOW_REASON));
      }
    } catch (final TransportException e) {
      reason = "transport failure: " + e.getMessage();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      reason = "interrupted";
    } catch (final RuntimeException e) {
      reason = "unexpected failure: " + e.getMessage();
      log.error("Writer of {} failed", session.id(), e);
    } finally {
      teardown(session, reason);
    }
  }

  /** Schedules the teardown of a session that overflowed.
   *
   * <p>The writer normally notices the closed queue, sends the overflow
   * error and tears the session down itself. If it is still blocked on the
   * client after {@link #OVERFLOW_GRACE_MS}, the session is torn down from
   * here.
   *
   * @param session the overflowed session.
   */
  private void onOverflow(final Session session) {
    try {
      workers.execute(() -> awaitOverflowTeardown(session));
    } catch (final RejectedExecutionException e) {
      teardown(session, "slow consumer");
    }
  }

  /** Tears down an overflowed session unless its writer did in time.
   *
   * @param session the overflowed session.
   */
  private void awaitOverflowTeardown(final Session session) {
    try {
      if (session.awaitRelease(OVERFLOW_GRACE_MS)) {
        return;
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.warn("{} writer blocked after overflow, closing its connection",
        session.id());
    teardown(session, "slow consumer, writer blocked");
  }

  /** Removes every trace of a session. Only the first call has an effect.
   *
   * @param session the session to tear down.
   * @param reason why the session ends, for logging.
   */
  private void teardown(final Session session, final String reason) {
    if (!session.release()) {
      return;
    }
    session.close();
    final Set<String> removed = registry.removeSession(session.id());
    sessions.remove(session.id());
    try {
      session.connection().close();
    } catch (final RuntimeException e) {
      log.debug("Error closing connection of {}: {}", session.id(),
          e.getMessage());
    }
    metrics.sessionClosed(session.id(), removed.size());
    log.debug("Closed {} ({}), released {} subscription(s)", session,
        reason, removed.size());
  }

  /** Best-effort write used right before closing a connection.
   *
   * @param session the session.
   * @param message the message to write.
   */
  private static void sendQuietly(final Session session,
      final OutboundMessage message) {
    try {
      session.connection().send(FrameCodec.encode(message));
    } catch (final TransportException e) {
      log.debug("Could not notify {}: {}", session.id(), e.getMessage());
    }
  }

  /** Runs a session task under a thread name that tells which session and
   * role it serves, restoring the pooled thread's name afterwards.
   *
   * @param id the session id.
   * @param role either reader or writer.
   * @param task the task.
   * @return the named task.
   */
  private static Runnable named(final SessionId id, final String role,
      final Runnable task) {
    return () -> {
      final Thread thread = Thread.currentThread();
      final String poolName = thread.getName();
      thread.setName("consistency-session-" + id.value() + "-" + role);
      try {
        task.run();
      } finally {
        thread.setName(poolName);
      }
    };
  }

  /** Names the idle session worker threads and makes them daemons. */
  private static final class SessionThreadFactory implements ThreadFactory {

    /** The thread counter. */
    private final AtomicInteger count = new AtomicInteger();

    @Override
    public Thread newThread(final Runnable runnable) {
      final Thread thread = new Thread(runnable,
          "consistency-worker-" + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
