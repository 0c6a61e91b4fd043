package org.waabox.consistency;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.consistency.metrics.ConsistencyMetrics;
import org.waabox.consistency.protocol.OutboundMessage;
import org.waabox.consistency.transport.ClientConnection;

/**
 * The broker side of one connected client: its id, its connection handle and
 * its bounded outbound queue.
 *
 * <p>Any thread may {@link #offer(OutboundMessage)} a message; exactly one
 * writer thread {@link #take() takes} them, in offer order. Offering never
 * blocks: when the queue is full the session's {@link OverflowPolicy}
 * decides between discarding the oldest message and closing the queue.
 * A closing overflow is reported to the session's overflow handler, on the
 * offering thread and outside the session lock.
 *
 * <p>Once {@link #close() closed}, a session rejects every offer. The
 * {@link ConnectionManager} closes a session before it removes the session's
 * registry entries, so nothing can be enqueued to a session that is no
 * longer registered.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Session {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Session.class);

  /** The session id, never null. */
  private final SessionId id;

  /** The client connection, never null. */
  private final ClientConnection connection;

  /** The queue bound. */
  private final int capacity;

  /** What to do when the queue is full, never null. */
  private final OverflowPolicy overflowPolicy;

  /** The metrics reporter, never null. */
  private final ConsistencyMetrics metrics;

  /** Guards the queue and the state flags. */
  private final ReentrantLock lock = new ReentrantLock();

  /** Signalled when a message is queued or the session closes. */
  private final Condition notEmpty = lock.newCondition();

  /** Undelivered messages, oldest first. Guarded by {@link #lock}. */
  private final ArrayDeque<OutboundMessage> queue;

  /** Whether offers are accepted. Guarded by {@link #lock}. */
  private boolean open = true;

  /** Whether the queue was closed by an overflow. Guarded by {@link #lock}. */
  private boolean overflowed;

  /** Set once by the first caller that releases the session. */
  private final AtomicBoolean released = new AtomicBoolean(false);

  /** Counted down when the session is released. */
  private final CountDownLatch releasedSignal = new CountDownLatch(1);

  /** Called once when an overflow closes the queue, never null. */
  private final Consumer<Session> overflowHandler;

  /**
   * Creates a new open session that nobody is told about on overflow.
   *
   * @param theId             the session id, never null
   * @param theConnection     the client connection, never null
   * @param settings          the broker settings, never null
   * @param theMetrics        the metrics reporter, never null
   */
  Session(final SessionId theId, final ClientConnection theConnection,
      final BrokerSettings settings, final ConsistencyMetrics theMetrics) {
    this(theId, theConnection, settings, theMetrics, session -> { });
  }

  /**
   * Creates a new open session.
   *
   * @param theId              the session id, never null
   * @param theConnection      the client connection, never null
   * @param settings           the broker settings, never null
   * @param theMetrics         the metrics reporter, never null
   * @param theOverflowHandler told when a {@link OverflowPolicy#DISCONNECT}
   *     overflow closes the queue, never null
   */
  Session(final SessionId theId, final ClientConnection theConnection,
      final BrokerSettings settings, final ConsistencyMetrics theMetrics,
      final Consumer<Session> theOverflowHandler) {
    overflowHandler = Objects.requireNonNull(theOverflowHandler,
        "overflowHandler must not be null");
    id = Objects.requireNonNull(theId, "id must not be null");
    connection = Objects.requireNonNull(theConnection,
        "connection must not be null");
    Objects.requireNonNull(settings, "settings must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    capacity = settings.queueCapacity();
    overflowPolicy = settings.overflowPolicy();
    queue = new ArrayDeque<>(Math.min(capacity, 64));
  }

  /**
   * Returns the session id.
   *
   * @return the id, never null
   */
  public SessionId id() {
    return id;
  }

  /**
   * Returns the client connection.
   *
   * @return the connection, never null
   */
  public ClientConnection connection() {
    return connection;
  }

  /**
   * Enqueues a message for delivery without blocking.
   *
   * <p>When the queue is full, {@link OverflowPolicy#DROP_OLDEST} discards
   * the oldest undelivered message and accepts this one, while
   * {@link OverflowPolicy#DISCONNECT} closes the session and rejects it.
   *
   * @param message the message, never null
   * @return true if the message was queued, false if the session is closed
   *         or was closed by this overflow
   */
  public boolean offer(final OutboundMessage message) {
    return offer(message, null);
  }

  /**
   * Enqueues a message and, if it was queued, runs an action before any
   * other thread can offer to or take from this session.
   *
   * <p>Nothing offered after this call can reach the client before
   * {@code message}, and the writer cannot send {@code message} before the
   * action completed.
   *
   * @param message  the message, never null
   * @param onQueued the action to run under the session lock, may be null
   * @return true if the message was queued
   */
  boolean offer(final OutboundMessage message, final Runnable onQueued) {
    Objects.requireNonNull(message, "message must not be null");

    boolean disconnected = false;
    lock.lock();
    try {
      if (!open) {
        return false;
      }
      if (queue.size() >= capacity) {
        if (overflowPolicy == OverflowPolicy.DISCONNECT) {
          open = false;
          overflowed = true;
          queue.clear();
          notEmpty.signalAll();
          disconnected = true;
          metrics.slowConsumerDisconnected(id);
          log.warn("{} outbound queue overflowed ({}), disconnecting",
              id, capacity);
          return false;
        }
        final OutboundMessage dropped = queue.pollFirst();
        metrics.messageDropped(id);
        log.debug("{} outbound queue full, dropped {}", id, dropped);
      }
      queue.addLast(message);
      if (onQueued != null) {
        onQueued.run();
      }
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
      if (disconnected) {
        overflowHandler.accept(this);
      }
    }
  }

  /**
   * Blocks until a message is available.
   *
   * @return the oldest undelivered message, or null once the session is
   *         closed
   *
   * @throws InterruptedException if the writer thread is interrupted
   */
  public OutboundMessage take() throws InterruptedException {
    lock.lock();
    try {
      while (open && queue.isEmpty()) {
        notEmpty.await();
      }
      if (!open) {
        return null;
      }
      return queue.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes the queue: pending messages are discarded, further offers are
   * rejected and a blocked {@link #take()} returns null.
   *
   * @return true if this call closed the session, false if it was already
   *         closed
   */
  public boolean close() {
    lock.lock();
    try {
      if (!open) {
        return false;
      }
      open = false;
      queue.clear();
      notEmpty.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns whether the session still accepts messages.
   *
   * @return true until the session is closed
   */
  public boolean isOpen() {
    lock.lock();
    try {
      return open;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns whether the session was closed because its queue overflowed.
   *
   * @return true after a {@link OverflowPolicy#DISCONNECT} overflow
   */
  public boolean isOverflowed() {
    lock.lock();
    try {
      return overflowed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of undelivered messages.
   *
   * @return the queue size
   */
  public int queuedCount() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Claims the teardown of this session.
   *
   * @return true for the first caller only
   */
  boolean release() {
    if (released.compareAndSet(false, true)) {
      releasedSignal.countDown();
      return true;
    }
    return false;
  }

  /**
   * Waits until the session is released.
   *
   * @param timeoutMs the longest time to wait, in milliseconds
   * @return true if the session was released in time
   *
   * @throws InterruptedException if the waiting thread is interrupted
   */
  boolean awaitRelease(final long timeoutMs) throws InterruptedException {
    return releasedSignal.await(timeoutMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public String toString() {
    return id + "@" + connection.remoteAddress();
  }
}
