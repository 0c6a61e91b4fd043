package org.waabox.consistency.ingest;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.consistency.BrokerSettings;
import org.waabox.consistency.metrics.ConsistencyMetrics;

/**
 * The broker side of {@link ChangeReporter}: turns reported changes into
 * {@link InvalidationEvent}s and hands them, one at a time and in arrival
 * order, to the dispatcher.
 *
 * <p>Reporting never blocks on dispatch. Changes wait in a bounded queue
 * that a single worker thread drains, so changes to the same URI are
 * dispatched in the order they were reported.
 *
 * <p>When coalescing is enabled, a change to a URI that already has an event
 * waiting in the queue replaces that event's payload instead of queueing a
 * second one. The guarantee is that at least one dispatch follows the latest
 * reported change and carries its payload; it is not one dispatch per
 * change. An event is taken out of the coalescing window as soon as the
 * worker picks it up, so a change reported during its dispatch is queued
 * again.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BackendIngest implements ChangeReporter {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      BackendIngest.class);

  /** How long {@link #stop()} waits for the worker to finish. */
  private static final long STOP_TIMEOUT_MS = 5_000;

  /** Receives every event taken from the queue, never null. */
  private final Consumer<InvalidationEvent> dispatch;

  /** Whether queued changes to the same URI are merged. */
  private final boolean coalesce;

  /** The maximum number of queued events. */
  private final int maxPending;

  /** The metrics reporter, never null. */
  private final ConsistencyMetrics metrics;

  /** Guards the queue, the index and the running flag. */
  private final ReentrantLock lock = new ReentrantLock();

  /** Signalled when an event is queued or the ingest stops. */
  private final Condition changed = lock.newCondition();

  /** Events waiting for dispatch, oldest first. */
  private final ArrayDeque<Pending> queue = new ArrayDeque<>();

  /** Queued events by URI, only maintained when coalescing. */
  private final Map<String, Pending> queuedByUri = new HashMap<>();

  /** Whether changes are being accepted. Guarded by {@link #lock}. */
  private boolean running;

  /** The worker draining the queue. */
  private Thread worker;

  /**
   * Creates a new ingest.
   *
   * @param theDispatch receives the events to fan out, never null
   * @param settings    the broker settings, never null
   * @param theMetrics  the metrics reporter, never null
   */
  public BackendIngest(final Consumer<InvalidationEvent> theDispatch,
      final BrokerSettings settings, final ConsistencyMetrics theMetrics) {
    dispatch = Objects.requireNonNull(theDispatch,
        "dispatch must not be null");
    Objects.requireNonNull(settings, "settings must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    coalesce = settings.coalesceChanges();
    maxPending = settings.maxPendingChanges();
  }

  /**
   * Starts accepting changes and the dispatch worker.
   *
   * @throws IllegalStateException if the ingest is already running
   */
  public void start() {
    lock.lock();
    try {
      if (running) {
        throw new IllegalStateException("BackendIngest is already running");
      }
      running = true;
      worker = new Thread(this::drainLoop, "consistency-ingest");
      worker.setDaemon(true);
      worker.start();
    } finally {
      lock.unlock();
    }
    log.info("BackendIngest started (coalesce={}, maxPending={})",
        coalesce, maxPending);
  }

  /**
   * Stops accepting changes and stops the worker. Changes still queued are
   * discarded; an in-flight dispatch is allowed to finish.
   */
  public void stop() {
    final Thread current;
    final int discarded;
    lock.lock();
    try {
      if (!running) {
        return;
      }
      running = false;
      discarded = queue.size();
      queue.clear();
      queuedByUri.clear();
      current = worker;
      worker = null;
      changed.signalAll();
    } finally {
      lock.unlock();
    }

    if (current != null && current != Thread.currentThread()) {
      try {
        current.join(STOP_TIMEOUT_MS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for the ingest worker to stop");
      }
    }
    if (discarded > 0) {
      log.warn("BackendIngest stopped, discarded {} pending change(s)",
          discarded);
    } else {
      log.info("BackendIngest stopped");
    }
  }

  /** {@inheritDoc} */
  @Override
  public void reportChange(final String uri, final byte[] payload) {
    Objects.requireNonNull(uri, "uri must not be null");
    if (uri.isBlank()) {
      metrics.changeRejected(uri);
      throw new IllegalArgumentException("uri must not be blank");
    }

    lock.lock();
    try {
      if (!running) {
        metrics.changeRejected(uri);
        throw new BackendUnavailableException(
            "The broker is not accepting changes");
      }
      if (coalesce) {
        final Pending queued = queuedByUri.get(uri);
        if (queued != null) {
          queued.payload = payload == null ? null : payload.clone();
          log.debug("Coalesced change for {}", uri);
          return;
        }
      }
      if (queue.size() >= maxPending) {
        metrics.changeRejected(uri);
        throw new BackendUnavailableException(
            "Pending change queue is full (" + maxPending + ")");
      }
      final Pending pending = new Pending(uri,
          payload == null ? null : payload.clone());
      queue.addLast(pending);
      if (coalesce) {
        queuedByUri.put(uri, pending);
      }
      changed.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of events waiting for dispatch.
   *
   * @return the queue size
   */
  public int pendingCount() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns whether changes are being accepted.
   *
   * @return true between {@link #start()} and {@link #stop()}
   */
  public boolean isRunning() {
    lock.lock();
    try {
      return running;
    } finally {
      lock.unlock();
    }
  }

  /** Takes events from the queue and dispatches them until stopped. */
  private void drainLoop() {
    while (true) {
      final InvalidationEvent event = next();
      if (event == null) {
        return;
      }
      try {
        dispatch.accept(event);
      } catch (final RuntimeException e) {
        log.error("Dispatch of {} failed: {}", event, e.getMessage(), e);
      }
    }
  }

  /** Blocks until an event is available.
   *
   * @return the next event, or null once the ingest stopped.
   */
  private InvalidationEvent next() {
    lock.lock();
    try {
      while (running && queue.isEmpty()) {
        changed.await(1, TimeUnit.SECONDS);
      }
      if (!running) {
        return null;
      }
      final Pending pending = queue.pollFirst();
      if (coalesce) {
        queuedByUri.remove(pending.uri);
      }
      return new InvalidationEvent(pending.uri, pending.payload);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return null;
    } finally {
      lock.unlock();
    }
  }

  /** A queued change; the payload is replaced when coalescing. */
  private static final class Pending {

    /** The changed URI, never null. */
    private final String uri;

    /** The latest payload, may be null. */
    private byte[] payload;

    /** Creates a queued change.
     *
     * @param theUri the changed URI, never null.
     * @param thePayload the payload, may be null.
     */
    private Pending(final String theUri, final byte[] thePayload) {
      uri = theUri;
      payload = thePayload;
    }
  }
}
