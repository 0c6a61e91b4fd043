package org.waabox.consistency;

import java.util.Objects;

/**
 * Tuning knobs of the broker core: outbound queue size, the overflow policy
 * and how the backend ingest buffers changes.
 *
 * <p>Instances are created through static factory methods. The defaults are
 * a queue of {@value #DEFAULT_QUEUE_CAPACITY} messages per session,
 * {@link OverflowPolicy#DROP_OLDEST}, coalescing enabled and up to
 * {@value #DEFAULT_MAX_PENDING_CHANGES} pending changes.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BrokerSettings {

  /** The default per-session outbound queue capacity. */
  public static final int DEFAULT_QUEUE_CAPACITY = 256;

  /** The default bound of the ingest pending queue. */
  public static final int DEFAULT_MAX_PENDING_CHANGES = 10_000;

  /** The maximum number of undelivered messages per session. */
  private final int queueCapacity;

  /** What to do when a session queue is full. */
  private final OverflowPolicy overflowPolicy;

  /** Whether queued changes to the same URI are merged. */
  private final boolean coalesceChanges;

  /** The maximum number of changes waiting for dispatch. */
  private final int maxPendingChanges;

  /**
   * Creates new settings.
   *
   * @param queueCapacity     the session queue capacity
   * @param overflowPolicy    the overflow policy, never null
   * @param coalesceChanges   whether to coalesce queued changes
   * @param maxPendingChanges the ingest queue bound
   */
  private BrokerSettings(final int queueCapacity,
      final OverflowPolicy overflowPolicy, final boolean coalesceChanges,
      final int maxPendingChanges) {
    this.queueCapacity = queueCapacity;
    this.overflowPolicy = overflowPolicy;
    this.coalesceChanges = coalesceChanges;
    this.maxPendingChanges = maxPendingChanges;
  }

  /**
   * Creates settings with the given parameters.
   *
   * @param queueCapacity     the maximum number of undelivered messages per
   *                          session, must be greater than zero
   * @param overflowPolicy    what to do when a session queue is full,
   *                          never null
   * @param coalesceChanges   true to merge queued changes to the same URI
   * @param maxPendingChanges the maximum number of changes waiting for
   *                          dispatch, must be greater than zero
   * @return the new settings, never null
   *
   * @throws IllegalArgumentException if a bound is not positive
   * @throws NullPointerException if overflowPolicy is null
   */
  public static BrokerSettings create(final int queueCapacity,
      final OverflowPolicy overflowPolicy, final boolean coalesceChanges,
      final int maxPendingChanges) {
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException(
          "queueCapacity must be greater than 0, got: " + queueCapacity);
    }
    if (maxPendingChanges <= 0) {
      throw new IllegalArgumentException(
          "maxPendingChanges must be greater than 0, got: "
              + maxPendingChanges);
    }
    Objects.requireNonNull(overflowPolicy, "overflowPolicy must not be null");
    return new BrokerSettings(queueCapacity, overflowPolicy, coalesceChanges,
        maxPendingChanges);
  }

  /**
   * Creates settings with the defaults.
   *
   * @return the default settings, never null
   */
  public static BrokerSettings defaults() {
    return new BrokerSettings(DEFAULT_QUEUE_CAPACITY,
        OverflowPolicy.DROP_OLDEST, true, DEFAULT_MAX_PENDING_CHANGES);
  }

  /**
   * Returns the maximum number of undelivered messages per session.
   *
   * @return the queue capacity, always greater than zero
   */
  public int queueCapacity() {
    return queueCapacity;
  }

  /**
   * Returns the policy applied when a session queue is full.
   *
   * @return the overflow policy, never null
   */
  public OverflowPolicy overflowPolicy() {
    return overflowPolicy;
  }

  /**
   * Returns whether queued changes to the same URI are merged into one
   * dispatch.
   *
   * @return true if coalescing is enabled
   */
  public boolean coalesceChanges() {
    return coalesceChanges;
  }

  /**
   * Returns the maximum number of changes waiting for dispatch.
   *
   * @return the pending changes bound, always greater than zero
   */
  public int maxPendingChanges() {
    return maxPendingChanges;
  }

  @Override
  public String toString() {
    return "BrokerSettings[queueCapacity=" + queueCapacity
        + ", overflowPolicy=" + overflowPolicy
        + ", coalesceChanges=" + coalesceChanges
        + ", maxPendingChanges=" + maxPendingChanges + "]";
  }
}
