package org.waabox.consistency.spring;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.consistency.BrokerSettings;
import org.waabox.consistency.OverflowPolicy;

/**
 * Configuration properties for Consistency, mapped from the
 * {@code consistency.*} prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code consistency.queue-capacity} - outbound messages buffered per
 *       session, defaults to 256.</li>
 *   <li>{@code consistency.overflow-policy} - {@code drop-oldest} or
 *       {@code disconnect}, defaults to {@code drop-oldest}.</li>
 *   <li>{@code consistency.coalesce-changes} - merge queued changes to the
 *       same URI, defaults to true.</li>
 *   <li>{@code consistency.max-pending-changes} - backend changes waiting
 *       for dispatch before new ones are refused, defaults to 10000.</li>
 *   <li>{@code consistency.websocket.*} - the WebSocket client endpoint.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "consistency")
public class ConsistencyProperties {

  /** Outbound messages buffered per session. */
  private int queueCapacity = BrokerSettings.DEFAULT_QUEUE_CAPACITY;

  /** What to do when a session's outbound queue is full. */
  private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;

  /** Whether queued changes to the same URI are merged. */
  private boolean coalesceChanges = true;

  /** Backend changes waiting for dispatch before new ones are refused. */
  private int maxPendingChanges = BrokerSettings.DEFAULT_MAX_PENDING_CHANGES;

  /** The WebSocket endpoint settings. */
  private final Websocket websocket = new Websocket();

  /**
   * Builds the broker settings from these properties.
   *
   * @return the settings, never null
   *
   * @throws IllegalArgumentException if a value is out of range
   */
  public BrokerSettings toSettings() {
    return BrokerSettings.create(queueCapacity, overflowPolicy,
        coalesceChanges, maxPendingChanges);
  }

  /**
   * Returns the outbound queue capacity per session.
   *
   * @return the capacity
   */
  public int getQueueCapacity() {
    return queueCapacity;
  }

  /**
   * Sets the outbound queue capacity per session.
   *
   * @param queueCapacity the capacity, must be positive
   */
  public void setQueueCapacity(final int queueCapacity) {
    this.queueCapacity = queueCapacity;
  }

  /**
   * Returns the overflow policy.
   *
   * @return the policy, never null
   */
  public OverflowPolicy getOverflowPolicy() {
    return overflowPolicy;
  }

  /**
   * Sets the overflow policy.
   *
   * @param overflowPolicy the policy, never null
   */
  public void setOverflowPolicy(final OverflowPolicy overflowPolicy) {
    this.overflowPolicy = overflowPolicy;
  }

  /**
   * Returns whether queued changes to the same URI are merged.
   *
   * @return true if changes are coalesced
   */
  public boolean isCoalesceChanges() {
    return coalesceChanges;
  }

  /**
   * Sets whether queued changes to the same URI are merged.
   *
   * @param coalesceChanges true to coalesce
   */
  public void setCoalesceChanges(final boolean coalesceChanges) {
    this.coalesceChanges = coalesceChanges;
  }

  /**
   * Returns the maximum number of pending backend changes.
   *
   * @return the maximum
   */
  public int getMaxPendingChanges() {
    return maxPendingChanges;
  }

  /**
   * Sets the maximum number of pending backend changes.
   *
   * @param maxPendingChanges the maximum, must be positive
   */
  public void setMaxPendingChanges(final int maxPendingChanges) {
    this.maxPendingChanges = maxPendingChanges;
  }

  /**
   * Returns the WebSocket endpoint settings.
   *
   * @return the settings, never null
   */
  public Websocket getWebsocket() {
    return websocket;
  }

  /** WebSocket endpoint settings, under {@code consistency.websocket}. */
  public static class Websocket {

    /** Whether the WebSocket endpoint is registered. */
    private boolean enabled = true;

    /** The endpoint path. */
    private String path = "/consistency";

    /** The origins allowed to connect. */
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    /**
     * Returns whether the endpoint is registered.
     *
     * @return true if enabled
     */
    public boolean isEnabled() {
      return enabled;
    }

    /**
     * Sets whether the endpoint is registered.
     *
     * @param enabled true to register it
     */
    public void setEnabled(final boolean enabled) {
      this.enabled = enabled;
    }

    /**
     * Returns the endpoint path.
     *
     * @return the path, never null
     */
    public String getPath() {
      return path;
    }

    /**
     * Sets the endpoint path.
     *
     * @param path the path, never null
     */
    public void setPath(final String path) {
      this.path = path;
    }

    /**
     * Returns the origins allowed to connect.
     *
     * @return the origins, never null
     */
    public List<String> getAllowedOrigins() {
      return allowedOrigins;
    }

    /**
     * Sets the origins allowed to connect.
     *
     * @param allowedOrigins the origins, never null
     */
    public void setAllowedOrigins(final List<String> allowedOrigins) {
      this.allowedOrigins = allowedOrigins;
    }
  }
}
