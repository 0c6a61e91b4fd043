package org.waabox.consistency.ingest;

/**
 * An inbound channel through which the backend reaches the broker (a
 * socket, an HTTP endpoint, a Kafka topic).
 *
 * <p>Typical lifecycle:
 * <ol>
 *   <li>Call {@link #start(ChangeReporter)} to begin receiving changes</li>
 *   <li>Every decoded change is forwarded to the reporter</li>
 *   <li>Call {@link #stop()} to shut down the channel</li>
 * </ol>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeSource {

  /**
   * Starts the channel.
   *
   * @param reporter where received changes are forwarded, never null
   */
  void start(ChangeReporter reporter);

  /**
   * Stops the channel and releases associated resources.
   *
   * <p>After this method returns, no further changes are forwarded.
   */
  void stop();
}
