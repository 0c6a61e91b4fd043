package org.waabox.consistency.ingest;

/**
 * The contract through which a backend tells the broker that a resource
 * changed.
 *
 * <p>Implementations exist on both sides of the wire: the broker's own
 * {@link BackendIngest}, and backend-side clients that forward the call over
 * HTTP or Kafka. All of them either accept the change or throw.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ChangeReporter {

  /**
   * Reports that a resource changed.
   *
   * @param uri     the changed resource URI, never null
   * @param payload an optional opaque payload forwarded to clients
   *                best-effort, may be null
   *
   * @throws BackendUnavailableException if the change could not be
   *     accepted
   * @throws IllegalArgumentException if the uri is blank
   */
  void reportChange(String uri, byte[] payload);

  /**
   * Reports that a resource changed, without payload.
   *
   * @param uri the changed resource URI, never null
   *
   * @throws BackendUnavailableException if the change could not be
   *     accepted
   */
  default void reportChange(final String uri) {
    reportChange(uri, null);
  }
}
