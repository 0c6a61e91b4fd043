package org.waabox.consistency.ingest;

import java.util.Arrays;
import java.util.Objects;

/**
 * A change of one resource, as reported by the backend.
 *
 * <p>Events are transient: they are produced by the ingest, consumed by the
 * dispatcher and never persisted. The {@code payload} byte array is
 * defensively copied on construction and on access.
 *
 * @param uri     the changed resource URI, never null
 * @param payload an optional opaque payload, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record InvalidationEvent(String uri, byte[] payload) {

  /**
   * Compact constructor that validates the uri and copies the payload.
   */
  public InvalidationEvent {
    Objects.requireNonNull(uri, "uri must not be null");
    if (payload != null) {
      payload = payload.clone();
    }
  }

  /**
   * Creates an event without payload.
   *
   * @param uri the changed resource URI, never null
   * @return the event, never null
   */
  public static InvalidationEvent of(final String uri) {
    return new InvalidationEvent(uri, null);
  }

  /**
   * Returns a defensive copy of the payload.
   *
   * @return a copy of the payload, or null if none was reported
   */
  @Override
  public byte[] payload() {
    return payload == null ? null : payload.clone();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof InvalidationEvent that)) {
      return false;
    }
    return uri.equals(that.uri) && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return 31 * uri.hashCode() + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "InvalidationEvent[" + uri
        + (payload != null ? " +" + payload.length + " bytes" : "") + "]";
  }
}
