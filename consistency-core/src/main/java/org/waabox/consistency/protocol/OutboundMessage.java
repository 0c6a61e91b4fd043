package org.waabox.consistency.protocol;

import java.util.Arrays;
import java.util.Objects;

/**
 * A message queued for delivery to one client.
 *
 * <p>The optional {@code payload} of an invalidation is defensively copied
 * on construction and on access.
 *
 * @param type    the message type, never null
 * @param uri     the resource URI for {@link Type#ACK} and
 *                {@link Type#INVALIDATED}, null for {@link Type#ERROR}
 * @param payload the optional opaque payload of an invalidation, may be null
 * @param reason  the error reason for {@link Type#ERROR}, null otherwise
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record OutboundMessage(
    Type type,
    String uri,
    byte[] payload,
    String reason
) {

  /** The kinds of message the broker sends to clients. */
  public enum Type {
    /** A subscription was registered. */
    ACK,
    /** A watched resource changed. */
    INVALIDATED,
    /** A client frame could not be processed. */
    ERROR
  }

  /**
   * Compact constructor that validates the message and copies the payload.
   */
  public OutboundMessage {
    Objects.requireNonNull(type, "type must not be null");
    if (type == Type.ERROR) {
      Objects.requireNonNull(reason, "reason must not be null");
    } else {
      Objects.requireNonNull(uri, "uri must not be null");
    }
    if (payload != null) {
      payload = payload.clone();
    }
  }

  /**
   * Creates the acknowledgement of a subscription.
   *
   * @param uri the subscribed resource, never null
   * @return the message, never null
   */
  public static OutboundMessage ack(final String uri) {
    return new OutboundMessage(Type.ACK, uri, null, null);
  }

  /**
   * Creates an invalidation notice.
   *
   * @param uri     the changed resource, never null
   * @param payload the optional payload reported by the backend, may be null
   * @return the message, never null
   */
  public static OutboundMessage invalidated(final String uri,
      final byte[] payload) {
    return new OutboundMessage(Type.INVALIDATED, uri, payload, null);
  }

  /**
   * Creates an error report.
   *
   * @param reason the human readable reason, never null
   * @return the message, never null
   */
  public static OutboundMessage error(final String reason) {
    return new OutboundMessage(Type.ERROR, null, null, reason);
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
    if (!(o instanceof OutboundMessage that)) {
      return false;
    }
    return type == that.type
        && Objects.equals(uri, that.uri)
        && Objects.equals(reason, that.reason)
        && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(type, uri, reason);
    result = 31 * result + Arrays.hashCode(payload);
    return result;
  }

  @Override
  public String toString() {
    return "OutboundMessage[" + type
        + (uri != null ? " " + uri : "")
        + (reason != null ? " " + reason : "")
        + (payload != null ? " +" + payload.length + " bytes" : "")
        + "]";
  }
}
