package org.waabox.consistency.protocol;

import java.util.Objects;

/**
 * A decoded frame sent by a client to the broker.
 *
 * @param type the frame type, never null
 * @param uri  the resource URI, never null for {@link Type#SUBSCRIBE} and
 *             {@link Type#UNSUBSCRIBE}, null for {@link Type#CLOSE}
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ClientFrame(Type type, String uri) {

  /** The kinds of frame a client can send. */
  public enum Type {
    /** Start watching a resource. */
    SUBSCRIBE,
    /** Stop watching a resource. */
    UNSUBSCRIBE,
    /** End the session. */
    CLOSE
  }

  /**
   * Compact constructor that validates the frame.
   */
  public ClientFrame {
    Objects.requireNonNull(type, "type must not be null");
    if (type != Type.CLOSE) {
      Objects.requireNonNull(uri, "uri must not be null");
    }
  }

  /**
   * Creates a subscribe frame.
   *
   * @param uri the resource to watch, never null
   * @return the frame, never null
   */
  public static ClientFrame subscribe(final String uri) {
    return new ClientFrame(Type.SUBSCRIBE, uri);
  }

  /**
   * Creates an unsubscribe frame.
   *
   * @param uri the resource to stop watching, never null
   * @return the frame, never null
   */
  public static ClientFrame unsubscribe(final String uri) {
    return new ClientFrame(Type.UNSUBSCRIBE, uri);
  }

  /**
   * Creates a close frame.
   *
   * @return the frame, never null
   */
  public static ClientFrame close() {
    return new ClientFrame(Type.CLOSE, null);
  }
}
