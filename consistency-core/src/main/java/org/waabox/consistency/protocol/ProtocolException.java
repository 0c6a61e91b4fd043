package org.waabox.consistency.protocol;

/**
 * Thrown when a frame does not follow the Consistency wire protocol.
 *
 * <p>A protocol error is local to the frame that caused it: the broker
 * reports it to the client with an {@code error} frame and keeps the
 * connection open.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ProtocolException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new protocol exception.
   *
   * @param message the reason reported back to the client, never null
   */
  public ProtocolException(final String message) {
    super(message);
  }

  /**
   * Creates a new protocol exception with an underlying cause.
   *
   * @param message the reason reported back to the client, never null
   * @param cause   the parsing failure, never null
   */
  public ProtocolException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
