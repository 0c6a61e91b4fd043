package org.waabox.consistency.transport;

/**
 * Thrown when a client connection can no longer carry frames.
 *
 * <p>The broker does not retry: the affected session is torn down and the
 * client is expected to reconnect and resubscribe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class TransportException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new transport exception.
   *
   * @param message the detail message, never null
   */
  public TransportException(final String message) {
    super(message);
  }

  /**
   * Creates a new transport exception with an underlying cause.
   *
   * @param message the detail message, never null
   * @param cause   the I/O failure, never null
   */
  public TransportException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
