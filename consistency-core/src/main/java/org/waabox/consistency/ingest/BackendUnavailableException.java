package org.waabox.consistency.ingest;

/**
 * Thrown to a backend whose change report could not be accepted by the
 * broker: the broker is stopped, unreachable, or its pending queue is full.
 *
 * <p>The backend should treat the change as not delivered and retry or
 * alert; the broker never drops a report silently.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class BackendUnavailableException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param message the detail message, never null
   */
  public BackendUnavailableException(final String message) {
    super(message);
  }

  /**
   * Creates a new exception with an underlying cause.
   *
   * @param message the detail message, never null
   * @param cause   the underlying failure, never null
   */
  public BackendUnavailableException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
