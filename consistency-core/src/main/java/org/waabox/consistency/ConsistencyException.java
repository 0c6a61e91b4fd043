package org.waabox.consistency;

/**
 * Raised when a broker channel cannot acquire the infrastructure it needs,
 * most often a listening address that is taken or not allowed.
 *
 * <p>Unlike a {@link org.waabox.consistency.transport.TransportException},
 * which ends one session, this failure stops the channel from starting.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConsistencyException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The channel that failed, may be null. */
  private final String channel;

  /**
   * Creates a new exception.
   *
   * @param message the detail message, never null
   * @param cause   the underlying cause, may be null
   */
  public ConsistencyException(final String message, final Throwable cause) {
    this(null, message, cause);
  }

  /** Creates a new exception for a named channel.
   *
   * @param theChannel the failing channel, may be null.
   * @param message the detail message.
   * @param cause the underlying cause.
   */
  private ConsistencyException(final String theChannel, final String message,
      final Throwable cause) {
    super(message, cause);
    channel = theChannel;
  }

  /**
   * Reports that a channel could not bind its listening address.
   *
   * @param channel the channel name, never null
   * @param address the address that was requested, never null
   * @param cause   the bind failure, never null
   * @return the exception to throw, never null
   */
  public static ConsistencyException bindFailed(final String channel,
      final String address, final Throwable cause) {
    return new ConsistencyException(channel, channel + " cannot listen on "
        + address + ": " + cause.getMessage(), cause);
  }

  /**
   * Returns the channel that failed.
   *
   * @return the channel name, or null if not tied to a channel
   */
  public String channel() {
    return channel;
  }
}
