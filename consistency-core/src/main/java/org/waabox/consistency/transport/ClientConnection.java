package org.waabox.consistency.transport;

/**
 * One bidirectional, frame-oriented connection to a client.
 *
 * <p>The broker reads from a connection on exactly one thread and writes to
 * it on exactly one other thread. {@link #close()} may be called from any
 * thread, at any time, and more than once.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ClientConnection {

  /**
   * Blocks until the next frame arrives.
   *
   * @return the frame text, or null once the client has closed the
   *         connection or {@link #close()} was called
   *
   * @throws TransportException if the connection failed
   */
  String receive();

  /**
   * Writes one frame to the client.
   *
   * @param frame the frame text, never null
   *
   * @throws TransportException if the connection failed or is closed
   */
  void send(String frame);

  /**
   * Closes the connection, unblocking a pending {@link #receive()}.
   */
  void close();

  /**
   * Describes the remote peer for logging.
   *
   * @return the remote address, never null
   */
  String remoteAddress();
}
