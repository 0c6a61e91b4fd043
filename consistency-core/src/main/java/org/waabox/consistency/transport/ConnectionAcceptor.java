package org.waabox.consistency.transport;

/**
 * A source of client connections (a listening socket, a WebSocket endpoint).
 *
 * <p>The broker core depends only on this interface, never on a concrete
 * network stack.
 *
 * <p>Typical lifecycle:
 * <ol>
 *   <li>Call {@link #start(ConnectionHandler)} to begin accepting</li>
 *   <li>Each accepted connection is handed to the handler</li>
 *   <li>Call {@link #stop()} to stop accepting new connections</li>
 * </ol>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ConnectionAcceptor {

  /**
   * Starts accepting connections.
   *
   * @param handler the handler for accepted connections, never null
   */
  void start(ConnectionHandler handler);

  /**
   * Stops accepting connections and releases the listening resources.
   *
   * <p>Connections already handed to the handler are not closed by this
   * method; the broker closes them.
   */
  void stop();
}
