package org.waabox.consistency.transport;

/**
 * Receives the connections accepted by a {@link ConnectionAcceptor}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ConnectionHandler {

  /**
   * Takes ownership of a freshly accepted connection.
   *
   * <p>Implementations must not block the acceptor thread.
   *
   * @param connection the new connection, never null
   */
  void onConnection(ClientConnection connection);
}
