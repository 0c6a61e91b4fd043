package org.waabox.consistency.socket;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Objects;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.consistency.ConsistencyException;

/**
 * A server socket with a daemon thread that hands every accepted socket to a
 * callback. Shared by the client acceptor and the backend ingest listener.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class SocketListener {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      SocketListener.class);

  /** How long {@link #stop()} waits for the accept thread. */
  private static final long JOIN_TIMEOUT_MS = 5_000;

  /** The first pause after a failed accept. */
  private static final long MIN_ACCEPT_BACKOFF_MS = 50;

  /** The longest pause between failed accepts. */
  private static final long MAX_ACCEPT_BACKOFF_MS = 2_000;

  /** The address to bind, never null. */
  private final SocketConfig config;

  /** The name of the accept thread, never null. */
  private final String threadName;

  /** The bound server socket, null until started. */
  private volatile ServerSocket serverSocket;

  /** The accept thread, null until started. */
  private Thread acceptThread;

  /**
   * Creates a listener.
   *
   * @param theConfig     the address to bind, never null
   * @param theThreadName the name of the accept thread, never null
   */
  SocketListener(final SocketConfig theConfig, final String theThreadName) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
    threadName = Objects.requireNonNull(theThreadName,
        "threadName cannot be null");
  }

  /**
   * Binds the server socket and starts accepting.
   *
   * @param onAccept receives every accepted socket, never null
   *
   * @throws IllegalStateException if already started
   * @throws ConsistencyException if the address cannot be bound
   */
  synchronized void start(final Consumer<Socket> onAccept) {
    Objects.requireNonNull(onAccept, "onAccept cannot be null");
    if (serverSocket != null) {
      throw new IllegalStateException("Listener " + threadName
          + " is already started");
    }
    try {
      final ServerSocket socket = new ServerSocket();
      socket.setReuseAddress(true);
      socket.bind(new InetSocketAddress(config.host(), config.port()));
      serverSocket = socket;
    } catch (final IOException e) {
      throw ConsistencyException.bindFailed(threadName, config.toString(),
          e);
    }
    acceptThread = new Thread(() -> acceptLoop(onAccept), threadName);
    acceptThread.setDaemon(true);
    acceptThread.start();
  }

  /**
   * Returns the bound port.
   *
   * @return the local port, or -1 if not started
   */
  int localPort() {
    final ServerSocket socket = serverSocket;
    return socket == null ? -1 : socket.getLocalPort();
  }

  /** Closes the server socket and waits for the accept thread. */
  synchronized void stop() {
    final ServerSocket socket = serverSocket;
    if (socket == null) {
      return;
    }
    serverSocket = null;
    try {
      socket.close();
    } catch (final IOException e) {
      log.warn("Error closing {}: {}", config, e.getMessage());
    }
    try {
      acceptThread.join(JOIN_TIMEOUT_MS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    acceptThread = null;
  }

  /** Accepts sockets until the server socket is closed.
   *
   * <p>Failed accepts, such as running out of file descriptors, are retried
   * after a pause that doubles up to {@link #MAX_ACCEPT_BACKOFF_MS}.
   *
   * @param onAccept the accept callback.
   */
  private void acceptLoop(final Consumer<Socket> onAccept) {
    final ServerSocket socket = serverSocket;
    long backoff = MIN_ACCEPT_BACKOFF_MS;
    while (socket != null && !socket.isClosed()) {
      final Socket accepted;
      try {
        accepted = socket.accept();
        backoff = MIN_ACCEPT_BACKOFF_MS;
      } catch (final IOException e) {
        if (socket.isClosed()) {
          return;
        }
        log.warn("Accept on {} failed, retrying in {} ms: {}", config,
            backoff, e.getMessage());
        try {
          Thread.sleep(backoff);
        } catch (final InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          return;
        }
        backoff = nextBackoff(backoff);
        continue;
      }
      try {
        onAccept.accept(accepted);
      } catch (final RuntimeException e) {
        log.warn("Could not handle connection from {}: {}",
            accepted.getRemoteSocketAddress(), e.getMessage(), e);
        closeQuietly(accepted);
      }
    }
  }

  /**
   * Returns the pause that follows another failed accept.
   *
   * @param backoff the current pause, in milliseconds
   * @return the doubled pause, capped at {@link #MAX_ACCEPT_BACKOFF_MS}
   */
  static long nextBackoff(final long backoff) {
    return Math.min(backoff * 2, MAX_ACCEPT_BACKOFF_MS);
  }

  /**
   * Closes a socket, logging failures.
   *
   * @param socket the socket to close, never null
   */
  static void closeQuietly(final Socket socket) {
    try {
      socket.close();
    } catch (final IOException e) {
      log.debug("Error closing {}: {}", socket.getRemoteSocketAddress(),
          e.getMessage());
    }
  }
}
