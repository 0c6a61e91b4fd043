package org.waabox.consistency.socket;

/**
 * Configuration holder for the TCP listeners of this module.
 *
 * <p>Holds the address to bind, the port to listen on and the longest line
 * a peer may send. A port of 0 binds an ephemeral port, see
 * {@link SocketConnectionAcceptor#localPort()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SocketConfig {

  /** The default port for client connections. */
  public static final int DEFAULT_CLIENT_PORT = 4691;

  /** The default port for backend change records. */
  public static final int DEFAULT_INGEST_PORT = 1991;

  /** The default longest line, in characters, a peer may send. */
  public static final int DEFAULT_MAX_FRAME_LENGTH = 64 * 1024;

  /** The default bind address, all interfaces. */
  private static final String DEFAULT_HOST = "0.0.0.0";

  /** The address to bind. */
  private final String host;

  /** The port to listen on. */
  private final int port;

  /** The longest line, in characters, a peer may send. */
  private final int maxFrameLength;

  /** Private constructor; use the static factory methods instead. */
  private SocketConfig(final String host, final int port,
      final int maxFrameLength) {
    this.host = host;
    this.port = port;
    this.maxFrameLength = maxFrameLength;
  }

  /**
   * Creates a configuration bound to all interfaces.
   *
   * @param port the port to listen on, 0 for an ephemeral port
   * @return a new {@link SocketConfig} instance, never null
   */
  public static SocketConfig create(final int port) {
    return create(DEFAULT_HOST, port);
  }

  /**
   * Creates a configuration bound to the given address.
   *
   * @param host the address to bind, never null
   * @param port the port to listen on, 0 for an ephemeral port
   * @return a new {@link SocketConfig} instance, never null
   */
  public static SocketConfig create(final String host, final int port) {
    return create(host, port, DEFAULT_MAX_FRAME_LENGTH);
  }

  /**
   * Creates a configuration bound to the given address with a custom line
   * limit. A peer that sends a longer line is refused.
   *
   * @param host           the address to bind, never null
   * @param port           the port to listen on, 0 for an ephemeral port
   * @param maxFrameLength the longest line in characters, must be positive
   * @return a new {@link SocketConfig} instance, never null
   */
  public static SocketConfig create(final String host, final int port,
      final int maxFrameLength) {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("host cannot be blank");
    }
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port: " + port);
    }
    if (maxFrameLength <= 0) {
      throw new IllegalArgumentException(
          "maxFrameLength must be positive, got: " + maxFrameLength);
    }
    return new SocketConfig(host, port, maxFrameLength);
  }

  /**
   * Returns the address to bind.
   *
   * @return the host, never null
   */
  public String host() {
    return host;
  }

  /**
   * Returns the port to listen on.
   *
   * @return the listening port
   */
  public int port() {
    return port;
  }

  /**
   * Returns the longest line a peer may send.
   *
   * @return the limit in characters
   */
  public int maxFrameLength() {
    return maxFrameLength;
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
