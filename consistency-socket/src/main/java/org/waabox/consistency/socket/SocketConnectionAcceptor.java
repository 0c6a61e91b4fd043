package org.waabox.consistency.socket;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.consistency.transport.ConnectionAcceptor;
import org.waabox.consistency.transport.ConnectionHandler;

/**
 * TCP implementation of {@link ConnectionAcceptor}.
 *
 * <p>Every accepted socket becomes a {@link SocketClientConnection} that
 * exchanges one JSON frame per line.
 *
 * <p>Typical usage:
 * <pre>{@code
 * Consistency consistency = Consistency.builder()
 *     .acceptor(new SocketConnectionAcceptor(SocketConfig.create(4691)))
 *     .build();
 * consistency.start();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SocketConnectionAcceptor implements ConnectionAcceptor {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      SocketConnectionAcceptor.class);

  /** The configuration for this acceptor. */
  private final SocketConfig config;

  /** The TCP listener. */
  private final SocketListener listener;

  /**
   * Creates a new acceptor.
   *
   * @param config the socket configuration, never null
   */
  public SocketConnectionAcceptor(final SocketConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    listener = new SocketListener(config, "consistency-client-accept");
  }

  /** {@inheritDoc} */
  @Override
  public void start(final ConnectionHandler handler) {
    Objects.requireNonNull(handler, "handler cannot be null");
    listener.start(socket ->
        handler.onConnection(new SocketClientConnection(socket,
            config.maxFrameLength())));
    log.info("SocketConnectionAcceptor listening on {}:{}", config.host(),
        listener.localPort());
  }

  /** {@inheritDoc} */
  @Override
  public void stop() {
    listener.stop();
    log.info("SocketConnectionAcceptor stopped");
  }

  /**
   * Returns the bound port, useful when configured with port 0.
   *
   * @return the local port, or -1 if not started
   */
  public int localPort() {
    return listener.localPort();
  }
}
