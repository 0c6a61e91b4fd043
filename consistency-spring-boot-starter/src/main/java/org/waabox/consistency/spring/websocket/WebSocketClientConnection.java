package org.waabox.consistency.spring.websocket;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.waabox.consistency.transport.ClientConnection;
import org.waabox.consistency.transport.TransportException;

/**
 * Adapts a Spring {@link WebSocketSession} to a {@link ClientConnection}.
 *
 * <p>The container pushes inbound text messages through {@link #deliver};
 * they are buffered until the broker's receive loop takes them. Once the
 * WebSocket closes, {@link #receive()} reports end of stream.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class WebSocketClientConnection implements ClientConnection {

  /** Marks the end of the inbound stream, never equal to any frame. */
  private static final Object END_OF_STREAM = new Object();

  /** The underlying WebSocket session, never null. */
  private final WebSocketSession session;

  /** Inbound frames not yet received, then END_OF_STREAM, never null. */
  private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();

  /** Whether the end of stream was signaled. */
  private final AtomicBoolean ended = new AtomicBoolean(false);

  /** The peer address, captured at creation. */
  private final String remoteAddress;

  /**
   * Wraps a WebSocket session.
   *
   * @param theSession the open session, never null
   */
  WebSocketClientConnection(final WebSocketSession theSession) {
    session = Objects.requireNonNull(theSession, "session cannot be null");
    remoteAddress = session.getRemoteAddress() == null
        ? session.getId()
        : String.valueOf(session.getRemoteAddress());
  }

  /**
   * Buffers a text message received from the client.
   *
   * @param frame the message payload, never null
   */
  void deliver(final String frame) {
    if (!ended.get()) {
      inbound.add(frame);
    }
  }

  /** Signals that no more messages will arrive. */
  void endOfStream() {
    if (ended.compareAndSet(false, true)) {
      inbound.add(END_OF_STREAM);
    }
  }

  /** {@inheritDoc} */
  @Override
  public String receive() {
    final Object item;
    try {
      item = inbound.take();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("Interrupted while reading from "
          + remoteAddress, e);
    }
    if (item == END_OF_STREAM) {
      inbound.add(END_OF_STREAM);
      return null;
    }
    return (String) item;
  }

  /** {@inheritDoc} */
  @Override
  public void send(final String frame) {
    synchronized (session) {
      try {
        session.sendMessage(new TextMessage(frame));
      } catch (final IOException | IllegalStateException e) {
        throw new TransportException("Write to " + remoteAddress
            + " failed: " + e.getMessage(), e);
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    endOfStream();
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(CloseStatus.NORMAL);
    } catch (final IOException e) {
      throw new TransportException("Close of " + remoteAddress
          + " failed: " + e.getMessage(), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public String remoteAddress() {
    return remoteAddress;
  }
}
