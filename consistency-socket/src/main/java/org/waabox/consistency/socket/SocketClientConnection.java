package org.waabox.consistency.socket;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import org.waabox.consistency.transport.ClientConnection;
import org.waabox.consistency.transport.TransportException;

/**
 * A {@link ClientConnection} over a TCP socket, one UTF-8 frame per line.
 *
 * <p>A line longer than the configured limit fails the receive with a
 * {@link TransportException}, which ends the session.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SocketClientConnection implements ClientConnection {

  /** The underlying socket, never null. */
  private final Socket socket;

  /** Reads inbound lines. */
  private final LineReader reader;

  /** Writes outbound lines; guarded by itself. */
  private final BufferedWriter writer;

  /** The peer address, captured at creation. */
  private final String remoteAddress;

  /**
   * Wraps a connected socket with the default line limit.
   *
   * @param theSocket the connected socket, never null
   *
   * @throws TransportException if the socket streams cannot be opened
   */
  public SocketClientConnection(final Socket theSocket) {
    this(theSocket, SocketConfig.DEFAULT_MAX_FRAME_LENGTH);
  }

  /**
   * Wraps a connected socket.
   *
   * @param theSocket      the connected socket, never null
   * @param maxFrameLength the longest inbound line, in characters
   *
   * @throws TransportException if the socket streams cannot be opened
   */
  public SocketClientConnection(final Socket theSocket,
      final int maxFrameLength) {
    socket = Objects.requireNonNull(theSocket, "socket cannot be null");
    remoteAddress = String.valueOf(socket.getRemoteSocketAddress());
    try {
      reader = new LineReader(socket.getInputStream(), maxFrameLength);
      writer = new BufferedWriter(new OutputStreamWriter(
          socket.getOutputStream(), StandardCharsets.UTF_8));
    } catch (final IOException e) {
      throw new TransportException("Cannot open streams of "
          + remoteAddress, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public String receive() {
    try {
      return reader.readLine();
    } catch (final LineReader.FrameTooLongException e) {
      throw new TransportException("Frame from " + remoteAddress
          + " refused: " + e.getMessage(), e);
    } catch (final IOException e) {
      if (socket.isClosed()) {
        return null;
      }
      throw new TransportException("Read from " + remoteAddress
          + " failed: " + e.getMessage(), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void send(final String frame) {
    synchronized (writer) {
      try {
        writer.write(frame);
        writer.write('\n');
        writer.flush();
      } catch (final IOException e) {
        throw new TransportException("Write to " + remoteAddress
            + " failed: " + e.getMessage(), e);
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    try {
      socket.close();
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
