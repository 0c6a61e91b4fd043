package org.waabox.consistency.socket;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.consistency.ingest.BackendUnavailableException;
import org.waabox.consistency.ingest.ChangeEventCodec;
import org.waabox.consistency.ingest.ChangeReporter;
import org.waabox.consistency.ingest.ChangeSource;
import org.waabox.consistency.ingest.InvalidationEvent;

/**
 * Raw TCP backend channel, implementing {@link ChangeSource}.
 *
 * <p>Backends connect and write one JSON change record per line, see
 * {@link ChangeEventCodec}. Every record is answered with one
 * {@link IngestReply} line, so a backend learns whether the broker took the
 * change or refused it. A backend may also write a single record and close
 * the connection without reading the reply. Malformed records are answered
 * and skipped; the connection stays open. A line over the configured limit
 * is answered and the connection is closed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class SocketIngestServer implements ChangeSource {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      SocketIngestServer.class);

  /** The configuration for this server. */
  private final SocketConfig config;

  /** The TCP listener. */
  private final SocketListener listener;

  /** The backend connections being read. */
  private final Set<Socket> connections = ConcurrentHashMap.newKeySet();

  /** Reads backend connections, created on start. */
  private ExecutorService readers;

  /**
   * Creates a new ingest server.
   *
   * @param config the socket configuration, never null
   */
  public SocketIngestServer(final SocketConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    listener = new SocketListener(config, "consistency-ingest-accept");
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void start(final ChangeReporter reporter) {
    Objects.requireNonNull(reporter, "reporter cannot be null");
    final AtomicInteger count = new AtomicInteger();
    readers = Executors.newCachedThreadPool(runnable -> {
      final Thread thread = new Thread(runnable,
          "consistency-ingest-reader-" + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
    final ExecutorService pool = readers;
    listener.start(socket -> {
      connections.add(socket);
      pool.execute(() -> read(socket, reporter));
    });
    log.info("SocketIngestServer listening on {}:{}", config.host(),
        listener.localPort());
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void stop() {
    listener.stop();
    for (final Socket socket : connections) {
      SocketListener.closeQuietly(socket);
    }
    connections.clear();
    if (readers != null) {
      readers.shutdownNow();
      readers = null;
    }
    log.info("SocketIngestServer stopped");
  }

  /**
   * Returns the bound port, useful when configured with port 0.
   *
   * @return the local port, or -1 if not started
   */
  public int localPort() {
    return listener.localPort();
  }

  /**
   * Parses one change record and reports it.
   *
   * <p>Package-private for testability.
   *
   * @param line     the raw record, never null
   * @param reporter the reporter to forward to, never null
   * @return the reply for the backend, or null for a blank line
   */
  IngestReply handleRecord(final String line, final ChangeReporter reporter) {
    if (line.isBlank()) {
      return null;
    }
    final InvalidationEvent event;
    try {
      event = ChangeEventCodec.deserialize(line);
    } catch (final IllegalArgumentException e) {
      log.warn("Skipping malformed change record: {}", e.getMessage());
      return IngestReply.refused(IngestReply.Status.MALFORMED,
          e.getMessage());
    }
    try {
      reporter.reportChange(event.uri(), event.payload());
      return IngestReply.accepted();
    } catch (final BackendUnavailableException e) {
      log.warn("Change for {} refused: {}", event.uri(), e.getMessage());
      return IngestReply.refused(IngestReply.Status.UNAVAILABLE,
          e.getMessage());
    }
  }

  /** Reads records from one backend connection until it closes.
   *
   * @param socket the backend connection.
   * @param reporter the reporter to forward to.
   */
  private void read(final Socket socket, final ChangeReporter reporter) {
    final Object peer = socket.getRemoteSocketAddress();
    log.debug("Backend connected from {}", peer);
    try {
      final LineReader reader = new LineReader(socket.getInputStream(),
          config.maxFrameLength());
      final Writer writer = new BufferedWriter(new OutputStreamWriter(
          socket.getOutputStream(), StandardCharsets.UTF_8));
      try {
        String line;
        while ((line = reader.readLine()) != null) {
          final IngestReply reply = handleRecord(line, reporter);
          if (reply != null) {
            reply(writer, reply, peer);
          }
        }
      } catch (final LineReader.FrameTooLongException e) {
        log.warn("Backend {} sent an oversized record: {}", peer,
            e.getMessage());
        reply(writer, IngestReply.refused(IngestReply.Status.TOO_LONG,
            e.getMessage()), peer);
      }
    } catch (final IOException e) {
      if (!socket.isClosed()) {
        log.warn("Read from backend {} failed: {}", peer, e.getMessage());
      }
    } finally {
      connections.remove(socket);
      SocketListener.closeQuietly(socket);
      log.debug("Backend {} disconnected", peer);
    }
  }

  /** Writes one reply line. A backend that stopped reading is not an error.
   *
   * @param writer the backend connection's writer.
   * @param reply the reply to write.
   * @param peer the backend address, for logging.
   */
  private static void reply(final Writer writer, final IngestReply reply,
      final Object peer) {
    try {
      writer.write(reply.encode());
      writer.write('\n');
      writer.flush();
    } catch (final IOException e) {
      log.debug("Backend {} did not take the reply {}: {}", peer,
          reply.status(), e.getMessage());
    }
  }
}
