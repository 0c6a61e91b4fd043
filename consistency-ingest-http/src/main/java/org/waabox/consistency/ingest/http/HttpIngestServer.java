package org.waabox.consistency.ingest.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.consistency.ConsistencyException;
import org.waabox.consistency.ingest.BackendUnavailableException;
import org.waabox.consistency.ingest.ChangeEventCodec;
import org.waabox.consistency.ingest.ChangeReporter;
import org.waabox.consistency.ingest.ChangeSource;
import org.waabox.consistency.ingest.InvalidationEvent;

/**
 * HTTP backend channel, implementing {@link ChangeSource}.
 *
 * <p>Uses Java's built-in {@code com.sun.net.httpserver.HttpServer}. Backends
 * {@code POST} one JSON change record (see {@link ChangeEventCodec}) to the
 * configured path and get:
 * <ul>
 *   <li>{@code 202} when the change was accepted for dispatch,</li>
 *   <li>{@code 400} when the body is not a valid change record,</li>
 *   <li>{@code 405} for any method other than {@code POST},</li>
 *   <li>{@code 503} when the broker refuses the change.</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * Consistency consistency = Consistency.builder()
 *     .changeSource(new HttpIngestServer(HttpIngestConfig.create(1992)))
 *     .build();
 * consistency.start();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpIngestServer implements ChangeSource {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      HttpIngestServer.class);

  /** HTTP 202 Accepted status code. */
  private static final int HTTP_ACCEPTED = 202;

  /** HTTP 400 Bad Request status code. */
  private static final int HTTP_BAD_REQUEST = 400;

  /** HTTP 405 Method Not Allowed status code. */
  private static final int HTTP_METHOD_NOT_ALLOWED = 405;

  /** HTTP 500 Internal Server Error status code. */
  private static final int HTTP_INTERNAL_ERROR = 500;

  /** HTTP 503 Service Unavailable status code. */
  private static final int HTTP_UNAVAILABLE = 503;

  /** The delay in seconds before stopping the HTTP server. */
  private static final int SERVER_STOP_DELAY_SECONDS = 1;

  /** The configuration for this server. */
  private final HttpIngestConfig config;

  /** The reporter changes are forwarded to, set on start. */
  private volatile ChangeReporter reporter;

  /** The HTTP server for receiving change records. */
  private HttpServer server;

  /**
   * Creates a new HTTP ingest server with the given configuration.
   *
   * @param config the HTTP ingest configuration, never null
   */
  public HttpIngestServer(final HttpIngestConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
  }

  /**
   * Binds the HTTP endpoint and starts forwarding changes.
   *
   * @param theReporter the reporter to forward changes to, never null
   *
   * @throws ConsistencyException if the port cannot be bound
   */
  @Override
  public synchronized void start(final ChangeReporter theReporter) {
    reporter = Objects.requireNonNull(theReporter, "reporter cannot be null");
    try {
      server = HttpServer.create(new InetSocketAddress(config.port()), 0);
      server.createContext(config.path(), this::handleChange);
      server.start();
      log.info("HttpIngestServer started on port {} at path {}",
          localPort(), config.path());
    } catch (final IOException e) {
      throw ConsistencyException.bindFailed("HttpIngestServer",
          "port " + config.port(), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public synchronized void stop() {
    if (server != null) {
      server.stop(SERVER_STOP_DELAY_SECONDS);
      server = null;
      log.info("HttpIngestServer stopped");
    }
  }

  /**
   * Returns the bound port, useful when configured with port 0.
   *
   * @return the local port, or -1 if not started
   */
  public synchronized int localPort() {
    return server == null ? -1 : server.getAddress().getPort();
  }

  /**
   * Handles an incoming HTTP request on the change endpoint.
   *
   * @param exchange the HTTP exchange, never null
   * @throws IOException if reading the request body or sending the
   *     response fails
   */
  private void handleChange(final HttpExchange exchange) throws IOException {
    if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
      exchange.getResponseHeaders().add("Allow", "POST");
      sendResponse(exchange, HTTP_METHOD_NOT_ALLOWED, "Method Not Allowed");
      return;
    }

    final InvalidationEvent event;
    try (InputStream is = exchange.getRequestBody()) {
      final String body = new String(is.readAllBytes(),
          StandardCharsets.UTF_8);
      event = ChangeEventCodec.deserialize(body);
    } catch (final IllegalArgumentException e) {
      log.warn("Rejected malformed change record: {}", e.getMessage());
      sendResponse(exchange, HTTP_BAD_REQUEST, e.getMessage());
      return;
    }

    try {
      reporter.reportChange(event.uri(), event.payload());
      sendResponse(exchange, HTTP_ACCEPTED, "Accepted");
    } catch (final BackendUnavailableException e) {
      log.warn("Change for {} refused: {}", event.uri(), e.getMessage());
      sendResponse(exchange, HTTP_UNAVAILABLE, e.getMessage());
    } catch (final RuntimeException e) {
      log.error("Failed to handle change for {}", event.uri(), e);
      sendResponse(exchange, HTTP_INTERNAL_ERROR, "Internal Server Error");
    }
  }

  /**
   * Sends an HTTP response with the given status code and body.
   *
   * @param exchange   the HTTP exchange
   * @param statusCode the HTTP status code
   * @param body       the response body text
   * @throws IOException if writing the response fails
   */
  private static void sendResponse(final HttpExchange exchange,
      final int statusCode, final String body) throws IOException {
    final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type",
        "text/plain; charset=utf-8");
    exchange.sendResponseHeaders(statusCode, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}
