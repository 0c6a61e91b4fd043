package org.waabox.consistency.ingest.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.consistency.ingest.BackendUnavailableException;
import org.waabox.consistency.ingest.ChangeEventCodec;
import org.waabox.consistency.ingest.ChangeReporter;
import org.waabox.consistency.ingest.InvalidationEvent;

/**
 * Backend-side {@link ChangeReporter} that posts change records to a remote
 * {@link HttpIngestServer}.
 *
 * <p>Each call is a synchronous {@code POST}; the change is accepted once the
 * broker answers with a 2xx status.
 *
 * <p>Typical usage:
 * <pre>{@code
 * ChangeReporter reporter = new HttpChangeReporter(
 *     URI.create("http://broker:1992/consistency/changes"));
 * orderRepository.save(order);
 * reporter.reportChange("/orders/" + order.id());
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpChangeReporter implements ChangeReporter {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      HttpChangeReporter.class);

  /** The default request timeout. */
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

  /** The endpoint of the broker, never null. */
  private final URI endpoint;

  /** The request timeout, never null. */
  private final Duration timeout;

  /** The HTTP client, never null. */
  private final HttpClient client;

  /**
   * Creates a reporter with the default timeout of 5 seconds.
   *
   * @param endpoint the full URL of the broker change endpoint, never null
   */
  public HttpChangeReporter(final URI endpoint) {
    this(endpoint, DEFAULT_TIMEOUT);
  }

  /**
   * Creates a reporter.
   *
   * @param endpoint the full URL of the broker change endpoint, never null
   * @param timeout  the connect and request timeout, never null
   */
  public HttpChangeReporter(final URI endpoint, final Duration timeout) {
    this.endpoint = Objects.requireNonNull(endpoint,
        "endpoint cannot be null");
    this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
    client = HttpClient.newBuilder().connectTimeout(timeout).build();
  }

  /**
   * {@inheritDoc}
   *
   * @throws BackendUnavailableException if the broker cannot be reached or
   *     does not accept the change
   */
  @Override
  public void reportChange(final String uri, final byte[] payload) {
    Objects.requireNonNull(uri, "uri cannot be null");

    final String json = ChangeEventCodec.serialize(
        new InvalidationEvent(uri, payload));
    final HttpRequest request = HttpRequest.newBuilder()
        .uri(endpoint)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json))
        .build();

    final HttpResponse<String> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (final IOException e) {
      throw new BackendUnavailableException(
          "Failed to report change for " + uri + " to " + endpoint, e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendUnavailableException(
          "Interrupted while reporting change for " + uri, e);
    }

    final int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new BackendUnavailableException("Broker " + endpoint
          + " responded with status " + status + " for " + uri + ": "
          + response.body());
    }
    log.debug("Reported change for {} to {}", uri, endpoint);
  }
}
