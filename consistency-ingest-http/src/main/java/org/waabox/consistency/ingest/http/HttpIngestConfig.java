package org.waabox.consistency.ingest.http;

/**
 * Configuration holder for the HTTP backend channel.
 *
 * <p>Holds the port to listen on and the HTTP path where backends post
 * change records.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpIngestConfig {

  /** The default port for backend change records. */
  public static final int DEFAULT_PORT = 1992;

  /** The default HTTP path for change records. */
  public static final String DEFAULT_PATH = "/consistency/changes";

  /** The port to listen on. */
  private final int port;

  /** The HTTP path for the change endpoint. */
  private final String path;

  /** Private constructor; use the static factory methods instead. */
  private HttpIngestConfig(final int port, final String path) {
    this.port = port;
    this.path = path;
  }

  /**
   * Creates a new configuration with the given port, using the default
   * path ({@value #DEFAULT_PATH}).
   *
   * @param port the port to listen on, 0 for an ephemeral port
   * @return a new {@link HttpIngestConfig} instance, never null
   */
  public static HttpIngestConfig create(final int port) {
    return create(port, DEFAULT_PATH);
  }

  /**
   * Creates a new configuration with the given port and path.
   *
   * @param port the port to listen on, 0 for an ephemeral port
   * @param path the HTTP path for the change endpoint, never null
   * @return a new {@link HttpIngestConfig} instance, never null
   */
  public static HttpIngestConfig create(final int port, final String path) {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port: " + port);
    }
    if (path == null || !path.startsWith("/")) {
      throw new IllegalArgumentException(
          "path must start with '/', got: " + path);
    }
    return new HttpIngestConfig(port, path);
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
   * Returns the HTTP path for the change endpoint.
   *
   * @return the path, never null
   */
  public String path() {
    return path;
  }
}
