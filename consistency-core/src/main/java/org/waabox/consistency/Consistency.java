package org.waabox.consistency;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.consistency.ingest.BackendIngest;
import org.waabox.consistency.ingest.ChangeReporter;
import org.waabox.consistency.ingest.ChangeSource;
import org.waabox.consistency.metrics.ConsistencyMetrics;
import org.waabox.consistency.metrics.NoopConsistencyMetrics;
import org.waabox.consistency.transport.ClientConnection;
import org.waabox.consistency.transport.ConnectionAcceptor;

/**
 * The main entry point of the Consistency invalidation broker.
 *
 * <p>Consistency wires the {@link SubscriptionRegistry}, the
 * {@link ConnectionManager}, the {@link Dispatcher} and the
 * {@link BackendIngest} together, and drives the lifecycle of the configured
 * client transports ({@link ConnectionAcceptor}) and backend channels
 * ({@link ChangeSource}).
 *
 * <p>Instances are created through the fluent {@link Builder} starting with
 * {@link #builder()}.
 *
 * <p>Usage example:
 * <pre>{@code
 * Consistency consistency = Consistency.builder()
 *     .settings(BrokerSettings.defaults())
 *     .acceptor(new SocketConnectionAcceptor(SocketConfig.create(4691)))
 *     .changeSource(new SocketIngestServer(SocketConfig.create(1991)))
 *     .build();
 *
 * consistency.start();
 *
 * // In-process backend:
 * consistency.reportChange("/orders/42");
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Consistency implements ChangeReporter {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      Consistency.class);

  /** The broker settings. */
  private final BrokerSettings settings;

  /** The subscription registry. */
  private final SubscriptionRegistry registry;

  /** The session owner. */
  private final ConnectionManager connectionManager;

  /** The backend ingest. */
  private final BackendIngest ingest;

  /** The client transports. */
  private final List<ConnectionAcceptor> acceptors;

  /** The backend channels. */
  private final List<ChangeSource> changeSources;

  /** Whether this instance has been started. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether this instance has been stopped. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /**
   * Creates a new broker.
   *
   * @param theSettings      the broker settings, never null
   * @param metrics          the metrics reporter, never null
   * @param theAcceptors     the client transports, never null
   * @param theChangeSources the backend channels, never null
   */
  private Consistency(final BrokerSettings theSettings,
      final ConsistencyMetrics metrics,
      final List<ConnectionAcceptor> theAcceptors,
      final List<ChangeSource> theChangeSources) {
    settings = theSettings;
    registry = new SubscriptionRegistry();
    final SessionTable sessions = new SessionTable();
    connectionManager = new ConnectionManager(registry, sessions, settings,
        metrics);
    final Dispatcher dispatcher = new Dispatcher(registry, sessions, metrics);
    ingest = new BackendIngest(dispatcher::dispatch, settings, metrics);
    acceptors = List.copyOf(theAcceptors);
    changeSources = List.copyOf(theChangeSources);
  }

  /**
   * Creates a new builder for constructing a Consistency instance.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the broker.
   *
   * <p>This method performs the following steps in order:
   * <ol>
   *   <li>Starts the backend ingest so changes can be accepted.</li>
   *   <li>Starts every change source, forwarding to this broker.</li>
   *   <li>Starts every connection acceptor.</li>
   * </ol>
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException(
          "Consistency has already been started");
    }
    ingest.start();
    for (final ChangeSource source : changeSources) {
      source.start(this);
    }
    for (final ConnectionAcceptor acceptor : acceptors) {
      acceptor.start(this::acceptQuietly);
    }
    log.info("Consistency started with {} acceptor(s), {} change source(s)"
        + " and {}", acceptors.size(), changeSources.size(), settings);
  }

  /**
   * Reports a backend change.
   *
   * @param uri     the changed resource URI, never null
   * @param payload an optional payload forwarded best-effort, may be null
   *
   * @throws org.waabox.consistency.ingest.BackendUnavailableException if
   *     the broker is not running or its pending queue is full
   */
  @Override
  public void reportChange(final String uri, final byte[] payload) {
    ingest.reportChange(uri, payload);
  }

  /**
   * Hands a client connection to the broker.
   *
   * <p>Transports that are not driven by a {@link ConnectionAcceptor}, such
   * as a WebSocket endpoint managed by a web container, call this method
   * directly.
   *
   * @param connection the connection, never null
   * @return the session created for the connection, never null
   *
   * @throws IllegalStateException if the broker is stopped
   */
  public Session accept(final ClientConnection connection) {
    return connectionManager.accept(connection);
  }

  /**
   * Stops the broker: acceptors, change sources, the ingest and every
   * session, in that order. Idempotent.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    for (final ConnectionAcceptor acceptor : acceptors) {
      try {
        acceptor.stop();
      } catch (final RuntimeException e) {
        log.warn("Error stopping acceptor {}: {}",
            acceptor.getClass().getSimpleName(), e.getMessage(), e);
      }
    }
    for (final ChangeSource source : changeSources) {
      try {
        source.stop();
      } catch (final RuntimeException e) {
        log.warn("Error stopping change source {}: {}",
            source.getClass().getSimpleName(), e.getMessage(), e);
      }
    }
    ingest.stop();
    connectionManager.stop();
    log.info("Consistency stopped");
  }

  /**
   * Returns the subscription registry.
   *
   * @return the registry, never null
   */
  public SubscriptionRegistry registry() {
    return registry;
  }

  /**
   * Returns the number of connected sessions.
   *
   * @return the session count
   */
  public int sessionCount() {
    return connectionManager.sessionCount();
  }

  /**
   * Returns the broker settings.
   *
   * @return the settings, never null
   */
  public BrokerSettings settings() {
    return settings;
  }

  /**
   * Returns the configured connection acceptors.
   *
   * @return an unmodifiable list, never null
   */
  public List<ConnectionAcceptor> acceptors() {
    return acceptors;
  }

  /**
   * Returns the configured change sources.
   *
   * @return an unmodifiable list, never null
   */
  public List<ChangeSource> changeSources() {
    return changeSources;
  }

  /** Accepts a connection from an acceptor thread, logging refusals.
   *
   * @param connection the accepted connection.
   */
  private void acceptQuietly(final ClientConnection connection) {
    try {
      connectionManager.accept(connection);
    } catch (final IllegalStateException e) {
      log.debug("Refused {}: {}", connection.remoteAddress(),
          e.getMessage());
    }
  }

  /**
   * Fluent builder for constructing {@link Consistency} instances.
   */
  public static final class Builder {

    /** The broker settings, defaults if not set. */
    private BrokerSettings settings = BrokerSettings.defaults();

    /** The metrics reporter, no-op if not set. */
    private ConsistencyMetrics metrics = new NoopConsistencyMetrics();

    /** The client transports. */
    private final List<ConnectionAcceptor> acceptors = new ArrayList<>();

    /** The backend channels. */
    private final List<ChangeSource> changeSources = new ArrayList<>();

    /** Creates a new builder. */
    private Builder() {
    }

    /**
     * Sets the broker settings.
     *
     * @param theSettings the settings, never null
     * @return this builder, never null
     */
    public Builder settings(final BrokerSettings theSettings) {
      settings = Objects.requireNonNull(theSettings,
          "settings must not be null");
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     * @return this builder, never null
     */
    public Builder metrics(final ConsistencyMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Adds a client transport.
     *
     * @param acceptor the acceptor, never null
     * @return this builder, never null
     */
    public Builder acceptor(final ConnectionAcceptor acceptor) {
      acceptors.add(Objects.requireNonNull(acceptor,
          "acceptor must not be null"));
      return this;
    }

    /**
     * Adds a backend channel.
     *
     * @param source the change source, never null
     * @return this builder, never null
     */
    public Builder changeSource(final ChangeSource source) {
      changeSources.add(Objects.requireNonNull(source,
          "changeSource must not be null"));
      return this;
    }

    /**
     * Builds the broker. The broker is not started.
     *
     * @return the new broker, never null
     */
    public Consistency build() {
      return new Consistency(settings, metrics, acceptors, changeSources);
    }
  }
}
