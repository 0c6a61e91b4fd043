package org.waabox.consistency.ingest.kafka;

import java.time.Duration;
import java.util.Collections;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.consistency.ingest.BackendUnavailableException;
import org.waabox.consistency.ingest.ChangeEventCodec;
import org.waabox.consistency.ingest.ChangeReporter;
import org.waabox.consistency.ingest.ChangeSource;
import org.waabox.consistency.ingest.InvalidationEvent;

/** Kafka backend channel, implementing {@link ChangeSource}.
 *
 * <p>Consumes change records from a topic and reports each one to the
 * broker. The record value is a JSON change record (see
 * {@link ChangeEventCodec}); when the value is empty the record key is taken
 * as the URI. Each instance uses a unique consumer group so every broker
 * receives every change.
 *
 * <p>Typical usage:
 * <pre>
 *   Consistency consistency = Consistency.builder()
 *       .changeSource(new KafkaIngestSource(
 *           KafkaIngestConfig.create("localhost:9092")))
 *       .build();
 *   consistency.start();
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaIngestSource implements ChangeSource {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      KafkaIngestSource.class);

  /** Poll timeout for the Kafka consumer loop. */
  private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

  /** The Kafka configuration, never null. */
  private final KafkaIngestConfig config;

  /** Creates the consumer on start, never null. */
  private final Supplier<Consumer<String, String>> consumerFactory;

  /** Flag indicating whether the poll loop is running. */
  private final AtomicBoolean running = new AtomicBoolean(false);

  /** The reporter changes are forwarded to, set on start. */
  private volatile ChangeReporter reporter;

  /** The Kafka consumer, created on {@link #start(ChangeReporter)}. */
  private volatile Consumer<String, String> consumer;

  /** The daemon thread running the consumer poll loop. */
  private volatile Thread pollThread;

  /** Creates a new KafkaIngestSource with the given configuration.
   *
   * @param theConfig the Kafka ingest configuration, never null
   */
  public KafkaIngestSource(final KafkaIngestConfig theConfig) {
    this(theConfig, () -> createConsumer(theConfig));
  }

  /** Creates a new KafkaIngestSource with a custom consumer factory.
   *
   * <p>Package-private for testability.
   *
   * @param theConfig the Kafka ingest configuration, never null
   * @param theConsumerFactory creates the consumer, never null
   */
  KafkaIngestSource(final KafkaIngestConfig theConfig,
      final Supplier<Consumer<String, String>> theConsumerFactory) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    consumerFactory = Objects.requireNonNull(theConsumerFactory,
        "consumerFactory must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public void start(final ChangeReporter theReporter) {
    Objects.requireNonNull(theReporter, "reporter must not be null");
    if (running.getAndSet(true)) {
      log.warn("KafkaIngestSource is already running");
      return;
    }
    reporter = theReporter;

    consumer = consumerFactory.get();
    consumer.subscribe(Collections.singletonList(config.topic()));

    pollThread = new Thread(this::pollLoop, "consistency-kafka-ingest-poll");
    pollThread.setDaemon(true);
    pollThread.start();

    log.info("KafkaIngestSource started on topic '{}' with bootstrap servers "
        + "'{}'", config.topic(), config.bootstrapServers());
  }

  /** {@inheritDoc} */
  @Override
  public void stop() {
    if (!running.getAndSet(false)) {
      return;
    }

    log.info("Stopping KafkaIngestSource...");

    if (consumer != null) {
      consumer.wakeup();
    }

    if (pollThread != null) {
      try {
        pollThread.join(5_000);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for poll thread to stop");
      }
    }

    closeQuietly(consumer, "consumer");
    consumer = null;
    pollThread = null;

    log.info("KafkaIngestSource stopped");
  }

  /** Parses one record and reports the change it carries.
   *
   * <p>Package-private for testability.
   *
   * @param record the consumed record, never null
   * @param target the reporter to forward to, never null
   * @return true if the change was reported
   */
  boolean handleRecord(final ConsumerRecord<String, String> record,
      final ChangeReporter target) {
    final InvalidationEvent event;
    try {
      event = toEvent(record);
    } catch (final IllegalArgumentException e) {
      log.error("Skipping change record from partition {} offset {}: {}",
          record.partition(), record.offset(), e.getMessage());
      return false;
    }
    try {
      target.reportChange(event.uri(), event.payload());
      return true;
    } catch (final BackendUnavailableException e) {
      log.warn("Change for {} refused: {}", event.uri(), e.getMessage());
      return false;
    }
  }

  /** Reads the change carried by a record.
   *
   * @param record the consumed record.
   * @return the event, never null.
   * @throws IllegalArgumentException if the record carries no change.
   */
  private static InvalidationEvent toEvent(
      final ConsumerRecord<String, String> record) {
    final String value = record.value();
    if (value == null || value.isBlank()) {
      final String key = record.key();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("record has neither value nor key");
      }
      return InvalidationEvent.of(key);
    }
    return ChangeEventCodec.deserialize(value);
  }

  /** The main consumer poll loop. Runs in a daemon thread until
   * {@link #stop()} is called.
   */
  private void pollLoop() {
    try {
      while (running.get()) {
        final ConsumerRecords<String, String> records =
            consumer.poll(POLL_TIMEOUT);
        for (final ConsumerRecord<String, String> record : records) {
          handleRecord(record, reporter);
        }
      }
    } catch (final WakeupException e) {
      if (running.get()) {
        throw e;
      }
      log.debug("Poll loop woken up for shutdown");
    }
  }

  /** Creates a new Kafka consumer configured with string deserializers
   * and a unique consumer group for broadcast semantics.
   *
   * @param config the Kafka ingest configuration, never null
   * @return the Kafka consumer, never null
   */
  private static Consumer<String, String> createConsumer(
      final KafkaIngestConfig config) {
    final String groupId = config.consumerGroupPrefix()
        + UUID.randomUUID();

    final Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
        config.bootstrapServers());
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    return new KafkaConsumer<>(props);
  }

  /** Closes an AutoCloseable resource quietly, logging any errors.
   *
   * @param closeable the resource to close, may be null
   * @param name the name for logging purposes, never null
   */
  private static void closeQuietly(final AutoCloseable closeable,
      final String name) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (final Exception e) {
        log.warn("Error closing {}: {}", name, e.getMessage(), e);
      }
    }
  }
}
