package org.waabox.consistency.ingest.kafka;

import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.consistency.ingest.BackendUnavailableException;
import org.waabox.consistency.ingest.ChangeEventCodec;
import org.waabox.consistency.ingest.ChangeReporter;
import org.waabox.consistency.ingest.InvalidationEvent;

/** Backend-side {@link ChangeReporter} that publishes change records to the
 * topic read by {@link KafkaIngestSource}.
 *
 * <p>Records are keyed by URI so that changes to the same resource stay in
 * one partition. Each call waits for the broker acknowledgement up to the
 * configured send timeout.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaChangeReporter implements ChangeReporter,
    AutoCloseable {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      KafkaChangeReporter.class);

  /** The Kafka configuration, never null. */
  private final KafkaIngestConfig config;

  /** The Kafka producer, never null. */
  private final Producer<String, String> producer;

  /** Creates a reporter with its own Kafka producer.
   *
   * @param theConfig the Kafka ingest configuration, never null
   */
  public KafkaChangeReporter(final KafkaIngestConfig theConfig) {
    this(theConfig, createProducer(theConfig));
  }

  /** Creates a reporter on an existing producer.
   *
   * @param theConfig the Kafka ingest configuration, never null
   * @param theProducer the producer to send with, never null
   */
  public KafkaChangeReporter(final KafkaIngestConfig theConfig,
      final Producer<String, String> theProducer) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    producer = Objects.requireNonNull(theProducer,
        "producer must not be null");
  }

  /** {@inheritDoc}
   *
   * @throws BackendUnavailableException if Kafka does not acknowledge the
   *     record within the send timeout
   */
  @Override
  public void reportChange(final String uri, final byte[] payload) {
    Objects.requireNonNull(uri, "uri must not be null");

    final String json = ChangeEventCodec.serialize(
        new InvalidationEvent(uri, payload));
    final ProducerRecord<String, String> record = new ProducerRecord<>(
        config.topic(), uri, json);

    try {
      final RecordMetadata metadata = producer.send(record)
          .get(config.sendTimeout().toMillis(), TimeUnit.MILLISECONDS);
      log.debug("Published change for '{}' to partition {} offset {}", uri,
          metadata.partition(), metadata.offset());
    } catch (final ExecutionException e) {
      throw new BackendUnavailableException("Failed to publish change for "
          + uri + ": " + e.getCause().getMessage(), e.getCause());
    } catch (final TimeoutException e) {
      throw new BackendUnavailableException("Timed out publishing change for "
          + uri + " after " + config.sendTimeout(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendUnavailableException(
          "Interrupted while publishing change for " + uri, e);
    } catch (final RuntimeException e) {
      throw new BackendUnavailableException("Failed to publish change for "
          + uri + ": " + e.getMessage(), e);
    }
  }

  /** Closes the underlying producer. */
  @Override
  public void close() {
    producer.close();
  }

  /** Creates a new Kafka producer configured with string serializers.
   *
   * @param config the Kafka ingest configuration, never null
   * @return the Kafka producer, never null
   */
  private static Producer<String, String> createProducer(
      final KafkaIngestConfig config) {
    final Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,
        config.bootstrapServers());
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "1");
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG,
        String.valueOf(config.sendTimeout().toMillis()));
    return new KafkaProducer<>(props);
  }
}
