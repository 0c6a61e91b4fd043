package org.waabox.consistency.ingest.kafka;

import java.time.Duration;
import java.util.Objects;

/** Configuration for the Kafka backend channel.
 *
 * <p>Holds the bootstrap servers, the topic carrying change records, the
 * consumer group prefix and the send timeout of {@link KafkaChangeReporter}.
 * Each broker instance uses a unique consumer group (prefix + random UUID)
 * so that every broker sees every change.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaIngestConfig {

  /** The default topic name for change records. */
  public static final String DEFAULT_TOPIC = "consistency-changes";

  /** The default consumer group prefix. */
  public static final String DEFAULT_CONSUMER_GROUP_PREFIX = "consistency-";

  /** The default send timeout of the backend-side reporter. */
  private static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(5);

  /** The Kafka bootstrap servers, never null. */
  private final String bootstrapServers;

  /** The topic name, never null. */
  private final String topic;

  /** The consumer group prefix, never null. */
  private final String consumerGroupPrefix;

  /** How long a reporter waits for the broker acknowledgement. */
  private final Duration sendTimeout;

  /** Creates a new configuration.
   *
   * @param theBootstrapServers the Kafka bootstrap servers, never null
   * @param theTopic the topic name, never null
   * @param theConsumerGroupPrefix the consumer group prefix, never null
   * @param theSendTimeout the send timeout, never null
   */
  private KafkaIngestConfig(final String theBootstrapServers,
      final String theTopic, final String theConsumerGroupPrefix,
      final Duration theSendTimeout) {
    bootstrapServers = Objects.requireNonNull(theBootstrapServers,
        "bootstrapServers must not be null");
    topic = Objects.requireNonNull(theTopic, "topic must not be null");
    consumerGroupPrefix = Objects.requireNonNull(theConsumerGroupPrefix,
        "consumerGroupPrefix must not be null");
    sendTimeout = Objects.requireNonNull(theSendTimeout,
        "sendTimeout must not be null");
  }

  /** Creates a configuration with the default topic, prefix and timeout.
   *
   * @param bootstrapServers the Kafka bootstrap servers, never null
   * @return a new configuration, never null
   */
  public static KafkaIngestConfig create(final String bootstrapServers) {
    return new KafkaIngestConfig(bootstrapServers, DEFAULT_TOPIC,
        DEFAULT_CONSUMER_GROUP_PREFIX, DEFAULT_SEND_TIMEOUT);
  }

  /** Creates a configuration with custom values.
   *
   * @param bootstrapServers the Kafka bootstrap servers, never null
   * @param topic the topic name, never null
   * @param consumerGroupPrefix the consumer group prefix, never null
   * @param sendTimeout the send timeout of the reporter, never null
   * @return a new configuration, never null
   */
  public static KafkaIngestConfig create(final String bootstrapServers,
      final String topic, final String consumerGroupPrefix,
      final Duration sendTimeout) {
    return new KafkaIngestConfig(bootstrapServers, topic,
        consumerGroupPrefix, sendTimeout);
  }

  /** Returns the Kafka bootstrap servers.
   *
   * @return the bootstrap servers, never null
   */
  public String bootstrapServers() {
    return bootstrapServers;
  }

  /** Returns the topic name.
   *
   * @return the topic, never null
   */
  public String topic() {
    return topic;
  }

  /** Returns the consumer group prefix.
   *
   * @return the prefix, never null
   */
  public String consumerGroupPrefix() {
    return consumerGroupPrefix;
  }

  /** Returns the send timeout of the backend-side reporter.
   *
   * @return the timeout, never null
   */
  public Duration sendTimeout() {
    return sendTimeout;
  }
}
