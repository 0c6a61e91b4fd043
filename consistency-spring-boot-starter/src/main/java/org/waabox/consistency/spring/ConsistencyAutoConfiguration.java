package org.waabox.consistency.spring;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.consistency.Consistency;
import org.waabox.consistency.ingest.ChangeSource;
import org.waabox.consistency.metrics.ConsistencyMetrics;
import org.waabox.consistency.transport.ConnectionAcceptor;

/**
 * Spring Boot auto-configuration for the Consistency invalidation broker.
 *
 * <p>This configuration creates and manages a singleton {@link Consistency}
 * instance built from {@link ConsistencyProperties}. Every
 * {@link ConnectionAcceptor} and {@link ChangeSource} bean in the
 * application context is added to the broker; an optional
 * {@link ConsistencyMetrics} bean replaces the no-op reporter.
 *
 * <p>The broker lifecycle (start/stop) is managed through Spring's
 * {@link SmartLifecycle}, starting after every other bean is ready.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(ConsistencyProperties.class)
public class ConsistencyAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ConsistencyAutoConfiguration.class);

  /**
   * Creates the singleton {@link Consistency} bean.
   *
   * @param properties        the configuration properties, never null
   * @param metricsProvider   provider for an optional ConsistencyMetrics bean
   * @param acceptorProvider  provider for the client transports
   * @param sourceProvider    provider for the backend channels
   *
   * @return the configured broker, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public Consistency consistency(
      final ConsistencyProperties properties,
      final ObjectProvider<ConsistencyMetrics> metricsProvider,
      final ObjectProvider<ConnectionAcceptor> acceptorProvider,
      final ObjectProvider<ChangeSource> sourceProvider) {

    requireAtMostOne(metricsProvider, ConsistencyMetrics.class);

    final Consistency.Builder builder = Consistency.builder()
        .settings(properties.toSettings());

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Consistency using custom ConsistencyMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    acceptorProvider.orderedStream().forEach(acceptor -> {
      builder.acceptor(acceptor);
      log.info("Consistency using ConnectionAcceptor: {}",
          acceptor.getClass().getSimpleName());
    });

    sourceProvider.orderedStream().forEach(source -> {
      builder.changeSource(source);
      log.info("Consistency using ChangeSource: {}",
          source.getClass().getSimpleName());
    });

    final Consistency consistency = builder.build();
    log.info("Consistency created with {}", consistency.settings());
    return consistency;
  }

  /**
   * Creates a {@link SmartLifecycle} bean that manages the broker
   * start/stop lifecycle.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1})
   * to ensure all other beans are initialized first, and stops early
   * for the same reason.
   *
   * @param consistency the broker to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle consistencyLifecycle(final Consistency consistency) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting Consistency lifecycle...");
        consistency.start();
        running = true;
        log.info("Consistency lifecycle started successfully.");
      }

      @Override
      public void stop() {
        log.info("Stopping Consistency lifecycle...");
        consistency.stop();
        running = false;
        log.info("Consistency lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Consistency requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
