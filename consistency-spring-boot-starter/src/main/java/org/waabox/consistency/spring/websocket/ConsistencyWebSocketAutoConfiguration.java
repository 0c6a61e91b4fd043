package org.waabox.consistency.spring.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.waabox.consistency.Consistency;
import org.waabox.consistency.spring.ConsistencyAutoConfiguration;
import org.waabox.consistency.spring.ConsistencyProperties;

/**
 * Registers {@link ConsistencyWebSocketHandler} as a WebSocket endpoint in
 * servlet web applications.
 *
 * <p>The endpoint is served at {@code consistency.websocket.path} and can be
 * turned off with {@code consistency.websocket.enabled=false}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration(after = ConsistencyAutoConfiguration.class)
@ConditionalOnClass(WebSocketConfigurer.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnBean(Consistency.class)
@ConditionalOnProperty(prefix = "consistency.websocket", name = "enabled",
    havingValue = "true", matchIfMissing = true)
@EnableWebSocket
public class ConsistencyWebSocketAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ConsistencyWebSocketAutoConfiguration.class);

  /**
   * Creates the WebSocket handler bound to the broker.
   *
   * @param consistency the broker, never null
   *
   * @return the handler, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public ConsistencyWebSocketHandler consistencyWebSocketHandler(
      final Consistency consistency) {
    return new ConsistencyWebSocketHandler(consistency);
  }

  /**
   * Registers the handler under the configured path and origins.
   *
   * @param handler    the WebSocket handler, never null
   * @param properties the configuration properties, never null
   *
   * @return the configurer, never null
   */
  @Bean
  public WebSocketConfigurer consistencyWebSocketConfigurer(
      final ConsistencyWebSocketHandler handler,
      final ConsistencyProperties properties) {
    final ConsistencyProperties.Websocket websocket =
        properties.getWebsocket();
    return registry -> {
      registry.addHandler(handler, websocket.getPath())
          .setAllowedOriginPatterns(
              websocket.getAllowedOrigins().toArray(new String[0]));
      log.info("Consistency WebSocket endpoint registered at {}",
          websocket.getPath());
    };
  }
}
