package org.waabox.consistency.server.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.waabox.consistency.ingest.http.HttpIngestConfig;
import org.waabox.consistency.ingest.http.HttpIngestServer;
import org.waabox.consistency.socket.SocketConfig;
import org.waabox.consistency.socket.SocketConnectionAcceptor;
import org.waabox.consistency.socket.SocketIngestServer;

/** Spring configuration that defines the network channels of the server.
 *
 * <p>The beans are picked up by the consistency-spring-boot-starter
 * auto-configuration through
 * {@link org.springframework.beans.factory.ObjectProvider} and started
 * together with the broker:
 * <ul>
 *   <li>{@link SocketIngestServer}, the raw socket backend channel</li>
 *   <li>{@link HttpIngestServer}, the HTTP backend channel</li>
 *   <li>{@link SocketConnectionAcceptor}, line-delimited TCP clients</li>
 * </ul>
 *
 * <p>Setting a channel's port to 0 leaves it out.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration
public class ServerConfig {

  /** Creates the socket backend channel.
   *
   * @param host the address to bind, never null
   * @param port the port to listen on
   *
   * @return the socket ingest server, never null
   */
  @Bean
  @ConditionalOnExpression(
      "${consistency.server.socket-ingest-port:1991} != 0")
  public SocketIngestServer socketIngestServer(
      @Value("${consistency.server.bind-host:0.0.0.0}") final String host,
      @Value("${consistency.server.socket-ingest-port:1991}")
          final int port) {
    return new SocketIngestServer(SocketConfig.create(host, port));
  }

  /** Creates the HTTP backend channel.
   *
   * @param port the port to listen on
   * @param path the path changes are posted to, never null
   *
   * @return the HTTP ingest server, never null
   */
  @Bean
  @ConditionalOnExpression(
      "${consistency.server.http-ingest-port:1992} != 0")
  public HttpIngestServer httpIngestServer(
      @Value("${consistency.server.http-ingest-port:1992}") final int port,
      @Value("${consistency.server.http-ingest-path:/consistency/changes}")
          final String path) {
    return new HttpIngestServer(HttpIngestConfig.create(port, path));
  }

  /** Creates the line-delimited TCP client transport.
   *
   * @param host the address to bind, never null
   * @param port the port to listen on
   *
   * @return the socket connection acceptor, never null
   */
  @Bean
  @ConditionalOnExpression(
      "${consistency.server.client-socket-port:4691} != 0")
  public SocketConnectionAcceptor socketConnectionAcceptor(
      @Value("${consistency.server.bind-host:0.0.0.0}") final String host,
      @Value("${consistency.server.client-socket-port:4691}")
          final int port) {
    return new SocketConnectionAcceptor(SocketConfig.create(host, port));
  }
}
