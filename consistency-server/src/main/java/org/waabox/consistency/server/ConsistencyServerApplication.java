package org.waabox.consistency.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot entry point of the Consistency server.
 *
 * <p>Serves browser clients over WebSocket and, depending on
 * {@code consistency.server.*}, line-delimited socket clients plus the
 * socket and HTTP backend channels.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class ConsistencyServerApplication {

  /** Launches the server.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(ConsistencyServerApplication.class, args);
  }
}
