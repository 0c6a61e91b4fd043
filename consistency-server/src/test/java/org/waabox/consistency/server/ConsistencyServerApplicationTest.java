package org.waabox.consistency.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.ApplicationContext;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.waabox.consistency.Consistency;
import org.waabox.consistency.ingest.http.HttpIngestServer;
import org.waabox.consistency.protocol.ClientFrame;
import org.waabox.consistency.protocol.FrameCodec;
import org.waabox.consistency.protocol.OutboundMessage;
import org.waabox.consistency.socket.SocketConnectionAcceptor;
import org.waabox.consistency.socket.SocketIngestServer;

/** Boots the server with its network channels turned off and talks to it
 * over its WebSocket endpoint.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "consistency.server.socket-ingest-port=0",
        "consistency.server.http-ingest-port=0",
        "consistency.server.client-socket-port=0"
    })
class ConsistencyServerApplicationTest {

  @LocalServerPort
  private int port;

  @Autowired
  private Consistency consistency;

  @Autowired
  private ApplicationContext context;

  @Test
  void whenContextLoads_givenDisabledPorts_shouldLeaveChannelsOut() {
    assertEquals(0,
        context.getBeanNamesForType(SocketIngestServer.class).length);
    assertEquals(0,
        context.getBeanNamesForType(HttpIngestServer.class).length);
    assertEquals(0,
        context.getBeanNamesForType(SocketConnectionAcceptor.class).length);
    assertEquals(0, consistency.changeSources().size());
  }

  @Test
  void whenBackendReportsChange_givenWebSocketSubscriber_shouldInvalidate()
      throws Exception {
    final BlockingQueue<String> received = new LinkedBlockingQueue<>();
    final StandardWebSocketClient client = new StandardWebSocketClient();

    final WebSocketSession session = client.execute(
        new TextWebSocketHandler() {
          @Override
          protected void handleTextMessage(final WebSocketSession s,
              final TextMessage message) {
            received.add(message.getPayload());
          }
        }, "ws://localhost:" + port + "/consistency")
        .get(5, TimeUnit.SECONDS);

    try {
      session.sendMessage(new TextMessage(
          FrameCodec.encode(ClientFrame.subscribe("/articles/7"))));
      assertEquals(OutboundMessage.ack("/articles/7"), next(received));

      final byte[] payload = "v2".getBytes(StandardCharsets.UTF_8);
      consistency.reportChange("/articles/7", payload);

      assertEquals(OutboundMessage.invalidated("/articles/7", payload),
          next(received));
    } finally {
      session.close();
    }
  }

  private static OutboundMessage next(final BlockingQueue<String> received)
      throws InterruptedException {
    final String frame = received.poll(5, TimeUnit.SECONDS);
    assertNotNull(frame, "no frame received within 5s");
    return FrameCodec.decodeOutbound(frame);
  }
}
