package org.waabox.consistency.socket;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.consistency.Consistency;
import org.waabox.consistency.ConsistencyException;
import org.waabox.consistency.protocol.ClientFrame;
import org.waabox.consistency.protocol.FrameCodec;
import org.waabox.consistency.protocol.OutboundMessage;

/**
 * Tests for {@link SocketConnectionAcceptor}, end to end through a running
 * {@link Consistency} broker.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SocketConnectionAcceptorTest {

  private SocketConnectionAcceptor acceptor;
  private SocketIngestServer ingest;
  private Consistency consistency;

  @BeforeEach
  void setUp() {
    acceptor = new SocketConnectionAcceptor(
        SocketConfig.create("127.0.0.1", 0));
    ingest = new SocketIngestServer(SocketConfig.create("127.0.0.1", 0));
    consistency = Consistency.builder()
        .acceptor(acceptor)
        .changeSource(ingest)
        .build();
    consistency.start();
  }

  @AfterEach
  void tearDown() {
    consistency.stop();
  }

  private static void sendLine(final Socket socket, final String line)
      throws Exception {
    final OutputStream out = socket.getOutputStream();
    out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
    out.flush();
  }

  private static BufferedReader reader(final Socket socket) throws Exception {
    return new BufferedReader(new InputStreamReader(socket.getInputStream(),
        StandardCharsets.UTF_8));
  }

  @Test
  void whenBackendReportsChange_givenSubscribedClient_shouldInvalidate()
      throws Exception {
    try (Socket client = new Socket("127.0.0.1", acceptor.localPort());
         Socket backend = new Socket("127.0.0.1", ingest.localPort())) {
      client.setSoTimeout(5_000);
      final BufferedReader in = reader(client);

      sendLine(client, FrameCodec.encode(ClientFrame.subscribe("/orders/42")));
      assertEquals(OutboundMessage.ack("/orders/42"),
          FrameCodec.decodeOutbound(in.readLine()));

      sendLine(backend, "{\"uri\":\"/orders/42\"}");

      assertEquals(OutboundMessage.invalidated("/orders/42", null),
          FrameCodec.decodeOutbound(in.readLine()));
    }
  }

  @Test
  void whenClientSendsGarbage_givenOpenConnection_shouldReplyErrorAndStay()
      throws Exception {
    try (Socket client = new Socket("127.0.0.1", acceptor.localPort())) {
      client.setSoTimeout(5_000);
      final BufferedReader in = reader(client);

      sendLine(client, "hello");
      final OutboundMessage error = FrameCodec.decodeOutbound(in.readLine());
      assertEquals(OutboundMessage.Type.ERROR, error.type());

      sendLine(client, "{\"v\":1,\"type\":\"subscribe\",\"uri\":\"/a\"}");
      assertEquals(OutboundMessage.ack("/a"),
          FrameCodec.decodeOutbound(in.readLine()));
    }
  }

  @Test
  void whenClientDisconnects_givenSubscription_shouldReleaseIt()
      throws Exception {
    try (Socket client = new Socket("127.0.0.1", acceptor.localPort())) {
      client.setSoTimeout(5_000);
      sendLine(client, FrameCodec.encode(ClientFrame.subscribe("/a")));
      reader(client).readLine();
      assertEquals(1, consistency.registry().resourceCount());
    }

    final long deadline = System.currentTimeMillis() + 5_000;
    while (consistency.sessionCount() > 0
        && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertEquals(0, consistency.sessionCount());
    assertEquals(0, consistency.registry().resourceCount());
  }

  @Test
  void whenClientSendsClose_givenOpenConnection_shouldCloseSocket()
      throws Exception {
    try (Socket client = new Socket("127.0.0.1", acceptor.localPort())) {
      client.setSoTimeout(5_000);
      final BufferedReader in = reader(client);

      sendLine(client, FrameCodec.encode(ClientFrame.close()));

      assertNull(in.readLine());
    }
    assertTrue(acceptor.localPort() > 0);
  }

  @Test
  void whenClientSendsOversizedFrame_givenFrameLimit_shouldEndSession()
      throws Exception {
    final SocketConnectionAcceptor strict = new SocketConnectionAcceptor(
        SocketConfig.create("127.0.0.1", 0, 64));
    final Consistency broker = Consistency.builder().acceptor(strict).build();
    broker.start();
    try (Socket client = new Socket("127.0.0.1", strict.localPort())) {
      client.setSoTimeout(5_000);
      sendLine(client, FrameCodec.encode(ClientFrame.subscribe("/a")));
      assertEquals(OutboundMessage.ack("/a"),
          FrameCodec.decodeOutbound(reader(client).readLine()));

      sendLine(client, FrameCodec.encode(
          ClientFrame.subscribe("/" + "x".repeat(500))));

      final long deadline = System.currentTimeMillis() + 5_000;
      while (broker.sessionCount() > 0
          && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
      assertEquals(0, broker.sessionCount());
      assertEquals(0, broker.registry().resourceCount());
    } finally {
      broker.stop();
    }
  }

  @Test
  void whenStarting_givenPortInUse_shouldThrowConsistencyException() {
    final SocketConnectionAcceptor second = new SocketConnectionAcceptor(
        SocketConfig.create("127.0.0.1", acceptor.localPort()));

    final ConsistencyException e = assertThrows(ConsistencyException.class,
        () -> second.start(connection -> { }));
    assertEquals("consistency-client-accept", e.channel());
  }
}
