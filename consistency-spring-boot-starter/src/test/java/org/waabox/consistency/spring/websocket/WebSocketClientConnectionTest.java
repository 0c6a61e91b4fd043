package org.waabox.consistency.spring.websocket;

import static org.easymock.EasyMock.createNiceMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

/**
 * Tests for {@link WebSocketClientConnection}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class WebSocketClientConnectionTest {

  private WebSocketClientConnection connection() {
    final WebSocketSession session = createNiceMock(WebSocketSession.class);
    expect(session.getId()).andReturn("ws-1").anyTimes();
    replay(session);
    return new WebSocketClientConnection(session);
  }

  @Test
  void whenReceiving_givenEmptyMessage_shouldNotReportEndOfStream() {
    final WebSocketClientConnection connection = connection();
    connection.deliver("");
    connection.deliver(new String(""));
    connection.deliver("{\"action\":\"subscribe\",\"uri\":\"/a\"}");

    assertEquals("", connection.receive());
    assertEquals("", connection.receive());
    assertEquals("{\"action\":\"subscribe\",\"uri\":\"/a\"}",
        connection.receive());
  }

  @Test
  void whenReceiving_givenEndOfStream_shouldKeepReportingIt() {
    final WebSocketClientConnection connection = connection();
    connection.deliver("first");
    connection.endOfStream();
    connection.deliver("late");

    assertEquals("first", connection.receive());
    assertNull(connection.receive());
    assertNull(connection.receive());
  }
}
