package org.waabox.consistency.spring.websocket;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.waabox.consistency.Consistency;

/**
 * Bridges Spring WebSocket sessions to a {@link Consistency} broker.
 *
 * <p>Each WebSocket session becomes a {@link WebSocketClientConnection}
 * handed to {@link Consistency#accept}; the broker then drives it like any
 * other transport. Text messages are client frames, one per message.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ConsistencyWebSocketHandler extends TextWebSocketHandler {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ConsistencyWebSocketHandler.class);

  /** The broker, never null. */
  private final Consistency consistency;

  /** The connections of the open WebSocket sessions, by session id. */
  private final Map<String, WebSocketClientConnection> connections =
      new ConcurrentHashMap<>();

  /**
   * Creates a new handler.
   *
   * @param theConsistency the broker to hand connections to, never null
   */
  public ConsistencyWebSocketHandler(final Consistency theConsistency) {
    consistency = Objects.requireNonNull(theConsistency,
        "consistency cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public void afterConnectionEstablished(final WebSocketSession session)
      throws Exception {
    final WebSocketClientConnection connection =
        new WebSocketClientConnection(session);
    connections.put(session.getId(), connection);
    try {
      consistency.accept(connection);
    } catch (final IllegalStateException e) {
      connections.remove(session.getId());
      log.debug("Refused WebSocket {}: {}", session.getId(), e.getMessage());
      if (session.isOpen()) {
        session.close(CloseStatus.SERVICE_RESTARTED);
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  protected void handleTextMessage(final WebSocketSession session,
      final TextMessage message) {
    final WebSocketClientConnection connection =
        connections.get(session.getId());
    if (connection != null) {
      connection.deliver(message.getPayload());
    }
  }

  /** {@inheritDoc} */
  @Override
  public void handleTransportError(final WebSocketSession session,
      final Throwable exception) {
    log.debug("WebSocket {} transport error: {}", session.getId(),
        exception.getMessage());
    release(session);
  }

  /** {@inheritDoc} */
  @Override
  public void afterConnectionClosed(final WebSocketSession session,
      final CloseStatus status) {
    release(session);
  }

  /**
   * Returns the number of open WebSocket sessions.
   *
   * @return the number of sessions
   */
  public int connectionCount() {
    return connections.size();
  }

  /** Ends the inbound stream of a session's connection.
   *
   * @param session the WebSocket session.
   */
  private void release(final WebSocketSession session) {
    final WebSocketClientConnection connection =
        connections.remove(session.getId());
    if (connection != null) {
      connection.endOfStream();
    }
  }
}
