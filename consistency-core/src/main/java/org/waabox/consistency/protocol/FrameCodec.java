package org.waabox.consistency.protocol;

import java.util.Base64;
import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Static utility class for the client wire protocol, version
 * {@value #VERSION}.
 *
 * <p>Every frame is a single JSON object. JSON escaping keeps frames free of
 * raw line breaks, so on stream transports one frame is one line; on message
 * transports one frame is one message.
 *
 * <p>Client to broker:
 * <pre>
 *   {"v":1,"type":"subscribe","uri":"/orders/42"}
 *   {"v":1,"type":"unsubscribe","uri":"/orders/42"}
 *   {"v":1,"type":"close"}
 * </pre>
 * The legacy form {@code {"message":"watch","data":{"uri":"..."}}} (and
 * {@code "unwatch"}) is accepted as well. The {@code v} field is optional.
 *
 * <p>Broker to client:
 * <pre>
 *   {"v":1,"type":"ack","uri":"/orders/42"}
 *   {"v":1,"type":"invalidated","uri":"/orders/42","payload":"base64"}
 *   {"v":1,"type":"error","reason":"..."}
 * </pre>
 *
 * <p>Uses Jackson's tree model ({@link JsonNode}) for lightweight JSON
 * processing without requiring full object binding.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FrameCodec {

  /** The protocol version written on every frame. */
  public static final int VERSION = 1;

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private FrameCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a broker message into a frame.
   *
   * @param message the message to serialize, never null.
   * @return the JSON frame, never null.
   */
  public static String encode(final OutboundMessage message) {
    Objects.requireNonNull(message, "message cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("v", VERSION);
    node.put("type", message.type().name().toLowerCase(Locale.ROOT));
    switch (message.type()) {
      case ACK -> node.put("uri", message.uri());
      case INVALIDATED -> {
        node.put("uri", message.uri());
        final byte[] payload = message.payload();
        if (payload != null) {
          node.put("payload", Base64.getEncoder().encodeToString(payload));
        }
      }
      case ERROR -> node.put("reason", message.reason());
      default -> throw new IllegalStateException(
          "Unknown message type: " + message.type());
    }
    return node.toString();
  }

  /**
   * Serializes a client frame. Used by client libraries and tests.
   *
   * @param frame the frame to serialize, never null.
   * @return the JSON frame, never null.
   */
  public static String encode(final ClientFrame frame) {
    Objects.requireNonNull(frame, "frame cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("v", VERSION);
    node.put("type", frame.type().name().toLowerCase(Locale.ROOT));
    if (frame.uri() != null) {
      node.put("uri", frame.uri());
    }
    return node.toString();
  }

  /**
   * Parses a frame received from a client.
   *
   * @param text the raw frame, never null.
   * @return the parsed frame, never null.
   * @throws ProtocolException if the frame is malformed, has an unknown
   *     type, an unsupported version or a missing or blank URI.
   */
  public static ClientFrame decodeClientFrame(final String text) {
    Objects.requireNonNull(text, "text cannot be null");

    final JsonNode node = readObject(text);
    checkVersion(node);

    final JsonNode type = node.get("type");
    if (type != null) {
      return clientFrame(type.asText(), node);
    }

    // {"message": "watch", "data": {"uri": "..."}}
    final JsonNode legacy = node.get("message");
    if (legacy != null) {
      final JsonNode data = node.path("data");
      switch (legacy.asText()) {
        case "watch":
          return ClientFrame.subscribe(requireUri(data));
        case "unwatch":
          return ClientFrame.unsubscribe(requireUri(data));
        default:
          throw new ProtocolException(
              "unknown message: " + legacy.asText());
      }
    }
    throw new ProtocolException("missing field: type");
  }

  /**
   * Parses a frame sent by the broker. Used by client libraries and tests.
   *
   * @param text the raw frame, never null.
   * @return the parsed message, never null.
   * @throws ProtocolException if the frame is malformed.
   */
  public static OutboundMessage decodeOutbound(final String text) {
    Objects.requireNonNull(text, "text cannot be null");

    final JsonNode node = readObject(text);
    checkVersion(node);

    final String type = requireText(node, "type");
    switch (type) {
      case "ack":
        return OutboundMessage.ack(requireUri(node));
      case "invalidated":
        final JsonNode payload = node.get("payload");
        return OutboundMessage.invalidated(requireUri(node),
            payload == null || payload.isNull()
                ? null
                : decodeBase64(payload.asText()));
      case "error":
        return OutboundMessage.error(requireText(node, "reason"));
      default:
        throw new ProtocolException("unknown type: " + type);
    }
  }

  /** Builds a client frame from its type name.
   *
   * @param type the type name as sent by the client.
   * @param node the frame.
   * @return the frame, never null.
   */
  private static ClientFrame clientFrame(final String type,
      final JsonNode node) {
    switch (type.toLowerCase(Locale.ROOT)) {
      case "subscribe":
        return ClientFrame.subscribe(requireUri(node));
      case "unsubscribe":
        return ClientFrame.unsubscribe(requireUri(node));
      case "close":
        return ClientFrame.close();
      default:
        throw new ProtocolException("unknown type: " + type);
    }
  }

  /** Parses the text and checks that it is a JSON object.
   *
   * @param text the raw frame.
   * @return the object node, never null.
   */
  private static JsonNode readObject(final String text) {
    final JsonNode node;
    try {
      node = MAPPER.readTree(text);
    } catch (final JsonProcessingException e) {
      throw new ProtocolException("frame is not valid JSON", e);
    }
    if (node == null || !node.isObject()) {
      throw new ProtocolException("frame must be a JSON object");
    }
    return node;
  }

  /** Rejects frames that declare a version other than {@link #VERSION}.
   *
   * @param node the frame.
   */
  private static void checkVersion(final JsonNode node) {
    final JsonNode version = node.get("v");
    if (version != null && !(version.canConvertToInt()
        && version.isIntegralNumber() && version.asInt() == VERSION)) {
      throw new ProtocolException(
          "unsupported protocol version: " + version);
    }
  }

  /** Returns the non blank uri field of the node.
   *
   * @param node the node holding the uri.
   * @return the uri, never null.
   */
  private static String requireUri(final JsonNode node) {
    return requireText(node, "uri");
  }

  /** Returns the non blank text field of the node or throws.
   *
   * @param node the parent node.
   * @param field the field name.
   * @return the field value, never null.
   */
  private static String requireText(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      throw new ProtocolException("missing field: " + field);
    }
    if (value.asText().isBlank()) {
      throw new ProtocolException("blank field: " + field);
    }
    return value.asText();
  }

  /** Decodes a base64 payload.
   *
   * @param text the base64 text.
   * @return the decoded bytes, never null.
   */
  private static byte[] decodeBase64(final String text) {
    try {
      return Base64.getDecoder().decode(text);
    } catch (final IllegalArgumentException e) {
      throw new ProtocolException("payload is not valid base64", e);
    }
  }
}
