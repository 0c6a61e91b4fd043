package org.waabox.consistency.ingest;

import java.util.Base64;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Static utility class for serializing and deserializing
 * {@link InvalidationEvent} instances exchanged with the backend.
 *
 * <p>The record is a JSON object with a {@code uri} field and an optional
 * base64 {@code payload}:
 * <pre>
 *   {"uri":"/orders/42","payload":"eyJpZCI6NDJ9"}
 * </pre>
 * The backend message {@code {"message":"update","data":{"uri":"..."}}} is
 * accepted by {@link #deserialize(String)} as well.
 *
 * <p>Uses Jackson's tree model ({@link JsonNode}) for lightweight
 * JSON processing without requiring full object binding.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChangeEventCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private ChangeEventCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes an {@link InvalidationEvent} into a JSON string.
   *
   * @param event the event to serialize, never null.
   * @return the JSON representation of the event, never null.
   */
  public static String serialize(final InvalidationEvent event) {
    Objects.requireNonNull(event, "event cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("uri", event.uri());
    final byte[] payload = event.payload();
    if (payload != null) {
      node.put("payload", Base64.getEncoder().encodeToString(payload));
    }
    return node.toString();
  }

  /**
   * Deserializes a JSON string into an {@link InvalidationEvent}.
   *
   * @param json the JSON string to parse, never null.
   * @return the parsed event, never null.
   * @throws IllegalArgumentException if the JSON is malformed, the uri is
   *     missing or blank, or the payload is not base64.
   */
  public static InvalidationEvent deserialize(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    try {
      final JsonNode node = MAPPER.readTree(json);
      if (node == null || !node.isObject()) {
        throw new IllegalArgumentException(
            "Change record must be a JSON object: " + json);
      }

      if (node.has("message")) {
        if (!"update".equals(node.get("message").asText())) {
          throw new IllegalArgumentException(
              "Unknown backend message: " + node.get("message"));
        }
        return InvalidationEvent.of(requireUri(node.path("data")));
      }

      final String uri = requireUri(node);
      final JsonNode payload = node.get("payload");
      if (payload == null || payload.isNull()) {
        return InvalidationEvent.of(uri);
      }
      return new InvalidationEvent(uri,
          Base64.getDecoder().decode(payload.asText()));
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize change record from JSON: " + json, e);
    }
  }

  /** Returns the non blank uri of the node or throws if missing.
   *
   * @param node the JSON node holding the uri.
   * @return the uri, never null.
   * @throws IllegalArgumentException if the uri is missing or blank.
   */
  private static String requireUri(final JsonNode node) {
    final JsonNode value = node.get("uri");
    if (value == null || value.isNull() || value.asText().isBlank()) {
      throw new IllegalArgumentException(
          "Missing field: uri in JSON: " + node);
    }
    return value.asText();
  }
}
