package org.waabox.consistency.protocol;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link FrameCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FrameCodecTest {

  @Test
  void whenDecoding_givenSubscribeFrame_shouldParseUri() {
    final ClientFrame frame = FrameCodec.decodeClientFrame(
        "{\"v\":1,\"type\":\"subscribe\",\"uri\":\"/orders/42\"}");

    assertEquals(ClientFrame.subscribe("/orders/42"), frame);
  }

  @Test
  void whenDecoding_givenFrameWithoutVersion_shouldAcceptIt() {
    final ClientFrame frame = FrameCodec.decodeClientFrame(
        "{\"type\":\"unsubscribe\",\"uri\":\"/a\"}");

    assertEquals(ClientFrame.unsubscribe("/a"), frame);
  }

  @Test
  void whenDecoding_givenCloseFrame_shouldNotRequireUri() {
    assertEquals(ClientFrame.close(),
        FrameCodec.decodeClientFrame("{\"v\":1,\"type\":\"close\"}"));
  }

  @Test
  void whenDecoding_givenLegacyWatchMessage_shouldMapToSubscribe() {
    final ClientFrame frame = FrameCodec.decodeClientFrame(
        "{\"message\":\"watch\",\"data\":{\"uri\":\"/widgets/7\"}}");

    assertEquals(ClientFrame.subscribe("/widgets/7"), frame);
  }

  @Test
  void whenDecoding_givenInvalidJson_shouldThrowProtocolException() {
    final ProtocolException e = assertThrows(ProtocolException.class,
        () -> FrameCodec.decodeClientFrame("{\"type\":"));

    assertEquals("frame is not valid JSON", e.getMessage());
  }

  @Test
  void whenDecoding_givenJsonArray_shouldThrowProtocolException() {
    assertThrows(ProtocolException.class,
        () -> FrameCodec.decodeClientFrame("[1,2]"));
  }

  @Test
  void whenDecoding_givenMissingUri_shouldThrowProtocolException() {
    final ProtocolException e = assertThrows(ProtocolException.class,
        () -> FrameCodec.decodeClientFrame("{\"type\":\"subscribe\"}"));

    assertEquals("missing field: uri", e.getMessage());
  }

  @Test
  void whenDecoding_givenBlankUri_shouldThrowProtocolException() {
    final ProtocolException e = assertThrows(ProtocolException.class,
        () -> FrameCodec.decodeClientFrame(
            "{\"type\":\"subscribe\",\"uri\":\"  \"}"));

    assertEquals("blank field: uri", e.getMessage());
  }

  @Test
  void whenDecoding_givenUnknownType_shouldThrowProtocolException() {
    final ProtocolException e = assertThrows(ProtocolException.class,
        () -> FrameCodec.decodeClientFrame(
            "{\"type\":\"publish\",\"uri\":\"/a\"}"));

    assertEquals("unknown type: publish", e.getMessage());
  }

  @Test
  void whenDecoding_givenUnsupportedVersion_shouldThrowProtocolException() {
    assertThrows(ProtocolException.class,
        () -> FrameCodec.decodeClientFrame(
            "{\"v\":2,\"type\":\"subscribe\",\"uri\":\"/a\"}"));
  }

  @Test
  void whenEncoding_givenAck_shouldWriteVersionTypeAndUri() {
    final String json = FrameCodec.encode(OutboundMessage.ack("/a"));

    assertTrue(json.contains("\"v\":1"));
    assertTrue(json.contains("\"type\":\"ack\""));
    assertTrue(json.contains("\"uri\":\"/a\""));
  }

  @Test
  void whenEncoding_givenInvalidationWithoutPayload_shouldOmitPayload() {
    final String json = FrameCodec.encode(
        OutboundMessage.invalidated("/orders/42", null));

    assertTrue(json.contains("\"type\":\"invalidated\""));
    assertFalse(json.contains("payload"));
  }

  @Test
  void whenEncoding_givenInvalidationWithPayload_shouldWriteBase64() {
    final byte[] payload = "hi".getBytes(StandardCharsets.UTF_8);

    final String json = FrameCodec.encode(
        OutboundMessage.invalidated("/a", payload));

    assertTrue(json.contains("\"payload\":\"aGk=\""));
    assertArrayEquals(payload, FrameCodec.decodeOutbound(json).payload());
  }

  @Test
  void whenEncoding_givenError_shouldWriteReason() {
    final String json = FrameCodec.encode(
        OutboundMessage.error("missing field: uri"));

    assertTrue(json.contains("\"type\":\"error\""));
    assertTrue(json.contains("\"reason\":\"missing field: uri\""));
  }
}
