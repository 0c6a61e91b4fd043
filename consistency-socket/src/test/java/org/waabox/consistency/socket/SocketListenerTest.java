package org.waabox.consistency.socket;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SocketListener}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SocketListenerTest {

  @Test
  void whenAcceptKeepsFailing_givenBackoff_shouldDoubleUpToTheCap() {
    assertEquals(100, SocketListener.nextBackoff(50));
    assertEquals(1_600, SocketListener.nextBackoff(800));
    assertEquals(2_000, SocketListener.nextBackoff(1_600));
    assertEquals(2_000, SocketListener.nextBackoff(2_000));
  }
}
