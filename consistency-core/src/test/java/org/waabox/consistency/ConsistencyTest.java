package org.waabox.consistency;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.consistency.ingest.BackendUnavailableException;
import org.waabox.consistency.ingest.ChangeReporter;
import org.waabox.consistency.ingest.ChangeSource;
import org.waabox.consistency.protocol.ClientFrame;
import org.waabox.consistency.protocol.OutboundMessage;
import org.waabox.consistency.transport.ConnectionAcceptor;
import org.waabox.consistency.transport.ConnectionHandler;

/**
 * Tests for {@link Consistency}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ConsistencyTest {

  @Test
  void whenStarting_givenSourcesAndAcceptors_shouldStartAndStopThem() {
    final ChangeSource source = createMock(ChangeSource.class);
    final ConnectionAcceptor acceptor = createMock(ConnectionAcceptor.class);

    source.start(anyObject(ChangeReporter.class));
    expectLastCall().once();
    source.stop();
    expectLastCall().once();
    acceptor.start(anyObject(ConnectionHandler.class));
    expectLastCall().once();
    acceptor.stop();
    expectLastCall().once();
    replay(source, acceptor);

    final Consistency consistency = Consistency.builder()
        .changeSource(source)
        .acceptor(acceptor)
        .build();

    consistency.start();
    consistency.stop();
    consistency.stop();

    verify(source, acceptor);
  }

  @Test
  void whenStarting_givenStartedInstance_shouldThrow() {
    final Consistency consistency = Consistency.builder().build();
    consistency.start();
    try {
      assertThrows(IllegalStateException.class, consistency::start);
    } finally {
      consistency.stop();
    }
  }

  @Test
  void whenBuilding_givenNoSettings_shouldUseDefaults() {
    final Consistency consistency = Consistency.builder().build();

    assertEquals(BrokerSettings.DEFAULT_QUEUE_CAPACITY,
        consistency.settings().queueCapacity());
    assertEquals(OverflowPolicy.DROP_OLDEST,
        consistency.settings().overflowPolicy());
  }

  @Test
  void whenReportingChange_givenSubscribedClient_shouldDeliverInvalidation()
      throws Exception {
    final Consistency consistency = Consistency.builder().build();
    consistency.start();
    try {
      final InMemoryConnection client = new InMemoryConnection("c1");
      consistency.accept(client);
      client.clientSends(ClientFrame.subscribe("/orders/42"));
      assertEquals(OutboundMessage.ack("/orders/42"), client.nextMessage());

      consistency.reportChange("/orders/42");

      assertEquals(OutboundMessage.invalidated("/orders/42", null),
          client.nextMessage());
    } finally {
      consistency.stop();
    }
  }

  @Test
  void whenReportingChange_givenSourceDrivenChange_shouldDeliver()
      throws Exception {
    final CapturingSource source = new CapturingSource();
    final Consistency consistency = Consistency.builder()
        .changeSource(source)
        .build();
    consistency.start();
    try {
      assertNotNull(source.reporter);
      final InMemoryConnection client = new InMemoryConnection("c1");
      consistency.accept(client);
      client.clientSends(ClientFrame.subscribe("/widgets/7"));
      client.nextMessage();

      source.reporter.reportChange("/widgets/7");

      assertEquals("/widgets/7", client.nextMessage().uri());
      assertEquals(List.of(source), consistency.changeSources());
    } finally {
      consistency.stop();
    }
  }

  @Test
  void whenReportingChange_givenStoppedBroker_shouldThrowUnavailable() {
    final Consistency consistency = Consistency.builder().build();

    assertThrows(BackendUnavailableException.class,
        () -> consistency.reportChange("/a"));
  }

  @Test
  void whenAccepting_givenStoppedBroker_shouldRefuse() {
    final Consistency consistency = Consistency.builder().build();
    consistency.start();
    consistency.stop();

    assertThrows(IllegalStateException.class,
        () -> consistency.accept(new InMemoryConnection("late")));
  }

  @Test
  void whenBuilding_givenRegistry_shouldExposeTheSameInstance() {
    final Consistency consistency = Consistency.builder().build();

    assertSame(consistency.registry(), consistency.registry());
    assertEquals(0, consistency.sessionCount());
  }

  /** A change source that keeps the reporter it was started with. */
  private static final class CapturingSource implements ChangeSource {

    private volatile ChangeReporter reporter;

    @Override
    public void start(final ChangeReporter theReporter) {
      reporter = theReporter;
    }

    @Override
    public void stop() {
      reporter = null;
    }
  }
}
