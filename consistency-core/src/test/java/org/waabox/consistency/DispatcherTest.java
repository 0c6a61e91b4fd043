package org.waabox.consistency;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.consistency.ingest.InvalidationEvent;
import org.waabox.consistency.metrics.ConsistencyMetrics;
import org.waabox.consistency.metrics.NoopConsistencyMetrics;
import org.waabox.consistency.protocol.OutboundMessage;

/**
 * Tests for {@link Dispatcher}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DispatcherTest {

  private SubscriptionRegistry registry;
  private SessionTable sessions;

  @BeforeEach
  void setUp() {
    registry = new SubscriptionRegistry();
    sessions = new SessionTable();
  }

  private Session open(final long id, final BrokerSettings settings) {
    final Session session = new Session(new SessionId(id),
        new InMemoryConnection("client-" + id), settings,
        new NoopConsistencyMetrics());
    sessions.add(session);
    return session;
  }

  private Session open(final long id) {
    return open(id, BrokerSettings.defaults());
  }

  @Test
  void whenDispatching_givenTwoWatchersOfWidget_shouldNotifyOnlyThem()
      throws Exception {
    final Session a = open(1);
    final Session b = open(2);
    final Session c = open(3);
    registry.subscribe(a.id(), "/widgets/7");
    registry.subscribe(b.id(), "/widgets/7");
    registry.subscribe(c.id(), "/widgets/8");

    final Dispatcher dispatcher = new Dispatcher(registry, sessions,
        new NoopConsistencyMetrics());

    assertEquals(2, dispatcher.dispatch(InvalidationEvent.of("/widgets/7")));

    assertEquals(OutboundMessage.invalidated("/widgets/7", null), a.take());
    assertEquals(OutboundMessage.invalidated("/widgets/7", null), b.take());
    assertEquals(0, c.queuedCount());
  }

  @Test
  void whenDispatching_givenPayload_shouldForwardIt() throws Exception {
    final Session a = open(1);
    registry.subscribe(a.id(), "/orders/42");

    final Dispatcher dispatcher = new Dispatcher(registry, sessions,
        new NoopConsistencyMetrics());
    dispatcher.dispatch(new InvalidationEvent("/orders/42",
        "shipped".getBytes(StandardCharsets.UTF_8)));

    assertArrayEquals("shipped".getBytes(StandardCharsets.UTF_8),
        a.take().payload());
  }

  @Test
  void whenDispatching_givenUnsubscribedSession_shouldSkipIt() {
    final Session a = open(1);
    registry.subscribe(a.id(), "/widgets/7");
    registry.unsubscribe(a.id(), "/widgets/7");

    final Dispatcher dispatcher = new Dispatcher(registry, sessions,
        new NoopConsistencyMetrics());

    assertEquals(0, dispatcher.dispatch(InvalidationEvent.of("/widgets/7")));
    assertEquals(0, a.queuedCount());
  }

  @Test
  void whenDispatching_givenStaleSessionId_shouldSkipIt() {
    registry.subscribe(new SessionId(99), "/widgets/7");
    final Session a = open(1);
    registry.subscribe(a.id(), "/widgets/7");

    final Dispatcher dispatcher = new Dispatcher(registry, sessions,
        new NoopConsistencyMetrics());

    assertEquals(1, dispatcher.dispatch(InvalidationEvent.of("/widgets/7")));
  }

  @Test
  void whenDispatching_givenSlowConsumer_shouldNotAffectOthers()
      throws Exception {
    final BrokerSettings tight = BrokerSettings.create(1,
        OverflowPolicy.DISCONNECT, true, 100);
    final Session slow = open(1, tight);
    final Session fast = open(2);
    registry.subscribe(slow.id(), "/a");
    registry.subscribe(fast.id(), "/a");

    final Dispatcher dispatcher = new Dispatcher(registry, sessions,
        new NoopConsistencyMetrics());
    dispatcher.dispatch(InvalidationEvent.of("/a"));
    final int delivered = dispatcher.dispatch(InvalidationEvent.of("/a"));

    assertEquals(1, delivered);
    assertNull(slow.take());
    assertEquals("/a", fast.take().uri());
    assertEquals("/a", fast.take().uri());
  }

  @Test
  void whenDispatching_givenNoSubscribers_shouldReportZeroRecipients() {
    final ConsistencyMetrics metrics = createMock(ConsistencyMetrics.class);
    metrics.invalidationDispatched("/nobody", 0);
    expectLastCall().once();
    replay(metrics);

    final Dispatcher dispatcher = new Dispatcher(registry, sessions, metrics);

    assertEquals(0, dispatcher.dispatch(InvalidationEvent.of("/nobody")));
    verify(metrics);
  }
}
