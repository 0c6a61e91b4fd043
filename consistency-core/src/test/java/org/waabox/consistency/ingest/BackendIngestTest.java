package org.waabox.consistency.ingest;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.waabox.consistency.BrokerSettings;
import org.waabox.consistency.OverflowPolicy;
import org.waabox.consistency.metrics.ConsistencyMetrics;
import org.waabox.consistency.metrics.NoopConsistencyMetrics;

/**
 * Tests for {@link BackendIngest}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class BackendIngestTest {

  private BackendIngest ingest;

  @AfterEach
  void tearDown() {
    if (ingest != null) {
      ingest.stop();
    }
  }

  /** Dispatch function that blocks on the first event until released. */
  private static final class GatedDispatch
      implements Consumer<InvalidationEvent> {

    private final CountDownLatch firstSeen = new CountDownLatch(1);
    private final CountDownLatch gate = new CountDownLatch(1);
    private final List<InvalidationEvent> events =
        new CopyOnWriteArrayList<>();

    @Override
    public void accept(final InvalidationEvent event) {
      events.add(event);
      firstSeen.countDown();
      try {
        gate.await(5, TimeUnit.SECONDS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }

    void awaitFirst() throws InterruptedException {
      assertTrue(firstSeen.await(5, TimeUnit.SECONDS));
    }

    void release() {
      gate.countDown();
    }

    void awaitCount(final int count) throws InterruptedException {
      final long deadline = System.currentTimeMillis() + 5_000;
      while (events.size() < count
          && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
    }
  }

  private static BrokerSettings settings(final boolean coalesce,
      final int maxPending) {
    return BrokerSettings.create(16, OverflowPolicy.DROP_OLDEST, coalesce,
        maxPending);
  }

  @Test
  void whenReporting_givenRunningIngest_shouldDispatchInOrder()
      throws Exception {
    final GatedDispatch dispatch = new GatedDispatch();
    dispatch.release();
    ingest = new BackendIngest(dispatch, settings(true, 100),
        new NoopConsistencyMetrics());
    ingest.start();

    ingest.reportChange("/a");
    ingest.reportChange("/b");
    ingest.reportChange("/c");
    dispatch.awaitCount(3);

    assertEquals(List.of(InvalidationEvent.of("/a"),
        InvalidationEvent.of("/b"), InvalidationEvent.of("/c")),
        dispatch.events);
  }

  @Test
  void whenReporting_givenQueuedChangeAndCoalescing_shouldKeepLatestPayload()
      throws Exception {
    final GatedDispatch dispatch = new GatedDispatch();
    ingest = new BackendIngest(dispatch, settings(true, 100),
        new NoopConsistencyMetrics());
    ingest.start();

    ingest.reportChange("/busy");
    dispatch.awaitFirst();

    ingest.reportChange("/a", "v1".getBytes(StandardCharsets.UTF_8));
    ingest.reportChange("/b");
    ingest.reportChange("/a", "v2".getBytes(StandardCharsets.UTF_8));
    assertEquals(2, ingest.pendingCount());

    dispatch.release();
    dispatch.awaitCount(3);

    assertEquals(3, dispatch.events.size());
    assertEquals("/a", dispatch.events.get(1).uri());
    assertArrayEquals("v2".getBytes(StandardCharsets.UTF_8),
        dispatch.events.get(1).payload());
    assertEquals("/b", dispatch.events.get(2).uri());
  }

  @Test
  void whenReporting_givenQueuedChangeWithoutCoalescing_shouldKeepBoth()
      throws Exception {
    final GatedDispatch dispatch = new GatedDispatch();
    ingest = new BackendIngest(dispatch, settings(false, 100),
        new NoopConsistencyMetrics());
    ingest.start();

    ingest.reportChange("/busy");
    dispatch.awaitFirst();

    ingest.reportChange("/a");
    ingest.reportChange("/a");
    assertEquals(2, ingest.pendingCount());

    dispatch.release();
    dispatch.awaitCount(3);

    assertEquals(3, dispatch.events.size());
  }

  @Test
  void whenReporting_givenStoppedIngest_shouldThrowUnavailable() {
    final ConsistencyMetrics metrics = createMock(ConsistencyMetrics.class);
    metrics.changeRejected("/a");
    expectLastCall().once();
    replay(metrics);

    ingest = new BackendIngest(event -> { }, settings(true, 100), metrics);

    assertThrows(BackendUnavailableException.class,
        () -> ingest.reportChange("/a"));
    verify(metrics);
  }

  @Test
  void whenReporting_givenFullQueue_shouldThrowUnavailable()
      throws Exception {
    final GatedDispatch dispatch = new GatedDispatch();
    ingest = new BackendIngest(dispatch, settings(true, 2),
        new NoopConsistencyMetrics());
    ingest.start();

    ingest.reportChange("/busy");
    dispatch.awaitFirst();
    ingest.reportChange("/a");
    ingest.reportChange("/b");

    assertThrows(BackendUnavailableException.class,
        () -> ingest.reportChange("/c"));

    // A URI that is already queued still coalesces.
    ingest.reportChange("/a");
    dispatch.release();
  }

  @Test
  void whenReporting_givenBlankUri_shouldThrowIllegalArgument() {
    ingest = new BackendIngest(event -> { }, settings(true, 100),
        new NoopConsistencyMetrics());
    ingest.start();

    assertThrows(IllegalArgumentException.class,
        () -> ingest.reportChange("  "));
  }

  @Test
  void whenDispatchFails_givenNextChange_shouldKeepDraining()
      throws Exception {
    final List<String> seen = new CopyOnWriteArrayList<>();
    final CountDownLatch done = new CountDownLatch(1);
    ingest = new BackendIngest(event -> {
      seen.add(event.uri());
      if (event.uri().equals("/boom")) {
        throw new IllegalStateException("boom");
      }
      done.countDown();
    }, settings(true, 100), new NoopConsistencyMetrics());
    ingest.start();

    ingest.reportChange("/boom");
    ingest.reportChange("/ok");

    assertTrue(done.await(5, TimeUnit.SECONDS));
    assertEquals(List.of("/boom", "/ok"), seen);
  }

  @Test
  void whenStarting_givenRunningIngest_shouldThrow() {
    ingest = new BackendIngest(event -> { }, settings(true, 100),
        new NoopConsistencyMetrics());
    ingest.start();

    assertThrows(IllegalStateException.class, ingest::start);
  }

  @Test
  void whenStopping_givenPendingChanges_shouldDiscardThem()
      throws Exception {
    final GatedDispatch dispatch = new GatedDispatch();
    ingest = new BackendIngest(dispatch, settings(true, 100),
        new NoopConsistencyMetrics());
    ingest.start();
    ingest.reportChange("/busy");
    dispatch.awaitFirst();
    ingest.reportChange("/a");

    dispatch.release();
    ingest.stop();

    assertFalse(ingest.isRunning());
    assertEquals(0, ingest.pendingCount());
  }
}
