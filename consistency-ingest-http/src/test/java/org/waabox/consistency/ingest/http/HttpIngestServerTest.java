package org.waabox.consistency.ingest.http;

import static org.easymock.EasyMock.aryEq;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.isNull;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.waabox.consistency.ConsistencyException;
import org.waabox.consistency.ingest.BackendUnavailableException;
import org.waabox.consistency.ingest.ChangeReporter;

/**
 * Integration tests for {@link HttpIngestServer} and
 * {@link HttpChangeReporter}.
 *
 * <p>These tests start a real HTTP server on an ephemeral localhost port.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HttpIngestServerTest {

  private final HttpClient client = HttpClient.newHttpClient();

  private HttpIngestServer server;

  @AfterEach
  void tearDown() {
    if (server != null) {
      server.stop();
    }
  }

  private URI endpoint() {
    return URI.create("http://localhost:" + server.localPort()
        + HttpIngestConfig.DEFAULT_PATH);
  }

  private int post(final String body) throws Exception {
    final HttpRequest request = HttpRequest.newBuilder()
        .uri(endpoint())
        .POST(HttpRequest.BodyPublishers.ofString(body))
        .build();
    return client.send(request, HttpResponse.BodyHandlers.ofString())
        .statusCode();
  }

  @Test
  void whenPosting_givenValidRecord_shouldReportAndAnswer202()
      throws Exception {
    final ChangeReporter reporter = createMock(ChangeReporter.class);
    reporter.reportChange(eq("/orders/42"), isNull());
    expectLastCall().once();
    replay(reporter);

    server = new HttpIngestServer(HttpIngestConfig.create(0));
    server.start(reporter);

    assertEquals(202, post("{\"uri\":\"/orders/42\"}"));
    verify(reporter);
  }

  @Test
  void whenPosting_givenMalformedBody_shouldAnswer400() throws Exception {
    final ChangeReporter reporter = createMock(ChangeReporter.class);
    replay(reporter);

    server = new HttpIngestServer(HttpIngestConfig.create(0));
    server.start(reporter);

    assertEquals(400, post("not json"));
    assertEquals(400, post("{\"payload\":\"aGk=\"}"));
    verify(reporter);
  }

  @Test
  void whenRequesting_givenGetMethod_shouldAnswer405() throws Exception {
    final ChangeReporter reporter = createMock(ChangeReporter.class);
    replay(reporter);

    server = new HttpIngestServer(HttpIngestConfig.create(0));
    server.start(reporter);

    final HttpRequest request = HttpRequest.newBuilder()
        .uri(endpoint())
        .GET()
        .build();

    assertEquals(405, client.send(request,
        HttpResponse.BodyHandlers.ofString()).statusCode());
    verify(reporter);
  }

  @Test
  void whenPosting_givenRefusingBroker_shouldAnswer503() throws Exception {
    final ChangeReporter reporter = createMock(ChangeReporter.class);
    reporter.reportChange(eq("/a"), isNull());
    expectLastCall().andThrow(new BackendUnavailableException("full"));
    replay(reporter);

    server = new HttpIngestServer(HttpIngestConfig.create(0));
    server.start(reporter);

    assertEquals(503, post("{\"uri\":\"/a\"}"));
    verify(reporter);
  }

  @Test
  void whenReporting_givenRunningServer_shouldDeliverPayload()
      throws Exception {
    final byte[] payload = "shipped".getBytes(StandardCharsets.UTF_8);
    final ChangeReporter reporter = createMock(ChangeReporter.class);
    reporter.reportChange(eq("/orders/42"), aryEq(payload));
    expectLastCall().once();
    replay(reporter);

    server = new HttpIngestServer(HttpIngestConfig.create(0));
    server.start(reporter);

    new HttpChangeReporter(endpoint()).reportChange("/orders/42", payload);

    verify(reporter);
  }

  @Test
  void whenReporting_givenRefusingBroker_shouldThrowUnavailable() {
    final ChangeReporter reporter = createMock(ChangeReporter.class);
    reporter.reportChange(eq("/a"), isNull());
    expectLastCall().andThrow(new BackendUnavailableException("stopped"));
    replay(reporter);

    server = new HttpIngestServer(HttpIngestConfig.create(0));
    server.start(reporter);
    final HttpChangeReporter remote = new HttpChangeReporter(endpoint());

    assertThrows(BackendUnavailableException.class,
        () -> remote.reportChange("/a"));
  }

  @Test
  void whenReporting_givenNoServer_shouldThrowUnavailable() {
    final HttpChangeReporter remote = new HttpChangeReporter(
        URI.create("http://localhost:1/consistency/changes"));

    assertThrows(BackendUnavailableException.class,
        () -> remote.reportChange("/a"));
  }

  @Test
  void whenStarting_givenPortInUse_shouldThrowConsistencyException() {
    final ChangeReporter reporter = createMock(ChangeReporter.class);
    replay(reporter);
    server = new HttpIngestServer(HttpIngestConfig.create(0));
    server.start(reporter);

    final HttpIngestServer second = new HttpIngestServer(
        HttpIngestConfig.create(server.localPort()));

    final ConsistencyException e = assertThrows(ConsistencyException.class,
        () -> second.start(reporter));
    assertEquals("HttpIngestServer", e.channel());
  }

  @Test
  void whenCreatingConfig_givenRelativePath_shouldThrow() {
    assertThrows(IllegalArgumentException.class,
        () -> HttpIngestConfig.create(1992, "changes"));
  }
}
