package org.waabox.consistency.socket;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The line {@link SocketIngestServer} writes back for every change record.
 *
 * <p>Format:
 * <pre>{@code
 *   {"status":"accepted"}
 *   {"status":"malformed","reason":"..."}
 *   {"status":"unavailable","reason":"..."}
 *   {"status":"too_long","reason":"..."}
 * }</pre>
 *
 * @param status the outcome, never null
 * @param reason why the record was not accepted, null when accepted
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
record IngestReply(Status status, String reason) {

  /** Shared, thread-safe mapper. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The outcome of one change record. */
  enum Status {
    /** The change was handed to the broker. */
    ACCEPTED,
    /** The record could not be parsed; nothing was reported. */
    MALFORMED,
    /** The broker refused the change; the backend may retry. */
    UNAVAILABLE,
    /** The record exceeded the line limit; the connection is closed. */
    TOO_LONG
  }

  /** Validates the reply. */
  IngestReply {
    Objects.requireNonNull(status, "status must not be null");
  }

  /**
   * Creates the reply to an accepted change.
   *
   * @return the reply, never null
   */
  static IngestReply accepted() {
    return new IngestReply(Status.ACCEPTED, null);
  }

  /**
   * Creates a refusal.
   *
   * @param status the refusal kind, never null
   * @param reason why the record was refused, never null
   * @return the reply, never null
   */
  static IngestReply refused(final Status status, final String reason) {
    return new IngestReply(status, Objects.requireNonNull(reason,
        "reason must not be null"));
  }

  /**
   * Returns whether the change was accepted.
   *
   * @return true for {@link Status#ACCEPTED}
   */
  boolean isAccepted() {
    return status == Status.ACCEPTED;
  }

  /**
   * Encodes the reply as one JSON line, without terminator.
   *
   * @return the JSON text, never null
   */
  String encode() {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("status", status.name().toLowerCase(Locale.ROOT));
    if (reason != null) {
      node.put("reason", reason);
    }
    return node.toString();
  }
}
