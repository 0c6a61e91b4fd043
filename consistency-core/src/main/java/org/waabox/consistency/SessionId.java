package org.waabox.consistency;

/**
 * Identifies one client session for the lifetime of its connection.
 *
 * <p>Ids are handed out by the {@link ConnectionManager} from a monotonically
 * increasing counter and are never reused within a broker process.
 *
 * @param value the numeric identifier, always positive
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SessionId(long value) {

  /**
   * Compact constructor that validates the identifier.
   *
   * @throws IllegalArgumentException if value is not positive
   */
  public SessionId {
    if (value <= 0) {
      throw new IllegalArgumentException(
          "session id must be positive, got: " + value);
    }
  }

  /**
   * Returns a short human readable form used in logs and thread names.
   *
   * @return the string form, never null
   */
  @Override
  public String toString() {
    return "session-" + value;
  }
}
