package org.waabox.consistency.socket;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Reads UTF-8 lines from a socket stream, refusing lines longer than a
 * fixed limit before they are buffered.
 *
 * <p>Lines end with {@code \n}; a trailing {@code \r} is dropped. A last line
 * without terminator is returned at end of stream.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class LineReader {

  /** The decoded stream, never null. */
  private final Reader reader;

  /** The longest line accepted, in characters. */
  private final int maxLength;

  /**
   * Creates a reader over a stream.
   *
   * @param in           the stream to read, never null
   * @param theMaxLength the longest line accepted, in characters
   */
  LineReader(final InputStream in, final int theMaxLength) {
    reader = new BufferedReader(new InputStreamReader(in,
        StandardCharsets.UTF_8));
    maxLength = theMaxLength;
  }

  /**
   * Reads the next line.
   *
   * @return the line without terminator, or null at end of stream
   *
   * @throws FrameTooLongException if the line exceeds the limit; the rest
   *     of the stream can no longer be trusted
   * @throws IOException if the read fails
   */
  String readLine() throws IOException {
    final StringBuilder line = new StringBuilder();
    int c;
    while ((c = reader.read()) != -1) {
      if (c == '\n') {
        final int last = line.length() - 1;
        if (last >= 0 && line.charAt(last) == '\r') {
          line.setLength(last);
        }
        return line.toString();
      }
      // One extra character is left for a '\r' before the '\n'.
      if (line.length() > maxLength
          || (line.length() == maxLength && c != '\r')) {
        throw new FrameTooLongException(maxLength);
      }
      line.append((char) c);
    }
    return line.length() == 0 ? null : line.toString();
  }

  /** Raised when a peer sends a line longer than the limit. */
  static final class FrameTooLongException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param maxLength the limit that was exceeded
     */
    FrameTooLongException(final int maxLength) {
      super("line exceeds " + maxLength + " characters");
    }
  }
}
