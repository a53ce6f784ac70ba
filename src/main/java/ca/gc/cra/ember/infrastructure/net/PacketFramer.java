package ca.gc.cra.ember.infrastructure.net;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * Splits a byte stream into newline-delimited packets.
 *
 * <p>A trailing {@code \r} is stripped and blank lines are skipped. A line whose content, without its
 * {@code \r\n} or {@code \n} terminator, is longer than the limit is discarded up to its delimiter and
 * reported once as {@link Frame#oversized()}. Bytes of an unterminated line at end of stream are dropped.
 * Partial state survives a {@link java.net.SocketTimeoutException}, so the caller may simply call
 * {@link #next()} again.</p>
 *
 * <p>Not thread-safe; one instance per connection.</p>
 */
final class PacketFramer {
  private static final int READ_CHUNK = 4_096;

  private final InputStream in;
  private final int maxBytes;
  private final byte[] chunk = new byte[READ_CHUNK];
  private int chunkPos;
  private int chunkLen;
  private byte[] line = new byte[256];
  private int lineLen;
  private boolean discarding;

  PacketFramer(InputStream in, int maxBytes) {
    this.in = in;
    this.maxBytes = maxBytes;
  }

  /**
   * Reads the next packet.
   *
   * @return next frame, or {@code null} at end of stream
   * @throws IOException when reading fails, including read timeouts
   */
  Frame next() throws IOException {
    while (true) {
      if (chunkPos == chunkLen) {
        int read = in.read(chunk, 0, chunk.length);
        if (read < 0) {
          lineLen = 0;
          discarding = false;
          return null;
        }
        chunkPos = 0;
        chunkLen = read;
      }
      while (chunkPos < chunkLen) {
        byte b = chunk[chunkPos++];
        if (b == '\n') {
          if (discarding) {
            discarding = false;
            lineLen = 0;
            return Frame.OVERSIZED;
          }
          int len = lineLen;
          lineLen = 0;
          if (len > 0 && line[len - 1] == '\r') {
            len--;
          }
          if (len == 0 || isBlank(line, len)) {
            continue;
          }
          return new Frame(Arrays.copyOf(line, len), false);
        }
        if (discarding) {
          continue;
        }
        // one byte of headroom for the \r of a \r\n terminator
        if (lineLen > maxBytes || (lineLen == maxBytes && b != '\r')) {
          discarding = true;
          continue;
        }
        if (lineLen == line.length) {
          line = Arrays.copyOf(line, Math.min(maxBytes + 1, line.length * 2));
        }
        line[lineLen++] = b;
      }
    }
  }

  private static boolean isBlank(byte[] bytes, int len) {
    for (int i = 0; i < len; i++) {
      if (bytes[i] != ' ' && bytes[i] != '\t' && bytes[i] != '\r') {
        return false;
      }
    }
    return true;
  }

  /**
   * One framed packet.
   *
   * @param bytes packet bytes without delimiter; empty when oversized
   * @param oversized {@code true} when the line exceeded the limit and was discarded
   */
  record Frame(byte[] bytes, boolean oversized) {
    static final Frame OVERSIZED = new Frame(new byte[0], true);
  }
}
