package ca.gc.cra.ember.infrastructure.device;

import ca.gc.cra.ember.application.port.CommandTransport;
import ca.gc.cra.ember.application.port.DispatchException;
import ca.gc.cra.ember.domain.device.CommandType;
import ca.gc.cra.ember.domain.device.Device;
import ca.gc.cra.ember.validation.Numbers;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Sends a command over a short-lived TCP connection and waits for a one-line acknowledgement.
 *
 * <p>Any reply is an acknowledgement unless it starts with {@code ERR} or {@code NAK}. A closed connection
 * without a reply, a connect failure, or a read timeout is a {@link DispatchException}.</p>
 *
 * <p>The acknowledgement timeout bounds the whole reply, not each read; at most {@value #MAX_ACK_CHARS}
 * characters are read.</p>
 */
public final class TcpCommandTransport implements CommandTransport {
  static final int MAX_ACK_CHARS = 256;

  private final int connectTimeoutMillis;
  private final int ackTimeoutMillis;

  public TcpCommandTransport(int connectTimeoutMillis, int ackTimeoutMillis) {
    this.connectTimeoutMillis = (int) Numbers.requireRange("connectTimeoutMillis", connectTimeoutMillis, 1, 60_000);
    this.ackTimeoutMillis = (int) Numbers.requireRange("ackTimeoutMillis", ackTimeoutMillis, 1, 60_000);
  }

  @Override
  public String send(Device device, CommandType command) throws DispatchException, InterruptedException {
    if (Thread.currentThread().isInterrupted()) {
      throw new InterruptedException("dispatch interrupted before connect");
    }
    String target = device.ip() + ":" + device.port();
    try (Socket socket = new Socket()) {
      socket.connect(new InetSocketAddress(device.ip(), device.port()), connectTimeoutMillis);
      socket.setSoTimeout(ackTimeoutMillis);
      socket.setTcpNoDelay(true);
      long deadline = System.nanoTime() + ackTimeoutMillis * 1_000_000L;
      OutputStream out = socket.getOutputStream();
      out.write(command.wireLine().getBytes(StandardCharsets.US_ASCII));
      out.flush();
      String ack = readAck(socket, deadline);
      if (ack == null) {
        throw new DispatchException(command + " to " + target + ": connection closed without acknowledgement");
      }
      ack = ack.trim();
      String upper = ack.toUpperCase(Locale.ROOT);
      if (upper.startsWith("ERR") || upper.startsWith("NAK")) {
        throw new DispatchException(command + " rejected by " + target + ": " + ack);
      }
      return ack;
    } catch (SocketTimeoutException ex) {
      throw new DispatchException(command + " to " + target + " timed out", ex);
    } catch (IOException ex) {
      throw new DispatchException(command + " to " + target + " failed: " + ex.getMessage(), ex);
    }
  }

  /**
   * Reads one reply line within {@code deadline}, stopping after {@value #MAX_ACK_CHARS} characters.
   *
   * @return the line without its terminator, or {@code null} when the peer closed before sending anything
   * @throws SocketTimeoutException when the deadline passes before the line completes
   */
  private static String readAck(Socket socket, long deadline) throws IOException {
    InputStream in = new BufferedInputStream(socket.getInputStream(), MAX_ACK_CHARS);
    StringBuilder line = new StringBuilder();
    while (line.length() < MAX_ACK_CHARS) {
      long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
      if (remainingMillis <= 0) {
        throw new SocketTimeoutException("acknowledgement not completed in time");
      }
      socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, remainingMillis));
      int b = in.read();
      if (b < 0) {
        return line.length() == 0 ? null : line.toString();
      }
      if (b == '\n') {
        return line.toString();
      }
      line.append((char) (b & 0x7F));
    }
    return line.toString();
  }
}
