package ca.gc.cra.ember.infrastructure.device;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ember.application.port.DispatchException;
import ca.gc.cra.ember.domain.device.CommandType;
import ca.gc.cra.ember.domain.device.Device;
import ca.gc.cra.ember.domain.device.DeviceMode;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TcpCommandTransportTest {
  private ServerSocket server;
  private Device device;

  @BeforeEach
  void setUp() throws IOException {
    server = new ServerSocket(0, 4, InetAddress.getLoopbackAddress());
    device = new Device("pfds-1", "Unit", "127.0.0.1", server.getLocalPort(), "RoomA", DeviceMode.CONTINUOUS, 10);
  }

  @AfterEach
  void tearDown() throws IOException {
    server.close();
  }

  @Test
  void returnsAcknowledgementLine() throws Exception {
    CompletableFuture<String> received = respond("OK PERIOD_ON");

    String ack = new TcpCommandTransport(1_000, 1_000).send(device, CommandType.PERIOD_ON);

    assertEquals("OK PERIOD_ON", ack);
    assertEquals("PERIOD_ON", received.get(2, TimeUnit.SECONDS));
  }

  @Test
  void errorReplyIsFailure() {
    respond("ERR busy");

    DispatchException ex = assertThrows(DispatchException.class,
        () -> new TcpCommandTransport(1_000, 1_000).send(device, CommandType.REQUEST1));
    assertTrue(ex.getMessage().contains("ERR busy"), ex.getMessage());
  }

  @Test
  void silentDeviceTimesOut() {
    CompletableFuture.runAsync(() -> {
      try (Socket socket = server.accept()) {
        new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII)).readLine();
        Thread.sleep(1_000L);
      } catch (IOException ex) {
        throw new IllegalStateException(ex);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });

    DispatchException ex = assertThrows(DispatchException.class,
        () -> new TcpCommandTransport(1_000, 200).send(device, CommandType.REQUEST1));
    assertTrue(ex.getCause() instanceof SocketTimeoutException);
  }

  @Test
  void tricklingReplyIsBoundedByOverallDeadline() {
    CompletableFuture.runAsync(() -> {
      try (Socket socket = server.accept()) {
        new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII)).readLine();
        OutputStream out = socket.getOutputStream();
        for (int i = 0; i < 40; i++) {
          out.write('O');
          out.flush();
          Thread.sleep(100L);
        }
      } catch (IOException ex) {
        // the transport gave up and closed the socket
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });

    long started = System.nanoTime();
    DispatchException ex = assertThrows(DispatchException.class,
        () -> new TcpCommandTransport(1_000, 300).send(device, CommandType.REQUEST1));
    long elapsedMillis = (System.nanoTime() - started) / 1_000_000L;

    assertTrue(ex.getCause() instanceof SocketTimeoutException);
    assertTrue(elapsedMillis < 2_000L, "elapsed " + elapsedMillis + " ms");
  }

  @Test
  void oversizedReplyIsCapped() throws Exception {
    respond("OK" + "x".repeat(1_000));

    String ack = new TcpCommandTransport(1_000, 1_000).send(device, CommandType.REQUEST1);

    assertEquals(TcpCommandTransport.MAX_ACK_CHARS, ack.length());
    assertTrue(ack.startsWith("OKx"));
  }

  @Test
  void closedPortIsFailure() throws IOException {
    server.close();

    assertThrows(DispatchException.class,
        () -> new TcpCommandTransport(500, 500).send(device, CommandType.EEPROM1));
  }

  private CompletableFuture<String> respond(String reply) {
    return CompletableFuture.supplyAsync(() -> {
      try (Socket socket = server.accept()) {
        String line = new BufferedReader(
            new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII)).readLine();
        OutputStream out = socket.getOutputStream();
        out.write((reply + "\n").getBytes(StandardCharsets.US_ASCII));
        out.flush();
        return line;
      } catch (IOException ex) {
        throw new IllegalStateException(ex);
      }
    });
  }
}
