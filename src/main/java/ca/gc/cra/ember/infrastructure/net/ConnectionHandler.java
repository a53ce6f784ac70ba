package ca.gc.cra.ember.infrastructure.net;

import ca.gc.cra.ember.application.port.ConnectionListener;
import ca.gc.cra.ember.application.port.MetricNames;
import ca.gc.cra.ember.application.port.MetricsPort;
import ca.gc.cra.ember.application.port.RecordSink;
import ca.gc.cra.ember.domain.device.CommandType;
import ca.gc.cra.ember.domain.record.CalibrationBlock;
import ca.gc.cra.ember.domain.record.DecodeResult;
import ca.gc.cra.ember.domain.record.DecodedRecord;
import ca.gc.cra.ember.domain.record.Identity;
import ca.gc.cra.ember.domain.record.ParseError;
import ca.gc.cra.ember.domain.record.SensorSample;
import ca.gc.cra.ember.domain.record.ThermalFrame;
import ca.gc.cra.ember.infrastructure.protocol.SensorPacketDecoder;
import ca.gc.cra.ember.logging.LogThrottle;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.OptionalDouble;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Serves one field-unit connection: frames packets, decodes them, resolves their location, and hands records
 * to the {@link RecordSink}. Every failure stays inside this connection.
 */
final class ConnectionHandler implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionHandler.class);

  private final Socket socket;
  private final IngestSettings settings;
  private final SensorPacketDecoder decoder;
  private final RecordSink sink;
  private final MetricsPort metrics;
  private final List<ConnectionListener> listeners;
  private final LogThrottle errorLog;
  private final BooleanSupplier running;
  private final Runnable onClose;

  ConnectionHandler(
      Socket socket,
      IngestSettings settings,
      SensorPacketDecoder decoder,
      RecordSink sink,
      MetricsPort metrics,
      List<ConnectionListener> listeners,
      LogThrottle errorLog,
      BooleanSupplier running,
      Runnable onClose) {
    this.socket = socket;
    this.settings = settings;
    this.decoder = decoder;
    this.sink = sink;
    this.metrics = metrics;
    this.listeners = listeners;
    this.errorLog = errorLog;
    this.running = running;
    this.onClose = onClose;
  }

  @Override
  public void run() {
    String peer = socket.getInetAddress().getHostAddress();
    ConnectionContext context = new ConnectionContext(peer, decoder.calibration());
    MDC.put("peer", peer);
    log.info("Field unit connected from {}:{}", peer, socket.getPort());
    try (Socket s = socket) {
      s.setSoTimeout(settings.readTimeoutMillis());
      s.setTcpNoDelay(true);
      notifyListeners(peer);
      if (settings.autoPeriodOnConnect()) {
        sendPeriodOn(s);
      }
      PacketFramer framer = new PacketFramer(s.getInputStream(), settings.maxPacketBytes());
      while (running.getAsBoolean()) {
        PacketFramer.Frame frame;
        try {
          frame = framer.next();
        } catch (SocketTimeoutException timeout) {
          continue;
        }
        if (frame == null) {
          break;
        }
        handle(context, frame);
      }
    } catch (IOException ex) {
      if (running.getAsBoolean()) {
        log.info("Connection from {} closed: {}", peer, ex.getMessage());
      } else {
        log.debug("Connection from {} closed during shutdown", peer, ex);
      }
    } finally {
      log.info("Field unit {} disconnected (location={}, packets={}, errors={})",
          peer, context.effectiveLocation(), context.received(), context.errors());
      MDC.remove("location");
      MDC.remove("peer");
      onClose.run();
    }
  }

  void handle(ConnectionContext context, PacketFramer.Frame frame) {
    if (frame.oversized()) {
      recordError(context, context.effectiveLocation(),
          "packet exceeds " + settings.maxPacketBytes() + " bytes", "");
      return;
    }
    DecodeResult result = decoder.decode(frame.bytes(), context.calibration());
    if (result instanceof DecodeResult.Failed failed) {
      ParseError error = failed.error();
      String location = error.locationHint() != null ? error.locationHint() : context.effectiveLocation();
      recordError(context, location, error.reason(), error.excerpt());
      return;
    }
    DecodeResult.Decoded decoded = (DecodeResult.Decoded) result;
    DecodedRecord record = decoded.record();
    String location;
    if (record instanceof Identity identity && !applyIdentity(context, identity)) {
      location = context.effectiveLocation();
    } else {
      location = context.resolve(decoded.locationId());
    }
    MDC.put("location", location);
    context.countReceived();
    metrics.increment(MetricNames.PACKETS_RECEIVED, location);
    if (record instanceof ThermalFrame) {
      metrics.increment(MetricNames.FRAMES_THERMAL, location);
    } else if (record instanceof SensorSample) {
      metrics.increment(MetricNames.SAMPLES_SENSOR, location);
    } else if (record instanceof CalibrationBlock block) {
      applyCalibration(context, block);
      return;
    }
    sink.submit(location, record);
  }

  /**
   * Records the serial and binds the announced location.
   *
   * @return {@code false} when the connection is already bound to a different location
   */
  private boolean applyIdentity(ConnectionContext context, Identity identity) {
    if (identity.serial() != null) {
      context.serial(identity.serial());
      log.debug("Peer {} announced serial {}", context.peerAddress(), identity.serial());
    }
    String location = identity.locationId();
    if (location == null) {
      return true;
    }
    if (context.bind(location)) {
      log.info("Connection from {} bound to location {}", context.peerAddress(), location);
      return true;
    }
    log.warn("Connection from {} already bound to {}; ignoring location {}",
        context.peerAddress(), context.boundLocation(), location);
    return false;
  }

  private void applyCalibration(ConnectionContext context, CalibrationBlock block) {
    if (!settings.useDeviceOffset()) {
      log.debug("Calibration block from {} ignored (device offset disabled)", context.peerAddress());
      return;
    }
    OptionalDouble offset = block.deviceOffsetCelsius();
    if (offset.isEmpty()) {
      log.warn("Calibration block from {} carries an implausible device offset; ignored", context.peerAddress());
      return;
    }
    context.calibration(decoder.calibration().withDeviceOffset(offset.getAsDouble()));
    log.info("Applying device offset {} C to frames from {}", offset.getAsDouble(), context.peerAddress());
  }

  private void recordError(ConnectionContext context, String location, String reason, String excerpt) {
    context.countError();
    metrics.increment(MetricNames.PACKETS_ERRORS, location);
    long suppressed = errorLog.tryAcquire(context.peerAddress());
    if (suppressed >= 0) {
      log.warn("Dropped malformed packet from {} (location={}): {} [{}] (suppressed {} earlier)",
          context.peerAddress(), location, reason, excerpt, suppressed);
    }
  }

  private void notifyListeners(String peer) {
    for (ConnectionListener listener : listeners) {
      try {
        listener.onConnected(peer);
      } catch (RuntimeException ex) {
        log.warn("Connection listener {} failed for {}", listener, peer, ex);
      }
    }
  }

  private static void sendPeriodOn(Socket s) {
    try {
      OutputStream out = s.getOutputStream();
      out.write(CommandType.PERIOD_ON.wireLine().getBytes(StandardCharsets.US_ASCII));
      out.flush();
    } catch (IOException ex) {
      log.warn("Failed to send PERIOD_ON to {}: {}", s.getInetAddress().getHostAddress(), ex.getMessage());
    }
  }
}
