package ca.gc.cra.ember.infrastructure.net;

import ca.gc.cra.ember.config.SimulatorConfig;
import ca.gc.cra.ember.domain.record.Identity;
import ca.gc.cra.ember.domain.record.PacketFormat;
import ca.gc.cra.ember.domain.record.SensorSample;
import ca.gc.cra.ember.domain.record.ThermalCalibration;
import ca.gc.cra.ember.domain.record.ThermalFrame;
import ca.gc.cra.ember.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.ember.infrastructure.protocol.SensorPacketEncoder;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Impersonates field units for bench tests: each unit connects, announces its serial and location, then
 * alternates thermal frames and sensor samples at a fixed rate.
 *
 * <p>Frames hold an ambient background of about 24 °C with one hotspot at the configured temperature.</p>
 *
 * @since 0.1.0
 */
public final class FieldUnitSimulator {
  private static final Logger log = LoggerFactory.getLogger(FieldUnitSimulator.class);
  private static final int CONNECT_TIMEOUT_MILLIS = 5_000;
  private static final double AMBIENT_CELSIUS = 24.0d;

  private final SimulatorConfig config;
  private final ThermalCalibration calibration;

  public FieldUnitSimulator(SimulatorConfig config) {
    this(config, ThermalCalibration.defaults());
  }

  /**
   * Creates a simulator that encodes temperatures with the given calibration.
   *
   * @param config simulator settings
   * @param calibration conversion the receiving service applies to raw words
   */
  public FieldUnitSimulator(SimulatorConfig config, ThermalCalibration calibration) {
    this.config = Objects.requireNonNull(config, "config");
    this.calibration = Objects.requireNonNull(calibration, "calibration");
  }

  /**
   * Runs every configured unit concurrently and waits for them to finish.
   *
   * @return per-run totals
   * @throws InterruptedException when interrupted while waiting
   */
  public Report run() throws InterruptedException {
    ExecutorService pool = ExecutorFactories.newFixedPool(config.connections(), "ember-sim");
    List<Future<Integer>> units = new ArrayList<>();
    try {
      for (int i = 0; i < config.connections(); i++) {
        final int index = i;
        units.add(pool.submit(() -> runUnit(index)));
      }
      long sent = 0;
      int failed = 0;
      for (Future<Integer> unit : units) {
        try {
          sent += unit.get();
        } catch (ExecutionException ex) {
          failed++;
          log.warn("Simulated unit failed: {}", ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage());
        }
      }
      return new Report(config.connections() - failed, failed, sent);
    } finally {
      pool.shutdownNow();
      pool.awaitTermination(5, TimeUnit.SECONDS);
    }
  }

  private int runUnit(int index) throws IOException, InterruptedException {
    String location = config.locationFor(index);
    String serial = config.serialFor(index);
    PacketFormat format = config.format();
    Random random = new Random(config.seed() + index);
    long intervalNanos = (long) (1_000_000_000L / config.rate());
    int sent = 0;
    MDC.put("location", location == null ? "-" : location);
    try (Socket socket = new Socket()) {
      socket.connect(new InetSocketAddress(config.host(), config.port()), CONNECT_TIMEOUT_MILLIS);
      socket.setTcpNoDelay(true);
      OutputStream out = socket.getOutputStream();
      out.write(SensorPacketEncoder.encodeLine(format, location, Identity.ofSerial(serial)));
      if (location != null) {
        out.write(SensorPacketEncoder.encodeLine(format, location, Identity.ofLocation(location)));
      }
      out.flush();
      log.debug("Unit {} connected as {} ({})", index, serial, format);
      long next = System.nanoTime();
      for (int p = 0; p < config.packets(); p++) {
        if (p % 2 == 0) {
          out.write(SensorPacketEncoder.encodeLine(format, location, frame(random)));
        } else {
          out.write(SensorPacketEncoder.encodeLine(format, location, sample(random)));
        }
        out.flush();
        sent++;
        next += intervalNanos;
        long waitNanos = next - System.nanoTime();
        if (waitNanos > 0) {
          TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
      }
      socket.shutdownOutput();
    } finally {
      MDC.remove("location");
    }
    log.debug("Unit {} finished after {} packets", index, sent);
    return sent;
  }

  ThermalFrame frame(Random random) {
    int[] raw = new int[ThermalFrame.CELLS];
    int hotspot = random.nextInt(ThermalFrame.CELLS);
    for (int i = 0; i < raw.length; i++) {
      double celsius = i == hotspot ? config.hotspotCelsius() : AMBIENT_CELSIUS + random.nextGaussian() * 0.5d;
      raw[i] = toRaw(celsius);
    }
    return new ThermalFrame(raw, calibration);
  }

  SensorSample sample(Random random) {
    int adc1 = 800 + random.nextInt(400);
    int adc2 = 200 + random.nextInt(300);
    return new SensorSample(adc1, adc2, random.nextInt(20) == 0, System.currentTimeMillis());
  }

  private int toRaw(double celsius) {
    long word = Math.round((celsius - calibration.offset()) / calibration.scale());
    if (calibration.signed()) {
      word = Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, word));
      return (int) word & 0xFFFF;
    }
    return (int) Math.max(0, Math.min(0xFFFF, word));
  }

  /**
   * Outcome of a simulator run.
   *
   * @param unitsCompleted units that sent every packet
   * @param unitsFailed units that could not connect or lost their connection
   * @param packetsSent frames and samples sent, excluding identity packets
   */
  public record Report(int unitsCompleted, int unitsFailed, long packetsSent) {}
}
