package ca.gc.cra.ember.config;

import ca.gc.cra.ember.application.fusion.ConfidencePolicy;
import ca.gc.cra.ember.application.fusion.FusionDispatcher;
import ca.gc.cra.ember.application.fusion.SensorFusionEngine;
import ca.gc.cra.ember.application.port.ClockPort;
import ca.gc.cra.ember.application.port.CommandTransport;
import ca.gc.cra.ember.application.port.DeviceRegistryStore;
import ca.gc.cra.ember.application.port.MetricsPort;
import ca.gc.cra.ember.application.rate.AdaptiveRateController;
import ca.gc.cra.ember.application.schedule.DeviceRegistry;
import ca.gc.cra.ember.application.schedule.DeviceScheduler;
import ca.gc.cra.ember.infrastructure.device.TcpCommandTransport;
import ca.gc.cra.ember.infrastructure.device.YamlDeviceRegistryStore;
import ca.gc.cra.ember.infrastructure.events.LoggingAlarmListener;
import ca.gc.cra.ember.infrastructure.events.LoggingDispatchListener;
import ca.gc.cra.ember.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.ember.infrastructure.net.TcpIngestionServer;
import ca.gc.cra.ember.infrastructure.protocol.SensorPacketDecoder;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds the EMBER service graph once from an {@link EmberConfig}.
 * <p><strong>Why:</strong> The shared {@link MetricsPort}, {@link ClockPort}, and listeners are created here and
 * passed through constructors; no component reaches for global state.</p>
 * <p><strong>Wiring:</strong> ingestion server &rarr; {@link FusionDispatcher} &rarr; {@link SensorFusionEngine}
 * &rarr; alarm listeners; ingestion connection events &rarr; {@link DeviceScheduler}.</p>
 * <p><strong>Lifecycle:</strong> {@link #start()} loads the registry, starts the scheduler, binds the
 * listener and, when streams are mapped, starts the rate governor; {@link #close()} stops them in reverse
 * order.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final EmberConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final SensorPacketDecoder decoder;
  private final SensorFusionEngine fusionEngine;
  private final FusionDispatcher fusionDispatcher;
  private final TcpIngestionServer ingestionServer;
  private final DeviceRegistry deviceRegistry;
  private final DeviceScheduler scheduler;
  private final AdaptiveRateController rateController;
  private ScheduledExecutorService rateGovernor;
  private boolean started;
  private boolean closed;

  /**
   * Wires the production adapters.
   *
   * @param config validated configuration
   * @param metrics shared metrics port
   * @param clock shared clock
   */
  public CompositionRoot(EmberConfig config, MetricsPort metrics, ClockPort clock) {
    this(config, metrics, clock,
        new YamlDeviceRegistryStore(config.registry()),
        new TcpCommandTransport(config.scheduler().connectTimeoutMillis(), config.scheduler().ackTimeoutMillis()));
  }

  /**
   * Wires the graph with explicit registry storage and command transport.
   *
   * @param config validated configuration
   * @param metrics shared metrics port
   * @param clock shared clock
   * @param store device registry storage
   * @param transport device command transport
   */
  public CompositionRoot(
      EmberConfig config,
      MetricsPort metrics,
      ClockPort clock,
      DeviceRegistryStore store,
      CommandTransport transport) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.decoder = new SensorPacketDecoder(config.thermal(), clock);
    this.fusionEngine = new SensorFusionEngine(
        config.fusion(), ConfidencePolicy.forName(config.confidencePolicy()), clock, metrics, config.streams());
    this.fusionEngine.addAlarmListener(new LoggingAlarmListener());
    this.fusionDispatcher = new FusionDispatcher(fusionEngine, metrics);
    this.ingestionServer = new TcpIngestionServer(config.ingest(), decoder, fusionDispatcher, metrics, clock);
    this.deviceRegistry = new DeviceRegistry(store);
    this.scheduler = new DeviceScheduler(deviceRegistry, transport, config.scheduler(), clock, metrics);
    this.scheduler.addDispatchListener(new LoggingDispatchListener());
    this.rateController = new AdaptiveRateController(config.rate(), clock, metrics);
    if (config.schedulerEnabled()) {
      ingestionServer.addConnectionListener(scheduler);
    }
  }

  /**
   * Starts the scheduler (when enabled) and the ingestion listener.
   *
   * @throws IOException when the registry cannot be read or the listener cannot bind
   */
  public synchronized void start() throws IOException {
    if (started || closed) {
      throw new IllegalStateException(closed ? "already closed" : "already started");
    }
    if (config.schedulerEnabled()) {
      deviceRegistry.load();
      scheduler.start();
    } else {
      log.info("Device scheduler disabled");
    }
    try {
      ingestionServer.start();
    } catch (IOException ex) {
      scheduler.close();
      throw ex;
    }
    log.info("EMBER listening on {}:{} (policy={}, streams={})",
        config.ingest().bindHost(), ingestionServer.port(), config.confidencePolicy(), config.streams().size());
    if (!config.streams().isEmpty()) {
      long period = Math.max(100L, config.rate().cooldownMillis());
      rateGovernor = ExecutorFactories.newSingleScheduler("ember-rate");
      rateGovernor.scheduleWithFixedDelay(this::safeGovern, period, period, TimeUnit.MILLISECONDS);
    }
    started = true;
  }

  /**
   * Feeds the fusion backlog of each mapped stream's location into the rate controller.
   *
   * @return number of streams updated
   */
  public int governStreamRates() {
    int updated = 0;
    for (Map.Entry<String, String> stream : config.streams().entrySet()) {
      rateController.update(stream.getKey(), fusionDispatcher.depth(stream.getValue()));
      updated++;
    }
    return updated;
  }

  private void safeGovern() {
    try {
      governStreamRates();
    } catch (RuntimeException ex) {
      log.error("Rate governor update failed", ex);
    }
  }

  public EmberConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  public SensorPacketDecoder decoder() {
    return decoder;
  }

  public SensorFusionEngine fusionEngine() {
    return fusionEngine;
  }

  public FusionDispatcher fusionDispatcher() {
    return fusionDispatcher;
  }

  public TcpIngestionServer ingestionServer() {
    return ingestionServer;
  }

  public DeviceRegistry deviceRegistry() {
    return deviceRegistry;
  }

  public DeviceScheduler scheduler() {
    return scheduler;
  }

  public AdaptiveRateController rateController() {
    return rateController;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (rateGovernor != null) {
      rateGovernor.shutdownNow();
      rateGovernor = null;
    }
    ingestionServer.close();
    scheduler.close();
    fusionDispatcher.close();
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
    started = false;
  }
}
