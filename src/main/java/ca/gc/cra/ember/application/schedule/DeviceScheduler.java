package ca.gc.cra.ember.application.schedule;

import ca.gc.cra.ember.application.port.ClockPort;
import ca.gc.cra.ember.application.port.CommandTransport;
import ca.gc.cra.ember.application.port.ConnectionListener;
import ca.gc.cra.ember.application.port.DispatchException;
import ca.gc.cra.ember.application.port.DispatchListener;
import ca.gc.cra.ember.application.port.MetricNames;
import ca.gc.cra.ember.application.port.MetricsPort;
import ca.gc.cra.ember.domain.device.Command;
import ca.gc.cra.ember.domain.device.CommandType;
import ca.gc.cra.ember.domain.device.Device;
import ca.gc.cra.ember.domain.device.DispatchOutcome;
import ca.gc.cra.ember.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.ember.logging.LogThrottle;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Polls registered devices on their own cadence and enables continuous reporting.
 * <p><strong>Cadence:</strong> every tick, each device is evaluated independently and receives at most one
 * command:</p>
 * <ol>
 *   <li>{@code PERIOD_ON} for a Continuous device that has not acknowledged it yet, spaced by
 *   {@link SchedulerSettings#periodOnRetryMillis()} while it keeps failing;</li>
 *   <li>{@code REQUEST1} once {@code pollInterval} has elapsed since the previous one;</li>
 *   <li>{@code EEPROM1} when the optional refresh is enabled and due.</li>
 * </ol>
 * <p><strong>Isolation:</strong> a device never has two commands in flight; different devices dispatch
 * concurrently on a bounded pool. A failure keeps the device scheduled and is logged at most once per
 * {@link SchedulerSettings#failureLogIntervalSeconds()}.</p>
 * <p><strong>Shutdown:</strong> {@link #close()} stops ticking, then waits for already selected dispatches.</p>
 *
 * @since 0.1.0
 */
public final class DeviceScheduler implements ConnectionListener, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DeviceScheduler.class);
  private static final long NEVER = Long.MIN_VALUE;

  private final DeviceRegistry registry;
  private final CommandTransport transport;
  private final SchedulerSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Executor dispatchExecutor;
  private final ExecutorService ownedDispatchPool;
  private final LogThrottle failureLog;
  private final List<DispatchListener> listeners = new CopyOnWriteArrayList<>();
  private final ConcurrentMap<String, DeviceState> states = new ConcurrentHashMap<>();
  private final AtomicBoolean running = new AtomicBoolean();
  private volatile ScheduledExecutorService ticker;

  public DeviceScheduler(
      DeviceRegistry registry,
      CommandTransport transport,
      SchedulerSettings settings,
      ClockPort clock,
      MetricsPort metrics) {
    this(registry, transport, settings, clock, metrics,
        ExecutorFactories.newFixedPool(settings.dispatchThreads(), "ember-dispatch"), true);
  }

  /**
   * Creates a scheduler that dispatches on a caller-supplied executor, which {@link #close()} leaves running.
   */
  public DeviceScheduler(
      DeviceRegistry registry,
      CommandTransport transport,
      SchedulerSettings settings,
      ClockPort clock,
      MetricsPort metrics,
      Executor dispatchExecutor) {
    this(registry, transport, settings, clock, metrics, dispatchExecutor, false);
  }

  private DeviceScheduler(
      DeviceRegistry registry,
      CommandTransport transport,
      SchedulerSettings settings,
      ClockPort clock,
      MetricsPort metrics,
      Executor dispatchExecutor,
      boolean owned) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
    this.ownedDispatchPool = owned ? (ExecutorService) dispatchExecutor : null;
    this.failureLog = new LogThrottle(clock, settings.failureLogIntervalSeconds() * 1_000L);
  }

  public void addDispatchListener(DispatchListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Starts ticking at {@link SchedulerSettings#tickMillis()}. The first tick runs immediately.
   *
   * @throws IllegalStateException when already started
   */
  public void start() {
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("scheduler already started");
    }
    ScheduledExecutorService executor = ExecutorFactories.newSingleScheduler("ember-scheduler");
    ticker = executor;
    executor.scheduleWithFixedDelay(this::safeTick, 0L, settings.tickMillis(), TimeUnit.MILLISECONDS);
    log.info("Device scheduler started (tick={}ms, devices={})", settings.tickMillis(), registry.list().size());
  }

  /**
   * Evaluates every device once and hands due commands to the dispatch executor.
   *
   * @return number of dispatches started
   */
  public int tick() {
    long now = clock.nowMillis();
    List<Device> devices = registry.list();
    Set<String> present = new HashSet<>();
    int started = 0;
    for (Device device : devices) {
      present.add(device.id());
      DeviceState state = states.computeIfAbsent(device.id(), id -> new DeviceState());
      if (!state.inFlight.compareAndSet(false, true)) {
        continue;
      }
      CommandType due = select(device, state, now);
      if (due == null) {
        state.inFlight.set(false);
        continue;
      }
      Command command = new Command(due, device, now);
      try {
        dispatchExecutor.execute(() -> dispatch(command, state));
        started++;
      } catch (RejectedExecutionException ex) {
        state.inFlight.set(false);
        log.warn("Dispatch of {} to {} rejected; scheduler is shutting down", due, device.id());
      }
    }
    states.keySet().retainAll(present);
    return started;
  }

  /**
   * Re-arms {@code PERIOD_ON} for Continuous devices registered at a reconnecting address.
   *
   * @param ip peer address of the reconnecting unit
   * @return number of devices re-armed
   */
  public int onDeviceReconnected(String ip) {
    int rearmed = 0;
    for (Device device : registry.findByIp(ip)) {
      if (!device.continuous()) {
        continue;
      }
      DeviceState state = states.computeIfAbsent(device.id(), id -> new DeviceState());
      synchronized (state) {
        state.periodOnAcknowledged = false;
        state.nextPeriodOnMillis = NEVER;
      }
      rearmed++;
      log.info("Device {} reconnected from {}; PERIOD_ON re-armed", device.id(), ip);
    }
    return rearmed;
  }

  @Override
  public void onConnected(String peerAddress) {
    onDeviceReconnected(peerAddress);
  }

  /**
   * Whether {@code PERIOD_ON} has been acknowledged by a device since start or last reconnect.
   *
   * @param deviceId device id
   * @return {@code true} once acknowledged
   */
  public boolean periodOnAcknowledged(String deviceId) {
    DeviceState state = states.get(deviceId);
    if (state == null) {
      return false;
    }
    synchronized (state) {
      return state.periodOnAcknowledged;
    }
  }

  private CommandType select(Device device, DeviceState state, long now) {
    synchronized (state) {
      if (device.continuous() && !state.periodOnAcknowledged
          && (state.nextPeriodOnMillis == NEVER || now >= state.nextPeriodOnMillis)) {
        state.nextPeriodOnMillis = now + settings.periodOnRetryMillis();
        return CommandType.PERIOD_ON;
      }
      if (state.lastRequestMillis == NEVER || now - state.lastRequestMillis >= device.pollIntervalMillis()) {
        state.lastRequestMillis = now;
        return CommandType.REQUEST1;
      }
      long refresh = settings.eepromRefreshMillis();
      if (refresh > 0 && (state.lastEepromMillis == NEVER || now - state.lastEepromMillis >= refresh)) {
        state.lastEepromMillis = now;
        return CommandType.EEPROM1;
      }
      return null;
    }
  }

  private void dispatch(Command command, DeviceState state) {
    Device device = command.device();
    MDC.put("device", device.id());
    long started = clock.nowMillis();
    DispatchOutcome outcome;
    try {
      String ack = transport.send(device, command.type());
      outcome = DispatchOutcome.success(command, clock.nowMillis() - started, ack);
    } catch (DispatchException ex) {
      outcome = DispatchOutcome.failure(command, clock.nowMillis() - started, ex.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      outcome = DispatchOutcome.failure(command, clock.nowMillis() - started, "interrupted");
    } catch (RuntimeException ex) {
      log.error("Unexpected failure dispatching {} to {}", command.type(), device.id(), ex);
      outcome = DispatchOutcome.failure(command, clock.nowMillis() - started, ex.toString());
    }
    try {
      record(outcome, state);
      for (DispatchListener listener : listeners) {
        try {
          listener.onDispatch(outcome);
        } catch (RuntimeException ex) {
          log.warn("Dispatch listener {} failed", listener, ex);
        }
      }
    } finally {
      state.inFlight.set(false);
      MDC.remove("device");
    }
  }

  private void record(DispatchOutcome outcome, DeviceState state) {
    Command command = outcome.command();
    String deviceId = command.device().id();
    if (outcome.success()) {
      metrics.increment(MetricNames.DISPATCH_SUCCESS, deviceId);
      boolean recovered;
      synchronized (state) {
        if (command.type() == CommandType.PERIOD_ON) {
          state.periodOnAcknowledged = true;
        }
        recovered = state.failing;
        state.failing = false;
      }
      if (recovered) {
        failureLog.reset(deviceId);
        log.info("Device {} recovered ({} acknowledged in {}ms)", deviceId, command.type(), outcome.latencyMillis());
      } else {
        log.debug("Device {} acknowledged {} in {}ms", deviceId, command.type(), outcome.latencyMillis());
      }
      return;
    }
    metrics.increment(MetricNames.DISPATCH_FAILURE, deviceId);
    synchronized (state) {
      state.failing = true;
    }
    long suppressed = failureLog.tryAcquire(deviceId);
    if (suppressed >= 0) {
      log.warn("Dispatch of {} to {} ({}:{}) failed: {} (suppressed {} earlier failure(s))",
          command.type(), deviceId, command.device().ip(), command.device().port(), outcome.detail(), suppressed);
    }
  }

  private void safeTick() {
    try {
      tick();
    } catch (RuntimeException ex) {
      log.error("Scheduler tick failed", ex);
    }
  }

  /**
   * Stops ticking and waits for in-flight dispatches to finish.
   */
  @Override
  public void close() {
    ScheduledExecutorService executor = ticker;
    running.set(false);
    if (executor != null) {
      executor.shutdown();
      awaitQuietly(executor, settings.tickMillis() + 1_000L, "scheduler tick");
    }
    if (ownedDispatchPool != null) {
      ownedDispatchPool.shutdown();
      long budget = settings.connectTimeoutMillis() + settings.ackTimeoutMillis() + 1_000L;
      awaitQuietly(ownedDispatchPool, budget, "device dispatch");
    }
    log.info("Device scheduler stopped");
  }

  private static void awaitQuietly(ExecutorService executor, long timeoutMillis, String what) {
    try {
      if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        log.warn("Timed out waiting for {} to finish; forcing shutdown", what);
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class DeviceState {
    private final AtomicBoolean inFlight = new AtomicBoolean();
    private long lastRequestMillis = NEVER;
    private long lastEepromMillis = NEVER;
    private long nextPeriodOnMillis = NEVER;
    private boolean periodOnAcknowledged;
    private boolean failing;
  }
}
