package ca.gc.cra.ember.application.fusion;

import ca.gc.cra.ember.application.port.AlarmListener;
import ca.gc.cra.ember.application.port.ClockPort;
import ca.gc.cra.ember.application.port.MetricNames;
import ca.gc.cra.ember.application.port.MetricsPort;
import ca.gc.cra.ember.domain.fusion.FusionResult;
import ca.gc.cra.ember.domain.fusion.SensorChannel;
import ca.gc.cra.ember.domain.record.DecodedRecord;
import ca.gc.cra.ember.domain.record.Identity;
import ca.gc.cra.ember.domain.record.SensorSample;
import ca.gc.cra.ember.domain.record.ThermalFrame;
import ca.gc.cra.ember.validation.Strings;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Combines thermal, gas, smoke, flame, and vision readings into one alarm decision per
 * location.
 * <p><strong>Alarm rule:</strong> a channel triggers when its reading is at or above the configured threshold;
 * {@code alarm = sourcesTriggered >= minSources}. The reported confidence comes from the configured
 * {@link ConfidencePolicy}.</p>
 * <p><strong>Debounce:</strong> thermal frames pass through a per-location {@link HotCellGrid}; the thermal
 * channel reads the hottest cell still inside its decay window.</p>
 * <p><strong>Hold:</strong> after an alarm the decision for that location is frozen for
 * {@link FusionSettings#holdMillis()}; readings keep updating while it is held.</p>
 * <p><strong>Thread-safety:</strong> each location's state is guarded by its own monitor, so different locations
 * evaluate in parallel and one location is single-writer. {@link FusionDispatcher} additionally serializes
 * record delivery per location.</p>
 * <p><strong>Observability:</strong> counts {@value MetricNames#FUSION_INVOCATIONS} and
 * {@value MetricNames#FUSION_ALARMS} per location.</p>
 *
 * @since 0.1.0
 */
public final class SensorFusionEngine {
  private static final Logger log = LoggerFactory.getLogger(SensorFusionEngine.class);
  static final double TRIGGER_FLOOR = 0.05d;

  private final FusionSettings settings;
  private final ConfidencePolicy policy;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Map<String, String> streamLocations;
  private final List<AlarmListener> listeners = new CopyOnWriteArrayList<>();
  private final ConcurrentMap<String, FusionState> states = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, VisionReading> vision = new ConcurrentHashMap<>();

  /**
   * Creates an engine without stream mapping.
   *
   * @param settings validated fusion parameters
   * @param policy confidence aggregation
   * @param clock time source
   * @param metrics metrics sink
   */
  public SensorFusionEngine(
      FusionSettings settings, ConfidencePolicy policy, ClockPort clock, MetricsPort metrics) {
    this(settings, policy, clock, metrics, Map.of());
  }

  /**
   * Creates an engine.
   *
   * @param settings validated fusion parameters
   * @param policy confidence aggregation
   * @param clock time source
   * @param metrics metrics sink
   * @param streamLocations stream id to location id, used by {@link #submitStreamVision(String, double)}
   */
  public SensorFusionEngine(
      FusionSettings settings,
      ConfidencePolicy policy,
      ClockPort clock,
      MetricsPort metrics,
      Map<String, String> streamLocations) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.streamLocations = Map.copyOf(Objects.requireNonNull(streamLocations, "streamLocations"));
  }

  public void addAlarmListener(AlarmListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public FusionSettings settings() {
    return settings;
  }

  public ConfidencePolicy policy() {
    return policy;
  }

  /**
   * Evaluates a complete set of readings for a location.
   *
   * <p>All inputs are required. The hold period of the location applies: while held, the latched alarm is
   * returned with {@link FusionResult#held()} set.</p>
   *
   * @param locationId location
   * @param temperatureCelsius thermal reading
   * @param gasPpm gas concentration
   * @param smokePercent smoke level
   * @param flamePercent analog flame level
   * @param visionConfidence detector confidence in [0, 1]
   * @return decision
   * @throws IllegalArgumentException when a reading is NaN or infinite, or vision lies outside [0, 1]
   */
  public FusionResult fuse(
      String locationId,
      double temperatureCelsius,
      double gasPpm,
      double smokePercent,
      double flamePercent,
      double visionConfidence) {
    String location = Strings.requireNonBlank("locationId", locationId);
    requireFinite("temperature", temperatureCelsius);
    requireFinite("gas", gasPpm);
    requireFinite("smoke", smokePercent);
    requireFinite("flame", flamePercent);
    requireFinite("vision", visionConfidence);
    if (visionConfidence < 0d || visionConfidence > 1d) {
      throw new IllegalArgumentException("vision confidence must be within [0,1] (was " + visionConfidence + ")");
    }
    Readings readings = new Readings(
        temperatureCelsius, gasPpm, smokePercent, flamePercent, false, visionConfidence);
    FusionState state = state(location);
    synchronized (state) {
      return decide(state, readings, clock.nowMillis());
    }
  }

  /**
   * Applies a decoded record to the location state and re-evaluates it.
   *
   * @param locationId location the record belongs to
   * @param record decoded record
   * @return new decision for thermal frames and sensor samples; empty for identity and calibration records
   */
  public Optional<FusionResult> onRecord(String locationId, DecodedRecord record) {
    Objects.requireNonNull(record, "record");
    FusionState state = state(Strings.requireNonBlank("locationId", locationId));
    long now = clock.nowMillis();
    synchronized (state) {
      if (record instanceof ThermalFrame frame) {
        state.applyFrame(frame, settings.limit(SensorChannel.TEMPERATURE).threshold(), now);
      } else if (record instanceof SensorSample sample) {
        state.applySample(sample, settings.gasFromAdc1());
      } else {
        if (record instanceof Identity identity && identity.serial() != null) {
          state.serial = identity.serial();
        }
        return Optional.empty();
      }
      Readings readings = new Readings(
          state.thermalReading(now),
          state.gasPpm,
          state.smokePercent,
          state.flamePercent,
          state.samplesApplied > 0 && state.flame == (settings.flameActiveValue() == 1),
          visionFor(state.locationId, now));
      return Optional.of(decide(state, readings, now));
    }
  }

  /**
   * Records a detector confidence for a location. It participates in evaluations until it is older than
   * {@link FusionSettings#visionMaxAgeMillis()}.
   *
   * @param locationId location
   * @param confidence confidence in [0, 1]
   */
  public void submitVision(String locationId, double confidence) {
    String location = Strings.requireNonBlank("locationId", locationId);
    if (Double.isNaN(confidence) || confidence < 0d || confidence > 1d) {
      throw new IllegalArgumentException("vision confidence must be within [0,1] (was " + confidence + ")");
    }
    vision.put(location, new VisionReading(confidence, clock.nowMillis()));
  }

  /**
   * Records a detector confidence for a camera stream, resolved through the stream map.
   *
   * @param streamId stream id
   * @param confidence confidence in [0, 1]
   * @return {@code false} when the stream is not mapped to a location
   */
  public boolean submitStreamVision(String streamId, double confidence) {
    String location = streamLocations.get(streamId);
    if (location == null) {
      log.debug("Ignoring vision confidence for unmapped stream {}", streamId);
      return false;
    }
    submitVision(location, confidence);
    return true;
  }

  /**
   * Returns a copy of the state of a location.
   *
   * @param locationId location
   * @return snapshot, or empty when no record has been seen for the location
   */
  public Optional<FusionSnapshot> snapshot(String locationId) {
    FusionState state = states.get(locationId);
    if (state == null) {
      return Optional.empty();
    }
    long now = clock.nowMillis();
    synchronized (state) {
      return Optional.of(state.snapshot(now));
    }
  }

  public Set<String> locations() {
    return Set.copyOf(states.keySet());
  }

  private FusionState state(String locationId) {
    return states.computeIfAbsent(locationId, id -> new FusionState(id, settings.hotCellDecayMillis()));
  }

  private double visionFor(String locationId, long now) {
    VisionReading reading = vision.get(locationId);
    if (reading == null || now - reading.atMillis() > settings.visionMaxAgeMillis()) {
      return Double.NaN;
    }
    return reading.confidence();
  }

  private FusionResult decide(FusionState state, Readings readings, long now) {
    metrics.increment(MetricNames.FUSION_INVOCATIONS, state.locationId);
    if (state.holding(now)) {
      FusionResult held = state.latched.asHeld(now);
      state.lastResult = held;
      return held;
    }
    FusionResult result = assess(state.locationId, readings, now);
    state.lastResult = result;
    if (result.alarm()) {
      state.latched = result;
      state.holdUntilMillis = now + settings.holdMillis();
      metrics.increment(MetricNames.FUSION_ALARMS, state.locationId);
      notifyListeners(result);
    } else {
      state.latched = null;
    }
    return result;
  }

  FusionResult assess(String locationId, Readings readings, long now) {
    Map<SensorChannel, Double> triggered = new EnumMap<>(SensorChannel.class);
    consider(triggered, SensorChannel.TEMPERATURE, readings.temperature());
    consider(triggered, SensorChannel.GAS, readings.gas());
    consider(triggered, SensorChannel.SMOKE, readings.smoke());
    consider(triggered, SensorChannel.VISION, readings.vision());
    if (readings.flameFlag()) {
      triggered.put(SensorChannel.FLAME, 1.0d);
    } else {
      consider(triggered, SensorChannel.FLAME, readings.flame());
    }
    int sources = triggered.size();
    boolean alarm = sources >= settings.minSources();
    double confidence = triggered.isEmpty() ? 0d : clamp(policy.score(triggered));
    return new FusionResult(locationId, alarm, confidence, sources, triggered.keySet(), false, now);
  }

  private void consider(Map<SensorChannel, Double> triggered, SensorChannel channel, double value) {
    if (Double.isNaN(value)) {
      return;
    }
    ChannelLimit limit = settings.limit(channel);
    if (limit.triggers(value)) {
      triggered.put(channel, Math.max(TRIGGER_FLOOR, limit.exceedance(value)));
    }
  }

  private void notifyListeners(FusionResult result) {
    log.debug("Alarm raised for location {} (sources={}, confidence={})",
        result.locationId(), result.contributing(), String.format("%.2f", result.confidence()));
    for (AlarmListener listener : listeners) {
      try {
        listener.onAlarm(result);
      } catch (RuntimeException ex) {
        log.warn("Alarm listener {} failed for location {}", listener, result.locationId(), ex);
      }
    }
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0d;
    }
    return Math.max(0d, Math.min(1d, value));
  }

  private static void requireFinite(String name, double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException(name + " reading must be a finite number (was " + value + ")");
    }
  }

  /** Channel inputs of one evaluation; NaN means "no reading". */
  record Readings(double temperature, double gas, double smoke, double flame, boolean flameFlag, double vision) {}

  private record VisionReading(double confidence, long atMillis) {}
}
