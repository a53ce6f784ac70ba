package ca.gc.cra.ember.application.fusion;

import ca.gc.cra.ember.domain.fusion.SensorChannel;
import ca.gc.cra.ember.validation.Numbers;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Validated fusion parameters.
 *
 * @param limits per-channel threshold and saturation; every {@link SensorChannel} must be present
 * @param minSources channels that must trigger before an alarm is raised (1..5)
 * @param holdMillis period after an alarm during which the decision is frozen
 * @param hotCellDecayMillis time a thermal cell stays hot after its last exceedance
 * @param visionMaxAgeMillis age after which a submitted vision confidence is ignored
 * @param flameActiveValue digital flame input value (0 or 1) that means "flame present"
 * @param mailboxCapacity per-location handoff queue bound
 * @param workers fusion worker threads shared by all locations
 * @param gasFromAdc1 derive the gas channel from adc1 through the MQ-135 curve; adc1 also feeds smoke, so when
 *     {@code false} sensor samples leave gas unset
 */
public record FusionSettings(
    Map<SensorChannel, ChannelLimit> limits,
    int minSources,
    long holdMillis,
    long hotCellDecayMillis,
    long visionMaxAgeMillis,
    int flameActiveValue,
    int mailboxCapacity,
    int workers,
    boolean gasFromAdc1) {

  public FusionSettings {
    Objects.requireNonNull(limits, "limits");
    EnumMap<SensorChannel, ChannelLimit> copy = new EnumMap<>(SensorChannel.class);
    copy.putAll(limits);
    for (SensorChannel channel : SensorChannel.values()) {
      if (copy.get(channel) == null) {
        throw new IllegalArgumentException("missing limit for channel " + channel);
      }
    }
    ChannelLimit vision = copy.get(SensorChannel.VISION);
    Numbers.requireRange("fusion.vision.threshold", vision.threshold(), 0d, 1d);
    limits = Map.copyOf(copy);
    Numbers.requireRange("fusion.minSources", minSources, 1, SensorChannel.values().length);
    Numbers.requireRange("fusion.holdMillis", holdMillis, 0, 3_600_000L);
    Numbers.requireRange("fusion.hotCellDecayMillis", hotCellDecayMillis, 0, 3_600_000L);
    Numbers.requireRange("fusion.visionMaxAgeMillis", visionMaxAgeMillis, 1, 3_600_000L);
    Numbers.requireRange("fusion.flameActiveValue", flameActiveValue, 0, 1);
    Numbers.requireRange("fusion.mailboxCapacity", mailboxCapacity, 1, 65_536);
    Numbers.requireRange("fusion.workers", workers, 1, 64);
  }

  /**
   * Creates settings with the gas channel left to direct {@code fuse} input.
   */
  public FusionSettings(
      Map<SensorChannel, ChannelLimit> limits,
      int minSources,
      long holdMillis,
      long hotCellDecayMillis,
      long visionMaxAgeMillis,
      int flameActiveValue,
      int mailboxCapacity,
      int workers) {
    this(limits, minSources, holdMillis, hotCellDecayMillis, visionMaxAgeMillis, flameActiveValue,
        mailboxCapacity, workers, false);
  }

  public static FusionSettings defaults() {
    return new FusionSettings(
        defaultLimits(),
        2,
        5_000L,
        5_000L,
        2_000L,
        1,
        256,
        Math.max(2, Math.min(8, Runtime.getRuntime().availableProcessors())));
  }

  public static Map<SensorChannel, ChannelLimit> defaultLimits() {
    EnumMap<SensorChannel, ChannelLimit> limits = new EnumMap<>(SensorChannel.class);
    limits.put(SensorChannel.TEMPERATURE, new ChannelLimit(40d, 80d));
    limits.put(SensorChannel.GAS, new ChannelLimit(400d, 2_000d));
    limits.put(SensorChannel.SMOKE, new ChannelLimit(25d, 75d));
    limits.put(SensorChannel.FLAME, new ChannelLimit(25d, 75d));
    limits.put(SensorChannel.VISION, new ChannelLimit(0.7d, 1.0d));
    return limits;
  }

  public ChannelLimit limit(SensorChannel channel) {
    return limits.get(channel);
  }
}
