package ca.gc.cra.ember.application.fusion;

import ca.gc.cra.ember.domain.fusion.FusionResult;

/**
 * Read-only copy of one location's fusion state. Readings never received are {@link Double#NaN}.
 *
 * @param locationId location
 * @param serial last serial announced for the location, or {@code null}
 * @param temperatureCelsius thermal channel reading
 * @param hotCells cells currently latched hot
 * @param gasPpm latest gas reading
 * @param smokePercent latest smoke reading
 * @param flamePercent latest analog flame reading
 * @param flame latest digital flame flag
 * @param framesApplied thermal frames applied so far
 * @param samplesApplied sensor samples applied so far
 * @param holding whether an alarm decision is currently latched
 * @param lastResult most recent evaluation, or {@code null}
 */
public record FusionSnapshot(
    String locationId,
    String serial,
    double temperatureCelsius,
    int hotCells,
    double gasPpm,
    double smokePercent,
    double flamePercent,
    boolean flame,
    long framesApplied,
    long samplesApplied,
    boolean holding,
    FusionResult lastResult) {}
