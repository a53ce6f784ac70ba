package ca.gc.cra.ember.infrastructure.events;

import ca.gc.cra.ember.application.port.AlarmListener;
import ca.gc.cra.ember.domain.fusion.FusionResult;
import ca.gc.cra.ember.domain.fusion.SensorChannel;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every raised alarm as one structured log line on the {@code ember.alarm} logger.
 *
 * @since 0.1.0
 */
public final class LoggingAlarmListener implements AlarmListener {
  private static final Logger log = LoggerFactory.getLogger("ember.alarm");

  @Override
  public void onAlarm(FusionResult result) {
    Objects.requireNonNull(result, "result");
    StringJoiner channels = new StringJoiner(",", "[", "]");
    for (SensorChannel channel : SensorChannel.values()) {
      if (result.contributing().contains(channel)) {
        channels.add(channel.name().toLowerCase(Locale.ROOT));
      }
    }
    log.warn("fusion.alarm location={}, sources={}, channels={}, confidence={}, at={}",
        result.locationId(),
        result.sourcesTriggered(),
        channels,
        String.format(Locale.ROOT, "%.3f", result.confidence()),
        result.evaluatedAtMillis());
  }
}
