package ca.gc.cra.ember.config;

import ca.gc.cra.ember.application.rate.RateSettings;
import ca.gc.cra.ember.validation.Numbers;
import ca.gc.cra.ember.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Settings of the {@code ratesim} command, which replays a backlog-depth sequence through the rate controller.
 *
 * @param depths queue depths in observation order
 * @param stepMillis simulated time between observations
 * @param stream stream id reported in the output
 * @param rate controller parameters
 */
public record RateSimConfig(List<Integer> depths, long stepMillis, String stream, RateSettings rate) {

  public RateSimConfig {
    depths = List.copyOf(depths);
    if (depths.isEmpty()) {
      throw new IllegalArgumentException("depths must list at least one queue depth");
    }
    Numbers.requireRange("stepMillis", stepMillis, 0, 3_600_000);
    stream = Strings.requireIdentifier("stream", stream);
  }

  public static RateSimConfig fromMap(Map<String, String> map) {
    ConfigValues values = new ConfigValues(map);
    String raw = values.text("depths", null);
    if (raw == null) {
      throw new IllegalArgumentException("depths is required, e.g. depths=0,3,8,12,8,2");
    }
    List<Integer> depths = new ArrayList<>();
    for (String token : raw.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      depths.add(Numbers.parseInt("depths", token, 0, 0, 1_000_000));
    }
    return new RateSimConfig(
        depths,
        Numbers.parseInt("stepMillis", values.raw("stepMillis"), 1_000, 0, 3_600_000),
        values.text("stream", "stream-1"),
        EmberConfig.rateFromMap(values));
  }
}
