package ca.gc.cra.ember.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective flat configuration.
   *
   * @param command active CLI command
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when cross-key validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String command,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(command, "command");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(command, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String command, Map<String, String> effective) {
    String exporter = trim(effective.get("metrics.exporter")).toLowerCase(Locale.ROOT);
    if (exporter.equals("otlp") && trim(effective.get("metrics.otlpEndpoint")).isEmpty()) {
      throw new IllegalArgumentException("metrics.otlpEndpoint is required when metrics.exporter=otlp");
    }
    if ("serve".equalsIgnoreCase(command)
        && parseBoolean(effective.get("scheduler.enabled"), true)
        && trim(effective.get("registry")).isEmpty()) {
      throw new IllegalArgumentException("registry is required when scheduler.enabled=true");
    }
    if ("simulate".equalsIgnoreCase(command) && trim(effective.get("location")).isEmpty()
        && !"no_loc".equalsIgnoreCase(trim(effective.get("format")))) {
      throw new IllegalArgumentException("location is required unless format=NO_LOC");
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
