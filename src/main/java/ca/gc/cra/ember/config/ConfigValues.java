package ca.gc.cra.ember.config;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Typed lookups over a flat configuration map. Blank or missing values fall back to the supplied default.
 */
final class ConfigValues {
  private final Map<String, String> values;

  ConfigValues(Map<String, String> values) {
    this.values = values == null ? Map.of() : values;
  }

  String text(String key, String defaultValue) {
    String value = values.get(key);
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }

  boolean bool(String key, boolean defaultValue) {
    String value = values.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
    };
  }

  String raw(String key) {
    return values.get(key);
  }

  Map<String, String> withPrefix(String prefix) {
    Map<String, String> out = new TreeMap<>();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey().startsWith(prefix) && entry.getKey().length() > prefix.length()) {
        out.put(entry.getKey().substring(prefix.length()), entry.getValue());
      }
    }
    return out;
  }
}
