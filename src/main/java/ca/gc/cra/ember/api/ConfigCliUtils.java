package ca.gc.cra.ember.api;

import ca.gc.cra.ember.config.ConfigMerger;
import ca.gc.cra.ember.config.DefaultsForMode;
import ca.gc.cra.ember.config.YamlConfigLoader;
import ca.gc.cra.ember.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared steps of every command: split {@code config=PATH} from the CLI map, load the YAML file, merge with
 * defaults, and apply {@code logging.level.*} overrides.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);
  private static final String LEVEL_PREFIX = "logging.level.";

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  /**
   * Builds the effective configuration of a command: CLI over YAML over defaults.
   *
   * @param command command name
   * @param cliKv CLI key/value pairs; {@code config} is removed from it
   * @param usage usage line printed on invalid input
   * @return merged configuration
   * @throws CliAbort when the file is missing, unreadable, or the merged values are inconsistent
   */
  static Map<String, String> effectiveConfig(String command, Map<String, String> cliKv, String usage)
      throws CliAbort {
    String configPath = extractConfigPath(cliKv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        throw new CliAbort(ExitCode.CONFIG_ERROR);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, command);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        throw new CliAbort(ExitCode.CONFIG_ERROR);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        throw new CliAbort(ExitCode.IO_ERROR);
      }
    }
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          command, yaml, cliKv, DefaultsForMode.asFlatMap(command), log::warn);
      applyLogLevels(effective);
      return effective;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", command, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * Applies {@code logging.level.<logger>=LEVEL} entries to logback.
   *
   * @param effective merged configuration
   */
  static void applyLogLevels(Map<String, String> effective) {
    Map<String, String> levels = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : effective.entrySet()) {
      if (entry.getKey().startsWith(LEVEL_PREFIX) && entry.getKey().length() > LEVEL_PREFIX.length()) {
        levels.put(entry.getKey().substring(LEVEL_PREFIX.length()), entry.getValue());
      }
    }
    levels.forEach(LoggingConfigurator::setLevel);
  }

  /** Carries an exit code out of a helper that has already logged the reason. */
  static final class CliAbort extends Exception {
    private final ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
