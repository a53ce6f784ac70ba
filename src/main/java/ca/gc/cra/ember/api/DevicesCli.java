package ca.gc.cra.ember.api;

import ca.gc.cra.ember.api.ConfigCliUtils.CliAbort;
import ca.gc.cra.ember.application.schedule.DeviceRegistry;
import ca.gc.cra.ember.domain.device.Device;
import ca.gc.cra.ember.domain.device.DeviceMode;
import ca.gc.cra.ember.infrastructure.device.YamlDeviceRegistryStore;
import ca.gc.cra.ember.logging.LoggingConfigurator;
import ca.gc.cra.ember.validation.Numbers;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Administers the device registry file: list, add, and remove devices.
 *
 * @since 0.1.0
 */
public final class DevicesCli {
  private static final Logger log = LoggerFactory.getLogger(DevicesCli.class);
  private static final String MODE = "devices";
  private static final String SUMMARY_USAGE =
      "usage: devices <list|add|remove> [registry=PATH] [id=ID] [name=TEXT] [ip=ADDR] [port=N] "
          + "[location=ID] [mode=Continuous|OnDemand] [poll=SECONDS]";
  private static final String HELP_TEXT = """
      EMBER device registry administration

      Usage:
        devices list   [registry=PATH]
        devices add    id=ID ip=ADDR location=ID [name=TEXT] [port=N] [mode=Continuous|OnDemand] [poll=SECONDS]
        devices remove id=ID

      Options:
        registry=PATH      Registry YAML (default ~/.ember/devices.yaml)
        id=ID              Unique device id ([A-Za-z0-9._-])
        ip=ADDR            IPv4 or IPv6 literal of the device
        port=1-65535       Command port (default 9001)
        location=ID        Location the device serves
        mode=NAME          Continuous or OnDemand (default OnDemand)
        poll=1-3600        REQUEST1 interval in seconds (default 10)
      """;

  private DevicesCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String[] tokens = input.keyValueArgs();
    if (tokens.length == 0 || tokens[0].contains("=")) {
      log.error("Missing devices action");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String action = tokens[0].toLowerCase(Locale.ROOT);

    Map<String, String> effective;
    try {
      Map<String, String> cliKv = CliArgsParser.toMap(Arrays.copyOfRange(tokens, 1, tokens.length));
      effective = ConfigCliUtils.effectiveConfig(MODE, cliKv, SUMMARY_USAGE);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    DeviceRegistry registry = new DeviceRegistry(new YamlDeviceRegistryStore(Path.of(effective.get("registry"))));
    try {
      registry.load();
      return switch (action) {
        case "list" -> list(registry);
        case "add" -> add(registry, effective);
        case "remove" -> remove(registry, effective);
        default -> {
          log.error("Unknown devices action: {}", action);
          CliPrinter.println(SUMMARY_USAGE);
          yield ExitCode.INVALID_ARGS;
        }
      };
    } catch (IllegalArgumentException ex) {
      log.error("Invalid device: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Registry I/O failure: {}", effective.get("registry"), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in devices command", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode list(DeviceRegistry registry) {
    List<Device> devices = registry.list();
    if (devices.isEmpty()) {
      CliPrinter.println("No devices registered.");
      return ExitCode.SUCCESS;
    }
    CliPrinter.println(String.format(Locale.ROOT, "%-16s %-20s %-22s %-16s %-10s %s",
        "ID", "NAME", "ADDRESS", "LOCATION", "MODE", "POLL"));
    for (Device device : devices) {
      CliPrinter.println(String.format(Locale.ROOT, "%-16s %-20s %-22s %-16s %-10s %ds",
          device.id(), device.name(), device.ip() + ":" + device.port(), device.locationId(),
          device.continuous() ? "Continuous" : "OnDemand", device.pollIntervalSeconds()));
    }
    return ExitCode.SUCCESS;
  }

  private static ExitCode add(DeviceRegistry registry, Map<String, String> values) throws IOException {
    for (String key : List.of("id", "ip", "location")) {
      String value = values.get(key);
      if (value == null || value.isBlank()) {
        log.error("add requires {}=...", key);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
    }
    Device device = new Device(
        values.get("id"),
        values.get("name"),
        values.get("ip"),
        Numbers.parseInt("port", values.get("port"), Device.DEFAULT_PORT, 1, 65_535),
        values.get("location"),
        DeviceMode.fromString(values.getOrDefault("mode", "OnDemand")),
        Numbers.parseInt("poll", values.get("poll"), Device.DEFAULT_POLL_SECONDS,
            Device.MIN_POLL_SECONDS, Device.MAX_POLL_SECONDS));
    registry.add(device);
    CliPrinter.println("Added device " + device.id() + " (" + device.ip() + ":" + device.port() + ")");
    return ExitCode.SUCCESS;
  }

  private static ExitCode remove(DeviceRegistry registry, Map<String, String> values) throws IOException {
    String id = values.get("id");
    if (id == null || id.isBlank()) {
      log.error("remove requires id=ID");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!registry.remove(id)) {
      log.error("No device with id {}", id);
      return ExitCode.CONFIG_ERROR;
    }
    CliPrinter.println("Removed device " + id);
    return ExitCode.SUCCESS;
  }
}
