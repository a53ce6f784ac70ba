package ca.gc.cra.ember.infrastructure.device;

import ca.gc.cra.ember.application.port.DeviceRegistryStore;
import ca.gc.cra.ember.domain.device.Device;
import ca.gc.cra.ember.domain.device.DeviceMode;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Device registry persisted as a YAML document:
 *
 * <pre>
 * devices:
 *   - id: pfds-1
 *     name: Kitchen suppressor
 *     ip: 192.168.1.50
 *     port: 9001
 *     locationId: RoomA
 *     mode: Continuous
 *     pollIntervalSeconds: 30
 * </pre>
 *
 * <p>Writes go to a sibling temporary file that is then moved over the registry.</p>
 */
public final class YamlDeviceRegistryStore implements DeviceRegistryStore {
  private final Path path;

  public YamlDeviceRegistryStore(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  public Path path() {
    return path;
  }

  @Override
  public List<Device> load() throws IOException {
    if (!Files.exists(path)) {
      return List.of();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse device registry at " + path, ex);
    }
    if (document == null) {
      return List.of();
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("device registry root must be a mapping");
    }
    Object entries = root.get("devices");
    if (entries == null) {
      return List.of();
    }
    if (!(entries instanceof List<?> list)) {
      throw new IllegalArgumentException("devices must be a list");
    }
    List<Device> devices = new ArrayList<>(list.size());
    int index = 0;
    for (Object entry : list) {
      if (!(entry instanceof Map<?, ?> fields)) {
        throw new IllegalArgumentException("devices[" + index + "] must be a mapping");
      }
      try {
        devices.add(toDevice(fields));
      } catch (IllegalArgumentException | NullPointerException ex) {
        throw new IllegalArgumentException("devices[" + index + "]: " + ex.getMessage(), ex);
      }
      index++;
    }
    return devices;
  }

  @Override
  public void save(List<Device> devices) throws IOException {
    List<Map<String, Object>> entries = new ArrayList<>(devices.size());
    for (Device device : devices) {
      entries.add(toMap(device));
    }
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("devices", entries);

    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setPrettyFlow(true);

    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = path.resolveSibling(path.getFileName() + ".tmp");
    try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
      new Yaml(options).dump(root, writer);
    }
    try {
      Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static Device toDevice(Map<?, ?> fields) {
    return new Device(
        text(fields, "id"),
        text(fields, "name"),
        text(fields, "ip"),
        integer(fields, "port", Device.DEFAULT_PORT),
        text(fields, "locationId"),
        DeviceMode.fromString(text(fields, "mode")),
        integer(fields, "pollIntervalSeconds", Device.DEFAULT_POLL_SECONDS));
  }

  private static Map<String, Object> toMap(Device device) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("id", device.id());
    map.put("name", device.name());
    map.put("ip", device.ip());
    map.put("port", device.port());
    map.put("locationId", device.locationId());
    map.put("mode", device.continuous() ? "Continuous" : "OnDemand");
    map.put("pollIntervalSeconds", device.pollIntervalSeconds());
    return map;
  }

  private static String text(Map<?, ?> fields, String key) {
    Object value = fields.get(key);
    return value == null ? null : value.toString();
  }

  private static int integer(Map<?, ?> fields, String key, int defaultValue) {
    Object value = fields.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + value + ")", ex);
    }
  }
}
