package ca.gc.cra.ember.infrastructure.protocol;

import ca.gc.cra.ember.application.port.ClockPort;
import ca.gc.cra.ember.domain.record.CalibrationBlock;
import ca.gc.cra.ember.domain.record.DecodeResult;
import ca.gc.cra.ember.domain.record.Identity;
import ca.gc.cra.ember.domain.record.PacketFormat;
import ca.gc.cra.ember.domain.record.ParseError;
import ca.gc.cra.ember.domain.record.SensorSample;
import ca.gc.cra.ember.domain.record.ThermalCalibration;
import ca.gc.cra.ember.domain.record.ThermalFrame;
import ca.gc.cra.ember.logging.Logs;
import ca.gc.cra.ember.validation.Strings;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Stateless decoder turning one framed field-unit packet into a typed record.
 * <p><strong>Why:</strong> Field units mix four wire variants on the same port; the decoder detects the variant
 * and normalises it so ingestion only deals with {@link DecodeResult}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Recognise {@code #serialno}, {@code #locid}, {@code #frame}, {@code #Sensor}, and {@code #EEPROM}
 *   packets.</li>
 *   <li>Detect {@link PacketFormat} from where (or whether) the location id appears.</li>
 *   <li>Report every malformed packet as a {@link ParseError}; never throw for bad input.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; one instance is shared by every connection handler.</p>
 * <p><strong>Performance:</strong> Linear in packet size; a thermal frame allocates one word array.</p>
 *
 * @since 0.1.0
 * @see SensorPacketEncoder
 */
public final class SensorPacketDecoder {
  static final int SENSOR_FIELD_COUNT = 3;
  private static final int EXCERPT_BYTES = 96;
  private static final String TAG_SERIAL = "serialno:";
  private static final String TAG_LOCATION = "locid:";
  private static final String TAG_FRAME = "frame";
  private static final String TAG_SENSOR = "sensor";
  private static final String TAG_EEPROM = "eeprom";

  private final ThermalCalibration calibration;
  private final ClockPort clock;

  /**
   * Creates a decoder.
   *
   * @param calibration default thermal calibration
   * @param clock timestamp source for sensor samples
   */
  public SensorPacketDecoder(ThermalCalibration calibration, ClockPort clock) {
    this.calibration = Objects.requireNonNull(calibration, "calibration");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ThermalCalibration calibration() {
    return calibration;
  }

  /**
   * Decodes one packet with the default calibration.
   *
   * @param packet bytes of exactly one packet without its line delimiter
   * @return decoded record or parse error
   */
  public DecodeResult decode(byte[] packet) {
    return decode(packet, calibration);
  }

  /**
   * Decodes one packet with an explicit thermal calibration, e.g. one corrected by a device offset.
   *
   * @param packet bytes of exactly one packet without its line delimiter
   * @param frameCalibration calibration applied to thermal words
   * @return decoded record or parse error
   */
  public DecodeResult decode(byte[] packet, ThermalCalibration frameCalibration) {
    if (packet == null || packet.length == 0) {
      return fail("empty packet", null, null, "");
    }
    for (byte b : packet) {
      if ((b < 0x20 && b != '\t') || b == 0x7F) {
        return fail("packet contains non-printable byte", null, null, Logs.excerpt(packet, EXCERPT_BYTES));
      }
    }
    String text = new String(packet, StandardCharsets.US_ASCII).trim();
    String excerpt = Logs.truncate(text, EXCERPT_BYTES);
    if (text.length() < 2 || text.charAt(0) != '#' || text.charAt(text.length() - 1) != '!') {
      return fail("packet must start with '#' and end with '!'", null, null, excerpt);
    }
    String content = text.substring(1, text.length() - 1);
    String lower = content.toLowerCase(Locale.ROOT);

    if (lower.startsWith(TAG_SERIAL)) {
      return decodeIdentity(content.substring(TAG_SERIAL.length()), true, excerpt);
    }
    if (lower.startsWith(TAG_LOCATION)) {
      return decodeIdentity(content.substring(TAG_LOCATION.length()), false, excerpt);
    }
    if (lower.startsWith(TAG_FRAME)) {
      return decodeFrame(content, frameCalibration == null ? calibration : frameCalibration, excerpt);
    }
    if (lower.startsWith(TAG_SENSOR)) {
      return decodeSensor(content, excerpt);
    }
    if (lower.startsWith(TAG_EEPROM)) {
      return decodeCalibration(content, excerpt);
    }
    return fail("unknown packet type", null, null, excerpt);
  }

  private DecodeResult decodeIdentity(String value, boolean serial, String excerpt) {
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      return fail((serial ? "serial" : "location id") + " must not be blank",
          PacketFormat.SEPARATE, null, excerpt);
    }
    if (serial) {
      return DecodeResult.decoded(PacketFormat.SEPARATE, null, Identity.ofSerial(trimmed));
    }
    try {
      String location = Strings.requireIdentifier("location id", trimmed);
      return DecodeResult.decoded(PacketFormat.SEPARATE, location, Identity.ofLocation(location));
    } catch (IllegalArgumentException ex) {
      return fail(ex.getMessage(), PacketFormat.SEPARATE, null, excerpt);
    }
  }

  private DecodeResult decodeFrame(String content, ThermalCalibration frameCalibration, String excerpt) {
    Envelope envelope = Envelope.split(content, TAG_FRAME.length(), true);
    if (envelope.error() != null) {
      return fail(envelope.error(), envelope.format(), envelope.location(), excerpt);
    }
    try {
      int[] words = ThermalFrameCodec.parseGrid(envelope.payload());
      ThermalFrame frame = new ThermalFrame(words, frameCalibration);
      return DecodeResult.decoded(envelope.format(), envelope.location(), frame);
    } catch (IllegalArgumentException ex) {
      return fail(ex.getMessage(), envelope.format(), envelope.location(), excerpt);
    }
  }

  private DecodeResult decodeSensor(String content, String excerpt) {
    Envelope envelope = Envelope.split(content, TAG_SENSOR.length(), false);
    if (envelope.error() != null) {
      return fail(envelope.error(), envelope.format(), envelope.location(), excerpt);
    }
    String[] parts = envelope.payload().split(",", -1);
    int fields = envelope.payload().isBlank() ? 0 : parts.length;
    if (fields != SENSOR_FIELD_COUNT) {
      return fail("expected " + SENSOR_FIELD_COUNT + " fields, got " + fields,
          envelope.format(), envelope.location(), excerpt);
    }
    Integer adc1 = null;
    Integer adc2 = null;
    Boolean flame = null;
    try {
      for (String part : parts) {
        int eq = part.indexOf('=');
        if (eq <= 0) {
          throw new IllegalArgumentException("field '" + part.trim() + "' must be KEY=VALUE");
        }
        String key = stripTrailingColon(part.substring(0, eq).trim()).toUpperCase(Locale.ROOT);
        String value = part.substring(eq + 1).trim();
        switch (key) {
          case "ADC1" -> adc1 = requireUnset(adc1, key, parseAdc(key, value));
          case "ADC2" -> adc2 = requireUnset(adc2, key, parseAdc(key, value));
          case "MPY30", "FLAME" -> flame = requireUnset(flame, key, parseFlag(key, value));
          default -> throw new IllegalArgumentException("unknown sensor field " + key);
        }
      }
      if (adc1 == null || adc2 == null || flame == null) {
        throw new IllegalArgumentException("sensor sample requires ADC1, ADC2 and MPY30");
      }
      SensorSample sample = new SensorSample(adc1, adc2, flame, clock.nowMillis());
      return DecodeResult.decoded(envelope.format(), envelope.location(), sample);
    } catch (IllegalArgumentException ex) {
      return fail(ex.getMessage(), envelope.format(), envelope.location(), excerpt);
    }
  }

  private DecodeResult decodeCalibration(String content, String excerpt) {
    int colon = content.indexOf(':');
    if (colon < 0) {
      return fail("missing ':' separator", PacketFormat.EMBEDDED, null, excerpt);
    }
    String tag = content.substring(TAG_EEPROM.length(), colon).trim();
    try {
      int[] words = ThermalFrameCodec.parseExact(content.substring(colon + 1), CalibrationBlock.WORDS);
      return DecodeResult.decoded(PacketFormat.EMBEDDED, null, new CalibrationBlock(tag, words));
    } catch (IllegalArgumentException ex) {
      return fail(ex.getMessage(), PacketFormat.EMBEDDED, null, excerpt);
    }
  }

  private static int parseAdc(String key, String value) {
    try {
      int parsed = Integer.parseInt(value);
      if (parsed < 0 || parsed > SensorSample.ADC_MAX) {
        throw new IllegalArgumentException(key + " must be between 0 and " + SensorSample.ADC_MAX);
      }
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + value + "')", ex);
    }
  }

  private static boolean parseFlag(String key, String value) {
    return switch (value.toLowerCase(Locale.ROOT)) {
      case "1", "true" -> true;
      case "0", "false" -> false;
      default -> throw new IllegalArgumentException(key + " must be 0, 1, true or false");
    };
  }

  private static <T> T requireUnset(T current, String key, T value) {
    if (current != null) {
      throw new IllegalArgumentException("duplicate sensor field " + key);
    }
    return value;
  }

  private static String stripTrailingColon(String key) {
    return key.endsWith(":") ? key.substring(0, key.length() - 1).trim() : key;
  }

  private static DecodeResult fail(String reason, PacketFormat format, String location, String excerpt) {
    return DecodeResult.failed(new ParseError(reason, format, location, excerpt));
  }

  /**
   * Tag, location, and payload split of a frame or sensor packet.
   */
  private record Envelope(PacketFormat format, String location, String payload, String error) {

    static Envelope split(String content, int tagLength, boolean thermal) {
      int colon = content.indexOf(':');
      if (colon < 0) {
        return new Envelope(null, null, "", "missing ':' separator");
      }
      String suffix = content.substring(tagLength, colon).trim();
      String rest = content.substring(colon + 1);
      if (!suffix.isEmpty()) {
        return withLocation(PacketFormat.EMBEDDED, suffix, rest);
      }
      int second = rest.indexOf(':');
      if (second < 0) {
        return new Envelope(PacketFormat.NO_LOC, null, rest.trim(), null);
      }
      String location = rest.substring(0, second).trim();
      String payload = rest.substring(second + 1).trim();
      PacketFormat format = thermal && !ThermalFrameCodec.containsWhitespace(payload)
          ? PacketFormat.CONTINUOUS
          : PacketFormat.SEPARATE;
      if (location.isEmpty()) {
        return new Envelope(PacketFormat.NO_LOC, null, payload, null);
      }
      return withLocation(format, location, payload);
    }

    private static Envelope withLocation(PacketFormat format, String rawLocation, String payload) {
      try {
        String location = Strings.requireIdentifier("location id", rawLocation);
        return new Envelope(format, location, payload.trim(), null);
      } catch (IllegalArgumentException ex) {
        return new Envelope(format, null, payload, ex.getMessage());
      }
    }
  }
}
