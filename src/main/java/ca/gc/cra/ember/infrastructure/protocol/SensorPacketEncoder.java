package ca.gc.cra.ember.infrastructure.protocol;

import ca.gc.cra.ember.domain.record.CalibrationBlock;
import ca.gc.cra.ember.domain.record.DecodedRecord;
import ca.gc.cra.ember.domain.record.Identity;
import ca.gc.cra.ember.domain.record.PacketFormat;
import ca.gc.cra.ember.domain.record.SensorSample;
import ca.gc.cra.ember.domain.record.ThermalFrame;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Renders records in the field-unit wire format. Output decodes back to identical field values with
 * {@link SensorPacketDecoder}.
 *
 * @since 0.1.0
 */
public final class SensorPacketEncoder {

  private SensorPacketEncoder() {}

  /**
   * Encodes one record as packet text without the line delimiter.
   *
   * @param format wire variant; ignored for identity and calibration packets, which have a single form
   * @param locationId location to embed; required unless {@code format} is {@link PacketFormat#NO_LOC}
   * @param record record to encode
   * @return packet text, e.g. {@code #SensorRoomA:ADC1=1734,ADC2=2293,MPY30=1!}
   * @throws IllegalArgumentException when a location is required but missing, or an identity carries both
   *     a serial and a location
   */
  public static String encode(PacketFormat format, String locationId, DecodedRecord record) {
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(record, "record");
    if (record instanceof Identity identity) {
      return encodeIdentity(identity);
    }
    if (record instanceof CalibrationBlock block) {
      return "#EEPROM" + block.deviceTag() + ':' + ThermalFrameCodec.toContinuousHex(block.words()) + '!';
    }
    if (record instanceof ThermalFrame frame) {
      String payload = format == PacketFormat.SEPARATE
          ? ThermalFrameCodec.toSpacedHex(frame.rawWords())
          : ThermalFrameCodec.toContinuousHex(frame.rawWords());
      return envelope("frame", format, locationId, payload);
    }
    SensorSample sample = (SensorSample) record;
    String payload = "ADC1=" + sample.adc1() + ",ADC2=" + sample.adc2() + ",MPY30=" + (sample.flame() ? 1 : 0);
    return envelope("Sensor", format, locationId, payload);
  }

  /**
   * Encodes one record as a newline terminated ASCII line ready to write to a socket.
   *
   * @param format wire variant
   * @param locationId location to embed
   * @param record record to encode
   * @return packet bytes including {@code \n}
   */
  public static byte[] encodeLine(PacketFormat format, String locationId, DecodedRecord record) {
    return (encode(format, locationId, record) + '\n').getBytes(StandardCharsets.US_ASCII);
  }

  private static String encodeIdentity(Identity identity) {
    if (identity.serial() != null && identity.locationId() != null) {
      throw new IllegalArgumentException("identity with serial and location encodes as two packets");
    }
    if (identity.serial() != null) {
      return "#serialno:" + identity.serial() + '!';
    }
    return "#locid:" + identity.locationId() + '!';
  }

  private static String envelope(String tag, PacketFormat format, String locationId, String payload) {
    if (format == PacketFormat.NO_LOC) {
      return '#' + tag + ':' + payload + '!';
    }
    if (locationId == null || locationId.isBlank()) {
      throw new IllegalArgumentException(format + " packets require a location id");
    }
    if (format == PacketFormat.EMBEDDED) {
      return '#' + tag + locationId + ':' + payload + '!';
    }
    return '#' + tag + ':' + locationId + ':' + payload + '!';
  }
}
