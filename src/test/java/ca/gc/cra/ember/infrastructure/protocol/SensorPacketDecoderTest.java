package ca.gc.cra.ember.infrastructure.protocol;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ember.domain.record.CalibrationBlock;
import ca.gc.cra.ember.domain.record.DecodeResult;
import ca.gc.cra.ember.domain.record.Identity;
import ca.gc.cra.ember.domain.record.PacketFormat;
import ca.gc.cra.ember.domain.record.ParseError;
import ca.gc.cra.ember.domain.record.SensorSample;
import ca.gc.cra.ember.domain.record.ThermalCalibration;
import ca.gc.cra.ember.domain.record.ThermalFrame;
import ca.gc.cra.ember.support.Packets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class SensorPacketDecoderTest {
  private static final long NOW = 1_700_000_000_000L;

  private final SensorPacketDecoder decoder = new SensorPacketDecoder(ThermalCalibration.defaults(), () -> NOW);

  @Test
  void decodesSerialAndLocationIdentities() {
    DecodeResult.Decoded serial = decoded("#serialno:SIM001!");
    assertEquals(Identity.ofSerial("SIM001"), serial.record());
    assertNull(serial.locationId());

    DecodeResult.Decoded location = decoded("#locid:RoomA!");
    assertEquals(Identity.ofLocation("RoomA"), location.record());
    assertEquals("RoomA", location.locationId());
    assertEquals(PacketFormat.SEPARATE, location.format());
  }

  @Test
  void decodesSeparateSensorSample() {
    DecodeResult.Decoded result = decoded("#Sensor:RoomA:ADC1=1734,ADC2=2293,MPY30=1!");

    assertEquals(PacketFormat.SEPARATE, result.format());
    assertEquals("RoomA", result.locationId());
    SensorSample sample = assertInstanceOf(SensorSample.class, result.record());
    assertEquals(1734, sample.adc1());
    assertEquals(2293, sample.adc2());
    assertTrue(sample.flame());
    assertEquals(NOW, sample.timestampMillis());
    assertEquals(1734 * 100.0 / 4095, sample.smokePercent(), 1e-9);
  }

  @Test
  void detectsEmbeddedAndNoLocationSensorVariants() {
    DecodeResult.Decoded embedded = decoded("#SensorRoomB:ADC1=10,ADC2=20,FLAME=false!");
    assertEquals(PacketFormat.EMBEDDED, embedded.format());
    assertEquals("RoomB", embedded.locationId());

    DecodeResult.Decoded noLoc = decoded("#Sensor:adc1=10,adc2=20,mpy30=true!");
    assertEquals(PacketFormat.NO_LOC, noLoc.format());
    assertNull(noLoc.locationId());
    SensorSample sample = assertInstanceOf(SensorSample.class, noLoc.record());
    assertEquals(20, sample.adc2());
    assertTrue(sample.flame());
  }

  @Test
  void toleratesTrailingColonOnKeys() {
    DecodeResult.Decoded result = decoded("#Sensor:RoomA:ADC1:=5,ADC2=6,MPY30=0!");

    SensorSample sample = assertInstanceOf(SensorSample.class, result.record());
    assertEquals(5, sample.adc1());
    assertFalse(sample.flame());
  }

  @Test
  void decodesFrameInEveryLayout() {
    int[] words = Packets.uniformWords(30.0);
    words[5] = 0x0102;
    String spaced = ThermalFrameCodec.toSpacedHex(words);
    String continuous = ThermalFrameCodec.toContinuousHex(words);

    DecodeResult.Decoded separate = decoded("#frame:RoomA:" + spaced + "!");
    DecodeResult.Decoded embedded = decoded("#frameRoomA:" + continuous + "!");
    DecodeResult.Decoded contiguous = decoded("#frame:RoomA:" + continuous + "!");
    DecodeResult.Decoded noLoc = decoded("#frame:" + continuous + "!");

    assertEquals(PacketFormat.SEPARATE, separate.format());
    assertEquals(PacketFormat.EMBEDDED, embedded.format());
    assertEquals(PacketFormat.CONTINUOUS, contiguous.format());
    assertEquals(PacketFormat.NO_LOC, noLoc.format());
    for (DecodeResult.Decoded result : new DecodeResult.Decoded[] {separate, embedded, contiguous, noLoc}) {
      ThermalFrame frame = assertInstanceOf(ThermalFrame.class, result.record());
      assertArrayEquals(words, frame.rawWords());
      assertEquals(29.58, frame.celsius(5), 1e-9);
      assertEquals(30.0, frame.celsius(0), 1e-9);
    }
  }

  @Test
  void dropsFrameTrailer() {
    int[] words = Arrays.copyOf(Packets.uniformWords(25.0), 834);
    Arrays.fill(words, 768, 834, 0xBEEF);

    DecodeResult.Decoded result = decoded("#frame:RoomA:" + ThermalFrameCodec.toContinuousHex(words) + "!");

    ThermalFrame frame = assertInstanceOf(ThermalFrame.class, result.record());
    assertEquals(ThermalFrame.CELLS, frame.rawWords().length);
    assertEquals(25.0, frame.maxCelsius(), 1e-9);
  }

  @Test
  void appliesExplicitCalibration() {
    String packet = "#frame:RoomA:" + ThermalFrameCodec.toContinuousHex(Packets.uniformWords(30.0)) + "!";

    DecodeResult result = decoder.decode(Packets.ascii(packet), ThermalCalibration.defaults().withDeviceOffset(2.5));

    ThermalFrame frame = (ThermalFrame) ((DecodeResult.Decoded) result).record();
    assertEquals(32.5, frame.celsius(0), 1e-9);
  }

  @Test
  void decodesCalibrationBlock() {
    int[] words = new int[CalibrationBlock.WORDS];
    words[0] = (short) -150 & 0xFFFF;

    DecodeResult.Decoded result = decoded("#EEPROM1:" + ThermalFrameCodec.toContinuousHex(words) + "!");

    CalibrationBlock block = assertInstanceOf(CalibrationBlock.class, result.record());
    assertEquals("1", block.deviceTag());
    assertEquals(-1.5, block.deviceOffsetCelsius().orElseThrow(), 1e-9);
  }

  @Test
  void reportsWrongSensorFieldCount() {
    ParseError error = failed("#Sensor:RoomA:ADC1=1,ADC2=2!");

    assertEquals("expected 3 fields, got 2", error.reason());
    assertEquals("RoomA", error.locationHint());
  }

  @Test
  void reportsMalformedPackets() {
    assertEquals("empty packet", failed("").reason());
    assertTrue(failed("serialno:SIM001").reason().contains("must start with '#'"));
    assertEquals("unknown packet type", failed("#bogus:1!").reason());
    assertTrue(failed("#Sensor:RoomA:ADC1=abc,ADC2=2,MPY30=1!").reason().contains("ADC1 must be an integer"));
    assertTrue(failed("#Sensor:RoomA:ADC1=5000,ADC2=2,MPY30=1!").reason().contains("between 0 and 4095"));
    assertTrue(failed("#Sensor:RoomA:ADC1=1,ADC2=2,MPY30=maybe!").reason().contains("MPY30"));
    assertTrue(failed("#Sensor:RoomA:ADC1=1,ADC1=2,MPY30=1!").reason().contains("duplicate"));
    assertTrue(failed("#frame:RoomA:0102!").reason().contains("expected 768 cells"));
    assertTrue(failed("#locid:!").reason().contains("must not be blank"));
  }

  @Test
  void reportsNonHexFrameDigit() {
    char[] hex = ThermalFrameCodec.toContinuousHex(Packets.uniformWords(25.0)).toCharArray();
    hex[10] = 'G';

    ParseError error = failed("#frame:RoomA:" + new String(hex) + "!");

    assertTrue(error.reason().contains("non-hex character 'G'"));
    assertEquals(PacketFormat.CONTINUOUS, error.format());
  }

  @Test
  void rejectsControlBytesWithoutThrowing() {
    DecodeResult result = decoder.decode(new byte[] {'#', 0x01, '!'});

    assertFalse(result.isSuccess());
  }

  private DecodeResult.Decoded decoded(String packet) {
    DecodeResult result = decoder.decode(Packets.ascii(packet));
    if (result instanceof DecodeResult.Failed failed) {
      throw new AssertionError("expected success but got " + failed.error());
    }
    return (DecodeResult.Decoded) result;
  }

  private ParseError failed(String packet) {
    DecodeResult result = decoder.decode(Packets.ascii(packet));
    return assertInstanceOf(DecodeResult.Failed.class, result).error();
  }
}
