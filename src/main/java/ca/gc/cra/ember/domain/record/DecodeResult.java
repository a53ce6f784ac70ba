package ca.gc.cra.ember.domain.record;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of decoding one packet: either a typed record or a {@link ParseError}.
 */
public sealed interface DecodeResult permits DecodeResult.Decoded, DecodeResult.Failed {

  static DecodeResult decoded(PacketFormat format, String locationId, DecodedRecord record) {
    return new Decoded(format, locationId, record);
  }

  static DecodeResult failed(ParseError error) {
    return new Failed(error);
  }

  boolean isSuccess();

  /**
   * Successful decode.
   *
   * @param format detected wire variant
   * @param locationId location carried in the packet, or {@code null} for {@link PacketFormat#NO_LOC}
   * @param record decoded record
   */
  record Decoded(PacketFormat format, String locationId, DecodedRecord record) implements DecodeResult {
    public Decoded {
      Objects.requireNonNull(format, "format");
      Objects.requireNonNull(record, "record");
      locationId = locationId == null || locationId.isBlank() ? null : locationId.trim();
    }

    public Optional<String> location() {
      return Optional.ofNullable(locationId);
    }

    @Override
    public boolean isSuccess() {
      return true;
    }
  }

  /**
   * Failed decode.
   *
   * @param error typed parse failure
   */
  record Failed(ParseError error) implements DecodeResult {
    public Failed {
      Objects.requireNonNull(error, "error");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }
  }
}
