package ca.gc.cra.ember.domain.record;

/**
 * Wire variants recognised by the packet decoder.
 */
public enum PacketFormat {
  /** Distinct packets for serial, location, frame, and sample; location as its own field. */
  SEPARATE,
  /** Location id glued to the packet tag, e.g. {@code #frameRoomA:...!}. */
  EMBEDDED,
  /** Thermal frame sent as one unbroken hex run with a separate location field. */
  CONTINUOUS,
  /** No location in the packet; the caller falls back to the peer address. */
  NO_LOC
}
