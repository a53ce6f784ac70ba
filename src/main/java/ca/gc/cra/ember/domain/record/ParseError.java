package ca.gc.cra.ember.domain.record;

import java.util.Objects;

/**
 * Typed description of a packet that could not be decoded.
 *
 * @param reason human readable cause, e.g. {@code expected 3 fields, got 2}
 * @param format wire variant detected before the failure, or {@code null} if detection failed
 * @param locationHint location id found in the packet before the failure, or {@code null}
 * @param excerpt truncated packet text for diagnostics
 */
public record ParseError(String reason, PacketFormat format, String locationHint, String excerpt) {
  public ParseError {
    reason = Objects.requireNonNull(reason, "reason");
    excerpt = excerpt == null ? "" : excerpt;
  }
}
