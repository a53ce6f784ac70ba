package ca.gc.cra.ember.application.port;

import ca.gc.cra.ember.domain.record.DecodedRecord;

/**
 * Non-blocking handoff from ingestion to fusion.
 *
 * <p>Implementations must return promptly even when the consumer side is slow; records for one location are
 * delivered in submission order.</p>
 */
public interface RecordSink {
  /**
   * Hands a decoded record over for processing.
   *
   * @param locationId resolved location id; never {@code null}
   * @param record decoded record
   */
  void submit(String locationId, DecodedRecord record);
}
