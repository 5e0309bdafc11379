package dev.archivist.ingestion;

import dev.archivist.metadata.IngestionRecord;
import dev.archivist.store.BatchHandle;
import java.util.List;
import java.util.Objects;

/**
 * Result of one ingestor call.
 *
 * @param record the persisted record of the run
 * @param batches batches the run wrote to; empty when the run failed during setup
 * @param fileRecords per-file records when the run aggregates several file uploads, else empty
 */
public record IngestionOutcome(
    IngestionRecord record, List<BatchHandle> batches, List<IngestionRecord> fileRecords) {

  public IngestionOutcome {
    Objects.requireNonNull(record, "record must not be null");
    batches = batches == null ? List.of() : List.copyOf(batches);
    fileRecords = fileRecords == null ? List.of() : List.copyOf(fileRecords);
  }

  public IngestionOutcome(IngestionRecord record, List<BatchHandle> batches) {
    this(record, batches, List.of());
  }
}
