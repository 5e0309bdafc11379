package dev.archivist.orchestration;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.archivist.index.IndexOperationResult;
import dev.archivist.metadata.IngestionRecord;
import dev.archivist.store.BatchHandle;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * What an orchestrated ingestion produced.
 *
 * @param ingestion record of the run
 * @param fileRecords per-file records of a multi-file upload, else empty
 * @param batches batches written by the run
 * @param index result of the automatic index operation; null when none ran or it failed
 * @param indexError message of a failed automatic index operation; the ingestion itself stands
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record IngestionReport(
    @JsonProperty("ingestion") IngestionRecord ingestion,
    @JsonProperty("file_records") List<IngestionRecord> fileRecords,
    @JsonProperty("batches") List<BatchHandle> batches,
    @JsonProperty("index") @Nullable IndexOperationResult index,
    @JsonProperty("index_error") @Nullable String indexError) {

  public IngestionReport {
    Objects.requireNonNull(ingestion, "ingestion must not be null");
    fileRecords = fileRecords == null ? List.of() : List.copyOf(fileRecords);
    batches = batches == null ? List.of() : List.copyOf(batches);
  }

  public boolean indexed() {
    return index != null;
  }
}
