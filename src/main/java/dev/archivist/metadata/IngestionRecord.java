package dev.archivist.metadata;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Audit record of one ingestion run. Persisted once by the raw store and never modified afterwards.
 *
 * @param ingestionId globally unique run identifier
 * @param sourceType origin of the run ({@link SourceType#UNKNOWN} for multi-file aggregates)
 * @param startedAt when the run started
 * @param completedAt when the run finished; null only while in progress
 * @param documentsIngested number of documents stored
 * @param documentsFailed number of documents that could not be stored
 * @param bytesProcessed total bytes of stored content
 * @param status run status
 * @param errorMessage failure description; set only for failed runs
 * @param sourceIdentifiers selectors processed by the run (channel, space key, filename)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestionRecord(
    @JsonProperty("ingestion_id") String ingestionId,
    @JsonProperty("source_type") SourceType sourceType,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") @Nullable Instant completedAt,
    @JsonProperty("documents_ingested") int documentsIngested,
    @JsonProperty("documents_failed") int documentsFailed,
    @JsonProperty("bytes_processed") long bytesProcessed,
    @JsonProperty("status") IngestionStatus status,
    @JsonProperty("error_message") @Nullable String errorMessage,
    @JsonProperty("source_identifiers") List<String> sourceIdentifiers) {

  public IngestionRecord {
    Objects.requireNonNull(ingestionId, "ingestionId must not be null");
    Objects.requireNonNull(sourceType, "sourceType must not be null");
    Objects.requireNonNull(startedAt, "startedAt must not be null");
    Objects.requireNonNull(status, "status must not be null");
    if (status.isTerminal() && completedAt == null) {
      throw new IllegalArgumentException("A " + status.value() + " record must have completedAt");
    }
    if (errorMessage != null && status != IngestionStatus.FAILED) {
      throw new IllegalArgumentException("errorMessage is only allowed on failed records");
    }
    sourceIdentifiers = sourceIdentifiers == null ? List.of() : List.copyOf(sourceIdentifiers);
  }
}
