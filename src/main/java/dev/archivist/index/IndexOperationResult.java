package dev.archivist.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of a mutating index operation.
 *
 * @param operation the operation performed
 * @param version version of the index after the operation
 * @param chunksAdded chunks added to the provider
 * @param chunksRemoved chunks removed from the record's accounting (reindex replace only)
 * @param documentCount total chunk count after the operation
 * @param batches batches whose chunks were added
 * @param skippedBatches batches that were missing or malformed and were skipped
 * @param backupPath backup directory created by a rebuild; null otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexOperationResult(
    @JsonProperty("operation") IndexOperation operation,
    @JsonProperty("version") int version,
    @JsonProperty("chunks_added") int chunksAdded,
    @JsonProperty("chunks_removed") int chunksRemoved,
    @JsonProperty("document_count") int documentCount,
    @JsonProperty("batches") List<String> batches,
    @JsonProperty("skipped_batches") List<String> skippedBatches,
    @JsonProperty("backup_path") @Nullable String backupPath) {

  public IndexOperationResult {
    Objects.requireNonNull(operation, "operation must not be null");
    batches = batches == null ? List.of() : List.copyOf(batches);
    skippedBatches = skippedBatches == null ? List.of() : List.copyOf(skippedBatches);
  }
}
