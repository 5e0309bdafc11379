package dev.archivist.index;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * State of the index as described by the version record, cross-checked with the provider.
 *
 * @param exists whether a version record exists
 * @param path live index directory
 * @param version record version; null when absent
 * @param createdAt record creation time; null when absent
 * @param lastUpdated last mutation time; null when absent
 * @param embeddingModel embedding model identifier; null when absent
 * @param documentCount chunk count according to the record; null when absent
 * @param providerCount chunk count reported by the provider; null when it could not be read
 * @param consistent whether both counts are known and equal
 * @param batchStats chunks per batch according to the record
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexInfo(
    @JsonProperty("exists") boolean exists,
    @JsonProperty("path") String path,
    @JsonProperty("version") @Nullable Integer version,
    @JsonProperty("created_at") @Nullable Instant createdAt,
    @JsonProperty("last_updated") @Nullable Instant lastUpdated,
    @JsonProperty("embedding_model") @Nullable String embeddingModel,
    @JsonProperty("document_count") @Nullable Integer documentCount,
    @JsonProperty("provider_count") @Nullable Integer providerCount,
    @JsonProperty("consistent") boolean consistent,
    @JsonProperty("batch_stats") Map<String, Integer> batchStats) {

  public IndexInfo {
    batchStats = batchStats == null ? Map.of() : Map.copyOf(batchStats);
  }

  static IndexInfo absent(String path) {
    return new IndexInfo(false, path, null, null, null, null, null, null, false, Map.of());
  }
}
