package dev.archivist.index;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Authoritative description of the live index. Written only after a mutation has fully succeeded.
 *
 * @param createdAt when the index was initialized or last rebuilt
 * @param lastUpdated when the last successful mutation finished
 * @param embeddingModel identifier of the embedding model used
 * @param documentCount number of chunks the index should hold
 * @param batchStats chunks contributed per batch handle
 * @param version 1 after initialize or rebuild, incremented by every other mutation
 * @param lastOperation the mutation that produced this record
 */
public record IndexVersionRecord(
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("last_updated") Instant lastUpdated,
    @JsonProperty("embedding_model") String embeddingModel,
    @JsonProperty("document_count") int documentCount,
    @JsonProperty("batch_stats") Map<String, Integer> batchStats,
    @JsonProperty("version") int version,
    @JsonProperty("operation") IndexOperation lastOperation) {

  public IndexVersionRecord {
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(lastUpdated, "lastUpdated must not be null");
    Objects.requireNonNull(embeddingModel, "embeddingModel must not be null");
    Objects.requireNonNull(lastOperation, "lastOperation must not be null");
    if (version < 1) {
      throw new IllegalArgumentException("version must be >= 1, got: " + version);
    }
    if (documentCount < 0) {
      throw new IllegalArgumentException("documentCount must be >= 0, got: " + documentCount);
    }
    batchStats = batchStats == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(batchStats));
  }

  /** A version-1 record describing a freshly built index. */
  static IndexVersionRecord fresh(Instant now, String embeddingModel,
      Map<String, Integer> batchStats, IndexOperation operation) {
    int count = batchStats.values().stream().mapToInt(Integer::intValue).sum();
    return new IndexVersionRecord(now, now, embeddingModel, count, batchStats, 1, operation);
  }

  /** The successor record: version + 1, with {@code batchStats} replacing the current stats. */
  IndexVersionRecord next(Instant now, Map<String, Integer> newBatchStats,
      IndexOperation operation) {
    int count = newBatchStats.values().stream().mapToInt(Integer::intValue).sum();
    return new IndexVersionRecord(createdAt, now, embeddingModel, count, newBatchStats,
        version + 1, operation);
  }
}
