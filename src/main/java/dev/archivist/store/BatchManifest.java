package dev.archivist.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.archivist.metadata.SourceType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Manifest of a stored batch. New members are appended; existing entries are carried over
 * unchanged.
 *
 * @param batchId directory name of the batch
 * @param sourceType partition the batch lives in
 * @param batchName optional human-readable name the batch was created with
 * @param createdAt when the batch was allocated
 * @param documents members in the order they were stored
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchManifest(
    @JsonProperty("batch_id") String batchId,
    @JsonProperty("source_type") SourceType sourceType,
    @JsonProperty("batch_name") @Nullable String batchName,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("documents") List<ManifestEntry> documents) {

  public BatchManifest {
    Objects.requireNonNull(batchId, "batchId must not be null");
    Objects.requireNonNull(sourceType, "sourceType must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    documents = documents == null ? List.of() : List.copyOf(documents);
  }

  /** Returns a new manifest with {@code entry} appended after the existing members. */
  public BatchManifest append(ManifestEntry entry) {
    List<ManifestEntry> appended = new ArrayList<>(documents);
    appended.add(entry);
    return new BatchManifest(batchId, sourceType, batchName, createdAt, appended);
  }

  @JsonIgnore
  public BatchHandle handle() {
    return new BatchHandle(sourceType, batchId);
  }
}
