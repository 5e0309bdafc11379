package dev.archivist.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Objects;

/**
 * One member of a batch manifest. Entries are written once and never changed.
 *
 * @param id document id given by the ingestor
 * @param storedFilename file holding the content, relative to the batch directory
 * @param metadataFilename file holding the {@link dev.archivist.metadata.DocumentMetadata}
 * @param contentKind encoding of the stored content
 * @param storedAt when the member was written
 */
public record ManifestEntry(
    @JsonProperty("id") String id,
    @JsonProperty("stored_filename") String storedFilename,
    @JsonProperty("metadata_filename") String metadataFilename,
    @JsonProperty("content_kind") ContentKind contentKind,
    @JsonProperty("stored_at") Instant storedAt) {

  public ManifestEntry {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(storedFilename, "storedFilename must not be null");
    Objects.requireNonNull(metadataFilename, "metadataFilename must not be null");
    Objects.requireNonNull(contentKind, "contentKind must not be null");
    Objects.requireNonNull(storedAt, "storedAt must not be null");
  }
}
