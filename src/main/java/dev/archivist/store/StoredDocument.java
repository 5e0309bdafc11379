package dev.archivist.store;

import com.fasterxml.jackson.databind.JsonNode;
import dev.archivist.metadata.DocumentMetadata;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A batch member read back from disk.
 *
 * @param entry the manifest entry
 * @param metadata the stored provenance
 * @param structured JSON content for {@link ContentKind#STRUCTURED} members, otherwise null
 * @param text plain content for {@link ContentKind#TEXT} members, otherwise null
 */
public record StoredDocument(
    ManifestEntry entry,
    DocumentMetadata metadata,
    @Nullable JsonNode structured,
    @Nullable String text) {

  public StoredDocument {
    Objects.requireNonNull(entry, "entry must not be null");
    Objects.requireNonNull(metadata, "metadata must not be null");
  }
}
