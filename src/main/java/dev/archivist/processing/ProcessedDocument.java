package dev.archivist.processing;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of processing one batch member: either its chunks or the reason it was skipped.
 *
 * @param documentId manifest id of the document
 * @param chunks chunks produced; empty on failure or when the rendered text was blank
 * @param error failure description; null on success
 */
public record ProcessedDocument(String documentId, List<DocumentChunk> chunks,
    @Nullable String error) {

  public ProcessedDocument {
    Objects.requireNonNull(documentId, "documentId must not be null");
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
    if (error != null && !chunks.isEmpty()) {
      throw new IllegalArgumentException("A failed document cannot carry chunks");
    }
  }

  public static ProcessedDocument success(String documentId, List<DocumentChunk> chunks) {
    return new ProcessedDocument(documentId, chunks, null);
  }

  public static ProcessedDocument failure(String documentId, String error) {
    return new ProcessedDocument(documentId, List.of(), error);
  }

  public boolean succeeded() {
    return error == null;
  }
}
