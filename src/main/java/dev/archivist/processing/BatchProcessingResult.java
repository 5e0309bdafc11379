package dev.archivist.processing;

import dev.archivist.store.BatchHandle;
import java.util.List;
import java.util.Objects;

/**
 * Per-document outcomes of processing one batch.
 *
 * @param batch the processed batch
 * @param documents one outcome per non-binary member, in manifest order
 */
public record BatchProcessingResult(BatchHandle batch, List<ProcessedDocument> documents) {

  public BatchProcessingResult {
    Objects.requireNonNull(batch, "batch must not be null");
    documents = documents == null ? List.of() : List.copyOf(documents);
  }

  /** All chunks of the successfully processed documents, in order. */
  public List<DocumentChunk> chunks() {
    return documents.stream().flatMap(d -> d.chunks().stream()).toList();
  }

  public long succeeded() {
    return documents.stream().filter(ProcessedDocument::succeeded).count();
  }

  public long failed() {
    return documents.size() - succeeded();
  }
}
