package dev.archivist.processing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.archivist.metadata.DocumentMetadata;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One search-ready slice of a rendered document, carrying the document's full provenance.
 *
 * @param text the chunk body text
 * @param metadata provenance of the document the chunk was cut from
 * @param batchId handle of the batch, rendered as {@code <source_type>/<batch_id>}
 * @param documentId manifest id of the document
 * @param chunkIndex zero-based position of the chunk within its document
 * @param chunkCount number of chunks cut from the document
 */
public record DocumentChunk(
    String text,
    DocumentMetadata metadata,
    String batchId,
    String documentId,
    int chunkIndex,
    int chunkCount) {

  private static final ObjectMapper JSON = new ObjectMapper();

  /** Provenance and position keys; an {@code extra} entry with one of these names is dropped. */
  static final Set<String> RESERVED_KEYS = Set.of(
      "source", "source_type", "source_id", "ingested_at", "source_timestamp", "author", "title",
      "url", "batch_id", "document_id", "chunk_index", "chunk_count");

  public DocumentChunk {
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(metadata, "metadata must not be null");
    Objects.requireNonNull(batchId, "batchId must not be null");
    Objects.requireNonNull(documentId, "documentId must not be null");
    if (chunkIndex < 0 || chunkIndex >= chunkCount) {
      throw new IllegalArgumentException(
          "chunkIndex " + chunkIndex + " out of range for chunkCount " + chunkCount);
    }
  }

  /**
   * Converts provenance to a langchain4j {@link Metadata} instance with snake_case keys used by the
   * index. Entries of {@code extra} come last and never replace a reserved key; values the index cannot hold natively (booleans,
   * lists, maps) are stored as their JSON text.
   */
  public Metadata toMetadata() {
    Metadata out =
        Metadata.from("source", metadata.sourceName())
            .put("source_type", metadata.sourceType().value())
            .put("source_id", metadata.sourceId())
            .put("ingested_at", metadata.ingestedAt().toString());
    if (metadata.sourceTimestamp() != null) {
      out.put("source_timestamp", metadata.sourceTimestamp().toString());
    }
    if (metadata.author() != null) {
      out.put("author", metadata.author());
    }
    if (metadata.title() != null) {
      out.put("title", metadata.title());
    }
    if (metadata.url() != null) {
      out.put("url", metadata.url());
    }
    out.put("batch_id", batchId)
        .put("document_id", documentId)
        .put("chunk_index", chunkIndex)
        .put("chunk_count", chunkCount);
    for (Map.Entry<String, Object> entry : metadata.extra().entrySet()) {
      if (RESERVED_KEYS.contains(entry.getKey())) {
        continue;
      }
      putValue(out, entry.getKey(), entry.getValue());
    }
    return out;
  }

  /** Converts this chunk to a langchain4j {@link TextSegment} ready for embedding. */
  public TextSegment toTextSegment() {
    return TextSegment.from(text, toMetadata());
  }

  private static void putValue(Metadata out, String key, Object value) {
    if (value == null) {
      return;
    }
    if (value instanceof String s) {
      out.put(key, s);
    } else if (value instanceof Integer i) {
      out.put(key, i);
    } else if (value instanceof Long l) {
      out.put(key, l);
    } else if (value instanceof Double d) {
      out.put(key, d);
    } else if (value instanceof Float f) {
      out.put(key, f);
    } else {
      try {
        out.put(key, JSON.writeValueAsString(value));
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Metadata value for '" + key + "' is not JSON", e);
      }
    }
  }
}
