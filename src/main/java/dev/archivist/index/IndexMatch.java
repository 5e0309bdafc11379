package dev.archivist.index;

import java.util.Map;

/**
 * One ranked result of a nearest-neighbour query.
 *
 * @param id provider id of the entry
 * @param score relevance score, higher is better
 * @param text chunk text
 * @param metadata chunk metadata (source, source_type, source_id, ...)
 */
public record IndexMatch(String id, double score, String text, Map<String, Object> metadata) {

  public IndexMatch {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
