package dev.archivist.index;

import dev.archivist.metadata.SourceType;
import dev.archivist.processing.DocumentChunk;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Embedding and similarity-search provider bound to one index directory. Mutations are persisted
 * to the directory before they return.
 */
public interface IndexProvider {

  /** Embeds and adds the chunks; returns their provider ids in input order. */
  List<String> add(List<DocumentChunk> chunks);

  List<IndexMatch> query(String text, int maxResults, @Nullable SourceType sourceType);

  /** Number of entries the provider itself holds. */
  int count();

  /** Removes every entry of the given source type; returns the number removed. */
  int removeSource(SourceType sourceType);

  void deleteAll();
}
