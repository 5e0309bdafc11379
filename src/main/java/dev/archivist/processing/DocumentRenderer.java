package dev.archivist.processing;

import dev.archivist.metadata.SourceType;
import dev.archivist.store.StoredDocument;
import java.util.Set;

/**
 * Source-specific strategy that reconstructs one coherent display text from a stored document.
 *
 * @see DocumentProcessor
 */
public interface DocumentRenderer {

  /** Source types this renderer is registered for in the processor's strategy table. */
  Set<SourceType> sourceTypes();

  /**
   * Renders the document.
   *
   * @throws IllegalArgumentException if the stored content lacks a required field
   */
  String render(StoredDocument document);
}
