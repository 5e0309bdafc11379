package dev.archivist.processing;

import dev.archivist.metadata.SourceType;
import dev.archivist.store.StoredDocument;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Markdown and plain text are indexed as-is. */
@Component
public class PlainTextRenderer implements DocumentRenderer {

  @Override
  public Set<SourceType> sourceTypes() {
    return Set.of(SourceType.MARKDOWN, SourceType.TEXT);
  }

  @Override
  public String render(StoredDocument document) {
    if (document.text() != null) {
      return document.text();
    }
    return JsonFields.required(JsonFields.structured(document), "content");
  }
}
