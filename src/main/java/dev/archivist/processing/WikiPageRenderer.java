package dev.archivist.processing;

import com.fasterxml.jackson.databind.JsonNode;
import dev.archivist.metadata.SourceType;
import dev.archivist.store.StoredDocument;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Renders a wiki page as a title, location and authorship header above the page text. */
@Component
public class WikiPageRenderer implements DocumentRenderer {

  @Override
  public Set<SourceType> sourceTypes() {
    return Set.of(SourceType.WIKI);
  }

  @Override
  public String render(StoredDocument document) {
    JsonNode page = JsonFields.structured(document);
    String title = JsonFields.required(page, "title");
    return String.join("\n",
        "# " + title,
        "Space: " + JsonFields.required(page, "space_key"),
        "Path: " + JsonFields.optional(page, "hierarchy_path", title),
        "Last Updated: " + JsonFields.optional(page, "last_updated", "unknown")
            + " by " + JsonFields.optional(page, "author", "unknown"),
        "",
        "---",
        "",
        JsonFields.required(page, "text_content"));
  }
}
