package dev.archivist.processing;

import com.fasterxml.jackson.databind.JsonNode;
import dev.archivist.metadata.SourceType;
import dev.archivist.store.StoredDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Renders extracted PDF pages under a title/author header, each page behind a page marker. */
@Component
public class PdfRenderer implements DocumentRenderer {

  @Override
  public Set<SourceType> sourceTypes() {
    return Set.of(SourceType.PDF);
  }

  @Override
  public String render(StoredDocument document) {
    JsonNode pdf = JsonFields.structured(document);
    JsonNode info = pdf.path("pdf_metadata");
    String filename = JsonFields.required(pdf, "filename");

    List<String> lines = new ArrayList<>();
    lines.add("# " + nonBlank(info.path("title").asText(""), filename));
    lines.add("Author: " + nonBlank(info.path("author").asText(""), "Unknown"));
    lines.add("Pages: " + JsonFields.required(pdf, "total_pages"));
    lines.add("");
    lines.add("---");
    lines.add("");
    for (JsonNode page : pdf.path("pages")) {
      lines.add("\n--- Page " + JsonFields.required(page, "page") + " ---\n");
      lines.add(JsonFields.optional(page, "text", ""));
    }
    return String.join("\n", lines);
  }

  private static String nonBlank(String value, String fallback) {
    return value.isBlank() ? fallback : value;
  }
}
