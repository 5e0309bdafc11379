package dev.archivist.processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.archivist.fixture.DocumentMetadataBuilder;
import dev.archivist.store.ArchiveJson;
import dev.archivist.store.ContentKind;
import dev.archivist.store.ManifestEntry;
import dev.archivist.store.StoredDocument;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentRenderersTest {

  private final ObjectMapper mapper = ArchiveJson.newMapper();

  @Test
  void chatThreadRendersHeaderAndOneLinePerMessage() {
    Map<String, Object> thread = Map.of(
        "channel_name", "general",
        "thread_ts", "1700000000.000100",
        "participants", List.of("Ada", "Grace"),
        "messages", List.of(
            Map.of("timestamp", "2023-11-14 22:13:20", "user_name", "Ada", "text", "Deploy?"),
            Map.of("timestamp", "2023-11-14 22:15:00", "user_name", "Grace", "text", "Done.")));

    String rendered = new ChatThreadRenderer().render(structured(thread));

    assertThat(rendered).isEqualTo(String.join("\n",
        "# Slack Conversation: #general",
        "Thread ID: 1700000000.000100",
        "Participants: Ada, Grace",
        "",
        "---",
        "",
        "[2023-11-14 22:13:20] Ada: Deploy?",
        "[2023-11-14 22:15:00] Grace: Done."));
  }

  @Test
  void wikiPageRendersBreadcrumbAndBody() {
    Map<String, Object> page = Map.of(
        "title", "Onboarding",
        "space_key", "ENG",
        "hierarchy_path", "Home / Team / Onboarding",
        "last_updated", "2026-01-10T08:00:00Z",
        "author", "grace",
        "text_content", "Welcome aboard.");

    String rendered = new WikiPageRenderer().render(structured(page));

    assertThat(rendered).isEqualTo(String.join("\n",
        "# Onboarding",
        "Space: ENG",
        "Path: Home / Team / Onboarding",
        "Last Updated: 2026-01-10T08:00:00Z by grace",
        "",
        "---",
        "",
        "Welcome aboard."));
  }

  @Test
  void pdfFallsBackToFilenameAndUnknownAuthor() {
    Map<String, Object> pdf = Map.of(
        "filename", "scan.pdf",
        "total_pages", 2,
        "pdf_metadata", Map.of(),
        "pages", List.of(Map.of("page", 1, "text", "One"), Map.of("page", 2, "text", "Two")));

    String rendered = new PdfRenderer().render(structured(pdf));

    assertThat(rendered)
        .startsWith("# scan.pdf\nAuthor: Unknown\nPages: 2\n")
        .contains("\n--- Page 1 ---\n\nOne")
        .contains("\n--- Page 2 ---\n\nTwo");
  }

  @Test
  void plainTextUsesStoredTextOrContentField() {
    PlainTextRenderer renderer = new PlainTextRenderer();

    assertThat(renderer.render(text("# Title\nbody"))).isEqualTo("# Title\nbody");
    assertThat(renderer.render(structured(Map.of("filename", "a.md", "content", "from json"))))
        .isEqualTo("from json");
  }

  @Test
  void structuredRendererRejectsPlainText() {
    assertThatThrownBy(() -> new WikiPageRenderer().render(text("not json")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("no structured content");
  }

  private StoredDocument structured(Map<String, Object> content) {
    JsonNode node = mapper.valueToTree(content);
    return new StoredDocument(entry(ContentKind.STRUCTURED), new DocumentMetadataBuilder().build(),
        node, null);
  }

  private StoredDocument text(String content) {
    return new StoredDocument(entry(ContentKind.TEXT), new DocumentMetadataBuilder().build(), null,
        content);
  }

  private static ManifestEntry entry(ContentKind kind) {
    return new ManifestEntry("doc", "doc.content", "doc.metadata.json", kind,
        Instant.parse("2026-01-15T10:00:00Z"));
  }
}
