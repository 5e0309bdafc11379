package dev.archivist.processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.archivist.fixture.DocumentMetadataBuilder;
import dev.archivist.metadata.DocumentMetadata;
import dev.archivist.metadata.SourceType;
import dev.archivist.store.ArchiveJson;
import dev.archivist.store.BatchHandle;
import dev.archivist.store.BatchNotFoundException;
import dev.archivist.store.MalformedBatchException;
import dev.archivist.store.RawDataStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentProcessorTest {

  @TempDir Path baseDir;

  private RawDataStore store;
  private DocumentProcessor processor;

  @BeforeEach
  void setUp() {
    store = new RawDataStore(baseDir, ArchiveJson.newMapper(),
        Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC));
    processor = new DocumentProcessor(store, new RecursiveTextSplitter(700, 100), List.of(
        new ChatThreadRenderer(), new WikiPageRenderer(), new PdfRenderer(),
        new PlainTextRenderer()));
  }

  @Test
  void markdownOf1500CharactersBecomesThreeChunksCarryingProvenance() throws IOException {
    BatchHandle batch = store.createBatch(SourceType.MARKDOWN, "handbook");
    Map<String, Object> content = new LinkedHashMap<>();
    content.put("filename", "handbook.md");
    content.put("content", "abcdefghi ".repeat(150));
    DocumentMetadata metadata = new DocumentMetadataBuilder()
        .sourceType(SourceType.MARKDOWN)
        .sourceId("handbook.md")
        .title("Handbook")
        .build();
    store.storeDocument(batch, "handbook", content, metadata);

    BatchProcessingResult result = processor.processBatch(batch);

    List<DocumentChunk> chunks = result.chunks();
    assertThat(chunks).hasSize(3);
    assertThat(chunks).extracting(c -> c.text().length()).containsExactly(699, 699, 279);
    assertThat(chunks).extracting(DocumentChunk::chunkIndex).containsExactly(0, 1, 2);
    assertThat(chunks).allSatisfy(chunk -> {
      assertThat(chunk.chunkCount()).isEqualTo(3);
      assertThat(chunk.batchId()).isEqualTo(batch.toString());
      assertThat(chunk.documentId()).isEqualTo("handbook");
      assertThat(chunk.toMetadata().getString("source_id")).isEqualTo("handbook.md");
      assertThat(chunk.toMetadata().getString("title")).isEqualTo("Handbook");
    });
  }

  @Test
  void oneFailingDocumentLeavesTheOthersProcessed() throws IOException {
    BatchHandle batch = store.createBatch(SourceType.WIKI, "space_ENG");
    store.storeDocument(batch, "page_1", wikiPage("1", "First page body"), wikiMetadata("1"));
    Map<String, Object> broken = wikiPage("2", "ignored");
    broken.remove("text_content");
    store.storeDocument(batch, "page_2", broken, wikiMetadata("2"));
    store.storeDocument(batch, "page_3", wikiPage("3", "Third page body"), wikiMetadata("3"));

    BatchProcessingResult result = processor.processBatch(batch);

    assertThat(result.documents()).hasSize(3);
    assertThat(result.succeeded()).isEqualTo(2);
    assertThat(result.failed()).isEqualTo(1);
    ProcessedDocument failure = result.documents().get(1);
    assertThat(failure.documentId()).isEqualTo("page_2");
    assertThat(failure.error()).contains("text_content");
    assertThat(result.chunks()).extracting(DocumentChunk::documentId)
        .containsExactly("page_1", "page_3");
  }

  @Test
  void unreadableContentFileIsAFailureNotAnAbort() throws IOException {
    BatchHandle batch = store.createBatch(SourceType.TEXT, "notes");
    Path gone = store.storeDocument(batch, "a", "first note", textMetadata("a"));
    store.storeDocument(batch, "b", "second note", textMetadata("b"));
    Files.delete(gone);

    BatchProcessingResult result = processor.processBatch(batch);

    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.chunks()).extracting(DocumentChunk::text).containsExactly("second note");
  }

  @Test
  void binaryMembersAreSkipped() throws IOException {
    BatchHandle batch = store.createBatch(SourceType.PDF, "report");
    DocumentMetadata metadata = new DocumentMetadataBuilder()
        .sourceType(SourceType.PDF).sourceId("report.pdf").build();
    store.storeBinary(batch, "report.pdf", new byte[] {1, 2, 3}, metadata);
    Map<String, Object> pdf = new LinkedHashMap<>();
    pdf.put("filename", "report.pdf");
    pdf.put("total_pages", 1);
    pdf.put("pdf_metadata", Map.of("title", "Quarterly Report"));
    pdf.put("pages", List.of(Map.of("page", 1, "text", "Revenue grew.", "char_count", 13)));
    store.storeDocument(batch, "report", pdf, metadata);

    BatchProcessingResult result = processor.processBatch(batch);

    assertThat(result.documents()).hasSize(1);
    assertThat(result.chunks()).singleElement()
        .satisfies(c -> assertThat(c.text()).startsWith("# Quarterly Report").contains("Revenue grew."));
  }

  @Test
  void batchWithoutRendererIsMalformed() throws IOException {
    DocumentProcessor textOnly = new DocumentProcessor(
        store, new RecursiveTextSplitter(), List.of(new PlainTextRenderer()));
    BatchHandle batch = store.createBatch(SourceType.CHAT, "general");

    assertThatThrownBy(() -> textOnly.processBatch(batch))
        .isInstanceOf(MalformedBatchException.class)
        .hasMessageContaining("chat");
  }

  @Test
  void missingBatchIsNotFound() {
    assertThatThrownBy(() -> processor.processBatch(new BatchHandle(SourceType.WIKI, "missing")))
        .isInstanceOf(BatchNotFoundException.class);
  }

  @Test
  void twoRenderersForOneSourceTypeAreRejected() {
    assertThatThrownBy(() -> new DocumentProcessor(store, new RecursiveTextSplitter(),
        List.of(new PlainTextRenderer(), new PlainTextRenderer())))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void blankDocumentProducesNoChunksButSucceeds() throws IOException {
    BatchHandle batch = store.createBatch(SourceType.TEXT, "empty");
    store.storeDocument(batch, "blank", "   \n  ", textMetadata("blank"));

    BatchProcessingResult result = processor.processBatch(batch);

    assertThat(result.succeeded()).isEqualTo(1);
    assertThat(result.chunks()).isEmpty();
  }

  private static Map<String, Object> wikiPage(String id, String text) {
    Map<String, Object> page = new LinkedHashMap<>();
    page.put("page_id", id);
    page.put("title", "Page " + id);
    page.put("space_key", "ENG");
    page.put("hierarchy_path", "Home / Page " + id);
    page.put("author", "grace");
    page.put("last_updated", "2026-01-10T08:00:00Z");
    page.put("text_content", text);
    return page;
  }

  private static DocumentMetadata wikiMetadata(String id) {
    return new DocumentMetadataBuilder()
        .sourceType(SourceType.WIKI).sourceId(id).sourceName("ENG").title("Page " + id).build();
  }

  private static DocumentMetadata textMetadata(String id) {
    return new DocumentMetadataBuilder().sourceType(SourceType.TEXT).sourceId(id).build();
  }
}
