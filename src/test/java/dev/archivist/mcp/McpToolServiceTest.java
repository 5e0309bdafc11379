package dev.archivist.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.archivist.index.IndexInfo;
import dev.archivist.index.IndexMatch;
import dev.archivist.index.IndexNotFoundException;
import dev.archivist.index.IndexOperation;
import dev.archivist.index.IndexOperationResult;
import dev.archivist.index.ReindexMode;
import dev.archivist.metadata.IngestionRecord;
import dev.archivist.metadata.IngestionStatus;
import dev.archivist.metadata.SourceType;
import dev.archivist.orchestration.IngestionOrchestrator;
import dev.archivist.orchestration.IngestionReport;
import dev.archivist.store.BatchHandle;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class McpToolServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Mock
    IngestionOrchestrator orchestrator;

    McpToolService mcpToolService;

    @BeforeEach
    void setUp() {
        mcpToolService = new McpToolService(orchestrator);
    }

    // --- ingest_file ---

    @Test
    void ingestFileReportsRunAndIndexResult() {
        IngestionRecord record = new IngestionRecord("upload_markdown_20260115_100000_ab12cd34",
                SourceType.MARKDOWN, NOW, NOW, 1, 0, 42, IngestionStatus.COMPLETED, null,
                List.of("guide.md"));
        IndexOperationResult indexed = new IndexOperationResult(IndexOperation.UPDATE, 7, 3, 0, 30,
                List.of(), List.of(), null);
        given(orchestrator.ingestFile(Path.of("/data/guide.md"), null, Map.of(), true))
                .willReturn(new IngestionReport(record, List.of(), List.of(), indexed, null));

        String result = mcpToolService.ingestFile("/data/guide.md", null, null);

        assertThat(result)
                .contains("upload_markdown_20260115_100000_ab12cd34 completed")
                .contains("1 ingested, 0 failed")
                .contains("Indexed 3 chunks (index version 7)");
    }

    @Test
    void ingestFileWithBlankPathReturnsErrorWithoutCallingOrchestrator() {
        String result = mcpToolService.ingestFile("  ", null, null);

        assertThat(result).startsWith("Error: Path must not be empty");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void ingestFileTurnsExceptionsIntoErrorStrings() {
        given(orchestrator.ingestFile(any(), any(), any(), anyBoolean()))
                .willThrow(new IllegalArgumentException("Unsupported file type: a.docx"));

        String result = mcpToolService.ingestFile("/data/a.docx", "ada", false);

        assertThat(result).isEqualTo("Error ingesting file: Unsupported file type: a.docx");
    }

    // --- audit tools ---

    @Test
    void ingestionHistoryWithNoRecords() {
        given(orchestrator.history(null, IngestionOrchestrator.DEFAULT_HISTORY_LIMIT)).willReturn(List.of());

        assertThat(mcpToolService.ingestionHistory(null, null)).isEqualTo("No ingestion runs recorded.");
    }

    @Test
    void ingestionHistoryRejectsUnknownSourceType() {
        String result = mcpToolService.ingestionHistory("email", 5);

        assertThat(result).startsWith("Error reading ingestion history:").contains("email");
        verifyNoInteractions(orchestrator);
    }

    @Test
    void listBatchesRequiresSourceType() {
        assertThat(mcpToolService.listBatches(null)).isEqualTo("Error: Source type must not be empty.");
    }

    @Test
    void listBatchesWithNothingStored() {
        given(orchestrator.listBatches(SourceType.WIKI)).willReturn(List.of());

        assertThat(mcpToolService.listBatches("wiki")).isEqualTo("No wiki batches stored.");
    }

    // --- index tools ---

    @Test
    void indexInfoWithoutAnIndex() {
        given(orchestrator.indexInfo()).willReturn(new IndexInfo(false, "/data/vectorstore", null, null,
                null, null, null, null, false, Map.of()));

        assertThat(mcpToolService.indexInfo()).startsWith("No index at /data/vectorstore");
    }

    @Test
    void indexInfoFlagsInconsistentCounts() {
        given(orchestrator.indexInfo()).willReturn(new IndexInfo(true, "/data/vectorstore", 4, NOW, NOW,
                "bge-small-en-v1.5", 30, 28, false, Map.of("wiki/b1", 30)));

        String result = mcpToolService.indexInfo();

        assertThat(result)
                .contains("Version: 4")
                .contains("Chunks: 30 (provider reports 28)")
                .contains("Warning: record and provider counts disagree.");
    }

    @Test
    void updateIndexCreatesTheIndexWhenMissing() {
        given(orchestrator.indexInfo()).willReturn(new IndexInfo(false, "/data/vectorstore", null, null,
                null, null, null, null, false, Map.of()));
        given(orchestrator.initializeIndex(null)).willReturn(new IndexOperationResult(
                IndexOperation.INITIALIZE, 1, 12, 0, 12, List.of("wiki/b1"), List.of(), null));

        String result = mcpToolService.updateIndex();

        assertThat(result).isEqualTo("initialize done: version 1, 12 chunks added, 0 removed, 12 total.");
        verify(orchestrator, never()).updateIndex(any());
    }

    @Test
    void rebuildIndexReportsBackupAndSkippedBatches() {
        given(orchestrator.rebuildIndex(null, true)).willReturn(new IndexOperationResult(
                IndexOperation.REBUILD, 1, 10, 0, 10, List.of("wiki/b1"), List.of("wiki/gone"),
                "/data/vectorstore_backup_20260115_100000"));

        String result = mcpToolService.rebuildIndex(null);

        assertThat(result)
                .contains("Skipped batches: wiki/gone")
                .contains("Backup: /data/vectorstore_backup_20260115_100000");
    }

    @Test
    void reindexSourceParsesMode() {
        given(orchestrator.reindexSource(SourceType.CHAT, ReindexMode.APPEND)).willReturn(
                new IndexOperationResult(IndexOperation.REINDEX_SOURCE, 3, 5, 0, 20, List.of(),
                        List.of(), null));

        String result = mcpToolService.reindexSource("chat", "Append");

        assertThat(result).startsWith(IndexOperation.REINDEX_SOURCE.value() + " done: version 3");
    }

    @Test
    void reindexSourceWithBadModeReturnsError() {
        assertThat(mcpToolService.reindexSource("chat", "merge")).startsWith("Error reindexing source:");
        verifyNoInteractions(orchestrator);
    }

    // --- search_index ---

    @Test
    void searchIndexFormatsRankedExcerpts() {
        String longText = "x".repeat(600);
        given(orchestrator.search("deploy", 5, null)).willReturn(List.of(
                new IndexMatch("id-1", 0.91234, "Restart the agent.",
                        Map.of("title", "Runbook", "source_type", "wiki", "source_id", "101")),
                new IndexMatch("id-2", 0.5, longText, Map.of("source", "#general"))));

        String result = mcpToolService.searchIndex("deploy", null, null);

        assertThat(result)
                .startsWith("1. [0.912] Runbook (wiki, 101)")
                .contains("Restart the agent.")
                .contains("2. [0.500] #general (?, ?)")
                .contains("x".repeat(500) + "...")
                .doesNotContain("x".repeat(501));
    }

    @Test
    void searchIndexClampsMaxResultsAndFiltersBySource() {
        given(orchestrator.search("deploy", 50, SourceType.PDF)).willReturn(List.of());

        String result = mcpToolService.searchIndex("deploy", 500, "pdf");

        assertThat(result).isEqualTo("No results found for query: deploy");
    }

    @Test
    void searchIndexWithBlankQueryReturnsError() {
        assertThat(mcpToolService.searchIndex("", null, null)).startsWith("Error: Query must not be empty");
        verify(orchestrator, never()).search(any(), anyInt(), isNull());
    }

    @Test
    void searchWithoutIndexReturnsError() {
        given(orchestrator.search("deploy", 5, null)).willThrow(new IndexNotFoundException("No index at /data"));

        assertThat(mcpToolService.searchIndex("deploy", 5, null))
                .isEqualTo("Error searching index: No index at /data");
    }

    @Test
    void reportOfFailedIndexingMentionsTheError() {
        IngestionRecord record = new IngestionRecord("upload_text_20260115_100000_ab12cd34",
                SourceType.TEXT, NOW, NOW, 1, 0, 5, IngestionStatus.COMPLETED, null, List.of("a.txt"));
        given(orchestrator.ingestFile(Path.of("/data/a.txt"), null, Map.of(), true)).willReturn(
                new IngestionReport(record, List.of(), List.of(new BatchHandle(SourceType.TEXT, "b1")),
                        null, "Index provider failed: model offline"));

        assertThat(mcpToolService.ingestFile("/data/a.txt", null, true))
                .contains("Indexing failed: Index provider failed: model offline");
    }
}
