package dev.archivist.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.archivist.index.IndexInfo;
import dev.archivist.index.IndexOperation;
import dev.archivist.index.IndexOperationException;
import dev.archivist.index.IndexOperationResult;
import dev.archivist.index.ReindexMode;
import dev.archivist.index.VectorIndexManager;
import dev.archivist.ingestion.IngestionOutcome;
import dev.archivist.ingestion.chat.ChatIngestor;
import dev.archivist.ingestion.upload.FileUploadIngestor;
import dev.archivist.ingestion.wiki.WikiIngestor;
import dev.archivist.metadata.IngestionRecord;
import dev.archivist.metadata.IngestionStatus;
import dev.archivist.metadata.SourceType;
import dev.archivist.store.BatchHandle;
import dev.archivist.store.RawDataStore;
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
class IngestionOrchestratorTest {

    private static final Instant STARTED = Instant.parse("2026-01-15T10:00:00Z");
    private static final BatchHandle SPACE_BATCH =
            new BatchHandle(SourceType.WIKI, "20260115_100000_000_space_ENG");

    @Mock
    FileUploadIngestor files;

    @Mock
    ChatIngestor chat;

    @Mock
    WikiIngestor wiki;

    @Mock
    RawDataStore store;

    @Mock
    VectorIndexManager index;

    IngestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new IngestionOrchestrator(files, chat, wiki, store, index);
    }

    // --- Automatic indexing ---

    @Test
    void completedRunUpdatesAnExistingIndex() {
        given(wiki.ingestSpace("ENG", 500)).willReturn(outcome(IngestionStatus.COMPLETED, 3));
        given(index.exists()).willReturn(true);
        given(index.update(List.of(SPACE_BATCH))).willReturn(result(IndexOperation.UPDATE, 4));

        IngestionReport report = orchestrator.ingestWikiSpace("ENG", 500, true);

        assertThat(report.indexed()).isTrue();
        assertThat(report.index().version()).isEqualTo(4);
        assertThat(report.indexError()).isNull();
        verify(index, never()).initialize(any());
    }

    @Test
    void completedRunInitializesAMissingIndex() {
        given(wiki.ingestPage("101")).willReturn(outcome(IngestionStatus.COMPLETED, 1));
        given(index.exists()).willReturn(false);
        given(index.initialize(List.of(SPACE_BATCH))).willReturn(result(IndexOperation.INITIALIZE, 1));

        IngestionReport report = orchestrator.ingestWikiPage("101", true);

        assertThat(report.index().operation()).isEqualTo(IndexOperation.INITIALIZE);
        verify(index, never()).update(any());
    }

    @Test
    void partialRunIsStillIndexed() {
        given(chat.ingestChannel("C1", 30, 1000)).willReturn(outcome(IngestionStatus.PARTIAL, 2));
        given(index.exists()).willReturn(true);
        given(index.update(List.of(SPACE_BATCH))).willReturn(result(IndexOperation.UPDATE, 2));

        IngestionReport report = orchestrator.ingestChatChannel("C1", 30, 1000, true);

        assertThat(report.indexed()).isTrue();
    }

    @Test
    void failedRunIsNeverIndexed() {
        IngestionRecord failed = new IngestionRecord("wiki_space_ENG", SourceType.WIKI, STARTED,
                STARTED, 0, 0, 0, IngestionStatus.FAILED, "401 Unauthorized", List.of("ENG"));
        given(wiki.ingestSpace("ENG", 500)).willReturn(new IngestionOutcome(failed, List.of()));

        IngestionReport report = orchestrator.ingestWikiSpace("ENG", 500, true);

        assertThat(report.indexed()).isFalse();
        verifyNoInteractions(index);
    }

    @Test
    void runThatStoredNothingIsNotIndexed() {
        given(chat.ingestExport(Path.of("/exports/acme"))).willReturn(outcome(IngestionStatus.COMPLETED, 0));

        IngestionReport report = orchestrator.ingestChatExport(Path.of("/exports/acme"), true);

        assertThat(report.indexed()).isFalse();
        verifyNoInteractions(index);
    }

    @Test
    void autoIndexOffSkipsIndexing() {
        given(files.ingestFile(Path.of("/tmp/guide.md"), "ada", Map.of()))
                .willReturn(outcome(IngestionStatus.COMPLETED, 1));

        IngestionReport report = orchestrator.ingestFile(Path.of("/tmp/guide.md"), "ada", Map.of(), false);

        assertThat(report.indexed()).isFalse();
        assertThat(report.ingestion().documentsIngested()).isEqualTo(1);
        verifyNoInteractions(index);
    }

    @Test
    void indexFailureIsReportedWithoutUndoingTheIngestion() {
        given(wiki.ingestSpace("ENG", 500)).willReturn(outcome(IngestionStatus.COMPLETED, 3));
        given(index.exists()).willReturn(true);
        given(index.update(List.of(SPACE_BATCH)))
                .willThrow(new IndexOperationException("Index provider failed: model offline"));

        IngestionReport report = orchestrator.ingestWikiSpace("ENG", 500, true);

        assertThat(report.indexed()).isFalse();
        assertThat(report.indexError()).contains("model offline");
        assertThat(report.ingestion().status()).isEqualTo(IngestionStatus.COMPLETED);
        assertThat(report.batches()).containsExactly(SPACE_BATCH);
    }

    // --- Index operations ---

    @Test
    void updateWithoutSelectionAddsOnlyPendingBatches() {
        BatchHandle indexed = new BatchHandle(SourceType.MARKDOWN, "20260114_090000_000_guide");
        BatchHandle pending = new BatchHandle(SourceType.TEXT, "20260115_090000_000_notes");
        given(index.getInfo()).willReturn(new IndexInfo(true, "/data/vectorstore", 2, STARTED,
                STARTED, "bge-small-en-v1.5", 3, 3, true, Map.of(indexed.toString(), 3)));
        given(store.allBatchHandles()).willReturn(List.of(indexed, pending));
        given(index.update(List.of(pending))).willReturn(result(IndexOperation.UPDATE, 3));

        IndexOperationResult result = orchestrator.updateIndex(null);

        assertThat(result.version()).isEqualTo(3);
    }

    @Test
    void reindexWithoutModeUsesTheConfiguredDefault() {
        given(index.reindexSource(SourceType.WIKI)).willReturn(result(IndexOperation.REINDEX_SOURCE, 5));

        orchestrator.reindexSource(SourceType.WIKI, null);

        verify(index, never()).reindexSource(any(), any(ReindexMode.class));
    }

    @Test
    void reindexWithModePassesItThrough() {
        given(index.reindexSource(SourceType.WIKI, ReindexMode.APPEND))
                .willReturn(result(IndexOperation.REINDEX_SOURCE, 5));

        IndexOperationResult result = orchestrator.reindexSource(SourceType.WIKI, ReindexMode.APPEND);

        assertThat(result.version()).isEqualTo(5);
    }

    // --- Audit ---

    @Test
    void historyRejectsNonPositiveLimit() {
        assertThatThrownBy(() -> orchestrator.history(null, 0))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(store);
    }

    @Test
    void listBatchesRejectsUnknownSourceType() {
        assertThatThrownBy(() -> orchestrator.listBatches(SourceType.UNKNOWN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static IngestionOutcome outcome(IngestionStatus status, int documents) {
        IngestionRecord record = new IngestionRecord("wiki_space_ENG", SourceType.WIKI, STARTED,
                STARTED, documents, status == IngestionStatus.PARTIAL ? 1 : 0, 1024L, status, null,
                List.of("ENG"));
        return new IngestionOutcome(record, List.of(SPACE_BATCH));
    }

    private static IndexOperationResult result(IndexOperation operation, int version) {
        return new IndexOperationResult(operation, version, 3, 0, 3, List.of(SPACE_BATCH.toString()),
                List.of(), null);
    }
}
