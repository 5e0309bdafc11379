package dev.archivist.index;

import static org.assertj.core.api.Assertions.assertThat;

import dev.archivist.fixture.DocumentMetadataBuilder;
import dev.archivist.fixture.HashingEmbeddingModel;
import dev.archivist.metadata.SourceType;
import dev.archivist.processing.DocumentChunk;
import dev.archivist.store.ArchiveJson;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EmbeddingStoreIndexTest {

    @TempDir
    Path directory;

    private final HashingEmbeddingModel model = new HashingEmbeddingModel();

    @Test
    void addReturnsOneIdPerChunkAndPersistsBothFiles() {
        EmbeddingStoreIndex index = open();

        List<String> ids = index.add(List.of(
                chunk(SourceType.WIKI, "deployment pipeline runbook"),
                chunk(SourceType.CHAT, "lunch plans for friday")));

        assertThat(ids).hasSize(2).doesNotHaveDuplicates();
        assertThat(index.count()).isEqualTo(2);
        assertThat(directory.resolve(EmbeddingStoreIndex.STORE_FILE)).isRegularFile();
        assertThat(directory.resolve(EmbeddingStoreIndex.STATS_FILE)).isRegularFile();
    }

    @Test
    void queryRanksTheClosestChunkFirstAndHonoursSourceFilter() {
        EmbeddingStoreIndex index = open();
        index.add(List.of(
                chunk(SourceType.WIKI, "deployment pipeline runbook"),
                chunk(SourceType.CHAT, "deployment pipeline is broken again"),
                chunk(SourceType.CHAT, "lunch plans for friday")));

        List<IndexMatch> all = index.query("deployment pipeline runbook", 3, null);
        List<IndexMatch> chatOnly = index.query("deployment pipeline runbook", 3, SourceType.CHAT);

        assertThat(all.get(0).text()).isEqualTo("deployment pipeline runbook");
        assertThat(all.get(0).metadata()).containsEntry("source_type", "wiki");
        assertThat(chatOnly).hasSize(2)
                .allSatisfy(match -> assertThat(match.metadata()).containsEntry("source_type", "chat"));
        assertThat(chatOnly.get(0).text()).isEqualTo("deployment pipeline is broken again");
    }

    @Test
    void reopeningTheDirectoryRestoresEntriesAndCounts() {
        open().add(List.of(
                chunk(SourceType.PDF, "quarterly revenue report"),
                chunk(SourceType.PDF, "headcount plan")));

        EmbeddingStoreIndex reopened = open();

        assertThat(reopened.count()).isEqualTo(2);
        assertThat(reopened.query("quarterly revenue", 1, null))
                .extracting(IndexMatch::text)
                .containsExactly("quarterly revenue report");
    }

    @Test
    void removeSourceDropsOnlyThatSource() {
        EmbeddingStoreIndex index = open();
        index.add(List.of(
                chunk(SourceType.WIKI, "wiki one"),
                chunk(SourceType.WIKI, "wiki two"),
                chunk(SourceType.CHAT, "slack one")));

        int removed = index.removeSource(SourceType.WIKI);

        assertThat(removed).isEqualTo(2);
        assertThat(index.count()).isEqualTo(1);
        assertThat(index.query("wiki one", 5, null))
                .extracting(IndexMatch::text)
                .containsExactly("slack one");
        assertThat(index.removeSource(SourceType.PDF)).isZero();
    }

    @Test
    void deleteAllEmptiesThePersistedIndex() {
        EmbeddingStoreIndex index = open();
        index.add(List.of(chunk(SourceType.TEXT, "notes")));

        index.deleteAll();

        assertThat(index.count()).isZero();
        assertThat(open().count()).isZero();
        assertThat(Files.exists(directory.resolve(EmbeddingStoreIndex.STORE_FILE))).isTrue();
    }

    @Test
    void addingNothingDoesNotCallTheModel() {
        EmbeddingStoreIndex index = open();

        assertThat(index.add(List.of())).isEmpty();
        assertThat(model.calls()).isZero();
    }

    private EmbeddingStoreIndex open() {
        return new EmbeddingStoreIndex(directory, model, ArchiveJson.newMapper());
    }

    private static DocumentChunk chunk(SourceType type, String text) {
        return new DocumentChunk(text,
                new DocumentMetadataBuilder().sourceType(type).sourceId(text).build(),
                type.value() + "/batch", text, 0, 1);
    }
}
