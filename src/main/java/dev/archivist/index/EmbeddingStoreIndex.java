package dev.archivist.index;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.archivist.metadata.SourceType;
import dev.archivist.processing.DocumentChunk;
import dev.archivist.store.ArchiveJson;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.filter.Filter;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

/**
 * Default {@link IndexProvider}: a langchain4j {@link InMemoryEmbeddingStore} persisted as {@code
 * embeddings.json}, plus {@code index-stats.json} holding entry counts per source type.
 *
 * <p>{@link #add} computes every embedding before touching the store, so an embedding failure
 * leaves the directory as it was.
 */
public class EmbeddingStoreIndex implements IndexProvider {

    static final String STORE_FILE = "embeddings.json";
    static final String STATS_FILE = "index-stats.json";

    private static final int EMBED_BATCH_SIZE = 256;
    private static final TypeReference<Map<String, Integer>> STATS_TYPE = new TypeReference<>() {};

    private final Path directory;
    private final EmbeddingModel embeddingModel;
    private final ObjectMapper mapper;
    private final InMemoryEmbeddingStore<TextSegment> store;
    private final Map<String, Integer> stats;

    EmbeddingStoreIndex(Path directory, EmbeddingModel embeddingModel, ObjectMapper mapper) {
        this.directory = directory;
        this.embeddingModel = embeddingModel;
        this.mapper = mapper;
        try {
            Files.createDirectories(directory);
            Path storeFile = directory.resolve(STORE_FILE);
            this.store = Files.isRegularFile(storeFile)
                    ? InMemoryEmbeddingStore.fromFile(storeFile)
                    : new InMemoryEmbeddingStore<>();
            Path statsFile = directory.resolve(STATS_FILE);
            this.stats = Files.isRegularFile(statsFile)
                    ? new LinkedHashMap<>(mapper.readValue(statsFile.toFile(), STATS_TYPE))
                    : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open index at " + directory, e);
        }
    }

    @Override
    public synchronized List<String> add(List<DocumentChunk> chunks) {
        if (chunks.isEmpty()) {
            return List.of();
        }
        List<TextSegment> segments = chunks.stream()
                .map(DocumentChunk::toTextSegment)
                .toList();

        List<Embedding> embeddings = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i += EMBED_BATCH_SIZE) {
            List<TextSegment> batch = segments.subList(i, Math.min(i + EMBED_BATCH_SIZE, segments.size()));
            List<Embedding> batchEmbeddings = embeddingModel.embedAll(batch).content();
            if (batchEmbeddings.size() != batch.size()) {
                throw new IllegalStateException("Embedding model returned " + batchEmbeddings.size()
                        + " embeddings for " + batch.size() + " segments");
            }
            embeddings.addAll(batchEmbeddings);
        }

        List<String> ids = store.addAll(embeddings, segments);
        for (DocumentChunk chunk : chunks) {
            stats.merge(chunk.metadata().sourceType().value(), 1, Integer::sum);
        }
        persist();
        return ids;
    }

    @Override
    public List<IndexMatch> query(String text, int maxResults, @Nullable SourceType sourceType) {
        Embedding queryEmbedding = embeddingModel.embed(text).content();
        Filter filter = sourceType == null
                ? null
                : metadataKey("source_type").isEqualTo(sourceType.value());
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder()
                .queryEmbedding(queryEmbedding)
                .maxResults(maxResults)
                .filter(filter)
                .build();
        List<EmbeddingMatch<TextSegment>> matches = store.search(request).matches();
        return matches.stream()
                .map(m -> new IndexMatch(m.embeddingId(), m.score(), m.embedded().text(),
                        m.embedded().metadata().toMap()))
                .toList();
    }

    @Override
    public synchronized int count() {
        return stats.values().stream().mapToInt(Integer::intValue).sum();
    }

    @Override
    public synchronized int removeSource(SourceType sourceType) {
        Integer removed = stats.remove(sourceType.value());
        store.removeAll(metadataKey("source_type").isEqualTo(sourceType.value()));
        persist();
        return removed == null ? 0 : removed;
    }

    @Override
    public synchronized void deleteAll() {
        store.removeAll();
        stats.clear();
        persist();
    }

    private void persist() {
        try {
            store.serializeToFile(directory.resolve(STORE_FILE));
            ArchiveJson.writeAtomically(mapper, directory.resolve(STATS_FILE), stats);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot persist index at " + directory, e);
        }
    }
}
