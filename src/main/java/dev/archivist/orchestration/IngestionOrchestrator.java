package dev.archivist.orchestration;

import dev.archivist.ArchivistException;
import dev.archivist.index.IndexInfo;
import dev.archivist.index.IndexMatch;
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
import dev.archivist.store.BatchManifest;
import dev.archivist.store.RawDataStore;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single entry point for ingesting content and managing the index.
 *
 * <p>Every ingest method runs the matching ingestor and, when {@code autoIndex} is set, adds the
 * written batches to the index afterwards: {@code update} when an index exists, {@code initialize}
 * otherwise. Nothing is indexed for a failed run or a run that stored no document. A failing index
 * operation does not undo the ingestion; it is reported in {@link IngestionReport#indexError()}.
 */
@Service
public class IngestionOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(IngestionOrchestrator.class);

  public static final int DEFAULT_HISTORY_LIMIT = 10;

  private final FileUploadIngestor files;
  private final ChatIngestor chat;
  private final WikiIngestor wiki;
  private final RawDataStore store;
  private final VectorIndexManager index;

  public IngestionOrchestrator(
      FileUploadIngestor files,
      ChatIngestor chat,
      WikiIngestor wiki,
      RawDataStore store,
      VectorIndexManager index) {
    this.files = files;
    this.chat = chat;
    this.wiki = wiki;
    this.store = store;
    this.index = index;
  }

  public IngestionReport ingestFile(
      Path path, @Nullable String uploadedBy, Map<String, Object> overrides, boolean autoIndex) {
    return run(() -> files.ingestFile(path, uploadedBy, overrides), autoIndex);
  }

  public IngestionReport ingestFiles(
      List<Path> paths, @Nullable String uploadedBy, boolean autoIndex) {
    return run(() -> files.ingestFiles(paths, uploadedBy), autoIndex);
  }

  public IngestionReport ingestBytes(
      String filename,
      byte[] bytes,
      @Nullable String uploadedBy,
      Map<String, Object> overrides,
      boolean autoIndex) {
    return run(() -> files.ingestBytes(filename, bytes, uploadedBy, overrides), autoIndex);
  }

  public IngestionReport ingestChatChannel(
      String channelId, int daysHistory, int limit, boolean autoIndex) {
    return run(() -> chat.ingestChannel(channelId, daysHistory, limit), autoIndex);
  }

  public IngestionReport ingestChatExport(Path exportDir, boolean autoIndex) {
    return run(() -> chat.ingestExport(exportDir), autoIndex);
  }

  public IngestionReport ingestWikiSpace(String spaceKey, int limit, boolean autoIndex) {
    return run(() -> wiki.ingestSpace(spaceKey, limit), autoIndex);
  }

  public IngestionReport ingestWikiPage(String pageId, boolean autoIndex) {
    return run(() -> wiki.ingestPage(pageId), autoIndex);
  }

  /**
   * Builds the index from scratch.
   *
   * @param batches batches to index; null for every stored batch
   */
  public IndexOperationResult initializeIndex(@Nullable List<BatchHandle> batches) {
    return index.initialize(batches);
  }

  /**
   * Adds batches to the existing index.
   *
   * @param batches batches to add; null for every stored batch the index does not account for yet
   */
  public IndexOperationResult updateIndex(@Nullable List<BatchHandle> batches) {
    return index.update(batches != null ? batches : pendingBatches());
  }

  public IndexOperationResult rebuildIndex(@Nullable List<BatchHandle> batches, boolean backup) {
    return index.rebuild(batches, backup);
  }

  /**
   * Reindexes one source.
   *
   * @param mode reindex mode; null for the configured default
   */
  public IndexOperationResult reindexSource(SourceType sourceType, @Nullable ReindexMode mode) {
    return mode == null ? index.reindexSource(sourceType) : index.reindexSource(sourceType, mode);
  }

  public IndexInfo indexInfo() {
    return index.getInfo();
  }

  public List<IndexMatch> search(String query, int maxResults, @Nullable SourceType sourceType) {
    return index.search(query, maxResults, sourceType);
  }

  /** Newest-first run records, optionally for one source type. */
  public List<IngestionRecord> history(@Nullable SourceType sourceType, int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
    }
    return store.history(sourceType, limit);
  }

  public List<BatchManifest> listBatches(SourceType sourceType) {
    if (!sourceType.isStorable()) {
      throw new IllegalArgumentException("No batches for source type " + sourceType.value());
    }
    return store.listBatches(sourceType);
  }

  /** Stored batches missing from the version record, oldest first. */
  List<BatchHandle> pendingBatches() {
    Set<String> indexed = index.getInfo().batchStats().keySet();
    return store.allBatchHandles().stream()
        .filter(handle -> !indexed.contains(handle.toString()))
        .toList();
  }

  private IngestionReport run(Supplier<IngestionOutcome> ingestion, boolean autoIndex) {
    IngestionOutcome outcome = ingestion.get();
    IngestionRecord record = outcome.record();
    if (!autoIndex) {
      return report(outcome, null, null);
    }
    if (!indexable(record) || outcome.batches().isEmpty()) {
      log.info(
          "Skipping automatic indexing for {} ({}, {} documents)",
          record.ingestionId(),
          record.status().value(),
          record.documentsIngested());
      return report(outcome, null, null);
    }
    try {
      IndexOperationResult result =
          index.exists() ? index.update(outcome.batches()) : index.initialize(outcome.batches());
      log.info(
          "Indexed {} chunks from {} (index version {})",
          result.chunksAdded(),
          record.ingestionId(),
          result.version());
      return report(outcome, result, null);
    } catch (ArchivistException | IllegalArgumentException e) {
      log.error("Automatic indexing failed for {}: {}", record.ingestionId(), e.getMessage(), e);
      return report(outcome, null, e.getMessage());
    }
  }

  private static boolean indexable(IngestionRecord record) {
    return (record.status() == IngestionStatus.COMPLETED
            || record.status() == IngestionStatus.PARTIAL)
        && record.documentsIngested() > 0;
  }

  private static IngestionReport report(
      IngestionOutcome outcome, @Nullable IndexOperationResult index, @Nullable String error) {
    return new IngestionReport(
        outcome.record(), outcome.fileRecords(), outcome.batches(), index, error);
  }
}
