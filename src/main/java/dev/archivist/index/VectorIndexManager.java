package dev.archivist.index;

import dev.archivist.metadata.SourceType;
import dev.archivist.processing.BatchProcessingResult;
import dev.archivist.processing.DocumentChunk;
import dev.archivist.processing.DocumentProcessor;
import dev.archivist.store.ArchiveJson;
import dev.archivist.store.BatchHandle;
import dev.archivist.store.BatchNotFoundException;
import dev.archivist.store.MalformedBatchException;
import dev.archivist.store.RawDataStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the lifecycle of the vector index: initialize, update, rebuild and source-scoped reindex.
 *
 * <p>{@code vectorstore_version.json} is the authority on whether an index exists and what it
 * holds. Every mutation builds the new index in a staging directory, swaps it in place of {@code
 * vectorstore/}, and only then writes the version record. A provider failure or timeout discards
 * the staging directory, so the live index and the version record stay byte-for-byte unchanged.
 *
 * <p>Mutations are serialized in-process and guarded against other processes by a lease on {@code
 * vectorstore.lock}.
 */
public class VectorIndexManager implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(VectorIndexManager.class);

  static final String INDEX_DIR = "vectorstore";
  static final String LOCK_FILE = "vectorstore.lock";
  static final String BACKUP_PREFIX = "vectorstore_backup_";
  private static final String STAGING_PREFIX = "vectorstore_staging_";
  private static final String REPLACED_PREFIX = "vectorstore_replaced_";

  private static final DateTimeFormatter DIR_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter STAGING_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

  private final Path basePath;
  private final Path indexDir;
  private final IndexVersionStore versionStore;
  private final IndexProviderFactory providerFactory;
  private final DocumentProcessor processor;
  private final RawDataStore store;
  private final IndexProperties properties;
  private final Clock clock;

  private final ReentrantLock mutationLock = new ReentrantLock();
  private final ExecutorService executor =
      Executors.newCachedThreadPool(
          r -> {
            Thread thread = new Thread(r, "index-operation");
            thread.setDaemon(true);
            return thread;
          });

  private volatile @Nullable IndexProvider liveProvider;

  public VectorIndexManager(
      Path basePath,
      IndexProviderFactory providerFactory,
      DocumentProcessor processor,
      RawDataStore store,
      IndexProperties properties,
      Clock clock) {
    this.basePath = basePath;
    this.indexDir = basePath.resolve(INDEX_DIR);
    this.versionStore =
        new IndexVersionStore(basePath.resolve(IndexVersionStore.FILE_NAME), ArchiveJson.newMapper());
    this.providerFactory = providerFactory;
    this.processor = processor;
    this.store = store;
    this.properties = properties;
    this.clock = clock;
  }

  public Path indexPath() {
    return indexDir;
  }

  /** Whether a version record exists. */
  public boolean exists() {
    return versionStore.exists();
  }

  /**
   * Builds the index from scratch. Version becomes 1.
   *
   * @param batches batches to index; null for every stored batch
   * @throws IndexConflictException if an index already exists
   * @throws IndexOperationException if there is nothing to index or the provider fails
   */
  public IndexOperationResult initialize(@Nullable List<BatchHandle> batches) {
    return mutating(() -> doInitialize(batches));
  }

  /**
   * Adds the chunks of {@code batches} to the existing index. Nothing is deduplicated: updating
   * with the same batch twice indexes its chunks twice.
   *
   * @throws IndexNotFoundException if no index exists
   */
  public IndexOperationResult update(List<BatchHandle> batches) {
    return mutating(() -> doUpdate(batches, IndexOperation.UPDATE));
  }

  /**
   * Recreates the index from scratch, first copying the current index and version record to
   * {@code vectorstore_backup_<timestamp>} when {@code backup} is set. Version resets to 1. Without
   * an existing index this behaves as {@link #initialize}.
   *
   * @param batches batches to index; null for every stored batch
   * @param backup whether to back up the current index first
   */
  public IndexOperationResult rebuild(@Nullable List<BatchHandle> batches, boolean backup) {
    return mutating(() -> doRebuild(batches, backup));
  }

  /** Reindexes every batch of one source using the configured {@link ReindexMode}. */
  public IndexOperationResult reindexSource(SourceType sourceType) {
    return reindexSource(sourceType, properties.reindexMode());
  }

  /**
   * Reindexes every stored batch of one source.
   *
   * <p>{@link ReindexMode#REPLACE} removes the source's entries and adds its batches again in one
   * operation. {@link ReindexMode#APPEND} only adds, leaving the previous entries in place so the
   * source ends up represented twice.
   *
   * @throws IndexNotFoundException if no index exists
   */
  public IndexOperationResult reindexSource(SourceType sourceType, ReindexMode mode) {
    if (!sourceType.isStorable()) {
      throw new IllegalArgumentException("Cannot reindex source type " + sourceType.value());
    }
    return mutating(() -> doReindex(sourceType, mode));
  }

  /** Version record contents cross-checked with the provider's own count. */
  public IndexInfo getInfo() {
    Optional<IndexVersionRecord> current = versionStore.read();
    if (current.isEmpty()) {
      if (Files.isDirectory(indexDir)) {
        log.warn("Index directory {} exists without a version record", indexDir);
      }
      return IndexInfo.absent(indexDir.toString());
    }
    IndexVersionRecord record = current.get();
    Integer providerCount;
    try {
      providerCount = liveProvider().count();
    } catch (RuntimeException e) {
      log.warn("Cannot read provider count for {}: {}", indexDir, e.getMessage());
      providerCount = null;
    }
    boolean consistent = providerCount != null && providerCount == record.documentCount();
    if (!consistent) {
      log.warn("Index count mismatch: version record says {}, provider reports {}",
          record.documentCount(), providerCount);
    }
    return new IndexInfo(true, indexDir.toString(), record.version(), record.createdAt(),
        record.lastUpdated(), record.embeddingModel(), record.documentCount(), providerCount,
        consistent, record.batchStats());
  }

  /**
   * Nearest-neighbour query over the live index.
   *
   * @param query free-text query
   * @param maxResults number of results, at least 1
   * @param sourceType restrict to one source type; null for all
   * @throws IndexNotFoundException if no index exists
   */
  public List<IndexMatch> search(String query, int maxResults, @Nullable SourceType sourceType) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (maxResults < 1) {
      throw new IllegalArgumentException("maxResults must be >= 1, got: " + maxResults);
    }
    if (!versionStore.exists()) {
      throw new IndexNotFoundException("No index at " + indexDir);
    }
    return liveProvider().query(query, maxResults, sourceType);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  // --- operations, called with the mutation lock and lease held ---

  private IndexOperationResult doInitialize(@Nullable List<BatchHandle> batches) {
    if (versionStore.exists()) {
      throw new IndexConflictException(
          "Index already exists at " + indexDir + "; use update or rebuild");
    }
    List<BatchHandle> targets = batches == null ? store.allBatchHandles() : batches;
    Collected collected = collect(targets);
    if (collected.chunks().isEmpty()) {
      throw new IndexOperationException(
          "Nothing to index: " + targets.size() + " batches produced no chunks");
    }
    if (Files.isDirectory(indexDir)) {
      log.warn("Discarding index data at {} that has no version record", indexDir);
    }

    Path staging = stage(null, null, collected.chunks()).staging();
    IndexVersionRecord record = IndexVersionRecord.fresh(
        clock.instant(), properties.embeddingModel(), collected.batchStats(),
        IndexOperation.INITIALIZE);
    commit(staging, record);

    log.info("Initialized index at {} with {} chunks from {} batches",
        indexDir, record.documentCount(), collected.batchStats().size());
    return result(IndexOperation.INITIALIZE, record, collected, collected.chunks().size(), 0, null);
  }

  private IndexOperationResult doUpdate(List<BatchHandle> batches, IndexOperation operation) {
    IndexVersionRecord current = requireRecord();
    Collected collected = collect(batches);
    if (collected.chunks().isEmpty()) {
      log.info("{}: no chunks in {} batches, index left at version {}",
          operation.value(), batches.size(), current.version());
      return result(operation, current, collected, 0, 0, null);
    }

    Path staging = stage(indexDir, null, collected.chunks()).staging();
    Map<String, Integer> merged = new LinkedHashMap<>(current.batchStats());
    collected.batchStats().forEach((batch, count) -> merged.merge(batch, count, Integer::sum));
    IndexVersionRecord next = current.next(clock.instant(), merged, operation);
    commit(staging, next);

    log.info("{}: added {} chunks, index now at version {} with {} chunks",
        operation.value(), collected.chunks().size(), next.version(), next.documentCount());
    return result(operation, next, collected, collected.chunks().size(), 0, null);
  }

  private IndexOperationResult doRebuild(@Nullable List<BatchHandle> batches, boolean backup) {
    Optional<IndexVersionRecord> current = versionStore.read();
    if (current.isEmpty()) {
      log.info("No index at {}, rebuild initializes a new one", indexDir);
      return doInitialize(batches);
    }
    List<BatchHandle> targets = batches == null ? store.allBatchHandles() : batches;
    Collected collected = collect(targets);
    if (collected.chunks().isEmpty()) {
      throw new IndexOperationException(
          "Nothing to index: " + targets.size() + " batches produced no chunks");
    }

    Path staging = stage(null, null, collected.chunks()).staging();
    Path backupPath = null;
    if (backup) {
      try {
        backupPath = backup();
      } catch (IOException e) {
        deleteTree(staging);
        throw new IndexOperationException("Cannot back up index at " + indexDir, e);
      }
    }
    IndexVersionRecord record = IndexVersionRecord.fresh(
        clock.instant(), properties.embeddingModel(), collected.batchStats(),
        IndexOperation.REBUILD);
    commit(staging, record);

    log.info("Rebuilt index at {} with {} chunks (previous version {} had {})",
        indexDir, record.documentCount(), current.get().version(), current.get().documentCount());
    return result(IndexOperation.REBUILD, record, collected, collected.chunks().size(), 0,
        backupPath);
  }

  private IndexOperationResult doReindex(SourceType sourceType, ReindexMode mode) {
    List<BatchHandle> batches = store.listBatchHandles(sourceType);
    if (mode == ReindexMode.APPEND) {
      requireRecord();
      log.warn("Reindexing {} in append mode: existing {} entries are kept and will be duplicated",
          sourceType.value(), sourceType.value());
      return doUpdate(batches, IndexOperation.REINDEX_SOURCE);
    }

    IndexVersionRecord current = requireRecord();
    Collected collected = collect(batches);
    String prefix = sourceType.value() + "/";
    Map<String, Integer> kept = new LinkedHashMap<>();
    int removedFromRecord = 0;
    for (Map.Entry<String, Integer> entry : current.batchStats().entrySet()) {
      if (entry.getKey().startsWith(prefix)) {
        removedFromRecord += entry.getValue();
      } else {
        kept.put(entry.getKey(), entry.getValue());
      }
    }

    Staged staged = stage(indexDir, sourceType, collected.chunks());
    if (staged.removed() != removedFromRecord) {
      log.warn("Provider removed {} {} entries, version record accounted for {}",
          staged.removed(), sourceType.value(), removedFromRecord);
    }
    collected.batchStats().forEach((batch, count) -> kept.merge(batch, count, Integer::sum));
    IndexVersionRecord next = current.next(clock.instant(), kept, IndexOperation.REINDEX_SOURCE);
    commit(staged.staging(), next);

    log.info("Reindexed {}: removed {} chunks, added {}, index now at version {}",
        sourceType.value(), removedFromRecord, collected.chunks().size(), next.version());
    return result(IndexOperation.REINDEX_SOURCE, next, collected, collected.chunks().size(),
        removedFromRecord, null);
  }

  // --- building blocks ---

  private IndexOperationResult mutating(Supplier<IndexOperationResult> operation) {
    mutationLock.lock();
    try (IndexLock lease = IndexLock.acquire(basePath.resolve(LOCK_FILE))) {
      try {
        return operation.get();
      } finally {
        liveProvider = null;
      }
    } catch (IOException e) {
      throw new IndexOperationException("Cannot acquire index lease in " + basePath, e);
    } finally {
      mutationLock.unlock();
    }
  }

  private IndexVersionRecord requireRecord() {
    return versionStore.read()
        .orElseThrow(() -> new IndexNotFoundException(
            "No index at " + indexDir + "; initialize it first"));
  }

  private Collected collect(List<BatchHandle> batches) {
    List<DocumentChunk> chunks = new ArrayList<>();
    Map<String, Integer> batchStats = new LinkedHashMap<>();
    List<String> skipped = new ArrayList<>();
    for (BatchHandle handle : batches) {
      BatchProcessingResult processed;
      try {
        processed = processor.processBatch(handle);
      } catch (BatchNotFoundException | MalformedBatchException e) {
        log.warn("Skipping batch {}: {}", handle, e.getMessage());
        skipped.add(handle.toString());
        continue;
      }
      List<DocumentChunk> batchChunks = processed.chunks();
      chunks.addAll(batchChunks);
      batchStats.merge(handle.toString(), batchChunks.size(), Integer::sum);
    }
    return new Collected(chunks, batchStats, skipped);
  }

  /**
   * Builds a staging directory: a copy of {@code copyFrom} (or empty), minus {@code removeSource},
   * plus {@code chunks}. Provider calls run under the configured timeout.
   */
  private Staged stage(@Nullable Path copyFrom, @Nullable SourceType removeSource,
      List<DocumentChunk> chunks) {
    Path staging = newStagingDirectory();
    try {
      if (copyFrom != null && Files.isDirectory(copyFrom)) {
        copyTree(copyFrom, staging);
      } else {
        Files.createDirectories(staging);
      }
    } catch (IOException e) {
      deleteTree(staging);
      throw new IndexOperationException("Cannot prepare staging directory " + staging, e);
    }
    try {
      int removed = withTimeout(() -> {
        IndexProvider provider = providerFactory.open(staging);
        int count = removeSource == null ? 0 : provider.removeSource(removeSource);
        provider.add(chunks);
        return count;
      });
      return new Staged(staging, removed);
    } catch (RuntimeException e) {
      deleteTree(staging);
      throw e;
    }
  }

  /** Swaps the staging directory in as the live index, then writes the version record. */
  private void commit(Path staging, IndexVersionRecord record) {
    Path replaced = null;
    try {
      if (Files.exists(indexDir)) {
        replaced = uniqueSibling(REPLACED_PREFIX);
        Files.move(indexDir, replaced);
      }
      Files.move(staging, indexDir);
    } catch (IOException e) {
      restore(replaced);
      deleteTree(staging);
      throw new IndexOperationException("Cannot swap staged index into " + indexDir, e);
    }
    try {
      versionStore.write(record);
    } catch (IOException e) {
      deleteTree(indexDir);
      restore(replaced);
      throw new IndexOperationException("Cannot write index version record", e);
    }
    if (replaced != null) {
      deleteTree(replaced);
    }
  }

  private void restore(@Nullable Path replaced) {
    if (replaced == null || Files.exists(indexDir)) {
      return;
    }
    try {
      Files.move(replaced, indexDir);
    } catch (IOException e) {
      log.error("Cannot restore previous index from {}; it is kept there", replaced, e);
    }
  }

  private Path backup() throws IOException {
    Path backupDir = uniqueSibling(BACKUP_PREFIX);
    if (Files.isDirectory(indexDir)) {
      copyTree(indexDir, backupDir);
    } else {
      Files.createDirectories(backupDir);
    }
    Files.copy(versionStore.path(), backupDir.resolve(IndexVersionStore.FILE_NAME));
    log.warn("Backed up index to {} before rebuild", backupDir);
    return backupDir;
  }

  private <T> T withTimeout(Callable<T> task) {
    Future<T> future = executor.submit(task);
    try {
      return future.get(properties.operationTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new IndexOperationException(
          "Index provider did not finish within " + properties.operationTimeout());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      throw new IndexOperationException("Index provider failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new IndexOperationException("Interrupted while waiting for the index provider", e);
    }
  }

  private IndexProvider liveProvider() {
    IndexProvider provider = liveProvider;
    if (provider == null) {
      if (!Files.isDirectory(indexDir)) {
        throw new IndexNotFoundException("Index directory " + indexDir + " is missing");
      }
      provider = providerFactory.open(indexDir);
      liveProvider = provider;
    }
    return provider;
  }

  /** Never reuses a name, even one whose directory an abandoned provider task still writes to. */
  Path newStagingDirectory() {
    String suffix = UUID.randomUUID().toString().substring(0, 8);
    return basePath.resolve(
        STAGING_PREFIX + STAGING_TIMESTAMP.format(clock.instant()) + "_" + suffix);
  }

  private Path uniqueSibling(String prefix) {
    String base = prefix + DIR_TIMESTAMP.format(clock.instant());
    Path candidate = basePath.resolve(base);
    for (int n = 2; Files.exists(candidate); n++) {
      candidate = basePath.resolve(base + "_" + n);
    }
    return candidate;
  }

  private static void copyTree(Path source, Path target) throws IOException {
    try (Stream<Path> paths = Files.walk(source)) {
      for (Path path : paths.toList()) {
        Path destination = target.resolve(source.relativize(path).toString());
        if (Files.isDirectory(path)) {
          Files.createDirectories(destination);
        } else {
          Files.copy(path, destination);
        }
      }
    }
  }

  private static void deleteTree(Path root) {
    if (!Files.exists(root)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(root)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      log.warn("Cannot delete {}: {}", root, e.getMessage());
    }
  }

  private static IndexOperationResult result(IndexOperation operation, IndexVersionRecord record,
      Collected collected, int added, int removed, @Nullable Path backupPath) {
    return new IndexOperationResult(operation, record.version(), added, removed,
        record.documentCount(), List.copyOf(collected.batchStats().keySet()), collected.skipped(),
        backupPath == null ? null : backupPath.toString());
  }

  private record Collected(List<DocumentChunk> chunks, Map<String, Integer> batchStats,
      List<String> skipped) {
  }

  private record Staged(Path staging, int removed) {
  }
}
