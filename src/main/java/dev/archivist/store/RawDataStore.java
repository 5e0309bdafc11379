package dev.archivist.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.archivist.metadata.DocumentMetadata;
import dev.archivist.metadata.IngestionRecord;
import dev.archivist.metadata.IngestionStatus;
import dev.archivist.metadata.SourceType;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, source-partitioned filesystem store for raw content and the ingestion audit log.
 *
 * <p>Layout under the base path:
 *
 * <pre>
 * raw/&lt;source_type&gt;/&lt;batch_id&gt;/manifest.json
 * raw/&lt;source_type&gt;/&lt;batch_id&gt;/&lt;id&gt;.content.json | .content.txt | &lt;stem&gt;_&lt;hash&gt;&lt;ext&gt;
 * raw/&lt;source_type&gt;/&lt;batch_id&gt;/&lt;stored&gt;.metadata.json
 * ingestion_logs/&lt;ingestion_id&gt;.json
 * </pre>
 *
 * <p>Nothing here deletes or rewrites a stored member. The manifest is replaced atomically with a
 * copy that keeps every previous entry and appends the new one. Write operations declare {@link
 * IOException}; callers treat it as a per-document failure and continue with the next document.
 *
 * <p>Single-writer per batch: concurrent writers on different batches touch disjoint paths.
 */
public class RawDataStore {

  private static final Logger log = LoggerFactory.getLogger(RawDataStore.class);

  static final String RAW_DIR = "raw";
  static final String LOGS_DIR = "ingestion_logs";
  static final String MANIFEST_FILE = "manifest.json";

  private static final DateTimeFormatter BATCH_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

  private static final Comparator<BatchManifest> NEWEST_BATCH_FIRST =
      Comparator.comparing(BatchManifest::createdAt)
          .thenComparing(BatchManifest::batchId)
          .reversed();

  private static final Comparator<IngestionRecord> NEWEST_RUN_FIRST =
      Comparator.comparing(IngestionRecord::startedAt)
          .thenComparing(IngestionRecord::ingestionId)
          .reversed();

  private final Path basePath;
  private final ObjectMapper mapper;
  private final Clock clock;

  public RawDataStore(Path basePath, ObjectMapper mapper, Clock clock) {
    this.basePath = basePath;
    this.mapper = mapper;
    this.clock = clock;
  }

  public Path basePath() {
    return basePath;
  }

  /**
   * Allocates a new, empty batch under the source's partition.
   *
   * <p>The batch id is {@code yyyyMMdd_HHmmss_SSS} (UTC) followed by the sanitized name. Directory
   * creation is atomic; if the id is already taken a numeric suffix is appended, so two calls never
   * return the same handle.
   *
   * @param sourceType partition to create the batch in
   * @param name optional human-readable name
   * @return handle of the new batch
   * @throws IOException if the batch directory or its manifest cannot be written
   */
  public BatchHandle createBatch(SourceType sourceType, @Nullable String name) throws IOException {
    if (!sourceType.isStorable()) {
      throw new IllegalArgumentException("No storage partition for source type " + sourceType);
    }
    Instant now = clock.instant();
    String base = BATCH_TIMESTAMP.format(now);
    String safeName = name == null || name.isBlank() ? null : ArchiveJson.sanitize(name);
    if (safeName != null) {
      base = base + "_" + safeName;
    }

    Path partition = basePath.resolve(RAW_DIR).resolve(sourceType.value());
    Files.createDirectories(partition);

    String batchId = base;
    for (int attempt = 2; ; attempt++) {
      try {
        Files.createDirectory(partition.resolve(batchId));
        break;
      } catch (FileAlreadyExistsException e) {
        batchId = base + "_" + attempt;
      }
    }

    BatchManifest manifest = new BatchManifest(batchId, sourceType, name, now, List.of());
    ArchiveJson.writeAtomically(mapper, partition.resolve(batchId).resolve(MANIFEST_FILE), manifest);
    BatchHandle handle = new BatchHandle(sourceType, batchId);
    log.info("Created batch {}", handle);
    return handle;
  }

  /**
   * Stores one document and appends it to the batch manifest.
   *
   * <p>A {@link CharSequence} content is written as plain text; any other value is serialized as
   * JSON. The metadata is written side by side with the content.
   *
   * @param handle target batch
   * @param documentId id unique within the source, e.g. {@code "thread_1700000000.000100"}
   * @param content text or a JSON-serializable structure
   * @param metadata provenance of the document
   * @return path of the stored content file
   * @throws BatchNotFoundException if the handle is stale or invalid
   * @throws IOException if any file cannot be written
   */
  public Path storeDocument(
      BatchHandle handle, String documentId, Object content, DocumentMetadata metadata)
      throws IOException {
    Path batchDir = requireBatch(handle);
    boolean text = content instanceof CharSequence;
    String stem = uniqueStem(batchDir, ArchiveJson.sanitize(documentId),
        text ? ".content.txt" : ".content.json");
    String storedFilename = stem + (text ? ".content.txt" : ".content.json");
    Path contentPath = batchDir.resolve(storedFilename);

    if (text) {
      Files.writeString(contentPath, (CharSequence) content, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    } else {
      Files.write(contentPath, mapper.writeValueAsBytes(content),
          StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }
    String metadataFilename = stem + ".metadata.json";
    writeNew(batchDir.resolve(metadataFilename), metadata);

    appendToManifest(batchDir, new ManifestEntry(documentId, storedFilename, metadataFilename,
        text ? ContentKind.TEXT : ContentKind.STRUCTURED, clock.instant()));
    log.debug("Stored document {} in batch {}", documentId, handle);
    return contentPath;
  }

  /**
   * Stores opaque bytes as {@code <stem>_<hash16><ext>} and appends them to the manifest.
   *
   * <p>Identical bytes uploaded twice are stored twice; the SHA-256 recorded in {@code
   * extra.content_hash} lets downstream consumers flag them as duplicates.
   *
   * @param handle target batch
   * @param filename original upload filename
   * @param bytes the payload
   * @param metadata provenance; enriched with {@code content_hash}, {@code original_filename} and
   *     {@code size_bytes}
   * @return path of the stored payload
   * @throws IOException if any file cannot be written
   */
  public Path storeBinary(
      BatchHandle handle, String filename, byte[] bytes, DocumentMetadata metadata)
      throws IOException {
    Path batchDir = requireBatch(handle);
    String hash = ContentHasher.sha256(bytes);

    int dot = filename.lastIndexOf('.');
    String stem = dot > 0 ? filename.substring(0, dot) : filename;
    String ext = dot > 0 ? ArchiveJson.sanitize(filename.substring(dot + 1)) : "";
    String suffix = ext.isEmpty() ? "" : "." + ext;
    String storedStem = uniqueStem(batchDir,
        ArchiveJson.sanitize(stem) + "_" + hash.substring(0, ContentHasher.FILENAME_HASH_LENGTH),
        suffix);
    String storedFilename = storedStem + suffix;
    Path payloadPath = batchDir.resolve(storedFilename);
    Files.write(payloadPath, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);

    DocumentMetadata enriched = metadata
        .withExtra("content_hash", hash)
        .withExtra("original_filename", filename)
        .withExtra("size_bytes", bytes.length);
    String metadataFilename = storedFilename + ".metadata.json";
    writeNew(batchDir.resolve(metadataFilename), enriched);

    appendToManifest(batchDir, new ManifestEntry(storedStem, storedFilename, metadataFilename,
        ContentKind.BINARY, clock.instant()));
    log.debug("Stored binary {} ({} bytes) in batch {}", storedFilename, bytes.length, handle);
    return payloadPath;
  }

  /**
   * Persists the final record of a run. A record file is written once and never replaced.
   *
   * @throws IllegalArgumentException if the record is still in progress
   * @throws FileAlreadyExistsException if a record with the same id was already logged
   */
  public Path logRun(IngestionRecord record) throws IOException {
    if (record.status() == IngestionStatus.IN_PROGRESS) {
      throw new IllegalArgumentException(
          "Cannot log in-progress run " + record.ingestionId());
    }
    Path logsDir = basePath.resolve(LOGS_DIR);
    Files.createDirectories(logsDir);
    Path target = logsDir.resolve(ArchiveJson.sanitize(record.ingestionId()) + ".json");
    writeNew(target, record);
    log.info("Logged ingestion run {} ({}): {} ingested, {} failed",
        record.ingestionId(), record.status().value(),
        record.documentsIngested(), record.documentsFailed());
    return target;
  }

  /**
   * Ingestion records, newest first by {@code started_at}. Unreadable record files are skipped
   * with a warning.
   *
   * @param sourceType restrict to one source type; null for all
   * @param limit maximum number of records; non-positive for no limit
   */
  public List<IngestionRecord> history(@Nullable SourceType sourceType, int limit) {
    Path logsDir = basePath.resolve(LOGS_DIR);
    if (!Files.isDirectory(logsDir)) {
      return List.of();
    }
    List<IngestionRecord> records = new ArrayList<>();
    try (Stream<Path> files = Files.list(logsDir)) {
      for (Path file : files.filter(p -> p.getFileName().toString().endsWith(".json")).toList()) {
        try {
          IngestionRecord record = mapper.readValue(file.toFile(), IngestionRecord.class);
          if (sourceType == null || record.sourceType() == sourceType) {
            records.add(record);
          }
        } catch (IOException | RuntimeException e) {
          log.warn("Skipping unreadable ingestion record {}: {}", file, e.getMessage());
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot list " + logsDir, e);
    }
    records.sort(NEWEST_RUN_FIRST);
    return limit > 0 && records.size() > limit ? List.copyOf(records.subList(0, limit)) : records;
  }

  /** Manifests of every batch in the partition, newest first. */
  public List<BatchManifest> listBatches(SourceType sourceType) {
    if (!sourceType.isStorable()) {
      return List.of();
    }
    Path partition = basePath.resolve(RAW_DIR).resolve(sourceType.value());
    if (!Files.isDirectory(partition)) {
      return List.of();
    }
    List<BatchManifest> manifests = new ArrayList<>();
    try (Stream<Path> dirs = Files.list(partition)) {
      for (Path dir : dirs.filter(Files::isDirectory).toList()) {
        Path manifestPath = dir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifestPath)) {
          log.warn("Batch directory {} has no manifest, skipping", dir);
          continue;
        }
        try {
          manifests.add(mapper.readValue(manifestPath.toFile(), BatchManifest.class));
        } catch (IOException | RuntimeException e) {
          log.warn("Skipping unreadable manifest {}: {}", manifestPath, e.getMessage());
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot list " + partition, e);
    }
    manifests.sort(NEWEST_BATCH_FIRST);
    return manifests;
  }

  /** Handles of every batch in the partition, oldest first. */
  public List<BatchHandle> listBatchHandles(SourceType sourceType) {
    List<BatchManifest> manifests = new ArrayList<>(listBatches(sourceType));
    manifests.sort(NEWEST_BATCH_FIRST.reversed());
    return manifests.stream().map(BatchManifest::handle).toList();
  }

  /** Handles of every stored batch across all partitions, oldest first within each partition. */
  public List<BatchHandle> allBatchHandles() {
    List<BatchHandle> handles = new ArrayList<>();
    for (SourceType type : SourceType.values()) {
      handles.addAll(listBatchHandles(type));
    }
    return handles;
  }

  /**
   * Reads the manifest of a batch.
   *
   * @throws BatchNotFoundException if the batch directory does not exist
   * @throws MalformedBatchException if the manifest is missing or unreadable
   */
  public BatchManifest readManifest(BatchHandle handle) {
    Path batchDir = batchDir(handle);
    if (!Files.isDirectory(batchDir)) {
      throw new BatchNotFoundException(handle);
    }
    Path manifestPath = batchDir.resolve(MANIFEST_FILE);
    if (!Files.isRegularFile(manifestPath)) {
      throw new MalformedBatchException("Batch " + handle + " has no manifest");
    }
    try {
      BatchManifest manifest = mapper.readValue(manifestPath.toFile(), BatchManifest.class);
      if (manifest.sourceType() != handle.sourceType()) {
        throw new MalformedBatchException("Batch " + handle + " declares source type "
            + manifest.sourceType().value());
      }
      return manifest;
    } catch (IOException | IllegalArgumentException e) {
      throw new MalformedBatchException("Unreadable manifest for batch " + handle, e);
    }
  }

  /**
   * Reads one non-binary member back from disk.
   *
   * @throws IOException if the content or metadata file cannot be read or parsed
   */
  public StoredDocument readDocument(BatchHandle handle, ManifestEntry entry) throws IOException {
    if (entry.contentKind() == ContentKind.BINARY) {
      throw new IllegalArgumentException("Binary member " + entry.id() + " has no readable text");
    }
    Path batchDir = batchDir(handle);
    DocumentMetadata metadata = mapper.readValue(
        batchDir.resolve(entry.metadataFilename()).toFile(), DocumentMetadata.class);
    Path contentPath = batchDir.resolve(entry.storedFilename());
    if (entry.contentKind() == ContentKind.TEXT) {
      return new StoredDocument(entry, metadata, null,
          Files.readString(contentPath, StandardCharsets.UTF_8));
    }
    JsonNode structured = mapper.readTree(contentPath.toFile());
    return new StoredDocument(entry, metadata, structured, null);
  }

  /** Reads the metadata stored next to a member, binary members included. */
  public DocumentMetadata readMetadata(BatchHandle handle, ManifestEntry entry)
      throws IOException {
    return mapper.readValue(
        batchDir(handle).resolve(entry.metadataFilename()).toFile(), DocumentMetadata.class);
  }

  Path batchDir(BatchHandle handle) {
    return basePath.resolve(RAW_DIR).resolve(handle.sourceType().value()).resolve(handle.batchId());
  }

  private Path requireBatch(BatchHandle handle) {
    Path batchDir = batchDir(handle);
    if (!Files.isRegularFile(batchDir.resolve(MANIFEST_FILE))) {
      throw new BatchNotFoundException(handle);
    }
    return batchDir;
  }

  private void appendToManifest(Path batchDir, ManifestEntry entry) throws IOException {
    Path manifestPath = batchDir.resolve(MANIFEST_FILE);
    BatchManifest current = mapper.readValue(manifestPath.toFile(), BatchManifest.class);
    ArchiveJson.writeAtomically(mapper, manifestPath, current.append(entry));
  }

  private void writeNew(Path target, Object value) throws IOException {
    Files.write(target, mapper.writeValueAsBytes(value),
        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
  }

  /** First {@code stem}, {@code stem_2}, ... whose content file does not exist yet. */
  private static String uniqueStem(Path batchDir, String stem, String suffix) {
    String candidate = stem;
    for (int n = 2; Files.exists(batchDir.resolve(candidate + suffix)); n++) {
      candidate = stem + "_" + n;
    }
    return candidate;
  }
}
