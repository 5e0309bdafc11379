package dev.archivist.ingestion.upload;

import dev.archivist.ingestion.IngestionOutcome;
import dev.archivist.ingestion.RunRecorder;
import dev.archivist.ingestion.UnsupportedSourceException;
import dev.archivist.metadata.DocumentMetadata;
import dev.archivist.metadata.IngestionRecord;
import dev.archivist.metadata.IngestionRun;
import dev.archivist.metadata.IngestionStatus;
import dev.archivist.metadata.SourceType;
import dev.archivist.store.BatchHandle;
import dev.archivist.store.RawDataStore;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ingests uploaded PDF, Markdown and plain-text files, one run and one batch per file.
 *
 * <p>PDFs are stored as extracted page text plus the original bytes. Markdown and text are stored
 * as their decoded content; byte uploads additionally keep the original bytes.
 */
@Service
public class FileUploadIngestor {

    private static final Logger log = LoggerFactory.getLogger(FileUploadIngestor.class);

    private final RawDataStore store;
    private final RunRecorder runs;
    private final PdfTextExtractor pdfExtractor;
    private final Clock clock;

    public FileUploadIngestor(RawDataStore store, RunRecorder runs, PdfTextExtractor pdfExtractor,
                              Clock clock) {
        this.store = store;
        this.runs = runs;
        this.pdfExtractor = pdfExtractor;
        this.clock = clock;
    }

    /**
     * Ingests a file from the local filesystem.
     *
     * @param path       the file to ingest
     * @param uploadedBy uploader name; null if unknown
     * @param overrides  entries merged into the document's {@code extra} metadata
     * @throws UnsupportedSourceException if the extension is not .pdf, .md, .markdown or .txt
     */
    public IngestionOutcome ingestFile(Path path, @Nullable String uploadedBy,
                                       Map<String, Object> overrides) {
        String filename = path.getFileName().toString();
        SourceType type = requireSupported(filename);
        return ingest(type, filename, () -> Files.readAllBytes(path), lastModified(path),
                uploadedBy, overrides, type == SourceType.PDF);
    }

    /**
     * Ingests uploaded bytes. The original bytes are always kept next to the extracted content.
     *
     * @throws UnsupportedSourceException if the extension is not supported
     */
    public IngestionOutcome ingestBytes(String filename, byte[] bytes, @Nullable String uploadedBy,
                                        Map<String, Object> overrides) {
        SourceType type = requireSupported(filename);
        return ingest(type, filename, () -> bytes, null, uploadedBy, overrides, true);
    }

    /**
     * Ingests several files. Each supported file gets its own run; an aggregate run of source type
     * {@code unknown} counts a file as ingested when its own run completed without failures.
     * Unsupported files are counted as failed in the aggregate.
     */
    public IngestionOutcome ingestFiles(List<Path> paths, @Nullable String uploadedBy) {
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("No files to ingest");
        }
        IngestionRun aggregate = runs.start("upload_batch", SourceType.UNKNOWN);
        List<IngestionRecord> fileRecords = new ArrayList<>();
        List<BatchHandle> batches = new ArrayList<>();
        for (Path path : paths) {
            String filename = path.getFileName().toString();
            aggregate.addSourceIdentifier(filename);
            if (SourceType.fromFilename(filename).isEmpty()) {
                log.warn("Skipping unsupported file {}", filename);
                aggregate.recordFailure();
                continue;
            }
            IngestionOutcome outcome = ingestFile(path, uploadedBy, Map.of());
            fileRecords.add(outcome.record());
            batches.addAll(outcome.batches());
            if (outcome.record().status() == IngestionStatus.COMPLETED) {
                aggregate.recordSuccess(outcome.record().bytesProcessed());
            } else {
                aggregate.recordFailure();
            }
        }
        IngestionRecord record = runs.complete(aggregate);
        log.info("Ingested {} of {} files ({})", record.documentsIngested(), paths.size(),
                record.status().value());
        return new IngestionOutcome(record, batches, fileRecords);
    }

    private IngestionOutcome ingest(SourceType type, String filename, ByteSource source,
                                    @Nullable Instant modified, @Nullable String uploadedBy,
                                    Map<String, Object> overrides, boolean keepOriginal) {
        IngestionRun run = runs.start("upload_" + type.value(), type);
        run.addSourceIdentifier(filename);

        BatchHandle batch;
        try {
            batch = store.createBatch(type, stem(filename));
        } catch (IOException | RuntimeException e) {
            IngestionRecord record = runs.fail(run, "Cannot create batch for " + filename + ": "
                    + e.getMessage(), e);
            return new IngestionOutcome(record, List.of());
        }

        try {
            byte[] bytes = source.read();
            Map<String, Object> extra = new LinkedHashMap<>();
            if (uploadedBy != null) {
                extra.put("uploaded_by", uploadedBy);
            }
            extra.put("file_size", bytes.length);
            DocumentMetadata metadata = new DocumentMetadata(type, filename, filename,
                    clock.instant(), modified, uploadedBy, stem(filename), null, extra);

            if (keepOriginal) {
                store.storeBinary(batch, filename, bytes, metadata.withExtras(overrides));
            }
            if (type == SourceType.PDF) {
                storePdf(batch, filename, bytes, metadata, overrides);
            } else {
                storeText(batch, filename, bytes, metadata, overrides);
            }
            run.recordSuccess(bytes.length);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to ingest {}", filename, e);
            run.recordFailure();
        }

        IngestionRecord record = runs.complete(run);
        log.info("Ingested {} as {} ({})", filename, type.value(), record.status().value());
        return new IngestionOutcome(record, List.of(batch));
    }

    private void storePdf(BatchHandle batch, String filename, byte[] bytes,
                          DocumentMetadata metadata, Map<String, Object> overrides)
            throws IOException {
        PdfContent pdf = pdfExtractor.extract(bytes);

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("title", pdf.title());
        info.put("author", pdf.author());
        info.put("subject", pdf.subject());
        info.put("creator", pdf.creator());

        List<Map<String, Object>> pages = new ArrayList<>();
        for (int i = 0; i < pdf.pages().size(); i++) {
            Map<String, Object> page = new LinkedHashMap<>();
            page.put("page", i + 1);
            page.put("text", pdf.pages().get(i));
            page.put("char_count", pdf.pages().get(i).length());
            pages.add(page);
        }

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("filename", filename);
        content.put("total_pages", pdf.pages().size());
        content.put("pdf_metadata", info);
        content.put("pages", pages);

        DocumentMetadata pdfMetadata = new DocumentMetadata(
                SourceType.PDF,
                metadata.sourceId(),
                metadata.sourceName(),
                metadata.ingestedAt(),
                metadata.sourceTimestamp(),
                pdf.author() != null ? pdf.author() : metadata.author(),
                pdf.title() != null ? pdf.title() : metadata.title(),
                null,
                metadata.extra())
                .withExtra("total_pages", pdf.pages().size())
                .withExtras(overrides);
        store.storeDocument(batch, stem(filename), content, pdfMetadata);
    }

    private void storeText(BatchHandle batch, String filename, byte[] bytes,
                           DocumentMetadata metadata, Map<String, Object> overrides)
            throws IOException {
        String text = new String(bytes, StandardCharsets.UTF_8);

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("filename", filename);
        content.put("content", text);
        content.put("encoding", "utf-8");
        content.put("line_count", text.lines().count());
        content.put("char_count", text.length());

        store.storeDocument(batch, stem(filename), content, metadata.withExtras(overrides));
    }

    private static SourceType requireSupported(String filename) {
        Optional<SourceType> type = SourceType.fromFilename(filename);
        if (type.isEmpty()) {
            throw new UnsupportedSourceException("Unsupported file type: " + filename
                    + " (expected .pdf, .md, .markdown or .txt)");
        }
        return type.get();
    }

    private static String stem(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    private static @Nullable Instant lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            log.debug("Cannot read modification time of {}: {}", path, e.getMessage());
            return null;
        }
    }

    @FunctionalInterface
    private interface ByteSource {
        byte[] read() throws IOException;
    }
}
