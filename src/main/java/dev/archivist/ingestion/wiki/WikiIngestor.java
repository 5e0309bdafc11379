package dev.archivist.ingestion.wiki;

import dev.archivist.ingestion.IngestionOutcome;
import dev.archivist.ingestion.RunRecorder;
import dev.archivist.metadata.DocumentMetadata;
import dev.archivist.metadata.IngestionRecord;
import dev.archivist.metadata.IngestionRun;
import dev.archivist.metadata.SourceType;
import dev.archivist.store.ArchiveJson;
import dev.archivist.store.BatchHandle;
import dev.archivist.store.RawDataStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ingests wiki pages into the raw store, one document per page, with the page body converted to
 * plain text and its ancestor path recorded.
 */
@Service
public class WikiIngestor {

    private static final Logger log = LoggerFactory.getLogger(WikiIngestor.class);

    public static final int DEFAULT_LIMIT = 500;

    private final WikiSourceClient client;
    private final RawDataStore store;
    private final RunRecorder runs;
    private final Clock clock;

    public WikiIngestor(WikiSourceClient client, RawDataStore store, RunRecorder runs, Clock clock) {
        this.client = client;
        this.store = store;
        this.runs = runs;
        this.clock = clock;
    }

    /**
     * Ingests up to {@code limit} pages of a space into one batch.
     *
     * @param spaceKey the space key, e.g. {@code "ENG"}
     * @param limit    maximum number of pages
     */
    public IngestionOutcome ingestSpace(String spaceKey, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        IngestionRun run = runs.start("wiki_space_" + ArchiveJson.sanitize(spaceKey), SourceType.WIKI);
        run.addSourceIdentifier(spaceKey);

        List<WikiPage> pages;
        BatchHandle batch;
        try {
            pages = client.spacePages(spaceKey, limit);
            batch = store.createBatch(SourceType.WIKI, "space_" + spaceKey);
        } catch (IOException | RuntimeException e) {
            IngestionRecord record = runs.fail(run, "Cannot fetch space " + spaceKey + ": "
                    + e.getMessage(), e);
            return new IngestionOutcome(record, List.of());
        }

        for (WikiPage page : pages) {
            storePage(run, batch, page);
        }
        IngestionRecord record = runs.complete(run);
        log.info("Ingested {} pages from space {} ({} failed)",
                record.documentsIngested(), spaceKey, record.documentsFailed());
        return new IngestionOutcome(record, List.of(batch));
    }

    /** Ingests a single page into its own batch. */
    public IngestionOutcome ingestPage(String pageId) {
        IngestionRun run = runs.start("wiki_page_" + ArchiveJson.sanitize(pageId), SourceType.WIKI);
        run.addSourceIdentifier(pageId);

        WikiPage page;
        BatchHandle batch;
        try {
            page = client.page(pageId);
            batch = store.createBatch(SourceType.WIKI, "page_" + pageId);
        } catch (IOException | RuntimeException e) {
            IngestionRecord record = runs.fail(run, "Cannot fetch page " + pageId + ": "
                    + e.getMessage(), e);
            return new IngestionOutcome(record, List.of());
        }

        storePage(run, batch, page);
        return new IngestionOutcome(runs.complete(run), List.of(batch));
    }

    private void storePage(IngestionRun run, BatchHandle batch, WikiPage page) {
        try {
            String text = HtmlText.toPlainText(page.bodyHtml());
            String author = page.author() == null ? "unknown" : page.author();

            Map<String, Object> content = new LinkedHashMap<>();
            content.put("page_id", page.id());
            content.put("title", page.title());
            content.put("space_key", page.spaceKey());
            content.put("hierarchy_path", page.hierarchyPath());
            content.put("version", page.version());
            content.put("author", author);
            content.put("last_updated",
                    page.lastUpdated() == null ? "unknown" : page.lastUpdated().toString());
            content.put("url", page.url());
            content.put("text_content", text);

            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("space_key", page.spaceKey());
            extra.put("hierarchy_path", page.hierarchyPath());
            extra.put("version", page.version());
            extra.put("ancestors", page.ancestors());

            DocumentMetadata metadata = new DocumentMetadata(
                    SourceType.WIKI,
                    page.id(),
                    page.spaceKey(),
                    clock.instant(),
                    page.lastUpdated(),
                    page.author(),
                    page.title(),
                    page.url(),
                    extra);

            Path stored = store.storeDocument(batch, "page_" + page.id(), content, metadata);
            run.recordSuccess(Files.size(stored));
            log.debug("Stored page {} ({})", page.id(), page.hierarchyPath());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to store page {}", page.id(), e);
            run.recordFailure();
        }
    }
}
