package dev.archivist.mcp;

import dev.archivist.index.IndexInfo;
import dev.archivist.index.IndexMatch;
import dev.archivist.index.IndexOperationResult;
import dev.archivist.index.ReindexMode;
import dev.archivist.metadata.IngestionRecord;
import dev.archivist.metadata.SourceType;
import dev.archivist.orchestration.IngestionOrchestrator;
import dev.archivist.orchestration.IngestionReport;
import dev.archivist.store.BatchManifest;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter over {@link IngestionOrchestrator}.
 *
 * <p>Tool methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Tools: {@code ingest_file}, {@code ingestion_history}, {@code list_batches}, {@code
 * index_info}, {@code update_index}, {@code rebuild_index}, {@code reindex_source}, {@code
 * search_index}.
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private static final int MAX_SEARCH_RESULTS = 50;
  private static final int EXCERPT_LENGTH = 500;

  private final IngestionOrchestrator orchestrator;

  public McpToolService(IngestionOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @Tool(
      name = "ingest_file",
      description =
          "Ingest a PDF, Markdown or text file from the server's filesystem into the raw store "
              + "and, unless autoIndex is false, add it to the search index.")
  public String ingestFile(
      @ToolParam(description = "Absolute path of the file to ingest") @Nullable String path,
      @ToolParam(description = "Name of the uploader", required = false) @Nullable String uploadedBy,
      @ToolParam(description = "Index the file after storing it (default true)", required = false)
          @Nullable Boolean autoIndex) {
    try {
      if (path == null || path.isBlank()) {
        return "Error: Path must not be empty. Provide the path of a .pdf, .md or .txt file.";
      }
      IngestionReport report =
          orchestrator.ingestFile(
              Path.of(path), uploadedBy, Map.of(), !Boolean.FALSE.equals(autoIndex));
      return formatReport(report);
    } catch (Exception e) {
      log.debug("ingest_file failed for {}", path, e);
      return "Error ingesting file: " + e.getMessage();
    }
  }

  @Tool(
      name = "ingestion_history",
      description = "List recent ingestion runs, newest first, optionally for one source type.")
  public String ingestionHistory(
      @ToolParam(
              description = "Source type: chat, wiki, pdf, markdown, text or unknown",
              required = false)
          @Nullable String sourceType,
      @ToolParam(description = "Maximum number of runs (default 10)", required = false)
          @Nullable Integer limit) {
    try {
      int max = limit == null || limit < 1 ? IngestionOrchestrator.DEFAULT_HISTORY_LIMIT : limit;
      List<IngestionRecord> records = orchestrator.history(parseType(sourceType), max);
      if (records.isEmpty()) {
        return "No ingestion runs recorded.";
      }
      StringBuilder sb = new StringBuilder();
      for (IngestionRecord record : records) {
        sb.append(
            String.format(
                "- %s [%s] %s: %d ingested, %d failed, %,d bytes, started %s%s%n",
                record.ingestionId(),
                record.sourceType().value(),
                record.status().value(),
                record.documentsIngested(),
                record.documentsFailed(),
                record.bytesProcessed(),
                record.startedAt(),
                record.errorMessage() != null ? " (" + record.errorMessage() + ")" : ""));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error reading ingestion history: " + e.getMessage();
    }
  }

  @Tool(name = "list_batches", description = "List stored batches of one source type, newest first.")
  public String listBatches(
      @ToolParam(description = "Source type: chat, wiki, pdf, markdown or text")
          @Nullable String sourceType) {
    try {
      SourceType type = parseType(sourceType);
      if (type == null) {
        return "Error: Source type must not be empty.";
      }
      List<BatchManifest> batches = orchestrator.listBatches(type);
      if (batches.isEmpty()) {
        return "No %s batches stored.".formatted(type.value());
      }
      StringBuilder sb = new StringBuilder();
      for (BatchManifest batch : batches) {
        sb.append(
            String.format(
                "- %s: %d documents, created %s%n",
                batch.handle(), batch.documents().size(), batch.createdAt()));
      }
      return sb.toString();
    } catch (Exception e) {
      return "Error listing batches: " + e.getMessage();
    }
  }

  @Tool(
      name = "index_info",
      description =
          "Show the index version record: version, chunk count, embedding model, and whether the "
              + "provider agrees with the record.")
  public String indexInfo() {
    try {
      IndexInfo info = orchestrator.indexInfo();
      if (!info.exists()) {
        return "No index at %s. Ingest content or call update_index to create one."
            .formatted(info.path());
      }
      return """
          Index: %s
          - Version: %d
          - Chunks: %,d (provider reports %s)
          - Embedding model: %s
          - Batches: %d
          - Created: %s
          - Last updated: %s"""
          .formatted(
              info.path(),
              info.version(),
              info.documentCount(),
              info.providerCount() != null ? "%,d".formatted(info.providerCount()) : "unknown",
              info.embeddingModel(),
              info.batchStats().size(),
              info.createdAt(),
              info.lastUpdated())
          + (info.consistent() ? "" : "\nWarning: record and provider counts disagree.");
    } catch (Exception e) {
      return "Error reading index info: " + e.getMessage();
    }
  }

  @Tool(
      name = "update_index",
      description =
          "Add every stored batch that is not indexed yet. Creates the index if none exists.")
  public String updateIndex() {
    try {
      IndexOperationResult result =
          orchestrator.indexInfo().exists()
              ? orchestrator.updateIndex(null)
              : orchestrator.initializeIndex(null);
      return formatResult(result);
    } catch (Exception e) {
      return "Error updating index: " + e.getMessage();
    }
  }

  @Tool(
      name = "rebuild_index",
      description =
          "Rebuild the index from every stored batch. Backs up the current index first unless "
              + "backup is false.")
  public String rebuildIndex(
      @ToolParam(description = "Back up the current index first (default true)", required = false)
          @Nullable Boolean backup) {
    try {
      return formatResult(orchestrator.rebuildIndex(null, !Boolean.FALSE.equals(backup)));
    } catch (Exception e) {
      return "Error rebuilding index: " + e.getMessage();
    }
  }

  @Tool(
      name = "reindex_source",
      description =
          "Reindex every stored batch of one source type. Mode 'replace' (default) removes the "
              + "source's entries first; 'append' adds them again next to the existing ones.")
  public String reindexSource(
      @ToolParam(description = "Source type: chat, wiki, pdf, markdown or text")
          @Nullable String sourceType,
      @ToolParam(description = "replace or append", required = false) @Nullable String mode) {
    try {
      SourceType type = parseType(sourceType);
      if (type == null) {
        return "Error: Source type must not be empty.";
      }
      ReindexMode reindexMode =
          mode == null || mode.isBlank()
              ? null
              : ReindexMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
      return formatResult(orchestrator.reindexSource(type, reindexMode));
    } catch (Exception e) {
      return "Error reindexing source: " + e.getMessage();
    }
  }

  @Tool(
      name = "search_index",
      description =
          "Semantic search over indexed chunks. Returns excerpts with their source, title and "
              + "similarity score.")
  public String searchIndex(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Maximum number of results (1-50, default 5)", required = false)
          @Nullable Integer maxResults,
      @ToolParam(description = "Restrict to one source type", required = false)
          @Nullable String sourceType) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      int max = maxResults == null || maxResults < 1 ? 5 : Math.min(maxResults, MAX_SEARCH_RESULTS);
      List<IndexMatch> matches = orchestrator.search(query, max, parseType(sourceType));
      if (matches.isEmpty()) {
        return "No results found for query: " + query;
      }
      StringBuilder sb = new StringBuilder();
      int rank = 1;
      for (IndexMatch match : matches) {
        Map<String, Object> metadata = match.metadata();
        sb.append(
            String.format(
                "%d. [%.3f] %s (%s, %s)%n%s%n%n",
                rank++,
                match.score(),
                metadata.getOrDefault("title", metadata.getOrDefault("source", "untitled")),
                metadata.getOrDefault("source_type", "?"),
                metadata.getOrDefault("source_id", "?"),
                excerpt(match.text())));
      }
      return sb.toString().strip();
    } catch (Exception e) {
      return "Error searching index: " + e.getMessage();
    }
  }

  private static @Nullable SourceType parseType(@Nullable String sourceType) {
    return sourceType == null || sourceType.isBlank() ? null : SourceType.fromValue(sourceType.trim());
  }

  private static String excerpt(String text) {
    return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH) + "...";
  }

  private static String formatReport(IngestionReport report) {
    IngestionRecord record = report.ingestion();
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            "Ingestion %s %s: %d ingested, %d failed.",
            record.ingestionId(),
            record.status().value(),
            record.documentsIngested(),
            record.documentsFailed()));
    if (record.errorMessage() != null) {
      sb.append(" Error: ").append(record.errorMessage());
    }
    if (report.index() != null) {
      sb.append(
          String.format(
              " Indexed %d chunks (index version %d).",
              report.index().chunksAdded(),
              report.index().version()));
    } else if (report.indexError() != null) {
      sb.append(" Indexing failed: ").append(report.indexError());
    }
    return sb.toString();
  }

  private static String formatResult(IndexOperationResult result) {
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            "%s done: version %d, %d chunks added, %d removed, %d total.",
            result.operation().value(),
            result.version(),
            result.chunksAdded(),
            result.chunksRemoved(),
            result.documentCount()));
    if (!result.skippedBatches().isEmpty()) {
      sb.append(" Skipped batches: ").append(String.join(", ", result.skippedBatches()));
    }
    if (result.backupPath() != null) {
      sb.append(" Backup: ").append(result.backupPath());
    }
    return sb.toString();
  }
}
