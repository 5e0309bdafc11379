package dev.archivist.api;

import dev.archivist.ingestion.chat.ChatIngestor;
import dev.archivist.ingestion.wiki.WikiIngestor;
import dev.archivist.orchestration.IngestionOrchestrator;
import dev.archivist.orchestration.IngestionReport;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** Ingestion endpoints. Each call is one run; the response carries its record. */
@RestController
@RequestMapping("/api/ingest")
public class IngestController {

  private final IngestionOrchestrator orchestrator;

  public IngestController(IngestionOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @PostMapping("/file")
  public IngestionReport ingestFile(
      @RequestParam("file") MultipartFile file,
      @RequestParam(name = "uploadedBy", required = false) @Nullable String uploadedBy,
      @RequestParam(name = "autoIndex", defaultValue = "true") boolean autoIndex)
      throws IOException {
    String filename = file.getOriginalFilename();
    if (filename == null || filename.isBlank()) {
      throw new IllegalArgumentException("Uploaded file has no name");
    }
    return orchestrator.ingestBytes(filename, file.getBytes(), uploadedBy, Map.of(), autoIndex);
  }

  /** Ingests a file already present on the server's filesystem. */
  @PostMapping("/path")
  public IngestionReport ingestPath(
      @RequestParam("path") String path,
      @RequestParam(name = "uploadedBy", required = false) @Nullable String uploadedBy,
      @RequestParam(name = "autoIndex", defaultValue = "true") boolean autoIndex) {
    return orchestrator.ingestFile(Path.of(path), uploadedBy, Map.of(), autoIndex);
  }

  @PostMapping("/chat/channels/{channelId}")
  public IngestionReport ingestChatChannel(
      @PathVariable String channelId,
      @RequestParam(name = "days", defaultValue = "" + ChatIngestor.DEFAULT_DAYS_HISTORY) int days,
      @RequestParam(name = "limit", defaultValue = "" + ChatIngestor.DEFAULT_LIMIT) int limit,
      @RequestParam(name = "autoIndex", defaultValue = "true") boolean autoIndex) {
    return orchestrator.ingestChatChannel(channelId, days, limit, autoIndex);
  }

  @PostMapping("/chat/export")
  public IngestionReport ingestChatExport(
      @RequestParam("path") String exportDir,
      @RequestParam(name = "autoIndex", defaultValue = "true") boolean autoIndex) {
    return orchestrator.ingestChatExport(Path.of(exportDir), autoIndex);
  }

  @PostMapping("/wiki/spaces/{spaceKey}")
  public IngestionReport ingestWikiSpace(
      @PathVariable String spaceKey,
      @RequestParam(name = "limit", defaultValue = "" + WikiIngestor.DEFAULT_LIMIT) int limit,
      @RequestParam(name = "autoIndex", defaultValue = "true") boolean autoIndex) {
    return orchestrator.ingestWikiSpace(spaceKey, limit, autoIndex);
  }

  @PostMapping("/wiki/pages/{pageId}")
  public IngestionReport ingestWikiPage(
      @PathVariable String pageId,
      @RequestParam(name = "autoIndex", defaultValue = "true") boolean autoIndex) {
    return orchestrator.ingestWikiPage(pageId, autoIndex);
  }
}
