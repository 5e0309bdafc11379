package dev.archivist.api;

import dev.archivist.metadata.IngestionRecord;
import dev.archivist.metadata.SourceType;
import dev.archivist.orchestration.IngestionOrchestrator;
import dev.archivist.store.BatchManifest;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Read-only views of the run log and the stored batches, newest first. */
@RestController
public class AuditController {

  private final IngestionOrchestrator orchestrator;

  public AuditController(IngestionOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping("/api/ingestions")
  public List<IngestionRecord> history(
      @RequestParam(name = "sourceType", required = false) @Nullable String sourceType,
      @RequestParam(name = "limit", defaultValue = "" + IngestionOrchestrator.DEFAULT_HISTORY_LIMIT)
          int limit) {
    return orchestrator.history(
        sourceType == null ? null : SourceType.fromValue(sourceType), limit);
  }

  @GetMapping("/api/batches/{sourceType}")
  public List<BatchManifest> batches(@PathVariable String sourceType) {
    return orchestrator.listBatches(SourceType.fromValue(sourceType));
  }
}
