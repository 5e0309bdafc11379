package dev.archivist.api;

import dev.archivist.index.IndexInfo;
import dev.archivist.index.IndexMatch;
import dev.archivist.index.IndexOperationResult;
import dev.archivist.index.ReindexMode;
import dev.archivist.metadata.SourceType;
import dev.archivist.orchestration.IngestionOrchestrator;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Index lifecycle and query endpoints. */
@RestController
@RequestMapping("/api/index")
public class IndexController {

  private final IngestionOrchestrator orchestrator;

  public IndexController(IngestionOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @GetMapping
  public IndexInfo info() {
    return orchestrator.indexInfo();
  }

  @PostMapping("/initialize")
  public IndexOperationResult initialize(
      @Valid @RequestBody(required = false) @Nullable BatchSelection selection) {
    return orchestrator.initializeIndex(BatchSelection.of(selection));
  }

  /** Without a body, adds every stored batch the index does not account for yet. */
  @PostMapping("/update")
  public IndexOperationResult update(
      @Valid @RequestBody(required = false) @Nullable BatchSelection selection) {
    return orchestrator.updateIndex(BatchSelection.of(selection));
  }

  @PostMapping("/rebuild")
  public IndexOperationResult rebuild(
      @RequestParam(name = "backup", defaultValue = "true") boolean backup,
      @Valid @RequestBody(required = false) @Nullable BatchSelection selection) {
    return orchestrator.rebuildIndex(BatchSelection.of(selection), backup);
  }

  @PostMapping("/reindex/{sourceType}")
  public IndexOperationResult reindex(
      @PathVariable String sourceType,
      @RequestParam(name = "mode", required = false) @Nullable String mode) {
    return orchestrator.reindexSource(SourceType.fromValue(sourceType), parseMode(mode));
  }

  @GetMapping("/search")
  public List<IndexMatch> search(
      @RequestParam("q") String query,
      @RequestParam(name = "k", defaultValue = "5") int maxResults,
      @RequestParam(name = "sourceType", required = false) @Nullable String sourceType) {
    return orchestrator.search(
        query, maxResults, sourceType == null ? null : SourceType.fromValue(sourceType));
  }

  static @Nullable ReindexMode parseMode(@Nullable String mode) {
    if (mode == null || mode.isBlank()) {
      return null;
    }
    try {
      return ReindexMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid reindex mode: " + mode + " (replace or append)", e);
    }
  }
}
