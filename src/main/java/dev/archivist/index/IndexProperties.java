package dev.archivist.index;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Vector index settings, bound from {@code archivist.index.*}.
 *
 * @param embeddingModel identifier written to the version record
 * @param operationTimeout upper bound for one provider call sequence; the operation fails after it
 * @param reindexMode behaviour of source-scoped reindexing
 */
@ConfigurationProperties(prefix = "archivist.index")
public record IndexProperties(
    String embeddingModel,
    Duration operationTimeout,
    ReindexMode reindexMode) {

  public IndexProperties {
    if (embeddingModel == null || embeddingModel.isBlank()) {
      embeddingModel = "bge-small-en-v1.5-q";
    }
    if (operationTimeout == null) {
      operationTimeout = Duration.ofMinutes(10);
    }
    if (operationTimeout.isNegative() || operationTimeout.isZero()) {
      throw new IllegalStateException(
          "archivist.index.operation-timeout must be positive, got: " + operationTimeout);
    }
    if (reindexMode == null) {
      reindexMode = ReindexMode.REPLACE;
    }
  }
}
