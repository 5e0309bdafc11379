package dev.archivist.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.archivist.metadata.SourceType;
import java.util.Objects;

/**
 * Reference to one stored batch, rendered as {@code <source_type>/<batch_id>}.
 *
 * @param sourceType partition the batch lives in
 * @param batchId directory name of the batch within its partition
 */
public record BatchHandle(SourceType sourceType, String batchId) {

  public BatchHandle {
    Objects.requireNonNull(sourceType, "sourceType must not be null");
    Objects.requireNonNull(batchId, "batchId must not be null");
    if (!sourceType.isStorable()) {
      throw new IllegalArgumentException("No storage partition for source type " + sourceType);
    }
    if (batchId.isBlank() || batchId.contains("/") || batchId.contains("\\")
        || batchId.startsWith(".")) {
      throw new IllegalArgumentException("Invalid batch id: " + batchId);
    }
  }

  @JsonCreator
  public static BatchHandle parse(String value) {
    int slash = value == null ? -1 : value.indexOf('/');
    if (slash <= 0) {
      throw new IllegalArgumentException("Batch handle must look like <source_type>/<batch_id>: "
          + value);
    }
    return new BatchHandle(
        SourceType.fromValue(value.substring(0, slash)), value.substring(slash + 1));
  }

  @JsonValue
  @Override
  public String toString() {
    return sourceType.value() + "/" + batchId;
  }
}
