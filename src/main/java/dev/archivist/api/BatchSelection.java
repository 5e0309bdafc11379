package dev.archivist.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.archivist.store.BatchHandle;
import jakarta.validation.constraints.Size;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Optional request body of the index operations.
 *
 * @param batches batch handles such as {@code "wiki/20240101_120000_000_space_ENG"}; null or absent
 *     selects the operation's default; an empty list is rejected
 */
public record BatchSelection(
    @JsonProperty("batches")
        @Size(min = 1, message = "must not be empty; omit it to use the default batches")
        @Nullable List<BatchHandle> batches) {

  static @Nullable List<BatchHandle> of(@Nullable BatchSelection selection) {
    return selection == null ? null : selection.batches();
  }
}
