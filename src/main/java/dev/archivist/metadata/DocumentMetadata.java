package dev.archivist.metadata;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Provenance of one ingested unit (a chat thread, a wiki page, an uploaded file) before chunking.
 *
 * <p>{@code ingestedAt} is the pipeline's capture time; {@code sourceTimestamp} is the time the
 * content was created or last modified at its origin. The two are never interchangeable.
 *
 * <p>{@code extra} holds origin-specific JSON-compatible values (strings, numbers, booleans, lists
 * and nested maps). Insertion order is preserved. Integral numbers are held as {@link Long} and
 * fractional ones as {@link Double}, the types they come back as from JSON.
 *
 * @param sourceType origin of the document
 * @param sourceId identifier unique within the origin (thread ts, page id, filename)
 * @param sourceName human-readable label (channel name, space key, filename)
 * @param ingestedAt when the pipeline captured the document
 * @param sourceTimestamp when the content was created or modified at its origin; null if unknown
 * @param author author or uploader; null if unknown
 * @param title document title; null if not applicable
 * @param url link back to the origin; null if not applicable
 * @param extra open attribute map
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentMetadata(
    @JsonProperty("source_type") SourceType sourceType,
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("source_name") String sourceName,
    @JsonProperty("ingested_at") Instant ingestedAt,
    @JsonProperty("source_timestamp") @Nullable Instant sourceTimestamp,
    @JsonProperty("author") @Nullable String author,
    @JsonProperty("title") @Nullable String title,
    @JsonProperty("url") @Nullable String url,
    @JsonProperty("extra") Map<String, Object> extra) {

  public DocumentMetadata {
    Objects.requireNonNull(sourceType, "sourceType must not be null");
    Objects.requireNonNull(sourceId, "sourceId must not be null");
    Objects.requireNonNull(sourceName, "sourceName must not be null");
    Objects.requireNonNull(ingestedAt, "ingestedAt must not be null");
    extra = extra == null ? Map.of() : normalizeMap(extra);
  }

  /** Returns a copy with {@code key} set to {@code value} in the extra map. */
  public DocumentMetadata withExtra(String key, Object value) {
    Map<String, Object> merged = new LinkedHashMap<>(extra);
    merged.put(key, value);
    return new DocumentMetadata(
        sourceType, sourceId, sourceName, ingestedAt, sourceTimestamp, author, title, url, merged);
  }

  /** Returns a copy with every entry of {@code overrides} merged into the extra map. */
  public DocumentMetadata withExtras(Map<String, Object> overrides) {
    Map<String, Object> merged = new LinkedHashMap<>(extra);
    merged.putAll(overrides);
    return new DocumentMetadata(
        sourceType, sourceId, sourceName, ingestedAt, sourceTimestamp, author, title, url, merged);
  }

  private static Map<String, Object> normalizeMap(Map<?, ?> map) {
    Map<String, Object> out = new LinkedHashMap<>();
    map.forEach((key, value) -> out.put(String.valueOf(key), normalize(value)));
    return Collections.unmodifiableMap(out);
  }

  private static @Nullable Object normalize(@Nullable Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float f) {
      return f.doubleValue();
    }
    if (value instanceof Map<?, ?> map) {
      return normalizeMap(map);
    }
    if (value instanceof List<?> list) {
      List<@Nullable Object> out = new ArrayList<>(list.size());
      list.forEach(item -> out.add(normalize(item)));
      return Collections.unmodifiableList(out);
    }
    return value;
  }
}
