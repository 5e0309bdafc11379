package dev.archivist.processing;

import com.fasterxml.jackson.databind.JsonNode;
import dev.archivist.store.StoredDocument;
import org.jspecify.annotations.Nullable;

/** Field access helpers for structured stored content. */
final class JsonFields {

  private JsonFields() {
    // utility class
  }

  static JsonNode structured(StoredDocument document) {
    JsonNode node = document.structured();
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException(
          "Document " + document.entry().id() + " has no structured content");
    }
    return node;
  }

  static String required(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Missing field '" + field + "'");
    }
    return value.asText();
  }

  static String optional(JsonNode node, String field, String fallback) {
    @Nullable JsonNode value = node.get(field);
    return value == null || value.isNull() ? fallback : value.asText();
  }
}
