package dev.archivist.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of content origins. Determines the raw-store partition and the rendering strategy
 * applied by the document processor.
 */
public enum SourceType {
  CHAT("chat"),
  WIKI("wiki"),
  PDF("pdf"),
  MARKDOWN("markdown"),
  TEXT("text"),
  UNKNOWN("unknown");

  private final String value;

  SourceType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static SourceType fromValue(String value) {
    for (SourceType type : values()) {
      if (type.value.equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Invalid source type: " + value);
  }

  /** Whether documents of this type have their own partition under {@code raw/}. */
  public boolean isStorable() {
    return this != UNKNOWN;
  }

  /**
   * Maps an upload filename to its source type by extension.
   *
   * @param filename the original filename, e.g. {@code "handbook.pdf"}
   * @return the matching type, or empty for unsupported extensions
   */
  public static Optional<SourceType> fromFilename(String filename) {
    String lower = filename.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".pdf")) {
      return Optional.of(PDF);
    }
    if (lower.endsWith(".md") || lower.endsWith(".markdown")) {
      return Optional.of(MARKDOWN);
    }
    if (lower.endsWith(".txt")) {
      return Optional.of(TEXT);
    }
    return Optional.empty();
  }
}
