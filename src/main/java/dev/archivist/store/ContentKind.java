package dev.archivist.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How a stored member's payload is encoded on disk. */
public enum ContentKind {
  /** JSON document produced by a source ingestor. */
  STRUCTURED("structured"),
  /** Plain UTF-8 text. */
  TEXT("text"),
  /** Original upload bytes, kept for audit and never rendered. */
  BINARY("binary");

  private final String value;

  ContentKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ContentKind fromValue(String value) {
    for (ContentKind kind : values()) {
      if (kind.value.equalsIgnoreCase(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Invalid content kind: " + value);
  }
}
