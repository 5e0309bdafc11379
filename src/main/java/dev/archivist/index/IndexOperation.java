package dev.archivist.index;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Mutating operations recorded in the version record. */
public enum IndexOperation {
  INITIALIZE("initialize"),
  UPDATE("update"),
  REBUILD("rebuild"),
  REINDEX_SOURCE("reindex_source");

  private final String value;

  IndexOperation(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static IndexOperation fromValue(String value) {
    for (IndexOperation op : values()) {
      if (op.value.equalsIgnoreCase(value)) {
        return op;
      }
    }
    throw new IllegalArgumentException("Invalid index operation: " + value);
  }
}
