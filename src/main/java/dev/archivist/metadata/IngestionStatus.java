package dev.archivist.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle status of an ingestion run. */
public enum IngestionStatus {
  IN_PROGRESS("in_progress"),
  COMPLETED("completed"),
  FAILED("failed"),
  /** The run finished but at least one document failed. */
  PARTIAL("partial");

  private final String value;

  IngestionStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static IngestionStatus fromValue(String value) {
    for (IngestionStatus status : values()) {
      if (status.value.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Invalid ingestion status: " + value);
  }

  public boolean isTerminal() {
    return this != IN_PROGRESS;
  }
}
