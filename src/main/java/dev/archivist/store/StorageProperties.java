package dev.archivist.store;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Root of all persisted state: {@code raw/}, {@code ingestion_logs/}, {@code vectorstore/} and the
 * index version record.
 */
@ConfigurationProperties(prefix = "archivist.storage")
public record StorageProperties(String basePath) {

  public StorageProperties {
    if (basePath == null || basePath.isBlank()) {
      basePath = "data";
    }
  }
}
