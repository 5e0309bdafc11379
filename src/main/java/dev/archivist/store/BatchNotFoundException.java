package dev.archivist.store;

import dev.archivist.ArchivistException;

/** Raised when a batch handle does not point at an existing batch. */
public class BatchNotFoundException extends ArchivistException {

  public BatchNotFoundException(BatchHandle handle) {
    super("Batch not found: " + handle);
  }
}
