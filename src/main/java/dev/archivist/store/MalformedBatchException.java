package dev.archivist.store;

import dev.archivist.ArchivistException;

/**
 * Structural failure of a stored batch: missing or unreadable manifest, or a source type with no
 * processing strategy. Aborts the operation on that batch without touching stored data.
 */
public class MalformedBatchException extends ArchivistException {

  public MalformedBatchException(String message) {
    super(message);
  }

  public MalformedBatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
