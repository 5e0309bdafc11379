package dev.archivist.index;

import dev.archivist.ArchivistException;

/**
 * An index mutation failed (provider error, timeout, nothing to index). The live index and the
 * version record are unchanged.
 */
public class IndexOperationException extends ArchivistException {

  public IndexOperationException(String message) {
    super(message);
  }

  public IndexOperationException(String message, Throwable cause) {
    super(message, cause);
  }
}
