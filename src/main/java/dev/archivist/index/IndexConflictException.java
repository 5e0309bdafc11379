package dev.archivist.index;

import dev.archivist.ArchivistException;

/**
 * Precondition violation: the index already exists (on {@code initialize}) or another process
 * holds the index lease. No side effects have happened when this is thrown.
 */
public class IndexConflictException extends ArchivistException {

  public IndexConflictException(String message) {
    super(message);
  }
}
