package dev.archivist.index;

import dev.archivist.ArchivistException;

/** Precondition violation: the operation needs an existing index and there is none. */
public class IndexNotFoundException extends ArchivistException {

  public IndexNotFoundException(String message) {
    super(message);
  }
}
