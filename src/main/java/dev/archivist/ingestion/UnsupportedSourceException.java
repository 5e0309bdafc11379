package dev.archivist.ingestion;

import dev.archivist.ArchivistException;

/** Raised for input no ingestor can accept: an unknown file extension or an unconfigured client. */
public class UnsupportedSourceException extends ArchivistException {

  public UnsupportedSourceException(String message) {
    super(message);
  }
}
