package dev.archivist;

/** Base class of the typed, unchecked failures raised by the ingestion pipeline. */
public abstract class ArchivistException extends RuntimeException {

  protected ArchivistException(String message) {
    super(message);
  }

  protected ArchivistException(String message, Throwable cause) {
    super(message, cause);
  }
}
