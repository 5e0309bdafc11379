package dev.archivist.index;

/** How {@link VectorIndexManager#reindexSource} treats the source's existing entries. */
public enum ReindexMode {
  /** Remove the source's entries, then add all of its batches again. */
  REPLACE,
  /** Add all of the source's batches on top of the existing entries, duplicating them. */
  APPEND
}
