package dev.archivist.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.archivist.store.ArchiveJson;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Reads and atomically replaces {@code vectorstore_version.json}. */
class IndexVersionStore {

  static final String FILE_NAME = "vectorstore_version.json";

  private final Path path;
  private final ObjectMapper mapper;

  IndexVersionStore(Path path, ObjectMapper mapper) {
    this.path = path;
    this.mapper = mapper;
  }

  Path path() {
    return path;
  }

  boolean exists() {
    return Files.isRegularFile(path);
  }

  Optional<IndexVersionRecord> read() {
    return read(path);
  }

  Optional<IndexVersionRecord> read(Path file) {
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(mapper.readValue(file.toFile(), IndexVersionRecord.class));
    } catch (IOException e) {
      throw new IndexOperationException("Unreadable index version record " + file, e);
    }
  }

  void write(IndexVersionRecord record) throws IOException {
    ArchiveJson.writeAtomically(mapper, path, record);
  }
}
