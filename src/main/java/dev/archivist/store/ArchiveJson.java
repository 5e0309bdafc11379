package dev.archivist.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** JSON conventions shared by every persisted artifact: ISO-8601 instants, indented output. */
public final class ArchiveJson {

  private ArchiveJson() {
    // utility class
  }

  public static ObjectMapper newMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(SerializationFeature.INDENT_OUTPUT);
  }

  /**
   * Writes {@code value} to a sibling temp file, then moves it over {@code target}. Readers see
   * either the previous content or the new content, never a torn file.
   */
  public static void writeAtomically(ObjectMapper mapper, Path target, Object value)
      throws IOException {
    Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
    try {
      mapper.writeValue(tmp.toFile(), value);
      try {
        Files.move(
            tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

  /**
   * Keeps letters, digits, {@code -} and {@code _}; every other character becomes {@code _}.
   */
  public static String sanitize(String name) {
    StringBuilder out = new StringBuilder(name.length());
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      out.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' ? c : '_');
    }
    return out.toString();
  }
}
