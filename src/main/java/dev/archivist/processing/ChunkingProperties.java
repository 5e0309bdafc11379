package dev.archivist.processing;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised chunking configuration, bound from {@code archivist.chunking.*}.
 *
 * <ul>
 *   <li>{@code size} - target chunk length in characters (default 700, at least 50)
 *   <li>{@code overlap} - characters shared by consecutive chunks (default 100, in [0, size))
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "archivist.chunking")
public class ChunkingProperties {

  private int size = RecursiveTextSplitter.DEFAULT_CHUNK_SIZE;
  private int overlap = RecursiveTextSplitter.DEFAULT_OVERLAP;

  @PostConstruct
  void validate() {
    if (size < 50) {
      throw new IllegalStateException("archivist.chunking.size must be >= 50, got: " + size);
    }
    if (overlap < 0 || overlap >= size) {
      throw new IllegalStateException(
          "archivist.chunking.overlap must be in [0, size), got: " + overlap);
    }
  }

  public int getSize() {
    return size;
  }

  public void setSize(int size) {
    this.size = size;
  }

  public int getOverlap() {
    return overlap;
  }

  public void setOverlap(int overlap) {
    this.overlap = overlap;
  }
}
