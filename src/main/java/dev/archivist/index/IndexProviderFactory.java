package dev.archivist.index;

import java.nio.file.Path;

/** Opens (creating if needed) the provider stored in an index directory. */
@FunctionalInterface
public interface IndexProviderFactory {

  IndexProvider open(Path directory);
}
