package dev.archivist.store;

import java.nio.file.Path;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Creates the {@link RawDataStore} rooted at {@code archivist.storage.base-path}. */
@Configuration
public class RawDataStoreConfig {

  @Bean
  public RawDataStore rawDataStore(StorageProperties properties, Clock clock) {
    return new RawDataStore(Path.of(properties.basePath()), ArchiveJson.newMapper(), clock);
  }
}
