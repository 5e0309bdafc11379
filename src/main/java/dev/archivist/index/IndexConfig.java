package dev.archivist.index;

import dev.archivist.processing.DocumentProcessor;
import dev.archivist.store.RawDataStore;
import dev.archivist.store.StorageProperties;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the index provider and the {@link VectorIndexManager} over {@code
 * archivist.storage.base-path}.
 */
@Configuration
public class IndexConfig {

  @Bean
  public IndexProviderFactory indexProviderFactory(EmbeddingModel embeddingModel) {
    return new EmbeddingStoreIndexFactory(embeddingModel);
  }

  @Bean(destroyMethod = "close")
  public VectorIndexManager vectorIndexManager(
      StorageProperties storage,
      IndexProviderFactory providerFactory,
      DocumentProcessor processor,
      RawDataStore store,
      IndexProperties properties,
      Clock clock) {
    return new VectorIndexManager(
        Path.of(storage.basePath()), providerFactory, processor, store, properties, clock);
  }
}
