package dev.archivist.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.archivist.store.ArchiveJson;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.nio.file.Path;

/** Opens {@link EmbeddingStoreIndex} providers that embed with the configured model. */
public class EmbeddingStoreIndexFactory implements IndexProviderFactory {

  private final EmbeddingModel embeddingModel;
  private final ObjectMapper mapper = ArchiveJson.newMapper();

  public EmbeddingStoreIndexFactory(EmbeddingModel embeddingModel) {
    this.embeddingModel = embeddingModel;
  }

  @Override
  public IndexProvider open(Path directory) {
    return new EmbeddingStoreIndex(directory, embeddingModel, mapper);
  }
}
