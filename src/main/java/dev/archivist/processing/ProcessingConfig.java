package dev.archivist.processing;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ProcessingConfig {

  @Bean
  public RecursiveTextSplitter recursiveTextSplitter(ChunkingProperties properties) {
    return new RecursiveTextSplitter(properties.getSize(), properties.getOverlap());
  }
}
