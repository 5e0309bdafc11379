package dev.archivist.ingestion.wiki;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to call the Confluence REST API with basic
 * authentication. Left without base URL and credentials when Confluence is not configured.
 */
@Configuration
public class ConfluenceConfig {

  @Bean
  public RestClient confluenceRestClient(RestClient.Builder builder,
      ConfluenceProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

    RestClient.Builder configured = builder.clone()
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
    if (properties.configured()) {
      configured
          .baseUrl(properties.baseUrl())
          .defaultHeaders(h -> h.setBasicAuth(properties.username(), properties.apiToken()));
    }
    return configured.build();
  }
}
