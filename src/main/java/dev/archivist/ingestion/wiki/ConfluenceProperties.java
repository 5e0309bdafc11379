package dev.archivist.ingestion.wiki;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Confluence REST client settings. {@code retry.maxAttempts} of 1 disables retries. */
@ConfigurationProperties(prefix = "archivist.confluence")
public record ConfluenceProperties(
    String baseUrl,
    String username,
    String apiToken,
    int connectTimeoutMs,
    int readTimeoutMs,
    Retry retry) {

  public record Retry(int maxAttempts, long delayMs, double multiplier) {}

  public boolean configured() {
    return baseUrl != null && !baseUrl.isBlank()
        && username != null && !username.isBlank()
        && apiToken != null && !apiToken.isBlank();
  }
}
