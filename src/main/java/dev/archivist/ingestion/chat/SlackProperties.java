package dev.archivist.ingestion.chat;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Slack Web API client settings. {@code retry.maxAttempts} of 1 disables retries.
 */
@ConfigurationProperties(prefix = "archivist.slack")
public record SlackProperties(
    String baseUrl,
    String token,
    int connectTimeoutMs,
    int readTimeoutMs,
    Retry retry) {

  public record Retry(int maxAttempts, long delayMs, double multiplier) {}

  public boolean configured() {
    return token != null && !token.isBlank();
  }
}
