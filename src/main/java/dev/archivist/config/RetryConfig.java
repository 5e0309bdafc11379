package dev.archivist.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Enables {@code @Retryable} on the chat and wiki clients. Attempts default to 1 per client, so
 * retrying is opt-in through {@code archivist.slack.retry.*} and {@code archivist.confluence.retry.*}.
 */
@Configuration
@EnableRetry
public class RetryConfig {}
