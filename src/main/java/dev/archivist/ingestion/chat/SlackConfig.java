package dev.archivist.ingestion.chat;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to call the Slack Web API.
 *
 * <p>Timeouts are externalized via {@code archivist.slack.*} properties. The bot token is sent as
 * a bearer token on every request.
 */
@Configuration
public class SlackConfig {

  @Bean
  public RestClient slackRestClient(RestClient.Builder builder, SlackProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

    RestClient.Builder configured = builder.clone()
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory);
    if (properties.configured()) {
      configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.token());
    }
    return configured.build();
  }
}
