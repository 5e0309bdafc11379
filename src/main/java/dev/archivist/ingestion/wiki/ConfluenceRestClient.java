package dev.archivist.ingestion.wiki;

import com.fasterxml.jackson.databind.JsonNode;
import dev.archivist.ingestion.UnsupportedSourceException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link WikiSourceClient} over the Confluence REST API ({@code /rest/api/content}).
 *
 * <p>Retries follow {@code archivist.confluence.retry}; one attempt by default.
 */
@Service
public class ConfluenceRestClient implements WikiSourceClient {

    private static final Logger log = LoggerFactory.getLogger(ConfluenceRestClient.class);

    private static final int PAGE_SIZE = 50;
    private static final String EXPAND = "body.storage,version,ancestors,space";

    private final RestClient restClient;
    private final ConfluenceProperties properties;

    public ConfluenceRestClient(@Qualifier("confluenceRestClient") RestClient restClient,
                                ConfluenceProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${archivist.confluence.retry.max-attempts:1}",
            backoff = @Backoff(
                    delayExpression = "${archivist.confluence.retry.delay-ms:1000}",
                    multiplierExpression = "${archivist.confluence.retry.multiplier:2.0}"
            )
    )
    public List<WikiPage> spacePages(String spaceKey, int limit) {
        requireConfigured();
        List<WikiPage> pages = new ArrayList<>();
        int start = 0;
        while (pages.size() < limit) {
            int pageSize = Math.min(PAGE_SIZE, limit - pages.size());
            JsonNode body = restClient.get()
                    .uri("/rest/api/content?spaceKey={space}&type=page&start={start}&limit={limit}&expand={expand}",
                            spaceKey, start, pageSize, EXPAND)
                    .retrieve()
                    .body(JsonNode.class);
            if (body == null) {
                break;
            }
            JsonNode results = body.path("results");
            String base = body.path("_links").path("base").asText(properties.baseUrl());
            results.forEach(node -> pages.add(toPage(node, base)));
            if (results.size() < pageSize || !body.path("_links").has("next")) {
                break;
            }
            start += results.size();
        }
        log.debug("Fetched {} pages from space {}", pages.size(), spaceKey);
        return pages;
    }

    @Override
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${archivist.confluence.retry.max-attempts:1}",
            backoff = @Backoff(
                    delayExpression = "${archivist.confluence.retry.delay-ms:1000}",
                    multiplierExpression = "${archivist.confluence.retry.multiplier:2.0}"
            )
    )
    public WikiPage page(String pageId) {
        requireConfigured();
        JsonNode body = restClient.get()
                .uri("/rest/api/content/{id}?expand={expand}", pageId, EXPAND)
                .retrieve()
                .body(JsonNode.class);
        if (body == null) {
            throw new IllegalStateException("Empty response for Confluence page " + pageId);
        }
        return toPage(body, body.path("_links").path("base").asText(properties.baseUrl()));
    }

    private void requireConfigured() {
        if (!properties.configured()) {
            throw new UnsupportedSourceException(
                    "Confluence is not configured (archivist.confluence.base-url, username, api-token)");
        }
    }

    static WikiPage toPage(JsonNode node, String baseUrl) {
        List<String> ancestors = new ArrayList<>();
        node.path("ancestors").forEach(a -> ancestors.add(a.path("title").asText()));
        JsonNode version = node.path("version");
        String webui = node.path("_links").path("webui").asText("");
        return new WikiPage(
                node.path("id").asText(),
                node.path("title").asText(),
                node.path("space").path("key").asText(""),
                node.path("body").path("storage").path("value").asText(""),
                version.path("by").path("displayName").asText(null),
                parseInstant(version.path("when").asText(null)),
                version.path("number").asInt(1),
                ancestors,
                webui.isEmpty() ? null : baseUrl + webui);
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Confluence timestamp {}", value);
            return null;
        }
    }
}
