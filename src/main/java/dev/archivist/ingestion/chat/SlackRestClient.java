package dev.archivist.ingestion.chat;

import com.fasterxml.jackson.databind.JsonNode;
import dev.archivist.ingestion.UnsupportedSourceException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link ChatSourceClient} over the Slack Web API.
 *
 * <p>Transient {@link RestClientException}s are retried with exponential backoff as configured in
 * {@code archivist.slack.retry}; the default of one attempt means failures surface immediately.
 */
@Service
public class SlackRestClient implements ChatSourceClient {

    private static final Logger log = LoggerFactory.getLogger(SlackRestClient.class);

    private static final int PAGE_SIZE = 200;

    private final RestClient restClient;
    private final SlackProperties properties;
    private final Map<String, Optional<String>> userNames = new ConcurrentHashMap<>();

    public SlackRestClient(@Qualifier("slackRestClient") RestClient restClient,
                           SlackProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${archivist.slack.retry.max-attempts:1}",
            backoff = @Backoff(
                    delayExpression = "${archivist.slack.retry.delay-ms:1000}",
                    multiplierExpression = "${archivist.slack.retry.multiplier:2.0}"
            )
    )
    public ChatChannel channelInfo(String channelId) {
        JsonNode body = call("/conversations.info?channel={channel}", channelId);
        JsonNode channel = body.path("channel");
        return new ChatChannel(channel.path("id").asText(channelId),
                channel.path("name").asText(channelId));
    }

    @Override
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${archivist.slack.retry.max-attempts:1}",
            backoff = @Backoff(
                    delayExpression = "${archivist.slack.retry.delay-ms:1000}",
                    multiplierExpression = "${archivist.slack.retry.multiplier:2.0}"
            )
    )
    public List<ChatMessage> history(String channelId, Instant oldest, int limit) {
        List<ChatMessage> messages = new ArrayList<>();
        String cursor = "";
        String oldestTs = oldest.getEpochSecond() + ".000000";
        do {
            int pageSize = Math.min(PAGE_SIZE, limit - messages.size());
            JsonNode body = call(
                    "/conversations.history?channel={channel}&oldest={oldest}&limit={limit}&cursor={cursor}",
                    channelId, oldestTs, pageSize, cursor);
            body.path("messages").forEach(m -> messages.add(toMessage(m)));
            cursor = body.path("response_metadata").path("next_cursor").asText("");
        } while (!cursor.isEmpty() && messages.size() < limit);
        log.debug("Fetched {} messages from channel {}", messages.size(), channelId);
        return messages.size() > limit ? List.copyOf(messages.subList(0, limit)) : messages;
    }

    @Override
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${archivist.slack.retry.max-attempts:1}",
            backoff = @Backoff(
                    delayExpression = "${archivist.slack.retry.delay-ms:1000}",
                    multiplierExpression = "${archivist.slack.retry.multiplier:2.0}"
            )
    )
    public List<ChatMessage> replies(String channelId, String threadTs) {
        List<ChatMessage> messages = new ArrayList<>();
        String cursor = "";
        do {
            JsonNode body = call(
                    "/conversations.replies?channel={channel}&ts={ts}&limit={limit}&cursor={cursor}",
                    channelId, threadTs, PAGE_SIZE, cursor);
            body.path("messages").forEach(m -> messages.add(toMessage(m)));
            cursor = body.path("response_metadata").path("next_cursor").asText("");
        } while (!cursor.isEmpty());
        return messages;
    }

    /** Cached per user id; lookup failures resolve to empty so the caller falls back to the id. */
    @Override
    public Optional<String> userName(String userId) {
        return userNames.computeIfAbsent(userId, id -> {
            try {
                JsonNode user = call("/users.info?user={user}", id).path("user");
                String name = user.path("real_name").asText("");
                return Optional.of(name.isBlank() ? user.path("name").asText(id) : name);
            } catch (RestClientException | SlackApiException e) {
                log.warn("Cannot resolve Slack user {}: {}", id, e.getMessage());
                return Optional.empty();
            }
        });
    }

    private JsonNode call(String uri, Object... variables) {
        if (!properties.configured()) {
            throw new UnsupportedSourceException("Slack is not configured (archivist.slack.token)");
        }
        JsonNode body = restClient.get()
                .uri(uri, variables)
                .retrieve()
                .body(JsonNode.class);
        if (body == null || !body.path("ok").asBoolean(false)) {
            String error = body == null ? "empty response" : body.path("error").asText("unknown error");
            throw new SlackApiException("Slack API call " + uri + " failed: " + error);
        }
        return body;
    }

    private static ChatMessage toMessage(JsonNode node) {
        String threadTs = node.path("thread_ts").asText(null);
        String user = node.hasNonNull("user") ? node.get("user").asText() : null;
        return new ChatMessage(node.path("ts").asText(), user, node.path("text").asText(""),
                threadTs, node.path("reply_count").asInt(0));
    }

    /** Slack answered, but with {@code "ok": false}. Not retried. */
    static class SlackApiException extends RuntimeException {
        SlackApiException(String message) {
            super(message);
        }
    }
}
