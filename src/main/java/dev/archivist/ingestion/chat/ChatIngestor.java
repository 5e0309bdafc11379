package dev.archivist.ingestion.chat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.archivist.ingestion.IngestionOutcome;
import dev.archivist.ingestion.RunRecorder;
import dev.archivist.metadata.DocumentMetadata;
import dev.archivist.metadata.IngestionRecord;
import dev.archivist.metadata.IngestionRun;
import dev.archivist.metadata.SourceType;
import dev.archivist.store.ArchiveJson;
import dev.archivist.store.BatchHandle;
import dev.archivist.store.RawDataStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ingests chat conversations into the raw store, one document per thread.
 *
 * <p>Two entry points: live channel history through a {@link ChatSourceClient}, and a workspace
 * export directory ({@code users.json}, {@code channels.json}, {@code <channel>/<day>.json}). Each
 * call is one run with one batch; a thread that cannot be stored is counted as failed and the run
 * continues.
 */
@Service
public class ChatIngestor {

    private static final Logger log = LoggerFactory.getLogger(ChatIngestor.class);

    public static final int DEFAULT_DAYS_HISTORY = 30;
    public static final int DEFAULT_LIMIT = 1000;

    private static final DateTimeFormatter MESSAGE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final ChatSourceClient client;
    private final RawDataStore store;
    private final RunRecorder runs;
    private final Clock clock;
    private final ObjectMapper mapper = ArchiveJson.newMapper();

    public ChatIngestor(ChatSourceClient client, RawDataStore store, RunRecorder runs, Clock clock) {
        this.client = client;
        this.store = store;
        this.runs = runs;
        this.clock = clock;
    }

    /**
     * Ingests recent history of one channel, including thread replies.
     *
     * @param channelId   platform channel id
     * @param daysHistory how many days back to fetch
     * @param limit       maximum number of top-level messages
     * @return the run record and the batch written
     */
    public IngestionOutcome ingestChannel(String channelId, int daysHistory, int limit) {
        if (daysHistory < 1 || limit < 1) {
            throw new IllegalArgumentException("daysHistory and limit must be positive");
        }
        IngestionRun run = runs.start("chat_api_" + ArchiveJson.sanitize(channelId), SourceType.CHAT);
        run.addSourceIdentifier(channelId);

        ChatChannel channel;
        List<ChatMessage> messages;
        BatchHandle batch;
        try {
            channel = client.channelInfo(channelId);
            Instant oldest = clock.instant().minus(Duration.ofDays(daysHistory));
            messages = client.history(channelId, oldest, limit);
            batch = store.createBatch(SourceType.CHAT, "channel_" + channel.name());
        } catch (IOException | RuntimeException e) {
            IngestionRecord record = runs.fail(run, "Cannot fetch channel " + channelId + ": "
                    + e.getMessage(), e);
            return new IngestionOutcome(record, List.of());
        }

        List<List<ChatMessage>> grouped;
        try {
            grouped = ChatThreads.group(messages);
        } catch (NumberFormatException e) {
            log.error("Channel {} returned messages with malformed timestamps", channelId, e);
            run.recordFailure();
            IngestionRecord record = runs.complete(run);
            return new IngestionOutcome(record, List.of(batch));
        }

        List<List<ChatMessage>> threads = new ArrayList<>();
        for (List<ChatMessage> thread : grouped) {
            ChatMessage root = thread.get(0);
            if (root.replyCount() > 0) {
                try {
                    List<ChatMessage> withReplies = new ArrayList<>(thread);
                    withReplies.addAll(client.replies(channelId, root.ts()));
                    threads.addAll(ChatThreads.group(withReplies));
                } catch (RuntimeException e) {
                    log.error("Cannot fetch replies of thread {} in {}", root.ts(), channelId, e);
                    run.recordFailure();
                }
            } else {
                threads.add(thread);
            }
        }

        Map<String, String> names = new HashMap<>();
        Function<String, String> resolver = id ->
                names.computeIfAbsent(id, u -> client.userName(u).orElse(u));
        for (List<ChatMessage> thread : threads) {
            storeThread(run, batch, channel, thread, resolver);
        }

        IngestionRecord record = runs.complete(run);
        log.info("Ingested {} threads from #{} ({} failed)",
                record.documentsIngested(), channel.name(), record.documentsFailed());
        return new IngestionOutcome(record, List.of(batch));
    }

    /**
     * Ingests a workspace export directory.
     *
     * <p>Expects {@code channels.json} and {@code users.json} at the top level and one directory
     * per channel name holding day files. A day file that cannot be parsed counts as one failed
     * document.
     */
    public IngestionOutcome ingestExport(Path exportDir) {
        IngestionRun run = runs.start("chat_export", SourceType.CHAT);
        run.addSourceIdentifier(exportDir.toString());

        List<ChatChannel> channels;
        Map<String, String> users;
        BatchHandle batch;
        try {
            channels = readChannels(exportDir.resolve("channels.json"));
            users = readUsers(exportDir.resolve("users.json"));
            batch = store.createBatch(SourceType.CHAT, "chat_export");
        } catch (IOException | RuntimeException e) {
            IngestionRecord record = runs.fail(run, "Cannot read chat export " + exportDir + ": "
                    + e.getMessage(), e);
            return new IngestionOutcome(record, List.of());
        }

        for (ChatChannel channel : channels) {
            Path channelDir = exportDir.resolve(channel.name());
            if (!Files.isDirectory(channelDir)) {
                log.warn("Export has no directory for channel #{}", channel.name());
                continue;
            }
            List<ChatMessage> messages = new ArrayList<>();
            for (Path dayFile : dayFiles(channelDir, run)) {
                try {
                    mapper.readTree(dayFile.toFile()).forEach(node -> messages.add(toMessage(node)));
                } catch (IOException | RuntimeException e) {
                    log.error("Cannot read export file {}", dayFile, e);
                    run.recordFailure();
                }
            }
            List<List<ChatMessage>> threads;
            try {
                threads = ChatThreads.group(messages);
            } catch (NumberFormatException e) {
                log.error("Channel #{} has messages with malformed timestamps", channel.name(), e);
                run.recordFailure();
                continue;
            }
            for (List<ChatMessage> thread : threads) {
                storeThread(run, batch, channel, thread, id -> users.getOrDefault(id, id));
            }
        }

        IngestionRecord record = runs.complete(run);
        log.info("Ingested {} threads from chat export {} ({} failed)",
                record.documentsIngested(), exportDir, record.documentsFailed());
        return new IngestionOutcome(record, List.of(batch));
    }

    private void storeThread(IngestionRun run, BatchHandle batch, ChatChannel channel,
                             List<ChatMessage> thread, Function<String, String> userNames) {
        ChatMessage root = thread.get(0);
        try {
            Set<String> participants = new LinkedHashSet<>();
            List<Map<String, Object>> rendered = new ArrayList<>();
            for (ChatMessage message : thread) {
                String userName = message.user() == null ? "unknown" : userNames.apply(message.user());
                participants.add(userName);
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("ts", message.ts());
                m.put("user", message.user() == null ? "unknown" : message.user());
                m.put("user_name", userName);
                m.put("timestamp", MESSAGE_TIMESTAMP.format(message.instant()));
                m.put("text", message.text());
                rendered.add(m);
            }

            Map<String, Object> content = new LinkedHashMap<>();
            content.put("channel_id", channel.id());
            content.put("channel_name", channel.name());
            content.put("thread_ts", root.ts());
            content.put("participants", List.copyOf(participants));
            content.put("message_count", thread.size());
            content.put("messages", rendered);

            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("channel_id", channel.id());
            extra.put("channel_name", channel.name());
            extra.put("participants", List.copyOf(participants));
            extra.put("message_count", thread.size());

            DocumentMetadata metadata = new DocumentMetadata(
                    SourceType.CHAT,
                    root.ts(),
                    "#" + channel.name(),
                    clock.instant(),
                    root.instant(),
                    participants.iterator().next(),
                    "Thread in #" + channel.name(),
                    null,
                    extra);

            Path stored = store.storeDocument(batch, "thread_" + root.ts(), content, metadata);
            run.recordSuccess(Files.size(stored));
        } catch (IOException | RuntimeException e) {
            log.error("Failed to store thread {} of #{}", root.ts(), channel.name(), e);
            run.recordFailure();
        }
    }

    private List<Path> dayFiles(Path channelDir, IngestionRun run) {
        try (Stream<Path> files = Files.list(channelDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Cannot list export directory {}", channelDir, e);
            run.recordFailure();
            return List.of();
        }
    }

    private List<ChatChannel> readChannels(Path file) throws IOException {
        List<ChatChannel> channels = new ArrayList<>();
        for (JsonNode node : mapper.readTree(file.toFile())) {
            String name = node.path("name").asText();
            channels.add(new ChatChannel(node.path("id").asText(name), name));
        }
        return channels;
    }

    private Map<String, String> readUsers(Path file) throws IOException {
        Map<String, String> users = new HashMap<>();
        if (!Files.isRegularFile(file)) {
            log.warn("Chat export has no users.json, user ids are kept as names");
            return users;
        }
        for (JsonNode node : mapper.readTree(file.toFile())) {
            String realName = node.path("real_name").asText("");
            if (realName.isBlank()) {
                realName = node.path("profile").path("real_name").asText("");
            }
            users.put(node.path("id").asText(),
                    realName.isBlank() ? node.path("name").asText(node.path("id").asText()) : realName);
        }
        return users;
    }

    private static ChatMessage toMessage(JsonNode node) {
        String user = node.hasNonNull("user") ? node.get("user").asText() : null;
        return new ChatMessage(node.path("ts").asText(), user, node.path("text").asText(""),
                node.path("thread_ts").asText(null), node.path("reply_count").asInt(0));
    }
}
