package dev.archivist.processing;

import com.fasterxml.jackson.databind.JsonNode;
import dev.archivist.metadata.SourceType;
import dev.archivist.store.StoredDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Renders a stored chat thread as a header followed by one {@code [timestamp] speaker: text} line
 * per message, in stored (chronological) order.
 */
@Component
public class ChatThreadRenderer implements DocumentRenderer {

  @Override
  public Set<SourceType> sourceTypes() {
    return Set.of(SourceType.CHAT);
  }

  @Override
  public String render(StoredDocument document) {
    JsonNode thread = JsonFields.structured(document);
    List<String> participants = new ArrayList<>();
    thread.path("participants").forEach(p -> participants.add(p.asText()));

    List<String> lines = new ArrayList<>();
    lines.add("# Slack Conversation: #" + JsonFields.required(thread, "channel_name"));
    lines.add("Thread ID: " + JsonFields.required(thread, "thread_ts"));
    lines.add("Participants: " + String.join(", ", participants));
    lines.add("");
    lines.add("---");
    lines.add("");
    for (JsonNode message : thread.path("messages")) {
      lines.add("[" + JsonFields.required(message, "timestamp") + "] "
          + JsonFields.optional(message, "user_name", "unknown") + ": "
          + JsonFields.optional(message, "text", ""));
    }
    return String.join("\n", lines);
  }
}
