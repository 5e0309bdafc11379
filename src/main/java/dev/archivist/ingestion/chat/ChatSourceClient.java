package dev.archivist.ingestion.chat;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Read access to a chat platform. */
public interface ChatSourceClient {

  ChatChannel channelInfo(String channelId);

  /** Top-level messages newer than {@code oldest}, at most {@code limit}. */
  List<ChatMessage> history(String channelId, Instant oldest, int limit);

  /** All messages of a thread, root included. */
  List<ChatMessage> replies(String channelId, String threadTs);

  /** Display name of a user, if the platform knows it. */
  Optional<String> userName(String userId);
}
