package dev.archivist.ingestion.chat;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Groups chat messages into threads. */
final class ChatThreads {

  private static final Comparator<ChatMessage> CHRONOLOGICAL =
      Comparator.comparing(m -> new BigDecimal(m.ts()));

  private ChatThreads() {
    // utility class
  }

  /**
   * Groups by {@link ChatMessage#threadKey()}. Messages within a thread are chronological; threads
   * are ordered by their earliest message. Duplicate timestamps within a thread are dropped.
   */
  static List<List<ChatMessage>> group(List<ChatMessage> messages) {
    Map<String, Map<String, ChatMessage>> byThread = new LinkedHashMap<>();
    for (ChatMessage message : messages) {
      byThread.computeIfAbsent(message.threadKey(), k -> new LinkedHashMap<>())
          .putIfAbsent(message.ts(), message);
    }
    List<List<ChatMessage>> threads = new ArrayList<>();
    for (Map<String, ChatMessage> thread : byThread.values()) {
      List<ChatMessage> sorted = new ArrayList<>(thread.values());
      sorted.sort(CHRONOLOGICAL);
      threads.add(List.copyOf(sorted));
    }
    threads.sort(Comparator.comparing(t -> new BigDecimal(t.get(0).ts())));
    return threads;
  }
}
