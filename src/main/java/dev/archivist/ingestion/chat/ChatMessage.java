package dev.archivist.ingestion.chat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One chat message as returned by the chat platform.
 *
 * @param ts message timestamp in platform form ({@code "1700000000.000100"}), unique per channel
 * @param user author user id; null for bot or system messages
 * @param text message text
 * @param threadTs timestamp of the thread root; null for top-level messages without replies
 * @param replyCount number of replies when this message is a thread root
 */
public record ChatMessage(
    String ts, @Nullable String user, String text, @Nullable String threadTs, int replyCount) {

  public ChatMessage {
    Objects.requireNonNull(ts, "ts must not be null");
    text = text == null ? "" : text;
  }

  /** The thread this message belongs to: its {@code threadTs}, or its own {@code ts}. */
  public String threadKey() {
    return threadTs == null || threadTs.isBlank() ? ts : threadTs;
  }

  public Instant instant() {
    return toInstant(ts);
  }

  /** Converts a platform timestamp (seconds with a microsecond fraction) to an {@link Instant}. */
  public static Instant toInstant(String ts) {
    BigDecimal seconds = new BigDecimal(ts);
    long whole = seconds.longValue();
    long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
    return Instant.ofEpochSecond(whole, nanos);
  }
}
