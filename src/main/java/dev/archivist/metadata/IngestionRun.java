package dev.archivist.metadata;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;

/**
 * Tracks one in-progress ingestion run and produces its single final {@link IngestionRecord}.
 *
 * <p>Each update atomically replaces an immutable {@link IngestionRecord} snapshot. The run can be
 * finished exactly once, through {@link #complete()} or {@link #fail(String)}.
 */
public final class IngestionRun {

  private static final DateTimeFormatter ID_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private final Clock clock;
  private final AtomicReference<IngestionRecord> current;

  private IngestionRun(Clock clock, IngestionRecord initial) {
    this.clock = clock;
    this.current = new AtomicReference<>(initial);
  }

  /**
   * Starts a run.
   *
   * @param prefix id prefix naming the run kind, e.g. {@code "chat_api"} or {@code "upload_pdf"}
   * @param sourceType origin of the run
   * @param clock time source for start and completion timestamps
   * @return a run in status {@link IngestionStatus#IN_PROGRESS}
   */
  public static IngestionRun start(String prefix, SourceType sourceType, Clock clock) {
    Instant now = clock.instant();
    String id =
        prefix
            + "_"
            + ID_TIMESTAMP.format(now)
            + "_"
            + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    return new IngestionRun(
        clock,
        new IngestionRecord(
            id, sourceType, now, null, 0, 0, 0L, IngestionStatus.IN_PROGRESS, null, List.of()));
  }

  public String ingestionId() {
    return current.get().ingestionId();
  }

  /** Current immutable snapshot. */
  public IngestionRecord snapshot() {
    return current.get();
  }

  public void addSourceIdentifier(String identifier) {
    update(
        r -> {
          List<String> ids = new ArrayList<>(r.sourceIdentifiers());
          ids.add(identifier);
          return copy(r, r.documentsIngested(), r.documentsFailed(), r.bytesProcessed(), ids);
        });
  }

  public void recordSuccess(long bytes) {
    update(
        r ->
            copy(
                r,
                r.documentsIngested() + 1,
                r.documentsFailed(),
                r.bytesProcessed() + bytes,
                r.sourceIdentifiers()));
  }

  public void recordFailure() {
    update(
        r ->
            copy(
                r,
                r.documentsIngested(),
                r.documentsFailed() + 1,
                r.bytesProcessed(),
                r.sourceIdentifiers()));
  }

  /**
   * Finishes the run normally: {@link IngestionStatus#COMPLETED} if no document failed, otherwise
   * {@link IngestionStatus#PARTIAL}.
   */
  public IngestionRecord complete() {
    return finish(null);
  }

  /** Finishes the run as {@link IngestionStatus#FAILED}. */
  public IngestionRecord fail(String errorMessage) {
    return finish(errorMessage);
  }

  private IngestionRecord finish(@Nullable String errorMessage) {
    Instant completedAt = clock.instant();
    return current.updateAndGet(
        r -> {
          if (r.status().isTerminal()) {
            throw new IllegalStateException("Run " + r.ingestionId() + " is already finished");
          }
          IngestionStatus status;
          if (errorMessage != null) {
            status = IngestionStatus.FAILED;
          } else if (r.documentsFailed() > 0) {
            status = IngestionStatus.PARTIAL;
          } else {
            status = IngestionStatus.COMPLETED;
          }
          return new IngestionRecord(
              r.ingestionId(),
              r.sourceType(),
              r.startedAt(),
              completedAt,
              r.documentsIngested(),
              r.documentsFailed(),
              r.bytesProcessed(),
              status,
              errorMessage,
              r.sourceIdentifiers());
        });
  }

  private void update(UnaryOperator<IngestionRecord> change) {
    current.updateAndGet(
        r -> {
          if (r.status().isTerminal()) {
            throw new IllegalStateException("Run " + r.ingestionId() + " is already finished");
          }
          return change.apply(r);
        });
  }

  private static IngestionRecord copy(
      IngestionRecord r, int ingested, int failed, long bytes, List<String> identifiers) {
    return new IngestionRecord(
        r.ingestionId(),
        r.sourceType(),
        r.startedAt(),
        null,
        ingested,
        failed,
        bytes,
        IngestionStatus.IN_PROGRESS,
        null,
        identifiers);
  }
}
