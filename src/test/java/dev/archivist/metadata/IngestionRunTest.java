package dev.archivist.metadata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class IngestionRunTest {

  private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void idCarriesPrefixAndUtcTimestamp() {
    IngestionRun run = IngestionRun.start("wiki_space_ENG", SourceType.WIKI, clock);

    assertThat(run.ingestionId()).matches("wiki_space_ENG_20260115_100000_[0-9a-f]{8}");
    assertThat(run.snapshot().status()).isEqualTo(IngestionStatus.IN_PROGRESS);
    assertThat(run.snapshot().completedAt()).isNull();
  }

  @Test
  void idsAreUniqueWithinTheSameSecond() {
    IngestionRun first = IngestionRun.start("upload_pdf", SourceType.PDF, clock);
    IngestionRun second = IngestionRun.start("upload_pdf", SourceType.PDF, clock);

    assertThat(first.ingestionId()).isNotEqualTo(second.ingestionId());
  }

  @Test
  void completeWithoutFailuresIsCompleted() {
    IngestionRun run = IngestionRun.start("upload_text", SourceType.TEXT, clock);
    run.addSourceIdentifier("notes.txt");
    run.recordSuccess(120);
    run.recordSuccess(30);

    IngestionRecord record = run.complete();

    assertThat(record.status()).isEqualTo(IngestionStatus.COMPLETED);
    assertThat(record.documentsIngested()).isEqualTo(2);
    assertThat(record.bytesProcessed()).isEqualTo(150);
    assertThat(record.completedAt()).isEqualTo(NOW);
    assertThat(record.sourceIdentifiers()).containsExactly("notes.txt");
    assertThat(record.errorMessage()).isNull();
  }

  @Test
  void completeWithSomeFailuresIsPartial() {
    IngestionRun run = IngestionRun.start("chat_export", SourceType.CHAT, clock);
    run.recordSuccess(10);
    run.recordFailure();

    IngestionRecord record = run.complete();

    assertThat(record.status()).isEqualTo(IngestionStatus.PARTIAL);
    assertThat(record.documentsFailed()).isEqualTo(1);
  }

  @Test
  void completeWhenEveryDocumentFailedIsStillPartial() {
    IngestionRun run = IngestionRun.start("chat_export", SourceType.CHAT, clock);
    run.recordFailure();
    run.recordFailure();

    assertThat(run.complete().status()).isEqualTo(IngestionStatus.PARTIAL);
  }

  @Test
  void failCarriesErrorMessage() {
    IngestionRun run = IngestionRun.start("wiki_page_7", SourceType.WIKI, clock);

    IngestionRecord record = run.fail("Cannot fetch page 7: 404");

    assertThat(record.status()).isEqualTo(IngestionStatus.FAILED);
    assertThat(record.errorMessage()).isEqualTo("Cannot fetch page 7: 404");
    assertThat(record.completedAt()).isEqualTo(NOW);
  }

  @Test
  void finishedRunRejectsFurtherChanges() {
    IngestionRun run = IngestionRun.start("upload_text", SourceType.TEXT, clock);
    run.complete();

    assertThatThrownBy(() -> run.recordSuccess(1)).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(run::recordFailure).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(run::complete).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> run.fail("late")).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void recordRejectsErrorMessageOnNonFailedStatus() {
    assertThatThrownBy(
            () ->
                new IngestionRecord(
                    "id", SourceType.TEXT, NOW, NOW, 1, 0, 1L, IngestionStatus.COMPLETED, "boom",
                    null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void recordRejectsTerminalStatusWithoutCompletionTime() {
    assertThatThrownBy(
            () ->
                new IngestionRecord(
                    "id", SourceType.TEXT, NOW, null, 1, 0, 1L, IngestionStatus.COMPLETED, null,
                    null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
