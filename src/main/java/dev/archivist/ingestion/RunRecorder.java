package dev.archivist.ingestion;

import dev.archivist.metadata.IngestionRecord;
import dev.archivist.metadata.IngestionRun;
import dev.archivist.metadata.SourceType;
import dev.archivist.store.RawDataStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Starts ingestion runs and persists their single final record.
 *
 * <p>Failing to persist the record is not absorbed: the audit trail must hold one record per run,
 * so the caller sees an {@link UncheckedIOException}.
 */
@Component
public class RunRecorder {

  private static final Logger log = LoggerFactory.getLogger(RunRecorder.class);

  private final RawDataStore store;
  private final Clock clock;

  public RunRecorder(RawDataStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  public IngestionRun start(String prefix, SourceType sourceType) {
    IngestionRun run = IngestionRun.start(prefix, sourceType, clock);
    log.info("Started ingestion run {}", run.ingestionId());
    return run;
  }

  /** Completes the run ({@code completed} or {@code partial}) and logs its record. */
  public IngestionRecord complete(IngestionRun run) {
    return persist(run.complete());
  }

  /** Fails the run during setup and logs its record. */
  public IngestionRecord fail(IngestionRun run, String errorMessage, Throwable cause) {
    log.error("Ingestion run {} failed: {}", run.ingestionId(), errorMessage, cause);
    return persist(run.fail(errorMessage));
  }

  private IngestionRecord persist(IngestionRecord record) {
    try {
      store.logRun(record);
    } catch (IOException e) {
      log.error("Cannot persist ingestion record {}", record.ingestionId(), e);
      throw new UncheckedIOException("Cannot persist ingestion record " + record.ingestionId(), e);
    }
    return record;
  }
}
