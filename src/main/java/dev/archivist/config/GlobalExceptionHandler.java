package dev.archivist.config;

import dev.archivist.index.IndexConflictException;
import dev.archivist.index.IndexNotFoundException;
import dev.archivist.index.IndexOperationException;
import dev.archivist.ingestion.UnsupportedSourceException;
import dev.archivist.store.BatchNotFoundException;
import dev.archivist.store.MalformedBatchException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Document-level failures never reach this handler; they are counted in the run record. What
 * arrives here aborted a whole request.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  /** Request body constraint violations, reported as {@code field message} pairs. */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
    if (detail.isEmpty()) {
      detail = "Invalid request body";
    }
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
  }

  @ExceptionHandler(UnsupportedSourceException.class)
  ProblemDetail handleUnsupportedSource(UnsupportedSourceException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler({BatchNotFoundException.class, IndexNotFoundException.class})
  ProblemDetail handleNotFound(RuntimeException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  /** Initialize on an existing index, or another index operation holding the lease. */
  @ExceptionHandler(IndexConflictException.class)
  ProblemDetail handleConflict(IndexConflictException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(MalformedBatchException.class)
  ProblemDetail handleMalformedBatch(MalformedBatchException ex) {
    log.warn("Malformed batch: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
  }

  /** The index was left unchanged; the cause is usually the embedding model or a timeout. */
  @ExceptionHandler(IndexOperationException.class)
  ProblemDetail handleIndexFailure(IndexOperationException ex) {
    log.error("Index operation failed: {}", ex.getMessage(), ex);
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, ex.getMessage());
  }
}
