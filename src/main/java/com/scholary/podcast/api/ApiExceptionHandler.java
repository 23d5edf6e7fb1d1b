package com.scholary.podcast.api;

import com.scholary.podcast.feed.FeedException;
import com.scholary.podcast.ingestion.PodcastNotFoundException;
import com.scholary.podcast.job.JobNotFoundException;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps domain exceptions to HTTP responses for all controllers. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({JobNotFoundException.class, PodcastNotFoundException.class})
  ResponseEntity<ApiError> handleNotFound(RuntimeException ex) {
    LOGGER.warn("Not found: {}", ex.getMessage());
    return error(HttpStatus.NOT_FOUND, ex, ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  ResponseEntity<ApiError> handleInvalidRequest(IllegalArgumentException ex) {
    LOGGER.warn("Invalid request: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, ex, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("Request validation failed: {}", details);
    return error(HttpStatus.BAD_REQUEST, ex, details);
  }

  @ExceptionHandler(FeedException.class)
  ResponseEntity<ApiError> handleFeed(FeedException ex) {
    LOGGER.warn("Feed could not be read ({}): {}", ex.getKind(), ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, ex, ex.getMessage());
  }

  private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String details) {
    return ResponseEntity.status(status)
        .body(new ApiError(ex.getClass().getSimpleName(), details, Instant.now()));
  }

  record ApiError(String error, String message, Instant timestamp) {}
}
