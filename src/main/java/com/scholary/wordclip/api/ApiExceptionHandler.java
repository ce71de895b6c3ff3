package com.scholary.wordclip.api;

import com.scholary.wordclip.exception.NotFoundException;
import com.scholary.wordclip.exception.ValidationException;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps exceptions to {@code {timestamp, error, message}} bodies. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, Object>> invalidSettings(ValidationException ex) {
    return ResponseEntity.badRequest().body(body("validation_error", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
    return ResponseEntity.badRequest().body(body("bad_request", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> invalidRequest(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(err -> err.getField() + " " + err.getDefaultMessage())
            .orElse("validation failed");
    return ResponseEntity.badRequest().body(body("validation_error", message));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.badRequest().body(body("bad_request", "malformed request body"));
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(NotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body("not_found", ex.getMessage()));
  }

  @ExceptionHandler(TaskRejectedException.class)
  public ResponseEntity<Map<String, Object>> busy(TaskRejectedException ex) {
    LOGGER.warn("Rejected clip job: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(body("service_unavailable", "Job queue is full, retry later"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> internal(Exception ex) {
    LOGGER.error("Request failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(body("internal_error", ex.getMessage()));
  }

  private static Map<String, Object> body(String error, String message) {
    return Map.of(
        "timestamp",
        Instant.now().toString(),
        "error",
        error,
        "message",
        message == null ? "unexpected error" : message);
  }
}
