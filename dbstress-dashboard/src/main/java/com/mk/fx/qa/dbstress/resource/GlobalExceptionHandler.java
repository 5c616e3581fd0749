package com.mk.fx.qa.dbstress.resource;

import com.mk.fx.qa.dbstress.cfg.ErrorResponse;
import com.mk.fx.qa.dbstress.error.AlreadyRunningException;
import com.mk.fx.qa.dbstress.error.DuplicateOperationException;
import com.mk.fx.qa.dbstress.error.ExperimentAlreadyRunningException;
import com.mk.fx.qa.dbstress.error.RemoteRequestFailedException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler({
    DuplicateOperationException.class,
    AlreadyRunningException.class,
    ExperimentAlreadyRunningException.class
  })
  public ResponseEntity<ErrorResponse> handleConflict(RuntimeException ex) {
    log.warn("Conflict: {}", ex.getMessage());
    return ResponseEntity.status(409).body(new ErrorResponse("Conflict", ex.getMessage()));
  }

  @ExceptionHandler(RemoteRequestFailedException.class)
  public ResponseEntity<ErrorResponse> handleRemoteFailure(RemoteRequestFailedException ex) {
    log.warn("Engine request failed (status {}): {}", ex.getStatusCode(), ex.getMessage());
    return ResponseEntity.status(502).body(new ErrorResponse("Engine Error", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid Argument", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    var details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("Validation failed: {}", details);
    return ResponseEntity.badRequest().body(new ErrorResponse("Invalid Argument", details));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest()
        .body(new ErrorResponse("Invalid Argument", "Request body is not valid JSON"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Unhandled exception", ex);
    return ResponseEntity.internalServerError()
        .body(new ErrorResponse("Server Error", ex.getMessage()));
  }
}
