/*
 * Where: Datastore API
 * What: Maps datastore failures to HTTP status codes and error bodies
 * Why: Keeps the failure contract stable for the reporting UI
 */
package com.configwatch.datastore.api;

import com.configwatch.datastore.service.AccountNotFoundException;
import com.configwatch.datastore.service.ItemIntegrityViolationException;
import com.configwatch.datastore.service.RetryExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String CODE_BAD_REQUEST = "BAD_REQUEST";
  static final String CODE_ACCOUNT_NOT_FOUND = "ACCOUNT_NOT_FOUND";
  static final String CODE_ITEM_INTEGRITY_VIOLATION = "ITEM_INTEGRITY_VIOLATION";
  static final String CODE_STORAGE_UNAVAILABLE = "STORAGE_UNAVAILABLE";
  static final String CODE_INTERNAL_ERROR = "INTERNAL_ERROR";

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(CODE_BAD_REQUEST, ex.getMessage()));
  }

  @ExceptionHandler(AccountNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleAccountNotFound(AccountNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(CODE_ACCOUNT_NOT_FOUND, ex.getMessage()));
  }

  @ExceptionHandler(ItemIntegrityViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleIntegrityViolation(
      ItemIntegrityViolationException ex) {
    logger.error("duplicate items for one identity: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse(CODE_ITEM_INTEGRITY_VIOLATION, ex.getMessage()));
  }

  @ExceptionHandler(RetryExhaustedException.class)
  public ResponseEntity<ApiErrorResponse> handleRetryExhausted(RetryExhaustedException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse(CODE_STORAGE_UNAVAILABLE, ex.getMessage()));
  }

  @ExceptionHandler(DataAccessResourceFailureException.class)
  public ResponseEntity<ApiErrorResponse> handleStorageFailure(
      DataAccessResourceFailureException ex) {
    logger.warn("storage unavailable", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse(CODE_STORAGE_UNAVAILABLE, "storage unavailable"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled datastore api failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(CODE_INTERNAL_ERROR, ex.getMessage()));
  }
}
