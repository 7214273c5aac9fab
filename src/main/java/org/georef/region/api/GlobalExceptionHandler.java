package org.georef.region.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import org.georef.region.api.response.ApiErrorResponse;
import org.georef.region.service.exception.DomainException;

/**
 * Maps exceptions raised by the controllers onto {@link ApiErrorResponse} bodies.
 *
 * <p>Domain errors are mapped by their {@link org.georef.region.service.RegionServiceError} kind:
 *
 * <ul>
 *   <li>{@code ENTITY_NOT_FOUND} → 404
 *   <li>{@code DUPLICATE_CODE} → 409
 *   <li>{@code RESTRICTED_DELETION} → 400
 *   <li>{@code UNEXPECTED_STORAGE_ERROR} → 500 with a generic message; details are logged only
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  static final String GENERIC_ERROR_MESSAGE = "An unexpected error occurred";

  @ExceptionHandler(DomainException.class)
  public ResponseEntity<ApiErrorResponse> handleDomain(DomainException ex) {
    var code = ex.getError().name();
    return switch (ex.getError()) {
      case ENTITY_NOT_FOUND -> {
        log.debug("Not found: {}", ex.getMessage());
        yield respond(HttpStatus.NOT_FOUND, ApiErrorResponse.NOT_FOUND, ex.getMessage(), code);
      }
      case DUPLICATE_CODE -> {
        log.debug("Conflict: {}", ex.getMessage());
        yield respond(
            HttpStatus.CONFLICT, ApiErrorResponse.APPLICATION_ERROR, ex.getMessage(), code);
      }
      case RESTRICTED_DELETION -> {
        log.debug("Restricted deletion: {}", ex.getMessage());
        yield respond(
            HttpStatus.BAD_REQUEST, ApiErrorResponse.APPLICATION_ERROR, ex.getMessage(), code);
      }
      case UNEXPECTED_STORAGE_ERROR -> {
        log.error("Storage error: {}", ex.getMessage(), ex);
        yield respond(
            HttpStatus.INTERNAL_SERVER_ERROR,
            ApiErrorResponse.INTERNAL_ERROR,
            GENERIC_ERROR_MESSAGE,
            code);
      }
    };
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    var message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
            .reduce((a, b) -> a + "; " + b)
            .orElse("Validation failed");
    log.warn("Validation failed: {}", message);
    return respond(HttpStatus.BAD_REQUEST, ApiErrorResponse.INVALID_REQUEST, message, null);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, ApiErrorResponse.INVALID_REQUEST, "Malformed request body", null);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    var message = "Invalid value for parameter '" + ex.getName() + "'";
    log.warn("Bad request: {}", message);
    return respond(HttpStatus.BAD_REQUEST, ApiErrorResponse.INVALID_REQUEST, message, null);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Bad request: {}", ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, ApiErrorResponse.INVALID_REQUEST, ex.getMessage(), null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex) {
    log.error("Internal server error", ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiErrorResponse.INTERNAL_ERROR,
        GENERIC_ERROR_MESSAGE,
        null);
  }

  private static ResponseEntity<ApiErrorResponse> respond(
      HttpStatus status, String type, String message, String code) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(type, message, code));
  }
}
