package com.scholary.recordings.api;

import com.scholary.recordings.error.ErrorCode;
import com.scholary.recordings.error.NotFoundException;
import com.scholary.recordings.error.RangeNotSatisfiableException;
import com.scholary.recordings.error.RecordingException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Translates exceptions into the {@code {"error": {"code", "message"}}} envelope.
 *
 * <p>Client errors carry the reason. Server errors carry a generic message and no retry hint;
 * details go to the log only.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final String SERVER_ERROR_MESSAGE = "An unexpected error occurred";

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
    LOGGER.warn("Not found: {}", ex.getMessage());
    return error(ErrorCode.NOT_FOUND, ex.publicMessage());
  }

  @ExceptionHandler(RangeNotSatisfiableException.class)
  public ResponseEntity<ErrorResponse> handleRange(RangeNotSatisfiableException ex) {
    LOGGER.info("{}", ex.getMessage());
    return ResponseEntity.status(ErrorCode.INVALID_RANGE.status())
        .header(HttpHeaders.CONTENT_RANGE, "bytes */" + ex.size())
        .header(HttpHeaders.ACCEPT_RANGES, "bytes")
        .body(ErrorResponse.of(ErrorCode.INVALID_RANGE.name(), "Requested range not satisfiable"));
  }

  @ExceptionHandler(RecordingException.class)
  public ResponseEntity<ErrorResponse> handleRecordingException(RecordingException ex) {
    ErrorCode code = ex.errorCode();
    if (code.status().is5xxServerError()) {
      LOGGER.error("Request failed: {}", ex.getMessage(), ex);
      return error(code, SERVER_ERROR_MESSAGE);
    }
    LOGGER.warn("Request rejected: code={}, message={}", code, ex.getMessage());
    return error(code, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String errors =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
            .collect(Collectors.joining(", "));
    LOGGER.warn("Validation failed: {}", errors);
    return error(ErrorCode.VALIDATION_ERROR, "Validation failed: " + errors);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return error(ErrorCode.VALIDATION_ERROR, "The request body is missing or could not be parsed");
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    LOGGER.warn("Missing parameter: {}", ex.getParameterName());
    return error(ErrorCode.VALIDATION_ERROR, ex.getParameterName() + " is required");
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    LOGGER.warn("Missing header: {}", ex.getHeaderName());
    return error(ErrorCode.VALIDATION_ERROR, ex.getHeaderName() + " header is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    LOGGER.warn("Invalid value for {}: {}", ex.getName(), ex.getValue());
    return error(ErrorCode.VALIDATION_ERROR, "Invalid value for " + ex.getName());
  }

  @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException ex) {
    LOGGER.warn("Unsupported content type: {}", ex.getContentType());
    return error(
        ErrorCode.VALIDATION_ERROR, "Use application/json or multipart/form-data for uploads");
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleTooLarge(MaxUploadSizeExceededException ex) {
    LOGGER.warn("Upload too large: {}", ex.getMessage());
    return error(ErrorCode.VALIDATION_ERROR, "Upload exceeds the maximum allowed size");
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
    return error(ErrorCode.NOT_FOUND, "No endpoint " + ex.getResourcePath());
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ErrorResponse> handleMethod(HttpRequestMethodNotSupportedException ex) {
    LOGGER.warn("Method not allowed: {}", ex.getMethod());
    return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
        .body(
            ErrorResponse.of(
                ErrorCode.VALIDATION_ERROR.name(), "Method " + ex.getMethod() + " not allowed"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    LOGGER.error("Unexpected error", ex);
    return error(ErrorCode.SERVER_ERROR, SERVER_ERROR_MESSAGE);
  }

  private static ResponseEntity<ErrorResponse> error(ErrorCode code, String message) {
    return ResponseEntity.status(code.status()).body(ErrorResponse.of(code.name(), message));
  }
}
