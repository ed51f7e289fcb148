package com.scholary.breath.analyzer.api;

import com.scholary.breath.analyzer.objectstore.ObjectStoreException;
import com.scholary.breath.analyzer.waveform.MalformedWaveformException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps exceptions thrown by the controllers to {@link ErrorResponse} bodies. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MalformedWaveformException.class)
  public ResponseEntity<ErrorResponse> handleMalformedWaveform(
      MalformedWaveformException e, HttpServletRequest request) {
    LOGGER.warn("Rejected waveform: {}", e.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "malformed_waveform", e.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(
      MethodArgumentNotValidException e, HttpServletRequest request) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return respond(HttpStatus.BAD_REQUEST, "invalid_request", message, request);
  }

  @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
  public ResponseEntity<ErrorResponse> handleBadInput(Exception e, HttpServletRequest request) {
    return respond(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage(), request);
  }

  @ExceptionHandler(ObjectStoreException.class)
  public ResponseEntity<ErrorResponse> handleObjectStore(
      ObjectStoreException e, HttpServletRequest request) {
    LOGGER.error("Object store failure", e);
    return respond(HttpStatus.BAD_GATEWAY, "object_store_error", e.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, HttpServletRequest request) {
    LOGGER.error("Unhandled error on {}", request.getRequestURI(), e);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected server error", request);
  }

  private static ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String error, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(ErrorResponse.of(status.value(), error, message, request.getRequestURI()));
  }
}
