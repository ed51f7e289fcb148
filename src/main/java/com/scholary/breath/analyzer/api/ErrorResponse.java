package com.scholary.breath.analyzer.api;

import java.time.Instant;

/** Error body returned for rejected or failed requests. */
public record ErrorResponse(
    int status, String error, String message, String path, Instant timestamp) {

  public static ErrorResponse of(int status, String error, String message, String path) {
    return new ErrorResponse(status, error, message, path, Instant.now());
  }
}
