package com.acme.mailflow.worker.web;

/** JSON body of rejected requests. {@code retryAfter} is in seconds and absent when not relevant. */
public record ErrorResponse(String error, String message, Long retryAfter) {

  public static ErrorResponse of(String error, String message) {
    return new ErrorResponse(error, message, null);
  }
}
