package com.acme.mailflow.core;

/** Failure that retrying will not fix. Jobs failing with it skip their remaining attempts. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
