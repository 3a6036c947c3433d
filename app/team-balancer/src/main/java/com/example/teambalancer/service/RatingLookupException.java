package com.example.teambalancer.service;

public class RatingLookupException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public RatingLookupException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public RatingLookupException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
