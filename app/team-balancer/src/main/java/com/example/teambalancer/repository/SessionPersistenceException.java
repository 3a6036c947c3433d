package com.example.teambalancer.repository;

public class SessionPersistenceException extends RuntimeException {

  public SessionPersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
