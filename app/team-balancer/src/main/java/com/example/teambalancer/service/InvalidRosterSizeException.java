package com.example.teambalancer.service;

public class InvalidRosterSizeException extends RuntimeException {

  public InvalidRosterSizeException(int expected, int actual) {
    super("expected " + expected + " players, got " + actual);
  }
}
