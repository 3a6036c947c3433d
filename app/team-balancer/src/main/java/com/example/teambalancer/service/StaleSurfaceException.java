package com.example.teambalancer.service;

public class StaleSurfaceException extends RuntimeException {

  public StaleSurfaceException(String surfaceRef) {
    super("rendering surface no longer available: " + surfaceRef);
  }
}
