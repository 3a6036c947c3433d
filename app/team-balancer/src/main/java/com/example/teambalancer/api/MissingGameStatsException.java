package com.example.teambalancer.api;

public class MissingGameStatsException extends RuntimeException {
  public MissingGameStatsException(String handle) {
    super("player has no rating for the supported games: " + handle);
  }
}
