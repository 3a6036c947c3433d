package com.example.teambalancer.service;

public class PlayerNotFoundException extends RuntimeException {

  private final String playerId;

  public PlayerNotFoundException(String playerId) {
    super("player not found in designated team: " + playerId);
    this.playerId = playerId;
  }

  public String playerId() {
    return playerId;
  }
}
