package com.example.teambalancer.model;

public record TeamStats(int totalRating, double averageRating, int size) {

  public static final TeamStats EMPTY = new TeamStats(0, 0.0d, 0);
}
