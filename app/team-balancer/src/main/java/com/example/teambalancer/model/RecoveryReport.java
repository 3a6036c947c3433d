package com.example.teambalancer.model;

public record RecoveryReport(int reattached, int discarded) {

  public RecoveryReport plus(RecoveryReport other) {
    return new RecoveryReport(reattached + other.reattached, discarded + other.discarded);
  }
}
