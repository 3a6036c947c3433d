package com.example.teambalancer.model;

import java.util.List;

/** start 時のレーティング一括照会の結果。ロスター順を保持する。 */
public record RatingResolution(List<Participant> rated, List<String> failedParticipants) {

  public RatingResolution {
    rated = List.copyOf(rated);
    failedParticipants = List.copyOf(failedParticipants);
  }

  public boolean isComplete() {
    return failedParticipants.isEmpty();
  }
}
