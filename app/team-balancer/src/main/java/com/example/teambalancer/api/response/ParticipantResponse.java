package com.example.teambalancer.api.response;

import com.example.teambalancer.model.Participant;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ParticipantResponse(String userId, String displayName, int rating) {

  public static ParticipantResponse from(Participant participant) {
    return new ParticipantResponse(
        participant.externalId(), participant.displayName(), participant.rating());
  }
}
