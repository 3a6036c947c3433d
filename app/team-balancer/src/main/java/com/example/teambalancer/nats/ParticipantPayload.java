package com.example.teambalancer.nats;

import com.example.teambalancer.model.Participant;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ParticipantPayload(String externalId, String displayName, int rating) {

  static ParticipantPayload from(Participant participant) {
    return new ParticipantPayload(
        participant.externalId(), participant.displayName(), participant.rating());
  }
}
