package com.example.teambalancer.api.response;

import com.example.teambalancer.model.Participant;
import com.example.teambalancer.model.TeamStats;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record TeamResponse(
    List<ParticipantResponse> players, int totalRating, double averageRating) {

  public static TeamResponse from(List<Participant> players, TeamStats stats) {
    return new TeamResponse(
        players.stream().map(ParticipantResponse::from).toList(),
        stats.totalRating(),
        stats.averageRating());
  }
}
