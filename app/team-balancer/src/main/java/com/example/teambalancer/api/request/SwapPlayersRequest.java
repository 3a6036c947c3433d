package com.example.teambalancer.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/** team_a_player_id はチーム A、team_b_player_id はチーム B に所属している必要がある。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SwapPlayersRequest(@NotBlank String teamAPlayerId, @NotBlank String teamBPlayerId) {}
