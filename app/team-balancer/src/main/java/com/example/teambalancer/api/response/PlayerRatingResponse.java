package com.example.teambalancer.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlayerRatingResponse(
    String handle, Integer rating, Integer skillLevel, String avatar) {}
