package com.example.teambalancer.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/** profile はハンドル / @ハンドル / プロフィール URL のいずれか。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LinkIdentityRequest(@NotBlank String profile) {}
