package com.example.teambalancer.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "外部 API 応答の受け取り専用 DTO のため")
public record FaceitPlayerResponse(
    String playerId, String nickname, String avatar, Map<String, FaceitGameResponse> games) {}
