/*
 * どこで: Team Balancer API リクエスト DTO
 * 何を: セッション作成 API の入力を定義する
 * なぜ: 描画先 (guild/channel) を型安全に受け取るため
 */
package com.example.teambalancer.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateSessionRequest(
    @NotBlank String guildId, @NotBlank String channelId, String surfaceRef) {}
