/*
 * どこで: Team Balancer API レスポンス DTO
 * 何を: プロフィール連携成功時の応答を定義する
 * なぜ: 連携されたハンドルと現在のレーティングを利用者が確認できるようにするため
 */
package com.example.teambalancer.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LinkedIdentityResponse(
    String userId, String handle, Integer rating, Integer skillLevel, String linkedAt) {}
