/*
 * どこで: Team Balancer API
 * 何を: エラー応答の標準フォーマットを定義する
 * なぜ: 例外ハンドリング時のレスポンス形状を統一するため
 */
package com.example.teambalancer.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiErrorResponse(String code, String message, List<String> failedParticipants) {

  public ApiErrorResponse {
    failedParticipants = failedParticipants == null ? List.of() : List.copyOf(failedParticipants);
  }

  public ApiErrorResponse(String code, String message) {
    this(code, message, List.of());
  }
}
