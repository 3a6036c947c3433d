/*
 * どこで: Team Balancer API
 * 何を: 拒否されたセッション操作の結果を HTTP 層へ運ぶ
 * なぜ: 型付きエラーコードから HTTP ステータスへの変換を例外ハンドラに集約するため
 */
package com.example.teambalancer.api;

import com.example.teambalancer.model.SessionErrorCode;
import com.example.teambalancer.model.SessionOutcome;
import java.util.List;

public class SessionOperationException extends RuntimeException {

  private final SessionErrorCode error;
  private final List<String> failedParticipants;

  public SessionOperationException(SessionOutcome outcome) {
    super(outcome.message());
    this.error = outcome.error();
    this.failedParticipants = outcome.failedParticipants();
  }

  public SessionErrorCode error() {
    return error;
  }

  public List<String> failedParticipants() {
    return failedParticipants;
  }
}
