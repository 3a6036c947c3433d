/*
 * どこで: Team Balancer ドメインモデル
 * 何を: セッション操作の結果 (成功時ビュー / 拒否理由) を表現する
 * なぜ: 検証エラーを制御フロー用の例外にせず呼び出し側で分岐させるため
 */
package com.example.teambalancer.model;

import java.util.List;

public record SessionOutcome(
    SessionView view, SessionErrorCode error, String message, List<String> failedParticipants) {

  public SessionOutcome {
    failedParticipants = failedParticipants == null ? List.of() : List.copyOf(failedParticipants);
  }

  public static SessionOutcome accepted(SessionView view) {
    return new SessionOutcome(view, null, null, List.of());
  }

  public static SessionOutcome rejected(SessionErrorCode error, String message) {
    return new SessionOutcome(null, error, message, List.of());
  }

  public static SessionOutcome partialFailure(SessionView view, List<String> failedParticipants) {
    return new SessionOutcome(
        view,
        SessionErrorCode.PARTIAL_FAILURE,
        "rating lookup failed for " + failedParticipants.size() + " participant(s)",
        failedParticipants);
  }

  public boolean isAccepted() {
    return error == null;
  }
}
