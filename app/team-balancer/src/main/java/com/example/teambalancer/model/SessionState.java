/*
 * どこで: Team Balancer ドメインモデル
 * 何を: バランスセッションのライフサイクル状態を定義する
 * なぜ: 状態遷移のガードと永続スナップショットの状態タグを一致させるため
 */
package com.example.teambalancer.model;

public enum SessionState {
  OPEN,
  BALANCING,
  BALANCED,
  FINALIZED,
  CANCELLED,
  EXPIRED,
  FAILED;

  public boolean isTerminal() {
    return this == FINALIZED || this == CANCELLED || this == EXPIRED || this == FAILED;
  }
}
