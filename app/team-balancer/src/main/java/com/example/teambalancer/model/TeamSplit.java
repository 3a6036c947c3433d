/*
 * どこで: Team Balancer ドメインモデル
 * 何を: チーム A/B への振り分け結果を保持する
 * なぜ: balance/swap/rebalance の戻り値を不変なペアとして扱うため
 */
package com.example.teambalancer.model;

import java.util.List;

public record TeamSplit(List<Participant> teamA, List<Participant> teamB) {

  public TeamSplit {
    teamA = List.copyOf(teamA);
    teamB = List.copyOf(teamB);
  }

  public static TeamSplit empty() {
    return new TeamSplit(List.of(), List.of());
  }

  public boolean isEmpty() {
    return teamA.isEmpty() && teamB.isEmpty();
  }
}
