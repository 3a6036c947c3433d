/*
 * どこで: Team Balancer ドメインモデル
 * 何を: セッション参加者 1 名 (識別子/表示名/レーティング) を表現する
 * なぜ: 1 回のバランス計算中は値を固定し、チーム間で安全に共有するため
 */
package com.example.teambalancer.model;

public record Participant(String externalId, String displayName, int rating) {

  public Participant {
    if (externalId == null || externalId.isBlank()) {
      throw new IllegalArgumentException("externalId is required");
    }
    if (rating < 0) {
      throw new IllegalArgumentException("rating must not be negative: " + rating);
    }
    displayName = displayName == null || displayName.isBlank() ? externalId : displayName;
  }

  /**
   * 役割: 募集中 (OPEN) のロスターに載せる未評価の参加者を作る。
   * 動作: rating は 0 固定。start 時に評価済みの Participant へ置き換えられる。
   * 前提: externalId は空でないこと。
   */
  public static Participant unrated(String externalId, String displayName) {
    return new Participant(externalId, displayName, 0);
  }

  public Participant withRating(String resolvedDisplayName, int resolvedRating) {
    return new Participant(externalId, resolvedDisplayName, resolvedRating);
  }
}
