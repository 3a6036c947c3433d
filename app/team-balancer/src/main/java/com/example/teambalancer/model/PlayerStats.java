/*
 * どこで: Team Balancer ドメインモデル
 * 何を: 外部レーティングサービスから得たプレイヤー統計を保持する
 * なぜ: プロフィール連携と自分のレーティング確認で同じ形を使うため
 */
package com.example.teambalancer.model;

public record PlayerStats(
    String handle,
    String playerId,
    Integer rating,
    Integer skillLevel,
    boolean hasGameStats,
    String avatar) {}
