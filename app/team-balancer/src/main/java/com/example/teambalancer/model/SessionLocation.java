/*
 * どこで: Team Balancer ドメインモデル
 * 何を: セッションの描画先 (guild/channel/描画面ハンドル) を表す値型
 * なぜ: 復旧時にチャット基盤のライブオブジェクトへ依存せず状態機械を再構築するため
 */
package com.example.teambalancer.model;

public record SessionLocation(String guildId, String channelId, String surfaceRef) {

  public SessionLocation {
    if (guildId == null || guildId.isBlank()) {
      throw new IllegalArgumentException("guildId is required");
    }
    if (channelId == null || channelId.isBlank()) {
      throw new IllegalArgumentException("channelId is required");
    }
    surfaceRef = surfaceRef == null || surfaceRef.isBlank() ? null : surfaceRef;
  }

  public String channelKey() {
    return guildId + ":" + channelId;
  }

  public SessionLocation withSurfaceRef(String newSurfaceRef) {
    return new SessionLocation(guildId, channelId, newSurfaceRef);
  }
}
