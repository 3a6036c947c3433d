/*
 * どこで: Team Balancer 永続化モデル
 * 何を: 1 セッション分の永続スナップショット (JSON 1 オブジェクト) を定義する
 * なぜ: プロセス再起動後に状態機械を再構築する唯一の入力とするため
 */
package com.example.teambalancer.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SessionSnapshot(
    String sessionId,
    SessionState state,
    List<Participant> participants,
    List<Participant> teamA,
    List<Participant> teamB,
    long createdAt,
    String guildId,
    String channelId,
    String surfaceRef) {

  public SessionSnapshot {
    participants = participants == null ? List.of() : List.copyOf(participants);
    teamA = teamA == null ? List.of() : List.copyOf(teamA);
    teamB = teamB == null ? List.of() : List.copyOf(teamB);
  }

  public Instant createdAtInstant() {
    return Instant.ofEpochSecond(createdAt);
  }

  public SessionLocation location() {
    return new SessionLocation(guildId, channelId, surfaceRef);
  }
}
