/*
 * どこで: Team Balancer ドメインモデル
 * 何を: 受理された遷移ごとに生成する描画用ビューモデル
 * なぜ: 描画層を状態を持たない変換器として扱えるようにするため
 */
package com.example.teambalancer.model;

import java.time.Instant;
import java.util.List;

public record SessionView(
    String sessionId,
    SessionState state,
    SessionLocation location,
    int requiredPlayers,
    List<Participant> participants,
    List<Participant> teamA,
    List<Participant> teamB,
    TeamStats teamAStats,
    TeamStats teamBStats,
    int ratingGap,
    boolean aging,
    List<String> failedParticipants,
    Instant createdAt,
    Instant expiresAt) {

  public SessionView {
    participants = List.copyOf(participants);
    teamA = List.copyOf(teamA);
    teamB = List.copyOf(teamB);
    failedParticipants = List.copyOf(failedParticipants);
  }

  public int participantCount() {
    return participants.size();
  }

  public boolean ready() {
    return state == SessionState.OPEN && participants.size() == requiredPlayers;
  }
}
