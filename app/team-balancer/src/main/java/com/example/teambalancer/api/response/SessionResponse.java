/*
 * どこで: Team Balancer API レスポンス DTO
 * 何を: セッションの現在状態 (ロスター/チーム/統計) を返す
 * なぜ: 描画境界へ渡すビューと同じ情報を HTTP 利用者にも提供するため
 */
package com.example.teambalancer.api.response;

import com.example.teambalancer.model.SessionView;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record SessionResponse(
    String sessionId,
    String state,
    String guildId,
    String channelId,
    String surfaceRef,
    int requiredPlayers,
    int participantCount,
    boolean ready,
    List<ParticipantResponse> participants,
    TeamResponse teamA,
    TeamResponse teamB,
    int ratingGap,
    boolean aging,
    String createdAt,
    String expiresAt) {

  public static SessionResponse from(SessionView view) {
    final boolean hasTeams = !view.teamA().isEmpty() || !view.teamB().isEmpty();
    return new SessionResponse(
        view.sessionId(),
        view.state().name(),
        view.location().guildId(),
        view.location().channelId(),
        view.location().surfaceRef(),
        view.requiredPlayers(),
        view.participantCount(),
        view.ready(),
        view.participants().stream().map(ParticipantResponse::from).toList(),
        hasTeams ? TeamResponse.from(view.teamA(), view.teamAStats()) : null,
        hasTeams ? TeamResponse.from(view.teamB(), view.teamBStats()) : null,
        view.ratingGap(),
        view.aging(),
        view.createdAt().toString(),
        view.expiresAt().toString());
  }
}
