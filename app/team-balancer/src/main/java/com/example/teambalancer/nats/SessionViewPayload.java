/*
 * どこで: Team Balancer 描画境界 (NATS)
 * 何を: チャット基盤アダプタへ送るビューモデルの JSON 形状を定義する
 * なぜ: ドメインモデルの変更がアダプタとの契約へ直接漏れないようにするため
 */
package com.example.teambalancer.nats;

import com.example.teambalancer.model.Participant;
import com.example.teambalancer.model.SessionView;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "送信専用 DTO record のため")
public record SessionViewPayload(
    String state,
    int requiredPlayers,
    List<ParticipantPayload> participants,
    List<ParticipantPayload> teamA,
    List<ParticipantPayload> teamB,
    int teamATotal,
    double teamAAverage,
    int teamBTotal,
    double teamBAverage,
    int ratingGap,
    boolean aging,
    boolean ready,
    List<String> failedParticipants,
    String createdAt,
    String expiresAt) {

  static SessionViewPayload from(SessionView view) {
    return new SessionViewPayload(
        view.state().name(),
        view.requiredPlayers(),
        toPayloads(view.participants()),
        toPayloads(view.teamA()),
        toPayloads(view.teamB()),
        view.teamAStats().totalRating(),
        view.teamAStats().averageRating(),
        view.teamBStats().totalRating(),
        view.teamBStats().averageRating(),
        view.ratingGap(),
        view.aging(),
        view.ready(),
        view.failedParticipants(),
        view.createdAt().toString(),
        view.expiresAt().toString());
  }

  private static List<ParticipantPayload> toPayloads(List<Participant> participants) {
    return participants.stream().map(ParticipantPayload::from).toList();
  }
}
