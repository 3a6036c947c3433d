package com.example.teambalancer.service;

import com.example.teambalancer.config.BalancerProperties;
import com.example.teambalancer.model.Participant;
import com.example.teambalancer.model.SessionLocation;
import com.example.teambalancer.model.SessionSnapshot;
import com.example.teambalancer.model.SessionState;
import com.example.teambalancer.model.TeamSplit;
import com.example.teambalancer.repository.IdentityLinkRepository;
import com.example.teambalancer.repository.SessionStore;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class SessionStateMachineFactory {

  private final SessionCollaborators collaborators;
  private final Clock clock;

  public SessionStateMachineFactory(
      BalancingEngine engine,
      ParticipantRatingResolver ratingResolver,
      IdentityLinkRepository identityLinks,
      SessionStore store,
      SessionRenderer renderer,
      BalancerMetrics metrics,
      BalancerProperties properties,
      Clock clock) {
    this.collaborators =
        new SessionCollaborators(
            engine, ratingResolver, identityLinks, store, renderer, metrics, properties, clock);
    this.clock = clock;
  }

  public SessionStateMachine create(SessionLocation location) {
    final Instant now = Instant.now(clock);
    return new SessionStateMachine(
        collaborators,
        newSessionId(location, now),
        SessionState.OPEN,
        location,
        now.truncatedTo(ChronoUnit.SECONDS),
        List.of(),
        TeamSplit.empty());
  }

  /**
   * 役割: 永続スナップショットから新しい ID の状態機械を組み立てる。
   * 動作: createdAt は元の値を引き継ぐ。BALANCING は照会結果が失われているため OPEN に戻す。
   * 前提: location は描画面の再解決に成功したもの。終端状態のスナップショットは渡さない。
   */
  public SessionStateMachine restore(SessionSnapshot snapshot, SessionLocation location) {
    final boolean balanced = snapshot.state() == SessionState.BALANCED;
    final List<Participant> participants =
        balanced
            ? snapshot.participants()
            : snapshot.participants().stream()
                .map(
                    participant ->
                        Participant.unrated(participant.externalId(), participant.displayName()))
                .toList();
    return new SessionStateMachine(
        collaborators,
        newSessionId(location, Instant.now(clock)),
        balanced ? SessionState.BALANCED : SessionState.OPEN,
        location,
        snapshot.createdAtInstant(),
        participants,
        balanced ? new TeamSplit(snapshot.teamA(), snapshot.teamB()) : TeamSplit.empty());
  }

  static String newSessionId(SessionLocation location, Instant now) {
    final String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    return location.guildId()
        + "-"
        + location.channelId()
        + "-"
        + now.toEpochMilli()
        + "-"
        + suffix;
  }
}
