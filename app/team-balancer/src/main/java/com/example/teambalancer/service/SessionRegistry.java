/*
 * どこで: Team Balancer サービス層
 * 何を: このプロセスが所有する稼働中セッションを ID で引けるよう保持する
 * なぜ: 状態機械はメモリ上にのみ存在し、永続スナップショットは復旧用の写しに過ぎないため
 */
package com.example.teambalancer.service;

import com.example.teambalancer.config.BalancerProperties;
import com.example.teambalancer.model.SessionState;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class SessionRegistry {

  private final ConcurrentMap<String, SessionStateMachine> sessions = new ConcurrentHashMap<>();
  // 復旧前の ID -> 復旧後の ID
  private final ConcurrentMap<String, String> aliases = new ConcurrentHashMap<>();
  // 解放済み ID -> 終端状態。sessionTtl 経過で消える。
  private final ConcurrentMap<String, Retired> retired = new ConcurrentHashMap<>();
  private final BalancerMetrics metrics;
  private final BalancerProperties properties;
  private final Clock clock;

  public SessionRegistry(BalancerMetrics metrics, BalancerProperties properties, Clock clock) {
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
  }

  public void register(SessionStateMachine machine) {
    sessions.put(machine.sessionId(), machine);
    metrics.updateLiveSessions(sessions.size());
  }

  /** 役割: 復旧で ID が変わったセッションを旧 ID でも引けるようにする。 */
  public void alias(String previousSessionId, String sessionId) {
    aliases.put(previousSessionId, sessionId);
  }

  public Optional<SessionStateMachine> find(String sessionId) {
    final SessionStateMachine machine = sessions.get(sessionId);
    if (machine != null) {
      return Optional.of(machine);
    }
    final String current = aliases.get(sessionId);
    return current == null ? Optional.empty() : Optional.ofNullable(sessions.get(current));
  }

  public boolean contains(String sessionId) {
    return sessions.containsKey(sessionId);
  }

  /** 役割: チャンネル内で最も新しい稼働中セッションを返す。 */
  public Optional<SessionStateMachine> latestInChannel(String guildId, String channelId) {
    return sessions.values().stream()
        .filter(
            machine ->
                machine.location().guildId().equals(guildId)
                    && machine.location().channelId().equals(channelId))
        .max(
            Comparator.comparing(SessionStateMachine::createdAt)
                .thenComparing(SessionStateMachine::sessionId));
  }

  public void remove(String sessionId) {
    if (sessions.remove(sessionId) != null) {
      aliases.values().removeIf(sessionId::equals);
      metrics.updateLiveSessions(sessions.size());
    }
  }

  /**
   * 役割: 終端に達したセッションを稼働中一覧から外し、終端状態だけを一定時間覚えておく。
   * 動作: 旧 ID (alias) も同じ終端状態で記録する。記録は sessionTtl 経過後に消える。
   * 前提: machine は終端状態であること。
   */
  public void retire(SessionStateMachine machine) {
    final Instant now = Instant.now(clock);
    pruneRetired(now);
    final String sessionId = machine.sessionId();
    final Retired entry = new Retired(machine.state(), now.plus(properties.sessionTtl()));
    aliases.forEach(
        (previous, current) -> {
          if (current.equals(sessionId)) {
            retired.put(previous, entry);
          }
        });
    retired.put(sessionId, entry);
    remove(sessionId);
  }

  /** 役割: 解放済みセッションの終端状態を返す。記録が期限切れなら空。 */
  public Optional<SessionState> retiredState(String sessionId) {
    final Retired entry = retired.get(sessionId);
    if (entry == null) {
      return Optional.empty();
    }
    if (!Instant.now(clock).isBefore(entry.until())) {
      retired.remove(sessionId, entry);
      return Optional.empty();
    }
    return Optional.of(entry.state());
  }

  public void pruneRetired(Instant now) {
    retired.values().removeIf(entry -> !now.isBefore(entry.until()));
  }

  public Collection<SessionStateMachine> all() {
    return List.copyOf(sessions.values());
  }

  public int size() {
    return sessions.size();
  }

  private record Retired(SessionState state, Instant until) {}
}
