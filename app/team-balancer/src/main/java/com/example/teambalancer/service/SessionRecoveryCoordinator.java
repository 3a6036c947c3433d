/*
 * どこで: Team Balancer サービス層
 * 何を: 再起動前に永続化されたセッションを稼働中セッションとして再接続する
 * なぜ: プロセス再起動で進行中の募集/チーム分けを失わないようにするため
 */
package com.example.teambalancer.service;

import com.example.teambalancer.config.BalancerProperties;
import com.example.teambalancer.model.RecoveryReport;
import com.example.teambalancer.model.SessionLocation;
import com.example.teambalancer.model.SessionSnapshot;
import com.example.teambalancer.repository.SessionStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class SessionRecoveryCoordinator {

  private static final Logger logger = LoggerFactory.getLogger(SessionRecoveryCoordinator.class);
  private static final Comparator<SessionSnapshot> NEWEST_FIRST =
      Comparator.comparingLong(SessionSnapshot::createdAt)
          .thenComparing(SessionSnapshot::sessionId)
          .reversed();

  private final SessionStore store;
  private final SessionRenderer renderer;
  private final SessionRegistry registry;
  private final SessionStateMachineFactory factory;
  private final BalancerMetrics metrics;
  private final BalancerProperties properties;
  private final Clock clock;

  public SessionRecoveryCoordinator(
      SessionStore store,
      SessionRenderer renderer,
      SessionRegistry registry,
      SessionStateMachineFactory factory,
      BalancerMetrics metrics,
      BalancerProperties properties,
      Clock clock) {
    this.store = store;
    this.renderer = renderer;
    this.registry = registry;
    this.factory = factory;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void recoverOnStartup() {
    if (!properties.recoveryOnStartup()) {
      logger.info("session recovery on startup disabled");
      return;
    }
    try {
      runRecovery();
    } catch (RuntimeException ex) {
      logger.warn("session recovery on startup failed", ex);
      metrics.recordWorkerError("startup_recovery");
    }
  }

  /**
   * 役割: 永続スナップショットを一括走査し、再接続するか破棄するかを決める。
   * 動作: 期限切れ/終端は破棄する。チャンネルごとに createdAt が最新の 1 件だけを候補とし、それより古いものは描画面の
   * 解決可否に関係なく破棄する。候補の描画面が解決できなければ破棄する。
   * 前提: このプロセスが稼働中として保持するセッションは対象外 (破棄もしない)。
   */
  public synchronized RecoveryReport runRecovery() {
    final Instant now = Instant.now(clock);
    final Map<String, List<SessionSnapshot>> byChannel = new LinkedHashMap<>();
    int reattached = 0;
    int discarded = 0;

    for (SessionSnapshot snapshot : store.findAll()) {
      if (registry.contains(snapshot.sessionId())) {
        byChannel
            .computeIfAbsent(snapshot.location().channelKey(), key -> new ArrayList<>())
            .add(snapshot);
        continue;
      }
      if (isExpired(snapshot, now) || snapshot.state().isTerminal()) {
        discard(snapshot, "expired_or_terminal");
        discarded++;
        continue;
      }
      byChannel
          .computeIfAbsent(snapshot.location().channelKey(), key -> new ArrayList<>())
          .add(snapshot);
    }

    for (List<SessionSnapshot> channelSnapshots : byChannel.values()) {
      channelSnapshots.sort(NEWEST_FIRST);
      for (int i = 0; i < channelSnapshots.size(); i++) {
        final SessionSnapshot snapshot = channelSnapshots.get(i);
        if (registry.contains(snapshot.sessionId())) {
          continue;
        }
        if (i > 0) {
          discard(snapshot, "superseded");
          discarded++;
        } else if (reattach(snapshot).isPresent()) {
          reattached++;
        } else {
          discarded++;
        }
      }
    }

    final RecoveryReport report = new RecoveryReport(reattached, discarded);
    metrics.recordRecovery("reattached", reattached);
    metrics.recordRecovery("discarded", discarded);
    logger.info("session recovery finished reattached={} discarded={}", reattached, discarded);
    return report;
  }

  /**
   * 役割: 稼働中でない ID への操作を契機に 1 件だけ復旧を試みる。
   * 動作: 期限切れ/終端なら破棄して empty。同じチャンネルにより新しいセッションがあれば描画面の解決可否に
   * 関係なく破棄して empty。描画面を解決できなければ破棄して empty。
   */
  public synchronized Optional<SessionStateMachine> recover(SessionSnapshot snapshot) {
    final Optional<SessionStateMachine> live = registry.find(snapshot.sessionId());
    if (live.isPresent()) {
      return live;
    }
    if (isExpired(snapshot, Instant.now(clock)) || snapshot.state().isTerminal()) {
      discard(snapshot, "expired_or_terminal");
      metrics.recordRecovery("discarded", 1);
      return Optional.empty();
    }
    if (isSuperseded(snapshot)) {
      discard(snapshot, "superseded");
      metrics.recordRecovery("discarded", 1);
      return Optional.empty();
    }
    final Optional<SessionStateMachine> machine = reattach(snapshot);
    metrics.recordRecovery(machine.isPresent() ? "reattached" : "discarded", 1);
    return machine;
  }

  /** 同じチャンネルにより新しい稼働中セッションか永続スナップショットがあれば true。 */
  private boolean isSuperseded(SessionSnapshot snapshot) {
    final SessionLocation location = snapshot.location();
    final Optional<SessionStateMachine> live =
        registry.latestInChannel(location.guildId(), location.channelId());
    if (live.isPresent() && !live.get().createdAt().isBefore(snapshot.createdAtInstant())) {
      return true;
    }
    final Optional<SessionSnapshot> latest;
    try {
      latest = store.findLatestInChannel(location.guildId(), location.channelId());
    } catch (RuntimeException ex) {
      logger.warn("latest snapshot lookup failed sessionId={}", snapshot.sessionId(), ex);
      metrics.recordPersistenceError("find_latest");
      return false;
    }
    return latest
        .filter(newest -> !newest.sessionId().equals(snapshot.sessionId()))
        .filter(newest -> NEWEST_FIRST.compare(newest, snapshot) < 0)
        .isPresent();
  }

  private Optional<SessionStateMachine> reattach(SessionSnapshot snapshot) {
    final Optional<SessionLocation> location = resolveLocation(snapshot);
    if (location.isEmpty()) {
      discard(snapshot, "surface_unresolvable");
      return Optional.empty();
    }
    final SessionStateMachine machine = factory.restore(snapshot, location.get());
    registry.register(machine);
    // 新しいスナップショットを保存してから旧スナップショットを消す。
    if (!machine.announce("recover").isAccepted()) {
      registry.remove(machine.sessionId());
      discard(snapshot, "surface_gone");
      return Optional.empty();
    }
    registry.alias(snapshot.sessionId(), machine.sessionId());
    discard(snapshot, "reattached");
    logger.info(
        "session reattached previousSessionId={} sessionId={} state={}",
        snapshot.sessionId(),
        machine.sessionId(),
        machine.state());
    return Optional.of(machine);
  }

  private Optional<SessionLocation> resolveLocation(SessionSnapshot snapshot) {
    try {
      return renderer.resolveLocation(snapshot.location());
    } catch (RuntimeException ex) {
      logger.warn("surface resolution failed sessionId={}", snapshot.sessionId(), ex);
      return Optional.empty();
    }
  }

  private boolean isExpired(SessionSnapshot snapshot, Instant now) {
    return !now.isBefore(snapshot.createdAtInstant().plus(properties.sessionTtl()));
  }

  private void discard(SessionSnapshot snapshot, String reason) {
    try {
      store.delete(snapshot.sessionId());
      logger.info(
          "session snapshot discarded sessionId={} reason={}", snapshot.sessionId(), reason);
    } catch (RuntimeException ex) {
      logger.warn("session snapshot discard failed sessionId={}", snapshot.sessionId(), ex);
      metrics.recordPersistenceError("delete");
    }
  }
}
