/*
 * どこで: Team Balancer サービス層
 * 何を: セッション ID から状態機械を引き当て、各操作を委譲する
 * なぜ: 稼働中でない ID への操作で復旧を試み、終端に達したセッションを解放するため
 */
package com.example.teambalancer.service;

import com.example.teambalancer.model.RecoveryReport;
import com.example.teambalancer.model.SessionErrorCode;
import com.example.teambalancer.model.SessionLocation;
import com.example.teambalancer.model.SessionOutcome;
import com.example.teambalancer.model.SessionSnapshot;
import com.example.teambalancer.model.SessionState;
import com.example.teambalancer.repository.SessionStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SessionService {

  private static final Logger logger = LoggerFactory.getLogger(SessionService.class);

  private final SessionRegistry registry;
  private final SessionStateMachineFactory factory;
  private final SessionRecoveryCoordinator recoveryCoordinator;
  private final SessionStore store;
  private final BalancerMetrics metrics;
  private final Clock clock;

  public SessionService(
      SessionRegistry registry,
      SessionStateMachineFactory factory,
      SessionRecoveryCoordinator recoveryCoordinator,
      SessionStore store,
      BalancerMetrics metrics,
      Clock clock) {
    this.registry = registry;
    this.factory = factory;
    this.recoveryCoordinator = recoveryCoordinator;
    this.store = store;
    this.metrics = metrics;
    this.clock = clock;
  }

  public SessionOutcome createSession(SessionLocation location) {
    final SessionStateMachine machine = factory.create(location);
    registry.register(machine);
    final SessionOutcome outcome = machine.announce("create");
    releaseIfTerminal(machine);
    if (outcome.isAccepted()) {
      logger.info(
          "session created sessionId={} channel={}", machine.sessionId(), location.channelKey());
    }
    return outcome;
  }

  public SessionOutcome view(String sessionId) {
    return withSession(sessionId, machine -> SessionOutcome.accepted(machine.view()));
  }

  /**
   * 役割: チャンネルで最も新しいセッションを返す。
   * 動作: 稼働中のものを優先し、無ければ永続スナップショットから復旧を試みる。
   */
  public SessionOutcome latestInChannel(String guildId, String channelId) {
    final Optional<SessionStateMachine> live = registry.latestInChannel(guildId, channelId);
    if (live.isPresent()) {
      return withSession(live.get().sessionId(), m -> SessionOutcome.accepted(m.view()));
    }
    final Optional<SessionSnapshot> persisted;
    try {
      persisted = store.findLatestInChannel(guildId, channelId);
    } catch (RuntimeException ex) {
      logger.warn("latest session lookup failed guildId={} channelId={}", guildId, channelId, ex);
      metrics.recordPersistenceError("find_latest");
      return reject(SessionErrorCode.SESSION_NOT_FOUND, "no session in channel");
    }
    if (persisted.isEmpty()) {
      return reject(SessionErrorCode.SESSION_NOT_FOUND, "no session in channel");
    }
    return withSession(persisted.get().sessionId(), m -> SessionOutcome.accepted(m.view()));
  }

  public SessionOutcome join(String sessionId, String userId, String displayName) {
    return withSession(sessionId, machine -> machine.join(userId, displayName));
  }

  public SessionOutcome leave(String sessionId, String userId) {
    return withSession(sessionId, machine -> machine.leave(userId));
  }

  public SessionOutcome start(String sessionId) {
    return withSession(sessionId, SessionStateMachine::start);
  }

  public SessionOutcome swap(String sessionId, String teamAPlayerId, String teamBPlayerId) {
    return withSession(sessionId, machine -> machine.swap(teamAPlayerId, teamBPlayerId));
  }

  public SessionOutcome rebalance(String sessionId) {
    return withSession(sessionId, SessionStateMachine::rebalance);
  }

  public SessionOutcome finalizeTeams(String sessionId) {
    return withSession(sessionId, SessionStateMachine::finalizeTeams);
  }

  public SessionOutcome cancel(String sessionId) {
    return withSession(sessionId, SessionStateMachine::cancel);
  }

  public RecoveryReport runRecovery() {
    return recoveryCoordinator.runRecovery();
  }

  /** 役割: 稼働中セッションのうち寿命を過ぎたものを EXPIRED にして解放する。 動作: 遷移した件数を返す。 */
  public int expireDueSessions() {
    final Instant now = Instant.now(clock);
    registry.pruneRetired(now);
    int expired = 0;
    for (SessionStateMachine machine : registry.all()) {
      if (machine.expireIfDue(now)) {
        expired++;
      }
      releaseIfTerminal(machine);
    }
    return expired;
  }

  private SessionOutcome withSession(
      String sessionId, Function<SessionStateMachine, SessionOutcome> action) {
    final Optional<SessionStateMachine> live = registry.find(sessionId);
    if (live.isPresent()) {
      return apply(live.get(), action);
    }
    final Optional<SessionState> retired = registry.retiredState(sessionId);
    if (retired.isPresent()) {
      return reject(SessionErrorCode.SESSION_TERMINAL, "session is " + retired.get());
    }
    final Optional<SessionSnapshot> persisted;
    try {
      persisted = store.findById(sessionId);
    } catch (RuntimeException ex) {
      logger.warn("session snapshot lookup failed sessionId={}", sessionId, ex);
      metrics.recordPersistenceError("find");
      return reject(SessionErrorCode.SESSION_NOT_FOUND, "session not found");
    }
    if (persisted.isEmpty()) {
      return reject(SessionErrorCode.SESSION_NOT_FOUND, "session not found");
    }
    final Optional<SessionStateMachine> recovered = recoveryCoordinator.recover(persisted.get());
    if (recovered.isEmpty()) {
      return reject(SessionErrorCode.SESSION_UNAVAILABLE, "session no longer available");
    }
    return apply(recovered.get(), action);
  }

  private SessionOutcome apply(
      SessionStateMachine machine, Function<SessionStateMachine, SessionOutcome> action) {
    final SessionOutcome outcome = action.apply(machine);
    releaseIfTerminal(machine);
    return outcome;
  }

  private void releaseIfTerminal(SessionStateMachine machine) {
    if (machine.state().isTerminal()) {
      registry.retire(machine);
    }
  }

  private SessionOutcome reject(SessionErrorCode error, String message) {
    metrics.recordRejection(error.name());
    return SessionOutcome.rejected(error, message);
  }
}
