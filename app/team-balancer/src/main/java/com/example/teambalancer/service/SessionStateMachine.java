/*
 * どこで: Team Balancer サービス層
 * 何を: 1 セッションのライフサイクル (募集/バランス/調整/確定/取消/期限切れ) を管理する
 * なぜ: 同一セッションへの操作を直列化し、受理した遷移ごとに永続化と再描画を行うため
 */
package com.example.teambalancer.service;

import com.example.teambalancer.model.Participant;
import com.example.teambalancer.model.RatingResolution;
import com.example.teambalancer.model.SessionErrorCode;
import com.example.teambalancer.model.SessionLocation;
import com.example.teambalancer.model.SessionOutcome;
import com.example.teambalancer.model.SessionSnapshot;
import com.example.teambalancer.model.SessionState;
import com.example.teambalancer.model.SessionView;
import com.example.teambalancer.model.TeamSplit;
import com.example.teambalancer.model.TerminalReason;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SessionStateMachine {

  private static final Logger logger = LoggerFactory.getLogger(SessionStateMachine.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final SessionCollaborators collaborators;
  private final String sessionId;
  private final Instant createdAt;
  private final List<Participant> participants;
  private SessionLocation location;
  private SessionState state;
  private TeamSplit teams;
  private List<String> failedParticipants = List.of();

  SessionStateMachine(
      SessionCollaborators collaborators,
      String sessionId,
      SessionState state,
      SessionLocation location,
      Instant createdAt,
      List<Participant> participants,
      TeamSplit teams) {
    this.collaborators = collaborators;
    this.sessionId = sessionId;
    this.state = state;
    this.location = location;
    this.createdAt = createdAt;
    this.participants = new ArrayList<>(participants);
    this.teams = teams;
  }

  public String sessionId() {
    return sessionId;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public SessionState state() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  public SessionLocation location() {
    lock.lock();
    try {
      return location;
    } finally {
      lock.unlock();
    }
  }

  public SessionView view() {
    lock.lock();
    try {
      expireIfDueLocked(now());
      return buildView();
    } finally {
      lock.unlock();
    }
  }

  public SessionSnapshot snapshot() {
    lock.lock();
    try {
      return buildSnapshot();
    } finally {
      lock.unlock();
    }
  }

  /**
   * 役割: 作成直後/復旧直後の状態をそのまま描画・永続化する。
   * 動作: 描画面のハンドルが払い出されれば location に取り込む。描画面が消えていれば SESSION_UNAVAILABLE。
   */
  public SessionOutcome announce(String transition) {
    lock.lock();
    try {
      return publish(transition);
    } finally {
      lock.unlock();
    }
  }

  public SessionOutcome join(String participantId, String displayName) {
    lock.lock();
    try {
      final SessionOutcome terminal = rejectIfTerminal();
      if (terminal != null) {
        return terminal;
      }
      if (state != SessionState.OPEN) {
        return reject(SessionErrorCode.INVALID_STATE, "session is not accepting players: " + state);
      }
      if (collaborators.identityLinks().findHandle(participantId).isEmpty()) {
        return reject(SessionErrorCode.NOT_LINKED, "participant has no linked rating profile");
      }
      if (indexOf(participantId) >= 0) {
        return reject(SessionErrorCode.ALREADY_JOINED, "participant already joined");
      }
      if (participants.size() >= requiredPlayers()) {
        return reject(SessionErrorCode.FULL, "session is full");
      }
      participants.add(Participant.unrated(participantId, displayName));
      return publish("join");
    } finally {
      lock.unlock();
    }
  }

  public SessionOutcome leave(String participantId) {
    lock.lock();
    try {
      final SessionOutcome terminal = rejectIfTerminal();
      if (terminal != null) {
        return terminal;
      }
      if (state != SessionState.OPEN) {
        return reject(SessionErrorCode.INVALID_STATE, "roster is frozen: " + state);
      }
      final int index = indexOf(participantId);
      if (index < 0) {
        return reject(SessionErrorCode.NOT_MEMBER, "participant is not in the session");
      }
      participants.remove(index);
      return publish("leave");
    } finally {
      lock.unlock();
    }
  }

  /**
   * 役割: 定員に達したロスターのレーティングを照会し、2 チームへ分割する。
   * 動作: BALANCING へ遷移してからロックを離して一括照会し、全件の結果が揃った後に再ロックして BALANCED か FAILED
   * へ遷移する。照会中に取消/期限切れとなった場合は結果を捨てる。失敗時にロスターは巻き戻さない。
   */
  public SessionOutcome start() {
    final List<Participant> roster;
    lock.lock();
    try {
      final SessionOutcome terminal = rejectIfTerminal();
      if (terminal != null) {
        return terminal;
      }
      if (state == SessionState.BALANCED) {
        return reject(SessionErrorCode.ALREADY_BALANCED, "teams have already been created");
      }
      if (state != SessionState.OPEN) {
        return reject(SessionErrorCode.INVALID_STATE, "balancing already in progress");
      }
      if (participants.size() != requiredPlayers()) {
        return reject(
            SessionErrorCode.WRONG_SIZE,
            "need exactly "
                + requiredPlayers()
                + " players, currently have "
                + participants.size());
      }
      state = SessionState.BALANCING;
      roster = List.copyOf(participants);
      final SessionOutcome entered = publish("start");
      if (!entered.isAccepted()) {
        return entered;
      }
    } finally {
      lock.unlock();
    }

    final Instant startedAt = now();
    final RatingResolution resolution = resolveRatings(roster);

    lock.lock();
    try {
      expireIfDueLocked(now());
      if (state != SessionState.BALANCING) {
        logger.info(
            "dropping rating results for session no longer balancing sessionId={} state={}",
            sessionId,
            state);
        return reject(SessionErrorCode.SESSION_TERMINAL, "session is " + state);
      }
      collaborators.metrics().recordBalancingDuration(Duration.between(startedAt, now()));
      if (!resolution.isComplete()) {
        state = SessionState.FAILED;
        failedParticipants = resolution.failedParticipants();
        logger.warn(
            "balancing failed sessionId={} failedParticipants={}", sessionId, failedParticipants);
        final SessionView view = publishTerminal("partial_failure", null);
        return SessionOutcome.partialFailure(view, failedParticipants);
      }
      participants.clear();
      participants.addAll(resolution.rated());
      teams = collaborators.engine().balance(resolution.rated());
      state = SessionState.BALANCED;
      return publish("balanced");
    } finally {
      lock.unlock();
    }
  }

  public SessionOutcome swap(String teamAPlayerId, String teamBPlayerId) {
    lock.lock();
    try {
      final SessionOutcome rejected = rejectUnlessBalanced();
      if (rejected != null) {
        return rejected;
      }
      try {
        teams = collaborators.engine().swap(teams, teamAPlayerId, teamBPlayerId);
      } catch (PlayerNotFoundException ex) {
        return reject(SessionErrorCode.PLAYER_NOT_FOUND, ex.getMessage());
      }
      return publish("swap");
    } finally {
      lock.unlock();
    }
  }

  public SessionOutcome rebalance() {
    lock.lock();
    try {
      final SessionOutcome rejected = rejectUnlessBalanced();
      if (rejected != null) {
        return rejected;
      }
      teams = collaborators.engine().rebalance(teams);
      return publish("rebalance");
    } finally {
      lock.unlock();
    }
  }

  public SessionOutcome finalizeTeams() {
    lock.lock();
    try {
      final SessionOutcome rejected = rejectUnlessBalanced();
      if (rejected != null) {
        return rejected;
      }
      state = SessionState.FINALIZED;
      return SessionOutcome.accepted(publishTerminal("finalize", null));
    } finally {
      lock.unlock();
    }
  }

  public SessionOutcome cancel() {
    lock.lock();
    try {
      final SessionOutcome terminal = rejectIfTerminal();
      if (terminal != null) {
        return terminal;
      }
      state = SessionState.CANCELLED;
      return SessionOutcome.accepted(publishTerminal("cancel", TerminalReason.CANCELLED));
    } finally {
      lock.unlock();
    }
  }

  /**
   * 役割: 作成から固定時間が経過していれば EXPIRED へ遷移する。
   * 動作: 遷移した場合のみ true。操作の有無に関係なく createdAt 起点で判定する。
   */
  public boolean expireIfDue(Instant now) {
    lock.lock();
    try {
      return expireIfDueLocked(now);
    } finally {
      lock.unlock();
    }
  }

  private boolean expireIfDueLocked(Instant now) {
    if (state.isTerminal() || now.isBefore(expiresAt())) {
      return false;
    }
    state = SessionState.EXPIRED;
    logger.info("session expired sessionId={} createdAt={}", sessionId, createdAt);
    publishTerminal("expire", TerminalReason.EXPIRED);
    return true;
  }

  private RatingResolution resolveRatings(List<Participant> roster) {
    try {
      return collaborators.ratingResolver().resolve(roster);
    } catch (RuntimeException ex) {
      // 照会自体が投入できなかった場合はロスター全員を失敗扱いにする
      logger.warn("rating lookup could not run sessionId={}", sessionId, ex);
      collaborators.metrics().recordWorkerError("rating_lookup");
      return new RatingResolution(
          List.of(), roster.stream().map(Participant::externalId).toList());
    }
  }

  private SessionOutcome rejectIfTerminal() {
    expireIfDueLocked(now());
    if (state.isTerminal()) {
      return reject(SessionErrorCode.SESSION_TERMINAL, "session is " + state);
    }
    return null;
  }

  private SessionOutcome rejectUnlessBalanced() {
    final SessionOutcome terminal = rejectIfTerminal();
    if (terminal != null) {
      return terminal;
    }
    if (state != SessionState.BALANCED) {
      return reject(SessionErrorCode.INVALID_STATE, "teams have not been created: " + state);
    }
    return null;
  }

  private SessionOutcome reject(SessionErrorCode error, String message) {
    collaborators.metrics().recordRejection(error.name());
    logger.debug("session transition rejected sessionId={} error={}", sessionId, error);
    return SessionOutcome.rejected(error, message);
  }

  private SessionOutcome publish(String transition) {
    collaborators.metrics().recordTransition(transition);
    try {
      final String surfaceRef = collaborators.renderer().render(location, buildView());
      if (surfaceRef != null && !surfaceRef.equals(location.surfaceRef())) {
        location = location.withSurfaceRef(surfaceRef);
      }
    } catch (StaleSurfaceException ex) {
      logger.info("rendering surface gone, closing session sessionId={}", sessionId);
      state = SessionState.CANCELLED;
      collaborators.metrics().recordTransition("unavailable");
      discard();
      return reject(SessionErrorCode.SESSION_UNAVAILABLE, "session no longer available");
    } catch (RuntimeException ex) {
      logger.warn("session render failed sessionId={} transition={}", sessionId, transition, ex);
    }
    persist();
    return SessionOutcome.accepted(buildView());
  }

  private SessionView publishTerminal(String transition, TerminalReason reason) {
    collaborators.metrics().recordTransition(transition);
    final SessionView view = buildView();
    try {
      if (reason == null) {
        collaborators.renderer().render(location, view);
      } else {
        collaborators.renderer().renderTerminal(location, view, reason);
      }
    } catch (RuntimeException ex) {
      logger.warn(
          "session terminal render failed sessionId={} transition={}", sessionId, transition, ex);
    }
    discard();
    return view;
  }

  private void persist() {
    try {
      collaborators.store().save(buildSnapshot());
    } catch (RuntimeException ex) {
      // メモリ上のセッションは継続する。次の書き込みが成功するまで復旧対象外。
      logger.warn("session snapshot save failed sessionId={}", sessionId, ex);
      collaborators.metrics().recordPersistenceError("save");
    }
  }

  private void discard() {
    try {
      collaborators.store().delete(sessionId);
    } catch (RuntimeException ex) {
      logger.warn("session snapshot delete failed sessionId={}", sessionId, ex);
      collaborators.metrics().recordPersistenceError("delete");
    }
  }

  private SessionView buildView() {
    final BalancingEngine engine = collaborators.engine();
    final boolean aging =
        !state.isTerminal()
            && Duration.between(createdAt, now())
                    .compareTo(collaborators.properties().agingWarningAge())
                > 0;
    return new SessionView(
        sessionId,
        state,
        location,
        requiredPlayers(),
        participants,
        teams.teamA(),
        teams.teamB(),
        engine.stats(teams.teamA()),
        engine.stats(teams.teamB()),
        teams.isEmpty() ? 0 : engine.ratingGap(teams),
        aging,
        failedParticipants,
        createdAt,
        expiresAt());
  }

  private SessionSnapshot buildSnapshot() {
    return new SessionSnapshot(
        sessionId,
        state,
        participants,
        teams.teamA(),
        teams.teamB(),
        createdAt.getEpochSecond(),
        location.guildId(),
        location.channelId(),
        location.surfaceRef());
  }

  private int indexOf(String participantId) {
    for (int i = 0; i < participants.size(); i++) {
      if (participants.get(i).externalId().equals(participantId)) {
        return i;
      }
    }
    return -1;
  }

  private int requiredPlayers() {
    return collaborators.properties().requiredPlayers();
  }

  private Instant expiresAt() {
    return createdAt.plus(collaborators.properties().sessionTtl());
  }

  private Instant now() {
    return Instant.now(collaborators.clock());
  }
}
