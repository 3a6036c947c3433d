/*
 * どこで: Team Balancer サービス層
 * 何を: NATS 無効時に描画をログ出力で代替する
 * なぜ: ローカル実行/テストでチャット基盤なしでもセッションを操作できるようにするため
 */
package com.example.teambalancer.service;

import com.example.teambalancer.model.SessionLocation;
import com.example.teambalancer.model.SessionView;
import com.example.teambalancer.model.TerminalReason;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LoggingSessionRenderer implements SessionRenderer {

  private static final Logger logger = LoggerFactory.getLogger(LoggingSessionRenderer.class);

  @Override
  public String render(SessionLocation location, SessionView view) {
    final String surfaceRef =
        location.surfaceRef() == null ? "local-" + view.sessionId() : location.surfaceRef();
    logger.info(
        "session render sessionId={} state={} participants={}/{} ratingGap={} surfaceRef={}",
        view.sessionId(),
        view.state(),
        view.participantCount(),
        view.requiredPlayers(),
        view.ratingGap(),
        surfaceRef);
    return surfaceRef;
  }

  @Override
  public void renderTerminal(SessionLocation location, SessionView view, TerminalReason reason) {
    logger.info(
        "session render terminal sessionId={} reason={} surfaceRef={}",
        view.sessionId(),
        reason,
        location.surfaceRef());
  }

  @Override
  public Optional<SessionLocation> resolveLocation(SessionLocation location) {
    // ローカル描画では描画面が消えることはない。
    return Optional.of(location);
  }
}
