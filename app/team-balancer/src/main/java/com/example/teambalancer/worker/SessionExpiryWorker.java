/*
 * どこで: Team Balancer Worker
 * 何を: 寿命を過ぎた稼働中セッションを定期的に EXPIRED へ遷移させる
 * なぜ: 誰も操作しないセッションも固定時間で描画面を非アクティブ化し、スナップショットを消すため
 */
package com.example.teambalancer.worker;

import com.example.teambalancer.service.BalancerMetrics;
import com.example.teambalancer.service.SessionService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "balancer.expiry-worker-enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class SessionExpiryWorker {

  private static final Logger logger = LoggerFactory.getLogger(SessionExpiryWorker.class);

  private final SessionService sessionService;
  private final BalancerMetrics metrics;

  @Scheduled(fixedDelayString = "${balancer.expiry-sweep-interval}")
  public void run() {
    try {
      final int expired = sessionService.expireDueSessions();
      if (expired > 0) {
        logger.info("expired sessions swept count={}", expired);
      }
    } catch (RuntimeException ex) {
      logger.warn("session expiry sweep failed", ex);
      metrics.recordWorkerError("session_expiry");
    }
  }
}
