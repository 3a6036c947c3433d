/*
 * どこで: Team Balancer 設定
 * 何を: 描画境界 (NATS request/reply) の subject とタイムアウトを保持する
 * なぜ: チャット基盤アダプタとの接続点を環境ごとに切り替えるため
 */
package com.example.teambalancer.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "balancer.nats")
public record BalancerNatsProperties(
    String renderSubject, String resolveSubject, Duration requestTimeout) {

  public BalancerNatsProperties {
    renderSubject =
        renderSubject == null || renderSubject.isBlank() ? "balancer.render" : renderSubject;
    resolveSubject =
        resolveSubject == null || resolveSubject.isBlank()
            ? "balancer.surface.resolve"
            : resolveSubject;
    requestTimeout = requestTimeout == null ? Duration.ofSeconds(3) : requestTimeout;
  }
}
