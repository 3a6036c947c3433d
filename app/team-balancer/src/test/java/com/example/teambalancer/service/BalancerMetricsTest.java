package com.example.teambalancer.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class BalancerMetricsTest {

  @Test
  void recordsTransitionsRejectionsAndLiveSessions() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final BalancerMetrics metrics = new BalancerMetrics(registry);

    metrics.recordTransition("join");
    metrics.recordTransition("join");
    metrics.recordRejection("FULL");
    metrics.recordPersistenceError("save");
    metrics.recordRatingLookup("resolved", 1_000_000L);
    metrics.recordBalancingDuration(Duration.ofMillis(120));
    metrics.recordRecovery("reattached", 2);
    metrics.recordWorkerError("session_expiry");
    metrics.updateLiveSessions(3);

    assertThat(
            registry.get("tb.session.transition.total").tag("transition", "join").counter().count())
        .isEqualTo(2.0);
    assertThat(registry.get("tb.session.rejected.total").tag("error", "FULL").counter().count())
        .isEqualTo(1.0);
    assertThat(
            registry.get("tb.persistence.error.total").tag("operation", "save").counter().count())
        .isEqualTo(1.0);
    assertThat(
            registry.get("tb.rating.lookup.duration").tag("result", "resolved").timer().count())
        .isEqualTo(1L);
    assertThat(registry.get("tb.session.balancing.duration").timer().count()).isEqualTo(1L);
    assertThat(registry.get("tb.recovery.total").tag("result", "reattached").counter().count())
        .isEqualTo(2.0);
    assertThat(
            registry.get("tb.worker.error.total").tag("worker", "session_expiry").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("tb.sessions.live").gauge().value()).isEqualTo(3.0);
  }

  @Test
  void ignoresNegativeDurationsAndEmptyRecoveryCounts() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final BalancerMetrics metrics = new BalancerMetrics(registry);

    metrics.recordBalancingDuration(Duration.ofMillis(-1));
    metrics.recordRecovery("discarded", 0);
    metrics.updateLiveSessions(-5);

    assertThat(registry.get("tb.session.balancing.duration").timer().count()).isZero();
    assertThat(registry.find("tb.recovery.total").counter()).isNull();
    assertThat(registry.get("tb.sessions.live").gauge().value()).isZero();
  }
}
