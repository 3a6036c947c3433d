package com.example.teambalancer.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class BalancerMetrics {

  private final MeterRegistry meterRegistry;
  private final Timer balancingDurationTimer;
  private final AtomicLong liveSessions = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> rejectionCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> persistenceErrorCounters =
      new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> ratingLookupTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> recoveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> workerErrorCounters = new ConcurrentHashMap<>();

  public BalancerMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.balancingDurationTimer =
        Timer.builder("tb.session.balancing.duration")
            .description("Time from start to balanced or partial failure")
            .register(meterRegistry);
    Gauge.builder("tb.sessions.live", liveSessions, AtomicLong::get)
        .description("Sessions currently owned by this process")
        .register(meterRegistry);
  }

  public void recordTransition(String transition) {
    transitionCounters.computeIfAbsent(transition, this::registerTransitionCounter).increment();
  }

  public void recordRejection(String errorCode) {
    rejectionCounters.computeIfAbsent(errorCode, this::registerRejectionCounter).increment();
  }

  public void recordPersistenceError(String operation) {
    persistenceErrorCounters
        .computeIfAbsent(operation, this::registerPersistenceErrorCounter)
        .increment();
  }

  public void recordRatingLookup(String result, long elapsedNanos) {
    ratingLookupTimers
        .computeIfAbsent(result, this::registerRatingLookupTimer)
        .record(Math.max(0, elapsedNanos), TimeUnit.NANOSECONDS);
  }

  public void recordBalancingDuration(Duration duration) {
    if (duration.isNegative()) {
      return;
    }
    balancingDurationTimer.record(duration);
  }

  public void recordRecovery(String result, int count) {
    if (count <= 0) {
      return;
    }
    recoveryCounters.computeIfAbsent(result, this::registerRecoveryCounter).increment(count);
  }

  public void recordWorkerError(String worker) {
    workerErrorCounters.computeIfAbsent(worker, this::registerWorkerErrorCounter).increment();
  }

  public void updateLiveSessions(long count) {
    liveSessions.set(Math.max(0, count));
  }

  private Counter registerTransitionCounter(String transition) {
    return Counter.builder("tb.session.transition.total")
        .tags(Tags.of("transition", transition))
        .register(meterRegistry);
  }

  private Counter registerRejectionCounter(String errorCode) {
    return Counter.builder("tb.session.rejected.total")
        .tags(Tags.of("error", errorCode))
        .register(meterRegistry);
  }

  private Counter registerPersistenceErrorCounter(String operation) {
    return Counter.builder("tb.persistence.error.total")
        .tags(Tags.of("operation", operation))
        .register(meterRegistry);
  }

  private Timer registerRatingLookupTimer(String result) {
    return Timer.builder("tb.rating.lookup.duration")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerRecoveryCounter(String result) {
    return Counter.builder("tb.recovery.total")
        .tags(Tags.of("result", result))
        .register(meterRegistry);
  }

  private Counter registerWorkerErrorCounter(String worker) {
    return Counter.builder("tb.worker.error.total")
        .tags(Tags.of("worker", worker))
        .register(meterRegistry);
  }
}
