/*
 * どこで: Team Balancer サービス層
 * 何を: ロスター全員のレーティングを並列に照会し、全件揃うまで待ち合わせる
 * なぜ: 照会は独立した読み取りだが、状態遷移は全結果が出揃ってから 1 回だけ行うため
 */
package com.example.teambalancer.service;

import com.example.teambalancer.config.BalancerProperties;
import com.example.teambalancer.model.Participant;
import com.example.teambalancer.model.RatingResolution;
import com.example.teambalancer.repository.IdentityLinkRepository;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ParticipantRatingResolver {

  private static final Logger logger = LoggerFactory.getLogger(ParticipantRatingResolver.class);

  private final IdentityLinkRepository identityLinkRepository;
  private final RatingLookup ratingLookup;
  private final ExecutorService ratingLookupExecutor;
  private final BalancerMetrics metrics;
  private final Duration lookupTimeout;

  public ParticipantRatingResolver(
      IdentityLinkRepository identityLinkRepository,
      RatingLookup ratingLookup,
      ExecutorService ratingLookupExecutor,
      BalancerMetrics metrics,
      BalancerProperties properties) {
    this.identityLinkRepository = identityLinkRepository;
    this.ratingLookup = ratingLookup;
    this.ratingLookupExecutor = ratingLookupExecutor;
    this.metrics = metrics;
    this.lookupTimeout = properties.ratingLookupTimeout();
  }

  /**
   * 役割: 参加者ごとにハンドル解決とレーティング照会を 1 回ずつ行う。
   * 動作: 照会は並列実行し、タイムアウト/例外/未登録はその参加者の失敗として扱う。再試行はしない。
   * 前提: roster は join 順であること。結果の rated/failed もその順序を保つ。
   */
  public RatingResolution resolve(List<Participant> roster) {
    final List<CompletableFuture<Optional<Participant>>> futures = new ArrayList<>(roster.size());
    for (Participant participant : roster) {
      futures.add(
          CompletableFuture.supplyAsync(() -> lookup(participant), ratingLookupExecutor)
              .orTimeout(lookupTimeout.toMillis(), TimeUnit.MILLISECONDS)
              .exceptionally(ex -> onLookupFailure(participant, ex)));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

    final List<Participant> rated = new ArrayList<>(roster.size());
    final List<String> failed = new ArrayList<>();
    for (int i = 0; i < roster.size(); i++) {
      final Optional<Participant> result = futures.get(i).join();
      if (result.isPresent()) {
        rated.add(result.get());
      } else {
        failed.add(roster.get(i).externalId());
      }
    }
    return new RatingResolution(rated, failed);
  }

  private Optional<Participant> lookup(Participant participant) {
    final long startedAt = System.nanoTime();
    final Optional<String> handle = identityLinkRepository.findHandle(participant.externalId());
    if (handle.isEmpty()) {
      logger.warn(
          "participant lost identity link before rating lookup userId={}",
          participant.externalId());
      metrics.recordRatingLookup("not_linked", System.nanoTime() - startedAt);
      return Optional.empty();
    }
    final OptionalInt rating = ratingLookup.resolveRating(handle.get());
    if (rating.isEmpty()) {
      logger.info("rating not found userId={} handle={}", participant.externalId(), handle.get());
      metrics.recordRatingLookup("not_found", System.nanoTime() - startedAt);
      return Optional.empty();
    }
    metrics.recordRatingLookup("resolved", System.nanoTime() - startedAt);
    // 表示名が無い参加者は外部ハンドルで表示する。
    final String displayName =
        participant.displayName().equals(participant.externalId())
            ? handle.get()
            : participant.displayName();
    return Optional.of(participant.withRating(displayName, rating.getAsInt()));
  }

  private Optional<Participant> onLookupFailure(Participant participant, Throwable ex) {
    final Throwable cause =
        ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    if (cause instanceof TimeoutException) {
      logger.warn(
          "rating lookup timed out userId={} timeout={}", participant.externalId(), lookupTimeout);
      metrics.recordRatingLookup("timeout", lookupTimeout.toNanos());
    } else {
      logger.warn("rating lookup failed userId={}", participant.externalId(), cause);
      metrics.recordRatingLookup("error", 0L);
    }
    return Optional.empty();
  }
}
