/*
 * どこで: Team Balancer サービス層
 * 何を: ローカルユーザーと外部プレイヤーハンドルの連携/解除/レーティング照会を行う
 * なぜ: join の前提となる連携を、存在確認と統計有無の確認を済ませた上で登録するため
 */
package com.example.teambalancer.service;

import com.example.teambalancer.api.IdentityNotLinkedException;
import com.example.teambalancer.api.InvalidBalancerRequestException;
import com.example.teambalancer.api.MissingGameStatsException;
import com.example.teambalancer.api.PlayerProfileNotFoundException;
import com.example.teambalancer.api.response.LinkedIdentityResponse;
import com.example.teambalancer.api.response.PlayerRatingResponse;
import com.example.teambalancer.api.response.UnlinkIdentityResponse;
import com.example.teambalancer.model.IdentityLink;
import com.example.teambalancer.model.PlayerStats;
import com.example.teambalancer.repository.IdentityLinkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class IdentityLinkService {

  private static final Logger logger = LoggerFactory.getLogger(IdentityLinkService.class);

  private final IdentityLinkRepository identityLinkRepository;
  private final RatingLookup ratingLookup;

  public IdentityLinkService(
      IdentityLinkRepository identityLinkRepository, RatingLookup ratingLookup) {
    this.identityLinkRepository = identityLinkRepository;
    this.ratingLookup = ratingLookup;
  }

  /**
   * 役割: 入力からハンドルを取り出し、外部サービスで確認してから連携を上書き保存する。
   * 動作: 未登録は PlayerProfileNotFoundException、対象ゲームの統計なしは MissingGameStatsException。
   */
  public LinkedIdentityResponse link(String userId, String profile) {
    requireUserId(userId);
    final String handle = ProfileHandles.extract(profile);
    if (handle.isEmpty()) {
      throw new InvalidBalancerRequestException("profile is required");
    }
    if (!ratingLookup.verifyHandleExists(handle)) {
      throw new PlayerProfileNotFoundException(handle);
    }
    final PlayerStats stats =
        ratingLookup
            .findPlayerStats(handle)
            .orElseThrow(() -> new PlayerProfileNotFoundException(handle));
    if (!stats.hasGameStats()) {
      throw new MissingGameStatsException(handle);
    }
    final IdentityLink link = identityLinkRepository.link(userId, stats.handle());
    logger.info("identity linked userId={} handle={}", userId, link.handle());
    return new LinkedIdentityResponse(
        link.userId(),
        link.handle(),
        stats.rating(),
        stats.skillLevel(),
        link.lastUpdated().toString());
  }

  public UnlinkIdentityResponse unlink(String userId) {
    requireUserId(userId);
    if (!identityLinkRepository.unlink(userId)) {
      throw new IdentityNotLinkedException(userId);
    }
    logger.info("identity unlinked userId={}", userId);
    return new UnlinkIdentityResponse(userId, true);
  }

  public PlayerRatingResponse myRating(String userId) {
    requireUserId(userId);
    final String handle =
        identityLinkRepository
            .findHandle(userId)
            .orElseThrow(() -> new IdentityNotLinkedException(userId));
    final PlayerStats stats =
        ratingLookup
            .findPlayerStats(handle)
            .orElseThrow(() -> new PlayerProfileNotFoundException(handle));
    if (!stats.hasGameStats()) {
      throw new MissingGameStatsException(handle);
    }
    return new PlayerRatingResponse(
        stats.handle(), stats.rating(), stats.skillLevel(), stats.avatar());
  }

  private void requireUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new InvalidBalancerRequestException("X-User-Id is required");
    }
  }
}
