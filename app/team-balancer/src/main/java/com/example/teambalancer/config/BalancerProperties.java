/*
 * どこで: Team Balancer 設定
 * 何を: 募集人数/セッション寿命/レーティング照会のドメイン設定を保持する
 * なぜ: 環境差分をコード外へ出し、起動時に不正値を検出するため
 */
package com.example.teambalancer.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "balancer")
@Validated
public record BalancerProperties(
    @Positive int requiredPlayers,
    @NotNull Duration sessionTtl,
    @NotNull Duration agingWarningAge,
    @NotNull Duration expirySweepInterval,
    @NotNull Duration ratingLookupTimeout,
    @Positive int ratingLookupConcurrency,
    boolean recoveryOnStartup,
    @NotBlank String keyPrefix) {

  @AssertTrue(message = "balancer.required-players must be even")
  public boolean isRequiredPlayersEven() {
    return requiredPlayers % 2 == 0;
  }

  @AssertTrue(message = "balancer.session-ttl must be positive")
  public boolean isSessionTtlPositive() {
    return isPositiveDuration(sessionTtl);
  }

  @AssertTrue(message = "balancer.aging-warning-age must be positive")
  public boolean isAgingWarningAgePositive() {
    return isPositiveDuration(agingWarningAge);
  }

  @AssertTrue(message = "balancer.expiry-sweep-interval must be positive")
  public boolean isExpirySweepIntervalPositive() {
    return isPositiveDuration(expirySweepInterval);
  }

  @AssertTrue(message = "balancer.rating-lookup-timeout must be positive")
  public boolean isRatingLookupTimeoutPositive() {
    return isPositiveDuration(ratingLookupTimeout);
  }

  public int teamSize() {
    return requiredPlayers / 2;
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
