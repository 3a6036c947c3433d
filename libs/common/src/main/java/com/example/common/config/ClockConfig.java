/*
 * どこで: Common 共通設定
 * 何を: セッション寿命や参加時刻の判定に使う UTC Clock を提供する
 * なぜ: 期限切れ/経過時間の判定をテストで固定時刻に差し替えられるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  @Bean
  public Clock utcClock() {
    return Clock.systemUTC();
  }
}
