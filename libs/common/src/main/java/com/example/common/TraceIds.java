package com.example.common;

import java.util.UUID;

/** リクエストとメッセージに載せるトレース ID の払い出しと引き継ぎ。 */
public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /**
   * 役割: 上流から渡された ID を優先して引き継ぐ。
   * 動作: 候補のうち最初の空でない値を返し、すべて空なら新しい ID を払い出す。
   */
  public static String firstOrNew(String... candidates) {
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate;
      }
    }
    return newTraceId();
  }
}
