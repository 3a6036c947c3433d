/*
 * どこで: Team Balancer サービス層
 * 何を: プロフィール URL / @付きハンドル / 素のハンドルからハンドルを取り出す
 * なぜ: 利用者が貼り付ける形式の揺れを連携前に吸収するため
 */
package com.example.teambalancer.service;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ProfileHandles {

  private static final Pattern PROFILE_URL =
      Pattern.compile(
          "^https?://(?:www\\.)?faceit\\.com/(?:[a-z]{2}/)?players?/([^/?#]+)",
          Pattern.CASE_INSENSITIVE);

  private ProfileHandles() {}

  /** 動作: 取り出せない (空白のみ等) 場合は空文字を返す。 */
  public static String extract(String input) {
    if (input == null) {
      return "";
    }
    final String trimmed = input.trim();
    final Matcher matcher = PROFILE_URL.matcher(trimmed);
    if (matcher.find()) {
      return matcher.group(1);
    }
    final String handle = trimmed.startsWith("@") ? trimmed.substring(1) : trimmed;
    return handle.trim();
  }
}
