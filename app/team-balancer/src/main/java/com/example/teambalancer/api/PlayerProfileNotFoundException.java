/*
 * どこで: Team Balancer API
 * 何を: 外部レーティングサービスにハンドルが存在しないことを表現する
 * なぜ: 連携時の入力ミスを 404 として利用者へ返すため
 */
package com.example.teambalancer.api;

public class PlayerProfileNotFoundException extends RuntimeException {
  public PlayerProfileNotFoundException(String handle) {
    super("player profile not found: " + handle);
  }
}
