/*
 * どこで: Team Balancer API
 * 何を: リクエスト妥当性エラーを表現する
 * なぜ: バリデーション失敗を 400 へ正規化するため
 */
package com.example.teambalancer.api;

public class InvalidBalancerRequestException extends RuntimeException {
  public InvalidBalancerRequestException(String message) {
    super(message);
  }
}
