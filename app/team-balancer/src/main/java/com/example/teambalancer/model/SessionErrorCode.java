/*
 * どこで: Team Balancer ドメインモデル
 * 何を: セッション操作が拒否された理由を列挙する
 * なぜ: 例外ではなく型付きの結果として呼び出し側へ返すため
 */
package com.example.teambalancer.model;

public enum SessionErrorCode {
  NOT_LINKED,
  ALREADY_JOINED,
  FULL,
  NOT_MEMBER,
  WRONG_SIZE,
  ALREADY_BALANCED,
  PLAYER_NOT_FOUND,
  PARTIAL_FAILURE,
  INVALID_STATE,
  SESSION_TERMINAL,
  SESSION_NOT_FOUND,
  SESSION_UNAVAILABLE
}
