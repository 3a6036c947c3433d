package com.example.teambalancer.model;

/** 描画面を非アクティブ化するときの理由。 */
public enum TerminalReason {
  CANCELLED,
  EXPIRED,
  UNAVAILABLE
}
