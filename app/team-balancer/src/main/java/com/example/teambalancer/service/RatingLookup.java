/*
 * どこで: Team Balancer サービス層
 * 何を: 外部レーティングサービスへの照会を抽象化する
 * なぜ: HTTP クライアントの詳細を状態機械/プロフィール連携から切り離すため
 */
package com.example.teambalancer.service;

import com.example.teambalancer.model.PlayerStats;
import java.util.Optional;
import java.util.OptionalInt;

public interface RatingLookup {

  /**
   * 役割: ハンドルからレーティングを取得する。
   * 動作: プレイヤー未登録/対象ゲームの統計なしは empty。通信失敗は RatingLookupException を送出する。
   */
  OptionalInt resolveRating(String handle);

  /** 役割: ハンドルが外部サービスに存在するか確認する。 */
  boolean verifyHandleExists(String handle);

  /** 役割: レーティング/スキルレベル等の統計を取得する。 動作: プレイヤー未登録なら empty。 */
  Optional<PlayerStats> findPlayerStats(String handle);
}
