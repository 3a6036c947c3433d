/*
 * どこで: Team Balancer Repository 層
 * 何を: 進行中セッションのスナップショット永続化を抽象化する
 * なぜ: Redis 実装詳細を状態機械と復旧処理から切り離すため
 */
package com.example.teambalancer.repository;

import com.example.teambalancer.model.SessionSnapshot;
import java.util.List;
import java.util.Optional;

public interface SessionStore {

  /**
   * 役割: スナップショットを sessionId 単位で丸ごと置き換える。
   * 動作: 本体と channel/作成時刻のインデックスを更新する。失敗時は SessionPersistenceException を送出する。
   * 前提: snapshot.sessionId は空でないこと。
   */
  void save(SessionSnapshot snapshot);

  /** 役割: sessionId からスナップショットを取得する。 動作: 存在しなければ empty を返す。 */
  Optional<SessionSnapshot> findById(String sessionId);

  /**
   * 役割: スナップショットとインデックスを削除する。 動作: 既に存在しない場合も例外にはしない。 前提: sessionId は空でないこと。
   */
  void delete(String sessionId);

  /** 役割: channel 内で最も新しい (createdAt 最大の) スナップショットを返す。 */
  Optional<SessionSnapshot> findLatestInChannel(String guildId, String channelId);

  /** 役割: 永続化済みの全スナップショットを createdAt 昇順で返す。 */
  List<SessionSnapshot> findAll();
}
