/*
 * どこで: Team Balancer サービス層
 * 何を: セッションの描画先 (チャット基盤) との境界を抽象化する
 * なぜ: 状態機械はビューモデルを渡すだけにし、描画の詳細と冪等性を境界側に任せるため
 */
package com.example.teambalancer.service;

import com.example.teambalancer.model.SessionLocation;
import com.example.teambalancer.model.SessionView;
import com.example.teambalancer.model.TerminalReason;
import java.util.Optional;

public interface SessionRenderer {

  /**
   * 役割: 現在のビューを描画先へ冪等に再描画する。
   * 動作: 描画面のハンドル (新規作成時は払い出されたもの) を返す。描画面が消えていれば StaleSurfaceException。
   * 前提: 呼び出しはタイムアウトで有界であること。
   */
  String render(SessionLocation location, SessionView view);

  /** 役割: キャンセル/期限切れ時に描画面を非アクティブ化する。 */
  void renderTerminal(SessionLocation location, SessionView view, TerminalReason reason);

  /**
   * 役割: 復旧時に描画面がまだ存在するか確認する。
   * 動作: 解決できればハンドルを付け直した location を返し、解決不能/タイムアウトなら empty。
   */
  Optional<SessionLocation> resolveLocation(SessionLocation location);
}
