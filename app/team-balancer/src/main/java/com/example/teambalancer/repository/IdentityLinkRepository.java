/*
 * どこで: Team Balancer Repository 層
 * 何を: ローカルユーザー ID と外部プレイヤーハンドルの対応表を抽象化する
 * なぜ: join 時の連携確認と start 時のハンドル解決を同じ経路で行うため
 */
package com.example.teambalancer.repository;

import com.example.teambalancer.model.IdentityLink;
import java.util.Optional;

public interface IdentityLinkRepository {

  /** 役割: ユーザーの連携情報を取得する。 動作: 未連携なら empty を返す。 */
  Optional<IdentityLink> findLink(String userId);

  /** 役割: 連携済みハンドルのみを取得する。 */
  default Optional<String> findHandle(String userId) {
    return findLink(userId).map(IdentityLink::handle);
  }

  /** 役割: ハンドルを連携 (上書き) する。 動作: 更新時刻を記録した IdentityLink を返す。 */
  IdentityLink link(String userId, String handle);

  /** 役割: 連携を解除する。 動作: 解除対象が存在した場合のみ true を返す。 */
  boolean unlink(String userId);
}
