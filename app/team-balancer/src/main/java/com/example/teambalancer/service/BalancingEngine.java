/*
 * どこで: Team Balancer サービス層
 * 何を: レーティングに基づく 2 チーム分割/入れ替え/再分割を行う純粋関数群
 * なぜ: 状態機械から計算部分を切り離し、決定的な振る舞いを単体で検証するため
 */
package com.example.teambalancer.service;

import com.example.teambalancer.config.BalancerProperties;
import com.example.teambalancer.model.Participant;
import com.example.teambalancer.model.TeamSplit;
import com.example.teambalancer.model.TeamStats;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class BalancingEngine {

  private final int requiredPlayers;
  private final int teamSize;

  public BalancingEngine(BalancerProperties properties) {
    this.requiredPlayers = properties.requiredPlayers();
    this.teamSize = properties.teamSize();
  }

  /**
   * 役割: ロスターをレーティング合計が近い 2 チームへ分割する。
   * 動作: レーティング降順に安定ソートし、合計の低い側へ順に割り当てる。定員に達したチームは合計が低くても飛ばす。
   * 前提: roster のサイズは requiredPlayers と一致すること。一致しなければ InvalidRosterSizeException。
   */
  public TeamSplit balance(List<Participant> roster) {
    if (roster == null || roster.size() != requiredPlayers) {
      throw new InvalidRosterSizeException(requiredPlayers, roster == null ? 0 : roster.size());
    }
    // List.sort は安定ソートなので同レーティングは入力順を保つ。
    final List<Participant> sorted = new ArrayList<>(roster);
    sorted.sort(Comparator.comparingInt(Participant::rating).reversed());

    final List<Participant> teamA = new ArrayList<>(teamSize);
    final List<Participant> teamB = new ArrayList<>(teamSize);
    int totalA = 0;
    int totalB = 0;
    for (Participant participant : sorted) {
      if (teamA.size() < teamSize && (teamB.size() >= teamSize || totalA <= totalB)) {
        teamA.add(participant);
        totalA += participant.rating();
      } else {
        teamB.add(participant);
        totalB += participant.rating();
      }
    }
    return new TeamSplit(teamA, teamB);
  }

  public TeamStats stats(List<Participant> team) {
    if (team == null || team.isEmpty()) {
      return TeamStats.EMPTY;
    }
    final int total = total(team);
    final double average =
        BigDecimal.valueOf(total)
            .divide(BigDecimal.valueOf(team.size()), 1, RoundingMode.HALF_UP)
            .doubleValue();
    return new TeamStats(total, average, team.size());
  }

  public int ratingGap(TeamSplit split) {
    return Math.abs(total(split.teamA()) - total(split.teamB()));
  }

  /**
   * 役割: チーム A の idA とチーム B の idB を入れ替える。
   * 動作: それぞれの位置を保ったまま交換した新しい TeamSplit を返す。入力は変更しない。
   * 前提: idA はチーム A、idB はチーム B に所属すること。検索はチーム単位で、反対側にいても PlayerNotFoundException。
   */
  public TeamSplit swap(TeamSplit split, String idA, String idB) {
    final int indexA = indexOf(split.teamA(), idA);
    final int indexB = indexOf(split.teamB(), idB);
    if (indexA < 0 || indexB < 0) {
      throw new PlayerNotFoundException(indexA < 0 ? idA : idB);
    }
    final List<Participant> teamA = new ArrayList<>(split.teamA());
    final List<Participant> teamB = new ArrayList<>(split.teamB());
    final Participant fromA = teamA.get(indexA);
    teamA.set(indexA, teamB.get(indexB));
    teamB.set(indexB, fromA);
    return new TeamSplit(teamA, teamB);
  }

  /**
   * 役割: 現在の 2 チームを 1 つのロスターへ戻して再分割する。
   * 動作: A, B の順に連結して balance を呼ぶ。乱数は使わないため同じレーティング集合なら同じ分割になる。
   */
  public TeamSplit rebalance(TeamSplit split) {
    final List<Participant> roster = new ArrayList<>(split.teamA());
    roster.addAll(split.teamB());
    return balance(roster);
  }

  private int indexOf(List<Participant> team, String externalId) {
    for (int i = 0; i < team.size(); i++) {
      if (team.get(i).externalId().equals(externalId)) {
        return i;
      }
    }
    return -1;
  }

  private int total(List<Participant> team) {
    int total = 0;
    for (Participant participant : team) {
      total += participant.rating();
    }
    return total;
  }
}
