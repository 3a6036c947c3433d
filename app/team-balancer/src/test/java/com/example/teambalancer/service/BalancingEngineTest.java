package com.example.teambalancer.service;

import static com.example.teambalancer.service.BalancerTestFixtures.player;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.teambalancer.model.Participant;
import com.example.teambalancer.model.TeamSplit;
import com.example.teambalancer.model.TeamStats;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class BalancingEngineTest {

  private final BalancingEngine engine = new BalancingEngine(BalancerTestFixtures.properties());

  private final Participant p100 = player("p100", 100);
  private final Participant p90 = player("p90", 90);
  private final Participant p80 = player("p80", 80);
  private final Participant p70 = player("p70", 70);

  @Test
  void balanceAssignsGreedilyToLowerTotalUntilTeamIsFull() {
    final TeamSplit split = engine.balance(List.of(p80, p100, p70, p90));

    assertThat(split.teamA()).containsExactly(p100, p70);
    assertThat(split.teamB()).containsExactly(p90, p80);
    assertThat(engine.ratingGap(split)).isZero();
  }

  @Test
  void balanceKeepsInputOrderForEqualRatings() {
    final Participant a = player("a", 50);
    final Participant b = player("b", 50);
    final Participant c = player("c", 50);
    final Participant d = player("d", 50);

    final TeamSplit split = engine.balance(List.of(a, b, c, d));

    assertThat(split.teamA()).containsExactly(a, c);
    assertThat(split.teamB()).containsExactly(b, d);
  }

  @Test
  void balanceSkipsFullTeamEvenWhenItsTotalIsLower() {
    final BalancingEngine sixPlayers =
        new BalancingEngine(BalancerTestFixtures.properties(6, Duration.ofSeconds(1)));
    final List<Participant> roster =
        List.of(
            player("top", 3000),
            player("a", 10),
            player("b", 10),
            player("c", 10),
            player("d", 10),
            player("e", 10));

    final TeamSplit split = sixPlayers.balance(roster);

    assertThat(split.teamA()).hasSize(3);
    assertThat(split.teamB()).hasSize(3);
    assertThat(split.teamA()).extracting(Participant::externalId).contains("top");
  }

  @Test
  void balancePartitionsRosterIntoTwoEqualDisjointTeams() {
    final Random random = new Random(42);
    for (int size = 2; size <= 12; size += 2) {
      final BalancingEngine sized =
          new BalancingEngine(BalancerTestFixtures.properties(size, Duration.ofSeconds(1)));
      final List<Participant> roster = new ArrayList<>();
      for (int i = 0; i < size; i++) {
        roster.add(player("p" + i, random.nextInt(3000)));
      }
      for (int order = 0; order < 5; order++) {
        Collections.shuffle(roster, random);

        final TeamSplit split = sized.balance(roster);

        final Set<Participant> union = new HashSet<>(split.teamA());
        union.addAll(split.teamB());
        assertThat(split.teamA()).hasSize(size / 2);
        assertThat(split.teamB()).hasSize(size / 2);
        assertThat(split.teamA()).doesNotContainAnyElementsOf(split.teamB());
        assertThat(union).containsExactlyInAnyOrderElementsOf(roster);
      }
    }
  }

  @Test
  void balanceRejectsRosterOfWrongSize() {
    assertThatThrownBy(() -> engine.balance(List.of(p100, p90, p80)))
        .isInstanceOf(InvalidRosterSizeException.class)
        .hasMessageContaining("4")
        .hasMessageContaining("3");
  }

  @Test
  void statsRoundsAverageToOneDecimal() {
    final TeamStats stats = engine.stats(List.of(player("x", 100), player("y", 71)));

    assertThat(stats.totalRating()).isEqualTo(171);
    assertThat(stats.averageRating()).isEqualTo(85.5);
    assertThat(stats.size()).isEqualTo(2);
    assertThat(engine.stats(List.of())).isEqualTo(TeamStats.EMPTY);
  }

  @Test
  void swapExchangesPlayersInPlaceWithoutMutatingInput() {
    final TeamSplit split = new TeamSplit(List.of(p100, p70), List.of(p90, p80));

    final TeamSplit swapped = engine.swap(split, "p70", "p90");

    assertThat(swapped.teamA()).containsExactly(p100, p90);
    assertThat(swapped.teamB()).containsExactly(p70, p80);
    assertThat(split.teamA()).containsExactly(p100, p70);
    assertThat(engine.ratingGap(swapped)).isEqualTo(40);
  }

  @Test
  void swappingTheSamePairBackRestoresOriginalSplit() {
    final TeamSplit split = engine.balance(List.of(p100, p90, p80, p70));

    final TeamSplit swapped = engine.swap(split, "p70", "p90");

    assertThat(engine.swap(swapped, "p90", "p70")).isEqualTo(split);
  }

  @Test
  void swapLooksUpEachIdOnlyInItsOwnTeam() {
    final TeamSplit split = new TeamSplit(List.of(p100, p70), List.of(p90, p80));

    assertThatThrownBy(() -> engine.swap(split, "p90", "p80"))
        .isInstanceOf(PlayerNotFoundException.class)
        .satisfies(ex -> assertThat(((PlayerNotFoundException) ex).playerId()).isEqualTo("p90"));
    assertThatThrownBy(() -> engine.swap(split, "p100", "missing"))
        .isInstanceOf(PlayerNotFoundException.class)
        .satisfies(
            ex -> assertThat(((PlayerNotFoundException) ex).playerId()).isEqualTo("missing"));
  }

  @Test
  void rebalanceRestoresGreedySplitAfterManualSwap() {
    final TeamSplit balanced = engine.balance(List.of(p100, p90, p80, p70));
    final TeamSplit swapped = engine.swap(balanced, "p70", "p90");

    final TeamSplit rebalanced = engine.rebalance(swapped);

    assertThat(rebalanced).isEqualTo(balanced);
    assertThat(engine.rebalance(rebalanced)).isEqualTo(rebalanced);
  }

  @Test
  void rebalanceKeepsTotalsForTiedRatings() {
    final List<Participant> roster = new ArrayList<>();
    roster.add(player("a", 60));
    roster.add(player("b", 60));
    roster.add(player("c", 40));
    roster.add(player("d", 40));
    final TeamSplit first = engine.balance(roster);

    final TeamSplit second = engine.rebalance(first);

    assertThat(engine.stats(second.teamA()).totalRating())
        .isEqualTo(engine.stats(first.teamA()).totalRating());
    assertThat(engine.ratingGap(second)).isEqualTo(engine.ratingGap(first));
  }
}
