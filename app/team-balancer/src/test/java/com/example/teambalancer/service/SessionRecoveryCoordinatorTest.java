package com.example.teambalancer.service;

import static com.example.teambalancer.service.BalancerTestFixtures.NOW;
import static com.example.teambalancer.service.BalancerTestFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.teambalancer.config.BalancerProperties;
import com.example.teambalancer.model.Participant;
import com.example.teambalancer.model.RecoveryReport;
import com.example.teambalancer.model.SessionLocation;
import com.example.teambalancer.model.SessionSnapshot;
import com.example.teambalancer.model.SessionState;
import com.example.teambalancer.repository.IdentityLinkRepository;
import com.example.teambalancer.repository.SessionPersistenceException;
import com.example.teambalancer.repository.SessionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class SessionRecoveryCoordinatorTest {

  private SessionStore store;
  private SessionRenderer renderer;
  private SessionRegistry registry;
  private SessionStateMachineFactory factory;
  private SimpleMeterRegistry meterRegistry;
  private SessionRecoveryCoordinator coordinator;

  @BeforeEach
  void setUp() {
    store = Mockito.mock(SessionStore.class);
    renderer = Mockito.mock(SessionRenderer.class);
    meterRegistry = new SimpleMeterRegistry();
    final BalancerMetrics metrics = new BalancerMetrics(meterRegistry);
    final BalancerTestFixtures.MutableClock clock = new BalancerTestFixtures.MutableClock(NOW);
    final BalancerProperties properties = BalancerTestFixtures.properties();
    registry = new SessionRegistry(metrics, properties, clock);
    factory =
        new SessionStateMachineFactory(
            new BalancingEngine(properties),
            Mockito.mock(ParticipantRatingResolver.class),
            Mockito.mock(IdentityLinkRepository.class),
            store,
            renderer,
            metrics,
            properties,
            clock);
    coordinator =
        new SessionRecoveryCoordinator(
            store, renderer, registry, factory, metrics, properties, clock);
    when(renderer.resolveLocation(any()))
        .thenAnswer(invocation -> Optional.of(invocation.getArgument(0)));
  }

  @Test
  void reattachesOnlyNewestSnapshotPerChannel() {
    final SessionSnapshot older =
        snapshot("s-old", SessionState.OPEN, NOW.minus(Duration.ofMinutes(10)), "channel-1");
    final SessionSnapshot newer =
        snapshot("s-new", SessionState.OPEN, NOW.minus(Duration.ofMinutes(5)), "channel-1");
    when(store.findAll()).thenReturn(List.of(older, newer));

    final RecoveryReport report = coordinator.runRecovery();

    assertThat(report).isEqualTo(new RecoveryReport(1, 1));
    verify(renderer).resolveLocation(newer.location());
    verify(renderer, never()).resolveLocation(older.location());
    verify(store).delete("s-old");
    verify(store).delete("s-new");
    final ArgumentCaptor<SessionSnapshot> saved = ArgumentCaptor.forClass(SessionSnapshot.class);
    verify(store).save(saved.capture());
    assertThat(saved.getValue().sessionId()).isNotEqualTo("s-new");
    assertThat(saved.getValue().createdAt()).isEqualTo(newer.createdAt());
    assertThat(registry.size()).isEqualTo(1);
    assertThat(registry.find("s-new")).isPresent();
    assertThat(
            meterRegistry.get("tb.recovery.total").tag("result", "reattached").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void discardsOlderSnapshotEvenWhenNewestIsUnresolvable() {
    final SessionSnapshot older =
        snapshot("s-old", SessionState.OPEN, NOW.minus(Duration.ofMinutes(10)), "channel-1");
    final SessionSnapshot newer =
        snapshot("s-new", SessionState.OPEN, NOW.minus(Duration.ofMinutes(5)), "channel-1");
    when(store.findAll()).thenReturn(List.of(older, newer));
    when(renderer.resolveLocation(newer.location())).thenReturn(Optional.empty());

    final RecoveryReport report = coordinator.runRecovery();

    assertThat(report).isEqualTo(new RecoveryReport(0, 2));
    verify(renderer, times(1)).resolveLocation(any());
    verify(store).delete("s-old");
    verify(store).delete("s-new");
    verify(store, never()).save(any());
    assertThat(registry.size()).isZero();
  }

  @Test
  void recoversEachChannelIndependently() {
    when(store.findAll())
        .thenReturn(
            List.of(
                snapshot("s-a", SessionState.OPEN, NOW.minus(Duration.ofMinutes(3)), "channel-a"),
                snapshot("s-b", SessionState.OPEN, NOW.minus(Duration.ofMinutes(2)), "channel-b")));

    assertThat(coordinator.runRecovery()).isEqualTo(new RecoveryReport(2, 0));
    assertThat(registry.latestInChannel("guild-1", "channel-a")).isPresent();
    assertThat(registry.latestInChannel("guild-1", "channel-b")).isPresent();
  }

  @Test
  void discardsExpiredAndTerminalSnapshotsWithoutResolving() {
    when(store.findAll())
        .thenReturn(
            List.of(
                snapshot("s-expired", SessionState.OPEN, NOW.minus(Duration.ofMinutes(31)), "c1"),
                snapshot("s-final", SessionState.FINALIZED, NOW.minusSeconds(60), "c2")));

    assertThat(coordinator.runRecovery()).isEqualTo(new RecoveryReport(0, 2));
    verify(renderer, never()).resolveLocation(any());
    verify(store).delete("s-expired");
    verify(store).delete("s-final");
  }

  @Test
  void balancingSnapshotIsRestoredAsOpenRoster() {
    final SessionSnapshot balancing =
        new SessionSnapshot(
            "s-balancing",
            SessionState.BALANCING,
            List.of(new Participant("u1", "User 1", 0), new Participant("u2", "User 2", 0)),
            List.of(),
            List.of(),
            NOW.minusSeconds(30).getEpochSecond(),
            "guild-1",
            "channel-1",
            "surface-1");

    final Optional<SessionStateMachine> machine = coordinator.recover(balancing);

    assertThat(machine).isPresent();
    assertThat(machine.get().state()).isEqualTo(SessionState.OPEN);
    assertThat(machine.get().view().participants())
        .extracting(Participant::externalId)
        .containsExactly("u1", "u2");
    assertThat(registry.find("s-balancing")).containsSame(machine.get());
  }

  @Test
  void balancedSnapshotKeepsTeams() {
    final Participant a = BalancerTestFixtures.player("a", 100);
    final Participant b = BalancerTestFixtures.player("b", 90);
    final Participant c = BalancerTestFixtures.player("c", 80);
    final Participant d = BalancerTestFixtures.player("d", 70);
    final SessionSnapshot balanced =
        new SessionSnapshot(
            "s-balanced",
            SessionState.BALANCED,
            List.of(a, b, c, d),
            List.of(a, d),
            List.of(b, c),
            NOW.minusSeconds(30).getEpochSecond(),
            "guild-1",
            "channel-1",
            "surface-1");

    final SessionStateMachine machine = coordinator.recover(balanced).orElseThrow();

    assertThat(machine.state()).isEqualTo(SessionState.BALANCED);
    assertThat(machine.view().teamA()).containsExactly(a, d);
    assertThat(machine.view().teamB()).containsExactly(b, c);
  }

  @Test
  void recoverDiscardsSnapshotSupersededByNewerSnapshot() {
    final SessionSnapshot older =
        snapshot("s-old", SessionState.OPEN, NOW.minus(Duration.ofMinutes(10)), "channel-1");
    final SessionSnapshot newer =
        snapshot("s-new", SessionState.OPEN, NOW.minus(Duration.ofMinutes(5)), "channel-1");
    when(store.findLatestInChannel("guild-1", "channel-1")).thenReturn(Optional.of(newer));

    assertThat(coordinator.recover(older)).isEmpty();

    verify(renderer, never()).resolveLocation(any());
    verify(store).delete("s-old");
    assertThat(registry.size()).isZero();
    assertThat(coordinator.recover(newer)).isPresent();
    assertThat(registry.size()).isEqualTo(1);
  }

  @Test
  void recoverDiscardsSnapshotSupersededByLiveSession() {
    final SessionSnapshot newer =
        snapshot("s-new", SessionState.OPEN, NOW.minus(Duration.ofMinutes(5)), "channel-1");
    final SessionSnapshot older =
        snapshot("s-old", SessionState.OPEN, NOW.minus(Duration.ofMinutes(10)), "channel-1");
    final SessionStateMachine live = coordinator.recover(newer).orElseThrow();

    assertThat(coordinator.recover(older)).isEmpty();

    verify(store).delete("s-old");
    assertThat(registry.all()).containsExactly(live);
  }

  @Test
  void recoverStillReattachesWhenLatestLookupFails() {
    final SessionSnapshot only =
        snapshot("s-1", SessionState.OPEN, NOW.minus(Duration.ofMinutes(1)), "channel-1");
    when(store.findLatestInChannel("guild-1", "channel-1"))
        .thenThrow(new SessionPersistenceException("down", null));

    assertThat(coordinator.recover(only)).isPresent();
  }

  @Test
  void liveSessionsAreNeitherReattachedNorDiscarded() {
    final SessionStateMachine live =
        factory.create(new SessionLocation("guild-1", "channel-1", null));
    registry.register(live);
    final SessionSnapshot liveSnapshot = live.snapshot();
    final SessionSnapshot stale =
        snapshot("s-stale", SessionState.OPEN, NOW.minus(Duration.ofMinutes(1)), "channel-1");
    when(store.findAll()).thenReturn(List.of(stale, liveSnapshot));

    final RecoveryReport report = coordinator.runRecovery();

    assertThat(report).isEqualTo(new RecoveryReport(0, 1));
    verify(store).delete("s-stale");
    verify(store, never()).delete(live.sessionId());
    assertThat(registry.find(live.sessionId())).containsSame(live);
  }

  @Test
  void staleSurfaceOnReattachDiscardsSnapshot() {
    when(store.findAll())
        .thenReturn(List.of(snapshot("s-1", SessionState.OPEN, NOW.minusSeconds(10), "c1")));
    when(renderer.render(any(), any())).thenThrow(new StaleSurfaceException("surface-s-1"));

    assertThat(coordinator.runRecovery()).isEqualTo(new RecoveryReport(0, 1));
    assertThat(registry.size()).isZero();
    verify(store).delete("s-1");
  }

  @Test
  void startupRecoveryIsSkippedWhenDisabled() {
    coordinator.recoverOnStartup();

    verify(store, never()).findAll();
  }

  @Test
  void startupRecoveryFailureIsLoggedNotThrown() {
    final BalancerProperties enabled =
        new BalancerProperties(
            4,
            Duration.ofMinutes(30),
            Duration.ofMinutes(20),
            Duration.ofSeconds(30),
            Duration.ofSeconds(2),
            4,
            true,
            "tb");
    final SessionRecoveryCoordinator startup =
        new SessionRecoveryCoordinator(
            store,
            renderer,
            registry,
            factory,
            new BalancerMetrics(meterRegistry),
            enabled,
            new BalancerTestFixtures.MutableClock(NOW));
    when(store.findAll()).thenThrow(new SessionPersistenceException("redis down", null));

    startup.recoverOnStartup();

    verify(store).findAll();
    assertThat(
            meterRegistry
                .get("tb.worker.error.total")
                .tag("worker", "startup_recovery")
                .counter()
                .count())
        .isEqualTo(1.0);
  }
}
