package org.empiresim.engine.players;

import com.typesafe.config.ConfigFactory;
import org.empiresim.engine.EngineFixtures;
import org.empiresim.engine.MutableClock;
import org.empiresim.engine.processors.PlayerClockProcessor;
import org.empiresim.engine.resources.memory.InMemoryOfflineSnapshotStore;
import org.empiresim.engine.resources.memory.InMemoryPlayerTickStateStore;
import org.empiresim.engine.resources.memory.InMemoryTickRecordStore;
import org.empiresim.engine.scheduler.ProcessorRegistry;
import org.empiresim.engine.scheduler.SchedulerConfig;
import org.empiresim.engine.scheduler.TickSchedule;
import org.empiresim.engine.scheduler.TickScheduler;
import org.empiresim.junit.extensions.logging.ExpectLog;
import org.empiresim.junit.extensions.logging.LogLevel;
import org.empiresim.junit.extensions.logging.LogWatchExtension;
import org.empiresim.runtime.model.GameTime;
import org.empiresim.runtime.model.ValidationException;
import org.empiresim.runtime.offline.AutopilotStrategy;
import org.empiresim.runtime.offline.ClampConfig;
import org.empiresim.runtime.offline.OfflineAdjustment;
import org.empiresim.runtime.offline.OfflineSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class OfflineSessionServiceTest {

    private static final Instant EPOCH = Instant.parse("2025-01-01T00:00:00Z");

    private MutableClock clock;
    private PlayerTickStateTracker tracker;
    private InMemoryOfflineSnapshotStore snapshots;
    private TickScheduler scheduler;
    private OfflineSessionService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(EPOCH);
        tracker = new PlayerTickStateTracker(new InMemoryPlayerTickStateStore("player-states", ConfigFactory.empty()), clock);
        ProcessorRegistry registry = new ProcessorRegistry();
        registry.register(new PlayerClockProcessor("clock", ConfigFactory.empty(), EngineFixtures.processorContext(tracker)));
        scheduler = new TickScheduler(new InMemoryTickRecordStore("tick-records", ConfigFactory.empty()), tracker, registry,
            new TickSchedule(EPOCH, Duration.ofHours(1)), SchedulerConfig.DEFAULT, clock);
        snapshots = new InMemoryOfflineSnapshotStore("offline-snapshots", ConfigFactory.empty());
        service = new OfflineSessionService(snapshots, scheduler, ClampConfig.DEFAULT, 4, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void onSessionEnd_capturesCurrentWeek() {
        scheduler.advance(2, null);

        OfflineSnapshot snapshot = service.onSessionEnd("alice", 120, null, null);

        assertThat(snapshot.capturedAtWeek()).isEqualTo(12);
        assertThat(snapshot.autopilotStrategy()).isEqualTo(AutopilotStrategy.BALANCED);
        assertThat(snapshot.capturedAt()).isEqualTo(EPOCH);
        assertThat(snapshots.peek("alice")).contains(snapshot);
    }

    @Test
    void onLogin_appliesProtectionAndCatchesUp() {
        service.onSessionEnd("alice", 100, 55.0, AutopilotStrategy.DEFENSIVE);
        scheduler.advance(3, null);

        OfflineSessionService.LoginOutcome outcome = service.onLogin("alice", -100);

        OfflineAdjustment adjustment = outcome.offlineAdjustment().orElseThrow();
        assertThat(adjustment.weeksOffline()).isEqualTo(12);
        assertThat(adjustment.adjustedDelta()).isEqualTo(-50.0);
        assertThat(adjustment.catchUpBuff()).isCloseTo(1.0 + 0.5 * (1.0 - Math.exp(-3.0)), within(1e-9));
        assertThat(adjustment.autopilot().strategy()).isEqualTo(AutopilotStrategy.DEFENSIVE);
        assertThat(outcome.catchUp()).hasSize(1);
        assertThat(tracker.isLagging("alice", GameTime.ofTotalMonths(4))).isFalse();
    }

    @Test
    void onLogin_consumesSnapshotOnlyOnce() {
        service.onSessionEnd("alice", 100, null, null);
        scheduler.advance(1, null);

        assertThat(service.onLogin("alice", -10).offlineAdjustment()).isPresent();
        assertThat(service.onLogin("alice", -10).offlineAdjustment()).isEmpty();
    }

    @Test
    void onLogin_withoutSnapshotOnlyCatchesUp() {
        scheduler.advance(1, null);

        OfflineSessionService.LoginOutcome outcome = service.onLogin("newcomer", 0);

        assertThat(outcome.offlineAdjustment()).isEmpty();
        assertThat(outcome.catchUp()).hasSize(1);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Discarded offline snapshot of 'alice': .*")
    void onLogin_discardsSnapshotFromTheFuture() {
        snapshots.save(new OfflineSnapshot("alice", 400, EPOCH, 10, null, null));

        OfflineSessionService.LoginOutcome outcome = service.onLogin("alice", -10);

        assertThat(outcome.offlineAdjustment()).isEmpty();
        assertThat(snapshots.peek("alice")).isEmpty();
    }

    @Test
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> service.onSessionEnd(" ", 1, null, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.onSessionEnd("alice", Double.NaN, null, null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.onLogin(null, 0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new OfflineSessionService(snapshots, scheduler, ClampConfig.DEFAULT, 0, clock))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
