package org.empiresim.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.empiresim.engine.api.processors.ITickProcessor;
import org.empiresim.engine.api.services.IService;
import org.empiresim.engine.api.ticks.TickRecord;
import org.empiresim.engine.api.ticks.TickStatus;
import org.empiresim.engine.processors.LobbyingProcessor;
import org.empiresim.engine.processors.PlayerClockProcessor;
import org.empiresim.junit.extensions.logging.ExpectLog;
import org.empiresim.junit.extensions.logging.LogLevel;
import org.empiresim.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TickEngineTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));

    @Test
    void constructor_registersConfiguredProcessors() {
        try (TickEngine engine = new TickEngine(EngineFixtures.memoryEngineConfig(), clock)) {
            List<ITickProcessor> active = engine.getProcessorRegistry().getActiveProcessors();

            assertThat(active).extracting(ITickProcessor::getName).containsExactly("lobbying", "clock");
            assertThat(active.get(0)).isInstanceOf(LobbyingProcessor.class);
            assertThat(active.get(1)).isInstanceOf(PlayerClockProcessor.class);
        }
    }

    @Test
    void startAndStop_withTriggerDisabled() {
        TickEngine engine = new TickEngine(EngineFixtures.memoryEngineConfig(), clock);

        engine.start();
        engine.start();

        assertThat(engine.isStarted()).isTrue();
        assertThat(engine.getScheduledTrigger().getCurrentState()).isEqualTo(IService.State.STOPPED);

        engine.stop();

        assertThat(engine.isStarted()).isFalse();
    }

    @Test
    void manualTicks_advanceTrackedPlayers() {
        try (TickEngine engine = new TickEngine(EngineFixtures.memoryEngineConfig(), clock)) {
            engine.getTracker().getOrCreate("alice");

            List<TickRecord> records = engine.getScheduler().advance(2, "operator");

            assertThat(records).extracting(TickRecord::status).containsOnly(TickStatus.COMPLETED);
            assertThat(engine.getTracker().getUnprocessedPlayers(engine.getScheduler().getCurrentGameTime())).isEmpty();
            assertThat(engine.getTickRecords().findRecent(5)).hasSize(2);
            assertThat(engine.getMetrics()).containsKeys("scheduled-trigger", "tick-records", "player-states", "offline-snapshots");
            assertThat(engine.getMetrics().get("player-states")).containsEntry("players", 1);
        }
    }

    @Test
    void constructor_readsOfflineAndProbabilityBlocks() {
        try (TickEngine engine = new TickEngine(EngineFixtures.memoryEngineConfig(), clock)) {
            assertThat(engine.getOfflineSessions().getClampConfig().gracePeriodWeeks()).isEqualTo(2.0);
            assertThat(engine.getOfflineSessions().currentWeek()).isEqualTo(4);
            assertThat(engine.getLobbyingOdds()).isNotNull();
            assertThat(engine.getBreakthroughOdds()).isNotNull();
        }
    }

    @Test
    @Tag("integration")
    void constructor_usesH2WhenConfigured() {
        Config config = ConfigFactory.parseString(
                "engine.database { type = h2, jdbcUrl = \"jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1\" }")
            .withFallback(EngineFixtures.memoryEngineConfig());

        try (TickEngine engine = new TickEngine(config, clock)) {
            engine.getScheduler().advance(1, null);

            assertThat(engine.getMetrics()).containsKey("game-state-db");
            assertThat(engine.getScheduler().getState().ticksProcessed()).isEqualTo(1);
        }
    }

    @Test
    void constructor_rejectsUnknownDatabaseType() {
        Config config = ConfigFactory.parseString("engine.database.type = cassandra")
            .withFallback(EngineFixtures.memoryEngineConfig());

        assertThatThrownBy(() -> new TickEngine(config, clock))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cassandra");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to create processor 'bogus' of class .*")
    void constructor_failsOnUnknownProcessorClass() {
        Config config = ConfigFactory.parseString("engine.processors.bogus.className = org.empiresim.DoesNotExist")
            .withFallback(EngineFixtures.memoryEngineConfig());

        assertThatThrownBy(() -> new TickEngine(config, clock))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("bogus");
    }
}
