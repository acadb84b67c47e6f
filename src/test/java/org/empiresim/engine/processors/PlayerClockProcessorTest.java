package org.empiresim.engine.processors;

import com.typesafe.config.ConfigFactory;
import org.empiresim.engine.EngineFixtures;
import org.empiresim.engine.MutableClock;
import org.empiresim.engine.api.processors.ProcessorResult;
import org.empiresim.engine.players.PlayerTickStateTracker;
import org.empiresim.engine.resources.memory.InMemoryPlayerTickStateStore;
import org.empiresim.junit.extensions.logging.ExpectLog;
import org.empiresim.junit.extensions.logging.LogLevel;
import org.empiresim.junit.extensions.logging.LogWatchExtension;
import org.empiresim.runtime.model.GameTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PlayerClockProcessorTest {

    private PlayerTickStateTracker tracker;
    private ProcessorContext context;

    @BeforeEach
    void setUp() {
        tracker = new PlayerTickStateTracker(new InMemoryPlayerTickStateStore("player-states", ConfigFactory.empty()),
            new MutableClock(Instant.parse("2025-01-01T00:00:00Z")));
        context = EngineFixtures.processorContext(tracker);
    }

    @Test
    void process_countsMonthsSinceLastRun() throws Exception {
        PlayerClockProcessor processor = new PlayerClockProcessor("clock", ConfigFactory.empty(), context);

        processor.process(GameTime.ofTotalMonths(2), List.of("alice"));
        ProcessorResult result = processor.process(GameTime.ofTotalMonths(5), List.of("alice"));

        assertThat(result.success()).isTrue();
        assertThat(result.counters()).containsEntry(PlayerClockProcessor.MONTHS_ADVANCED, 3L);
        assertThat(tracker.getOrCreate("alice").system("clock").orElseThrow().counters())
            .containsEntry(PlayerClockProcessor.MONTHS_ADVANCED, 5L);
    }

    @Test
    void process_skipsPlayersAlreadyProcessed() throws Exception {
        PlayerClockProcessor processor = new PlayerClockProcessor("clock", ConfigFactory.empty(), context);
        processor.process(GameTime.ofTotalMonths(2), List.of("alice"));

        ProcessorResult replay = processor.process(GameTime.ofTotalMonths(2), List.of("alice", "bob"));

        assertThat(replay.itemsProcessed()).isEqualTo(1);
        assertThat(replay.counters()).containsEntry("playersSkipped", 1L);
    }

    @Test
    void options_overridePriorityAndEnabled() {
        PlayerClockProcessor defaults = new PlayerClockProcessor("clock", ConfigFactory.empty(), context);
        PlayerClockProcessor tuned = new PlayerClockProcessor("clock",
            ConfigFactory.parseString("priority = 5\nenabled = false"), context);

        assertThat(defaults.getPriority()).isEqualTo(1000);
        assertThat(defaults.isEnabled()).isTrue();
        assertThat(tuned.getPriority()).isEqualTo(5);
        assertThat(tuned.isEnabled()).isFalse();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Processor 'treasury' failed for player 'bob' at .*: vault locked")
    void process_isolatesFailingPlayer() throws Exception {
        AbstractTickProcessor processor = new AbstractTickProcessor("treasury", ConfigFactory.empty(), context) {
            @Override
            protected Map<String, Long> processPlayer(String playerId, GameTime gameTime) {
                if ("bob".equals(playerId)) {
                    throw new IllegalStateException("vault locked");
                }
                return Map.of("coins", 10L);
            }
        };

        ProcessorResult result = processor.process(GameTime.ofTotalMonths(2), List.of("alice", "bob", "carol"));

        assertThat(result.success()).isFalse();
        assertThat(result.itemsProcessed()).isEqualTo(2);
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.entityId()).isEqualTo("bob");
            assertThat(error.recoverable()).isTrue();
        });
        assertThat(result.counters()).containsEntry("coins", 20L);
        assertThat(tracker.isLagging("bob", GameTime.ofTotalMonths(2))).isTrue();
    }
}
