package org.empiresim.engine.processors;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.empiresim.engine.EngineFixtures;
import org.empiresim.engine.MutableClock;
import org.empiresim.engine.api.players.SystemState;
import org.empiresim.engine.api.processors.ProcessorResult;
import org.empiresim.engine.players.PlayerTickStateTracker;
import org.empiresim.engine.resources.memory.InMemoryOfflineSnapshotStore;
import org.empiresim.engine.resources.memory.InMemoryPlayerTickStateStore;
import org.empiresim.junit.extensions.logging.LogWatchExtension;
import org.empiresim.runtime.model.GameTime;
import org.empiresim.runtime.offline.AutopilotStrategy;
import org.empiresim.runtime.offline.ClampConfig;
import org.empiresim.runtime.offline.OfflineSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LobbyingProcessorTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final ClampConfig TIGHT_CLAMP = new ClampConfig(0.5, 2.0, 1.5, 4.0);

    private InMemoryOfflineSnapshotStore snapshots;
    private PlayerTickStateTracker tracker;
    private ProcessorContext context;

    @BeforeEach
    void setUp() {
        snapshots = new InMemoryOfflineSnapshotStore("offline-snapshots", ConfigFactory.empty());
        tracker = newTracker();
        context = EngineFixtures.processorContext(tracker, snapshots, TIGHT_CLAMP);
    }

    private static PlayerTickStateTracker newTracker() {
        return new PlayerTickStateTracker(new InMemoryPlayerTickStateStore("player-states", ConfigFactory.empty()),
            new MutableClock(NOW));
    }

    private static LobbyingProcessor decayOnly(ProcessorContext context) {
        return new LobbyingProcessor("lobbying",
            ConfigFactory.parseString("decayRate = 0.2\nsuccessInfluence = 0\nstartingInfluence = 100"), context);
    }

    private Map<String, Long> counters(PlayerTickStateTracker source, String playerId) {
        return source.getOrCreate(playerId).system("lobbying").map(SystemState::counters).orElse(Map.of());
    }

    @Test
    @DisplayName("Influence gained equals the successes rolled through the lobbying odds")
    void process_appliesRolledSuccesses() throws Exception {
        LobbyingProcessor processor = new LobbyingProcessor("lobbying",
            ConfigFactory.parseString("decayRate = 0\nsuccessInfluence = 10\noffice = LOCAL"), context);

        for (int month = 2; month <= 13; month++) {
            processor.process(GameTime.ofTotalMonths(month), List.of("alice"));
        }

        Map<String, Long> counters = counters(tracker, "alice");
        assertThat(counters.get(LobbyingProcessor.SUCCESSES)).isBetween(0L, 12L);
        assertThat(counters.get(LobbyingProcessor.INFLUENCE)).isEqualTo(10L * counters.get(LobbyingProcessor.SUCCESSES));
        assertThat(counters).doesNotContainKey(LobbyingProcessor.INFLUENCE_PROTECTED);
    }

    @Test
    void process_isReproducibleAcrossTrackers() throws Exception {
        PlayerTickStateTracker other = newTracker();
        LobbyingProcessor first = new LobbyingProcessor("lobbying", ConfigFactory.empty(), context);
        LobbyingProcessor second = new LobbyingProcessor("lobbying", ConfigFactory.empty(),
            EngineFixtures.processorContext(other, snapshots, TIGHT_CLAMP));

        for (int month = 2; month <= 25; month++) {
            first.process(GameTime.ofTotalMonths(month), List.of("alice", "bob"));
            second.process(GameTime.ofTotalMonths(month), List.of("alice", "bob"));
        }

        assertThat(counters(tracker, "alice")).isEqualTo(counters(other, "alice"));
        assertThat(counters(tracker, "bob")).isEqualTo(counters(other, "bob"));
    }

    @Test
    @DisplayName("Offline players lose no more influence than the drift clamp allows")
    void process_clampsDecayOfOfflinePlayers() throws Exception {
        LobbyingProcessor processor = decayOnly(context);
        snapshots.save(new OfflineSnapshot("alice", 4, NOW, 100.0, null, AutopilotStrategy.BALANCED));

        ProcessorResult result = processor.process(GameTime.ofTotalMonths(2), List.of("alice", "bob"));

        assertThat(result.success()).isTrue();
        assertThat(counters(tracker, "bob")).containsEntry(LobbyingProcessor.INFLUENCE, -20L)
            .doesNotContainKey(LobbyingProcessor.INFLUENCE_PROTECTED);
        assertThat(counters(tracker, "alice"))
            .containsEntry(LobbyingProcessor.INFLUENCE, -1L)
            .containsEntry(LobbyingProcessor.INFLUENCE_PROTECTED, 19L);

        processor.process(GameTime.ofTotalMonths(3), List.of("alice", "bob"));

        assertThat(counters(tracker, "bob")).containsEntry(LobbyingProcessor.INFLUENCE, -36L);
        assertThat(counters(tracker, "alice"))
            .containsEntry(LobbyingProcessor.INFLUENCE, -3L)
            .containsEntry(LobbyingProcessor.INFLUENCE_PROTECTED, 37L);
    }

    @Test
    void process_leavesOfflineDecayUntouchedWithinGracePeriod() throws Exception {
        LobbyingProcessor processor = decayOnly(context);
        snapshots.save(new OfflineSnapshot("alice", 8, NOW, 100.0, 55.0, AutopilotStrategy.DEFENSIVE));

        processor.process(GameTime.ofTotalMonths(2), List.of("alice"));

        assertThat(counters(tracker, "alice"))
            .containsEntry(LobbyingProcessor.INFLUENCE, -20L)
            .doesNotContainKey(LobbyingProcessor.INFLUENCE_PROTECTED);
    }

    @Test
    void process_returningPlayerDecaysNormally() throws Exception {
        LobbyingProcessor processor = decayOnly(context);
        snapshots.save(new OfflineSnapshot("alice", 4, NOW, 100.0, null, AutopilotStrategy.GROWTH));
        snapshots.consume("alice");

        processor.process(GameTime.ofTotalMonths(2), List.of("alice"));

        assertThat(counters(tracker, "alice")).containsEntry(LobbyingProcessor.INFLUENCE, -20L);
    }

    @Test
    void constructor_rejectsInvalidOptions() {
        assertThatThrownBy(() -> new LobbyingProcessor("lobbying", ConfigFactory.parseString("decayRate = 1.5"), context))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("decayRate");
        assertThatThrownBy(() -> new LobbyingProcessor("lobbying", ConfigFactory.parseString("office = GALACTIC"), context))
            .isInstanceOf(ConfigException.BadValue.class);
        assertThat(new LobbyingProcessor("lobbying", ConfigFactory.empty(), context).getPriority()).isEqualTo(50);
    }
}
