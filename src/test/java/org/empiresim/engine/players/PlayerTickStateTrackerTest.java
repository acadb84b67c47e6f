package org.empiresim.engine.players;

import com.typesafe.config.ConfigFactory;
import org.empiresim.engine.MutableClock;
import org.empiresim.engine.api.players.PlayerTickState;
import org.empiresim.engine.api.ticks.ClosedTickWriteException;
import org.empiresim.engine.api.ticks.ConcurrentTickException;
import org.empiresim.engine.resources.memory.InMemoryPlayerTickStateStore;
import org.empiresim.junit.extensions.logging.LogWatchExtension;
import org.empiresim.runtime.model.GameTime;
import org.empiresim.runtime.model.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PlayerTickStateTrackerTest {

    private static final GameTime MONTH_2 = GameTime.ofTotalMonths(2);
    private static final GameTime MONTH_3 = GameTime.ofTotalMonths(3);

    private MutableClock clock;
    private PlayerTickStateTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T12:00:00Z"));
        tracker = new PlayerTickStateTracker(new InMemoryPlayerTickStateStore("player-states", ConfigFactory.empty()), clock);
    }

    @Test
    void getOrCreate_startsAtZero() {
        PlayerTickState state = tracker.getOrCreate("alice");

        assertThat(state.lastProcessedTick()).isEqualTo(GameTime.ZERO);
        assertThat(state.systems()).isEmpty();
        assertThat(tracker.countPlayers()).isEqualTo(1);
        assertThat(tracker.getOrCreate("alice")).isSameAs(state);
    }

    @Test
    @DisplayName("Counters are applied once per game time")
    void markProcessed_isIdempotentPerGameTime() {
        tracker.markProcessed("alice", MONTH_2, "economy", Map.of("taxCollected", 100L));
        clock.advance(Duration.ofMinutes(5));
        PlayerTickState replay = tracker.markProcessed("alice", MONTH_2, "economy", Map.of("taxCollected", 100L));

        assertThat(replay.system("economy").orElseThrow().counters()).containsEntry("taxCollected", 100L);
        assertThat(replay.lastProcessedAt()).isEqualTo(Instant.parse("2025-03-01T12:00:00Z"));

        PlayerTickState next = tracker.markProcessed("alice", MONTH_3, "economy", Map.of("taxCollected", 50L));

        assertThat(next.system("economy").orElseThrow().counters()).containsEntry("taxCollected", 150L);
        assertThat(next.lastProcessedTick()).isEqualTo(MONTH_3);
    }

    @Test
    void markProcessed_neverMovesClockBackward() {
        tracker.markProcessed("alice", MONTH_3, "economy");

        PlayerTickState state = tracker.markProcessed("alice", MONTH_2, "elections");

        assertThat(state.lastProcessedTick()).isEqualTo(MONTH_3);
        assertThat(tracker.hasProcessed("alice", "elections", MONTH_2)).isTrue();
        assertThat(tracker.hasProcessed("alice", "elections", MONTH_3)).isFalse();
    }

    @Test
    void markProcessed_rejectsInvalidArguments() {
        assertThatThrownBy(() -> tracker.markProcessed("alice", GameTime.ZERO, "economy"))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> tracker.markProcessed("alice", MONTH_2, " "))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> tracker.getOrCreate(""))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void getUnprocessedPlayers_listsLaggingPlayersById() {
        tracker.getOrCreate("carol");
        tracker.getOrCreate("alice");
        tracker.markProcessed("bob", MONTH_2, "clock");

        assertThat(tracker.getUnprocessedPlayers(MONTH_2)).containsExactly("alice", "carol");
        assertThat(tracker.getUnprocessedPlayers(MONTH_3)).containsExactly("alice", "bob", "carol");
    }

    @Test
    void isLagging_treatsUnknownPlayersAsLagging() {
        assertThat(tracker.isLagging("stranger", GameTime.INITIAL)).isTrue();
        assertThat(tracker.hasProcessed("stranger", "clock", GameTime.INITIAL)).isFalse();
    }

    @Test
    void reconcileAfterFailure_clampsOnlyPlayersAhead() {
        tracker.markProcessed("alice", MONTH_3, "clock");
        tracker.markProcessed("bob", MONTH_2, "clock");

        int changed = tracker.reconcileAfterFailure(MONTH_2);

        assertThat(changed).isEqualTo(1);
        assertThat(tracker.getOrCreate("alice").lastProcessedTick()).isEqualTo(MONTH_2);
        assertThat(tracker.hasProcessed("alice", "clock", MONTH_3)).isTrue();
        assertThat(tracker.reconcileAfterFailure(MONTH_2)).isZero();
    }

    @Test
    @DisplayName("Writes bound to a closed tick are discarded, unbound writes are not fenced")
    void markProcessed_boundToClosedTick_isRejected() throws Exception {
        tracker.openTick("tick-2");
        tracker.callInTick("tick-2", () -> tracker.markProcessed("alice", MONTH_2, "clock"));

        assertThat(tracker.closeTick("tick-2")).isTrue();
        assertThat(tracker.closeTick("tick-2")).isFalse();
        assertThatThrownBy(() -> tracker.callInTick("tick-2", () -> tracker.markProcessed("alice", MONTH_3, "clock")))
            .isInstanceOf(ClosedTickWriteException.class)
            .hasMessageContaining("tick-2");
        assertThat(tracker.getOrCreate("alice").lastProcessedTick()).isEqualTo(MONTH_2);

        tracker.markProcessed("alice", MONTH_3, "clock");

        assertThat(tracker.getOrCreate("alice").lastProcessedTick()).isEqualTo(MONTH_3);
    }

    @Test
    void openTick_rejectsSecondTickWhileFenceIsOpen() {
        tracker.openTick("tick-2");

        assertThatThrownBy(() -> tracker.openTick("tick-3")).isInstanceOf(ConcurrentTickException.class);
        assertThat(tracker.isTickOpen("tick-2")).isTrue();
        assertThat(tracker.closeTick("tick-3")).isFalse();

        tracker.closeTick("tick-2");
        tracker.openTick("tick-3");

        assertThat(tracker.isTickOpen("tick-3")).isTrue();
    }
}
