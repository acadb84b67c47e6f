package org.empiresim.engine.resources.memory;

import com.typesafe.config.ConfigFactory;
import org.empiresim.engine.api.ticks.TickNotFoundException;
import org.empiresim.engine.api.ticks.TickRecord;
import org.empiresim.engine.api.ticks.TickResult;
import org.empiresim.engine.api.ticks.TickStatus;
import org.empiresim.engine.api.ticks.TriggerSource;
import org.empiresim.runtime.model.GameTime;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class InMemoryTickRecordStoreTest {

    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private final InMemoryTickRecordStore store = new InMemoryTickRecordStore("tick-records", ConfigFactory.empty());

    private static TickRecord running(String tickId, int month, Instant startedAt) {
        return TickRecord.running(tickId, GameTime.ofTotalMonths(month), TriggerSource.SCHEDULED, null, startedAt);
    }

    private static TickResult emptyResult(String tickId, int month, Instant startedAt) {
        return TickResult.aggregate(tickId, GameTime.ofTotalMonths(month), startedAt, startedAt.plusSeconds(1), 0, List.of());
    }

    @Test
    void insertRunning_allowsOnlyOneRunningTick() throws TickNotFoundException {
        assertThat(store.insertRunning(running("t2", 2, START))).isTrue();
        assertThat(store.insertRunning(running("t3", 3, START))).isFalse();

        store.finish("t2", TickStatus.COMPLETED, emptyResult("t2", 2, START), null, START.plusSeconds(1));

        assertThat(store.insertRunning(running("t3", 3, START.plusSeconds(2)))).isTrue();
        assertThat(store.insertRunning(running("t2", 2, START.plusSeconds(3)))).isFalse();
        assertThat(store.getMetrics()).containsEntry("rejected_inserts", 2L);
    }

    @Test
    void insertRunning_rejectsFinishedRecords() {
        TickRecord finished = running("t2", 2, START)
            .finish(TickStatus.FAILED, null, "boom", START.plusSeconds(1));

        assertThatThrownBy(() -> store.insertRunning(finished)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void finish_completesRecordExactlyOnce() throws TickNotFoundException {
        store.insertRunning(running("t2", 2, START));

        TickRecord finished = store.finish("t2", TickStatus.COMPLETED, emptyResult("t2", 2, START), "ignored", START.plusSeconds(4));

        assertThat(finished.status()).isEqualTo(TickStatus.COMPLETED);
        assertThat(finished.success()).isTrue();
        assertThat(finished.durationMs()).isEqualTo(4000L);
        assertThat(finished.failureReason()).isNull();
        assertThat(store.findRunning()).isEmpty();
        assertThatThrownBy(() -> store.finish("t2", TickStatus.FAILED, null, "late", START.plusSeconds(5)))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.finish("missing", TickStatus.FAILED, null, "late", START))
            .isInstanceOf(TickNotFoundException.class)
            .hasMessage("Tick 'missing' not found")
            .extracting(e -> ((TickNotFoundException) e).getTickId())
            .isEqualTo("missing");
    }

    @Test
    void findLatestCompleted_ignoresFailedTicks() throws TickNotFoundException {
        store.insertRunning(running("t2", 2, START));
        store.finish("t2", TickStatus.COMPLETED, emptyResult("t2", 2, START), null, START.plusSeconds(1));
        store.insertRunning(running("t3", 3, START.plusSeconds(2)));
        store.finish("t3", TickStatus.FAILED, null, "boom", START.plusSeconds(3));

        assertThat(store.findLatestCompleted()).map(TickRecord::tickId).contains("t2");
        assertThat(store.countByStatus(TickStatus.FAILED)).isEqualTo(1);
        assertThat(store.findRecent(10)).extracting(TickRecord::tickId).containsExactly("t3", "t2");
        assertThat(store.findRecent(1)).extracting(TickRecord::tickId).containsExactly("t3");
    }

    @Test
    void findLatestScheduled_ignoresManualTicks() throws TickNotFoundException {
        assertThat(store.findLatestScheduled()).isEmpty();

        store.insertRunning(running("t2", 2, START));
        store.finish("t2", TickStatus.COMPLETED, emptyResult("t2", 2, START), null, START.plusSeconds(1));
        store.insertRunning(TickRecord.running("t3", GameTime.ofTotalMonths(3), TriggerSource.MANUAL, "ops", START.plusSeconds(2)));
        store.finish("t3", TickStatus.COMPLETED, emptyResult("t3", 3, START), null, START.plusSeconds(3));

        assertThat(store.findLatestScheduled()).map(TickRecord::tickId).contains("t2");
        assertThat(store.findLatestCompleted()).map(TickRecord::tickId).contains("t3");
    }
}
