package org.empiresim.engine.scheduler;

import com.typesafe.config.ConfigFactory;
import org.empiresim.runtime.model.GameTime;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TickScheduleTest {

    private static final Instant EPOCH = Instant.parse("2025-01-01T00:00:00Z");

    private final TickSchedule schedule = new TickSchedule(EPOCH, Duration.ofHours(1));

    @Test
    void expectedGameTime_startsAtInitialMonth() {
        assertThat(schedule.expectedGameTime(EPOCH.minusSeconds(3600))).isEqualTo(GameTime.INITIAL);
        assertThat(schedule.expectedGameTime(EPOCH)).isEqualTo(GameTime.INITIAL);
        assertThat(schedule.expectedGameTime(EPOCH.plus(Duration.ofMinutes(59)))).isEqualTo(GameTime.INITIAL);
    }

    @Test
    void expectedGameTime_addsOneMonthPerInterval() {
        GameTime afterOneYear = schedule.expectedGameTime(EPOCH.plus(Duration.ofHours(12)));

        assertThat(afterOneYear.totalMonths()).isEqualTo(13);
        assertThat(afterOneYear.year()).isEqualTo(2);
        assertThat(afterOneYear.month()).isEqualTo(1);
    }

    @Test
    void dueAt_isInverseOfExpectedGameTime() {
        GameTime month = GameTime.ofTotalMonths(7);

        Instant due = schedule.dueAt(month);

        assertThat(due).isEqualTo(EPOCH.plus(Duration.ofHours(6)));
        assertThat(schedule.expectedGameTime(due)).isEqualTo(month);
        assertThat(schedule.expectedGameTime(due.minusMillis(1))).isEqualTo(GameTime.ofTotalMonths(6));
    }

    @Test
    void fromConfig_readsEpochAndInterval() {
        TickSchedule parsed = TickSchedule.fromConfig(ConfigFactory.parseString(
            "epoch = \"2025-01-01T00:00:00Z\"\ntickInterval = 30 minutes"));

        assertThat(parsed.epoch()).isEqualTo(EPOCH);
        assertThat(parsed.tickInterval()).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> new TickSchedule(EPOCH, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
