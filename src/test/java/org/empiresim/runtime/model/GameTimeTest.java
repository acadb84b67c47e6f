package org.empiresim.runtime.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GameTimeTest {

    @Test
    @DisplayName("Year and month are derived from totalMonths")
    void ofTotalMonths_derivesYearAndMonth() {
        assertThat(GameTime.ofTotalMonths(1)).isEqualTo(new GameTime(1, 1, 1));
        assertThat(GameTime.ofTotalMonths(12)).isEqualTo(new GameTime(1, 12, 12));
        assertThat(GameTime.ofTotalMonths(13)).isEqualTo(new GameTime(2, 1, 13));
        assertThat(GameTime.ofTotalMonths(27)).isEqualTo(new GameTime(3, 3, 27));
    }

    @Test
    void ofTotalMonths_zeroIsTheNeverProcessedSentinel() {
        assertThat(GameTime.ofTotalMonths(0)).isSameAs(GameTime.ZERO);
        assertThat(GameTime.ZERO.isZero()).isTrue();
        assertThat(GameTime.INITIAL.isZero()).isFalse();
    }

    @Test
    @DisplayName("Combinations that break the derivation are rejected")
    void constructor_rejectsMalformedTimes() {
        assertThatThrownBy(() -> new GameTime(1, 2, 1)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new GameTime(2, 1, 12)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new GameTime(0, 0, 5)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new GameTime(1, 1, 0)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> GameTime.ofTotalMonths(-1)).isInstanceOf(ValidationException.class);
    }

    @Test
    void next_crossesYearBoundary() {
        GameTime december = GameTime.ofTotalMonths(12);

        assertThat(december.next()).isEqualTo(new GameTime(2, 1, 13));
        assertThat(GameTime.ZERO.next()).isEqualTo(GameTime.INITIAL);
    }

    @Test
    void plusMonths_rejectsNegativeSteps() {
        assertThatThrownBy(() -> GameTime.INITIAL.plusMonths(-1)).isInstanceOf(ValidationException.class);
    }

    @Test
    void ordering_followsTotalMonths() {
        GameTime a = GameTime.ofTotalMonths(5);
        GameTime b = GameTime.ofTotalMonths(17);

        assertThat(a).isLessThan(b);
        assertThat(a.isBefore(b)).isTrue();
        assertThat(b.isAfter(a)).isTrue();
        assertThat(a.isAfter(a)).isFalse();
        assertThat(b.toString()).isEqualTo("Y2-M05 (#17)");
    }
}
