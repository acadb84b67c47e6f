package org.empiresim.runtime.model;

/**
 * A point on the global simulation clock. One tick advances the clock by one simulated month.
 * <p>
 * {@code totalMonths} is the canonical monotonic index; {@code year} and {@code month} are
 * derived display fields. {@link #ZERO} marks "never processed" and is the only value allowed
 * to break the derivation rule.
 *
 * @param year        1-based simulated year.
 * @param month       1-based month within the year (1..12).
 * @param totalMonths Canonical tick index, 1 for the first month of the first year.
 */
public record GameTime(int year, int month, int totalMonths) implements Comparable<GameTime> {

    public static final int MONTHS_PER_YEAR = 12;

    /** Sentinel for players that have never been processed. */
    public static final GameTime ZERO = new GameTime(0, 0, 0);

    /** The first month of the simulation, used when no tick has completed yet. */
    public static final GameTime INITIAL = new GameTime(1, 1, 1);

    public GameTime {
        if (totalMonths < 0) {
            throw new ValidationException("totalMonths must not be negative but was " + totalMonths);
        }
        boolean zero = totalMonths == 0 && year == 0 && month == 0;
        if (!zero) {
            int expectedYear = (totalMonths - 1) / MONTHS_PER_YEAR + 1;
            int expectedMonth = (totalMonths - 1) % MONTHS_PER_YEAR + 1;
            if (totalMonths == 0 || year != expectedYear || month != expectedMonth) {
                throw new ValidationException(String.format(
                    "Inconsistent game time {year=%d, month=%d, totalMonths=%d}", year, month, totalMonths));
            }
        }
    }

    /**
     * Builds a game time from its canonical month index.
     *
     * @param totalMonths Canonical tick index; 0 yields {@link #ZERO}.
     * @return The game time with derived year and month.
     */
    public static GameTime ofTotalMonths(int totalMonths) {
        if (totalMonths < 0) {
            throw new ValidationException("totalMonths must not be negative but was " + totalMonths);
        }
        if (totalMonths == 0) {
            return ZERO;
        }
        return new GameTime((totalMonths - 1) / MONTHS_PER_YEAR + 1, (totalMonths - 1) % MONTHS_PER_YEAR + 1, totalMonths);
    }

    public GameTime next() {
        return plusMonths(1);
    }

    public GameTime plusMonths(int months) {
        if (months < 0) {
            throw new ValidationException("Game time cannot move backward (months=" + months + ")");
        }
        return ofTotalMonths(Math.addExact(totalMonths, months));
    }

    public boolean isZero() {
        return totalMonths == 0;
    }

    public boolean isBefore(GameTime other) {
        return totalMonths < other.totalMonths;
    }

    public boolean isAfter(GameTime other) {
        return totalMonths > other.totalMonths;
    }

    @Override
    public int compareTo(GameTime other) {
        return Integer.compare(totalMonths, other.totalMonths);
    }

    @Override
    public String toString() {
        return String.format("Y%d-M%02d (#%d)", year, month, totalMonths);
    }
}
