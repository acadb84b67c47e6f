package org.empiresim.engine.scheduler;

import com.typesafe.config.Config;
import org.empiresim.runtime.model.GameTime;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Maps wall-clock time to the game time the world should have reached.
 * <p>
 * Month 1 starts at {@code epoch}; every {@code tickInterval} adds one game month.
 *
 * @param epoch        Wall-clock start of the first game month.
 * @param tickInterval Real time per game month.
 */
public record TickSchedule(Instant epoch, Duration tickInterval) {

    public TickSchedule {
        Objects.requireNonNull(epoch, "epoch");
        Objects.requireNonNull(tickInterval, "tickInterval");
        if (tickInterval.isZero() || tickInterval.isNegative()) {
            throw new IllegalArgumentException("tickInterval must be positive but was " + tickInterval);
        }
    }

    /**
     * Reads {@code epoch} (ISO-8601 instant) and {@code tickInterval} (HOCON duration).
     */
    public static TickSchedule fromConfig(Config schedule) {
        return new TickSchedule(Instant.parse(schedule.getString("epoch")), schedule.getDuration("tickInterval"));
    }

    /**
     * @return The game time due at {@code now}; {@link GameTime#INITIAL} before the epoch.
     */
    public GameTime expectedGameTime(Instant now) {
        if (now.isBefore(epoch)) {
            return GameTime.INITIAL;
        }
        long elapsedTicks = Duration.between(epoch, now).toMillis() / tickInterval.toMillis();
        return GameTime.ofTotalMonths(Math.toIntExact(1 + elapsedTicks));
    }

    /**
     * @return Wall-clock time at which {@code gameTime} becomes due.
     */
    public Instant dueAt(GameTime gameTime) {
        return epoch.plus(tickInterval.multipliedBy(Math.max(0, gameTime.totalMonths() - 1)));
    }
}
