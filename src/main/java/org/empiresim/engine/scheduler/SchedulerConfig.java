package org.empiresim.engine.scheduler;

import com.typesafe.config.Config;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of the tick scheduler.
 *
 * @param tickTimeout      Maximum duration of one tick before it is failed.
 * @param staleTickGrace   Extra time after {@code tickTimeout} before a RUNNING record is considered abandoned.
 * @param maxCatchUpMonths Maximum number of due ticks run by one {@link TickScheduler#runDueTicks()} call.
 * @param workerThreads    Size of the worker pool processing player batches.
 * @param batchSize        Players per batch handed to a processor.
 */
public record SchedulerConfig(
    Duration tickTimeout,
    Duration staleTickGrace,
    int maxCatchUpMonths,
    int workerThreads,
    int batchSize
) {

    public static final SchedulerConfig DEFAULT =
        new SchedulerConfig(Duration.ofMinutes(5), Duration.ofMinutes(1), 12, 4, 100);

    public SchedulerConfig {
        Objects.requireNonNull(tickTimeout, "tickTimeout");
        Objects.requireNonNull(staleTickGrace, "staleTickGrace");
        if (tickTimeout.isZero() || tickTimeout.isNegative() || staleTickGrace.isNegative()) {
            throw new IllegalArgumentException("tickTimeout must be positive and staleTickGrace must not be negative");
        }
        if (maxCatchUpMonths < 1 || workerThreads < 1 || batchSize < 1) {
            throw new IllegalArgumentException(String.format(
                "maxCatchUpMonths, workerThreads and batchSize must be positive but were %d, %d, %d",
                maxCatchUpMonths, workerThreads, batchSize));
        }
    }

    public static SchedulerConfig fromConfig(Config scheduler) {
        return new SchedulerConfig(
            scheduler.hasPath("tickTimeout") ? scheduler.getDuration("tickTimeout") : DEFAULT.tickTimeout,
            scheduler.hasPath("staleTickGrace") ? scheduler.getDuration("staleTickGrace") : DEFAULT.staleTickGrace,
            scheduler.hasPath("maxCatchUpMonths") ? scheduler.getInt("maxCatchUpMonths") : DEFAULT.maxCatchUpMonths,
            scheduler.hasPath("workerThreads") ? scheduler.getInt("workerThreads") : DEFAULT.workerThreads,
            scheduler.hasPath("batchSize") ? scheduler.getInt("batchSize") : DEFAULT.batchSize);
    }
}
