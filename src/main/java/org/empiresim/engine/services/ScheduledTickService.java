package org.empiresim.engine.services;

import com.typesafe.config.Config;
import org.empiresim.engine.api.ticks.ClockDriftException;
import org.empiresim.engine.api.ticks.ConcurrentTickException;
import org.empiresim.engine.api.ticks.TickRecord;
import org.empiresim.engine.api.ticks.TickStatus;
import org.empiresim.engine.scheduler.TickScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fires scheduled ticks. Polls the scheduler every {@code pollInterval} and runs whatever ticks the
 * schedule says are due. A rejected or failed trigger is recorded and the loop keeps polling.
 * Clock drift is fatal: it ends the loop and leaves the service in {@link State#ERROR}.
 */
public class ScheduledTickService extends AbstractService {

    private final TickScheduler scheduler;
    private final long pollIntervalMs;

    private final AtomicLong ticksTriggered = new AtomicLong();
    private final AtomicLong ticksFailed = new AtomicLong();
    private final AtomicLong triggersRejected = new AtomicLong();

    public ScheduledTickService(String name, Config options, TickScheduler scheduler) {
        super(name, options);
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        Duration pollInterval = options.hasPath("pollInterval") ? options.getDuration("pollInterval") : Duration.ofSeconds(1);
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive but was " + pollInterval);
        }
        this.pollIntervalMs = pollInterval.toMillis();
    }

    @Override
    protected void logStarted() {
        log.info("{} started: pollInterval={}ms, tickInterval={}", getClass().getSimpleName(), pollIntervalMs,
            scheduler.getSchedule().tickInterval());
    }

    @Override
    protected void run() throws InterruptedException {
        while (!Thread.currentThread().isInterrupted()) {
            checkPause();
            triggerDueTicks();
            Thread.sleep(pollIntervalMs);
        }
    }

    /**
     * Runs one polling round.
     *
     * @throws ClockDriftException if the schedule went back behind the completed ticks.
     */
    void triggerDueTicks() {
        try {
            List<TickRecord> records = scheduler.runDueTicks();
            for (TickRecord record : records) {
                ticksTriggered.incrementAndGet();
                if (record.status() == TickStatus.FAILED) {
                    ticksFailed.incrementAndGet();
                    recordError("TICK_FAILED", "Scheduled tick failed",
                        "Tick: " + record.tickId() + ", GameTime: " + record.gameTime() + ", Reason: " + record.failureReason());
                }
            }
        } catch (ConcurrentTickException e) {
            triggersRejected.incrementAndGet();
            log.warn("Scheduled trigger rejected: {}", e.getMessage());
            recordError("TICK_REJECTED", "Scheduled trigger rejected", e.getMessage());
        } catch (ClockDriftException e) {
            triggersRejected.incrementAndGet();
            log.error("Scheduled ticks halted until an operator intervenes: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.warn("Scheduled trigger failed: {}", e.getMessage());
            log.debug("Trigger failure details:", e);
            recordError("TICK_TRIGGER_FAILED", "Scheduled trigger failed",
                e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("ticks_triggered", ticksTriggered.get());
        metrics.put("ticks_failed", ticksFailed.get());
        metrics.put("triggers_rejected", triggersRejected.get());
    }
}
