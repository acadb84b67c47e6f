package org.empiresim.engine.scheduler;

import org.empiresim.engine.api.processors.ITickProcessor;
import org.empiresim.engine.api.processors.ProcessorResult;
import org.empiresim.engine.api.resources.database.ITickRecordStore;
import org.empiresim.engine.api.ticks.ClockDriftException;
import org.empiresim.engine.api.ticks.ConcurrentTickException;
import org.empiresim.engine.api.ticks.TickEngineState;
import org.empiresim.engine.api.ticks.TickNotFoundException;
import org.empiresim.engine.api.ticks.TickRecord;
import org.empiresim.engine.api.ticks.TickResult;
import org.empiresim.engine.api.ticks.TickStatus;
import org.empiresim.engine.api.ticks.TriggerSource;
import org.empiresim.engine.players.PlayerTickStateTracker;
import org.empiresim.runtime.model.GameTime;
import org.empiresim.runtime.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single global simulation clock.
 * <p>
 * Each tick moves the game forward by one month: a RUNNING {@link TickRecord} is written, the players
 * lagging behind the new game time are handed to the registered processors in priority order, and the
 * record is finished as COMPLETED (possibly with {@code success=false}) or FAILED. Player batches of one
 * processor run concurrently on a worker pool; processors run one after another.
 * <p>
 * At most one tick runs at a time. The in-process lock rejects concurrent triggers of this node, the
 * store's running check and uniqueness reject those of other nodes.
 * <p>
 * Worker writes are fenced by the tick through {@link PlayerTickStateTracker#callInTick}. A tick that
 * times out waits for its workers to stop before it is failed and reconciled, and a worker that outlives
 * that wait can no longer move players ahead of the clock.
 * <p>
 * <strong>Thread Safety:</strong> All public methods are safe to call from multiple threads.
 */
public class TickScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TickScheduler.class);
    private static final Duration WORKER_STOP_WAIT = Duration.ofSeconds(5);

    private final ITickRecordStore store;
    private final PlayerTickStateTracker tracker;
    private final ProcessorRegistry registry;
    private final TickSchedule schedule;
    private final SchedulerConfig config;
    private final Clock clock;
    private final ExecutorService workers;
    private final ReentrantLock tickLock = new ReentrantLock();

    private volatile String runningTickId;
    private volatile String currentProcessor;

    public TickScheduler(ITickRecordStore store, PlayerTickStateTracker tracker, ProcessorRegistry registry,
                         TickSchedule schedule, SchedulerConfig config, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.workers = Executors.newFixedThreadPool(config.workerThreads(), new WorkerThreadFactory());
    }

    // ========== Clock ==========

    /**
     * @return Game time of the latest completed tick, {@link GameTime#INITIAL} if none completed yet.
     */
    public GameTime getCurrentGameTime() {
        return store.findLatestCompleted().map(TickRecord::gameTime).orElse(GameTime.INITIAL);
    }

    /**
     * @return {@code max(0, expected - lastCompleted - 1)}.
     */
    public int getMissedTicks(GameTime expected) {
        return Math.max(0, expected.totalMonths() - getCurrentGameTime().totalMonths() - 1);
    }

    public int getMissedTicks() {
        return getMissedTicks(schedule.expectedGameTime(now()));
    }

    public TickSchedule getSchedule() {
        return schedule;
    }

    // ========== Tick record lifecycle ==========

    /**
     * Writes the RUNNING record of a new tick.
     *
     * @param tickId            Unique tick id.
     * @param gameTime          Game time the tick advances to.
     * @param triggeredBy       Trigger source.
     * @param triggeredByUserId Operator of a manual tick, may be {@code null}.
     * @return The running record.
     * @throws ConcurrentTickException if another tick is running.
     * @throws ClockDriftException     if {@code gameTime} does not lie after the current game time.
     */
    public TickRecord recordTick(String tickId, GameTime gameTime, TriggerSource triggeredBy, String triggeredByUserId) {
        if (tickId == null || tickId.isBlank()) {
            throw new ValidationException("tickId must not be blank");
        }
        Objects.requireNonNull(gameTime, "gameTime");
        Objects.requireNonNull(triggeredBy, "triggeredBy");

        Optional<TickRecord> running = store.findRunning();
        if (running.isPresent()) {
            throw new ConcurrentTickException(String.format(
                "Cannot start tick '%s': tick '%s' is still running", tickId, running.get().tickId()));
        }
        GameTime current = getCurrentGameTime();
        if (!gameTime.isAfter(current)) {
            log.error("Clock drift: tick '{}' targets {} but the current game time is {}", tickId, gameTime, current);
            throw new ClockDriftException(String.format(
                "Tick '%s' targets %s which does not advance the current game time %s", tickId, gameTime, current));
        }
        TickRecord record = TickRecord.running(tickId, gameTime, triggeredBy, triggeredByUserId, now());
        if (!store.insertRunning(record)) {
            throw new ConcurrentTickException(String.format(
                "Cannot start tick '%s': another tick is running or the id already exists", tickId));
        }
        log.debug("Tick '{}' started for {} ({})", tickId, gameTime, triggeredBy);
        return record;
    }

    /**
     * Finishes a running tick as COMPLETED. {@code success=false} results are allowed.
     *
     * @throws TickNotFoundException if the tick does not exist.
     * @throws IllegalStateException if the tick is already finished.
     */
    public TickRecord completeTick(String tickId, TickResult result) throws TickNotFoundException {
        Objects.requireNonNull(result, "result");
        tracker.closeTick(tickId);
        TickRecord record = store.finish(tickId, TickStatus.COMPLETED, result, null, now());
        if (record.success()) {
            log.info("Tick '{}' completed at {} in {} ms ({} players, {} items)",
                tickId, record.gameTime(), record.durationMs(), result.playersProcessed(), record.totalItemsProcessed());
        } else {
            log.warn("Tick '{}' completed at {} with {} error(s)", tickId, record.gameTime(), record.totalErrors());
        }
        return record;
    }

    /**
     * Finishes a running tick as FAILED and moves players that ran ahead back to the last completed tick.
     * Progress writes of the tick's workers are rejected from here on.
     *
     * @param tickId        The tick.
     * @param reason        Why the tick failed.
     * @param partialResult What was processed before the failure, may be {@code null}.
     * @throws TickNotFoundException if the tick does not exist.
     * @throws IllegalStateException if the tick is already finished.
     */
    public TickRecord failTick(String tickId, String reason, TickResult partialResult) throws TickNotFoundException {
        tracker.closeTick(tickId);
        TickRecord record = store.finish(tickId, TickStatus.FAILED, partialResult,
            reason == null || reason.isBlank() ? "unspecified" : reason, now());
        log.warn("Tick '{}' failed at {}: {}", tickId, record.gameTime(), record.failureReason());
        tracker.reconcileAfterFailure(getCurrentGameTime());
        return record;
    }

    // ========== Orchestration ==========

    /**
     * Runs one tick that advances the clock by one month.
     *
     * @param trigger What started the tick. A scheduled tick running while further ticks are missed
     *                is recorded as {@link TriggerSource#CATCHUP}.
     * @param userId  Operator of a manual tick, may be {@code null}.
     * @return The finished record.
     * @throws ConcurrentTickException if a tick is already running.
     * @throws ClockDriftException     if the store's clock is inconsistent.
     */
    public TickRecord runTick(TriggerSource trigger, String userId) {
        Objects.requireNonNull(trigger, "trigger");
        if (!tickLock.tryLock()) {
            throw new ConcurrentTickException("Tick '" + runningTickId + "' is already running");
        }
        try {
            recoverStaleTick();
            GameTime target = getCurrentGameTime().next();
            TriggerSource source = trigger == TriggerSource.SCHEDULED && getMissedTicks() > 0
                ? TriggerSource.CATCHUP
                : trigger;
            TickRecord running = recordTick(newTickId(target), target, source, userId);
            return execute(running);
        } finally {
            runningTickId = null;
            currentProcessor = null;
            tickLock.unlock();
        }
    }

    /**
     * Runs the ticks the schedule says are due, at most {@code maxCatchUpMonths} of them.
     * Stops at the first failed tick. Manual ticks may run ahead of the schedule, then nothing is due
     * until the schedule reaches them.
     *
     * @return Finished records in execution order, empty if nothing was due.
     * @throws ClockDriftException if the wall clock went back behind a completed scheduled tick.
     */
    public List<TickRecord> runDueTicks() {
        GameTime expected = schedule.expectedGameTime(now());
        Optional<TickRecord> lastScheduled = store.findLatestScheduled();
        if (lastScheduled.isPresent() && lastScheduled.get().gameTime().isAfter(expected)) {
            TickRecord last = lastScheduled.get();
            log.error("Clock drift: schedule expects {} but scheduled tick '{}' already completed {}",
                expected, last.tickId(), last.gameTime());
            throw new ClockDriftException(String.format(
                "Schedule expects %s behind the completed scheduled tick '%s' at %s", expected, last.tickId(), last.gameTime()));
        }
        int due = expected.totalMonths() - getCurrentGameTime().totalMonths();
        if (due <= 0) {
            return List.of();
        }
        int toRun = Math.min(due, config.maxCatchUpMonths());
        if (due > toRun) {
            log.info("{} ticks due, catching up {} now", due, toRun);
        }
        List<TickRecord> records = new ArrayList<>(toRun);
        for (int i = 0; i < toRun; i++) {
            TickRecord record = runTick(TriggerSource.SCHEDULED, null);
            records.add(record);
            if (record.status() == TickStatus.FAILED) {
                break;
            }
        }
        return records;
    }

    /**
     * Runs {@code count} consecutive manual ticks. Stops at the first failed tick.
     *
     * @throws ValidationException if {@code count} is not positive.
     */
    public List<TickRecord> advance(int count, String userId) {
        if (count < 1) {
            throw new ValidationException("count must be at least 1 but was " + count);
        }
        List<TickRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            TickRecord record = runTick(TriggerSource.MANUAL, userId);
            records.add(record);
            if (record.status() == TickStatus.FAILED) {
                log.warn("Manual advance stopped after {} of {} tick(s)", i + 1, count);
                break;
            }
        }
        return records;
    }

    /**
     * Brings one player up to the current game time without creating a tick record.
     * Skipped while a tick is running; that tick picks the player up instead.
     *
     * @param playerId The player.
     * @return Results of the processors that ran, empty if the player was not lagging.
     */
    public List<ProcessorResult> catchUpPlayer(String playerId) {
        tracker.getOrCreate(playerId);
        if (!tickLock.tryLock()) {
            log.debug("Catch-up of player '{}' deferred: tick '{}' is running", playerId, runningTickId);
            return List.of();
        }
        try {
            GameTime current = getCurrentGameTime();
            if (!tracker.isLagging(playerId, current)) {
                return List.of();
            }
            List<ProcessorResult> results = new ArrayList<>();
            long deadline = System.nanoTime() + config.tickTimeout().toNanos();
            String scope = "catch-up-" + playerId + "-" + UUID.randomUUID().toString().substring(0, 8);
            tracker.openTick(scope);
            try {
                for (ITickProcessor processor : registry.getActiveProcessors()) {
                    results.add(runProcessor(processor, current, List.of(playerId), deadline, scope));
                }
                log.debug("Player '{}' caught up to {}", playerId, current);
            } catch (TimeoutException e) {
                log.warn("Catch-up of player '{}' to {} timed out after {}", playerId, current, config.tickTimeout());
            } catch (InterruptedException e) {
                log.debug("Catch-up of player '{}' interrupted", playerId);
                Thread.currentThread().interrupt();
            } finally {
                tracker.closeTick(scope);
            }
            return results;
        } finally {
            tickLock.unlock();
        }
    }

    public TickEngineState getState() {
        Optional<TickRecord> latest = store.findLatestCompleted();
        String running = runningTickId;
        if (running == null) {
            running = store.findRunning().map(TickRecord::tickId).orElse(null);
        }
        return new TickEngineState(
            latest.map(TickRecord::gameTime).orElse(GameTime.INITIAL),
            latest.map(TickRecord::tickId).orElse(null),
            latest.map(TickRecord::completedAt).orElse(null),
            store.countByStatus(TickStatus.COMPLETED),
            store.countByStatus(TickStatus.FAILED),
            running != null,
            running,
            currentProcessor,
            getMissedTicks());
    }

    /**
     * Fails a RUNNING record left behind by a crashed process. A record younger than
     * {@code tickTimeout + staleTickGrace} is treated as a live tick of another node.
     */
    private void recoverStaleTick() {
        Optional<TickRecord> running = store.findRunning();
        if (running.isEmpty()) {
            return;
        }
        TickRecord stale = running.get();
        Duration age = Duration.between(stale.startedAt(), now());
        if (age.compareTo(config.tickTimeout().plus(config.staleTickGrace())) <= 0) {
            throw new ConcurrentTickException(String.format(
                "Tick '%s' is still running (started %d s ago)", stale.tickId(), age.toSeconds()));
        }
        log.warn("Recovering stale tick '{}' running since {}", stale.tickId(), stale.startedAt());
        try {
            failTick(stale.tickId(), "Stale tick recovered after " + age.toSeconds() + " s", stale.result());
        } catch (TickNotFoundException | IllegalStateException e) {
            log.debug("Stale tick '{}' was finished concurrently: {}", stale.tickId(), e.getMessage());
        }
    }

    private TickRecord execute(TickRecord running) {
        String tickId = running.tickId();
        runningTickId = tickId;
        long deadline = System.nanoTime() + config.tickTimeout().toNanos();
        try {
            tracker.openTick(tickId);
        } catch (ConcurrentTickException e) {
            return finishFailed(tickId, e.getMessage(), null);
        }
        try {
            return processTick(running, deadline);
        } finally {
            tracker.closeTick(tickId);
        }
    }

    private TickRecord processTick(TickRecord running, long deadline) {
        String tickId = running.tickId();
        GameTime gameTime = running.gameTime();
        List<String> players = tracker.getUnprocessedPlayers(gameTime);
        List<ProcessorResult> results = new ArrayList<>();
        log.debug("Tick '{}' processing {} lagging player(s)", tickId, players.size());

        try {
            for (ITickProcessor processor : registry.getActiveProcessors()) {
                if (!tracker.isTickOpen(tickId)) {
                    log.warn("Tick '{}' was finished while processing, skipping remaining processors", tickId);
                    return store.findById(tickId).orElseThrow(() -> new IllegalStateException("Tick '" + tickId + "' vanished"));
                }
                currentProcessor = processor.getName();
                results.add(runProcessor(processor, gameTime, players, deadline, tickId));
            }
        } catch (TimeoutException e) {
            TickResult partial = TickResult.aggregate(tickId, gameTime, running.startedAt(), now(), players.size(), results);
            return finishFailed(tickId, String.format("Tick exceeded timeout of %s in processor '%s'",
                config.tickTimeout(), currentProcessor), partial);
        } catch (InterruptedException e) {
            TickResult partial = TickResult.aggregate(tickId, gameTime, running.startedAt(), now(), players.size(), results);
            TickRecord failed = finishFailed(tickId, "Tick interrupted in processor '" + currentProcessor + "'", partial);
            Thread.currentThread().interrupt();
            return failed;
        } catch (RuntimeException e) {
            log.debug("Tick abort details:", e);
            TickResult partial = TickResult.aggregate(tickId, gameTime, running.startedAt(), now(), players.size(), results);
            return finishFailed(tickId, "Tick aborted in processor '" + currentProcessor + "': " + e.getMessage(), partial);
        }

        TickResult result = TickResult.aggregate(tickId, gameTime, running.startedAt(), now(), players.size(), results);
        try {
            return completeTick(tickId, result);
        } catch (TickNotFoundException | IllegalStateException e) {
            // Finished by an operator while processing
            log.warn("Tick '{}' could not be completed: {}", tickId, e.getMessage());
            return store.findById(tickId).orElseThrow(() -> new IllegalStateException("Tick '" + tickId + "' vanished", e));
        }
    }

    private TickRecord finishFailed(String tickId, String reason, TickResult partial) {
        try {
            return failTick(tickId, reason, partial);
        } catch (TickNotFoundException | IllegalStateException e) {
            log.warn("Tick '{}' could not be failed: {}", tickId, e.getMessage());
            return store.findById(tickId).orElseThrow(() -> new IllegalStateException("Tick '" + tickId + "' vanished", e));
        }
    }

    /**
     * Runs one processor over all player batches and merges the batch results.
     * A batch that throws yields a failed result; the other batches are unaffected. On timeout or
     * interrupt the batches are cancelled and awaited before the exception is rethrown.
     *
     * @param scope Tick id the batches' writes are fenced by.
     */
    private ProcessorResult runProcessor(ITickProcessor processor, GameTime gameTime, List<String> players,
                                         long deadline, String scope) throws TimeoutException, InterruptedException {
        String name = processor.getName();
        long startNanos = System.nanoTime();
        BatchGate gate = new BatchGate();
        List<Future<ProcessorResult>> futures = new ArrayList<>();
        for (List<String> batch : partition(players, config.batchSize())) {
            futures.add(workers.submit(() -> gate.run(() -> tracker.callInTick(scope, () -> processor.process(gameTime, batch)))));
        }

        ProcessorResult merged = ProcessorResult.empty(name);
        try {
            for (Future<ProcessorResult> future : futures) {
                ProcessorResult batchResult;
                try {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        throw new TimeoutException("Processor '" + name + "' exceeded the tick deadline");
                    }
                    batchResult = future.get(remaining, TimeUnit.NANOSECONDS);
                    if (batchResult == null) {
                        batchResult = ProcessorResult.failed(name,
                            new IllegalStateException("Processor returned no result"), elapsedMs(startNanos));
                    } else if (!name.equals(batchResult.processor())) {
                        batchResult = new ProcessorResult(name, batchResult.success(), batchResult.itemsProcessed(),
                            batchResult.errorCount(), batchResult.errors(), batchResult.counters(), batchResult.durationMs());
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Processor '{}' failed at {}: {}", name, gameTime, cause.getMessage());
                    log.debug("Processor failure details:", cause);
                    batchResult = ProcessorResult.failed(name, cause, elapsedMs(startNanos));
                }
                merged = merged.merge(batchResult);
            }
        } catch (TimeoutException | InterruptedException e) {
            gate.close();
            futures.forEach(future -> future.cancel(true));
            if (!gate.awaitIdle(WORKER_STOP_WAIT)) {
                log.warn("Processor '{}' left {} worker(s) running at {} after {}, their writes are discarded",
                    name, gate.active(), gameTime, WORKER_STOP_WAIT);
            }
            throw e;
        }
        return new ProcessorResult(name, merged.success(), merged.itemsProcessed(), merged.errorCount(),
            merged.errors(), merged.counters(), elapsedMs(startNanos));
    }

    private static List<List<String>> partition(List<String> players, int batchSize) {
        if (players.isEmpty()) {
            return List.of(List.of());
        }
        List<List<String>> batches = new ArrayList<>();
        for (int from = 0; from < players.size(); from += batchSize) {
            batches.add(List.copyOf(players.subList(from, Math.min(from + batchSize, players.size()))));
        }
        return batches;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String newTickId(GameTime target) {
        return String.format("tick-%d-%s", target.totalMonths(), UUID.randomUUID().toString().substring(0, 8));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    @Override
    public void close() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Tick workers did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Tracks the batches of one processor run. Once closed, batches that have not started yet do nothing.
     */
    private static final class BatchGate {
        private boolean closed;
        private int active;

        <T> T run(Callable<T> work) throws Exception {
            synchronized (this) {
                if (closed) {
                    return null;
                }
                active++;
            }
            try {
                return work.call();
            } finally {
                synchronized (this) {
                    active--;
                    notifyAll();
                }
            }
        }

        synchronized void close() {
            closed = true;
        }

        synchronized int active() {
            return active;
        }

        /**
         * @return {@code true} if no batch is running anymore.
         */
        synchronized boolean awaitIdle(Duration timeout) {
            long deadline = System.nanoTime() + timeout.toNanos();
            try {
                while (active > 0) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        return false;
                    }
                    TimeUnit.NANOSECONDS.timedWait(this, remaining);
                }
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "tick-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
