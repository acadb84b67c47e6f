package org.empiresim.engine.processors;

import com.typesafe.config.Config;
import org.empiresim.engine.api.processors.ITickProcessor;
import org.empiresim.engine.api.processors.ProcessorResult;
import org.empiresim.engine.api.processors.TickError;
import org.empiresim.engine.api.ticks.ClosedTickWriteException;
import org.empiresim.runtime.model.GameTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Base class of per-player tick processors.
 * <p>
 * Handles the bookkeeping every subsystem needs: players this processor already applied at the given
 * game time are skipped (their tick still advances, e.g. after a failed tick was reconciled), a
 * failing player is reported as a recoverable {@link TickError} without affecting the rest of the
 * batch, and successful players are marked processed together with the counters returned by
 * {@link #processPlayer(String, GameTime)}. A write rejected because the tick was
 * closed ends the batch with a {@link ClosedTickWriteException}.
 * <p>
 * Subclasses are instantiated reflectively with the constructor
 * {@code (String name, Config options, ProcessorContext context)}.
 */
public abstract class AbstractTickProcessor implements ITickProcessor {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String name;
    protected final Config options;
    protected final ProcessorContext context;
    private final int priority;
    private final boolean enabled;

    protected AbstractTickProcessor(String name, Config options, ProcessorContext context) {
        this.name = Objects.requireNonNull(name, "name");
        this.options = Objects.requireNonNull(options, "options");
        this.context = Objects.requireNonNull(context, "context");
        this.priority = options.hasPath("priority") ? options.getInt("priority") : defaultPriority();
        this.enabled = !options.hasPath("enabled") || options.getBoolean("enabled");
    }

    /**
     * Priority used when the configuration does not set one.
     */
    protected int defaultPriority() {
        return 100;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public final ProcessorResult process(GameTime gameTime, List<String> playerIds) throws Exception {
        long startNanos = System.nanoTime();
        int processed = 0;
        long skipped = 0;
        List<TickError> errors = new ArrayList<>();
        Map<String, Long> counters = new LinkedHashMap<>();

        for (String playerId : playerIds) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Processor '" + name + "' interrupted at " + gameTime);
            }
            if (context.tracker().hasProcessed(playerId, name, gameTime)) {
                context.tracker().markProcessed(playerId, gameTime, name);
                skipped++;
                continue;
            }
            try {
                Map<String, Long> increments = processPlayer(playerId, gameTime);
                Map<String, Long> safeIncrements = increments == null ? Map.of() : increments;
                context.tracker().markProcessed(playerId, gameTime, name, safeIncrements);
                safeIncrements.forEach((key, value) -> counters.merge(key, value, Long::sum));
                processed++;
            } catch (InterruptedException | ClosedTickWriteException e) {
                throw e;
            } catch (Exception e) {
                log.warn("Processor '{}' failed for player '{}' at {}: {}", name, playerId, gameTime, e.getMessage());
                log.debug("Player failure details:", e);
                errors.add(TickError.forPlayer(playerId, e));
            }
        }
        if (skipped > 0) {
            counters.put("playersSkipped", skipped);
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        return ProcessorResult.of(name, processed, errors, counters, durationMs);
    }

    /**
     * Applies this subsystem's effects to one player.
     *
     * @param playerId The player.
     * @param gameTime The game time being processed.
     * @return Counter increments recorded in the player's subsystem state, may be empty.
     * @throws Exception if the player could not be processed; the player is retried on the next tick.
     */
    protected abstract Map<String, Long> processPlayer(String playerId, GameTime gameTime) throws Exception;
}
