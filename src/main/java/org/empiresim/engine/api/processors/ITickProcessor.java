package org.empiresim.engine.api.processors;

import org.empiresim.runtime.model.GameTime;

import java.util.List;
import java.util.Optional;

/**
 * A game subsystem (banking, elections, research, ...) that the scheduler drives once per tick.
 * <p>
 * The scheduler only knows this contract. It calls processors in ascending {@link #getPriority()}
 * order with the players that lag behind the tick, and aggregates the returned counts. A processor
 * must be safe to call concurrently for disjoint player batches.
 */
public interface ITickProcessor {

    /**
     * @return Unique processor name, used in tick records and per-player system state.
     */
    String getName();

    /**
     * @return Execution order; lower runs first.
     */
    default int getPriority() {
        return 100;
    }

    /**
     * @return {@code false} to skip the processor without removing it from the registry.
     */
    default boolean isEnabled() {
        return true;
    }

    /**
     * Checks the processor's configuration once at registration.
     *
     * @return A problem description, or empty if the processor is usable.
     */
    default Optional<String> validate() {
        return Optional.empty();
    }

    /**
     * Applies this subsystem's effects for the given players at the given game time.
     * Per-player failures should be reported in the result; a thrown exception fails the whole batch.
     *
     * @param gameTime  The tick being processed.
     * @param playerIds Players to process; never null.
     * @return The processing result.
     * @throws Exception if the processor cannot handle the batch at all.
     */
    ProcessorResult process(GameTime gameTime, List<String> playerIds) throws Exception;
}
