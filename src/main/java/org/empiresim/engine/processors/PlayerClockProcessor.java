package org.empiresim.engine.processors;

import com.typesafe.config.Config;
import org.empiresim.engine.api.players.SystemState;
import org.empiresim.runtime.model.GameTime;

import java.util.Map;

/**
 * Advances every lagging player's clock, even when no domain processor touches the player.
 * Runs last by default and counts the game months each player has lived through.
 */
public class PlayerClockProcessor extends AbstractTickProcessor {

    public static final String MONTHS_ADVANCED = "monthsAdvanced";

    public PlayerClockProcessor(String name, Config options, ProcessorContext context) {
        super(name, options, context);
    }

    @Override
    protected int defaultPriority() {
        return 1000;
    }

    @Override
    protected Map<String, Long> processPlayer(String playerId, GameTime gameTime) {
        GameTime previous = context.tracker().getOrCreate(playerId).system(name)
            .map(SystemState::lastProcessed)
            .orElse(GameTime.ZERO);
        return Map.of(MONTHS_ADVANCED, (long) (gameTime.totalMonths() - previous.totalMonths()));
    }
}
