package org.empiresim.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.empiresim.engine.api.resources.database.IOfflineSnapshotStore;
import org.empiresim.engine.players.PlayerTickStateTracker;
import org.empiresim.engine.processors.ProcessorContext;
import org.empiresim.engine.resources.memory.InMemoryOfflineSnapshotStore;
import org.empiresim.runtime.offline.ClampConfig;
import org.empiresim.runtime.probability.LobbyingOdds;

/**
 * Shared setup of engine tests.
 */
public final class EngineFixtures {

    private EngineFixtures() {
    }

    /**
     * @return The resolved {@code empiresim} block of the bundled reference configuration.
     */
    public static Config referenceConfig() {
        return ConfigFactory.parseResources("reference.conf").resolve().getConfig("empiresim");
    }

    /**
     * @return The reference configuration with the in-memory stores and the scheduled trigger disabled.
     */
    public static Config memoryEngineConfig() {
        return ConfigFactory.parseString("engine.database.type = memory\nengine.trigger.enabled = false")
            .withFallback(referenceConfig());
    }

    public static ProcessorContext processorContext(PlayerTickStateTracker tracker) {
        return processorContext(tracker, new InMemoryOfflineSnapshotStore("offline-snapshots", ConfigFactory.empty()),
            ClampConfig.DEFAULT);
    }

    public static ProcessorContext processorContext(PlayerTickStateTracker tracker, IOfflineSnapshotStore snapshots,
                                                    ClampConfig clamp) {
        Config probability = referenceConfig().getConfig("probability");
        return new ProcessorContext(tracker, LobbyingOdds.fromConfig(probability), snapshots, clamp, 4);
    }
}
