package org.empiresim.engine.resources.memory;

import com.typesafe.config.Config;
import org.empiresim.engine.api.resources.database.ITickRecordStore;
import org.empiresim.engine.api.ticks.TickNotFoundException;
import org.empiresim.engine.api.ticks.TickRecord;
import org.empiresim.engine.api.ticks.TickResult;
import org.empiresim.engine.api.ticks.TickStatus;
import org.empiresim.engine.api.ticks.TriggerSource;
import org.empiresim.engine.resources.AbstractResource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tick record store kept on the heap. Used in tests and single-process development runs.
 * All operations synchronize on the store, so the running check and the insert are one atomic step.
 */
public class InMemoryTickRecordStore extends AbstractResource implements ITickRecordStore {

    private final Map<String, TickRecord> records = new LinkedHashMap<>();
    private final AtomicLong rejectedInserts = new AtomicLong();

    public InMemoryTickRecordStore(String name, Config options) {
        super(name, options);
    }

    @Override
    public synchronized boolean insertRunning(TickRecord record) {
        if (!record.isRunning()) {
            throw new IllegalArgumentException("Only RUNNING records can be inserted, got " + record.status());
        }
        boolean anotherRunning = records.values().stream().anyMatch(TickRecord::isRunning);
        if (anotherRunning || records.containsKey(record.tickId())) {
            rejectedInserts.incrementAndGet();
            return false;
        }
        records.put(record.tickId(), record);
        return true;
    }

    @Override
    public synchronized TickRecord finish(String tickId, TickStatus status, TickResult result, String reason,
                                          Instant completedAt) throws TickNotFoundException {
        TickRecord existing = records.get(tickId);
        if (existing == null) {
            throw new TickNotFoundException(tickId);
        }
        TickRecord finished = existing.finish(status, result, reason, completedAt);
        records.put(tickId, finished);
        return finished;
    }

    @Override
    public synchronized Optional<TickRecord> findById(String tickId) {
        return Optional.ofNullable(records.get(tickId));
    }

    @Override
    public synchronized Optional<TickRecord> findRunning() {
        return records.values().stream().filter(TickRecord::isRunning).findFirst();
    }

    @Override
    public synchronized Optional<TickRecord> findLatestCompleted() {
        return records.values().stream()
            .filter(r -> r.status() == TickStatus.COMPLETED)
            .max(Comparator.comparing(TickRecord::gameTime));
    }

    @Override
    public synchronized Optional<TickRecord> findLatestScheduled() {
        return records.values().stream()
            .filter(r -> r.status() == TickStatus.COMPLETED && r.triggeredBy() != TriggerSource.MANUAL)
            .max(Comparator.comparing(TickRecord::gameTime));
    }

    @Override
    public synchronized List<TickRecord> findRecent(int limit) {
        List<TickRecord> all = new ArrayList<>(records.values());
        all.sort(Comparator.comparing(TickRecord::startedAt).reversed());
        return all.subList(0, Math.min(Math.max(limit, 0), all.size()));
    }

    @Override
    public synchronized long countByStatus(TickStatus status) {
        return records.values().stream().filter(r -> r.status() == status).count();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        synchronized (this) {
            metrics.put("records", records.size());
        }
        metrics.put("rejected_inserts", rejectedInserts.get());
    }
}
