package org.empiresim.engine.api.processors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one processor for one tick (or one batch of players within a tick).
 * <p>
 * {@code errorCount} is the exact number of errors; {@code errors} keeps at most
 * {@link #MAX_RETAINED_ERRORS} of them to bound the size of the stored tick result.
 *
 * @param processor      Processor name.
 * @param success        {@code false} if any error occurred.
 * @param itemsProcessed Entities handled successfully.
 * @param errorCount     Total number of errors.
 * @param errors         Retained error details.
 * @param counters       Processor-specific summary counters.
 * @param durationMs     Wall-clock duration.
 */
public record ProcessorResult(
    String processor,
    boolean success,
    int itemsProcessed,
    int errorCount,
    List<TickError> errors,
    Map<String, Long> counters,
    long durationMs
) {

    public static final int MAX_RETAINED_ERRORS = 50;

    public ProcessorResult {
        Objects.requireNonNull(processor, "processor");
        errors = errors == null ? List.of() : List.copyOf(errors.subList(0, Math.min(errors.size(), MAX_RETAINED_ERRORS)));
        counters = counters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }

    public static ProcessorResult of(String processor, int itemsProcessed, List<TickError> errors,
                                     Map<String, Long> counters, long durationMs) {
        int errorCount = errors == null ? 0 : errors.size();
        return new ProcessorResult(processor, errorCount == 0, itemsProcessed, errorCount, errors, counters, durationMs);
    }

    /**
     * A processor that threw instead of returning a result.
     */
    public static ProcessorResult failed(String processor, Throwable cause, long durationMs) {
        return new ProcessorResult(processor, false, 0, 1, List.of(TickError.forProcessor(processor, cause)), Map.of(), durationMs);
    }

    public static ProcessorResult empty(String processor) {
        return new ProcessorResult(processor, true, 0, 0, List.of(), Map.of(), 0);
    }

    /**
     * Combines the results of two batches of the same processor. Durations are summed.
     */
    public ProcessorResult merge(ProcessorResult other) {
        if (!processor.equals(other.processor)) {
            throw new IllegalArgumentException("Cannot merge results of '" + processor + "' and '" + other.processor + "'");
        }
        List<TickError> mergedErrors = new ArrayList<>(errors);
        mergedErrors.addAll(other.errors);
        Map<String, Long> mergedCounters = new LinkedHashMap<>(counters);
        other.counters.forEach((key, value) -> mergedCounters.merge(key, value, Long::sum));
        return new ProcessorResult(processor, success && other.success, itemsProcessed + other.itemsProcessed,
            errorCount + other.errorCount, mergedErrors, mergedCounters, durationMs + other.durationMs);
    }
}
