package org.empiresim.engine.scheduler;

import org.empiresim.engine.api.processors.ITickProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the tick processors known to the scheduler.
 * <p>
 * Processors are validated once at registration; a processor reporting a problem stays registered
 * but disabled, so the remaining subsystems keep running.
 */
public class ProcessorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProcessorRegistry.class);

    private static final Comparator<ITickProcessor> EXECUTION_ORDER =
        Comparator.comparingInt(ITickProcessor::getPriority).thenComparing(ITickProcessor::getName);

    private final Map<String, ITickProcessor> processors = new LinkedHashMap<>();
    private final Map<String, String> disabled = new LinkedHashMap<>();

    /**
     * Registers a processor.
     *
     * @param processor The processor.
     * @return {@code true} if it passed validation and will run.
     * @throws IllegalArgumentException if a processor with the same name is already registered.
     */
    public synchronized boolean register(ITickProcessor processor) {
        String name = processor.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Processor name must not be blank: " + processor.getClass().getName());
        }
        if (processors.containsKey(name)) {
            throw new IllegalArgumentException("Processor '" + name + "' is already registered");
        }
        processors.put(name, processor);

        Optional<String> problem;
        try {
            problem = processor.validate();
        } catch (RuntimeException e) {
            problem = Optional.of("validation threw " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (problem.isPresent()) {
            disabled.put(name, problem.get());
            log.warn("Processor '{}' disabled: {}", name, problem.get());
            return false;
        }
        log.debug("Registered processor '{}' (priority {})", name, processor.getPriority());
        return true;
    }

    /**
     * @return Processors that will run, in execution order.
     */
    public synchronized List<ITickProcessor> getActiveProcessors() {
        List<ITickProcessor> active = new ArrayList<>();
        for (ITickProcessor processor : processors.values()) {
            if (processor.isEnabled() && !disabled.containsKey(processor.getName())) {
                active.add(processor);
            }
        }
        active.sort(EXECUTION_ORDER);
        return active;
    }

    /**
     * @return Disabled processor names with the validation problem.
     */
    public synchronized Map<String, String> getDisabledProcessors() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(disabled));
    }

    public synchronized int size() {
        return processors.size();
    }
}
