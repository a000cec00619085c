package com.heist.backend.service.pipeline;

import com.heist.backend.config.OrchestratorProperties;
import com.heist.backend.model.Signal;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Keys of signals the pipeline has already taken. Only the most recent
 * {@code processedCapacity} keys are remembered.
 */
@Component
public class ProcessedSignalRegistry {

    private final int capacity;
    private final Set<String> keys = new LinkedHashSet<>();

    public ProcessedSignalRegistry(OrchestratorProperties properties) {
        this.capacity = properties.getProcessedCapacity();
    }

    public static String keyOf(Signal signal) {
        return signal.getAddress() + "_" + signal.getTimestamp();
    }

    /**
     * @return true when the key was not seen before and is now recorded
     */
    public synchronized boolean markIfNew(String key) {
        if (!keys.add(key)) {
            return false;
        }
        Iterator<String> oldest = keys.iterator();
        while (keys.size() > capacity && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
        return true;
    }

    public synchronized boolean contains(String key) {
        return keys.contains(key);
    }

    public synchronized int size() {
        return keys.size();
    }
}
