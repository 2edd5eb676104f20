package com.deepansh.inbox.trigger;

import com.deepansh.inbox.config.AgentProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded set of recently seen event ids, oldest evicted first.
 * Insertion order, not access order: seeing a duplicate does not extend its life.
 */
@Component
public class RecentEventCache {

    private final int capacity;
    private final Map<String, Boolean> seen;

    @Autowired
    public RecentEventCache(AgentProperties properties) {
        this(properties.getTrigger().getDedupCapacity());
    }

    RecentEventCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("dedup capacity must be positive, was " + capacity);
        }
        this.capacity = capacity;
        this.seen = new LinkedHashMap<>(Math.max(16, capacity), 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > RecentEventCache.this.capacity;
            }
        };
    }

    /** Atomically records the id. @return true if it was not already present */
    public synchronized boolean markIfAbsent(String eventId) {
        return seen.putIfAbsent(eventId, Boolean.TRUE) == null;
    }

    /** Lets a redelivery of this id through again. */
    public synchronized void forget(String eventId) {
        seen.remove(eventId);
    }

    public synchronized boolean contains(String eventId) {
        return seen.containsKey(eventId);
    }

    public synchronized int size() {
        return seen.size();
    }
}
