package com.warmlead.crm.sync.search;

import com.warmlead.crm.sync.config.SearchProperties;
import com.warmlead.crm.sync.pipedrive.PipedrivePerson;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory LRU cache with a fixed time to live.
 * 
 * When full, the least recently read entry is evicted. Expired entries are dropped on read.
 * Per instance: each service node keeps its own entries.
 */
@Component
public class LruSearchResultCache implements SearchResultCache {

    private final Clock clock;
    private final long ttlMs;
    private final Map<String, Entry> entries;

    @Autowired
    public LruSearchResultCache(SearchProperties properties, Clock clock) {
        this(clock, properties.getCacheTtl().toMillis(), properties.getCacheMaxEntries());
    }

    LruSearchResultCache(Clock clock, long ttlMs, int maxEntries) {
        this.clock = clock;
        this.ttlMs = Math.max(0, ttlMs);
        int capacity = Math.max(1, maxEntries);
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                return size() > capacity;
            }
        };
    }

    @Override
    public synchronized Optional<List<PipedrivePerson>> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAtMs() <= clock.millis()) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.results());
    }

    @Override
    public synchronized void put(String key, List<PipedrivePerson> results) {
        if (key == null || results == null) {
            return;
        }
        entries.put(key, new Entry(List.copyOf(results), clock.millis() + ttlMs));
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    private record Entry(List<PipedrivePerson> results, long expiresAtMs) {
    }
}
