package com.jreinhal.annotator.visibility;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.jreinhal.annotator.model.AnnotationRecord;
import com.jreinhal.annotator.store.RecordStore;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * The one cached copy of the full record set.
 *
 * <p>Entries expire after {@code annotator.cache.ttl}. Callers invalidate explicitly after a
 * claim, after a save and when the acting user changes; nothing else drops the entry.</p>
 */
@Component
public class RecordSetCache {
    private static final Logger log = LoggerFactory.getLogger(RecordSetCache.class);
    private static final String KEY = "records";

    private final RecordStore recordStore;
    private final Cache<String, Map<String, AnnotationRecord>> cache;

    @Autowired
    public RecordSetCache(RecordStore recordStore, @Value("${annotator.cache.ttl:5m}") Duration ttl) {
        this(recordStore, ttl, Ticker.systemTicker());
    }

    RecordSetCache(RecordStore recordStore, Duration ttl, Ticker ticker) {
        this.recordStore = recordStore;
        this.cache = Caffeine.newBuilder()
            .maximumSize(1L)
            .expireAfterWrite(ttl)
            .ticker(ticker)
            .recordStats()
            .build();
    }

    /**
     * @throws com.jreinhal.annotator.store.StoreUnavailableException when a reload is needed and fails
     */
    public Map<String, AnnotationRecord> snapshot() {
        return cache.get(KEY, key -> {
            Map<String, AnnotationRecord> loaded = Collections.unmodifiableMap(recordStore.loadAll());
            log.debug("Record set reloaded from {} ({} records)", recordStore.describe(), loaded.size());
            return loaded;
        });
    }

    public void invalidate() {
        cache.invalidateAll();
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
