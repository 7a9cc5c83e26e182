package com.relay.notification.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.relay.notification.model.UserBehaviorPattern;
import com.relay.notification.repository.BehaviorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Bounded per-user cache of behavior patterns, owned by a single {@link FilterPipeline}.
 *
 * Population is atomic per key: concurrent misses for the same user compute once while
 * other users proceed. Entries never expire; they leave only through eviction at capacity
 * or explicit invalidation.
 */
public class BehaviorCache {

    private static final Logger log = LoggerFactory.getLogger(BehaviorCache.class);

    private final Cache<String, UserBehaviorPattern> cache;
    private final BehaviorStore store;

    /**
     * @param store optional durable store; may be null
     */
    public BehaviorCache(long capacity, BehaviorStore store) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(capacity)
                .recordStats()
                .build();
        this.store = store;
    }

    /**
     * Cached pattern for {@code userId}; on a miss, load it from the store or analyze it and save it.
     */
    public UserBehaviorPattern getOrCompute(String userId, Supplier<UserBehaviorPattern> analyzer) {
        return cache.get(userId, id -> loadOrAnalyze(id, analyzer));
    }

    public Optional<UserBehaviorPattern> getIfPresent(String userId) {
        return Optional.ofNullable(cache.getIfPresent(userId));
    }

    public void invalidate(String userId) {
        cache.invalidate(userId);
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    Cache<String, UserBehaviorPattern> nativeCache() {
        return cache;
    }

    private UserBehaviorPattern loadOrAnalyze(String userId, Supplier<UserBehaviorPattern> analyzer) {
        if (store != null) {
            Optional<UserBehaviorPattern> stored = store.load(userId);
            if (stored.isPresent()) {
                log.debug("Loaded behavior pattern for {} from store", userId);
                return stored.get();
            }
        }

        UserBehaviorPattern pattern = analyzer.get();
        if (store != null) {
            store.save(userId, pattern);
        }
        log.debug("Analyzed behavior pattern for {}: {} preferred categories, fatigue {}",
                userId, pattern.getPreferredCategories().size(), pattern.fatigueCount());
        return pattern;
    }
}
