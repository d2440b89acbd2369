package com.debateplatform.engine.cache;

import com.debateplatform.common.exception.CacheInconsistencyException;
import com.debateplatform.common.model.CacheEntry;
import com.debateplatform.common.model.CacheKey;
import com.debateplatform.common.model.DebateResult;
import com.debateplatform.common.model.EntityPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory cache of completed debate results, keyed by {@link CacheKey}
 * (pair plus input fingerprint).
 *
 * <p><strong>Push invalidation:</strong> {@link #invalidate(String, Instant)} deletes every entry
 * whose pair references the entity, via the entity → keys index, and remembers the mutation
 * instant. A result computed from a context snapshot taken at or before that instant can no longer
 * publish: {@link #put} rejects it with {@link CacheInconsistencyException}.
 *
 * <p>TTL is the secondary safety net; expired entries are evicted on read and by
 * {@link #evictExpired()}.
 *
 * <p>Compound updates of the entry map and its indexes are serialized on this instance;
 * every method is a short in-memory operation safe to call inside a reactive chain.
 */
@Component
public class DebateResultCache {

    private static final Logger log = LoggerFactory.getLogger(DebateResultCache.class);

    private final Clock clock;

    private final Map<CacheKey, CacheEntry>   entries         = new HashMap<>();
    private final Map<String, Set<CacheKey>>  keysByEntity    = new HashMap<>();
    private final Map<String, CacheKey>       latestByPair    = new HashMap<>();
    private final Map<String, Instant>        lastInvalidated = new HashMap<>();

    private final AtomicLong hits          = new AtomicLong();
    private final AtomicLong misses        = new AtomicLong();
    private final AtomicLong evictions     = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();

    public DebateResultCache(Clock clock) {
        this.clock = clock;
    }

    /** Returns the live entry for exactly this key; an expired entry is evicted and reported as a miss. */
    public synchronized Optional<CacheEntry> get(CacheKey key) {
        CacheEntry entry = entries.get(key);
        if (entry != null && entry.isExpired(clock.instant())) {
            remove(key);
            evictions.incrementAndGet();
            entry = null;
        }
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry);
    }

    /** The most recent live entry for the pair, whatever fingerprint it was computed from. */
    public synchronized Optional<CacheEntry> findLatest(EntityPair pair) {
        CacheKey key = latestByPair.get(pair.key());
        return key == null ? Optional.empty() : get(key);
    }

    /**
     * Stores a completed result.
     *
     * @param snapshotAt instant the input snapshot behind {@code result} was taken
     * @throws CacheInconsistencyException when either entity was mutated at or after that instant
     */
    public synchronized CacheEntry put(CacheKey key, DebateResult result, Duration ttl, Instant snapshotAt) {
        EntityPair pair = key.pair();
        for (String entityId : List.of(pair.primaryId(), pair.secondaryId())) {
            Instant mutatedAt = lastInvalidated.get(entityId);
            if (mutatedAt != null && !snapshotAt.isAfter(mutatedAt)) {
                throw new CacheInconsistencyException("result of debate " + result.debateId()
                    + " predates mutation of entity " + entityId + " at " + mutatedAt);
            }
        }

        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(key, result, now, now.plus(ttl));

        // an older fingerprint of the same pair is stale once a newer result lands
        CacheKey previous = latestByPair.put(pair.key(), key);
        if (previous != null && !previous.equals(key)) {
            remove(previous);
        }
        entries.put(key, entry);
        keysByEntity.computeIfAbsent(pair.primaryId(), id -> new HashSet<>()).add(key);
        keysByEntity.computeIfAbsent(pair.secondaryId(), id -> new HashSet<>()).add(key);

        log.info("CACHE_PUT pair={} debateId={} score={} expiresAt={}",
                 pair.key(), result.debateId(), result.score(), entry.expiresAt());
        return entry;
    }

    /**
     * Deletes every entry referencing {@code entityId} and records the mutation instant.
     *
     * @return number of entries removed
     */
    public synchronized int invalidate(String entityId, Instant mutatedAt) {
        lastInvalidated.merge(entityId, mutatedAt, (a, b) -> a.isAfter(b) ? a : b);
        Set<CacheKey> keys = keysByEntity.remove(entityId);
        int removed = 0;
        if (keys != null) {
            for (CacheKey key : Set.copyOf(keys)) {
                if (remove(key)) {
                    removed++;
                }
            }
        }
        invalidations.addAndGet(removed);
        log.info("CACHE_INVALIDATE entityId={} removed={} mutatedAt={}", entityId, removed, mutatedAt);
        return removed;
    }

    public int invalidate(String entityId) {
        return invalidate(entityId, clock.instant());
    }

    /** Sweeps all expired entries. */
    public synchronized int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (CacheEntry entry : new ArrayList<>(entries.values())) {
            if (entry.isExpired(now) && remove(entry.key())) {
                removed++;
            }
        }
        evictions.addAndGet(removed);
        if (removed > 0) {
            log.info("CACHE_EVICT_EXPIRED removed={}", removed);
        }
        return removed;
    }

    public synchronized CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), evictions.get(), invalidations.get(), entries.size());
    }

    private boolean remove(CacheKey key) {
        CacheEntry removed = entries.remove(key);
        if (removed == null) {
            return false;
        }
        EntityPair pair = key.pair();
        for (String entityId : new String[] {pair.primaryId(), pair.secondaryId()}) {
            Set<CacheKey> keys = keysByEntity.get(entityId);
            if (keys != null) {
                keys.remove(key);
                if (keys.isEmpty()) {
                    keysByEntity.remove(entityId);
                }
            }
        }
        latestByPair.remove(pair.key(), key);
        return true;
    }
}
