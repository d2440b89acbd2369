package com.debateplatform.engine.cache;

import com.debateplatform.common.exception.CacheInconsistencyException;
import com.debateplatform.common.model.CacheKey;
import com.debateplatform.common.model.DebateKind;
import com.debateplatform.common.model.DebateResult;
import com.debateplatform.common.model.EntityPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static com.debateplatform.engine.DebateFixtures.NOW;
import static com.debateplatform.engine.DebateFixtures.PAIR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DebateResultCacheTest {

    private static final Duration TTL = Duration.ofHours(24);

    private MutableClock clock;
    private DebateResultCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        cache = new DebateResultCache(clock);
    }

    private static DebateResult result(String debateId, EntityPair pair) {
        return new DebateResult(debateId, pair, 72.0, 0.8, "fit", List.of(), List.of(),
            "bull case", "bear case", 1, 5.0, "default-v1", 1120, NOW);
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        void hitOnlyForTheExactFingerprint() {
            CacheKey key = new CacheKey(PAIR, "fp-1");
            cache.put(key, result("d-1", PAIR), TTL, NOW.minusSeconds(30));

            assertThat(cache.get(key)).isPresent();
            assertThat(cache.get(new CacheKey(PAIR, "fp-2"))).isEmpty();
            assertThat(cache.findLatest(PAIR)).map(e -> e.result().debateId()).contains("d-1");

            CacheStats stats = cache.stats();
            assertThat(stats.hits()).isEqualTo(2);
            assertThat(stats.misses()).isEqualTo(1);
        }

        @Test
        @DisplayName("a newer fingerprint replaces the pair's older entry")
        void newerFingerprintReplacesOlder() {
            cache.put(new CacheKey(PAIR, "fp-1"), result("d-1", PAIR), TTL, NOW.minusSeconds(60));
            cache.put(new CacheKey(PAIR, "fp-2"), result("d-2", PAIR), TTL, NOW.minusSeconds(30));

            assertThat(cache.get(new CacheKey(PAIR, "fp-1"))).isEmpty();
            assertThat(cache.findLatest(PAIR)).map(e -> e.result().debateId()).contains("d-2");
            assertThat(cache.stats().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("expired entries are never served")
        void expiredEntriesEvicted() {
            CacheKey key = new CacheKey(PAIR, "fp-1");
            cache.put(key, result("d-1", PAIR), TTL, NOW.minusSeconds(30));

            clock.advance(TTL);

            assertThat(cache.get(key)).isEmpty();
            assertThat(cache.stats().evictions()).isEqualTo(1);
        }

        @Test
        void sweepRemovesOnlyExpired() {
            EntityPair other = EntityPair.of("fund-2", "lp-9", DebateKind.LP_MATCH);
            cache.put(new CacheKey(PAIR, "fp-1"), result("d-1", PAIR), Duration.ofMinutes(5), NOW.minusSeconds(30));
            cache.put(new CacheKey(other, "fp-9"), result("d-9", other), TTL, NOW.minusSeconds(30));

            clock.advance(Duration.ofMinutes(10));

            assertThat(cache.evictExpired()).isEqualTo(1);
            assertThat(cache.findLatest(other)).isPresent();
        }
    }

    @Nested
    @DisplayName("invalidation")
    class Invalidation {

        @Test
        @DisplayName("a mutation removes every entry referencing the entity")
        void mutationRemovesReferencingEntries() {
            EntityPair samePrimary = EntityPair.of("fund-1", "lp-3", DebateKind.LP_MATCH);
            EntityPair unrelated = EntityPair.of("fund-2", "lp-4", DebateKind.LP_MATCH);
            cache.put(new CacheKey(PAIR, "a"), result("d-1", PAIR), TTL, NOW.minusSeconds(30));
            cache.put(new CacheKey(samePrimary, "b"), result("d-2", samePrimary), TTL, NOW.minusSeconds(30));
            cache.put(new CacheKey(unrelated, "c"), result("d-3", unrelated), TTL, NOW.minusSeconds(30));

            assertThat(cache.invalidate("fund-1")).isEqualTo(2);

            assertThat(cache.findLatest(PAIR)).isEmpty();
            assertThat(cache.findLatest(samePrimary)).isEmpty();
            assertThat(cache.findLatest(unrelated)).isPresent();
            assertThat(cache.stats().invalidations()).isEqualTo(2);
        }

        @Test
        @DisplayName("a result from a snapshot taken before the mutation cannot publish")
        void staleResultRejected() {
            Instant snapshotAt = NOW.minusSeconds(60);
            cache.invalidate("lp-9", NOW.minusSeconds(10));

            assertThatThrownBy(() -> cache.put(new CacheKey(PAIR, "fp-1"), result("d-1", PAIR), TTL, snapshotAt))
                .isInstanceOf(CacheInconsistencyException.class)
                .hasMessageContaining("lp-9");
            assertThat(cache.findLatest(PAIR)).isEmpty();
        }

        @Test
        @DisplayName("a result from a snapshot taken after the mutation publishes normally")
        void freshResultAccepted() {
            cache.invalidate("lp-9", NOW.minusSeconds(60));

            cache.put(new CacheKey(PAIR, "fp-1"), result("d-1", PAIR), TTL, NOW.minusSeconds(10));

            assertThat(cache.findLatest(PAIR)).isPresent();
        }

        @Test
        void samePrimaryAndSecondaryIdIsAccepted() {
            EntityPair self = EntityPair.of("org-1", "org-1", DebateKind.DATA_ENRICHMENT);
            cache.put(new CacheKey(self, "fp"), result("d-1", self), TTL, NOW.minusSeconds(10));

            assertThat(cache.invalidate("org-1")).isEqualTo(1);
        }
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
