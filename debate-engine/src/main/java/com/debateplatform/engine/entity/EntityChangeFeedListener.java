package com.debateplatform.engine.entity;

import com.debateplatform.engine.cache.DebateResultCache;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Push invalidation: every entity mutation evicts the cached results referencing the entity.
 *
 * <p>Mutations arrive through the entity store's event stream (when
 * {@code services.entity-store.mutation-stream-enabled} is set) and through the
 * {@code POST /api/v1/entities/{id}/mutations} webhook. The stream subscription reconnects
 * with backoff for as long as the service runs.
 */
@Component
public class EntityChangeFeedListener {

    private static final Logger log = LoggerFactory.getLogger(EntityChangeFeedListener.class);

    private final EntityStore entityStore;
    private final DebateResultCache cache;
    private final Clock clock;
    private final boolean streamEnabled;

    private Disposable subscription;

    public EntityChangeFeedListener(EntityStore entityStore,
                                    DebateResultCache cache,
                                    Clock clock,
                                    @Value("${services.entity-store.mutation-stream-enabled:false}") boolean streamEnabled) {
        this.entityStore   = entityStore;
        this.cache         = cache;
        this.clock         = clock;
        this.streamEnabled = streamEnabled;
    }

    @PostConstruct
    public void subscribe() {
        if (!streamEnabled) {
            log.info("Entity mutation stream disabled; relying on the mutation webhook");
            return;
        }
        subscription = entityStore.mutations()
            .doOnSubscribe(s -> log.info("Entity mutation stream connected"))
            .repeat()
            .retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(1))
                .maxBackoff(Duration.ofMinutes(1))
                .doBeforeRetry(signal -> log.warn("Entity mutation stream dropped, reconnecting. attempt={} reason={}",
                                                  signal.totalRetries() + 1, signal.failure().getMessage())))
            .subscribe(this::onMutation,
                       err -> log.error("Entity mutation stream terminated", err));
    }

    /**
     * Invalidates at the later of the event time and the receipt time, so a debate whose context
     * was loaded before this service learned of the change cannot publish.
     *
     * @return number of cache entries removed
     */
    public int onMutation(EntityMutation mutation) {
        Instant received = clock.instant();
        Instant at = mutation.occurredAt() != null && mutation.occurredAt().isAfter(received)
            ? mutation.occurredAt() : received;
        return cache.invalidate(mutation.entityId(), at);
    }

    @PreDestroy
    public void shutdown() {
        if (subscription != null) {
            subscription.dispose();
        }
    }
}
