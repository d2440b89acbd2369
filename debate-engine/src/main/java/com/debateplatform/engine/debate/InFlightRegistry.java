package com.debateplatform.engine.debate;

import com.debateplatform.common.model.EntityPair;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The logical lock on debates: at most one run per pair and kind at any time.
 * Keyed by {@link EntityPair#key()}.
 */
@Component
public class InFlightRegistry {

    public record Ticket(String debateId, EntityPair pair, CancellationToken token) {}

    private final Map<String, Ticket> inFlight = new ConcurrentHashMap<>();

    /** @return the new ticket, or empty when the pair is already running */
    public Optional<Ticket> tryAcquire(EntityPair pair, String debateId) {
        Ticket fresh = new Ticket(debateId, pair, new CancellationToken());
        return inFlight.putIfAbsent(pair.key(), fresh) == null ? Optional.of(fresh) : Optional.empty();
    }

    public Optional<Ticket> current(EntityPair pair) {
        return Optional.ofNullable(inFlight.get(pair.key()));
    }

    public boolean isInFlight(EntityPair pair) {
        return inFlight.containsKey(pair.key());
    }

    /** Releases only the holder's own ticket. */
    public void release(Ticket ticket) {
        inFlight.remove(ticket.pair().key(), ticket);
    }

    /** @return number of runs signalled */
    public int cancelAll() {
        inFlight.values().forEach(t -> t.token().cancel());
        return inFlight.size();
    }

    public int size() {
        return inFlight.size();
    }
}
