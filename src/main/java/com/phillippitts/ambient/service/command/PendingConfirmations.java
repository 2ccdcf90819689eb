package com.phillippitts.ambient.service.command;

import com.phillippitts.ambient.config.properties.CommandProperties;
import com.phillippitts.ambient.domain.Clarification;
import com.phillippitts.ambient.service.command.clarifier.ClarifierReply;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Clarifications awaiting confirmation, keyed by request id, at most one per session.
 * Registering a new clarification for a session replaces the previous one; taking a
 * clarification removes it, so a request can be confirmed at most once. Expired entries are
 * evicted whenever a new clarification is registered.
 */
@Component
public class PendingConfirmations {

    private static final Logger LOG = LogManager.getLogger(PendingConfirmations.class);
    static final String DEFAULT_SESSION = "default";

    private final Duration ttl;
    private final Clock clock;
    private final Map<String, Clarification> byRequestId = new HashMap<>();
    private final Map<String, String> requestIdBySession = new HashMap<>();

    public PendingConfirmations(CommandProperties props, Clock clock) {
        this.ttl = Duration.ofMillis(props.getConfirmationTtlMs());
        this.clock = Objects.requireNonNull(clock);
    }

    public synchronized Clarification register(String sessionId, ClarifierReply reply) {
        String session = normalizeSession(sessionId);
        Instant now = Instant.now(clock);
        evictExpired(now);
        String previous = requestIdBySession.remove(session);
        if (previous != null && byRequestId.remove(previous) != null) {
            LOG.debug("Replaced pending clarification {} for session {}", previous, session);
        }
        Clarification c = new Clarification(UUID.randomUUID().toString(), session, reply.clarifiedIntent(),
                reply.actionSteps(), reply.confidence(), now.plus(ttl));
        byRequestId.put(c.requestId(), c);
        requestIdBySession.put(session, c.requestId());
        return c;
    }

    /**
     * Removes and returns the clarification.
     *
     * @return empty when the request id is unknown, already taken or expired
     */
    public synchronized Optional<Clarification> take(String requestId) {
        if (requestId == null) {
            return Optional.empty();
        }
        Clarification c = byRequestId.remove(requestId);
        if (c == null) {
            return Optional.empty();
        }
        requestIdBySession.remove(c.sessionId(), requestId);
        if (c.isExpired(Instant.now(clock))) {
            LOG.debug("Clarification {} expired at {}", requestId, c.expiresAt());
            return Optional.empty();
        }
        return Optional.of(c);
    }

    public synchronized Optional<Clarification> pendingFor(String sessionId) {
        String requestId = requestIdBySession.get(normalizeSession(sessionId));
        if (requestId == null) {
            return Optional.empty();
        }
        Clarification c = byRequestId.get(requestId);
        return c == null || c.isExpired(Instant.now(clock)) ? Optional.empty() : Optional.of(c);
    }

    synchronized int size() {
        return byRequestId.size();
    }

    private void evictExpired(Instant now) {
        Iterator<Clarification> it = byRequestId.values().iterator();
        int evicted = 0;
        while (it.hasNext()) {
            Clarification c = it.next();
            if (c.isExpired(now)) {
                it.remove();
                requestIdBySession.remove(c.sessionId(), c.requestId());
                evicted++;
            }
        }
        if (evicted > 0) {
            LOG.debug("Evicted {} expired clarification(s)", evicted);
        }
    }

    static String normalizeSession(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? DEFAULT_SESSION : sessionId.trim();
    }
}
