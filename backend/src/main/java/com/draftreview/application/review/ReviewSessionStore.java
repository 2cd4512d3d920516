package com.draftreview.application.review;

import com.draftreview.application.review.exception.ReviewSessionNotFoundException;
import com.draftreview.domain.review.model.Critique;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory review sessions with a fixed time to live.
 */
@Slf4j
@Component
public class ReviewSessionStore {

    private final Map<String, ReviewSession> sessions = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public ReviewSessionStore(@Value("${review.session.ttl:2h}") Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    ReviewSessionStore(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public ReviewSession save(Critique critique) {
        Instant now = clock.instant();
        ReviewSession session = new ReviewSession(UUID.randomUUID().toString(), critique, now, now.plus(ttl));
        sessions.put(session.getId(), session);
        return session;
    }

    /**
     * @throws ReviewSessionNotFoundException when the session is unknown or expired
     */
    public ReviewSession get(String reviewId) {
        ReviewSession session = sessions.get(reviewId);
        if (session == null || session.isExpired(clock.instant())) {
            throw new ReviewSessionNotFoundException(reviewId);
        }
        return session;
    }

    public int evictExpired() {
        Instant now = clock.instant();
        int before = sessions.size();
        sessions.values().removeIf(session -> session.isExpired(now));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.info("[ReviewSessionStore] Evicted {} expired review sessions, {} remaining", evicted, sessions.size());
        }
        return evicted;
    }

    public int size() {
        return sessions.size();
    }
}
