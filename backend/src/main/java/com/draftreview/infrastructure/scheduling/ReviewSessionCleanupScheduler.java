package com.draftreview.infrastructure.scheduling;

import com.draftreview.application.review.ReviewSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ReviewSessionCleanupScheduler {

    private final ReviewSessionStore reviewSessionStore;

    @Scheduled(fixedRate = 3600000)
    public void cleanupExpiredSessions() {
        int evicted = reviewSessionStore.evictExpired();
        log.debug("Cleaned up {} expired review sessions", evicted);
    }
}
