package com.waterCompliance.complianceDemo.orchestrator.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.waterCompliance.complianceDemo.broadcast.service.StatusBroadcastHub;
import com.waterCompliance.complianceDemo.orchestrator.model.AnalysisSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Session registry backed by a Caffeine cache.
 *
 * Sessions stay readable for the retention window after their last access; eviction
 * also closes the session's broadcast channel.
 */
@Slf4j
@Service
public class SessionService {

    private final Cache<String, AnalysisSession> sessionCache;
    private final Clock clock;

    public SessionService(StatusBroadcastHub broadcastHub,
                          Clock clock,
                          @Value("${analysis.session.retention:PT30M}") Duration retention,
                          @Value("${analysis.session.max-sessions:10000}") long maxSessions) {
        this.clock = clock;
        this.sessionCache = Caffeine.newBuilder()
                .expireAfterAccess(retention)
                .maximumSize(maxSessions)
                .removalListener((String key, AnalysisSession session, RemovalCause cause) -> {
                    if (key != null) {
                        broadcastHub.close(key);
                        log.debug("Session evicted - sessionId: {}, stage: {}, cause: {}",
                                key, session != null ? session.getStage() : null, cause);
                    }
                })
                .build();
    }

    public AnalysisSession createSession(String query) {
        AnalysisSession session = new AnalysisSession(UUID.randomUUID().toString(), query, clock.instant());
        sessionCache.put(session.getSessionId(), session);
        log.info("Created analysis session - sessionId: {}", session.getSessionId());
        return session;
    }

    public Optional<AnalysisSession> getSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessionCache.getIfPresent(sessionId));
    }

    public long getActiveSessionCount() {
        return sessionCache.estimatedSize();
    }

    public void invalidate(String sessionId) {
        sessionCache.invalidate(sessionId);
    }
}
