package com.waterCompliance.complianceDemo.gateway.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory sliding-window rate limiter for analysis submissions, keyed by client.
 */
@Slf4j
@Service
public class RateLimiter {

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;

    // clientKey -> timestamps of accepted requests inside the window
    private final Map<String, RequestWindow> clientWindows = new ConcurrentHashMap<>();

    public RateLimiter(@Value("${gateway.rate-limit.max-requests:15}") int maxRequests,
                       @Value("${gateway.rate-limit.window:PT1M}") Duration window,
                       Clock clock) {
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    /**
     * @return true if the request is admitted (and counted), false if the client is over its limit
     */
    public boolean isAllowed(String clientKey) {
        RequestWindow requestWindow = clientWindows.computeIfAbsent(clientKey, k -> new RequestWindow());
        boolean allowed = requestWindow.tryAcquire(clock.instant(), window, maxRequests);
        if (!allowed) {
            log.warn("Rate limit exceeded - client: {}", clientKey);
        }
        return allowed;
    }

    private static class RequestWindow {
        private final Deque<Instant> requests = new ArrayDeque<>();

        synchronized boolean tryAcquire(Instant now, Duration window, int maxRequests) {
            Instant cutoff = now.minus(window);
            while (!requests.isEmpty() && requests.peekFirst().isBefore(cutoff)) {
                requests.pollFirst();
            }
            if (requests.size() >= maxRequests) {
                return false;
            }
            requests.addLast(now);
            return true;
        }
    }
}
