package com.waterCompliance.complianceDemo.broadcast.service;

import com.waterCompliance.complianceDemo.broadcast.model.AnalysisEvent;
import com.waterCompliance.complianceDemo.orchestrator.model.PipelineStage;
import com.waterCompliance.complianceDemo.orchestrator.model.StageResultPatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Fans session events out to live subscribers.
 *
 * Every session has its own serial delivery chain on a shared executor: events of one
 * session reach each subscriber in publish order, publishers never wait for delivery,
 * and a slow session cannot hold up another. The latest non-status event is kept as a
 * snapshot and replayed to subscribers that join late; for stage updates the snapshot is
 * the stage's merged state rather than the last partial update.
 *
 * Channels exist from {@link #open} (or the first subscription) until {@link #close}.
 * Events published to a session without a channel are discarded.
 */
@Slf4j
@Service
public class StatusBroadcastHub {

    private final Executor deliveryExecutor;
    private final Map<String, SessionChannel> channels = new ConcurrentHashMap<>();

    public StatusBroadcastHub(@Qualifier("broadcastExecutor") Executor deliveryExecutor) {
        this.deliveryExecutor = deliveryExecutor;
    }

    public void open(String sessionId) {
        channels.computeIfAbsent(sessionId, id -> new SessionChannel());
    }

    /**
     * Registers a subscriber. It first receives the current snapshot (if any), then live events.
     */
    public void subscribe(String sessionId, EventSubscriber subscriber) {
        SessionChannel channel = channels.computeIfAbsent(sessionId, id -> new SessionChannel());
        channel.enqueue(() -> {
            AnalysisEvent snapshot = channel.snapshot;
            if (snapshot != null && !deliver(sessionId, subscriber, snapshot)) {
                return;
            }
            channel.subscribers.put(subscriber.getSubscriberId(), subscriber);
            log.debug("Subscriber added - sessionId: {}, subscriberId: {}, subscribers: {}",
                    sessionId, subscriber.getSubscriberId(), channel.subscribers.size());
        });
    }

    public void unsubscribe(String sessionId, String subscriberId) {
        SessionChannel channel = channels.get(sessionId);
        if (channel == null) {
            return;
        }
        channel.enqueue(() -> {
            if (channel.subscribers.remove(subscriberId) != null) {
                log.debug("Subscriber removed - sessionId: {}, subscriberId: {}", sessionId, subscriberId);
            }
        });
    }

    /**
     * Queues an event for every current subscriber of the session and returns immediately.
     */
    public void publish(String sessionId, AnalysisEvent event) {
        SessionChannel channel = channels.get(sessionId);
        if (channel == null) {
            log.debug("Discarding event for closed session - sessionId: {}, type: {}", sessionId, event.getType());
            return;
        }
        channel.enqueue(() -> {
            channel.remember(sessionId, event);
            for (EventSubscriber subscriber : channel.subscribers.values()) {
                if (!deliver(sessionId, subscriber, event)) {
                    channel.subscribers.remove(subscriber.getSubscriberId());
                }
            }
        });
    }

    /**
     * Drops all subscribers and the snapshot of a session. Called when the session is evicted.
     */
    public void close(String sessionId) {
        SessionChannel channel = channels.remove(sessionId);
        if (channel != null) {
            channel.enqueue(() -> {
                channel.subscribers.clear();
                channel.stagePatches.clear();
                channel.snapshot = null;
            });
            log.debug("Broadcast channel closed - sessionId: {}", sessionId);
        }
    }

    public int subscriberCount(String sessionId) {
        SessionChannel channel = channels.get(sessionId);
        return channel == null ? 0 : channel.subscribers.size();
    }

    private boolean deliver(String sessionId, EventSubscriber subscriber, AnalysisEvent event) {
        try {
            subscriber.deliver(event);
            return true;
        } catch (IOException | RuntimeException e) {
            log.info("Dropping subscriber after failed delivery - sessionId: {}, subscriberId: {}, error: {}",
                    sessionId, subscriber.getSubscriberId(), e.getMessage());
            return false;
        }
    }

    private final class SessionChannel {
        private final Map<String, EventSubscriber> subscribers = new ConcurrentHashMap<>();
        // only read and written on the delivery chain
        private volatile AnalysisEvent snapshot;
        private final Map<PipelineStage, StageResultPatch> stagePatches = new EnumMap<>(PipelineStage.class);
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        void remember(String sessionId, AnalysisEvent event) {
            if (!event.isSnapshotCandidate()) {
                return;
            }
            StageResultPatch patch = event.getPatch();
            if (patch != null) {
                StageResultPatch merged = stagePatches.merge(patch.getStage(), patch, StageResultPatch::merge);
                snapshot = AnalysisEvent.agentUpdate(sessionId, merged, event.getTimestamp());
            } else {
                snapshot = event;
            }
            if (event.isTerminal()) {
                stagePatches.clear();
            }
        }

        synchronized void enqueue(Runnable task) {
            tail = tail.thenRunAsync(task, deliveryExecutor)
                    .exceptionally(ex -> {
                        log.error("Broadcast task failed", ex);
                        return null;
                    });
        }
    }
}
