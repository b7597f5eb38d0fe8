package me.golemcore.orchestrator.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.EventType;
import me.golemcore.orchestrator.domain.model.OrchestratorEvent;
import me.golemcore.orchestrator.domain.model.SessionId;
import me.golemcore.orchestrator.domain.model.SubscriptionSnapshot;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Fans events out to every live observer and keeps a bounded history.
 *
 * <p>
 * Publishing appends to a ring buffer (oldest evicted first) and pushes the
 * event into each subscriber's own bounded queue. A subscriber whose queue
 * rejects the push is dropped with an error; the others are unaffected.
 * History snapshot and subscriber registration happen under the same lock as
 * publishing, so a new subscriber sees every event exactly once across
 * history and live stream.
 */
@Service
@Slf4j
public class EventBroadcaster {

    private final Object lock = new Object();
    private final Deque<OrchestratorEvent> ringBuffer;
    private final Map<String, Sinks.Many<OrchestratorEvent>> subscribers = new LinkedHashMap<>();
    private final Clock clock;
    private final int capacity;
    private final int historySize;
    private final int subscriberQueueSize;

    private long sequence;

    public EventBroadcaster(OrchestratorProperties properties, Clock clock) {
        OrchestratorProperties.EventsProperties events = properties.getEvents();
        this.clock = clock;
        this.capacity = normalizePositive(events.getBufferCapacity(), 1000);
        this.historySize = Math.min(normalizePositive(events.getHistorySize(), 100), capacity);
        this.subscriberQueueSize = normalizePositive(events.getSubscriberQueueSize(), 256);
        this.ringBuffer = new ArrayDeque<>(capacity);
    }

    public OrchestratorEvent publish(EventType type, SessionId sessionId, String channel,
            Map<String, Object> payload) {
        synchronized (lock) {
            OrchestratorEvent event = OrchestratorEvent.builder()
                    .seq(++sequence)
                    .type(type)
                    .timestamp(clock.instant())
                    .sessionId(sessionId)
                    .channel(channel)
                    .payload(payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of())
                    .build();

            if (ringBuffer.size() >= capacity) {
                ringBuffer.removeFirst();
            }
            ringBuffer.addLast(event);

            // Delivery may cancel a subscriber inline, which unregisters it; iterate a copy.
            for (Map.Entry<String, Sinks.Many<OrchestratorEvent>> entry : List.copyOf(subscribers.entrySet())) {
                if (!subscribers.containsKey(entry.getKey())) {
                    continue;
                }
                Sinks.EmitResult result = entry.getValue().tryEmitNext(event);
                if (result.isFailure()) {
                    subscribers.remove(entry.getKey());
                    log.warn("[Events] Dropping subscriber {}: {}", entry.getKey(), result);
                    entry.getValue().tryEmitError(new SubscriberDroppedException(entry.getKey(), result));
                }
            }
            log.debug("[Events] #{} {} session={} channel={}", event.seq(), type.getWireName(), sessionId, channel);
            return event;
        }
    }

    /**
     * Registers a new observer. The returned history holds the most recent
     * events; the live flux starts right after the last of them.
     */
    public SubscriptionSnapshot subscribe() {
        String subscriberId = UUID.randomUUID().toString();
        Sinks.Many<OrchestratorEvent> sink = Sinks.many().unicast()
                .onBackpressureBuffer(Queues.<OrchestratorEvent>get(subscriberQueueSize).get());
        List<OrchestratorEvent> history;
        synchronized (lock) {
            history = tail(historySize);
            subscribers.put(subscriberId, sink);
        }
        log.debug("[Events] Subscriber {} registered with {} history events", subscriberId, history.size());
        Flux<OrchestratorEvent> live = sink.asFlux()
                .doFinally(signal -> unsubscribe(subscriberId));
        return new SubscriptionSnapshot(subscriberId, history, live);
    }

    public void unsubscribe(String subscriberId) {
        Sinks.Many<OrchestratorEvent> sink;
        synchronized (lock) {
            sink = subscribers.remove(subscriberId);
        }
        if (sink != null) {
            sink.tryEmitComplete();
            log.debug("[Events] Subscriber {} removed", subscriberId);
        }
    }

    public List<OrchestratorEvent> recent(int limit) {
        synchronized (lock) {
            return tail(Math.max(0, Math.min(limit, capacity)));
        }
    }

    public int clearHistory() {
        synchronized (lock) {
            int cleared = ringBuffer.size();
            ringBuffer.clear();
            return cleared;
        }
    }

    public int subscriberCount() {
        synchronized (lock) {
            return subscribers.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    private List<OrchestratorEvent> tail(int count) {
        int skip = Math.max(0, ringBuffer.size() - count);
        List<OrchestratorEvent> result = new ArrayList<>(Math.min(count, ringBuffer.size()));
        Iterator<OrchestratorEvent> it = ringBuffer.iterator();
        for (int i = 0; it.hasNext(); i++) {
            OrchestratorEvent event = it.next();
            if (i >= skip) {
                result.add(event);
            }
        }
        return List.copyOf(result);
    }

    private int normalizePositive(int value, int fallback) {
        return value > 0 ? value : fallback;
    }

    /**
     * Signalled on a subscriber's live stream when it could not keep up.
     */
    public static class SubscriberDroppedException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        public SubscriberDroppedException(String subscriberId, Sinks.EmitResult reason) {
            super("Subscriber " + subscriberId + " dropped: " + reason);
        }
    }
}
