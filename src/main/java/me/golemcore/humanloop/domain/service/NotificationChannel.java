package me.golemcore.humanloop.domain.service;

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
import me.golemcore.humanloop.domain.model.PendingRequestView;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Fans newly created requests out to observers, each observer receiving each
 * request at most once.
 *
 * <p>
 * Two observer styles share the same per-observer delivery tracking:
 * <ul>
 * <li><b>Pull</b> - {@link #poll} filters the open requests down to those the
 * observer has not seen yet and marks them seen.
 * <li><b>Push</b> - {@link #subscribe} attaches a unicast sink. The subscriber
 * first receives the backlog of open requests it has not seen, then every
 * later announcement.
 * </ul>
 *
 * <p>
 * A backlog entry racing a live announcement of the same request is emitted
 * once, because both paths go through the observer's delivered-id set. An
 * observer that fails to accept an announcement is detached; the request stays
 * open for the next poll or subscriber.
 *
 * <p>
 * Pull observers have no connection to close, so one that stops polling is
 * dropped by {@link #expireIdle} after the configured idle time. Clients may
 * also call {@link #forget} explicitly.
 */
@Component
@Slf4j
public class NotificationChannel {

    private final Map<String, Observer> observers = new ConcurrentHashMap<>();

    /**
     * Offer a freshly created request to every subscribed observer.
     *
     * @return true if at least one observer accepted it
     */
    public boolean announce(PendingRequestView view) {
        return announce(view, requestId -> true);
    }

    /**
     * Offer a request to every subscribed observer while {@code stillOpen}
     * holds for its id. Stops as soon as the request closes.
     *
     * @return true if at least one observer accepted it
     */
    public boolean announce(PendingRequestView view, Predicate<String> stillOpen) {
        boolean delivered = false;
        for (Observer observer : new ArrayList<>(observers.values())) {
            if (!observer.isSubscribed()) {
                continue;
            }
            if (!stillOpen.test(view.id())) {
                log.debug("[Events] Request {} closed while announcing", view.id());
                break;
            }
            try {
                delivered |= observer.offer(view);
            } catch (RuntimeException e) { // NOSONAR - one broken observer must not fail the asker
                log.warn("[Events] Observer {} rejected request {}, detaching: {}",
                        observer.getId(), view.id(), e.getMessage());
                detach(observer);
            }
        }
        return delivered;
    }

    /**
     * Pull-style delivery. Returns the subset of {@code openRequests} not yet
     * delivered to {@code observerId}, in the given order, and marks it
     * delivered.
     */
    public List<PendingRequestView> poll(String observerId, List<PendingRequestView> openRequests) {
        Observer observer = observers.computeIfAbsent(observerId, Observer::new);
        observer.touch();
        List<PendingRequestView> fresh = new ArrayList<>();
        for (PendingRequestView view : openRequests) {
            if (observer.markDelivered(view.id())) {
                fresh.add(view);
            }
        }
        return fresh;
    }

    /**
     * Push-style delivery. The backlog is read after the sink is attached, so a
     * request created in between is seen through one path or the other and
     * never lost.
     */
    public Flux<PendingRequestView> subscribe(String observerId, Supplier<List<PendingRequestView>> backlog) {
        return Flux.defer(() -> {
            Sinks.Many<PendingRequestView> sink = Sinks.many().unicast().onBackpressureBuffer();
            Observer observer = observers.computeIfAbsent(observerId, Observer::new);
            observer.attach(sink);
            int replayed = 0;
            for (PendingRequestView view : backlog.get()) {
                if (observer.offer(view)) {
                    replayed++;
                }
            }
            log.info("[Events] Observer {} subscribed, backlog={}", observerId, replayed);
            return sink.asFlux()
                    .doFinally(signal -> {
                        observer.detach(sink);
                        observer.touch();
                        if (!observer.isSubscribed()) {
                            observers.remove(observerId, observer);
                        }
                        log.info("[Events] Observer {} unsubscribed, signal={}", observerId, signal);
                    });
        });
    }

    /**
     * Drop all tracking for an observer and complete its live stream, if any.
     */
    public void forget(String observerId) {
        Observer observer = observers.remove(observerId);
        if (observer != null) {
            observer.close();
        }
    }

    /**
     * Prune a request id from every observer once the request left the broker.
     */
    public void forgetRequest(String requestId) {
        observers.values().forEach(observer -> observer.forgetRequest(requestId));
    }

    /**
     * Drop observers that are not subscribed and have not polled within
     * {@code idleFor}.
     *
     * @return number of observers dropped
     */
    public int expireIdle(Duration idleFor) {
        Instant cutoff = Instant.now().minus(idleFor);
        int expired = 0;
        for (Observer observer : new ArrayList<>(observers.values())) {
            if (!observer.isSubscribed() && observer.getLastActivity().isBefore(cutoff)
                    && observers.remove(observer.getId(), observer)) {
                expired++;
            }
        }
        if (expired > 0) {
            log.debug("[Events] Expired {} idle observer(s)", expired);
        }
        return expired;
    }

    public int observerCount() {
        return observers.size();
    }

    private void detach(Observer observer) {
        observer.close();
        observers.remove(observer.getId(), observer);
    }

    private static final class Observer {

        private final String id;
        private final Set<String> deliveredIds = new HashSet<>();
        private Sinks.Many<PendingRequestView> sink;
        private volatile Instant lastActivity = Instant.now();

        private Observer(String id) {
            this.id = id;
        }

        String getId() {
            return id;
        }

        Instant getLastActivity() {
            return lastActivity;
        }

        void touch() {
            lastActivity = Instant.now();
        }

        synchronized boolean isSubscribed() {
            return sink != null;
        }

        synchronized boolean markDelivered(String requestId) {
            return deliveredIds.add(requestId);
        }

        synchronized boolean offer(PendingRequestView view) {
            if (sink == null || deliveredIds.contains(view.id())) {
                return false;
            }
            Sinks.EmitResult result = sink.tryEmitNext(view);
            if (result.isFailure()) {
                throw new IllegalStateException("Emit failed: " + result);
            }
            deliveredIds.add(view.id());
            return true;
        }

        synchronized void attach(Sinks.Many<PendingRequestView> newSink) {
            if (sink != null) {
                sink.tryEmitComplete();
            }
            sink = newSink;
        }

        synchronized void detach(Sinks.Many<PendingRequestView> oldSink) {
            if (sink == oldSink) {
                sink = null;
            }
        }

        synchronized void close() {
            if (sink != null) {
                sink.tryEmitComplete();
                sink = null;
            }
        }

        synchronized void forgetRequest(String requestId) {
            deliveredIds.remove(requestId);
        }
    }
}
