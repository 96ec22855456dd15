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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.humanloop.domain.model.PendingRequest;
import me.golemcore.humanloop.domain.model.PendingRequestView;
import me.golemcore.humanloop.domain.model.ResolutionResult;
import me.golemcore.humanloop.infrastructure.config.HumanLoopProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the table of pending human-input requests and is the single source of
 * truth for whether a request is still open.
 *
 * <p>
 * Flow:
 * <ol>
 * <li>An asker calls {@link #ask}; the broker registers an {@code OPEN}
 * request and announces it through {@link NotificationChannel}.
 * <li>The asker awaits the returned {@link PendingRequestHandle}.
 * <li>A transport adapter calls {@link #resolve} (or {@link #cancel}) by id,
 * from any thread.
 * <li>The handle completes on the asker's executor and the request leaves the
 * table.
 * </ol>
 *
 * <p>
 * Every insert, transition and removal runs under one monitor, so for a given
 * id at most one of resolve/cancel takes effect. Unknown or already closed ids
 * are reported as {@link ResolutionResult#UNKNOWN_OR_CLOSED} and never thrown.
 * Futures are completed after the monitor is released.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code hitl.broker.stale-after} - cancel open requests older than this
 * <li>{@code hitl.broker.sweep-interval} - how often the stale sweep and
 * idle observer expiry run
 * <li>{@code hitl.broker.observer-idle-timeout} - drop polling observers idle
 * for longer than this
 * </ul>
 */
@Service
@Slf4j
public class ResponseBroker {

    public static final String SHUTDOWN_REASON = "shutdown";
    public static final String TIMEOUT_REASON = "timeout";
    public static final String STALE_REASON = "stale";

    private final Object lock = new Object();
    private final Map<String, PendingRequest> requests = new LinkedHashMap<>();
    private final NotificationChannel notificationChannel;
    private final Executor wakeupExecutor;
    private final ScheduledExecutorService scheduler;
    private final Duration staleAfter;
    private final Duration sweepInterval;
    private final Duration observerIdleTimeout;

    private boolean accepting = true;
    private ScheduledFuture<?> maintenance;

    public ResponseBroker(NotificationChannel notificationChannel,
            HumanLoopProperties properties,
            @Qualifier("humanLoopWakeupExecutor") Executor wakeupExecutor,
            @Qualifier("humanLoopScheduler") ScheduledExecutorService scheduler) {
        this.notificationChannel = notificationChannel;
        this.wakeupExecutor = wakeupExecutor;
        this.scheduler = scheduler;
        HumanLoopProperties.BrokerProperties config = properties.getBroker();
        this.staleAfter = config.getStaleAfter() != null ? config.getStaleAfter() : Duration.ZERO;
        this.sweepInterval = config.getSweepInterval() != null ? config.getSweepInterval() : Duration.ofMinutes(1);
        this.observerIdleTimeout = config.getObserverIdleTimeout() != null
                ? config.getObserverIdleTimeout()
                : Duration.ZERO;
    }

    @PostConstruct
    public void init() {
        if (!isPositive(staleAfter) && !isPositive(observerIdleTimeout)) {
            log.info("[Broker] Started, stale sweep and observer expiry disabled");
            return;
        }
        long periodMs = Math.max(1, sweepInterval.toMillis());
        maintenance = scheduler.scheduleAtFixedRate(this::runMaintenance, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("[Broker] Started, stale-after={}, observer-idle-timeout={}, sweep-interval={}",
                staleAfter, observerIdleTimeout, sweepInterval);
    }

    /**
     * Cancel every open request so no asker hangs, then refuse new questions.
     */
    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            accepting = false;
        }
        if (maintenance != null) {
            maintenance.cancel(false);
        }
        int drained = drain(SHUTDOWN_REASON);
        log.info("[Broker] Shut down, drained {} open request(s)", drained);
    }

    public PendingRequestHandle ask(String question, Map<String, Object> metadata) {
        return ask(question, metadata, wakeupExecutor);
    }

    /**
     * Register a new question.
     *
     * @param question
     *            non-blank question text
     * @param metadata
     *            opaque key-value data passed through to observers, may be
     *            empty or null
     * @param callerExecutor
     *            executor the asker's continuation is scheduled on
     * @return handle to await the answer on
     * @throws InvalidRequestException
     *             if the question is blank
     * @throws IllegalStateException
     *             if the broker has been shut down
     */
    public PendingRequestHandle ask(String question, Map<String, Object> metadata, Executor callerExecutor) {
        if (question == null || question.isBlank()) {
            throw new InvalidRequestException("Question must not be blank");
        }
        Objects.requireNonNull(callerExecutor, "callerExecutor");

        PendingRequest request = new PendingRequest(UUID.randomUUID().toString(), question, metadata,
                Instant.now());
        String id = request.getId();

        // Removal happens on the asker's executor, right before the outcome reaches it
        CompletableFuture<String> delivery = request.getOutcome().handleAsync((answer, error) -> {
            release(id);
            if (error != null) {
                throw error instanceof CompletionException completion
                        ? completion
                        : new CompletionException(error);
            }
            return answer;
        }, callerExecutor);

        synchronized (lock) {
            if (!accepting) {
                throw new IllegalStateException("Response broker is shut down");
            }
            if (requests.putIfAbsent(id, request) != null) {
                throw new IllegalStateException("Duplicate request id: " + id);
            }
        }
        log.debug("[Broker] Registered request {}: {}", id, question);

        if (notificationChannel.announce(request.toView(), this::isOpen)) {
            markDelivered(id);
        }
        // An answer may have released the request while it was being announced
        if (!isTracked(id)) {
            notificationChannel.forgetRequest(id);
        }
        return new PendingRequestHandle(this, id, delivery);
    }

    /**
     * Deliver the answer for an open request.
     *
     * @return {@code ACCEPTED}, or {@code UNKNOWN_OR_CLOSED} if the id is not
     *         open
     */
    public ResolutionResult resolve(String id, String answer) {
        PendingRequest request;
        synchronized (lock) {
            request = id != null ? requests.get(id) : null;
            if (request != null && !request.resolve(answer != null ? answer : "")) {
                request = null;
            }
        }
        if (request == null) {
            log.debug("[Broker] Ignoring answer for unknown or closed request: {}", id);
            return ResolutionResult.UNKNOWN_OR_CLOSED;
        }
        request.getOutcome().complete(request.getAnswer());
        log.info("[Broker] Request {} resolved", id);
        return ResolutionResult.ACCEPTED;
    }

    /**
     * Abandon an open request. Its asker fails with
     * {@link RequestCancelledException} carrying {@code reason}.
     */
    public ResolutionResult cancel(String id, String reason) {
        PendingRequest request;
        synchronized (lock) {
            request = id != null ? requests.get(id) : null;
            if (request != null && !request.cancel(reason)) {
                request = null;
            }
        }
        if (request == null) {
            log.debug("[Broker] Ignoring cancel for unknown or closed request: {}", id);
            return ResolutionResult.UNKNOWN_OR_CLOSED;
        }
        request.getOutcome().completeExceptionally(new RequestCancelledException(id, reason));
        log.info("[Broker] Request {} cancelled: {}", id, reason);
        return ResolutionResult.ACCEPTED;
    }

    /**
     * Cancel every open request.
     *
     * @return number of requests cancelled
     */
    public int drain(String reason) {
        List<PendingRequest> cancelled = new ArrayList<>();
        synchronized (lock) {
            for (PendingRequest request : requests.values()) {
                if (request.cancel(reason)) {
                    cancelled.add(request);
                }
            }
        }
        for (PendingRequest request : cancelled) {
            request.getOutcome().completeExceptionally(new RequestCancelledException(request.getId(), reason));
        }
        if (!cancelled.isEmpty()) {
            log.info("[Broker] Drained {} open request(s): {}", cancelled.size(), reason);
        }
        return cancelled.size();
    }

    /**
     * Every open request in creation order, regardless of delivery.
     */
    public List<PendingRequestView> listOpen() {
        synchronized (lock) {
            List<PendingRequestView> open = new ArrayList<>();
            for (PendingRequest request : requests.values()) {
                if (request.isOpen()) {
                    open.add(request.toView());
                }
            }
            return open;
        }
    }

    /**
     * Open requests not yet delivered to {@code observerId}; marks them
     * delivered.
     */
    public List<PendingRequestView> poll(String observerId) {
        List<PendingRequestView> fresh = notificationChannel.poll(observerId, listOpen());
        fresh.forEach(view -> markDelivered(view.id()));
        return fresh;
    }

    /**
     * Live stream of requests for {@code observerId}: undelivered backlog
     * first, then new requests as they are asked.
     */
    public Flux<PendingRequestView> subscribe(String observerId) {
        return notificationChannel.subscribe(observerId, this::listOpen)
                .doOnNext(view -> markDelivered(view.id()));
    }

    public void unsubscribe(String observerId) {
        notificationChannel.forget(observerId);
    }

    public int openCount() {
        synchronized (lock) {
            return (int) requests.values().stream().filter(PendingRequest::isOpen).count();
        }
    }

    /**
     * Requests still held in the table, including terminal ones whose outcome
     * has not reached the asker yet.
     */
    public int trackedCount() {
        synchronized (lock) {
            return requests.size();
        }
    }

    public boolean isDelivered(String id) {
        synchronized (lock) {
            PendingRequest request = requests.get(id);
            return request != null && request.isDelivered();
        }
    }

    int expireIdleObservers() {
        return isPositive(observerIdleTimeout) ? notificationChannel.expireIdle(observerIdleTimeout) : 0;
    }

    void sweepStale() {
        Instant cutoff = Instant.now().minus(staleAfter);
        List<String> stale = new ArrayList<>();
        synchronized (lock) {
            for (PendingRequest request : requests.values()) {
                if (request.isOpen() && request.getCreatedAt().isBefore(cutoff)) {
                    stale.add(request.getId());
                }
            }
        }
        stale.forEach(id -> cancel(id, STALE_REASON));
    }

    ScheduledFuture<?> scheduleTimeout(String id, Duration timeout) {
        return scheduler.schedule(() -> {
            if (cancel(id, TIMEOUT_REASON).isAccepted()) {
                log.info("[Broker] Request {} timed out after {}", id, timeout);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runMaintenance() {
        try {
            if (isPositive(staleAfter)) {
                sweepStale();
            }
            expireIdleObservers();
        } catch (RuntimeException e) { // NOSONAR - keep the periodic task scheduled
            log.warn("[Broker] Maintenance run failed: {}", e.getMessage(), e);
        }
    }

    private boolean isOpen(String id) {
        synchronized (lock) {
            PendingRequest request = requests.get(id);
            return request != null && request.isOpen();
        }
    }

    private boolean isTracked(String id) {
        synchronized (lock) {
            return requests.containsKey(id);
        }
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isZero() && !duration.isNegative();
    }

    private void markDelivered(String id) {
        synchronized (lock) {
            PendingRequest request = requests.get(id);
            if (request != null) {
                request.markDelivered();
            }
        }
    }

    private void release(String id) {
        synchronized (lock) {
            PendingRequest request = requests.get(id);
            if (request == null || request.isOpen()) {
                return;
            }
            requests.remove(id);
        }
        notificationChannel.forgetRequest(id);
        log.debug("[Broker] Released request {}", id);
    }
}
