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

import me.golemcore.humanloop.domain.model.ResolutionResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Suspension point returned by {@link ResponseBroker#ask}. The asker awaits
 * the outcome of its own request; the broker completes it on the asker's
 * executor, never inline on the thread that resolved the request.
 *
 * <p>
 * The handle keeps only the request id and the broker-owned completion stage.
 * State lives in the broker table.
 */
public final class PendingRequestHandle {

    private final ResponseBroker broker;
    private final String id;
    private final CompletableFuture<String> delivery;

    PendingRequestHandle(ResponseBroker broker, String id, CompletableFuture<String> delivery) {
        this.broker = broker;
        this.id = id;
        this.delivery = delivery;
    }

    public String id() {
        return id;
    }

    /**
     * Await the answer. The returned future completes with the answer, or
     * exceptionally with {@link RequestCancelledException} as the cause.
     */
    public CompletableFuture<String> await() {
        return delivery.copy();
    }

    /**
     * Await the answer for at most {@code timeout}. On expiry the request is
     * cancelled with reason {@value ResponseBroker#TIMEOUT_REASON}; an answer
     * racing the timer wins or loses through the broker, exactly once.
     */
    public CompletableFuture<String> await(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return await();
        }
        ScheduledFuture<?> timer = broker.scheduleTimeout(id, timeout);
        delivery.whenComplete((answer, error) -> timer.cancel(false));
        return delivery.copy();
    }

    /**
     * Abandon the request from the asker's side.
     */
    public ResolutionResult cancel(String reason) {
        return broker.cancel(id, reason);
    }

    public boolean isDone() {
        return delivery.isDone();
    }
}
