package me.golemcore.humanloop.domain.model;

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

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One outstanding question and the slot for its eventual answer.
 *
 * <p>
 * The request starts {@link RequestState#OPEN} and transitions exactly once,
 * either to {@link RequestState#RESOLVED} (answer recorded) or to
 * {@link RequestState#CANCELLED} (reason recorded). The transition methods
 * only flip state; completing {@link #getOutcome()} is left to the owner so it
 * can happen outside its lock.
 *
 * <p>
 * Not thread-safe on its own. All mutation is serialized by
 * {@link me.golemcore.humanloop.domain.service.ResponseBroker}.
 */
@Getter
public class PendingRequest {

    private final String id;
    private final String question;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private final CompletableFuture<String> outcome = new CompletableFuture<>();

    private RequestState state = RequestState.OPEN;
    private String answer;
    private String cancelReason;
    private boolean delivered;

    public PendingRequest(String id, String question, Map<String, Object> metadata, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.question = Objects.requireNonNull(question, "question");
        this.metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public boolean isOpen() {
        return state == RequestState.OPEN;
    }

    /**
     * Records the answer and moves to {@code RESOLVED}.
     *
     * @return false if the request was already terminal
     */
    public boolean resolve(String answer) {
        if (!isOpen()) {
            return false;
        }
        this.answer = answer;
        this.state = RequestState.RESOLVED;
        return true;
    }

    /**
     * Records the reason and moves to {@code CANCELLED}.
     *
     * @return false if the request was already terminal
     */
    public boolean cancel(String reason) {
        if (!isOpen()) {
            return false;
        }
        this.cancelReason = reason;
        this.state = RequestState.CANCELLED;
        return true;
    }

    public void markDelivered() {
        this.delivered = true;
    }

    public PendingRequestView toView() {
        return new PendingRequestView(id, question, metadata);
    }
}
