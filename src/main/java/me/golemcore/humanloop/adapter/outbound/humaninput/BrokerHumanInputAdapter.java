package me.golemcore.humanloop.adapter.outbound.humaninput;

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
import me.golemcore.humanloop.domain.service.PendingRequestHandle;
import me.golemcore.humanloop.domain.service.ResponseBroker;
import me.golemcore.humanloop.infrastructure.config.HumanLoopProperties;
import me.golemcore.humanloop.port.outbound.HumanInputPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * HumanInputPort that routes questions through the {@link ResponseBroker}, so
 * any observer (live event stream, polling client) can surface them and post
 * the answer back.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code hitl.input.mode=broker} - default transport
 * <li>{@code hitl.input.answer-timeout} - optional per-question timeout
 * </ul>
 */
@Component
@ConditionalOnProperty(prefix = "hitl.input", name = "mode", havingValue = "broker", matchIfMissing = true)
@Slf4j
public class BrokerHumanInputAdapter implements HumanInputPort {

    static final String ABANDONED_REASON = "abandoned";

    private final ResponseBroker broker;
    private final Duration answerTimeout;

    public BrokerHumanInputAdapter(ResponseBroker broker, HumanLoopProperties properties) {
        this.broker = broker;
        this.answerTimeout = properties.getInput().getAnswerTimeout();
        log.info("BrokerHumanInputAdapter answer timeout: {}",
                answerTimeout == null || answerTimeout.isZero() ? "none" : answerTimeout);
    }

    @Override
    public CompletableFuture<String> requestInput(String question, Map<String, Object> metadata) {
        PendingRequestHandle handle = broker.ask(question, metadata);
        log.debug("Waiting for answer to request {}", handle.id());
        CompletableFuture<String> answer = handle.await(answerTimeout);
        answer.whenComplete((value, error) -> {
            if (error instanceof CancellationException) {
                handle.cancel(ABANDONED_REASON);
            }
        });
        return answer;
    }

    @Override
    public String getTransportName() {
        return "broker";
    }
}
