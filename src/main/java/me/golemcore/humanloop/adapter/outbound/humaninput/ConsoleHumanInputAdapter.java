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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.humanloop.infrastructure.console.ConsoleSession;
import me.golemcore.humanloop.port.outbound.HumanInputPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * HumanInputPort that asks directly on the terminal. The read blocks the
 * calling agent thread, so the returned future is already complete.
 */
@Component
@ConditionalOnProperty(prefix = "hitl.input", name = "mode", havingValue = "console")
@RequiredArgsConstructor
@Slf4j
public class ConsoleHumanInputAdapter implements HumanInputPort {

    private final ConsoleSession console;

    @Override
    public CompletableFuture<String> requestInput(String question, Map<String, Object> metadata) {
        String answer;
        try {
            answer = console.prompt("\n🤔 " + question + "\n> ");
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Console] Failed to read answer: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        if (answer == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Console input closed"));
        }
        return CompletableFuture.completedFuture(answer);
    }

    @Override
    public String getTransportName() {
        return "console";
    }
}
