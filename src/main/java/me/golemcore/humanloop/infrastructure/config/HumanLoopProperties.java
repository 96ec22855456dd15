package me.golemcore.humanloop.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties bound from application.properties under the
 * {@code hitl.*} prefix.
 *
 * <ul>
 * <li>{@link BrokerProperties} - stale request sweep</li>
 * <li>{@link InputProperties} - which human input transport the agent uses</li>
 * <li>{@link EventsProperties} - live event stream</li>
 * <li>{@link LlmProperties} - OpenAI-compatible model for the pizza agent</li>
 * <li>{@link ConsoleProperties} - interactive terminal loop</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "hitl")
@Data
public class HumanLoopProperties {

    private BrokerProperties broker = new BrokerProperties();
    private InputProperties input = new InputProperties();
    private EventsProperties events = new EventsProperties();
    private LlmProperties llm = new LlmProperties();
    private ConsoleProperties console = new ConsoleProperties();

    @Data
    public static class BrokerProperties {
        /** Open requests older than this are cancelled as stale. Zero disables the sweep. */
        private Duration staleAfter = Duration.ZERO;
        private Duration sweepInterval = Duration.ofMinutes(1);
        /** Polling observers idle for longer than this are dropped. Zero keeps them until forgotten. */
        private Duration observerIdleTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class InputProperties {
        /** {@code broker} (web and other observers) or {@code console}. */
        private String mode = "broker";
        /** Per-question timeout for the broker transport. Zero waits indefinitely. */
        private Duration answerTimeout = Duration.ZERO;
    }

    @Data
    public static class EventsProperties {
        private Duration heartbeatInterval = Duration.ofSeconds(1);
    }

    @Data
    public static class LlmProperties {
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String apiKey;
        private String model = "google/gemini-2.5-flash";
        private Duration timeout = Duration.ofSeconds(60);
        private int maxIterations = 6;
    }

    @Data
    public static class ConsoleProperties {
        private boolean enabled = false;
    }
}
