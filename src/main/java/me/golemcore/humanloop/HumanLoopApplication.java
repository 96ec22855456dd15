package me.golemcore.humanloop;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Human-in-the-loop coordination service.
 *
 * <p>
 * Agents suspend on questions that only a human can answer; the
 * {@code ResponseBroker} parks each question, announces it to observers and
 * wakes exactly the asker when an answer arrives.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → EventStreamController, HumanInputController, AgentController, ConsoleRunner
 * Domain Layer       → ResponseBroker, NotificationChannel, PizzaOrderAgent, AgentRunService
 * Infrastructure     → HumanInputPort adapters (broker, console), OpenAI-compatible ChatModel
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code hitl.*} prefix. Run with the {@code console} profile for the terminal
 * version.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class HumanLoopApplication {

    public static void main(String[] args) {
        SpringApplication.run(HumanLoopApplication.class, args);
    }

}
