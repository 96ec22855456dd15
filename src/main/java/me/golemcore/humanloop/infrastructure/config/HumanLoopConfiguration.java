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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.humanloop.infrastructure.console.ConsoleSession;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the thread pools and console streams shared by the broker, the agent
 * runner and the console front end.
 *
 * <p>
 * All pools use daemon threads and are shut down by the container after the
 * beans that use them.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class HumanLoopConfiguration {

    private final HumanLoopProperties properties;

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Runs the continuations of {@code await()} for askers that did not supply
     * their own executor.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService humanLoopWakeupExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("hitl-wakeup-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService humanLoopScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hitl-broker-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService humanLoopAgentExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("hitl-agent-"));
    }

    @Bean
    public ConsoleSession consoleSession() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return new ConsoleSession(reader, new PrintStream(System.out, true, StandardCharsets.UTF_8));
    }

    @PostConstruct
    public void init() {
        log.info("Human input mode: {}", properties.getInput().getMode());
        log.info("Stale request sweep: {}", properties.getBroker().getStaleAfter().isZero()
                ? "disabled"
                : properties.getBroker().getStaleAfter());
        log.info("LLM model: {} at {}", properties.getLlm().getModel(), properties.getLlm().getBaseUrl());
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
