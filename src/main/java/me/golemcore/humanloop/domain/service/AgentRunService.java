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
import me.golemcore.humanloop.domain.loop.PizzaOrderAgent;
import me.golemcore.humanloop.domain.model.AgentTaskEvent;
import me.golemcore.humanloop.domain.model.PizzaOrder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs pizza agent tasks in the background and publishes their outcome as
 * {@link AgentTaskEvent}s.
 *
 * <p>
 * One task at a time: starting a new run interrupts the running ones and
 * cancels their open questions with reason {@value #SUPERSEDED_REASON}.
 * Superseded runs end silently; every other run emits exactly one event.
 */
@Service
@Slf4j
public class AgentRunService {

    public static final String SUPERSEDED_REASON = "superseded";

    private final PizzaOrderAgent agent;
    private final ResponseBroker broker;
    private final ExecutorService agentExecutor;
    private final Map<String, RunningTask> runningTasks = new ConcurrentHashMap<>();
    private final Sinks.Many<AgentTaskEvent> events = Sinks.many().multicast().directBestEffort();

    public AgentRunService(PizzaOrderAgent agent, ResponseBroker broker,
            @Qualifier("humanLoopAgentExecutor") ExecutorService agentExecutor) {
        this.agent = agent;
        this.broker = broker;
        this.agentExecutor = agentExecutor;
    }

    /**
     * Start a new agent run for {@code customerRequest}.
     *
     * @return task id
     */
    public String start(String customerRequest) {
        if (customerRequest == null || customerRequest.isBlank()) {
            throw new InvalidRequestException("Question must not be blank");
        }
        supersedeRunningTasks();

        String taskId = UUID.randomUUID().toString();
        AtomicBoolean superseded = new AtomicBoolean();
        FutureTask<Void> task = new FutureTask<>(() -> runTask(taskId, customerRequest, superseded), null);
        runningTasks.put(taskId, new RunningTask(task, superseded));
        agentExecutor.execute(task);
        log.info("[Agent] Started task {}", taskId);
        return taskId;
    }

    public Flux<AgentTaskEvent> events() {
        return events.asFlux();
    }

    public int runningCount() {
        return runningTasks.size();
    }

    private void supersedeRunningTasks() {
        for (Map.Entry<String, RunningTask> entry : runningTasks.entrySet()) {
            entry.getValue().superseded().set(true);
            entry.getValue().future().cancel(true);
            runningTasks.remove(entry.getKey());
            log.info("[Agent] Superseded task {}", entry.getKey());
        }
        broker.drain(SUPERSEDED_REASON);
    }

    private void runTask(String taskId, String customerRequest, AtomicBoolean superseded) {
        try {
            PizzaOrder order = agent.run(customerRequest);
            if (!superseded.get()) {
                emit(AgentTaskEvent.complete(taskId, order));
            }
        } catch (RuntimeException e) { // NOSONAR - every failure becomes a task_result error
            if (superseded.get()) {
                log.debug("[Agent] Superseded task {} ended: {}", taskId, e.getMessage());
            } else {
                log.warn("[Agent] Task {} failed: {}", taskId, e.getMessage());
                emit(AgentTaskEvent.error(taskId, e.getMessage()));
            }
        } finally {
            runningTasks.remove(taskId);
        }
    }

    private synchronized void emit(AgentTaskEvent event) {
        Sinks.EmitResult result = events.tryEmitNext(event);
        if (result.isFailure()) {
            log.debug("[Agent] No live observer for task {} event: {}", event.taskId(), result);
        }
    }

    // The superseded flag lives and dies with its task entry.
    private record RunningTask(Future<?> future, AtomicBoolean superseded) {
    }
}
