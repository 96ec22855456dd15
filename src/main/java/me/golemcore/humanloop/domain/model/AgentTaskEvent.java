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

/**
 * Terminal outcome of a background agent run, published to live observers.
 */
public record AgentTaskEvent(String taskId, Status status, PizzaOrder order, String error) {

    public enum Status {
        COMPLETE, ERROR
    }

    public static AgentTaskEvent complete(String taskId, PizzaOrder order) {
        return new AgentTaskEvent(taskId, Status.COMPLETE, order, null);
    }

    public static AgentTaskEvent error(String taskId, String error) {
        return new AgentTaskEvent(taskId, Status.ERROR, null, error);
    }
}
