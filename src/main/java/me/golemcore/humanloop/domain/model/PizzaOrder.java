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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Structured result of a pizza agent run. May hold several pizzas.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PizzaOrder(List<Pizza> pizzas) {

    public PizzaOrder {
        pizzas = pizzas != null ? List.copyOf(pizzas) : List.of();
    }

    public boolean isEmpty() {
        return pizzas.isEmpty();
    }
}
