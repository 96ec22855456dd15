package me.golemcore.humanloop.adapter.inbound.console;

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
import me.golemcore.humanloop.domain.loop.PizzaOrderAgent;
import me.golemcore.humanloop.domain.model.Pizza;
import me.golemcore.humanloop.domain.model.PizzaOrder;
import me.golemcore.humanloop.infrastructure.console.ConsoleSession;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Interactive terminal front end: reads a pizza request, runs the agent on
 * the current thread and prints the resulting order. The agent's questions
 * are asked on the same terminal through whichever human input transport is
 * configured.
 */
@Component
@ConditionalOnProperty(prefix = "hitl.console", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ConsoleRunner implements CommandLineRunner {

    private static final Set<String> QUIT_COMMANDS = Set.of("quit", "exit", "q");
    private static final String GOODBYE = "👋 Goodbye!";

    private final ConsoleSession console;
    private final PizzaOrderAgent agent;

    @Override
    public void run(String... args) {
        console.println("🍕 Human-in-the-Loop Pizza Agent (Console Version)");
        console.println("=".repeat(50));

        while (true) {
            console.println("\nWhat would you like to ask the pizza agent?");
            console.println("(Type 'quit' to exit)");
            String question = console.prompt("> ");

            if (question == null || QUIT_COMMANDS.contains(question.trim().toLowerCase(Locale.ROOT))) {
                console.println(GOODBYE);
                return;
            }
            if (question.isBlank()) {
                continue;
            }

            handle(question);
            console.println("\n" + "-".repeat(50));
        }
    }

    private void handle(String question) {
        console.println("\n🤖 Agent is thinking about: '" + question + "'");
        console.println("The agent may ask you questions during its reasoning process...\n");
        try {
            PizzaOrder order = agent.run(question);
            printOrder(order);
        } catch (RuntimeException e) { // NOSONAR - any agent failure is reported and the loop continues
            log.debug("[Console] Agent run failed", e);
            console.println("\n❌ Error: " + e.getMessage());
        }
    }

    private void printOrder(PizzaOrder order) {
        console.println("\n✅ Your order:");
        List<Pizza> pizzas = order.pizzas();
        for (int i = 0; i < pizzas.size(); i++) {
            Pizza pizza = pizzas.get(i);
            console.println("  " + (i + 1) + ". " + pizza.size() + " pizza with "
                    + String.join(", ", pizza.toppings()));
            if (pizza.hasSpecialInstructions()) {
                console.println("     Special instructions: " + pizza.specialInstructions());
            }
        }
    }
}
