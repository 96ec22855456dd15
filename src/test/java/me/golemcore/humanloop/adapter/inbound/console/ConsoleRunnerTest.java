package me.golemcore.humanloop.adapter.inbound.console;

import me.golemcore.humanloop.domain.loop.AgentExecutionException;
import me.golemcore.humanloop.domain.loop.PizzaOrderAgent;
import me.golemcore.humanloop.domain.model.Pizza;
import me.golemcore.humanloop.domain.model.PizzaOrder;
import me.golemcore.humanloop.infrastructure.console.ConsoleSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConsoleRunnerTest {

    private PizzaOrderAgent agent;
    private ByteArrayOutputStream output;

    @BeforeEach
    void setUp() {
        agent = mock(PizzaOrderAgent.class);
        output = new ByteArrayOutputStream();
    }

    private String run(String input) {
        ConsoleSession session = new ConsoleSession(new BufferedReader(new StringReader(input)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
        new ConsoleRunner(session, agent).run();
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintBannerAndQuit() {
        String printed = run("quit\n");

        assertTrue(printed.startsWith("🍕 Human-in-the-Loop Pizza Agent (Console Version)"));
        assertTrue(printed.contains("=".repeat(50)));
        assertTrue(printed.contains("What would you like to ask the pizza agent?"));
        assertTrue(printed.contains("(Type 'quit' to exit)"));
        assertTrue(printed.contains("👋 Goodbye!"));
        verify(agent, never()).run(anyString());
    }

    @Test
    void shouldAcceptQuitAliasesCaseInsensitively() {
        assertTrue(run("Q\n").contains("👋 Goodbye!"));
        assertTrue(run("EXIT\n").contains("👋 Goodbye!"));
    }

    @Test
    void shouldStopAtEndOfInput() {
        assertTrue(run("").contains("👋 Goodbye!"));
    }

    @Test
    void shouldSkipBlankLines() {
        run("\n   \nquit\n");

        verify(agent, never()).run(anyString());
    }

    @Test
    void shouldPrintOrder() {
        when(agent.run("two pizzas")).thenReturn(new PizzaOrder(List.of(
                new Pizza("large", List.of("pepperoni", "mushrooms"), "well done"),
                new Pizza("small", List.of("cheese"), null))));

        String printed = run("two pizzas\nquit\n");

        assertTrue(printed.contains("🤖 Agent is thinking about: 'two pizzas'"));
        assertTrue(printed.contains("The agent may ask you questions during its reasoning process..."));
        assertTrue(printed.contains("✅ Your order:"));
        assertTrue(printed.contains("  1. large pizza with pepperoni, mushrooms"));
        assertTrue(printed.contains("     Special instructions: well done"));
        assertTrue(printed.contains("  2. small pizza with cheese"));
        assertTrue(printed.contains("-".repeat(50)));
    }

    @Test
    void shouldPrintErrorAndKeepGoing() {
        when(agent.run(anyString())).thenThrow(new AgentExecutionException("LLM is not configured"));

        String printed = run("pizza\nanother pizza\nq\n");

        assertTrue(printed.contains("❌ Error: LLM is not configured"));
        verify(agent, times(2)).run(anyString());
        assertTrue(printed.contains("👋 Goodbye!"));
    }
}
