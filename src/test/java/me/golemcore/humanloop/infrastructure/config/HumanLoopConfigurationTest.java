package me.golemcore.humanloop.infrastructure.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ThreadFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HumanLoopConfigurationTest {

    @Test
    void shouldCreateNumberedDaemonThreads() {
        ThreadFactory factory = HumanLoopConfiguration.namedDaemonThreads("hitl-test-");

        Thread first = factory.newThread(() -> {
        });
        Thread second = factory.newThread(() -> {
        });

        assertEquals("hitl-test-1", first.getName());
        assertEquals("hitl-test-2", second.getName());
        assertTrue(first.isDaemon());
    }

    @Test
    void shouldDefaultToBrokerTransportWithoutTimeouts() {
        HumanLoopProperties properties = new HumanLoopProperties();

        assertEquals("broker", properties.getInput().getMode());
        assertTrue(properties.getInput().getAnswerTimeout().isZero());
        assertTrue(properties.getBroker().getStaleAfter().isZero());
        assertEquals(Duration.ofMinutes(10), properties.getBroker().getObserverIdleTimeout());
        assertEquals(6, properties.getLlm().getMaxIterations());
        assertEquals("google/gemini-2.5-flash", properties.getLlm().getModel());
    }
}
