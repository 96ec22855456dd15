package me.golemcore.humanloop.domain.service;

import me.golemcore.humanloop.domain.loop.AgentExecutionException;
import me.golemcore.humanloop.domain.loop.PizzaOrderAgent;
import me.golemcore.humanloop.domain.model.AgentTaskEvent;
import me.golemcore.humanloop.domain.model.Pizza;
import me.golemcore.humanloop.domain.model.PizzaOrder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentRunServiceTest {

    private static final PizzaOrder ORDER = new PizzaOrder(List.of(new Pizza("large", List.of("pepperoni"), null)));

    private PizzaOrderAgent agent;
    private ResponseBroker broker;
    private ExecutorService executor;
    private AgentRunService service;

    @BeforeEach
    void setUp() {
        agent = mock(PizzaOrderAgent.class);
        broker = mock(ResponseBroker.class);
        executor = Executors.newCachedThreadPool();
        service = new AgentRunService(agent, broker, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldRejectBlankQuestion() {
        assertThrows(InvalidRequestException.class, () -> service.start(" "));
        assertThrows(InvalidRequestException.class, () -> service.start(null));
        verify(broker, never()).drain(anyString());
    }

    @Test
    void shouldPublishCompletedOrder() {
        when(agent.run("one large pepperoni")).thenReturn(ORDER);
        AtomicReference<String> taskId = new AtomicReference<>();

        StepVerifier.create(service.events())
                .then(() -> taskId.set(service.start("one large pepperoni")))
                .assertNext(event -> {
                    assertEquals(taskId.get(), event.taskId());
                    assertEquals(AgentTaskEvent.Status.COMPLETE, event.status());
                    assertEquals(ORDER, event.order());
                    assertNull(event.error());
                })
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldPublishAgentFailure() {
        when(agent.run("pizza")).thenThrow(new AgentExecutionException("Human input cancelled: timeout"));
        AtomicReference<String> taskId = new AtomicReference<>();

        StepVerifier.create(service.events())
                .then(() -> taskId.set(service.start("pizza")))
                .assertNext(event -> {
                    assertEquals(taskId.get(), event.taskId());
                    assertEquals(AgentTaskEvent.Status.ERROR, event.status());
                    assertEquals("Human input cancelled: timeout", event.error());
                })
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void shouldSupersedeRunningTaskSilently() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        when(agent.run("first")).thenAnswer(invocation -> {
            firstStarted.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AgentExecutionException("Agent interrupted while waiting for human input", e);
            }
            return ORDER;
        });
        when(agent.run("second")).thenReturn(ORDER);
        AtomicReference<String> secondId = new AtomicReference<>();

        StepVerifier.create(service.events())
                .then(() -> {
                    service.start("first");
                    awaitLatch(firstStarted);
                    secondId.set(service.start("second"));
                })
                .assertNext(event -> {
                    assertEquals(secondId.get(), event.taskId());
                    assertEquals(AgentTaskEvent.Status.COMPLETE, event.status());
                })
                .expectNoEvent(Duration.ofMillis(200))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        verify(broker, times(2)).drain(AgentRunService.SUPERSEDED_REASON);
        assertNotNull(secondId.get());
    }

    @Test
    void shouldForgetFinishedTasks() throws Exception {
        when(agent.run("pizza")).thenReturn(ORDER);

        service.start("pizza");

        long deadline = System.currentTimeMillis() + 5000;
        while (service.runningCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, service.runningCount());
    }

    @Test
    void shouldDropSupersededTaskThatNeverStarted() {
        ExecutorService deferred = mock(ExecutorService.class);
        service = new AgentRunService(agent, broker, deferred);
        when(agent.run("second")).thenReturn(ORDER);
        List<AgentTaskEvent> published = new ArrayList<>();
        service.events().subscribe(published::add);

        service.start("first");
        String secondId = service.start("second");

        ArgumentCaptor<Runnable> tasks = ArgumentCaptor.forClass(Runnable.class);
        verify(deferred, times(2)).execute(tasks.capture());
        tasks.getAllValues().forEach(Runnable::run);

        verify(agent, never()).run("first");
        assertEquals(1, published.size());
        assertEquals(secondId, published.get(0).taskId());
        assertEquals(AgentTaskEvent.Status.COMPLETE, published.get(0).status());
        assertEquals(0, service.runningCount());
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
