package me.golemcore.humanloop.adapter.inbound.web.controller;

import me.golemcore.humanloop.adapter.inbound.web.dto.AgentStartRequest;
import me.golemcore.humanloop.adapter.inbound.web.dto.AgentStartResponse;
import me.golemcore.humanloop.domain.service.AgentRunService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentControllerTest {

    private AgentRunService agentRunService;
    private AgentController controller;

    @BeforeEach
    void setUp() {
        agentRunService = mock(AgentRunService.class);
        controller = new AgentController(agentRunService);
    }

    @Test
    void startShouldReturnTaskId() {
        when(agentRunService.start("one large pepperoni")).thenReturn("task-1");

        StepVerifier.create(controller.start(new AgentStartRequest("one large pepperoni")))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    AgentStartResponse body = resp.getBody();
                    assertNotNull(body);
                    assertEquals("started", body.getStatus());
                    assertEquals("Agent is running", body.getMessage());
                    assertEquals("task-1", body.getTaskId());
                })
                .verifyComplete();
    }

    @Test
    void startShouldRejectBlankQuestion() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.start(new AgentStartRequest("  ")));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(agentRunService, never()).start(anyString());
    }
}
