package me.golemcore.humanloop.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.humanloop.adapter.inbound.web.dto.AgentStartRequest;
import me.golemcore.humanloop.adapter.inbound.web.dto.AgentStartResponse;
import me.golemcore.humanloop.domain.service.AgentRunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Starts a background pizza agent run. Its questions and final result arrive
 * on the event stream.
 */
@RestController
@RequestMapping("/agent")
@RequiredArgsConstructor
public class AgentController {

    private final AgentRunService agentRunService;

    @PostMapping("/start")
    public Mono<ResponseEntity<AgentStartResponse>> start(@RequestBody(required = false) AgentStartRequest request) {
        if (request == null || request.getQuestion() == null || request.getQuestion().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "question is required");
        }
        String taskId = agentRunService.start(request.getQuestion());
        return Mono.just(ResponseEntity.ok(AgentStartResponse.builder()
                .status("started")
                .message("Agent is running")
                .taskId(taskId)
                .build()));
    }
}
