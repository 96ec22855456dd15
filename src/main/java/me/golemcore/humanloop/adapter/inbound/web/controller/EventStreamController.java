package me.golemcore.humanloop.adapter.inbound.web.controller;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.humanloop.domain.model.AgentTaskEvent;
import me.golemcore.humanloop.domain.model.PendingRequestView;
import me.golemcore.humanloop.domain.service.AgentRunService;
import me.golemcore.humanloop.domain.service.ResponseBroker;
import me.golemcore.humanloop.infrastructure.config.HumanLoopProperties;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Server-sent event stream for browser observers.
 *
 * <p>
 * Every connection is its own observer: it receives the open questions it has
 * not seen yet, then new questions, agent task results and an empty heartbeat
 * object on a fixed interval. Closing the connection detaches the observer but
 * leaves its questions open for other observers.
 */
@RestController
@Slf4j
public class EventStreamController {

    static final String HUMAN_INPUT = "human_input";
    static final String TASK_RESULT = "task_result";

    private final ResponseBroker broker;
    private final AgentRunService agentRunService;
    private final Duration heartbeatInterval;

    public EventStreamController(ResponseBroker broker, AgentRunService agentRunService,
            HumanLoopProperties properties) {
        this.broker = broker;
        this.agentRunService = agentRunService;
        this.heartbeatInterval = properties.getEvents().getHeartbeatInterval();
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<Flux<ServerSentEvent<Map<String, Object>>>> events() {
        String observerId = "sse-" + UUID.randomUUID();
        log.debug("[Events] Opening stream for {}", observerId);

        Flux<Map<String, Object>> payloads = Flux.merge(
                broker.subscribe(observerId).map(EventStreamController::toHumanInputEvent),
                agentRunService.events().map(EventStreamController::toTaskResultEvent),
                heartbeats());

        Flux<ServerSentEvent<Map<String, Object>>> stream = payloads
                .map(payload -> ServerSentEvent.builder(payload).build())
                .doFinally(signal -> log.debug("[Events] Stream {} closed: {}", observerId, signal));

        return ResponseEntity.ok()
                .header(HttpHeaders.CACHE_CONTROL, "no-cache")
                .header("X-Accel-Buffering", "no")
                .body(stream);
    }

    private Flux<Map<String, Object>> heartbeats() {
        if (heartbeatInterval == null || heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            return Flux.never();
        }
        return Flux.interval(heartbeatInterval).map(tick -> Map.<String, Object>of());
    }

    static Map<String, Object> toHumanInputEvent(PendingRequestView view) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", HUMAN_INPUT);
        event.put("id", view.id());
        event.put("question", view.question());
        event.put("metadata", view.metadata());
        return event;
    }

    static Map<String, Object> toTaskResultEvent(AgentTaskEvent taskEvent) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("type", TASK_RESULT);
        event.put("task_id", taskEvent.taskId());
        event.put("status", taskEvent.status().name().toLowerCase(Locale.ROOT));
        if (taskEvent.status() == AgentTaskEvent.Status.COMPLETE) {
            event.put("order", taskEvent.order().pizzas());
        } else {
            event.put("error", taskEvent.error());
        }
        return event;
    }
}
