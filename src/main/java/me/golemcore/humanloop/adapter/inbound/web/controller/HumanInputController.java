package me.golemcore.humanloop.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.humanloop.adapter.inbound.web.dto.CancelRequest;
import me.golemcore.humanloop.adapter.inbound.web.dto.HumanResponseRequest;
import me.golemcore.humanloop.adapter.inbound.web.dto.PendingRequestDto;
import me.golemcore.humanloop.adapter.inbound.web.dto.RespondResponse;
import me.golemcore.humanloop.domain.model.PendingRequestView;
import me.golemcore.humanloop.domain.model.ResolutionResult;
import me.golemcore.humanloop.domain.service.ResponseBroker;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Endpoints through which a human answers, lists or abandons pending
 * questions. Unknown or already closed ids are reported in the body, never as
 * an HTTP error.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HumanInputController {

    private static final String DEFAULT_CANCEL_REASON = "cancelled by observer";

    private final ResponseBroker broker;

    @PostMapping("/respond")
    public Mono<ResponseEntity<RespondResponse>> respond(@RequestBody(required = false) HumanResponseRequest request) {
        if (request == null || request.getRequestId() == null || request.getRequestId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "request_id is required");
        }
        ResolutionResult result = broker.resolve(request.getRequestId(), request.getResponse());
        log.debug("[API] Response for {}: {}", request.getRequestId(), result);
        return Mono.just(ResponseEntity.ok(toResponse(result)));
    }

    @GetMapping("/api/requests")
    public Mono<ResponseEntity<List<PendingRequestDto>>> listOpen() {
        List<PendingRequestDto> open = broker.listOpen().stream()
                .map(HumanInputController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(open));
    }

    @PostMapping("/api/requests/{requestId}/cancel")
    public Mono<ResponseEntity<RespondResponse>> cancel(@PathVariable String requestId,
            @RequestBody(required = false) CancelRequest request) {
        String reason = request != null && request.getReason() != null && !request.getReason().isBlank()
                ? request.getReason()
                : DEFAULT_CANCEL_REASON;
        ResolutionResult result = broker.cancel(requestId, reason);
        return Mono.just(ResponseEntity.ok(toResponse(result)));
    }

    private static RespondResponse toResponse(ResolutionResult result) {
        return new RespondResponse(result.isAccepted() ? RespondResponse.RECEIVED : RespondResponse.UNKNOWN_OR_CLOSED);
    }

    private static PendingRequestDto toDto(PendingRequestView view) {
        return PendingRequestDto.builder()
                .id(view.id())
                .question(view.question())
                .metadata(view.metadata())
                .build();
    }
}
