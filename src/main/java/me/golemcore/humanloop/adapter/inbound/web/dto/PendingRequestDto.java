package me.golemcore.humanloop.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Open request as seen by polling clients. Carries no answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingRequestDto {
    private String id;
    private String question;
    private Map<String, Object> metadata;
}
