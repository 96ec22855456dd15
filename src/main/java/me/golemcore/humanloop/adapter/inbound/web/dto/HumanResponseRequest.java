package me.golemcore.humanloop.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer posted by a human for one pending request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HumanResponseRequest {
    @JsonProperty("request_id")
    private String requestId;
    private String response;
}
