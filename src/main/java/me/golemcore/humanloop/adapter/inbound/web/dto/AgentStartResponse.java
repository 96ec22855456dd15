package me.golemcore.humanloop.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentStartResponse {
    private String status;
    private String message;
    @JsonProperty("task_id")
    private String taskId;
}
