package me.golemcore.humanloop.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RespondResponse {
    public static final String RECEIVED = "received";
    public static final String UNKNOWN_OR_CLOSED = "unknown_or_closed";

    private String status;
}
