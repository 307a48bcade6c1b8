package com.example.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlatformCommandRequest {
    String command;
    Map<String, String> params;
    String tenantId;
    String requestedBy;
    int roleLevel;
    String mediaUrl;
}
