package com.example.orchestrator.dto;

import lombok.Data;

@Data
public class EscalateRequest {

    private String reason = "manual";
}
