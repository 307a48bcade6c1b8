package com.example.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PlatformCommandResponse {

    private boolean success;
    private String message;
    /** Generated document, base64 encoded. */
    private String artifactBase64;
    private String filename;
    private boolean followUp;
    private List<String> broadcastToRoles = new ArrayList<>();
}
