package com.example.orchestrator.dto;

import com.example.orchestrator.broadcast.BroadcastResult;
import com.example.orchestrator.command.CommandType;
import com.example.orchestrator.domain.ConversationStatus;
import com.example.orchestrator.intent.MessageIntent;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InboundResult {
    InboundOutcome outcome;
    String conversationId;
    MessageIntent intent;
    boolean staff;
    double confidence;
    CommandType command;
    ConversationStatus status;
    BroadcastResult broadcast;

    public static InboundResult of(InboundOutcome outcome) {
        return InboundResult.builder().outcome(outcome).build();
    }
}
