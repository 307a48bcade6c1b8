package com.example.orchestrator.command;

import com.example.orchestrator.config.OrchestratorProperties;
import com.example.orchestrator.domain.StaffRole;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Checks the requester's role level against the command and hands it to the first supporting
 * {@link OperationHandler}. Handler failures never escape; they become a failed result carrying the
 * user-facing apology.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandDispatcher {

    private final List<OperationHandler> handlers;
    private final OrchestratorProperties properties;

    public OperationResult dispatch(ParsedCommand command, CommandContext context) {
        OrchestratorProperties.Replies replies = properties.getReplies();
        if (command.command() == CommandType.UNKNOWN) {
            return OperationResult.failure(replies.getUnknownCommand());
        }

        int required = requiredLevel(command.command());
        if (context.roleLevel() < required) {
            log.info("Denied {} for {} in tenant {}: level {} below {}",
                    command.command().wireName(), context.senderPhone(), context.tenantId(),
                    context.roleLevel(), required);
            return OperationResult.failure(command.command() == CommandType.REPORT
                    ? replies.getReportAccessDenied()
                    : replies.getAccessDenied());
        }

        if (!command.isValid()) {
            return OperationResult.failure(replies.getInvalidCommand().formatted(command.error()));
        }

        Optional<OperationHandler> handler = handlers.stream()
                .filter(candidate -> candidate.supports(command))
                .findFirst();
        if (handler.isEmpty()) {
            log.warn("No operation handler for command {}", command.command().wireName());
            return OperationResult.failure(replies.getUnknownCommand());
        }

        try {
            OperationResult result = handler.get().handle(command, context);
            log.info("Command {} {} for {} in tenant {} via {}",
                    command.command().wireName(), result.isSuccess() ? "succeeded" : "failed",
                    context.senderPhone(), context.tenantId(), handler.get().getClass().getSimpleName());
            return result;
        } catch (RuntimeException ex) {
            log.warn("Command {} failed for {} in tenant {}: {}",
                    command.command().wireName(), context.senderPhone(), context.tenantId(), ex.getMessage(), ex);
            return OperationResult.failure(replies.getOperationFailed());
        }
    }

    static int requiredLevel(CommandType command) {
        return switch (command) {
            case REPORT -> StaffRole.REPORT_LEVEL;
            case HELP, VERIFY, UNKNOWN -> 0;
            default -> StaffRole.OPERATIONAL_LEVEL;
        };
    }
}
