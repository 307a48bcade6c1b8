package com.example.orchestrator.command;

import com.example.orchestrator.config.OrchestratorProperties;
import com.example.orchestrator.domain.StaffRole;
import com.example.orchestrator.dto.PlatformCommandRequest;
import com.example.orchestrator.dto.PlatformCommandResponse;
import java.util.Base64;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Forwards operational and reporting commands to the dealership platform, which owns inventory,
 * analytics and document rendering.
 */
@Slf4j
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
public class PlatformOperationHandler implements OperationHandler {

    private static final Set<CommandType> FORWARDED = EnumSet.of(
            CommandType.REPORT, CommandType.STATUS, CommandType.INVENTORY,
            CommandType.STATS, CommandType.EDIT, CommandType.UPLOAD);

    private final WebClient platformWebClient;
    private final OrchestratorProperties properties;

    public PlatformOperationHandler(
            @Qualifier("platformWebClient") WebClient platformWebClient,
            OrchestratorProperties properties) {
        this.platformWebClient = platformWebClient;
        this.properties = properties;
    }

    @Override
    public boolean supports(ParsedCommand command) {
        return FORWARDED.contains(command.command());
    }

    @Override
    public OperationResult handle(ParsedCommand command, CommandContext context) {
        PlatformCommandRequest request = PlatformCommandRequest.builder()
                .command(command.command().wireName())
                .params(command.params())
                .tenantId(context.tenantId())
                .requestedBy(context.senderPhone())
                .roleLevel(context.roleLevel())
                .mediaUrl(context.mediaUrl())
                .build();

        log.debug("Forwarding {} {} for tenant {}", request.getCommand(), request.getParams(), request.getTenantId());
        PlatformCommandResponse response = platformWebClient.post()
                .uri(properties.getPlatform().getCommandPath())
                .bodyValue(request)
                .retrieve()
                .bodyToMono(PlatformCommandResponse.class)
                .block(properties.getPlatform().getTimeout());

        if (response == null) {
            throw new IllegalStateException("Empty response from platform for command " + request.getCommand());
        }
        return toResult(response);
    }

    OperationResult toResult(PlatformCommandResponse response) {
        byte[] artifact = null;
        if (StringUtils.hasText(response.getArtifactBase64())) {
            artifact = Base64.getDecoder().decode(response.getArtifactBase64());
        }

        Set<StaffRole> roles = EnumSet.noneOf(StaffRole.class);
        if (response.getBroadcastToRoles() != null) {
            for (String name : response.getBroadcastToRoles()) {
                Optional<StaffRole> role = StaffRole.fromName(name);
                if (role.isPresent()) {
                    roles.add(role.get());
                } else {
                    log.warn("Ignoring unknown broadcast role '{}' returned by platform", name);
                }
            }
        }

        String message = response.getMessage();
        if (!response.isSuccess() && !StringUtils.hasText(message)) {
            message = properties.getReplies().getOperationFailed();
        }
        return OperationResult.builder()
                .success(response.isSuccess())
                .message(message)
                .artifactBytes(artifact)
                .filename(response.getFilename())
                .followUp(response.isFollowUp())
                .broadcastToRoles(Set.copyOf(roles))
                .build();
    }
}
