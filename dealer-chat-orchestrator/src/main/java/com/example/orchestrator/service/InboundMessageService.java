package com.example.orchestrator.service;

import com.example.orchestrator.broadcast.BroadcastDispatcher;
import com.example.orchestrator.broadcast.BroadcastJob;
import com.example.orchestrator.broadcast.BroadcastResult;
import com.example.orchestrator.command.CommandContext;
import com.example.orchestrator.command.CommandDispatcher;
import com.example.orchestrator.command.CommandRouter;
import com.example.orchestrator.command.OperationResult;
import com.example.orchestrator.command.ParsedCommand;
import com.example.orchestrator.config.OrchestratorProperties;
import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.domain.ConversationContext;
import com.example.orchestrator.domain.ConversationMessage;
import com.example.orchestrator.domain.DeliveryStatus;
import com.example.orchestrator.domain.MessageDirection;
import com.example.orchestrator.domain.StaffIdentity;
import com.example.orchestrator.dto.InboundEvent;
import com.example.orchestrator.dto.InboundOutcome;
import com.example.orchestrator.dto.InboundResult;
import com.example.orchestrator.event.MessageRecordedEvent;
import com.example.orchestrator.event.OrchestratorEvent;
import com.example.orchestrator.event.OrchestratorEventPublisher;
import com.example.orchestrator.event.OrchestratorEventType;
import com.example.orchestrator.identity.IdentityResolution;
import com.example.orchestrator.identity.IdentityResolver;
import com.example.orchestrator.identity.PhoneNormalizer;
import com.example.orchestrator.intent.ClassificationRequest;
import com.example.orchestrator.intent.ClassificationResult;
import com.example.orchestrator.intent.IntentClassifier;
import com.example.orchestrator.intent.MessageIntent;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Runs one gateway message end to end: duplicate check, identity, conversation state,
 * classification, then the staff command, verification or customer path.
 *
 * <p>Everything after the duplicate check, identity resolution included, happens under the per-sender
 * conversation lock, so two messages of one sender are never interleaved. The direct reply always goes out before any broadcast.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboundMessageService {

    /** Recent history searched for an earlier copy of a redelivered message. */
    private static final int REDELIVERY_LOOKBACK = 20;

    private final PhoneNormalizer phoneNormalizer;
    private final IdentityResolver identityResolver;
    private final IntentClassifier intentClassifier;
    private final ConversationStateMachine stateMachine;
    private final ConversationLocks conversationLocks;
    private final ConversationRepository conversationRepository;
    private final CommandRouter commandRouter;
    private final CommandDispatcher commandDispatcher;
    private final BroadcastDispatcher broadcastDispatcher;
    private final ReplySender replySender;
    private final CustomerInquiryResponder customerResponder;
    private final OrchestratorEventPublisher eventPublisher;
    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final OrchestratorProperties properties;

    public InboundResult handle(InboundEvent event) {
        String sender = phoneNormalizer.normalize(event.getFrom());
        if (sender.isEmpty()) {
            log.warn("Ignoring message {} from unusable sender '{}' on client {}",
                    event.getMessageId(), event.getFrom(), event.getClientId());
            return InboundResult.of(InboundOutcome.IGNORED);
        }

        if (!claimMessage(event)) {
            log.info("Duplicate message {} on client {} dropped", event.getMessageId(), event.getClientId());
            return InboundResult.of(InboundOutcome.DUPLICATE);
        }

        try {
            return conversationLocks.withLock(event.getTenantId(), sender, () -> process(event, sender));
        } catch (RuntimeException ex) {
            // let the gateway redeliver
            processedMarker(event).ifPresent(RBucket::delete);
            throw ex;
        }
    }

    /** Remembers the gateway message id; false when it was seen before. Events without an id always pass. */
    private boolean claimMessage(InboundEvent event) {
        return processedMarker(event)
                .map(bucket -> bucket.setIfAbsent(Instant.now().toString(), properties.getRedis().getDedupTtl()))
                .orElse(true);
    }

    private Optional<RBucket<String>> processedMarker(InboundEvent event) {
        if (!StringUtils.hasText(event.getMessageId())) {
            return Optional.empty();
        }
        return Optional.of(redissonClient.getBucket(
                keyFactory.processedMessageKey(event.getClientId(), event.getMessageId()), StringCodec.INSTANCE));
    }

    private InboundResult process(InboundEvent event, String sender) {
        IdentityResolution identity = identityResolver.resolve(event.getTenantId(), event.getFrom());
        Conversation conversation = stateMachine.getOrCreate(event.getTenantId(), sender, identity.isStaff());
        boolean reopened = stateMachine.onInbound(conversation);
        if (reopened) {
            log.info("Conversation {} reopened by {}", conversation.getId(), sender);
        }

        ClassificationResult classification = intentClassifier.classify(new ClassificationRequest(
                event.getMessage(),
                sender,
                event.getTenantId(),
                event.isHasMedia(),
                conversation.isStaff(),
                conversation.getStatus()), identity);
        recordInbound(conversation, event, classification);
        if (classification.isStaff()) {
            stateMachine.markStaff(conversation);
        }
        log.info("Message {} from {} in tenant {}: intent={} staff={} confidence={}",
                event.getMessageId(), sender, event.getTenantId(),
                classification.intent().wireName(), classification.isStaff(), classification.confidence());

        InboundResult.InboundResultBuilder result = InboundResult.builder()
                .outcome(InboundOutcome.PROCESSED)
                .conversationId(conversation.getId())
                .intent(classification.intent())
                .staff(classification.isStaff())
                .confidence(classification.confidence());

        try {
            route(event, sender, identity, conversation, classification, reopened, result);
        } catch (RuntimeException ex) {
            log.warn("Handling message {} in conversation {} failed: {}",
                    event.getMessageId(), conversation.getId(), ex.getMessage(), ex);
            replySender.sendText(conversation, event.getClientId(), replyAddress(event, sender),
                    properties.getReplies().getOperationFailed(), classification.intent().wireName());
        }
        return result.status(conversation.getStatus()).build();
    }

    private void route(
            InboundEvent event,
            String sender,
            IdentityResolution identity,
            Conversation conversation,
            ClassificationResult classification,
            boolean reopened,
            InboundResult.InboundResultBuilder result) {
        MessageIntent intent = classification.intent();
        if (intent == MessageIntent.CLOSE_CONVERSATION) {
            if (stateMachine.close(conversation, event.getMessage())) {
                reply(event, sender, conversation, properties.getReplies().getClosing(), intent);
            }
        } else if (intent == MessageIntent.STAFF_VERIFY_IDENTITY) {
            verify(event, sender, identity, conversation);
        } else if (classification.isStaffCommand()) {
            result.broadcast(runCommand(event, sender, identity, conversation, classification, result));
        } else if (intent == MessageIntent.CUSTOMER_ACKNOWLEDGEMENT) {
            log.debug("Acknowledgement in conversation {} needs no answer", conversation.getId());
        } else if (identity.isStaff() || conversation.isStaff()) {
            reply(event, sender, conversation, properties.getReplies().getStaffHint(), intent);
        } else {
            answerCustomer(event, sender, conversation, classification, reopened);
        }
    }

    private BroadcastResult runCommand(
            InboundEvent event,
            String sender,
            IdentityResolution identity,
            Conversation conversation,
            ClassificationResult classification,
            InboundResult.InboundResultBuilder result) {
        ParsedCommand command = commandRouter.parseCommand(event.getMessage(), classification.intent());
        result.command(command.command());
        String requester = StringUtils.hasText(identity.phone()) ? identity.phone() : sender;

        OperationResult outcome = commandDispatcher.dispatch(command, new CommandContext(
                event.getTenantId(),
                event.getClientId(),
                requester,
                identity.roleLevel(),
                true,
                conversation.getId(),
                event.getMediaUrl()));

        String to = replyAddress(event, sender);
        if (StringUtils.hasText(outcome.getMessage())) {
            replySender.sendText(conversation, event.getClientId(), to, outcome.getMessage(),
                    classification.intent().wireName());
        }
        if (!outcome.isSuccess() || !outcome.hasArtifact()) {
            return null;
        }

        replySender.sendDocument(conversation, event.getClientId(), to,
                outcome.getArtifactBytes(), outcome.getFilename(), outcome.getFilename());
        if (!outcome.shouldBroadcast()) {
            return null;
        }

        BroadcastResult broadcast = broadcastDispatcher.broadcast(new BroadcastJob(
                outcome.getArtifactBytes(),
                outcome.getFilename(),
                outcome.getFilename(),
                outcome.getBroadcastToRoles(),
                event.getTenantId(),
                event.getClientId(),
                requester));
        eventPublisher.publishLifecycleEvent(OrchestratorEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(OrchestratorEventType.BROADCAST_COMPLETED)
                .tenantId(event.getTenantId())
                .conversationId(conversation.getId())
                .occurredAt(Instant.now())
                .payload(Map.of(
                        "filename", String.valueOf(outcome.getFilename()),
                        "delivered", broadcast.delivered(),
                        "failed", broadcast.failed()))
                .build());
        return broadcast;
    }

    /**
     * {@code /verify <phone>}: an alias sender claims a registered staff number and is linked to it.
     * A sender writing from a real number can only confirm that same number.
     */
    private void verify(InboundEvent event, String sender, IdentityResolution identity, Conversation conversation) {
        OrchestratorProperties.Replies replies = properties.getReplies();
        ParsedCommand command = commandRouter.parseCommand(event.getMessage(), MessageIntent.STAFF_VERIFY_IDENTITY);
        if (!command.isValid()) {
            reply(event, sender, conversation, replies.getVerifyUsage(), MessageIntent.STAFF_VERIFY_IDENTITY);
            return;
        }

        String claimedPhone = command.param(ParsedCommand.PHONE);
        IdentityResolution claimed = identityResolver.resolvePhone(event.getTenantId(), claimedPhone);
        boolean alias = phoneNormalizer.isAlias(event.getFrom());
        boolean allowed = claimed.isStaff()
                && (alias || phoneNormalizer.sameNumber(sender, claimed.phone()));
        if (!allowed) {
            log.info("Verification of {} as {} refused in tenant {} (staff={}, ambiguous={})",
                    event.getFrom(), claimedPhone, event.getTenantId(), claimed.isStaff(), claimed.ambiguous());
            reply(event, sender, conversation, replies.getVerifyFailed().formatted(claimedPhone),
                    MessageIntent.STAFF_VERIFY_IDENTITY);
            return;
        }

        if (alias) {
            stateMachine.linkAlias(conversation, event.getFrom(), claimed.phone(),
                    ConversationContext.VERIFIED_VIA_VERIFY_COMMAND);
        } else {
            stateMachine.updateContext(conversation, context -> {
                context.setVerifiedStaffPhone(claimed.phone());
                context.setVerifiedVia(ConversationContext.VERIFIED_VIA_VERIFY_COMMAND);
                context.setVerifiedAt(Instant.now());
                return context;
            });
            stateMachine.markStaff(conversation);
        }

        StaffIdentity staff = claimed.staff().orElseThrow();
        log.info("{} verified as staff {} ({}) in tenant {}",
                event.getFrom(), claimed.phone(), staff.getRole(), event.getTenantId());
        reply(event, sender, conversation,
                replies.getVerifySuccess().formatted(claimed.phone(), staff.displayName()),
                MessageIntent.STAFF_VERIFY_IDENTITY);
    }

    /**
     * A message that reopened a closed conversation is welcomed back and leaves it active; only the
     * next inquiry hands it to sales again.
     */
    private void answerCustomer(
            InboundEvent event,
            String sender,
            Conversation conversation,
            ClassificationResult classification,
            boolean reopened) {
        Optional<CustomerReply> answer = customerResponder.respond(conversation, classification, event.getMessage());
        if (answer.isEmpty()) {
            return;
        }
        CustomerReply customerReply = answer.get();
        if (reopened && customerReply.escalate()) {
            reply(event, sender, conversation, properties.getReplies().getWelcome(), classification.intent());
            return;
        }
        if (StringUtils.hasText(customerReply.text())) {
            reply(event, sender, conversation, customerReply.text(), classification.intent());
        }
        if (customerReply.escalate() && stateMachine.escalate(conversation, customerReply.reason())) {
            log.info("Conversation {} escalated to sales ({})", conversation.getId(), customerReply.reason());
        }
    }

    private void reply(InboundEvent event, String sender, Conversation conversation, String text, MessageIntent intent) {
        replySender.sendText(conversation, event.getClientId(), replyAddress(event, sender), text, intent.wireName());
    }

    /** Aliases can only be reached through the full gateway identifier. */
    private String replyAddress(InboundEvent event, String sender) {
        return phoneNormalizer.isAlias(event.getFrom()) ? event.getFrom() : sender;
    }

    /**
     * Appends the inbound message and announces it. A redelivery of a message whose first attempt failed
     * after it was stored reuses the stored row.
     */
    private void recordInbound(Conversation conversation, InboundEvent event, ClassificationResult classification) {
        ConversationMessage message = findRecorded(conversation, event)
                .orElseGet(() -> appendInbound(conversation, event, classification));

        eventPublisher.publishMessageEvent(MessageRecordedEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .tenantId(conversation.getTenantId())
                .conversationId(conversation.getId())
                .message(message)
                .occurredAt(Instant.now())
                .build());
    }

    private Optional<ConversationMessage> findRecorded(Conversation conversation, InboundEvent event) {
        if (!StringUtils.hasText(event.getMessageId())) {
            return Optional.empty();
        }
        return conversationRepository.getMessages(conversation.getId(), REDELIVERY_LOOKBACK).stream()
                .filter(message -> message.getDirection() == MessageDirection.INBOUND)
                .filter(message -> event.getMessageId().equals(message.getGatewayMessageId()))
                .findFirst();
    }

    private ConversationMessage appendInbound(
            Conversation conversation, InboundEvent event, ClassificationResult classification) {
        String content = event.getMessage();
        if (!StringUtils.hasText(content) && event.isHasMedia()) {
            content = "[media] " + (event.getMediaUrl() != null ? event.getMediaUrl() : "");
        }
        ConversationMessage message = ConversationMessage.builder()
                .id(UUID.randomUUID().toString())
                .conversationId(conversation.getId())
                .direction(MessageDirection.INBOUND)
                .sender(event.getFrom())
                .content(content)
                .intent(classification.intent().wireName())
                .deliveryStatus(DeliveryStatus.RECEIVED)
                .gatewayMessageId(event.getMessageId())
                .timestamp(Instant.now())
                .build();
        conversationRepository.appendMessage(message);
        return message;
    }
}
