package com.example.orchestrator.intent;

import com.example.orchestrator.domain.ConversationStatus;
import com.example.orchestrator.identity.IdentityResolution;
import com.example.orchestrator.identity.IdentityResolver;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides what an inbound message asks for by walking fixed priority tiers:
 * closing phrases, identity verification, staff commands, customer inquiries, then a fallback.
 * The first tier that produces a candidate wins; inside a tier the first matching rule wins.
 */
@Slf4j
@Component
public class IntentClassifier {

    static final double FALLBACK_CONFIDENCE = 0.6;

    private final IdentityResolver identityResolver;
    private final List<IntentMatcher> tiers;

    public IntentClassifier(IdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
        this.tiers = List.of(
                new ClosingPhraseMatcher(),
                new VerifyCommandMatcher(),
                new StaffCommandMatcher(),
                new CustomerPatternMatcher());
    }

    public ClassificationResult classify(
            String text,
            String senderPhone,
            String tenantId,
            boolean hasMedia,
            boolean explicitStaffContext,
            ConversationStatus conversationStatus) {
        return classify(new ClassificationRequest(
                text, senderPhone, tenantId, hasMedia, explicitStaffContext, conversationStatus));
    }

    public ClassificationResult classify(ClassificationRequest request) {
        return classify(request, identityResolver.resolve(request.tenantId(), request.senderPhone()));
    }

    /**
     * Classifies against an identity the caller already resolved for this message.
     */
    public ClassificationResult classify(ClassificationRequest request, IdentityResolution identity) {
        MatchContext context = MatchContext.of(request, identity.isStaff());

        for (IntentMatcher tier : tiers) {
            Optional<IntentCandidate> candidate = tier.match(context);
            if (candidate.isPresent()) {
                ClassificationResult result = toResult(candidate.get(), context);
                log.debug("Classified message from {} as {} ({}) via {}",
                        request.senderPhone(), result.intent().wireName(), result.confidence(),
                        tier.getClass().getSimpleName());
                return result;
            }
        }

        if (context.isBlank() && !context.hasMedia()) {
            return new ClassificationResult(MessageIntent.UNKNOWN, context.explicitStaffContext(), 0.0);
        }
        return new ClassificationResult(
                MessageIntent.CUSTOMER_INQUIRY, context.explicitStaffContext(), FALLBACK_CONFIDENCE);
    }

    private ClassificationResult toResult(IntentCandidate candidate, MatchContext context) {
        boolean isStaff = context.explicitStaffContext()
                || (context.senderIsStaff() && candidate.intent().isStaffCommand());
        return new ClassificationResult(candidate.intent(), isStaff, candidate.confidence());
    }
}
