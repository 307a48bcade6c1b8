package com.example.orchestrator.intent;

import com.example.orchestrator.domain.ConversationStatus;
import java.util.List;
import java.util.Set;

/**
 * Pre-normalized view of an inbound message shared by all matcher tiers.
 */
public record MatchContext(
        String rawText,
        String text,
        List<String> tokens,
        boolean hasMedia,
        boolean senderIsStaff,
        boolean explicitStaffContext,
        ConversationStatus conversationStatus) {

    public static MatchContext of(ClassificationRequest request, boolean senderIsStaff) {
        String normalized = TextPatterns.normalize(request.text());
        return new MatchContext(
                request.text() != null ? request.text().trim() : "",
                normalized,
                TextPatterns.tokens(normalized),
                request.hasMedia(),
                senderIsStaff,
                request.explicitStaffContext(),
                request.conversationStatus());
    }

    public boolean staffEligible() {
        return senderIsStaff || explicitStaffContext;
    }

    public boolean isBlank() {
        return text.isEmpty();
    }

    public Set<String> tokenSet() {
        return Set.copyOf(tokens);
    }
}
