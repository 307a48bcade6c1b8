package com.example.orchestrator.intent;

import com.example.orchestrator.domain.ConversationStatus;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Acknowledgement and "no thanks" replies. They resolve an escalated conversation; anywhere else a
 * short one is a plain acknowledgement that changes nothing.
 */
public class ClosingPhraseMatcher implements IntentMatcher {

    static final double CONFIDENCE = 1.0;

    /** Longer messages that merely start with "thanks" are treated as new questions outside an escalation. */
    private static final int ACKNOWLEDGEMENT_MAX_TOKENS = 4;

    /** Short replies that only count as closing when they are the whole message. */
    private static final Set<String> EXACT_REPLIES = Set.of(
            "tidak", "tidak ada", "ga", "gak", "nggak", "enggak", "engga", "no", "nope",
            "cukup", "sudah", "udah", "sudah cukup", "udah cukup", "itu saja", "itu aja");

    private static final List<String> PHRASES = List.of(
            "terima kasih", "terimakasih", "makasih", "makasi", "trima kasih", "tengkyu",
            "thanks", "thank you", "thx", "no thanks", "sampai jumpa", "selamat tinggal",
            "sudah cukup", "cukup sekian", "sudah jelas");

    @Override
    public Optional<IntentCandidate> match(MatchContext context) {
        if (context.isBlank() || !isClosingPhrase(context.text())) {
            return Optional.empty();
        }
        if (context.conversationStatus() == ConversationStatus.ESCALATED) {
            return Optional.of(new IntentCandidate(MessageIntent.CLOSE_CONVERSATION, CONFIDENCE));
        }
        if (context.rawText().contains("?") || context.tokens().size() > ACKNOWLEDGEMENT_MAX_TOKENS) {
            return Optional.empty();
        }
        return Optional.of(new IntentCandidate(MessageIntent.CUSTOMER_ACKNOWLEDGEMENT, CONFIDENCE));
    }

    private static boolean isClosingPhrase(String text) {
        return EXACT_REPLIES.contains(text) || TextPatterns.containsAnyPhrase(text, PHRASES);
    }
}
