package com.example.orchestrator.intent;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * A single predicate inside a tier, producing a fixed intent and confidence.
 */
record PatternRule(MessageIntent intent, double confidence, Predicate<MatchContext> predicate) {

    static Optional<IntentCandidate> firstMatch(List<PatternRule> rules, MatchContext context) {
        for (PatternRule rule : rules) {
            if (rule.predicate().test(context)) {
                return Optional.of(new IntentCandidate(rule.intent(), rule.confidence()));
            }
        }
        return Optional.empty();
    }
}
