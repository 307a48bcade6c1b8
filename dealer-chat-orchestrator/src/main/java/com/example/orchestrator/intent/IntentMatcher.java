package com.example.orchestrator.intent;

import java.util.Optional;

/**
 * One priority tier of the classifier. Returns the first rule of the tier that matches.
 */
public interface IntentMatcher {

    Optional<IntentCandidate> match(MatchContext context);
}
