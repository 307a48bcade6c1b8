package com.example.orchestrator.intent;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@code /verify 08xxx}: lets a sender hidden behind an alias identifier claim a staff number.
 */
public class VerifyCommandMatcher implements IntentMatcher {

    private static final Pattern VERIFY = Pattern.compile("^(/verify(\\s|$)|verify\\s+\\d)");

    @Override
    public Optional<IntentCandidate> match(MatchContext context) {
        if (VERIFY.matcher(context.text()).find()) {
            return Optional.of(new IntentCandidate(MessageIntent.STAFF_VERIFY_IDENTITY, StaffCommandMatcher.EXACT));
        }
        return Optional.empty();
    }
}
