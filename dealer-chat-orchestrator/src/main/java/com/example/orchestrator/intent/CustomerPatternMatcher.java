package com.example.orchestrator.intent;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Showroom visitor inquiries. Specific inquiries outrank a greeting that opens the same message.
 */
public class CustomerPatternMatcher implements IntentMatcher {

    static final double GREETING = 0.9;
    static final double INQUIRY = 0.85;

    private static final List<String> TEST_DRIVE = List.of("test drive", "testdrive", "tes drive", "coba mobil", "coba unit");
    private static final Pattern PRICE = Pattern.compile(
            "\\b(harga|berapa|price|dp|cicilan|kredit|angsuran|nego|diskon|promo)\\b");
    private static final Pattern VEHICLE = Pattern.compile(
            "\\b(mobil|unit|ready|tersedia|stok|stock|tipe|type|warna|transmisi|matic|manual|km|tahun)\\b");
    private static final Set<String> GREETING_WORDS = Set.of(
            "halo", "hallo", "hai", "hi", "hello", "pagi", "siang", "sore", "malam", "permisi",
            "assalamualaikum", "selamat", "p", "min", "gan");

    private final List<PatternRule> rules = List.of(
            new PatternRule(MessageIntent.CUSTOMER_TEST_DRIVE, INQUIRY,
                    ctx -> TextPatterns.containsAnyPhrase(ctx.text(), TEST_DRIVE)),
            new PatternRule(MessageIntent.CUSTOMER_PRICE_INQUIRY, INQUIRY,
                    ctx -> PRICE.matcher(ctx.text()).find()),
            new PatternRule(MessageIntent.CUSTOMER_VEHICLE_INQUIRY, INQUIRY,
                    ctx -> VEHICLE.matcher(ctx.text()).find()),
            new PatternRule(MessageIntent.CUSTOMER_GREETING, GREETING,
                    ctx -> !ctx.tokens().isEmpty() && GREETING_WORDS.contains(ctx.tokens().get(0))));

    @Override
    public Optional<IntentCandidate> match(MatchContext context) {
        if (context.isBlank()) {
            return Optional.empty();
        }
        return PatternRule.firstMatch(rules, context);
    }
}
