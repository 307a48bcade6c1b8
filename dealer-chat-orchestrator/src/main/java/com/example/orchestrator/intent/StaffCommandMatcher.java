package com.example.orchestrator.intent;

import com.example.orchestrator.command.ReportType;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Back-office commands. Only consulted for senders known to be staff or threads already marked staff.
 *
 * <p>Confidence reflects how specific the match was: a command word at the start of the message
 * scores {@value #EXACT}, a known phrase anywhere {@value #PHRASE}, a looser pattern {@value #LOOSE}.
 */
public class StaffCommandMatcher implements IntentMatcher {

    static final double EXACT = 0.95;
    static final double MEDIA = 0.9;
    static final double PHRASE = 0.85;
    static final double LOOSE = 0.8;

    static final Set<String> HELP_WORDS = Set.of(
            "help", "bantuan", "panduan", "cara", "guide", "menu", "fitur", "perintah", "command");

    private static final Set<String> REPORT_WORDS = Set.of("report", "pdf", "reports");

    private static final List<String> REPORT_PHRASES = List.of(
            "sales report", "report pdf", "pdf report", "kirim report", "kirim pdf", "kirim reportnya",
            "kirim pdfnya", "laporan lengkap", "sales report lengkap", "penjualan showroom");

    private static final List<Pattern> REPORT_LOOSE = List.of(
            Pattern.compile("\\b(sales|penjualan)\\s+(summary|report|metrics|data|analytics)\\b"),
            Pattern.compile("\\b(metrics|metrix)\\s+(sales|penjualan|operational|pelanggan|customer)\\b"),
            Pattern.compile("\\b(customer|pelanggan)\\s+metrics\\b"),
            Pattern.compile("\\btotal\\s+(penjualan|revenue|inventory)\\b"));

    private static final Pattern STATUS_COMMAND = Pattern.compile("^/?status\\b");
    private static final Pattern STATUS_PHRASE = Pattern.compile("\\b(update|ubah|ganti|set)\\s+status\\b");
    private static final Pattern INVENTORY_COMMAND = Pattern.compile("^/?(inventory|stock|stok)\\b");
    private static final List<String> INVENTORY_PHRASES = List.of(
            "cek stok", "cek stock", "lihat stok", "lihat inventory", "daftar mobil", "list mobil");
    private static final Pattern STATS_COMMAND = Pattern.compile("^/?(stats|statistik|laporan)\\b");
    private static final Pattern EDIT_COMMAND = Pattern.compile("^/?(edit|ubah|rubah|ganti)\\b");
    private static final Pattern UPLOAD_COMMAND = Pattern.compile("^/?(upload|tambah|input)\\b");

    private static final Pattern VEHICLE_MODEL = Pattern.compile(
            "\\b(toyota|honda|daihatsu|suzuki|mitsubishi|nissan|mazda|hyundai|wuling|kia|bmw|mercedes"
                    + "|avanza|xenia|brio|jazz|innova|fortuner|ertiga|pajero|xpander|rush|terios|agya|ayla"
                    + "|calya|sigra|civic|crv|hrv|brv|yaris|raize|rocky|almaz)\\b");
    private static final Pattern VEHICLE_YEAR = Pattern.compile("\\b(19[89]\\d|20[0-4]\\d)\\b");
    private static final Pattern VEHICLE_PRICE = Pattern.compile("\\b\\d+([.,]\\d+)?\\s*(jt|juta|rb|ribu|m|miliar)\\b");

    private final List<PatternRule> rules = List.of(
            new PatternRule(MessageIntent.STAFF_HELP, EXACT,
                    ctx -> HELP_WORDS.contains(TextPatterns.commandWord(ctx.tokens())) && ctx.tokens().size() == 1),
            new PatternRule(MessageIntent.STAFF_GET_REPORT, EXACT,
                    ctx -> REPORT_WORDS.contains(TextPatterns.commandWord(ctx.tokens())) && ctx.tokens().size() == 1),
            new PatternRule(MessageIntent.STAFF_GET_REPORT, PHRASE,
                    ctx -> TextPatterns.containsAnyPhrase(ctx.text(), REPORT_PHRASES)
                            || ReportType.detect(ctx.tokenSet()).isPresent()
                            || REPORT_WORDS.contains(TextPatterns.commandWord(ctx.tokens()))),
            new PatternRule(MessageIntent.STAFF_GET_REPORT, LOOSE,
                    ctx -> REPORT_LOOSE.stream().anyMatch(p -> p.matcher(ctx.text()).find())),
            new PatternRule(MessageIntent.STAFF_HELP, PHRASE,
                    ctx -> ctx.tokens().stream().anyMatch(HELP_WORDS::contains)),
            new PatternRule(MessageIntent.STAFF_UPDATE_STATUS, EXACT,
                    ctx -> STATUS_COMMAND.matcher(ctx.text()).find()),
            new PatternRule(MessageIntent.STAFF_UPDATE_STATUS, PHRASE,
                    ctx -> STATUS_PHRASE.matcher(ctx.text()).find()),
            new PatternRule(MessageIntent.STAFF_CHECK_INVENTORY, EXACT,
                    ctx -> INVENTORY_COMMAND.matcher(ctx.text()).find()),
            new PatternRule(MessageIntent.STAFF_CHECK_INVENTORY, PHRASE,
                    ctx -> TextPatterns.containsAnyPhrase(ctx.text(), INVENTORY_PHRASES)),
            new PatternRule(MessageIntent.STAFF_GET_STATS, EXACT,
                    ctx -> STATS_COMMAND.matcher(ctx.text()).find()),
            new PatternRule(MessageIntent.STAFF_EDIT_VEHICLE, EXACT,
                    ctx -> EDIT_COMMAND.matcher(ctx.text()).find()),
            new PatternRule(MessageIntent.STAFF_UPLOAD_VEHICLE, EXACT,
                    ctx -> UPLOAD_COMMAND.matcher(ctx.text()).find()),
            new PatternRule(MessageIntent.STAFF_UPLOAD_VEHICLE, MEDIA,
                    ctx -> ctx.hasMedia() && ctx.isBlank()),
            new PatternRule(MessageIntent.STAFF_UPLOAD_VEHICLE, PHRASE,
                    StaffCommandMatcher::looksLikeVehicleDescription));

    @Override
    public Optional<IntentCandidate> match(MatchContext context) {
        if (!context.staffEligible()) {
            return Optional.empty();
        }
        return PatternRule.firstMatch(rules, context);
    }

    private static boolean looksLikeVehicleDescription(MatchContext ctx) {
        return VEHICLE_MODEL.matcher(ctx.text()).find()
                && VEHICLE_YEAR.matcher(ctx.text()).find()
                && VEHICLE_PRICE.matcher(ctx.text()).find();
    }
}
