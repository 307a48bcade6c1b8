package com.example.orchestrator.command;

import com.example.orchestrator.intent.MessageIntent;
import com.example.orchestrator.intent.TextPatterns;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns staff command text into a {@link ParsedCommand}. Stateless; synonyms are folded onto a
 * canonical vocabulary and parameters are picked up regardless of word order.
 */
@Component
public class CommandRouter {

    private static final Map<String, CommandType> KEYWORDS = buildKeywords();
    private static final Map<String, String> STATUS_WORDS = buildStatusWords();
    private static final Map<String, String> PERIOD_WORDS = buildPeriodWords();
    private static final Map<String, String> EDIT_FIELDS = buildEditFields();

    private static final Set<String> STATUS_FILLER = Set.of(
            "status", "update", "ubah", "ganti", "set", "jadi", "menjadi", "ke", "to", "mobil", "unit", "sudah");
    private static final Set<String> INVENTORY_FILLER = Set.of(
            "inventory", "stock", "stok", "cek", "lihat", "daftar", "list", "mobil", "semua");
    private static final Set<String> EDIT_FILLER = Set.of(
            "edit", "ubah", "rubah", "ganti", "jadi", "menjadi", "ke", "to", "mobil", "unit");

    private static final Pattern HYPHENATED_ID = Pattern.compile("^(?=.*\\d)[a-z0-9]+(-[a-z0-9]+)+$");
    private static final Pattern ALPHANUMERIC_ID = Pattern.compile("^(?=.*\\d)(?=.*[a-z])[a-z0-9]{3,}$");
    private static final Pattern PRICE_LIKE = Pattern.compile("^\\d+([.,]\\d+)?(jt|juta|rb|ribu|k|m)?$");
    private static final Pattern UPLOAD_PREFIX = Pattern.compile("(?i)^\\s*/?(upload|tambah|input)\\b\\s*");
    private static final Pattern VERIFY_PREFIX = Pattern.compile("(?i)^\\s*/?verify\\b(.*)$");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    public ParsedCommand parseCommand(String text, MessageIntent intent) {
        String normalized = TextPatterns.normalize(text);
        List<String> tokens = TextPatterns.tokens(normalized);
        CommandType command = fromIntent(intent).orElseGet(() -> detect(normalized, tokens));

        return switch (command) {
            case REPORT -> parseReport(tokens);
            case STATUS -> parseStatus(tokens);
            case INVENTORY -> parseInventory(tokens);
            case STATS -> parseStats(normalized, tokens);
            case EDIT -> parseEdit(tokens);
            case UPLOAD -> parseUpload(text);
            case HELP -> ParsedCommand.of(CommandType.HELP, Map.of());
            case VERIFY -> parseVerify(text);
            case UNKNOWN -> ParsedCommand.unknown();
        };
    }

    private Optional<CommandType> fromIntent(MessageIntent intent) {
        if (intent == null) {
            return Optional.empty();
        }
        return switch (intent) {
            case STAFF_HELP -> Optional.of(CommandType.HELP);
            case STAFF_GET_REPORT -> Optional.of(CommandType.REPORT);
            case STAFF_UPDATE_STATUS -> Optional.of(CommandType.STATUS);
            case STAFF_CHECK_INVENTORY -> Optional.of(CommandType.INVENTORY);
            case STAFF_GET_STATS -> Optional.of(CommandType.STATS);
            case STAFF_EDIT_VEHICLE -> Optional.of(CommandType.EDIT);
            case STAFF_UPLOAD_VEHICLE -> Optional.of(CommandType.UPLOAD);
            case STAFF_VERIFY_IDENTITY -> Optional.of(CommandType.VERIFY);
            default -> Optional.empty();
        };
    }

    private CommandType detect(String normalized, List<String> tokens) {
        if (tokens.isEmpty()) {
            return CommandType.UNKNOWN;
        }
        if (ReportType.detect(Set.copyOf(tokens)).isPresent() || TextPatterns.containsPhrase(normalized, "sales report")) {
            return CommandType.REPORT;
        }
        CommandType leading = KEYWORDS.get(TextPatterns.commandWord(tokens));
        if (leading != null) {
            return leading;
        }
        for (String token : tokens) {
            CommandType keyword = KEYWORDS.get(token.startsWith("/") ? token.substring(1) : token);
            if (keyword != null) {
                return keyword;
            }
        }
        return CommandType.UNKNOWN;
    }

    private ParsedCommand parseReport(List<String> tokens) {
        Map<String, String> params = new LinkedHashMap<>();
        ReportType type = ReportType.detect(Set.copyOf(tokens)).orElse(ReportType.REPORT_MENU);
        params.put(ParsedCommand.TYPE, type.wireName());
        if (type != ReportType.REPORT_MENU && tokens.contains("pdf")) {
            params.put(ParsedCommand.FORMAT, "pdf");
        }
        return ParsedCommand.of(CommandType.REPORT, params);
    }

    private ParsedCommand parseStatus(List<String> tokens) {
        Map<String, String> params = new LinkedHashMap<>();
        String status = null;
        for (String token : tokens) {
            status = STATUS_WORDS.get(token);
            if (status != null) {
                break;
            }
        }
        List<String> remaining = tokens.stream()
                .map(token -> token.startsWith("/") ? token.substring(1) : token)
                .filter(token -> !STATUS_FILLER.contains(token) && !STATUS_WORDS.containsKey(token))
                .toList();
        findVehicleId(remaining).ifPresent(id -> params.put(ParsedCommand.VEHICLE_ID, id));
        if (status != null) {
            params.put(ParsedCommand.STATUS, status);
        }

        if (!params.containsKey(ParsedCommand.VEHICLE_ID)) {
            return ParsedCommand.invalid(CommandType.STATUS, params, ParsedCommand.VEHICLE_ID);
        }
        if (status == null) {
            return ParsedCommand.invalid(CommandType.STATUS, params, ParsedCommand.STATUS);
        }
        return ParsedCommand.of(CommandType.STATUS, params);
    }

    private ParsedCommand parseInventory(List<String> tokens) {
        List<String> filter = tokens.stream()
                .map(token -> token.startsWith("/") ? token.substring(1) : token)
                .filter(token -> !INVENTORY_FILLER.contains(token))
                .toList();
        if (filter.isEmpty()) {
            return ParsedCommand.of(CommandType.INVENTORY, Map.of());
        }
        return ParsedCommand.of(CommandType.INVENTORY, Map.of(ParsedCommand.FILTER, String.join(" ", filter)));
    }

    private ParsedCommand parseStats(String normalized, List<String> tokens) {
        String period = "today";
        if (TextPatterns.containsPhrase(normalized, "hari ini")) {
            period = "today";
        } else {
            for (String token : tokens) {
                String mapped = PERIOD_WORDS.get(token);
                if (mapped != null) {
                    period = mapped;
                    break;
                }
            }
        }
        return ParsedCommand.of(CommandType.STATS, Map.of(ParsedCommand.PERIOD, period));
    }

    private ParsedCommand parseEdit(List<String> tokens) {
        List<String> words = new ArrayList<>(tokens.stream()
                .map(token -> token.startsWith("/") ? token.substring(1) : token)
                .toList());
        if (!words.isEmpty() && EDIT_FILLER.contains(words.get(0))) {
            words.remove(0);
        }

        Map<String, String> params = new LinkedHashMap<>();
        Optional<String> vehicleId = findVehicleId(words);
        vehicleId.ifPresent(id -> {
            params.put(ParsedCommand.VEHICLE_ID, id);
            words.remove(id.toLowerCase(Locale.ROOT));
        });

        String field = null;
        int fieldIndex = -1;
        for (int i = 0; i < words.size(); i++) {
            field = EDIT_FIELDS.get(words.get(i));
            if (field != null) {
                fieldIndex = i;
                break;
            }
        }
        if (field != null) {
            params.put(ParsedCommand.FIELD, field);
            List<String> value = words.subList(fieldIndex + 1, words.size()).stream()
                    .filter(word -> !EDIT_FILLER.contains(word))
                    .toList();
            if (!value.isEmpty()) {
                params.put(ParsedCommand.VALUE, String.join(" ", value));
            }
        }

        if (vehicleId.isEmpty()) {
            return ParsedCommand.invalid(CommandType.EDIT, params, ParsedCommand.VEHICLE_ID);
        }
        if (field == null) {
            return ParsedCommand.invalid(CommandType.EDIT, params, ParsedCommand.FIELD);
        }
        if (!params.containsKey(ParsedCommand.VALUE)) {
            return ParsedCommand.invalid(CommandType.EDIT, params, ParsedCommand.VALUE);
        }
        return ParsedCommand.of(CommandType.EDIT, params);
    }

    private ParsedCommand parseUpload(String text) {
        String description = text == null ? "" : UPLOAD_PREFIX.matcher(text).replaceFirst("").trim();
        if (description.isEmpty()) {
            return ParsedCommand.of(CommandType.UPLOAD, Map.of());
        }
        return ParsedCommand.of(CommandType.UPLOAD, Map.of(ParsedCommand.DESCRIPTION, description));
    }

    private ParsedCommand parseVerify(String text) {
        String phone = "";
        if (text != null) {
            Matcher matcher = VERIFY_PREFIX.matcher(text);
            if (matcher.matches()) {
                phone = NON_DIGITS.matcher(matcher.group(1)).replaceAll("");
            }
        }
        if (phone.isEmpty()) {
            return ParsedCommand.invalid(CommandType.VERIFY, Map.of(), ParsedCommand.PHONE);
        }
        return ParsedCommand.of(CommandType.VERIFY, Map.of(ParsedCommand.PHONE, phone));
    }

    /** Dealer stock ids look like {@code PM-PST-001}; bare prices such as {@code 150jt} are skipped. */
    private Optional<String> findVehicleId(List<String> words) {
        for (String word : words) {
            if (HYPHENATED_ID.matcher(word).matches()) {
                return Optional.of(word.toUpperCase(Locale.ROOT));
            }
        }
        for (String word : words) {
            if (ALPHANUMERIC_ID.matcher(word).matches() && !PRICE_LIKE.matcher(word).matches()) {
                return Optional.of(word.toUpperCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    private static Map<String, CommandType> buildKeywords() {
        Map<String, CommandType> m = new HashMap<>();
        m.put("report", CommandType.REPORT);
        m.put("pdf", CommandType.REPORT);
        m.put("status", CommandType.STATUS);
        m.put("inventory", CommandType.INVENTORY);
        m.put("stock", CommandType.INVENTORY);
        m.put("stok", CommandType.INVENTORY);
        m.put("stats", CommandType.STATS);
        m.put("statistik", CommandType.STATS);
        m.put("laporan", CommandType.STATS);
        m.put("edit", CommandType.EDIT);
        m.put("ubah", CommandType.EDIT);
        m.put("rubah", CommandType.EDIT);
        m.put("ganti", CommandType.EDIT);
        m.put("upload", CommandType.UPLOAD);
        m.put("tambah", CommandType.UPLOAD);
        m.put("input", CommandType.UPLOAD);
        m.put("help", CommandType.HELP);
        m.put("bantuan", CommandType.HELP);
        m.put("panduan", CommandType.HELP);
        m.put("menu", CommandType.HELP);
        m.put("perintah", CommandType.HELP);
        m.put("command", CommandType.HELP);
        m.put("verify", CommandType.VERIFY);
        return Map.copyOf(m);
    }

    private static Map<String, String> buildStatusWords() {
        Map<String, String> m = new HashMap<>();
        m.put("available", "AVAILABLE");
        m.put("tersedia", "AVAILABLE");
        m.put("ready", "AVAILABLE");
        m.put("booked", "BOOKED");
        m.put("booking", "BOOKED");
        m.put("book", "BOOKED");
        m.put("dipesan", "BOOKED");
        m.put("sold", "SOLD");
        m.put("terjual", "SOLD");
        m.put("laku", "SOLD");
        m.put("deleted", "DELETED");
        m.put("delete", "DELETED");
        m.put("hapus", "DELETED");
        m.put("dihapus", "DELETED");
        return Map.copyOf(m);
    }

    private static Map<String, String> buildPeriodWords() {
        Map<String, String> m = new HashMap<>();
        m.put("today", "today");
        m.put("harian", "today");
        m.put("daily", "today");
        m.put("week", "week");
        m.put("weekly", "week");
        m.put("minggu", "week");
        m.put("mingguan", "week");
        m.put("month", "month");
        m.put("monthly", "month");
        m.put("bulan", "month");
        m.put("bulanan", "month");
        return Map.copyOf(m);
    }

    private static Map<String, String> buildEditFields() {
        Map<String, String> m = new HashMap<>();
        m.put("harga", "price");
        m.put("price", "price");
        m.put("tahun", "year");
        m.put("year", "year");
        m.put("km", "mileage");
        m.put("kilometer", "mileage");
        m.put("odometer", "mileage");
        m.put("mileage", "mileage");
        m.put("warna", "color");
        m.put("color", "color");
        m.put("transmisi", "transmission");
        m.put("transmission", "transmission");
        m.put("bensin", "fuelType");
        m.put("bbm", "fuelType");
        m.put("fuel", "fuelType");
        m.put("nama", "name");
        m.put("name", "name");
        m.put("model", "name");
        m.put("deskripsi", "description");
        m.put("keterangan", "description");
        m.put("description", "description");
        return Map.copyOf(m);
    }
}
