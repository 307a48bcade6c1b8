package com.example.orchestrator.identity;

import com.example.orchestrator.config.OrchestratorProperties;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Canonicalizes gateway phone identifiers ({@code 6281234567890:12@s.whatsapp.net},
 * {@code +62 812-3456-7890}, {@code 0812...}) into bare digits and derives the formats used
 * when matching against stored numbers.
 */
@Component
public class PhoneNormalizer {

    private static final Pattern NON_DIGITS = Pattern.compile("\\D");
    private static final String ALIAS_SUFFIX = "@lid";

    private final String countryCode;

    public PhoneNormalizer(OrchestratorProperties properties) {
        this.countryCode = normalize(properties.getPhone().getCountryCode());
    }

    /**
     * Cuts the routing suffix at the first {@code @}, then the device suffix at the first {@code :},
     * then drops every non-digit. Never throws; returns an empty string for null or digit-free input.
     */
    public String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw;
        int at = value.indexOf('@');
        if (at >= 0) {
            value = value.substring(0, at);
        }
        int colon = value.indexOf(':');
        if (colon >= 0) {
            value = value.substring(0, colon);
        }
        return NON_DIGITS.matcher(value).replaceAll("");
    }

    public PhoneVariants variants(String canonicalDigits) {
        String digits = normalize(canonicalDigits);
        if (digits.isEmpty()) {
            return PhoneVariants.empty();
        }
        String zeroPrefixed = digits;
        if (!countryCode.isEmpty() && digits.startsWith(countryCode)) {
            zeroPrefixed = "0" + digits.substring(countryCode.length());
        }
        String countryCodePrefixed = digits;
        if (!countryCode.isEmpty() && digits.startsWith("0")) {
            countryCodePrefixed = countryCode + digits.substring(1);
        }
        return new PhoneVariants(digits, zeroPrefixed, countryCodePrefixed);
    }

    /** Whether two raw identifiers denote the same number in any of the known formats. */
    public boolean sameNumber(String left, String right) {
        String normalizedRight = normalize(right);
        return !normalizedRight.isEmpty() && variants(left).matches(normalizedRight);
    }

    /** Anonymized contact identifiers issued by the gateway instead of a phone number. */
    public boolean isAlias(String raw) {
        return raw != null && raw.toLowerCase(Locale.ROOT).contains(ALIAS_SUFFIX);
    }
}
