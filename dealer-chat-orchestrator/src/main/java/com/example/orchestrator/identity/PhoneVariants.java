package com.example.orchestrator.identity;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The representations of one canonical number that may appear in stored records.
 *
 * @param asIs the canonical digits unchanged
 * @param zeroPrefixed local form, leading country code replaced with {@code 0}
 * @param countryCodePrefixed international form, leading {@code 0} replaced with the country code
 */
public record PhoneVariants(String asIs, String zeroPrefixed, String countryCodePrefixed) {

    public static PhoneVariants empty() {
        return new PhoneVariants("", "", "");
    }

    /** Distinct non-empty variants, canonical form first. */
    public Set<String> all() {
        Set<String> values = new LinkedHashSet<>();
        addIfPresent(values, asIs);
        addIfPresent(values, zeroPrefixed);
        addIfPresent(values, countryCodePrefixed);
        return Collections.unmodifiableSet(values);
    }

    public boolean matches(String canonicalDigits) {
        return canonicalDigits != null && !canonicalDigits.isEmpty() && all().contains(canonicalDigits);
    }

    private static void addIfPresent(Set<String> values, String value) {
        if (value != null && !value.isEmpty()) {
            values.add(value);
        }
    }
}
