package com.nationrank.engine.aggregate;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which country codes count towards nation rankings.
 *
 * <p>A code resolves when it is two ASCII letters (restricted to the known list when one
 * is configured) or appears in the faction allow-list. Placeholders such as {@code "??"}
 * never resolve. Unresolvable codes are filtered, not errors.
 */
public class NationCodePolicy {

    private static final String UNKNOWN_PLACEHOLDER = "??";

    private final Set<String> knownCodes;
    private final Set<String> factionCodes;

    public NationCodePolicy(Set<String> knownCodes, Set<String> factionCodes) {
        this.knownCodes = knownCodes != null ? knownCodes : Set.of();
        this.factionCodes = factionCodes != null ? factionCodes : Set.of();
    }

    public static NationCodePolicy permissive() {
        return new NationCodePolicy(Set.of(), Set.of());
    }

    /**
     * Normalized (trimmed, upper-case) code, or empty when the code does not resolve.
     */
    public Optional<String> resolve(String rawCode) {
        if (rawCode == null) {
            return Optional.empty();
        }
        String code = rawCode.trim().toUpperCase(Locale.ROOT);
        if (code.isEmpty() || UNKNOWN_PLACEHOLDER.equals(code)) {
            return Optional.empty();
        }
        if (factionCodes.contains(code)) {
            return Optional.of(code);
        }
        if (code.length() != 2 || !isAsciiLetter(code.charAt(0)) || !isAsciiLetter(code.charAt(1))) {
            return Optional.empty();
        }
        if (!knownCodes.isEmpty() && !knownCodes.contains(code)) {
            return Optional.empty();
        }
        return Optional.of(code);
    }

    public boolean isResolvable(String rawCode) {
        return resolve(rawCode).isPresent();
    }

    private static boolean isAsciiLetter(char c) {
        return c >= 'A' && c <= 'Z';
    }
}
