package com.evfinder.domain.service;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Utilities for normalizing team and outcome names before fuzzy comparison.
 */
public final class NormalizationUtils {

    /** Club tokens that carry no identity ("Arsenal FC" and "Arsenal" are the same team). */
    private static final Set<String> CLUB_TOKENS = Set.of(
        "fc", "ac", "sc", "as", "ss", "us", "rc", "afc", "cf", "cd", "utd"
    );

    private NormalizationUtils() {
    }

    /**
     * Removes diacritics (Gérone -> Gerone).
     */
    public static String stripAccents(String text) {
        if (text == null) {
            return "";
        }
        return Normalizer.normalize(text, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    }

    /**
     * Normalizes a name for comparison.
     *
     * Rules:
     * 1. Remove accents
     * 2. Convert to lowercase
     * 3. Replace anything that is not a letter or digit with a space
     * 4. Drop club tokens (FC, AC, Utd, ...) unless nothing else is left
     * 5. Collapse whitespace
     */
    public static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String normalized = stripAccents(name).toLowerCase(Locale.ROOT);
        normalized = normalized.replaceAll("[^a-z0-9]+", " ").trim();
        if (normalized.isEmpty()) {
            return "";
        }

        String withoutClubTokens = Arrays.stream(normalized.split(" "))
            .filter(token -> !CLUB_TOKENS.contains(token))
            .collect(Collectors.joining(" "));

        return withoutClubTokens.isEmpty() ? normalized : withoutClubTokens;
    }

    /**
     * Lowercase, accent-free form used for keyword lookups. Punctuation is kept
     * so labels like "+2.5" or "Over 2,5" still carry their markers.
     */
    public static String normalizeLabel(String label) {
        if (label == null) {
            return "";
        }
        return stripAccents(label).toLowerCase(Locale.ROOT).trim();
    }
}
