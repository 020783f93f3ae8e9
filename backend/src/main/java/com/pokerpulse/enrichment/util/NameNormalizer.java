package com.pokerpulse.enrichment.util;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public final class NameNormalizer {

    private static final Map<String, String> VENUE_ABBREVIATIONS = Map.of(
            "st", "street",
            "rd", "road",
            "ave", "avenue",
            "ctr", "centre",
            "cntr", "centre",
            "center", "centre",
            "htl", "hotel",
            "bwl", "bowling"
    );

    private NameNormalizer() {}

    /** Trim, collapse whitespace and lowercase. Null stays null. */
    public static String normalize(String name) {
        if (name == null) return null;
        return name.trim()
                .replaceAll("\\s+", " ")
                .toLowerCase();
    }

    /**
     * Canonical form used for comparisons: accents removed, case folded, '&' spelled out,
     * punctuation dropped and the common street/venue abbreviations expanded.
     */
    public static String normalizeForMatch(String name) {
        if (name == null) return "";
        String s = Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        s = s.toLowerCase()
                .replace('’', '\'')
                .replace('‘', '\'')
                .replace("&", " and ")
                .replace("'", "")
                .replaceAll("[^a-z0-9 ]", " ")
                .replaceAll("\\s+", " ")
                .trim();
        if (s.isEmpty()) return s;
        return Arrays.stream(s.split(" "))
                .map(t -> VENUE_ABBREVIATIONS.getOrDefault(t, t))
                .collect(Collectors.joining(" "));
    }

    public static Set<String> tokens(String normalized) {
        if (normalized == null || normalized.isBlank()) return Set.of();
        return new LinkedHashSet<>(Arrays.asList(normalized.trim().split("\\s+")));
    }

    /** Lowercase, hyphen separated identifier fragment. */
    public static String slug(String name) {
        String s = normalizeForMatch(name);
        return s.replace(' ', '-');
    }
}
