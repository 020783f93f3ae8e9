package com.pokerpulse.enrichment.util;

import java.util.HashSet;
import java.util.Set;

public final class TextSimilarity {

    private TextSimilarity() {}

    public static int levenshtein(String a, String b) {
        if (a == null) a = "";
        if (b == null) b = "";
        int n = a.length(); int m = b.length();
        if (n == 0) return m;
        if (m == 0) return n;
        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int j = 0; j <= m; j++) prev[j] = j;
        for (int i = 1; i <= n; i++) {
            curr[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                int cost = (ca == b.charAt(j - 1)) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev; prev = curr; curr = tmp;
        }
        return prev[m];
    }

    /** 1 - distance / longer length, in [0, 1]. Two empty strings score 0. */
    public static double editRatio(String a, String b) {
        if (a == null || b == null || (a.isEmpty() && b.isEmpty())) return 0.0;
        int max = Math.max(a.length(), b.length());
        return 1.0 - (double) levenshtein(a, b) / max;
    }

    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        Set<String> inter = new HashSet<>(a);
        inter.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) inter.size() / union.size();
    }

    public static double tokenJaccard(String normalizedA, String normalizedB) {
        return jaccard(NameNormalizer.tokens(normalizedA), NameNormalizer.tokens(normalizedB));
    }
}
