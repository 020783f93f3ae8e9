package com.pokerpulse.enrichment.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NameNormalizerTest {

    @Test
    void normalizeForMatchFoldsCasePunctuationAndAccents() {
        assertThat(NameNormalizer.normalizeForMatch("  The Star  Casino & Hotel! ")).isEqualTo("the star casino and hotel");
        assertThat(NameNormalizer.normalizeForMatch("Café Royale")).isEqualTo("cafe royale");
        assertThat(NameNormalizer.normalizeForMatch("O’Malley's Bar")).isEqualTo("omalleys bar");
    }

    @Test
    void expandsCommonVenueAbbreviations() {
        assertThat(NameNormalizer.normalizeForMatch("Crown Htl, George St")).isEqualTo("crown hotel george street");
        assertThat(NameNormalizer.normalizeForMatch("Sports Center")).isEqualTo("sports centre");
    }

    @Test
    void nullAndBlankInputs() {
        assertThat(NameNormalizer.normalizeForMatch(null)).isEmpty();
        assertThat(NameNormalizer.normalize(null)).isNull();
        assertThat(NameNormalizer.tokens("   ")).isEmpty();
    }

    @Test
    void slugJoinsTokensWithHyphens() {
        assertThat(NameNormalizer.slug("Friday Night NLHE")).isEqualTo("friday-night-nlhe");
        assertThat(NameNormalizer.tokens("a b a c")).containsExactly("a", "b", "c");
    }
}
