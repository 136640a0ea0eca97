package net.findmycard.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CardTextNormalizerTest {

    @Test
    void should_FoldCaseAccentsAndWhitespace_When_NormalizingNames() {
        assertThat(CardTextNormalizer.normalizeName("Lim-Dûl's  Vault"))
            .isEqualTo(CardTextNormalizer.normalizeName("lim-dul's vault"));
        assertThat(CardTextNormalizer.normalizeName(null)).isEmpty();
    }

    @Test
    void should_KeepOnlyLettersDigitsAndSingleDashes_When_Slugging() {
        assertThat(CardTextNormalizer.slug("Fire // Ice")).isEqualTo("fire-ice");
        assertThat(CardTextNormalizer.slug("Lim-Dûl's  Vault")).isEqualTo("lim-dul-s-vault");
        assertThat(CardTextNormalizer.slug("Borrowing 100,000 Arrows")).isEqualTo("borrowing-100-000-arrows");
        assertThat(CardTextNormalizer.slug("???")).isEmpty();
    }

    @Test
    void should_CollapseWhitespace_When_NormalizingText() {
        assertThat(CardTextNormalizer.normalizeText("Draw  a card.\nScry 1."))
            .isEqualTo("draw a card. scry 1.");
    }

    @Test
    void should_StripReminderTextAndOwnName_When_PreparingMatchableText() {
        String text = CardTextNormalizer.matchableText(
            "Flying (This creature can't be blocked except by creatures with flying.)\nWhen Baneslayer Angel dies, draw a card.",
            "Baneslayer Angel");

        assertThat(text).doesNotContain("can't be blocked");
        assertThat(text).contains("when ~ dies, draw a card.");
    }
}
