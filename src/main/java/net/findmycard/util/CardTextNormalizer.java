package net.findmycard.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization used to compare card names and rules text across printings.
 *
 * <p>Names ignore case, accents and whitespace runs, so "Lim-Dûl's  Vault" and
 * "lim-dul's vault" fingerprint identically.</p>
 */
public final class CardTextNormalizer {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern REMINDER_TEXT = Pattern.compile("\\([^)]*\\)");
    private static final Pattern NON_SLUG = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

    private CardTextNormalizer() {
    }

    public static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        String folded = DIACRITICS.matcher(Normalizer.normalize(name, Normalizer.Form.NFD)).replaceAll("");
        return WHITESPACE.matcher(folded.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Normalized name reduced to letters and digits joined by single dashes, safe as a URL
     * path segment: "Fire // Ice" becomes {@code fire-ice}. Empty when nothing remains.
     */
    public static String slug(String name) {
        String dashed = NON_SLUG.matcher(normalizeName(name)).replaceAll("-");
        return EDGE_DASHES.matcher(dashed).replaceAll("");
    }

    public static String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        String lowered = text.toLowerCase(Locale.ROOT).replace('—', '-').replace('−', '-');
        return WHITESPACE.matcher(lowered).replaceAll(" ").trim();
    }

    /**
     * Rules text prepared for pattern matching: lower-cased, whitespace collapsed,
     * reminder text removed and the card's own name replaced by {@code ~}.
     */
    public static String matchableText(String oracleText, String cardName) {
        String text = normalizeText(REMINDER_TEXT.matcher(oracleText == null ? "" : oracleText).replaceAll(" "));
        String ownName = normalizeText(cardName);
        if (!ownName.isEmpty()) {
            text = text.replace(ownName, "~");
        }
        return text;
    }
}
