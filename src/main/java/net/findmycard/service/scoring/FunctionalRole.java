package net.findmycard.service.scoring;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * What a card does in a game, detected from its rules text.
 */
enum FunctionalRole {
    COUNTERSPELL("counterspell", "counter target (?:\\w+ )*spell"),
    CREATURE_REMOVAL("creature removal", "destroy target (?:\\w+ )*creature"),
    CARD_DRAW("card draw", "draws? (?:\\w+ )?cards?\\b"),
    DIRECT_DAMAGE("direct damage", "deals? (?:\\d+|x|that much) damage"),
    LIFEGAIN("lifegain", "gains? (?:\\d+|x|that much) life"),
    TUTORING("tutoring", "search(?:es)? (?:your|their|its owner's) library"),
    RECURSION("recursion", "return[^.]*from (?:your|a|their) graveyard"),
    EXILE_REMOVAL("exile removal", "exile target");

    private final String label;
    private final Pattern pattern;

    FunctionalRole(String label, String regex) {
        this.label = label;
        this.pattern = Pattern.compile(regex);
    }

    String label() {
        return label;
    }

    /**
     * Roles found in text already prepared by
     * {@link net.findmycard.util.CardTextNormalizer#matchableText(String, String)}.
     */
    static Set<FunctionalRole> detect(String matchableText) {
        Set<FunctionalRole> roles = EnumSet.noneOf(FunctionalRole.class);
        if (matchableText == null || matchableText.isEmpty()) {
            return roles;
        }
        for (FunctionalRole role : values()) {
            if (role.pattern.matcher(matchableText).find()) {
                roles.add(role);
            }
        }
        return roles;
    }
}
