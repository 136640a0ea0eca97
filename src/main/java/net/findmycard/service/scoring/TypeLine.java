package net.findmycard.service.scoring;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed type line: {@code "Legendary Creature — Human Wizard"} yields supertype
 * {@code legendary}, card type {@code creature} and subtypes {@code human}, {@code wizard}.
 * Multi-face type lines joined with {@code //} contribute every face's types.
 */
record TypeLine(Set<String> supertypes, Set<String> cardTypes, Set<String> subtypes) {

    private static final Set<String> KNOWN_SUPERTYPES = Set.of("basic", "legendary", "snow", "world", "ongoing");
    private static final Set<String> KNOWN_CARD_TYPES = Set.of(
        "artifact", "battle", "creature", "enchantment", "instant", "land",
        "planeswalker", "sorcery", "kindred", "tribal");

    TypeLine {
        supertypes = Set.copyOf(supertypes);
        cardTypes = Set.copyOf(cardTypes);
        subtypes = Set.copyOf(subtypes);
    }

    static TypeLine parse(String typeLine) {
        Set<String> supertypes = new LinkedHashSet<>();
        Set<String> cardTypes = new LinkedHashSet<>();
        Set<String> subtypes = new LinkedHashSet<>();
        if (typeLine == null || typeLine.isBlank()) {
            return new TypeLine(supertypes, cardTypes, subtypes);
        }
        for (String face : typeLine.toLowerCase(Locale.ROOT).split("//")) {
            String[] halves = face.split("[—\\u2013]|\\s-\\s", 2);
            for (String token : halves[0].trim().split("\\s+")) {
                if (KNOWN_SUPERTYPES.contains(token)) {
                    supertypes.add(token);
                } else if (KNOWN_CARD_TYPES.contains(token)) {
                    cardTypes.add(token);
                }
            }
            if (halves.length > 1) {
                for (String token : halves[1].trim().split("\\s+")) {
                    if (!token.isBlank()) {
                        subtypes.add(token);
                    }
                }
            }
        }
        return new TypeLine(supertypes, cardTypes, subtypes);
    }

    /** Every type word on the line, used for token overlap. */
    Set<String> allTokens() {
        Set<String> tokens = new LinkedHashSet<>(supertypes);
        tokens.addAll(cardTypes);
        tokens.addAll(subtypes);
        return tokens;
    }
}
