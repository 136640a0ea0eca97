package net.findmycard.service.scoring;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import net.findmycard.model.CardIdentity;
import net.findmycard.model.ManaColor;
import net.findmycard.util.CardTextNormalizer;

/**
 * Scoring view of a card identity, derived once per identity and pair-independent.
 */
record CardTraits(TypeLine typeLine,
                  Set<String> keywords,
                  Set<ManaColor> colorIdentity,
                  double manaValue,
                  String text,
                  Set<FunctionalRole> roles) {

    static CardTraits of(CardIdentity identity) {
        String text = CardTextNormalizer.matchableText(identity.oracleText(), identity.name());
        Set<String> keywords = identity.keywords().stream()
            .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
            .filter(keyword -> !keyword.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
        return new CardTraits(
            TypeLine.parse(identity.typeLine()),
            keywords,
            identity.colorIdentity(),
            identity.convertedManaCost(),
            text,
            FunctionalRole.detect(text));
    }

    boolean textContains(String fragment) {
        return text.contains(fragment);
    }

    boolean hasCardType(String cardType) {
        return typeLine.cardTypes().contains(cardType);
    }

    boolean hasSubtype(String subtype) {
        return typeLine.subtypes().contains(subtype);
    }
}
