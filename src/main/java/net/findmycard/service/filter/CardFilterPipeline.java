package net.findmycard.service.filter;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import net.findmycard.model.CardIdentity;
import net.findmycard.model.Legality;
import net.findmycard.model.ManaColor;
import net.findmycard.service.scoring.Recommendation;
import org.springframework.stereotype.Component;

/**
 * Applies {@link CardFilters} to identities and ranked recommendations.
 *
 * <p>Filtering is a stable pass: survivors keep their relative order and scores.</p>
 */
@Component
public class CardFilterPipeline {

    public List<Recommendation> apply(List<Recommendation> ranked, CardFilters filters) {
        if (filters == null || filters.isEmpty()) {
            return ranked;
        }
        return ranked.stream()
            .filter(recommendation -> matches(recommendation.candidate(), filters))
            .toList();
    }

    public List<CardIdentity> applyToIdentities(List<CardIdentity> identities, CardFilters filters) {
        if (filters == null || filters.isEmpty()) {
            return identities;
        }
        return identities.stream()
            .filter(identity -> matches(identity, filters))
            .toList();
    }

    public boolean matches(CardIdentity card, CardFilters filters) {
        return matchesColors(card, filters)
            && matchesColorIdentity(card, filters.colorIdentity())
            && matchesTypes(card, filters.types())
            && matchesRarities(card, filters)
            && matchesFormat(card, filters.format())
            && matchesManaValue(card, filters)
            && matchesPrice(card, filters)
            && matchesOracleText(card, filters.oracleText())
            && matchesSets(card, filters.sets())
            && matchesStat(card.power(), filters.power())
            && matchesStat(card.toughness(), filters.toughness())
            && matchesKeywords(card, filters.keywords());
    }

    private static boolean matchesColors(CardIdentity card, CardFilters filters) {
        Set<ManaColor> colors = filters.colors();
        if (colors.isEmpty()) {
            return true;
        }
        boolean colorless = card.colors().isEmpty() && identityWithoutColorless(card).isEmpty();
        if (filters.exactColorsOnly()) {
            return colorless
                ? colors.contains(ManaColor.C)
                : !colors.contains(ManaColor.C) && colors.equals(card.colors());
        }
        for (ManaColor color : colors) {
            boolean matched = color == ManaColor.C
                ? colorless
                : (card.colors().contains(color) || card.colorIdentity().contains(color));
            if (matched) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesColorIdentity(CardIdentity card, Set<ManaColor> allowed) {
        if (allowed.isEmpty()) {
            return true;
        }
        return allowed.containsAll(identityWithoutColorless(card));
    }

    private static Set<ManaColor> identityWithoutColorless(CardIdentity card) {
        if (!card.colorIdentity().contains(ManaColor.C)) {
            return card.colorIdentity();
        }
        return card.colorIdentity().stream()
            .filter(color -> color != ManaColor.C)
            .collect(Collectors.toUnmodifiableSet());
    }

    private static boolean matchesTypes(CardIdentity card, List<String> types) {
        if (types.isEmpty()) {
            return true;
        }
        String typeLine = card.typeLine().toLowerCase(Locale.ROOT);
        return types.stream().anyMatch(typeLine::contains);
    }

    private static boolean matchesRarities(CardIdentity card, CardFilters filters) {
        if (filters.rarities().isEmpty()) {
            return true;
        }
        return card.rarities().stream().anyMatch(filters.rarities()::contains);
    }

    private static boolean matchesFormat(CardIdentity card, String format) {
        if (format == null) {
            return true;
        }
        Legality legality = card.legalities().get(format);
        return legality != null && legality.isPlayable();
    }

    private static boolean matchesManaValue(CardIdentity card, CardFilters filters) {
        double manaValue = card.convertedManaCost();
        if (filters.minMv() != null && manaValue < filters.minMv()) {
            return false;
        }
        return filters.maxMv() == null || manaValue <= filters.maxMv();
    }

    private static boolean matchesPrice(CardIdentity card, CardFilters filters) {
        if (!filters.hasPriceBound()) {
            return true;
        }
        BigDecimal price = card.lowestPriceUsd();
        if (price == null) {
            return false;
        }
        if (filters.minPrice() != null && price.compareTo(filters.minPrice()) < 0) {
            return false;
        }
        return filters.maxPrice() == null || price.compareTo(filters.maxPrice()) <= 0;
    }

    private static boolean matchesOracleText(CardIdentity card, String oracleText) {
        return oracleText == null || card.oracleText().toLowerCase(Locale.ROOT).contains(oracleText);
    }

    private static boolean matchesStat(String printed, String wanted) {
        return wanted == null || (printed != null && printed.trim().toLowerCase(Locale.ROOT).equals(wanted));
    }

    private static boolean matchesKeywords(CardIdentity card, Set<String> keywords) {
        if (keywords.isEmpty()) {
            return true;
        }
        return card.keywords().stream()
            .map(keyword -> keyword.toLowerCase(Locale.ROOT))
            .anyMatch(keywords::contains);
    }

    private static boolean matchesSets(CardIdentity card, Set<String> sets) {
        if (sets.isEmpty()) {
            return true;
        }
        return card.setCodes().stream().anyMatch(sets::contains);
    }
}
