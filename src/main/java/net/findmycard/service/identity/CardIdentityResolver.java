package net.findmycard.service.identity;

import java.util.Optional;
import net.findmycard.exception.CardNotFoundException;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.model.CardPrinting;
import net.findmycard.service.catalog.CardCatalogStore;
import net.findmycard.service.catalog.CatalogSnapshot;
import net.findmycard.util.ValidationUtils;
import org.springframework.stereotype.Service;

/**
 * Maps card references to canonical identity keys against the current catalog snapshot.
 *
 * <p>A reference may be a printing id, an oracle id or the wire form of a derived key.
 * Resolution is a pure lookup, so repeated calls against one snapshot always agree.</p>
 */
@Service
public class CardIdentityResolver {

    private final CardCatalogStore catalogStore;

    public CardIdentityResolver(CardCatalogStore catalogStore) {
        this.catalogStore = catalogStore;
    }

    public CardIdentityKey resolve(String reference) {
        return resolve(reference, catalogStore.snapshot());
    }

    /**
     * Resolves against an explicit snapshot so a request can pin one catalog version.
     *
     * @throws CardNotFoundException when nothing in the snapshot matches
     */
    public CardIdentityKey resolve(String reference, CatalogSnapshot snapshot) {
        return tryResolve(reference, snapshot)
            .orElseThrow(() -> new CardNotFoundException(reference));
    }

    public Optional<CardIdentityKey> tryResolve(String reference, CatalogSnapshot snapshot) {
        String trimmed = ValidationUtils.trimToNull(reference);
        if (trimmed == null) {
            return Optional.empty();
        }
        Optional<CardIdentityKey> byPrinting = snapshot.keyForPrinting(trimmed);
        if (byPrinting.isPresent()) {
            return byPrinting;
        }
        Optional<CardIdentityKey> byOracle = snapshot.keyForOracleId(trimmed);
        if (byOracle.isPresent()) {
            return byOracle;
        }
        CardIdentityKey parsed;
        try {
            parsed = CardIdentityKey.parse(trimmed);
        } catch (IllegalArgumentException ex) {
            // a bare "derived:" prefix names nothing
            return Optional.empty();
        }
        return snapshot.getByKey(parsed).isPresent() ? Optional.of(parsed) : Optional.empty();
    }

    /**
     * Key a stored printing belongs to. Printings not yet in the snapshot get the key they
     * would receive on their own: their oracle id, or their derived fingerprint key.
     */
    public CardIdentityKey resolve(CardPrinting printing, CatalogSnapshot snapshot) {
        return snapshot.keyForPrinting(printing.printingId())
            .or(() -> printing.hasOracleId() ? snapshot.keyForOracleId(printing.oracleId()) : Optional.empty())
            .orElseGet(() -> printing.hasOracleId()
                ? CardIdentityKey.oracle(printing.oracleId())
                : IdentityFingerprint.of(printing).toDerivedKey());
    }
}
