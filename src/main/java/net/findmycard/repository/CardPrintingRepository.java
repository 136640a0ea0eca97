package net.findmycard.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import net.findmycard.model.CardPrinting;

/**
 * Persistence boundary for card printings.
 *
 * <p>The catalog is rebuilt from {@link #findAll()}; printings are written only by
 * ingestion (upsert, full replace, market data refresh) and never deleted piecemeal.</p>
 */
public interface CardPrintingRepository {

    /**
     * Enumerates every stored printing ordered by printing id.
     *
     * @throws org.springframework.dao.DataAccessException when the store cannot be read
     */
    List<CardPrinting> findAll();

    Optional<CardPrinting> findById(String printingId);

    /**
     * Inserts new printings and overwrites existing ones with the same printing id.
     *
     * @return number of rows written
     */
    int upsertAll(Collection<CardPrinting> printings);

    /**
     * Drops every stored printing and stores {@code printings} in their place.
     */
    int replaceAll(Collection<CardPrinting> printings);

    long count();
}
