package net.findmycard.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import net.findmycard.model.CardPrinting;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Repository;

/**
 * Non-persistent printing store used when no datasource URL is configured.
 */
@Repository
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
public class InMemoryCardPrintingRepository implements CardPrintingRepository {

    private final ConcurrentSkipListMap<String, CardPrinting> printings = new ConcurrentSkipListMap<>();

    @Override
    public List<CardPrinting> findAll() {
        return List.copyOf(printings.values());
    }

    @Override
    public Optional<CardPrinting> findById(String printingId) {
        if (printingId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(printings.get(printingId));
    }

    @Override
    public int upsertAll(Collection<CardPrinting> incoming) {
        if (incoming == null) {
            return 0;
        }
        incoming.forEach(printing -> printings.put(printing.printingId(), printing));
        return incoming.size();
    }

    @Override
    public synchronized int replaceAll(Collection<CardPrinting> incoming) {
        printings.clear();
        return upsertAll(incoming);
    }

    @Override
    public long count() {
        return printings.size();
    }
}
