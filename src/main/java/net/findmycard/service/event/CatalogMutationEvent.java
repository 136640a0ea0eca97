package net.findmycard.service.event;

import java.util.Set;

/**
 * Published after printings have been written to the repository.
 * <p>
 * The catalog store listens for it to rebuild its snapshot; nothing else should
 * react to it directly because cached data must only be purged once the new
 * snapshot is visible (see {@link CatalogRefreshedEvent}).
 */
public class CatalogMutationEvent {

    public enum Kind {
        UPSERT,
        REIMPORT,
        MARKET_DATA
    }

    private final Kind kind;
    private final Set<String> printingIds;
    private final String context;

    public CatalogMutationEvent(Kind kind, Set<String> printingIds, String context) {
        this.kind = kind;
        this.printingIds = printingIds != null ? Set.copyOf(printingIds) : Set.of();
        this.context = context;
    }

    public Kind getKind() {
        return kind;
    }

    public Set<String> getPrintingIds() {
        return printingIds;
    }

    public String getContext() {
        return context;
    }

    public boolean isFullReplace() {
        return kind == Kind.REIMPORT;
    }
}
