package net.findmycard.service.event;

import java.util.Set;
import net.findmycard.model.CardIdentityKey;

/**
 * Published once a rebuilt catalog snapshot has been swapped in.
 * Carries every identity key touched by the mutation, as seen before and after the rebuild.
 */
public class CatalogRefreshedEvent {

    private final Set<CardIdentityKey> touchedKeys;
    private final boolean fullReplace;
    private final long snapshotVersion;

    public CatalogRefreshedEvent(Set<CardIdentityKey> touchedKeys, boolean fullReplace, long snapshotVersion) {
        this.touchedKeys = touchedKeys != null ? Set.copyOf(touchedKeys) : Set.of();
        this.fullReplace = fullReplace;
        this.snapshotVersion = snapshotVersion;
    }

    public Set<CardIdentityKey> getTouchedKeys() {
        return touchedKeys;
    }

    public boolean isFullReplace() {
        return fullReplace;
    }

    public long getSnapshotVersion() {
        return snapshotVersion;
    }
}
