package net.findmycard.service.identity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import net.findmycard.model.CardIdentityKey;
import net.findmycard.model.CardPrinting;

/**
 * Groups printings into identities.
 *
 * <p>Every printing links its fingerprint to the oracle id it carries, if any. Linked
 * components become one identity keyed on the component's smallest oracle id, or on
 * the derived key of its smallest fingerprint when no member has an oracle id. Keys
 * depend only on the set of printings, never on the order they were ingested in, so
 * a printing that arrives without an oracle id lands on the same key as its oracle
 * siblings whether it was loaded before or after them.</p>
 */
public final class IdentityIndex {

    private static final String ORACLE_NODE = "o|";
    private static final String FINGERPRINT_NODE = "f|";

    private IdentityIndex() {
    }

    /**
     * Result of grouping a full set of printings.
     *
     * @param groups printings per identity key, each list ordered by printing id, keys ordered
     * @param keyByPrintingId identity key of every printing
     * @param keyByOracleId identity key reached from every oracle id seen
     * @param ambiguities groups that merged more than one distinct oracle id
     */
    public record Assignment(Map<CardIdentityKey, List<CardPrinting>> groups,
                             Map<String, CardIdentityKey> keyByPrintingId,
                             Map<String, CardIdentityKey> keyByOracleId,
                             List<Ambiguity> ambiguities) {
    }

    /**
     * A linked group whose printings carry several oracle ids.
     */
    public record Ambiguity(CardIdentityKey chosenKey, SortedSet<String> oracleIds) {
    }

    public static Assignment assign(List<CardPrinting> printings) {
        UnionFind links = new UnionFind();
        Map<String, IdentityFingerprint> fingerprints = new HashMap<>();
        for (CardPrinting printing : printings) {
            IdentityFingerprint fingerprint = IdentityFingerprint.of(printing);
            fingerprints.put(printing.printingId(), fingerprint);
            String fingerprintNode = fingerprintNode(fingerprint);
            links.add(fingerprintNode);
            if (printing.hasOracleId()) {
                links.union(fingerprintNode, ORACLE_NODE + printing.oracleId());
            }
        }

        Map<String, SortedSet<String>> oracleIdsByRoot = new HashMap<>();
        Map<String, IdentityFingerprint> smallestFingerprintByRoot = new HashMap<>();
        for (CardPrinting printing : printings) {
            IdentityFingerprint fingerprint = fingerprints.get(printing.printingId());
            String root = links.find(fingerprintNode(fingerprint));
            if (printing.hasOracleId()) {
                oracleIdsByRoot.computeIfAbsent(root, r -> new TreeSet<>()).add(printing.oracleId());
            }
            smallestFingerprintByRoot.merge(root, fingerprint,
                (left, right) -> left.compareTo(right) <= 0 ? left : right);
        }

        Map<CardIdentityKey, List<CardPrinting>> groups = new TreeMap<>();
        Map<String, CardIdentityKey> keyByPrintingId = new HashMap<>();
        Map<String, CardIdentityKey> keyByOracleId = new HashMap<>();
        Map<String, CardIdentityKey> keyByRoot = new HashMap<>();
        List<Ambiguity> ambiguities = new ArrayList<>();

        for (Map.Entry<String, IdentityFingerprint> entry : smallestFingerprintByRoot.entrySet()) {
            String root = entry.getKey();
            SortedSet<String> oracleIds = oracleIdsByRoot.get(root);
            CardIdentityKey key = oracleIds == null
                ? entry.getValue().toDerivedKey()
                : CardIdentityKey.oracle(oracleIds.first());
            keyByRoot.put(root, key);
            if (oracleIds != null) {
                oracleIds.forEach(oracleId -> keyByOracleId.put(oracleId, key));
                if (oracleIds.size() > 1) {
                    ambiguities.add(new Ambiguity(key, oracleIds));
                }
            }
        }

        for (CardPrinting printing : printings) {
            String root = links.find(fingerprintNode(fingerprints.get(printing.printingId())));
            CardIdentityKey key = keyByRoot.get(root);
            keyByPrintingId.put(printing.printingId(), key);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(printing);
        }

        Map<CardIdentityKey, List<CardPrinting>> orderedGroups = new LinkedHashMap<>();
        groups.forEach((key, members) -> {
            members.sort(Comparator.comparing(CardPrinting::printingId));
            orderedGroups.put(key, List.copyOf(members));
        });
        ambiguities.sort(Comparator.comparing(Ambiguity::chosenKey));

        return new Assignment(orderedGroups, Map.copyOf(keyByPrintingId), Map.copyOf(keyByOracleId), List.copyOf(ambiguities));
    }

    private static String fingerprintNode(IdentityFingerprint fingerprint) {
        return FINGERPRINT_NODE + fingerprint.normalizedName() + "|" + fingerprint.textHash();
    }

    /**
     * Disjoint-set forest over string nodes with path compression.
     */
    private static final class UnionFind {
        private final Map<String, String> parent = new HashMap<>();

        void add(String node) {
            parent.putIfAbsent(node, node);
        }

        String find(String node) {
            add(node);
            String root = node;
            while (!root.equals(parent.get(root))) {
                root = parent.get(root);
            }
            String cursor = node;
            while (!cursor.equals(root)) {
                String next = parent.get(cursor);
                parent.put(cursor, root);
                cursor = next;
            }
            return root;
        }

        void union(String left, String right) {
            String leftRoot = find(left);
            String rightRoot = find(right);
            if (leftRoot.equals(rightRoot)) {
                return;
            }
            if (leftRoot.compareTo(rightRoot) < 0) {
                parent.put(rightRoot, leftRoot);
            } else {
                parent.put(leftRoot, rightRoot);
            }
        }
    }
}
