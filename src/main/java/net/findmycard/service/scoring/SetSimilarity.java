package net.findmycard.service.scoring;

import java.util.HashSet;
import java.util.Set;

/**
 * Set overlap measures used by the scorers.
 */
final class SetSimilarity {

    private SetSimilarity() {
    }

    /**
     * Jaccard index; two empty sets are identical and score 1.
     */
    static <T> double jaccard(Set<T> left, Set<T> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        Set<T> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        int union = left.size() + right.size() - intersection.size();
        return (double) intersection.size() / union;
    }

    /**
     * Share of {@code subject} contained in {@code container}; an empty subject is fully contained.
     */
    static <T> double containment(Set<T> subject, Set<T> container) {
        if (subject.isEmpty()) {
            return 1.0;
        }
        long inside = subject.stream().filter(container::contains).count();
        return (double) inside / subject.size();
    }
}
