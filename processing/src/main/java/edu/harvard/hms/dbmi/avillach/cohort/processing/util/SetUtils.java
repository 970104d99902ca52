package edu.harvard.hms.dbmi.avillach.cohort.processing.util;

import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

public class SetUtils {

    public static <E> Set<E> union(final Set<? extends E> set1, final Set<? extends E> set2) {
        Set<E> union = new HashSet<>(set1);
        union.addAll(set2);
        return union;
    }

    public static <E> Set<E> intersection(final Set<? extends E> set1, final Set<? extends E> set2) {
        if (set1.isEmpty() || set2.isEmpty()) {
            return new HashSet<>();
        }
        return set1.parallelStream().filter(set2::contains).collect(Collectors.toSet());
    }

    public static <E> Set<E> difference(final Set<? extends E> set1, final Set<? extends E> set2) {
        Set<E> difference = new HashSet<>(set1);
        difference.removeAll(set2);
        return difference;
    }

    /**
     * Keeps the {@code limit} lowest identifiers, or all of them when {@code limit} is null.
     */
    public static Set<String> limit(final Set<String> identifiers, final Integer limit) {
        TreeSet<String> sorted = new TreeSet<>(identifiers);
        if (limit == null || sorted.size() <= limit) {
            return sorted;
        }
        return sorted.stream().limit(limit).collect(Collectors.toCollection(TreeSet::new));
    }
}
