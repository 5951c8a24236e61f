package com.objecty.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.function.Predicate;

/** Small stateless helpers over lists. All of them tolerate null input. */
public final class Sequences {

    private Sequences() {}

    /** Uniformly chosen element, or null for an empty list. */
    public static <T> T randElement(List<T> list) {
        if (list == null || list.isEmpty()) return null;
        return list.get(ThreadLocalRandom.current().nextInt(list.size()));
    }

    /** Uniformly chosen element among those matching {@code pred}, or null if none does. */
    public static <T> T randWhere(List<T> list, Predicate<? super T> pred) {
        if (list == null || pred == null) return null;
        List<T> matches = new ArrayList<>();
        for (T e : list) {
            if (pred.test(e)) matches.add(e);
        }
        return randElement(matches);
    }

    /**
     * Groups elements by key, keys in order of first appearance and elements in
     * list order within each group.
     */
    public static <T, K> Map<K, List<T>> partition(List<T> list, Function<? super T, ? extends K> keyFn) {
        Map<K, List<T>> out = new LinkedHashMap<>();
        if (list == null || keyFn == null) return out;
        for (T e : list) {
            out.computeIfAbsent(keyFn.apply(e), k -> new ArrayList<>()).add(e);
        }
        return out;
    }

    /** True if {@code list} contains at least one of {@code candidates}. */
    public static boolean includesAny(Collection<?> list, Collection<?> candidates) {
        if (list == null || candidates == null) return false;
        for (Object c : candidates) {
            if (list.contains(c)) return true;
        }
        return false;
    }
}
