package com.objecty.util;

import java.util.ArrayList;
import java.util.List;

import com.objecty.value.Aggregate;
import com.objecty.value.Value;

/**
 * Recursive difference between a candidate graph and the original it was taken from.
 *
 * Only slots of the candidate are visited, so slots removed from the original
 * are not reported. Reported values are the candidate's own, not copies.
 */
public final class Differ {

    private final DepthGuard guard;

    public Differ(int maxDepth) {
        this.guard = new DepthGuard("changes", maxDepth);
    }

    /**
     * Slots of {@code candidate} that differ from {@code original}.
     * <ul>
     *   <li>same value, or both sides falsy (absent, null, false, 0, NaN, ""): unchanged</li>
     *   <li>containers on both sides: compared recursively, reported only if something inside differs</li>
     *   <li>otherwise: the candidate value is reported as is</li>
     * </ul>
     * Arrays are compared index by index, and their differences come back as an
     * object keyed by index ("0", "1", ...).
     *
     * @return the changed slots, or null when nothing changed
     */
    public Aggregate changes(Aggregate candidate, Aggregate original) {
        if (candidate == null) return null;
        return diff(Value.object(candidate), original == null ? null : Value.object(original), 1);
    }

    private Aggregate diff(Value candidate, Value original, int depth) {
        guard.check(depth);

        Aggregate out = null;
        for (String key : keysOf(candidate)) {
            Value nv = slot(candidate, key);
            Value ov = (original == null) ? null : slot(original, key);

            if (Value.same(nv, ov)) continue;
            if (Value.isFalsy(nv) && Value.isFalsy(ov)) continue;

            if (nv != null && nv.isContainer() && ov != null && ov.isContainer()) {
                Aggregate sub = diff(nv, ov, depth + 1);
                if (sub == null) continue;
                if (out == null) out = new Aggregate();
                out.put(key, Value.object(sub));
                continue;
            }

            if (out == null) out = new Aggregate();
            out.put(key, nv);
        }
        return out;
    }

    private static List<String> keysOf(Value container) {
        if (container.isObject()) return container.asObject().keys();

        int n = container.asArray().size();
        List<String> keys = new ArrayList<>(n);
        for (int i = 0; i < n; i++) keys.add(Integer.toString(i));
        return keys;
    }

    private static Value slot(Value container, String key) {
        if (container.isObject()) return container.asObject().get(key);

        List<Value> list = container.asArray();
        int idx = arrayIndex(key);
        if (idx < 0 || idx >= list.size()) return null;
        Value v = list.get(idx);
        // a hole inside an array reads as null, not absent
        return v == null ? Value.nil() : v;
    }

    /** Canonical non-negative index ("0", "12"), or -1. */
    private static int arrayIndex(String key) {
        int n = key.length();
        if (n == 0 || n > 9) return -1;
        if (n > 1 && key.charAt(0) == '0') return -1;
        int idx = 0;
        for (int i = 0; i < n; i++) {
            char c = key.charAt(i);
            if (c < '0' || c > '9') return -1;
            idx = idx * 10 + (c - '0');
        }
        return idx;
    }
}
