package com.objecty.util;

import java.util.ArrayList;
import java.util.List;

import com.objecty.debug.Debug;
import com.objecty.value.Aggregate;
import com.objecty.value.Value;

/**
 * In-place merges of one aggregate into another.
 *
 * {@link #merge} overwrites, {@link #mergeSafe} only fills gaps. Both skip slot
 * pairs whose shapes do not line up instead of failing, so heterogeneous inputs
 * merge as far as they can.
 */
public final class Merger {

    private static final String TAG = "objecty.merge";

    private final DepthGuard mergeGuard;
    private final DepthGuard safeGuard;
    private final Cloner cloner;

    public Merger(int maxDepth) {
        this.mergeGuard = new DepthGuard("merge", maxDepth);
        this.safeGuard = new DepthGuard("mergeSafe", maxDepth);
        this.cloner = new Cloner(maxDepth);
    }

    /**
     * Merges {@code src} into {@code dest}, slot by slot, in this order:
     * <ol>
     *   <li>scalar (null and functions included) in src: assigned over dest</li>
     *   <li>array in dest, array in src: replaced by {@link #mergeArrays}</li>
     *   <li>array in dest, object in src: the object is appended unless already there</li>
     *   <li>object in both: merged recursively</li>
     *   <li>anything else, an absent dest slot included: left as is</li>
     * </ol>
     * Containers from src that end up in dest are shared, not copied.
     */
    public void merge(Aggregate dest, Aggregate src) {
        if (dest == null || src == null) return;
        merge(dest, src, 1);
    }

    private void merge(Aggregate dest, Aggregate src, int depth) {
        mergeGuard.check(depth);

        for (String p : src.keys()) {
            Value s = src.get(p);
            Value d = dest.get(p);

            if (s.isScalar()) {
                dest.set(p, s);
                continue;
            }

            if (d != null && d.isArray()) {
                if (s.isArray()) {
                    dest.set(p, Value.array(mergeArrays(d.asArray(), s.asArray())));
                } else if (!contains(d.asArray(), s)) {
                    List<Value> appended = new ArrayList<>(d.asArray());
                    appended.add(s);
                    dest.set(p, Value.array(appended));
                }
                continue;
            }

            if (d != null && d.isObject() && s.isObject()) {
                if (Value.same(d, s)) continue;
                merge(d.asObject(), s.asObject(), depth + 1);
                continue;
            }

            if (Debug.get().enabled()) {
                Debug.get().t(TAG, "merge skipped '" + p + "': "
                        + (d == null ? "absent" : d.getType()) + " <- " + s.getType());
            }
        }
    }

    /**
     * Copies into {@code dest} only what it does not have yet:
     * <ul>
     *   <li>absent in dest: containers are deep-cloned in, scalars copied</li>
     *   <li>explicit null in dest: left null</li>
     *   <li>object in both: merged recursively with the same rules</li>
     *   <li>anything else: left as is; arrays are never combined</li>
     * </ul>
     */
    public void mergeSafe(Aggregate dest, Aggregate src) {
        if (dest == null || src == null) return;
        mergeSafe(dest, src, 1);
    }

    private void mergeSafe(Aggregate dest, Aggregate src, int depth) {
        safeGuard.check(depth);

        for (String p : src.keys()) {
            Value s = src.get(p);
            Value d = dest.get(p);

            if (d == null) {
                dest.set(p, s.isContainer() ? cloner.cloneValue(s) : s);
            } else if (d.isNull()) {
                // explicit null: nothing wanted here
                continue;
            } else if (d.isObject() && s.isObject()) {
                if (Value.same(d, s)) continue;
                mergeSafe(d.asObject(), s.asObject(), depth + 1);
            }
        }
    }

    /**
     * New list holding every element of {@code a1}, then each element of
     * {@code a2} not found in {@code a1}. Duplicates within either list survive.
     * Membership uses {@link Value#same}.
     */
    public static List<Value> mergeArrays(List<Value> a1, List<Value> a2) {
        List<Value> out = new ArrayList<>();
        if (a1 != null) out.addAll(a1);
        if (a2 == null) return out;

        for (Value v : a2) {
            if (a1 == null || !contains(a1, v)) out.add(v);
        }
        return out;
    }

    private static boolean contains(List<Value> list, Value v) {
        for (Value e : list) {
            if (Value.same(e, v)) return true;
        }
        return false;
    }
}
