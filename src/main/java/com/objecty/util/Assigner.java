package com.objecty.util;

import java.util.Collection;
import java.util.Set;

import com.objecty.debug.Debug;
import com.objecty.reflect.Reflector;
import com.objecty.value.Aggregate;
import com.objecty.value.PropertyDescriptor;
import com.objecty.value.Value;

/**
 * Shallow, permission-aware copies between aggregates. Values are assigned as
 * is; slots the destination will not accept are skipped without complaint.
 */
public final class Assigner {

    private static final String TAG = "objecty.assign";

    private Assigner() {}

    public static Aggregate assign(Aggregate dest, Aggregate src) {
        return assign(dest, src, null);
    }

    /**
     * Assigns every non-callable property of {@code src}'s chain (instance slots,
     * shared fields, getters) onto {@code dest}, except names in {@code exclude}
     * and names dest reports as unwritable. Missing slots are created on dest.
     *
     * @return dest
     */
    public static Aggregate assign(Aggregate dest, Aggregate src, Collection<String> exclude) {
        if (dest == null || src == null) return dest;

        Set<String> locked = Reflector.unwritableSet(dest);
        for (String p : Reflector.enumerate(src)) {
            if (exclude != null && exclude.contains(p)) continue;
            if (locked.contains(p)) {
                Debug.get().t(TAG, "not writable: " + p);
                continue;
            }
            Value v = src.get(p);
            if (v != null) dest.set(p, v);
        }
        return dest;
    }

    public static Aggregate assignOwn(Aggregate dest, Aggregate src) {
        return assignOwn(dest, src, null);
    }

    /**
     * Assigns the instance slots of {@code src} onto {@code dest}, but only where
     * dest already declares the slot and would accept the assignment.
     * Never creates a slot on dest.
     *
     * @return dest
     */
    public static Aggregate assignOwn(Aggregate dest, Aggregate src, Collection<String> exclude) {
        if (dest == null || src == null) return dest;

        for (String p : src.keys()) {
            if (exclude != null && exclude.contains(p)) continue;

            PropertyDescriptor desc = Reflector.findDescriptor(dest, p);
            if (desc == null || !desc.acceptsAssignment()) {
                Debug.get().t(TAG, "not declared or not writable: " + p);
                continue;
            }
            dest.set(p, src.get(p));
        }
        return dest;
    }

    /**
     * Declares each slot of {@code vars} that {@code obj} does not have yet as a
     * writable instance slot holding the given value.
     *
     * @return obj
     */
    public static Aggregate defineVars(Aggregate obj, Aggregate vars) {
        if (obj == null || vars == null) return obj;
        for (String p : vars.keys()) {
            if (!obj.has(p)) obj.put(p, vars.get(p));
        }
        return obj;
    }

    /** Declares the named slots, initialised to null, where obj does not have them yet. */
    public static Aggregate defineVars(Aggregate obj, String... names) {
        if (obj == null) return null;
        for (String p : names) {
            if (!obj.has(p)) obj.put(p, Value.nil());
        }
        return obj;
    }
}
