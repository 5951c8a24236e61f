package com.objecty.reflect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.objecty.debug.Debug;
import com.objecty.value.Aggregate;
import com.objecty.value.Definition;
import com.objecty.value.PropertyDescriptor;
import com.objecty.value.Value;

/**
 * Property queries over an aggregate's chain.
 *
 * The chain is walked explicitly: level 0 is the instance, then its definition
 * and that definition's ancestors until the terminal root. For any name only
 * the first descriptor found counts; deeper levels declaring the same name are
 * masked by it.
 *
 * Nothing here mutates the aggregate, although reading a slot to rule out
 * callables does invoke its getter.
 */
public final class Reflector {

    private static final String TAG = "objecty.reflect";

    private Reflector() {}

    /**
     * Names of every non-callable property reachable from {@code obj}.
     *
     * @param includeData      include data slots (instance slots and shared fields);
     *                         when false the instance level is not visited and only
     *                         getter-backed properties are returned
     * @param includeAccessors include getter-backed properties
     * @return names in chain order, most-derived first, each listed once
     */
    public static List<String> enumerate(Aggregate obj, boolean includeData, boolean includeAccessors) {
        if (obj == null) return new ArrayList<>();

        List<String> props = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        if (includeData) {
            for (String p : obj.keys()) {
                seen.add(p);
                if (isCallable(obj, p)) continue;
                props.add(p);
            }
        }

        for (Definition d : obj.chain()) {
            for (String p : d.memberNames()) {
                if (!seen.add(p)) continue;
                if (isCallable(obj, p)) continue;

                PropertyDescriptor desc = d.member(p);
                if (!desc.hasGetter()) {
                    if (includeData) props.add(p);
                    else Debug.get().t(TAG, "hiding internal prop: " + p);
                } else if (includeAccessors) {
                    props.add(p);
                }
            }
        }
        return props;
    }

    /** All non-callable names, data and accessors alike. */
    public static List<String> enumerate(Aggregate obj) {
        return enumerate(obj, true, true);
    }

    /**
     * First descriptor for {@code name}, walking from the instance toward the root.
     *
     * @return the descriptor, its level set to where it was found, or null if no
     *         level declares the name
     */
    public static PropertyDescriptor findDescriptor(Aggregate obj, String name) {
        if (obj == null || name == null) return null;

        if (obj.hasOwn(name)) {
            return PropertyDescriptor.instanceSlot(name, !obj.isOwnReadOnly(name));
        }

        int level = 1;
        for (Definition d : obj.chain()) {
            PropertyDescriptor desc = d.member(name);
            if (desc != null) return desc.atLevel(level);
            level++;
        }
        return null;
    }

    /**
     * The active descriptor of every name on the chain, callables included,
     * in chain order.
     */
    public static Map<String, PropertyDescriptor> activeDescriptors(Aggregate obj) {
        LinkedHashMap<String, PropertyDescriptor> out = new LinkedHashMap<>();
        if (obj == null) return out;

        for (String p : obj.keys()) {
            out.put(p, PropertyDescriptor.instanceSlot(p, !obj.isOwnReadOnly(p)));
        }

        int level = 1;
        for (Definition d : obj.chain()) {
            for (String p : d.memberNames()) {
                if (!out.containsKey(p)) out.put(p, d.member(p).atLevel(level));
            }
            level++;
        }
        return out;
    }

    /**
     * Names an assignment would not take effect on: neither writable data nor
     * setter-backed. Computed once so callers can filter many slots against it.
     */
    public static Set<String> unwritableSet(Aggregate obj) {
        Set<String> out = new LinkedHashSet<>();
        for (PropertyDescriptor desc : activeDescriptors(obj).values()) {
            if (!desc.acceptsAssignment()) out.add(desc.name());
        }
        return Collections.unmodifiableSet(out);
    }

    /** A FUNC value is currently readable at {@code name} on the live instance. */
    public static boolean isCallable(Aggregate obj, String name) {
        Value v = obj.get(name);
        return v != null && v.getType() == Value.Type.FUNC;
    }
}
