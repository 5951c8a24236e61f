package com.objecty.util;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import com.objecty.value.Aggregate;
import com.objecty.value.CustomProjection;
import com.objecty.value.Definition;
import com.objecty.value.PropertyDescriptor;
import com.objecty.value.Value;

/**
 * Projects an aggregate onto a bare one, ready for serialization.
 *
 * For an aggregate with a definition, the public surface is what its chain
 * declares (fields and accessors); instance slots are backing storage and only
 * appear when named in {@code includes}. A bare aggregate has nothing declared,
 * so its instance slots are its surface.
 *
 * Only top-level slots are filtered. Nested containers are shared as is, except
 * that a top-level value implementing {@link CustomProjection} is replaced by
 * its own plain form.
 */
public final class Projector {

    private Projector() {}

    public static Aggregate project(Aggregate obj) {
        return project(obj, null, null, true);
    }

    /**
     * @param excludes     names never projected (includes win over excludes)
     * @param includes     instance slots copied first when present, writable or not
     * @param writableOnly skip properties an assignment would not take effect on
     * @return a new bare aggregate
     */
    public static Aggregate project(Aggregate obj, Collection<String> excludes,
                                    Collection<String> includes, boolean writableOnly) {
        Aggregate r = new Aggregate();
        if (obj == null) return r;

        if (includes != null) {
            for (String p : includes) {
                if (obj.hasOwn(p)) r.put(p, obj.get(p));
            }
        }

        if (obj.definition() == null) {
            for (String p : obj.keys()) {
                PropertyDescriptor desc = PropertyDescriptor.instanceSlot(p, !obj.isOwnReadOnly(p));
                copy(obj, r, desc, excludes, writableOnly);
            }
            return r;
        }

        Set<String> seen = new HashSet<>();
        for (Definition d : obj.chain()) {
            for (String p : d.memberNames()) {
                if (!seen.add(p)) continue;
                copy(obj, r, d.member(p), excludes, writableOnly);
            }
        }
        return r;
    }

    /** {@link #project} serialized to JSON text. */
    public static String toJson(Aggregate obj, Collection<String> excludes,
                                Collection<String> includes, boolean writableOnly) {
        return ValueCodec.stringify(Value.object(project(obj, excludes, includes, writableOnly)));
    }

    /** {@link #toJson} with the nesting limit of the JSON walk set by the caller. */
    public static String toJson(Aggregate obj, Collection<String> excludes,
                                Collection<String> includes, boolean writableOnly, int maxDepth) {
        return ValueCodec.stringify(Value.object(project(obj, excludes, includes, writableOnly)), maxDepth);
    }

    public static String toJson(Aggregate obj) {
        return toJson(obj, null, null, true);
    }

    private static void copy(Aggregate obj, Aggregate r, PropertyDescriptor desc,
                             Collection<String> excludes, boolean writableOnly) {
        String p = desc.name();
        if (excludes != null && excludes.contains(p)) return;
        if (writableOnly && !desc.acceptsAssignment()) return;

        Value v = obj.get(p);
        if (v == null || v.getType() == Value.Type.FUNC) return;
        r.put(p, plain(v));
    }

    private static Value plain(Value v) {
        if (v.isObject() && v.asObject() instanceof CustomProjection) {
            Value custom = ((CustomProjection) v.asObject()).toPlain();
            return custom == null ? Value.nil() : custom;
        }
        return v;
    }
}
