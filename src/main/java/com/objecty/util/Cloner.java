package com.objecty.util;

import java.util.ArrayList;
import java.util.List;

import com.objecty.reflect.Reflector;
import com.objecty.value.Aggregate;
import com.objecty.value.CustomClone;
import com.objecty.value.PropertyDescriptor;
import com.objecty.value.Value;

/**
 * Deep copies of value graphs.
 *
 * - Scalars are immutable and copied by reference.
 * - ARRAY and OBJECT values are rebuilt level by level, so the copy shares no
 *   container with the source.
 * - An aggregate implementing {@link CustomClone} supplies its own copy, which
 *   is stored as returned.
 *
 * Cyclic input fails with {@link RecursionLimitException} once the walk passes
 * {@code maxDepth}.
 */
public final class Cloner {

    private final DepthGuard guard;
    private final DepthGuard ancestryGuard;

    public Cloner(int maxDepth) {
        this.guard = new DepthGuard("clone", maxDepth);
        this.ancestryGuard = new DepthGuard("cloneWithAncestry", maxDepth);
    }

    /** Deep copy of {@code src} into a new bare aggregate. */
    public Aggregate clone(Aggregate src) {
        return clone(src, new Aggregate());
    }

    /**
     * Copies every instance slot of {@code src} into {@code dest}, assigning each
     * deep-copied value. Slots already in {@code dest} but not in {@code src}
     * are kept.
     *
     * @return dest, or a new bare aggregate when dest is null
     */
    public Aggregate clone(Aggregate src, Aggregate dest) {
        if (dest == null) dest = new Aggregate();
        if (src == null) return dest;
        copyInto(src, dest, 1);
        return dest;
    }

    /** Deep copy of a single value; scalars come back unchanged. */
    public Value cloneValue(Value v) {
        return cloneValue(v, 1);
    }

    /** Deep copy of a sequence into a new list. */
    public List<Value> cloneArray(List<Value> src) {
        if (src == null) return new ArrayList<>();
        return copyArray(src, 1);
    }

    private void copyInto(Aggregate src, Aggregate dest, int depth) {
        guard.check(depth);
        for (String p : src.keys()) {
            dest.set(p, cloneValue(src.get(p), depth + 1));
        }
    }

    private Value cloneValue(Value v, int depth) {
        if (v == null) return null;

        switch (v.getType()) {
            case ARRAY:
                return Value.array(copyArray(v.asArray(), depth));

            case OBJECT: {
                Aggregate o = v.asObject();
                if (o instanceof CustomClone) {
                    Value custom = ((CustomClone) o).cloneSelf();
                    return custom == null ? Value.nil() : custom;
                }
                Aggregate copy = new Aggregate();
                copyInto(o, copy, depth);
                return Value.object(copy);
            }

            default:
                // NULL, NUMBER, BOOL, STRING, FUNC: immutable wrappers
                return v;
        }
    }

    private List<Value> copyArray(List<Value> src, int depth) {
        guard.check(depth);
        List<Value> out = new ArrayList<>(src.size());
        for (Value item : src) out.add(cloneValue(item, depth + 1));
        return out;
    }

    // -------------------------
    // Kind-preserving copies
    // -------------------------

    /** Kind-preserving deep copy into a fresh {@link Aggregate#emptyCopy()} of src. */
    public Aggregate cloneWithAncestry(Aggregate src) {
        return cloneWithAncestry(src, null);
    }

    /**
     * Like {@link #clone(Aggregate, Aggregate)}, but every copied aggregate keeps
     * the kind of its source (built with {@link Aggregate#emptyCopy()}), and a slot
     * is only copied when the destination would accept the assignment: read-only
     * data and getter-only accessors on the destination are left alone.
     * Read-only instance slots of the source stay read-only in the copy.
     *
     * @return dest, or src's empty copy when dest is null
     */
    public Aggregate cloneWithAncestry(Aggregate src, Aggregate dest) {
        if (src == null) return dest;
        if (dest == null) dest = src.emptyCopy();
        copyKindInto(src, dest, 1);
        return dest;
    }

    private void copyKindInto(Aggregate src, Aggregate dest, int depth) {
        ancestryGuard.check(depth);
        for (String p : src.keys()) {
            PropertyDescriptor desc = Reflector.findDescriptor(dest, p);
            if (desc != null && !desc.acceptsAssignment()) continue;

            Value copy = cloneKind(src.get(p), depth + 1);
            if (src.isOwnReadOnly(p) && (desc == null || desc.level() == 0)) {
                dest.putReadOnly(p, copy);
            } else {
                dest.set(p, copy);
            }
        }
    }

    private Value cloneKind(Value v, int depth) {
        if (v == null) return null;

        switch (v.getType()) {
            case ARRAY: {
                ancestryGuard.check(depth);
                List<Value> src = v.asArray();
                List<Value> out = new ArrayList<>(src.size());
                for (Value item : src) out.add(cloneKind(item, depth + 1));
                return Value.array(out);
            }

            case OBJECT: {
                Aggregate o = v.asObject();
                if (o instanceof CustomClone) {
                    Value custom = ((CustomClone) o).cloneSelf();
                    return custom == null ? Value.nil() : custom;
                }
                Aggregate copy = o.emptyCopy();
                copyKindInto(o, copy, depth);
                return Value.object(copy);
            }

            default:
                return v;
        }
    }
}
