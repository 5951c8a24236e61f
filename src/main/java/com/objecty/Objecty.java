package com.objecty;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.objecty.reflect.Reflector;
import com.objecty.util.Assigner;
import com.objecty.util.Cloner;
import com.objecty.util.Differ;
import com.objecty.util.Merger;
import com.objecty.util.Projector;
import com.objecty.value.Aggregate;
import com.objecty.value.PropertyDescriptor;
import com.objecty.value.Value;

/**
 * Entry point to the object toolkit.
 *
 * - Deep copies: clone, cloneWithAncestry
 * - Merges: merge (overwrite), mergeSafe (fill gaps only), mergeArrays
 * - Differences: changes
 * - Reflection: getProps, getPropDesc, unwritable
 * - Assignment and projection: assign, assignOwn, defineVars, project, toJson
 *
 * Settings:
 *   maxDepth - nesting at which the recursive walks give up with a
 *              RecursionLimitException (default 512, at most 1000). Cyclic graphs
 *              always hit it before the call stack runs out.
 *
 * An instance holds no state besides its settings. The operations mutate only
 * the aggregates passed in; callers sharing a destination across threads must
 * serialize access themselves.
 */
public class Objecty {

    public static final int DEFAULT_MAX_DEPTH = 512;

    /** Highest accepted maxDepth; also the nesting Jackson allows by default when writing JSON. */
    public static final int MAX_DEPTH_LIMIT = 1000;

    private int maxDepth = DEFAULT_MAX_DEPTH;

    private Cloner cloner;
    private Merger merger;
    private Differ differ;

    public Objecty() {
        rebuild();
    }

    public Objecty setMaxDepth(int depth) {
        if (depth < 1 || depth > MAX_DEPTH_LIMIT) {
            throw new IllegalArgumentException("maxDepth must be in 1.." + MAX_DEPTH_LIMIT + ", got " + depth);
        }
        this.maxDepth = depth;
        rebuild();
        return this;
    }

    public int getMaxDepth() { return maxDepth; }

    private void rebuild() {
        this.cloner = new Cloner(maxDepth);
        this.merger = new Merger(maxDepth);
        this.differ = new Differ(maxDepth);
    }

    // ===================== CLONE =====================

    public Aggregate clone(Aggregate src) {
        return cloner.clone(src);
    }

    public Aggregate clone(Aggregate src, Aggregate dest) {
        return cloner.clone(src, dest);
    }

    public Value cloneValue(Value v) {
        return cloner.cloneValue(v);
    }

    public Aggregate cloneWithAncestry(Aggregate src) {
        return cloner.cloneWithAncestry(src);
    }

    public Aggregate cloneWithAncestry(Aggregate src, Aggregate dest) {
        return cloner.cloneWithAncestry(src, dest);
    }

    // ===================== MERGE =====================

    public void merge(Aggregate dest, Aggregate src) {
        merger.merge(dest, src);
    }

    public void mergeSafe(Aggregate dest, Aggregate src) {
        merger.mergeSafe(dest, src);
    }

    public List<Value> mergeArrays(List<Value> a1, List<Value> a2) {
        return Merger.mergeArrays(a1, a2);
    }

    // ===================== DIFF =====================

    /** Changed slots of candidate relative to original, or null when there are none. */
    public Aggregate changes(Aggregate candidate, Aggregate original) {
        return differ.changes(candidate, original);
    }

    // ===================== REFLECTION =====================

    public List<String> getProps(Aggregate obj) {
        return Reflector.enumerate(obj, true, true);
    }

    public List<String> getProps(Aggregate obj, boolean ownData, boolean getters) {
        return Reflector.enumerate(obj, ownData, getters);
    }

    public PropertyDescriptor getPropDesc(Aggregate obj, String name) {
        return Reflector.findDescriptor(obj, name);
    }

    public Set<String> unwritable(Aggregate obj) {
        return Reflector.unwritableSet(obj);
    }

    // ===================== ASSIGN / PROJECT =====================

    public Aggregate assign(Aggregate dest, Aggregate src) {
        return Assigner.assign(dest, src, null);
    }

    public Aggregate assign(Aggregate dest, Aggregate src, Collection<String> exclude) {
        return Assigner.assign(dest, src, exclude);
    }

    public Aggregate assignOwn(Aggregate dest, Aggregate src, Collection<String> exclude) {
        return Assigner.assignOwn(dest, src, exclude);
    }

    public Aggregate defineVars(Aggregate obj, Aggregate vars) {
        return Assigner.defineVars(obj, vars);
    }

    public Aggregate project(Aggregate obj) {
        return Projector.project(obj);
    }

    public Aggregate project(Aggregate obj, Collection<String> excludes, Collection<String> includes, boolean writableOnly) {
        return Projector.project(obj, excludes, includes, writableOnly);
    }

    public String toJson(Aggregate obj, Collection<String> excludes, Collection<String> includes, boolean writableOnly) {
        return Projector.toJson(obj, excludes, includes, writableOnly, maxDepth);
    }
}
