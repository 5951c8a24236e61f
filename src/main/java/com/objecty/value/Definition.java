package com.objecty.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * One level of an aggregate's chain: named members shared by every instance that
 * points at this definition or at a definition derived from it.
 *
 * A definition with a null parent sits directly on the terminal root, which
 * contributes nothing. Members are declared once, while the definition is being
 * set up, and are read-only afterwards as far as the algorithms are concerned.
 */
public final class Definition {

    private final String name;
    private final Definition parent;
    private final LinkedHashMap<String, PropertyDescriptor> members = new LinkedHashMap<>();

    public Definition(String name) {
        this(name, null);
    }

    public Definition(String name, Definition parent) {
        this.name = name;
        this.parent = parent;
    }

    public String name() { return name; }

    public Definition parent() { return parent; }

    /** Shared data member; writable means an instance may shadow it by assignment. */
    public Definition field(String member, Value initial, boolean writable) {
        members.put(member, PropertyDescriptor.data(member, initial == null ? Value.nil() : initial, writable, 0));
        return this;
    }

    /** Callable member. Callables never show up in enumeration or projection. */
    public Definition method(String member, Invocable fn) {
        members.put(member, PropertyDescriptor.data(member, Value.func(fn), true, 0));
        return this;
    }

    public Definition getter(String member, PropertyDescriptor.Getter getter) {
        return accessor(member, getter, null);
    }

    public Definition accessor(String member, PropertyDescriptor.Getter getter, PropertyDescriptor.Setter setter) {
        members.put(member, PropertyDescriptor.accessor(member, getter, setter, 0));
        return this;
    }

    /** Member declared at this level only, or null. */
    public PropertyDescriptor member(String member) {
        return members.get(member);
    }

    /** Names declared at this level, in declaration order. */
    public List<String> memberNames() {
        return Collections.unmodifiableList(new ArrayList<>(members.keySet()));
    }

    /** This definition followed by its ancestors, most-derived first. */
    public List<Definition> lineage() {
        List<Definition> out = new ArrayList<>();
        for (Definition d = this; d != null; d = d.parent) out.add(d);
        return out;
    }

    @Override
    public String toString() {
        return parent == null ? name : name + " : " + parent;
    }
}
